package com.example.shortsbot_backend.service.background;

/**
 * Search hit from a stock footage provider.
 *
 * @param source          provider name, e.g. {@code pexels}.
 * @param externalId      provider-side id.
 * @param downloadUrl     direct file URL.
 * @param durationSeconds advertised duration; {@code 0} when unknown.
 */
public record StockVideo(String source, String externalId, String downloadUrl, double durationSeconds) {}
