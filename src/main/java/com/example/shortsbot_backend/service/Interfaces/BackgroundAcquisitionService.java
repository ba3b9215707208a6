package com.example.shortsbot_backend.service.Interfaces;

import com.example.shortsbot_backend.model.BackgroundClip;

import java.util.List;

/**
 * Background footage collaborator, called only when a theme pool is exhausted or on operator request.
 */
public interface BackgroundAcquisitionService {
    /**
     * Downloads up to {@code countPerSource} clips per provider and registers them in the pool.
     *
     * @return newly registered clips; empty when nothing could be acquired.
     */
    List<BackgroundClip> acquire(String theme, int countPerSource);
}
