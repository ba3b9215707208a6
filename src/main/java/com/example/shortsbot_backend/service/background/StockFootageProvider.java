package com.example.shortsbot_backend.service.background;

import java.util.List;

public interface StockFootageProvider {
    String name();

    /** Providers without credentials are skipped. */
    boolean isEnabled();

    List<StockVideo> search(String keyword, int count);
}
