package com.example.shortsbot_backend.service.background;

public class StockFootageAccessException extends RuntimeException {
    public StockFootageAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
