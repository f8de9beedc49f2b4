package com.example.framegen_backend.exception;

/**
 * Raised when the headless browser could not produce a frame. Never retried by the generator.
 */
public class FrameRenderException extends RuntimeException {
    public FrameRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
