package com.example.framegen_backend.dto.web;

public record FrameRenderResponse(
        boolean success,
        String message,
        String framePath,
        int width,
        int height
) {
    public static FrameRenderResponse ok(String framePath, int width, int height) {
        return new FrameRenderResponse(true, "Success", framePath, width, height);
    }
}
