package com.example.framegen_backend.dto;

public record TemplateInfo(String key, String path, int width, int height) {
}
