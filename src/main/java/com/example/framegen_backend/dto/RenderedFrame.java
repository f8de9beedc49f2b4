package com.example.framegen_backend.dto;

import java.nio.file.Path;

public record RenderedFrame(Path path, int width, int height) {
}
