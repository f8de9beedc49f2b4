package com.example.framegen_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * @param template   template key, e.g. {@code 1080x1920/default.html} or just {@code default.html}
 * @param outputPath optional destination below the output directory; a unique name is generated when absent
 */
public record FrameRenderRequest(
        @NotBlank String template,
        String title,
        @NotNull String text,
        String image,
        Map<String, Object> ext,
        String outputPath
) {}
