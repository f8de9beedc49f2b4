package com.example.framegen_backend.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-supplied values for one render. {@code ext} carries any further placeholder values and
 * wins over the built-in keys when both name the same placeholder.
 */
public record FrameContext(String title, String text, String image, Map<String, Object> ext) {

    public FrameContext {
        ext = ext != null ? Collections.unmodifiableMap(new LinkedHashMap<>(ext)) : Map.of();
    }

    public static FrameContext of(String title, String text, String image) {
        return new FrameContext(title, text, image, Map.of());
    }

    /**
     * Builds the substitution variables, replacing the image reference with {@code resolvedImage}.
     */
    public Map<String, Object> toVariables(String resolvedImage) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("title", title);
        vars.put("text", text);
        vars.put("image", resolvedImage);
        vars.putAll(ext);
        return vars;
    }
}
