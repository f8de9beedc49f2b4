package com.example.framegen_backend.util;

import com.example.framegen_backend.dto.FrameSize;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the frame size from a template location such as {@code templates/1080x1920/default.html}.
 */
public class TemplateSizeResolver {
    private static final Pattern SIZE_SEGMENT = Pattern.compile("(\\d+)x(\\d+)");

    private final FrameSize fallback;

    public TemplateSizeResolver(FrameSize fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    /**
     * @param templatePath template key or filesystem path, any separator
     * @return size from the segment closest to the file name, or the configured fallback
     */
    public FrameSize resolve(String templatePath) {
        if (templatePath == null || templatePath.isBlank()) {
            return fallback;
        }
        String[] segments = templatePath.replace('\\', '/').split("/");
        for (int i = segments.length - 1; i >= 0; i--) {
            Matcher m = SIZE_SEGMENT.matcher(segments[i]);
            if (m.matches()) {
                try {
                    int w = Integer.parseInt(m.group(1));
                    int h = Integer.parseInt(m.group(2));
                    if (w > 0 && h > 0) {
                        return new FrameSize(w, h);
                    }
                } catch (NumberFormatException ignore) {
                    // digits too long for an int: not a size
                }
            }
        }
        return fallback;
    }

    public FrameSize fallback() {
        return fallback;
    }
}
