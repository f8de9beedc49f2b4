package com.example.framegen_backend.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Turns the {@code image} value of a frame context into something the browser can load.
 * URLs and data URIs pass through; filesystem paths become absolute {@code file://} URIs.
 */
public class ImageReferenceNormalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageReferenceNormalizer.class);
    private static final List<String> PASSTHROUGH_PREFIXES = List.of("http://", "https://", "data:", "file://");

    private final Path workingRoot;

    public ImageReferenceNormalizer(Path workingRoot) {
        this.workingRoot = workingRoot.toAbsolutePath().normalize();
    }

    public String normalize(String image) {
        if (image == null || image.isBlank() || hasScheme(image)) {
            return image;
        }
        Path path;
        try {
            path = Path.of(image);
        } catch (InvalidPathException e) {
            LOGGER.warn("Image reference is not a valid path, passing through: {}", image);
            return image;
        }
        if (!path.isAbsolute()) {
            path = workingRoot.resolve(path);
        }
        path = path.normalize();
        if (!Files.exists(path)) {
            // still rewritten, so the markup points at the same URI once the file shows up
            LOGGER.warn("Image file not found: {}", path);
        }
        String uri = path.toUri().toString();
        LOGGER.debug("Converted image path to: {}", uri);
        return uri;
    }

    static boolean hasScheme(String image) {
        for (String prefix : PASSTHROUGH_PREFIXES) {
            if (image.startsWith(prefix)) return true;
        }
        return false;
    }

    public Path workingRoot() {
        return workingRoot;
    }
}
