package com.example.framegen_backend.engine.Interfaces;

import com.example.framegen_backend.dto.FrameSize;

import java.nio.file.Path;

/**
 * A headless browser session bound to one viewport size for its whole lifetime.
 */
public interface FrameRasterizer extends AutoCloseable {

    /**
     * Rasterizes markup into {@code fileName} inside {@link #workDir()}.
     *
     * @param html     fully substituted markup
     * @param fileName base file name, no directories
     * @return the written file
     */
    Path screenshot(String html, String fileName) throws Exception;

    Path workDir();

    FrameSize size();

    @Override
    default void close() {
    }
}
