package com.example.framegen_backend.engine.Interfaces;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Finds a browser executable for headless rendering. An empty result means the rasterizer uses
 * its configured default binary.
 */
public interface BrowserExecutableLocator {
    Optional<Path> locate();
}
