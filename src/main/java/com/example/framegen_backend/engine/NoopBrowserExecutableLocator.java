package com.example.framegen_backend.engine;

import com.example.framegen_backend.engine.Interfaces.BrowserExecutableLocator;

import java.nio.file.Path;
import java.util.Optional;

public class NoopBrowserExecutableLocator implements BrowserExecutableLocator {
    @Override
    public Optional<Path> locate() {
        return Optional.empty();
    }
}
