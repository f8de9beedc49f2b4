package com.example.framegen_backend.engine;

import com.example.framegen_backend.dto.FrameSize;
import com.example.framegen_backend.engine.Interfaces.BrowserExecutableLocator;
import com.example.framegen_backend.engine.Interfaces.FrameRasterizer;
import com.example.framegen_backend.engine.Interfaces.RasterizerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Opens Chrome sessions: an explicitly configured binary wins, then the locator's answer, then the
 * fallback binary name looked up on {@code PATH}.
 */
public class ChromeRasterizerFactory implements RasterizerFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChromeRasterizerFactory.class);

    private final BrowserExecutableLocator locator;
    private final @Nullable String configuredBin;
    private final String fallbackBin;
    private final Path workDir;
    private final Duration timeout;
    private final FontconfigProbe fontconfigProbe;
    private final AtomicBoolean fontsChecked = new AtomicBoolean(false);

    public ChromeRasterizerFactory(BrowserExecutableLocator locator,
                                   @Nullable String configuredBin,
                                   String fallbackBin,
                                   Path workDir,
                                   Duration timeout,
                                   FontconfigProbe fontconfigProbe) {
        this.locator = locator;
        this.configuredBin = configuredBin;
        this.fallbackBin = fallbackBin;
        this.workDir = workDir;
        this.timeout = timeout;
        this.fontconfigProbe = fontconfigProbe;
    }

    @Override
    public FrameRasterizer open(FrameSize size) {
        if (fontsChecked.compareAndSet(false, true)) {
            fontconfigProbe.check();
        }
        String bin = resolveBinary();
        ChromeHeadlessRasterizer rasterizer = new ChromeHeadlessRasterizer(
                bin, workDir, size, ChromeHeadlessRasterizer.STABILITY_FLAGS, timeout);
        LOGGER.info("Chrome session ready: bin={} size={} flags={} workDir={}",
                bin, size, ChromeHeadlessRasterizer.STABILITY_FLAGS.size(), rasterizer.workDir());
        return rasterizer;
    }

    String resolveBinary() {
        if (configuredBin != null && !configuredBin.isBlank()) {
            return configuredBin;
        }
        return locator.locate()
                .map(Path::toString)
                .orElse(fallbackBin);
    }
}
