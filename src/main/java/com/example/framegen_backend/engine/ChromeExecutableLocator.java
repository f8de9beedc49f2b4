package com.example.framegen_backend.engine;

import com.example.framegen_backend.engine.Interfaces.BrowserExecutableLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Probes well-known Chrome/Chromium install locations once and remembers the answer.
 *
 * <p>Snap-packaged browsers run under AppArmor confinement, which rejects {@code --no-sandbox} and
 * friends, so candidates whose real path lies under {@code /snap/} are skipped.
 */
public class ChromeExecutableLocator implements BrowserExecutableLocator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChromeExecutableLocator.class);
    private static final String SNAP_SEGMENT = "/snap/";

    private final List<Path> candidates;
    private final Duration probeTimeout;
    private final String readlinkBin;

    private volatile Optional<Path> cached;

    public ChromeExecutableLocator(List<Path> candidates, Duration probeTimeout) {
        this(candidates, probeTimeout, "readlink");
    }

    ChromeExecutableLocator(List<Path> candidates, Duration probeTimeout, String readlinkBin) {
        this.candidates = List.copyOf(candidates);
        this.probeTimeout = probeTimeout != null ? probeTimeout : Duration.ofSeconds(1);
        this.readlinkBin = readlinkBin;
    }

    @Override
    public Optional<Path> locate() {
        Optional<Path> result = cached;
        if (result == null) {
            synchronized (this) {
                result = cached;
                if (result == null) {
                    result = probe();
                    cached = result;
                }
            }
        }
        return result;
    }

    private Optional<Path> probe() {
        for (Path candidate : candidates) {
            if (!Files.exists(candidate) || !Files.isExecutable(candidate)) {
                continue;
            }
            try {
                String realPath = resolveRealPath(candidate);
                if (realPath.contains(SNAP_SEGMENT)) {
                    LOGGER.debug("Skipping snap browser: {} -> {}", candidate, realPath);
                    continue;
                }
                LOGGER.info("Found non-snap browser: {} -> {}", candidate, realPath);
                return Optional.of(candidate);
            } catch (Exception e) {
                LOGGER.debug("Error checking {}: {}", candidate, e.toString());
            }
        }
        LOGGER.warn("No non-snap Chrome/Chromium found; snap browsers cannot run with the required flags. "
                + "Install google-chrome-stable or a distribution chromium package, or set frame.renderer.binary");
        return Optional.empty();
    }

    /**
     * Follows symlinks with {@code readlink -f}, bounded by the probe timeout.
     */
    String resolveRealPath(Path candidate) throws IOException, InterruptedException {
        Process p = new ProcessBuilder(readlinkBin, "-f", candidate.toString())
                .redirectErrorStream(true)
                .start();
        if (!p.waitFor(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
            p.destroyForcibly();
            throw new IOException("readlink timed out after " + probeTimeout + " for " + candidate);
        }
        String out;
        try (var br = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            out = br.readLine();
        }
        if (p.exitValue() != 0 || out == null || out.isBlank()) {
            throw new IOException("readlink failed with exit " + p.exitValue() + " for " + candidate);
        }
        return out.trim();
    }
}
