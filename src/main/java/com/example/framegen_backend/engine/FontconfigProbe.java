package com.example.framegen_backend.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Warns when the host has no usable fontconfig, which makes headless Chrome render text as boxes.
 * Never fails the caller.
 */
public class FontconfigProbe {
    private static final Logger LOGGER = LoggerFactory.getLogger(FontconfigProbe.class);
    private static final long TIMEOUT_SECONDS = 2;

    private final String fcListBin;

    public FontconfigProbe() {
        this("fc-list");
    }

    FontconfigProbe(String fcListBin) {
        this.fcListBin = fcListBin;
    }

    /**
     * @return number of fonts reported, or -1 when fontconfig could not be queried
     */
    public int check() {
        if (!isPosix()) {
            return -1;
        }
        try {
            Process p = new ProcessBuilder(List.of(fcListBin)).redirectErrorStream(false).start();
            StringBuilder out = new StringBuilder();
            Thread reader = new Thread(() -> {
                try (var br = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                    br.lines().forEach(line -> out.append(line).append('\n'));
                } catch (IOException e) {
                    LOGGER.debug("fc-list output read failed: {}", e.toString());
                }
            });
            reader.setDaemon(true);
            reader.start();
            if (!p.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                p.destroyForcibly();
                LOGGER.debug("fc-list timed out after {}s", TIMEOUT_SECONDS);
                return -1;
            }
            reader.join(TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS));
            if (p.exitValue() != 0) {
                LOGGER.warn("fontconfig not found or not working properly. "
                        + "Install with: sudo apt-get install -y fontconfig fonts-liberation fonts-noto-cjk");
                return -1;
            }
            int fonts = (int) out.toString().lines().filter(l -> !l.isBlank()).count();
            if (fonts == 0) {
                LOGGER.warn("No fonts detected by fontconfig. "
                        + "Install fonts with: sudo apt-get install -y fonts-liberation fonts-noto-cjk");
            } else {
                LOGGER.debug("Fontconfig detected {} fonts", fonts);
            }
            return fonts;
        } catch (IOException e) {
            LOGGER.warn("fontconfig (fc-list) not found on system. Install with: sudo apt-get install -y fontconfig");
            return -1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return -1;
        }
    }

    private static boolean isPosix() {
        return !System.getProperty("os.name", "").toLowerCase(java.util.Locale.ROOT).startsWith("windows");
    }
}
