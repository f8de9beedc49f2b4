package com.example.framegen_backend.engine;

import com.example.framegen_backend.dto.FrameSize;
import com.example.framegen_backend.engine.Interfaces.FrameRasterizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Screenshots HTML with a headless Chrome/Chromium process per frame. The markup is written next
 * to the screenshot as a temporary {@code .html} file and removed afterwards.
 */
public class ChromeHeadlessRasterizer implements FrameRasterizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChromeHeadlessRasterizer.class);

    /** Flags every session runs with; tuned for containers and transparent backgrounds. */
    public static final List<String> STABILITY_FLAGS = List.of(
            "--default-background-color=00000000",
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--disable-software-rasterizer",
            "--disable-extensions",
            "--disable-setuid-sandbox",
            "--disable-dbus",
            "--hide-scrollbars",
            "--mute-audio",
            "--disable-background-networking",
            "--disable-features=TranslateUI",
            "--disable-ipc-flooding-protection",
            "--no-first-run",
            "--no-default-browser-check",
            "--disable-backgrounding-occluded-windows",
            "--disable-renderer-backgrounding"
    );

    private final String browserBin;
    private final Path workDir;
    private final FrameSize size;
    private final List<String> flags;
    private final Duration timeout;

    public ChromeHeadlessRasterizer(String browserBin, Path workDir, FrameSize size, List<String> flags, Duration timeout) {
        this.browserBin = browserBin;
        this.workDir = workDir.toAbsolutePath().normalize();
        this.size = size;
        this.flags = List.copyOf(flags);
        this.timeout = timeout != null ? timeout : Duration.ofMinutes(1);
        try {
            Files.createDirectories(this.workDir);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to create work directory: " + this.workDir, e);
        }
    }

    @Override
    public Path screenshot(String html, String fileName) throws IOException, InterruptedException {
        if (fileName == null || fileName.isBlank() || fileName.contains("/") || fileName.contains("\\")) {
            throw new IllegalArgumentException("Screenshot file name must be a bare name: " + fileName);
        }
        Path target = workDir.resolve(fileName);
        Path htmlFile = workDir.resolve("frame-src-" + UUID.randomUUID() + ".html");
        // a leftover file with the same name must not pass for this run's output
        Files.deleteIfExists(target);
        Files.writeString(htmlFile, html, StandardCharsets.UTF_8);
        try {
            List<String> cmd = buildCommand(target, htmlFile);
            LOGGER.debug("Chrome command: {}", String.join(" ", cmd));
            run(cmd);
        } finally {
            try {
                Files.deleteIfExists(htmlFile);
            } catch (IOException e) {
                LOGGER.debug("Could not remove temporary markup {}: {}", htmlFile, e.toString());
            }
        }
        if (!Files.exists(target) || Files.size(target) == 0) {
            throw new IOException("Browser finished but produced no screenshot at " + target);
        }
        return target;
    }

    List<String> buildCommand(Path target, Path htmlFile) {
        List<String> cmd = new ArrayList<>();
        cmd.add(browserBin);
        cmd.add("--headless");
        cmd.add("--screenshot=" + target);
        cmd.add("--window-size=" + size.width() + "," + size.height());
        cmd.addAll(flags);
        cmd.add(htmlFile.toUri().toString());
        return cmd;
    }

    private void run(List<String> cmd) throws IOException, InterruptedException {
        Process p = new ProcessBuilder(cmd)
                .directory(workDir.toFile())
                .redirectErrorStream(false)
                .start();

        StringBuilder outBuf = new StringBuilder();
        StringBuilder errBuf = new StringBuilder();

        Thread tOut = new Thread(() -> drain(p.getInputStream(), "[chrome-out] {}", outBuf));
        Thread tErr = new Thread(() -> drain(p.getErrorStream(), "[chrome-err] {}", errBuf));
        tOut.setDaemon(true);
        tErr.setDaemon(true);
        tOut.start();
        tErr.start();

        boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            p.destroyForcibly();
            throw new IOException("Chrome timed out after " + timeout + "\n---- chrome stderr ----\n" + errBuf);
        }
        tOut.join(1000);
        tErr.join(1000);
        if (p.exitValue() != 0) {
            throw new IOException("Chrome failed with exit " + p.exitValue()
                    + "\n---- chrome stderr ----\n" + errBuf + "\n---- chrome stdout ----\n" + outBuf);
        }
    }

    private static void drain(InputStream in, String pattern, StringBuilder buf) {
        try (var br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            br.lines().forEach(line -> {
                LOGGER.debug(pattern, line);
                synchronized (buf) {
                    buf.append(line).append('\n');
                }
            });
        } catch (IOException e) {
            LOGGER.debug("Chrome output stream closed: {}", e.toString());
        }
    }

    public String browserBin() {
        return browserBin;
    }

    public List<String> flags() {
        return flags;
    }

    @Override
    public Path workDir() {
        return workDir;
    }

    @Override
    public FrameSize size() {
        return size;
    }
}
