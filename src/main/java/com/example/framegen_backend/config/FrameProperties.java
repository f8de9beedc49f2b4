package com.example.framegen_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Frame rendering settings: fallback frame size, template roots, output locations and the
 * headless browser used to rasterize templates.
 */
@ConfigurationProperties(prefix = "frame")
public class FrameProperties {

    private int defaultWidth = 1080;
    private int defaultHeight = 1920;
    private String outputDir = "./output";
    private String workingRoot = "";
    private List<String> templateRoots = new ArrayList<>(List.of("data/templates", "templates"));

    private Renderer renderer = new Renderer();
    private Executor executor = new Executor();

    public int getDefaultWidth() {
        return defaultWidth;
    }

    public void setDefaultWidth(int defaultWidth) {
        this.defaultWidth = defaultWidth;
    }

    public int getDefaultHeight() {
        return defaultHeight;
    }

    public void setDefaultHeight(int defaultHeight) {
        this.defaultHeight = defaultHeight;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * Root that relative image paths are resolved against. Blank means the process working directory.
     */
    public String getWorkingRoot() {
        return workingRoot;
    }

    public void setWorkingRoot(String workingRoot) {
        this.workingRoot = workingRoot;
    }

    public List<String> getTemplateRoots() {
        return templateRoots;
    }

    public void setTemplateRoots(List<String> templateRoots) {
        this.templateRoots = templateRoots;
    }

    public Renderer getRenderer() {
        return renderer;
    }

    public void setRenderer(Renderer renderer) {
        this.renderer = renderer;
    }

    public Executor getExecutor() {
        return executor;
    }

    public void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public static class Renderer {
        private String binary;
        private String fallbackBinary = "google-chrome";
        private String workDir = "";
        private long timeoutSeconds = 60;
        private long probeTimeoutMillis = 1000;
        private boolean discoveryEnabled = true;
        private List<String> candidates = new ArrayList<>(List.of(
                "/usr/bin/google-chrome",
                "/usr/bin/google-chrome-stable",
                "/usr/bin/chromium",
                "/usr/bin/chromium-browser",
                "/usr/local/bin/chrome",
                "/usr/local/bin/chromium"
        ));

        /**
         * Explicit browser executable. When set, discovery is skipped.
         */
        public String getBinary() {
            return binary;
        }

        public void setBinary(String binary) {
            this.binary = binary;
        }

        public String getFallbackBinary() {
            return fallbackBinary;
        }

        public void setFallbackBinary(String fallbackBinary) {
            this.fallbackBinary = fallbackBinary;
        }

        /**
         * Directory the browser writes screenshots into. Blank means the process working directory.
         */
        public String getWorkDir() {
            return workDir;
        }

        public void setWorkDir(String workDir) {
            this.workDir = workDir;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public long getProbeTimeoutMillis() {
            return probeTimeoutMillis;
        }

        public void setProbeTimeoutMillis(long probeTimeoutMillis) {
            this.probeTimeoutMillis = probeTimeoutMillis;
        }

        public boolean isDiscoveryEnabled() {
            return discoveryEnabled;
        }

        public void setDiscoveryEnabled(boolean discoveryEnabled) {
            this.discoveryEnabled = discoveryEnabled;
        }

        public List<String> getCandidates() {
            return candidates;
        }

        public void setCandidates(List<String> candidates) {
            this.candidates = candidates;
        }
    }

    public static class Executor {
        private int threads = 2;
        private int queueCapacity = 50;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
