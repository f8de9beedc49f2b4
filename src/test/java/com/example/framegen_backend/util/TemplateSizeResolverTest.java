package com.example.framegen_backend.util;

import com.example.framegen_backend.dto.FrameSize;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateSizeResolverTest {

    private final TemplateSizeResolver resolver = new TemplateSizeResolver(new FrameSize(1080, 1920));

    @Test
    void readsSizeFromDirectorySegment() {
        assertThat(resolver.resolve("1080x1920/default.html")).isEqualTo(new FrameSize(1080, 1920));
        assertThat(resolver.resolve("/srv/app/templates/1920x1080/modern.html")).isEqualTo(new FrameSize(1920, 1080));
    }

    @Test
    void acceptsWindowsSeparators() {
        assertThat(resolver.resolve("templates\\720x1280\\card.html")).isEqualTo(new FrameSize(720, 1280));
    }

    @Test
    void fallsBackWithoutSizeSegment() {
        assertThat(resolver.resolve("custom_name.html")).isEqualTo(new FrameSize(1080, 1920));
        assertThat(resolver.resolve("templates/wide/custom.html")).isEqualTo(new FrameSize(1080, 1920));
    }

    @Test
    void partialTokensAreNotSizes() {
        assertThat(resolver.resolve("v1080x1920/a.html")).isEqualTo(resolver.fallback());
        assertThat(resolver.resolve("1080x1920px/a.html")).isEqualTo(resolver.fallback());
        assertThat(resolver.resolve("0x1920/a.html")).isEqualTo(resolver.fallback());
    }

    @Test
    void closestSegmentToFileWins() {
        assertThat(resolver.resolve("800x600/1280x720/a.html")).isEqualTo(new FrameSize(1280, 720));
    }

    @Test
    void blankOrNullUsesFallback() {
        assertThat(resolver.resolve("")).isEqualTo(resolver.fallback());
        assertThat(resolver.resolve(null)).isEqualTo(resolver.fallback());
    }

    @Test
    void overflowingDigitsUseFallback() {
        assertThat(resolver.resolve("99999999999x1/a.html")).isEqualTo(resolver.fallback());
    }
}
