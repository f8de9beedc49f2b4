package com.example.framegen_backend.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ImageReferenceNormalizerTest {

    @TempDir
    Path root;

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private ImageReferenceNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new ImageReferenceNormalizer(root);
        logger = (Logger) LoggerFactory.getLogger(ImageReferenceNormalizer.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    void relativeExistingPathBecomesAbsoluteFileUri() throws Exception {
        Path pic = root.resolve("assets/pic.png");
        Files.createDirectories(pic.getParent());
        Files.write(pic, new byte[]{1, 2, 3});

        String uri = normalizer.normalize("assets/pic.png");

        assertThat(uri).startsWith("file://").isEqualTo(pic.toUri().toString());
        assertThat(appender.list).noneMatch(e -> e.getLevel() == Level.WARN);
    }

    @Test
    void absolutePathIsKeptButConvertedToUri() throws Exception {
        Path pic = Files.write(root.resolve("abs.png"), new byte[]{1});

        assertThat(normalizer.normalize(pic.toString())).isEqualTo(pic.toUri().toString());
    }

    @Test
    void missingFileWarnsAndStillRewrites() {
        String uri = normalizer.normalize("nope/missing.png");

        assertThat(uri).isEqualTo(root.resolve("nope/missing.png").toUri().toString());
        assertThat(appender.list)
                .anySatisfy(e -> {
                    assertThat(e.getLevel()).isEqualTo(Level.WARN);
                    assertThat(e.getFormattedMessage()).contains("missing.png");
                });
    }

    @Test
    void urlsAndDataUrisPassThrough() {
        assertThat(normalizer.normalize("https://cdn.example.com/a.png")).isEqualTo("https://cdn.example.com/a.png");
        assertThat(normalizer.normalize("http://host/a.png")).isEqualTo("http://host/a.png");
        assertThat(normalizer.normalize("data:image/png;base64,AAAA")).isEqualTo("data:image/png;base64,AAAA");
        assertThat(normalizer.normalize("file:///tmp/a.png")).isEqualTo("file:///tmp/a.png");
    }

    @Test
    void blankAndNullAreLeftAlone() {
        assertThat(normalizer.normalize(null)).isNull();
        assertThat(normalizer.normalize("")).isEmpty();
    }
}
