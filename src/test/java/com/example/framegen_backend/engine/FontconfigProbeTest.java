package com.example.framegen_backend.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FontconfigProbeTest {

    @TempDir
    Path tmp;

    @Test
    void countsReportedFonts() throws Exception {
        assumePosix();
        Path fcList = tmp.resolve("fc-list");
        Files.writeString(fcList, "#!/bin/sh\necho '/usr/share/fonts/a.ttf: A'\necho '/usr/share/fonts/b.ttf: B'\n");
        assumeTrue(fcList.toFile().setExecutable(true));

        assertThat(new FontconfigProbe(fcList.toString()).check()).isEqualTo(2);
    }

    @Test
    void missingFontconfigDoesNotThrow() {
        assumePosix();

        assertThat(new FontconfigProbe(tmp.resolve("absent-fc-list").toString()).check()).isEqualTo(-1);
    }

    @Test
    void failingFontconfigReportsUnknown() throws Exception {
        assumePosix();
        Path fcList = tmp.resolve("fc-list");
        Files.writeString(fcList, "#!/bin/sh\nexit 1\n");
        assumeTrue(fcList.toFile().setExecutable(true));

        assertThat(new FontconfigProbe(fcList.toString()).check()).isEqualTo(-1);
    }

    private static void assumePosix() {
        assumeTrue(!System.getProperty("os.name", "").toLowerCase().startsWith("windows"), "posix only");
    }
}
