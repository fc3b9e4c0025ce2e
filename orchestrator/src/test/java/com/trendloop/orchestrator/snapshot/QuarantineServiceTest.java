package com.trendloop.orchestrator.snapshot;

import com.trendloop.orchestrator.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class QuarantineServiceTest {

    @TempDir Path root;

    QuarantineService quarantine;

    @BeforeEach
    void setUp() {
        quarantine = new QuarantineService(root.resolve("_deleted_items"),
                MutableClock.at("2026-03-01T06:00:00Z"));
    }

    @Test
    void quarantine_movesFileUnderTimestampedName() throws IOException {
        Path post = Files.writeString(root.resolve("old-post.html"), "old");

        Optional<Path> moved = quarantine.quarantine(post);

        assertThat(moved).contains(quarantine.root().resolve("20260301_060000_old-post.html"));
        assertThat(Files.exists(post)).isFalse();
        assertThat(Files.readString(moved.orElseThrow())).isEqualTo("old");
    }

    @Test
    void quarantine_nameCollision_getsSuffix() throws IOException {
        Path a = Files.createDirectories(root.resolve("one/page.html"));
        Path b = Files.createDirectories(root.resolve("two/page.html"));

        Path first  = quarantine.quarantine(a).orElseThrow();
        Path second = quarantine.quarantine(b).orElseThrow();

        assertThat(second.getFileName().toString()).isEqualTo(first.getFileName() + "_1");
    }

    @Test
    void quarantine_missingPath_returnsEmpty() {
        assertThat(quarantine.quarantine(root.resolve("ghost.html"))).isEmpty();
    }
}
