package com.trendloop.orchestrator.snapshot;

import com.trendloop.orchestrator.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotRetentionTest {

    @TempDir Path root;

    MutableClock      clock;
    Path              docs;
    QuarantineService quarantine;
    SnapshotManager   manager;
    SnapshotRetention retention;

    @BeforeEach
    void setUp() throws IOException {
        clock      = MutableClock.at("2026-03-01T06:00:00Z");
        docs       = Files.createDirectories(root.resolve("docs"));
        quarantine = new QuarantineService(root.resolve("_deleted_items"), clock);
        manager    = new SnapshotManager(root.resolve("_backups"), quarantine, clock);
        retention  = new SnapshotRetention(manager, quarantine, docs, Duration.ofDays(30), clock);
        Files.writeString(docs.resolve("index.html"), "x");
    }

    @Test
    void prune_movesOnlyExpiredSnapshotsToQuarantine() {
        SnapshotHandle old = manager.createSnapshot(docs);
        clock.advance(Duration.ofDays(20));
        SnapshotHandle recent = manager.createSnapshot(docs);
        clock.advance(Duration.ofDays(11));   // old is now 31 days, recent 11

        List<SnapshotHandle> pruned = retention.prune();

        assertThat(pruned).extracting(SnapshotHandle::name).containsExactly(old.name());
        assertThat(old.isStale()).isTrue();
        assertThat(recent.isStale()).isFalse();
        // soft delete: the expired snapshot still exists in quarantine
        assertThat(quarantine.root().resolve("20260401_060000_" + old.name())).isDirectory();
    }

    @Test
    void prune_nothingExpired_isNoop() {
        manager.createSnapshot(docs);
        clock.advance(Duration.ofDays(29));

        assertThat(retention.prune()).isEmpty();
        assertThat(manager.listSnapshots(docs)).hasSize(1);
    }

    @Test
    void retentionShorterThanADay_isRejected() {
        assertThatThrownBy(() -> new SnapshotRetention(manager, quarantine, docs, Duration.ofHours(2), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
