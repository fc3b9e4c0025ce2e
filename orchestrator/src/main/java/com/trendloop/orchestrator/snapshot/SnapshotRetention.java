package com.trendloop.orchestrator.snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Age-based cleanup of old snapshots.
 *
 * Expired snapshots are moved into quarantine, not deleted. The retention age must be at
 * least one day, well above the runtime budget of a run, so the snapshot of the run in
 * progress is never eligible.
 */
public class SnapshotRetention {

    private static final Logger log = LoggerFactory.getLogger(SnapshotRetention.class);

    private final SnapshotManager   snapshots;
    private final QuarantineService quarantine;
    private final Path              sourceTree;
    private final Duration          maxAge;
    private final Clock             clock;

    public SnapshotRetention(SnapshotManager snapshots,
                             QuarantineService quarantine,
                             Path sourceTree,
                             Duration maxAge,
                             Clock clock) {
        if (maxAge.compareTo(Duration.ofDays(1)) < 0) {
            throw new IllegalArgumentException("Snapshot retention must be at least one day, got " + maxAge);
        }
        this.snapshots  = snapshots;
        this.quarantine = quarantine;
        this.sourceTree = sourceTree;
        this.maxAge     = maxAge;
        this.clock      = clock;
    }

    /**
     * Quarantine every snapshot older than the retention age.
     *
     * A snapshot that cannot be moved is logged and left for the next pass.
     *
     * @return the snapshots that were moved
     */
    public List<SnapshotHandle> prune() {
        Instant cutoff = clock.instant().minus(maxAge);
        List<SnapshotHandle> pruned = new ArrayList<>();
        for (SnapshotHandle handle : snapshots.listSnapshots(sourceTree)) {
            if (!handle.createdAt().isBefore(cutoff)) continue;
            try {
                quarantine.quarantine(handle.location());
                pruned.add(handle);
            } catch (UncheckedIOException e) {
                log.warn("Could not retire snapshot {}, will retry on the next pass: {}",
                        handle.name(), e.getMessage());
            }
        }
        if (!pruned.isEmpty()) {
            log.info("Retired {} snapshot(s) older than {} days", pruned.size(), maxAge.toDays());
        }
        return pruned;
    }
}
