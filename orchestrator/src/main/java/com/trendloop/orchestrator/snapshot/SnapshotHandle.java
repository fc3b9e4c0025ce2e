package com.trendloop.orchestrator.snapshot;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Reference to one timestamp-named copy of the published output tree.
 *
 * The directory behind a handle is never modified after creation. A handle becomes
 * stale when the retention policy (or an operator) moves the directory away.
 *
 * @param name       directory name, e.g. "backup_20260301_060000"
 * @param location   absolute path of the snapshot directory
 * @param sourceTree the tree that was copied, and where restore() writes back to
 * @param createdAt  when the snapshot was taken (UTC)
 * @param fileCount  regular files copied
 */
public record SnapshotHandle(
        String  name,
        Path    location,
        Path    sourceTree,
        Instant createdAt,
        long    fileCount) {

    public boolean isStale() {
        return !Files.isDirectory(location);
    }
}
