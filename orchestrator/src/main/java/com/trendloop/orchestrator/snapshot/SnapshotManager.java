package com.trendloop.orchestrator.snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystemException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Takes and restores full copies of the published output tree.
 *
 * <p>Layout under the backup root:
 * <pre>
 *   _backups/
 *     backup_20260301_060000/      one directory per run
 *     backup_20260301_060000_1/    same-second collision
 * </pre>
 *
 * Nothing here deletes. A restore first moves the current tree into quarantine, and a
 * snapshot that fails half-way is quarantined rather than removed.
 */
public class SnapshotManager {

    private static final Logger log = LoggerFactory.getLogger(SnapshotManager.class);

    static final String PREFIX = "backup_";

    private static final DateTimeFormatter NAME_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter NAME_PARSE =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern NAME_PATTERN = Pattern.compile("\\d{8}_\\d{6}(_\\d+)?");

    private final Path              backupRoot;
    private final QuarantineService quarantine;
    private final Clock             clock;

    public SnapshotManager(Path backupRoot, QuarantineService quarantine, Clock clock) {
        this.backupRoot = backupRoot.toAbsolutePath().normalize();
        this.quarantine = quarantine;
        this.clock      = clock;
    }

    // ------------------------------------------------------------------
    // Create
    // ------------------------------------------------------------------

    /**
     * Copy {@code sourceTree} into a new timestamp-named snapshot directory.
     *
     * A source tree that does not exist yet (first ever run) produces an empty snapshot.
     *
     * @throws SnapshotException SOURCE_UNREADABLE if the source exists but cannot be read,
     *                           DESTINATION_UNWRITABLE if the copy cannot be written
     */
    public SnapshotHandle createSnapshot(Path sourceTree) {
        Path source = sourceTree.toAbsolutePath().normalize();
        if (Files.exists(source) && (!Files.isDirectory(source) || !Files.isReadable(source))) {
            throw new SnapshotException(SnapshotException.Kind.SOURCE_UNREADABLE,
                    "Output tree is not a readable directory: " + source);
        }

        if (backupRoot.startsWith(source)) {
            throw new SnapshotException(SnapshotException.Kind.DESTINATION_UNWRITABLE,
                    "Backup root " + backupRoot + " lies inside the tree it would copy");
        }

        Instant createdAt = clock.instant();
        Path target;
        try {
            Files.createDirectories(backupRoot);
            target = createUniqueDirectory(PREFIX + NAME_STAMP.format(createdAt));
        } catch (IOException e) {
            throw new SnapshotException(SnapshotException.Kind.DESTINATION_UNWRITABLE,
                    "Cannot create snapshot directory under " + backupRoot, e);
        }

        if (!Files.exists(source)) {
            log.info("Output tree {} does not exist yet; created empty snapshot {}", source, target.getFileName());
            return new SnapshotHandle(target.getFileName().toString(), target, source, createdAt, 0);
        }

        try {
            long files = copyTree(source, target);
            log.info("Snapshot {} created from {} ({} files)", target.getFileName(), source, files);
            log.info("To roll back: POST /runs/restore/{}  (replaced files go to {})",
                    target.getFileName(), quarantine.root());
            return new SnapshotHandle(target.getFileName().toString(), target, source, createdAt, files);
        } catch (IOException e) {
            quarantinePartial(target);
            boolean readSide = e instanceof FileSystemException fse
                    && fse.getFile() != null
                    && Path.of(fse.getFile()).toAbsolutePath().startsWith(source);
            throw new SnapshotException(
                    readSide ? SnapshotException.Kind.SOURCE_UNREADABLE
                             : SnapshotException.Kind.DESTINATION_UNWRITABLE,
                    "Copy of " + source + " into " + target + " failed: " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Restore
    // ------------------------------------------------------------------

    /**
     * Put the snapshot's content back in place of its source tree.
     *
     * The current tree is moved into quarantine first, so a restore is itself
     * reversible.
     *
     * @throws SnapshotException STALE_HANDLE if the snapshot directory is gone,
     *                           RESTORE_FAILED if the move or the copy fails
     */
    public void restore(SnapshotHandle handle) {
        if (handle.isStale()) {
            throw new SnapshotException(SnapshotException.Kind.STALE_HANDLE,
                    "Snapshot " + handle.name() + " no longer exists at " + handle.location());
        }
        Path source = handle.sourceTree();
        log.warn("Restoring {} from snapshot {}", source, handle.name());
        try {
            quarantine.quarantine(source).ifPresent(moved ->
                    log.info("Current tree {} moved to quarantine {}", source, moved));
            Files.createDirectories(source);
            long files = copyTree(handle.location(), source);
            log.info("Restore of {} complete ({} files)", source, files);
        } catch (IOException | UncheckedIOException e) {
            throw new SnapshotException(SnapshotException.Kind.RESTORE_FAILED,
                    "Restore of " + source + " from " + handle.name() + " failed: " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Listing
    // ------------------------------------------------------------------

    /**
     * All snapshots under the backup root, oldest first.
     *
     * @param sourceTree recorded in every returned handle as its restore target
     */
    public List<SnapshotHandle> listSnapshots(Path sourceTree) {
        if (!Files.isDirectory(backupRoot)) return List.of();
        Path source = sourceTree.toAbsolutePath().normalize();
        List<SnapshotHandle> handles = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(backupRoot)) {
            for (Path dir : (Iterable<Path>) dirs::iterator) {
                String name = dir.getFileName().toString();
                if (!Files.isDirectory(dir) || !name.startsWith(PREFIX)) continue;
                handles.add(new SnapshotHandle(name, dir, source, createdAt(dir), -1));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list snapshots in " + backupRoot, e);
        }
        handles.sort(Comparator.comparing(SnapshotHandle::createdAt).thenComparing(SnapshotHandle::name));
        return handles;
    }

    public Path backupRoot() {
        return backupRoot;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Path createUniqueDirectory(String baseName) throws IOException {
        Path candidate = backupRoot.resolve(baseName);
        for (int n = 1; Files.exists(candidate); n++) {
            candidate = backupRoot.resolve(baseName + "_" + n);
        }
        return Files.createDirectory(candidate);
    }

    /** Recursive copy; returns the number of regular files copied. */
    private static long copyTree(Path from, Path to) throws IOException {
        long[] count = {0};
        Files.walkFileTree(from, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(to.resolve(from.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, to.resolve(from.relativize(file).toString()),
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                count[0]++;
                return FileVisitResult.CONTINUE;
            }
        });
        return count[0];
    }

    private void quarantinePartial(Path target) {
        try {
            quarantine.quarantine(target);
        } catch (UncheckedIOException e) {
            log.warn("Partial snapshot {} left in place, could not quarantine it: {}", target, e.getMessage());
        }
    }

    private static Instant createdAt(Path dir) {
        String stamp = dir.getFileName().toString().substring(PREFIX.length());
        if (NAME_PATTERN.matcher(stamp).matches()) {
            return LocalDateTime.parse(stamp.substring(0, 15), NAME_PARSE).toInstant(ZoneOffset.UTC);
        }
        // Hand-made directory; fall back to the filesystem timestamp.
        try {
            return Files.getLastModifiedTime(dir).toInstant();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read timestamp of " + dir, e);
        }
    }
}
