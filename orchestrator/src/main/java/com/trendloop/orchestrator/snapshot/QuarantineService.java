package com.trendloop.orchestrator.snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Soft delete: relocates files and directories into a quarantine area instead of
 * removing them.
 *
 * Every component that would otherwise delete published output (restore, snapshot
 * retention, an aborted partial snapshot) goes through {@link #quarantine}, so any
 * earlier snapshot stays restorable. Moved entries are renamed
 * {@code yyyyMMdd_HHmmss_<original-name>}; nothing here ever deletes.
 *
 * The quarantine root should live on the same filesystem as the trees it receives,
 * otherwise directory moves fail.
 */
public class QuarantineService {

    private static final Logger log = LoggerFactory.getLogger(QuarantineService.class);

    static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Path  quarantineRoot;
    private final Clock clock;

    public QuarantineService(Path quarantineRoot, Clock clock) {
        this.quarantineRoot = quarantineRoot.toAbsolutePath().normalize();
        this.clock          = clock;
    }

    /**
     * Move {@code target} into quarantine.
     *
     * @return the new location, or empty if {@code target} does not exist
     * @throws UncheckedIOException if the move fails; {@code target} is left in place
     */
    public Optional<Path> quarantine(Path target) {
        if (!Files.exists(target)) {
            log.warn("Nothing to quarantine, path does not exist: {}", target);
            return Optional.empty();
        }
        try {
            Files.createDirectories(quarantineRoot);
            Path dest = uniqueDestination(target.getFileName().toString());
            Files.move(target, dest);
            log.info("Moved {} to quarantine as {}", target, dest.getFileName());
            return Optional.of(dest);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not quarantine " + target, e);
        }
    }

    public Path root() {
        return quarantineRoot;
    }

    private Path uniqueDestination(String baseName) {
        String prefix = STAMP.format(clock.instant()) + "_" + baseName;
        Path candidate = quarantineRoot.resolve(prefix);
        for (int n = 1; Files.exists(candidate); n++) {
            candidate = quarantineRoot.resolve(prefix + "_" + n);
        }
        return candidate;
    }
}
