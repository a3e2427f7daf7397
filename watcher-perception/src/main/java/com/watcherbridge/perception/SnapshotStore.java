package com.watcherbridge.perception;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Directory of analyzed frames with a bounded retention policy:
 * files older than {@link #MAX_AGE} go first, then the oldest beyond
 * {@link #MAX_SNAPSHOTS} by modification time.
 */
@Slf4j
public class SnapshotStore {

    public static final int MAX_SNAPSHOTS = 100;
    public static final Duration MAX_AGE = Duration.ofDays(7);

    private static final DateTimeFormatter FILE_NAME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path directory;
    private final Clock clock;

    public SnapshotStore(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
    }

    /**
     * Write the frame under a timestamped name, then run {@link #cleanup()}.
     *
     * @return the written path, or empty when the write failed
     */
    public Optional<Path> save(byte[] image) {
        try {
            Files.createDirectories(directory);
            Path file = directory.resolve(LocalDateTime.now(clock).format(FILE_NAME) + ".jpg");
            Files.write(file, image);
            log.debug("Saved snapshot: {}", file);
            cleanup();
            return Optional.of(file);
        } catch (IOException e) {
            log.error("Failed to save snapshot: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Apply the age rule, then the count rule. Per-file failures are logged and skipped.
     */
    public void cleanup() {
        if (!Files.isDirectory(directory)) {
            return;
        }
        Instant cutoff = clock.instant().minus(MAX_AGE);
        for (Snapshot s : list()) {
            if (s.modified().isBefore(cutoff)) {
                delete(s.path(), "old");
            }
        }

        List<Snapshot> remaining = list();
        if (remaining.size() <= MAX_SNAPSHOTS) {
            return;
        }
        remaining.sort(Comparator.comparing(Snapshot::modified));
        int excess = remaining.size() - MAX_SNAPSHOTS;
        for (Snapshot s : remaining.subList(0, excess)) {
            delete(s.path(), "excess");
        }
    }

    public Path getDirectory() {
        return directory;
    }

    private List<Snapshot> list() {
        List<Snapshot> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.jpg")) {
            for (Path p : stream) {
                try {
                    out.add(new Snapshot(p, Files.getLastModifiedTime(p).toInstant()));
                } catch (IOException e) {
                    log.debug("Skipping snapshot {}: {}", p, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Snapshot listing failed: {}", e.getMessage());
        }
        return out;
    }

    private static void delete(Path p, String reason) {
        try {
            Files.deleteIfExists(p);
            log.debug("Deleted {} snapshot: {}", reason, p);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", p, e.getMessage());
        }
    }

    private record Snapshot(Path path, Instant modified) {
    }
}
