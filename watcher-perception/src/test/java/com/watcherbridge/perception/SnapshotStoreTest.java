package com.watcherbridge.perception;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotStoreTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SnapshotStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        store = new SnapshotStore(tempDir.resolve("snapshots"), clock);
    }

    @Test
    void save_usesTimestampedName() {
        Optional<Path> saved = store.save(new byte[]{1, 2, 3});

        assertTrue(saved.isPresent());
        assertEquals("20240501_120000_000.jpg", saved.get().getFileName().toString());
    }

    @Test
    void cleanup_110RecentFiles_keepsNewest100() throws IOException {
        Path dir = store.getDirectory();
        Files.createDirectories(dir);
        Instant base = clock.instant().minus(Duration.ofHours(2));
        for (int i = 0; i < 110; i++) {
            Path p = dir.resolve(String.format("snap_%03d.jpg", i));
            Files.write(p, new byte[]{(byte) i});
            Files.setLastModifiedTime(p, FileTime.from(base.plusSeconds(i)));
        }

        store.cleanup();

        assertEquals(100, count(dir));
        for (int i = 0; i < 10; i++) {
            assertFalse(Files.exists(dir.resolve(String.format("snap_%03d.jpg", i))));
        }
        assertTrue(Files.exists(dir.resolve("snap_010.jpg")));
        assertTrue(Files.exists(dir.resolve("snap_109.jpg")));
    }

    @Test
    void cleanup_oldFilesRemovedRegardlessOfCount() throws IOException {
        Path dir = store.getDirectory();
        Files.createDirectories(dir);
        Path old = dir.resolve("old.jpg");
        Path fresh = dir.resolve("fresh.jpg");
        Files.write(old, new byte[]{1});
        Files.write(fresh, new byte[]{2});
        Files.setLastModifiedTime(old, FileTime.from(clock.instant().minus(Duration.ofDays(8))));
        Files.setLastModifiedTime(fresh, FileTime.from(clock.instant().minus(Duration.ofDays(1))));

        store.cleanup();

        assertFalse(Files.exists(old));
        assertTrue(Files.exists(fresh));
    }

    @Test
    void cleanup_ignoresNonJpegFiles() throws IOException {
        Path dir = store.getDirectory();
        Files.createDirectories(dir);
        Path notes = dir.resolve("notes.txt");
        Files.writeString(notes, "keep");
        Files.setLastModifiedTime(notes, FileTime.from(clock.instant().minus(Duration.ofDays(30))));

        store.cleanup();

        assertTrue(Files.exists(notes));
    }

    @Test
    void cleanup_missingDirectory_isNoop() {
        assertDoesNotThrow(() -> store.cleanup());
    }

    private static long count(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.count();
        }
    }
}
