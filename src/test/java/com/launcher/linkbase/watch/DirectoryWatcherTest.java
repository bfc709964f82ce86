package com.launcher.linkbase.watch;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for DirectoryWatcher.
 */
class DirectoryWatcherTest {

    @TempDir
    Path tempDir;

    private DirectoryWatcher watcher;

    @BeforeEach
    void setUp() {
        watcher = new DirectoryWatcher();
    }

    @AfterEach
    void tearDown() {
        watcher.close();
    }

    @Test
    void testExistingFilesReplayedInOrder() throws IOException {
        Files.writeString(tempDir.resolve("b.desktop"), "");
        Files.writeString(tempDir.resolve("a.desktop"), "");
        Files.createDirectories(tempDir.resolve("kde4"));
        Files.writeString(tempDir.resolve("kde4").resolve("c.desktop"), "");

        List<FileChangeEvent> events = new ArrayList<>();
        watcher.watch(tempDir, false, events::add);

        assertThat(events).extracting(FileChangeEvent::getSubPath).containsExactly("a.desktop", "b.desktop");
        assertThat(events).allSatisfy(e -> {
            assertThat(e.getType()).isEqualTo(FileChangeType.ADDED);
            assertThat(e.getBasePath()).isEqualTo(tempDir);
            assertThat(e.getFullPath()).isEqualTo(tempDir.resolve(e.getSubPath()));
        });
    }

    @Test
    void testRecursiveReplayUsesSlashedSubPaths() throws IOException {
        Files.createDirectories(tempDir.resolve("kde4"));
        Files.writeString(tempDir.resolve("kde4").resolve("c.desktop"), "");
        Files.writeString(tempDir.resolve("a.desktop"), "");

        List<FileChangeEvent> events = new ArrayList<>();
        watcher.watch(tempDir, true, events::add);

        assertThat(events).extracting(FileChangeEvent::getSubPath).containsExactly("a.desktop", "kde4/c.desktop");
    }

    @Test
    void testMissingDirectoryIsIgnored() throws IOException {
        List<FileChangeEvent> events = new ArrayList<>();

        watcher.watch(tempDir.resolve("missing"), false, events::add);

        assertThat(events).isEmpty();
    }

    @Test
    void testFailingHandlerDoesNotStopReplay() throws IOException {
        Files.writeString(tempDir.resolve("a.desktop"), "");
        Files.writeString(tempDir.resolve("b.desktop"), "");
        List<String> seen = new ArrayList<>();

        watcher.watch(tempDir, false, e -> {
            seen.add(e.getSubPath());
            throw new IllegalStateException("boom");
        });

        assertThat(seen).containsExactly("a.desktop", "b.desktop");
    }

    /**
     * Watcher whose listing fails on one file name, as when the file is
     * deleted while the directory is being read.
     */
    private static DirectoryWatcher vanishing(String fileName) {
        return new DirectoryWatcher() {
            @Override
            protected Stream<Path> walk(Path dir, int maxDepth) throws IOException {
                return super.walk(dir, maxDepth).map(p -> {
                    if (p.getFileName().toString().equals(fileName)) {
                        throw new UncheckedIOException(new NoSuchFileException(p.toString()));
                    }
                    return p;
                });
            }
        };
    }

    @Test
    void testFileVanishingDuringListingReportedAsIOException() throws IOException {
        Files.writeString(tempDir.resolve("gone.desktop"), "");
        DirectoryWatcher racing = vanishing("gone.desktop");

        try {
            assertThatThrownBy(() -> racing.watch(tempDir, false, e -> { }))
                    .isInstanceOf(NoSuchFileException.class)
                    .hasMessageContaining("gone.desktop");
            assertThatThrownBy(() -> racing.watch(tempDir, true, e -> { }))
                    .isInstanceOf(IOException.class);
        } finally {
            racing.close();
        }
    }

    @Test
    void testNewFileReported() throws Exception {
        BlockingQueue<FileChangeEvent> events = new LinkedBlockingQueue<>();
        watcher.watch(tempDir, false, events::add);

        Files.writeString(tempDir.resolve("new.desktop"), "[Desktop Entry]\n");

        FileChangeEvent event = events.poll(10, TimeUnit.SECONDS);
        assertThat(event).isNotNull();
        assertThat(event.getSubPath()).isEqualTo("new.desktop");
        assertThat(event.getType()).isIn(FileChangeType.ADDED, FileChangeType.MODIFIED);
    }

    @Test
    void testClosedWatcherRejectsWatch() {
        watcher.close();

        assertThatThrownBy(() -> watcher.watch(tempDir, false, e -> { }))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testSubPath() {
        Path base = Path.of("/usr/share/applications");

        assertThat(DirectoryWatcher.subPath(base, base.resolve("a.desktop"))).isEqualTo("a.desktop");
        assertThat(DirectoryWatcher.subPath(base, base.resolve("kde4/b.desktop"))).isEqualTo("kde4/b.desktop");
        assertThat(DirectoryWatcher.subPath(base, base)).isEmpty();
    }

    @Test
    void testEventWithoutSubPathPointsAtBase() {
        Path base = Path.of("/usr/share/applications");

        FileChangeEvent event = FileChangeEvent.of(base, "", FileChangeType.SELF_REMOVED);

        assertThat(event.getFullPath()).isEqualTo(base);
    }
}
