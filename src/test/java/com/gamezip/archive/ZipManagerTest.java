package com.gamezip.archive;

import com.gamezip.core.http.ResourceLimitExceededException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ZipManagerTest {

    @TempDir
    Path dir;

    private ZipManager zipManager;

    @BeforeEach
    void setUp() {
        zipManager = new ZipManager(new ArchiveProperties());
    }

    @AfterEach
    void tearDown() {
        zipManager.unmountAll();
    }

    private static String text(byte[] data) {
        return new String(data, StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("mount / unmount")
    class Lifecycle {

        @Test
        @DisplayName("mounted file is found, and gone after unmount")
        void mountFindUnmount() throws Exception {
            Path zip = ZipFixtures.zip(dir.resolve("g1.zip"),
                    Map.of("content/example.com/game.swf", "SWF"));

            zipManager.mount("g1", zip);
            var found = zipManager.findFile("example.com/game.swf");
            assertTrue(found.isPresent());
            assertEquals("SWF", text(found.get().data()));
            assertEquals("g1", found.get().mountId());
            assertEquals("content/example.com/game.swf", found.get().entryPath());

            assertTrue(zipManager.unmount("g1"));
            assertTrue(zipManager.findFile("example.com/game.swf").isEmpty());
            assertFalse(zipManager.isMounted("g1"));
        }

        @Test
        @DisplayName("mount is idempotent for an id that is already mounted")
        void mountIsIdempotent() throws Exception {
            Path first = ZipFixtures.zip(dir.resolve("a.zip"), Map.of("content/a.com/x.txt", "A"));
            Path second = ZipFixtures.zip(dir.resolve("b.zip"), Map.of("content/a.com/x.txt", "B"));

            zipManager.mount("g1", first);
            var mountedAt = zipManager.getMountedArchives().get(0).mountTime();
            zipManager.mount("g1", second);

            var mounts = zipManager.getMountedArchives();
            assertEquals(1, mounts.size());
            assertEquals(first.toString(), mounts.get(0).zipPath());
            assertEquals(mountedAt, mounts.get(0).mountTime());
            assertEquals("A", text(zipManager.findFile("a.com/x.txt").orElseThrow().data()));
        }

        @Test
        @DisplayName("unmount of an unknown id returns false")
        void unmountUnknown() {
            assertFalse(zipManager.unmount("nope"));
        }

        @Test
        @DisplayName("missing file fails with MountException")
        void mountMissingFile() {
            var e = assertThrows(MountException.class, () -> zipManager.mount("g1", dir.resolve("missing.zip")));
            assertTrue(e.getMessage().startsWith("ZIP file not found"));
            assertFalse(zipManager.isMounted("g1"));
        }

        @Test
        @DisplayName("a file that is not a ZIP fails with MountException")
        void mountCorruptFile() throws Exception {
            Path bogus = Files.writeString(dir.resolve("bogus.zip"), "definitely not a zip");
            assertThrows(MountException.class, () -> zipManager.mount("g1", bogus));
            assertFalse(zipManager.isMounted("g1"));
        }

        @Test
        @DisplayName("unmountAll closes every archive")
        void unmountAll() throws Exception {
            zipManager.mount("a", ZipFixtures.zip(dir.resolve("a.zip"), Map.of("x", "1")));
            zipManager.mount("b", ZipFixtures.zip(dir.resolve("b.zip"), Map.of("y", "2")));

            zipManager.unmountAll();

            assertTrue(zipManager.getMountedArchives().isEmpty());
        }

        @Test
        @DisplayName("concurrent mount and unmount of one id leave a consistent registry")
        void concurrentMountUnmount() throws Exception {
            Path zip = ZipFixtures.zip(dir.resolve("c.zip"), Map.of("content/c.com/f.txt", "C"));
            ExecutorService pool = Executors.newFixedThreadPool(8);
            var start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < 200; i++) {
                    boolean mount = i % 2 == 0;
                    futures.add(pool.submit(() -> {
                        start.await();
                        if (mount) {
                            zipManager.mount("c", zip);
                        } else {
                            zipManager.unmount("c");
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> f : futures) {
                    f.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            int mounted = zipManager.getMountedArchives().size();
            assertTrue(mounted == 0 || mounted == 1);
            if (zipManager.isMounted("c")) {
                assertEquals("C", text(zipManager.findFile("c.com/f.txt").orElseThrow().data()));
            }
        }

        @Test
        @DisplayName("locks are held only for mounted ids")
        void locksDoNotAccumulate() throws Exception {
            for (int i = 0; i < 10_000; i++) {
                assertFalse(zipManager.unmount("never-mounted-" + i));
            }
            assertThrows(MountException.class, () -> zipManager.mount("missing", dir.resolve("missing.zip")));
            assertEquals(0, zipManager.lockCount());

            Path zip = ZipFixtures.zip(dir.resolve("l.zip"), Map.of("content/l.com/f.txt", "L"));
            zipManager.mount("l", zip);
            assertEquals(1, zipManager.lockCount());
            zipManager.unmount("l");
            assertEquals(0, zipManager.lockCount());
        }

        @Test
        @DisplayName("concurrent mount and unmount leave no stray locks")
        void concurrentLocksSettle() throws Exception {
            Path zip = ZipFixtures.zip(dir.resolve("s.zip"), Map.of("content/s.com/f.txt", "S"));
            ExecutorService pool = Executors.newFixedThreadPool(8);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < 400; i++) {
                    String id = "s" + (i % 4);
                    boolean mount = i % 3 != 0;
                    futures.add(pool.submit(() -> {
                        if (mount) {
                            zipManager.mount(id, zip);
                        } else {
                            zipManager.unmount(id);
                        }
                        return null;
                    }));
                }
                for (Future<?> f : futures) {
                    f.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(zipManager.getMountedArchives().size(), zipManager.lockCount());
            zipManager.unmountAll();
            assertEquals(0, zipManager.lockCount());
        }
    }

    @Nested
    @DisplayName("findFile")
    class FindFile {

        @Test
        @DisplayName("probes content/, htdocs/, bare and Legacy/htdocs/ layouts")
        void probesAllLayouts() throws Exception {
            zipManager.mount("g", ZipFixtures.zip(dir.resolve("layouts.zip"), Map.of(
                    "htdocs/h.com/a.txt", "htdocs",
                    "r.com/a.txt", "root",
                    "Legacy/htdocs/l.com/a.txt", "legacy")));

            assertEquals("htdocs", text(zipManager.findFile("h.com/a.txt").orElseThrow().data()));
            assertEquals("root", text(zipManager.findFile("r.com/a.txt").orElseThrow().data()));
            assertEquals("legacy", text(zipManager.findFile("/l.com/a.txt").orElseThrow().data()));
        }

        @Test
        @DisplayName("content/ wins over other layouts within one archive")
        void layoutOrder() throws Exception {
            zipManager.mount("g", ZipFixtures.zip(dir.resolve("both.zip"), Map.of(
                    "content/x.com/a.txt", "content",
                    "htdocs/x.com/a.txt", "htdocs")));
            assertEquals("content", text(zipManager.findFile("x.com/a.txt").orElseThrow().data()));
        }

        @Test
        @DisplayName("a miss in the first archive falls through to the second")
        void fallsThroughArchives() throws Exception {
            zipManager.mount("a", ZipFixtures.zip(dir.resolve("a.zip"), Map.of("content/other.com/x.txt", "A")));
            zipManager.mount("b", ZipFixtures.zip(dir.resolve("b.zip"), Map.of("htdocs/site.com/only-b.txt", "B")));

            var found = zipManager.findFile("site.com/only-b.txt").orElseThrow();
            assertEquals("B", text(found.data()));
            assertEquals("b", found.mountId());
        }

        @Test
        @DisplayName("the archive mounted first wins when both contain the path")
        void firstMountedWins() throws Exception {
            zipManager.mount("first", ZipFixtures.zip(dir.resolve("1.zip"), Map.of("content/s.com/f.txt", "1")));
            zipManager.mount("second", ZipFixtures.zip(dir.resolve("2.zip"), Map.of("content/s.com/f.txt", "2")));
            assertEquals("first", zipManager.findFile("s.com/f.txt").orElseThrow().mountId());
        }

        @Test
        @DisplayName("directories are not files")
        void directoriesAreNotFiles() throws Exception {
            zipManager.mount("g", ZipFixtures.zip(dir.resolve("d.zip"), Map.of("content/d.com/sub/", "")));
            assertTrue(zipManager.findFile("d.com/sub/").isEmpty());
        }

        @Test
        @DisplayName("entries above the buffering limit are refused")
        void entrySizeLimit() throws Exception {
            var properties = new ArchiveProperties();
            properties.setMaxEntrySize(4);
            var small = new ZipManager(properties);
            try {
                small.mount("g", ZipFixtures.zip(dir.resolve("big.zip"), Map.of("content/b.com/big.txt", "12345")));
                assertThrows(ResourceLimitExceededException.class, () -> small.findFile("b.com/big.txt"));
            } finally {
                small.unmountAll();
            }
        }
    }

    @Nested
    @DisplayName("inspection")
    class Inspection {

        @Test
        @DisplayName("getFile reads one entry of one archive")
        void getFile() throws Exception {
            zipManager.mount("g", ZipFixtures.zip(dir.resolve("g.zip"), Map.of("content/x.com/a.txt", "A")));
            assertEquals("A", text(zipManager.getFile("g", "/content/x.com/a.txt").orElseThrow()));
            assertTrue(zipManager.getFile("g", "x.com/a.txt").isEmpty());
            assertTrue(zipManager.getFile("other", "content/x.com/a.txt").isEmpty());
        }

        @Test
        @DisplayName("getMountedArchives reports id, path and file count")
        void mountedArchives() throws Exception {
            Path zip = ZipFixtures.zip(dir.resolve("g.zip"), Map.of("a", "1", "b", "2", "c", "3"));
            zipManager.mount("g", zip);

            var info = zipManager.getMountedArchives().get(0);
            assertEquals("g", info.id());
            assertEquals(zip.toString(), info.zipPath());
            assertEquals(3, info.fileCount());
            assertNotNull(info.mountTime());
        }

        @Test
        @DisplayName("listFiles filters with a case-insensitive pattern")
        void listFiles() throws Exception {
            zipManager.mount("g", ZipFixtures.zip(dir.resolve("g.zip"), Map.of(
                    "content/x.com/game.SWF", "1",
                    "content/x.com/index.html", "2")));

            assertEquals(2, zipManager.listFiles("g", null).size());
            assertEquals(List.of("content/x.com/game.SWF"), zipManager.listFiles("g", "\\.swf$"));
            assertTrue(zipManager.listFiles("unknown", null).isEmpty());
        }
    }
}
