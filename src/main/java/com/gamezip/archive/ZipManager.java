package com.gamezip.archive;

import com.gamezip.core.http.ResourceLimitExceededException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Registry of mounted ZIP archives, presented as one virtual filesystem.
 *
 * <p>Lookups are lock-free and may run concurrently with each other. Mount and
 * unmount of the same id are serialized on a per-id monitor, so a concurrent
 * mount/unmount pair for one id never leaves two handles open or a closed
 * handle registered.
 *
 * <p>When the same path exists in several archives, the archive mounted first wins.
 */
@Service
public class ZipManager {

    private static final Logger log = LoggerFactory.getLogger(ZipManager.class);

    private final ConcurrentHashMap<String, MountedArchive> mounts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Object> mountLocks = new ConcurrentHashMap<>();
    private final AtomicLong mountSequence = new AtomicLong();
    private final long maxEntrySize;

    public ZipManager(ArchiveProperties properties) {
        this.maxEntrySize = properties.getMaxEntrySize();
    }

    /**
     * Opens {@code zipPath} and registers it under {@code id}. Does nothing when
     * {@code id} is already mounted.
     *
     * @throws MountException if the file is missing, unreadable or not a ZIP archive
     */
    public void mount(String id, Path zipPath) {
        withMountLock(id, () -> {
            if (mounts.containsKey(id)) {
                log.debug("ZIP already mounted: {}", id);
                return null;
            }
            if (!Files.isRegularFile(zipPath) || !Files.isReadable(zipPath)) {
                throw new MountException("ZIP file not found: " + zipPath);
            }

            log.info("Mounting ZIP: {} -> {}", id, zipPath);
            ZipFile handle;
            try {
                handle = new ZipFile(zipPath.toFile());
            } catch (IOException e) {
                throw new MountException("Failed to open ZIP archive: " + zipPath, e);
            }

            var archive = new MountedArchive(id, zipPath, handle, Instant.now(), mountSequence.incrementAndGet());
            mounts.put(id, archive);
            log.info("Mounted ZIP: {} ({} files)", id, archive.fileCount());
            return null;
        });
    }

    /**
     * Closes and removes the archive registered under {@code id}.
     *
     * @return false if {@code id} was not mounted
     */
    public boolean unmount(String id) {
        return withMountLock(id, () -> {
            MountedArchive archive = mounts.remove(id);
            if (archive == null) {
                log.warn("ZIP not mounted: {}", id);
                return false;
            }
            log.info("Unmounting ZIP: {}", id);
            try {
                archive.close();
            } catch (IOException e) {
                log.error("Error closing ZIP handle for {}", id, e);
            }
            return true;
        });
    }

    public boolean isMounted(String id) {
        return mounts.containsKey(id);
    }

    /**
     * Reads one entry from one archive.
     *
     * @param entryPath entry name inside the archive; a leading slash is ignored
     * @return the entry bytes, or empty when the archive or entry does not exist
     * @throws ResourceLimitExceededException if the entry is larger than the buffering limit
     */
    public Optional<byte[]> getFile(String id, String entryPath) {
        MountedArchive archive = mounts.get(id);
        if (archive == null) {
            log.debug("ZIP not mounted: {}", id);
            return Optional.empty();
        }
        return readEntry(archive, stripLeadingSlash(entryPath));
    }

    /**
     * Resolves a logical {@code <host>/<path>} against every mounted archive,
     * trying each {@link ArchiveLayout} in order within an archive before moving
     * to the next archive.
     */
    public Optional<FoundFile> findFile(String relPath) {
        String normalized = stripLeadingSlash(relPath);
        for (MountedArchive archive : inMountOrder()) {
            for (ArchiveLayout layout : ArchiveLayout.values()) {
                String entryPath = layout.entryPath(normalized);
                Optional<byte[]> data = readEntry(archive, entryPath);
                if (data.isPresent()) {
                    log.info("Found in {}: {}", archive.id(), entryPath);
                    return Optional.of(new FoundFile(data.get(), archive.id(), entryPath));
                }
            }
        }
        return Optional.empty();
    }

    public List<MountInfo> getMountedArchives() {
        return inMountOrder().stream().map(MountedArchive::toInfo).toList();
    }

    /**
     * Lists entry names of a mounted archive.
     *
     * @param pattern optional case-insensitive regex; entries must contain a match
     */
    public List<String> listFiles(String id, String pattern) {
        MountedArchive archive = mounts.get(id);
        if (archive == null) {
            return List.of();
        }
        Pattern filter = pattern != null && !pattern.isBlank()
                ? Pattern.compile(pattern, Pattern.CASE_INSENSITIVE)
                : null;
        var names = new ArrayList<String>();
        try {
            archive.handle().stream()
                    .map(ZipEntry::getName)
                    .filter(name -> filter == null || filter.matcher(name).find())
                    .forEach(names::add);
        } catch (IllegalStateException e) {
            log.error("Error listing files in {}", id, e);
            return List.of();
        }
        return names;
    }

    @PreDestroy
    public void unmountAll() {
        log.info("Unmounting all ZIPs ({})...", mounts.size());
        for (String id : List.copyOf(mounts.keySet())) {
            unmount(id);
        }
        log.info("All ZIPs unmounted");
    }

    /**
     * Runs {@code action} while holding the lock for {@code id}. A lock is kept
     * only while its id is mounted; a thread that acquires a lock already retired
     * from the map retries with the current one.
     */
    private <T> T withMountLock(String id, Supplier<T> action) {
        while (true) {
            Object lock = mountLocks.computeIfAbsent(id, k -> new Object());
            synchronized (lock) {
                if (mountLocks.get(id) != lock) {
                    continue;
                }
                try {
                    return action.get();
                } finally {
                    if (!mounts.containsKey(id)) {
                        mountLocks.remove(id, lock);
                    }
                }
            }
        }
    }

    int lockCount() {
        return mountLocks.size();
    }

    private List<MountedArchive> inMountOrder() {
        var ordered = new ArrayList<>(mounts.values());
        ordered.sort(Comparator.comparingLong(MountedArchive::sequence));
        return ordered;
    }

    private Optional<byte[]> readEntry(MountedArchive archive, String entryPath) {
        try {
            ZipEntry entry = archive.handle().getEntry(entryPath);
            if (entry == null || entry.isDirectory()) {
                return Optional.empty();
            }
            if (entry.getSize() > maxEntrySize) {
                throw new ResourceLimitExceededException(
                        "Archive entry exceeds maximum buffered size", maxEntrySize);
            }
            try (InputStream in = archive.handle().getInputStream(entry)) {
                byte[] data = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8, maxEntrySize + 1));
                if (data.length > maxEntrySize) {
                    throw new ResourceLimitExceededException(
                            "Archive entry exceeds maximum buffered size", maxEntrySize);
                }
                log.debug("Read {} bytes from {}:{}", data.length, archive.id(), entryPath);
                return Optional.of(data);
            }
        } catch (IllegalStateException e) {
            // handle closed by a concurrent unmount
            log.debug("ZIP {} closed during lookup of {}", archive.id(), entryPath);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Failed to read {} from {}: {}", entryPath, archive.id(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String stripLeadingSlash(String path) {
        return path.startsWith("/") ? path.substring(1) : path;
    }
}
