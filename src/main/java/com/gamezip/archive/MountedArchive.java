package com.gamezip.archive;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.zip.ZipFile;

/**
 * One open archive in the mount registry. Owns exactly one {@link ZipFile} handle.
 */
final class MountedArchive implements Closeable {

    private final String id;
    private final Path sourcePath;
    private final ZipFile handle;
    private final Instant mountedAt;
    private final long sequence;

    MountedArchive(String id, Path sourcePath, ZipFile handle, Instant mountedAt, long sequence) {
        this.id = id;
        this.sourcePath = sourcePath;
        this.handle = handle;
        this.mountedAt = mountedAt;
        this.sequence = sequence;
    }

    String id() { return id; }
    Path sourcePath() { return sourcePath; }
    ZipFile handle() { return handle; }
    Instant mountedAt() { return mountedAt; }

    /** Registration order; lower values are probed first. */
    long sequence() { return sequence; }

    int fileCount() {
        try {
            return handle.size();
        } catch (IllegalStateException e) {
            return 0;
        }
    }

    MountInfo toInfo() {
        return new MountInfo(id, sourcePath.toString(), mountedAt, fileCount());
    }

    @Override
    public void close() throws IOException {
        handle.close();
    }
}
