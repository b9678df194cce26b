package com.gamezip.archive;

import java.time.Instant;

/**
 * Public view of a mounted archive, as listed by {@code GET /mounts}.
 */
public record MountInfo(String id, String zipPath, Instant mountTime, int fileCount) {}
