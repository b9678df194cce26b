package com.gamezip.archive;

/**
 * A successful virtual-filesystem lookup.
 *
 * @param data      entry bytes
 * @param mountId   id of the archive the entry came from
 * @param entryPath the entry name that matched, including its layout prefix
 */
public record FoundFile(byte[] data, String mountId, String entryPath) {}
