package com.gamezip.archive;

/**
 * Historical directory layouts archived sites were packaged with, in the order
 * they are probed. Adding a layout means adding a constant here.
 */
public enum ArchiveLayout {

    /** content/&lt;host&gt;/&lt;path&gt;, the most common layout. */
    CONTENT("content/"),
    HTDOCS("htdocs/"),
    ROOT(""),
    LEGACY_HTDOCS("Legacy/htdocs/");

    private final String prefix;

    ArchiveLayout(String prefix) {
        this.prefix = prefix;
    }

    public String entryPath(String relPath) {
        return prefix + relPath;
    }
}
