package com.gamezip.archive;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "gamezip.archive")
public class ArchiveProperties {

    /** Allow-listed directory that every mounted archive must live under. */
    private String gamesPath = "/data/flashpoint/Data/Games";

    /** Largest archive entry that will be buffered for a single response. */
    private long maxEntrySize = 50L * 1024 * 1024;

    public String getGamesPath() { return gamesPath; }
    public void setGamesPath(String gamesPath) { this.gamesPath = gamesPath; }
    public long getMaxEntrySize() { return maxEntrySize; }
    public void setMaxEntrySize(long maxEntrySize) { this.maxEntrySize = maxEntrySize; }
}
