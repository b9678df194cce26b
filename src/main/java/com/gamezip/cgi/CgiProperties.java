package com.gamezip.cgi;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "gamezip.cgi")
public class CgiProperties {

    private boolean enabled = false;
    private String phpCgiPath = "/usr/bin/php-cgi";
    private String documentRoot = "/data/flashpoint/Legacy/htdocs";
    private String cgiBinPath = "/data/flashpoint/Legacy/cgi-bin";
    private long timeoutMs = 30_000;
    private long maxBodySize = 10L * 1024 * 1024;
    private long maxResponseSize = 50L * 1024 * 1024;
    /** Delay between the termination signal and a forced kill of a timed-out script. */
    private long killGraceMs = 5_000;
    private long maxStderrSize = 1024 * 1024;
    private String serverSoftware = "gamezip-server/0.1.0";

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getPhpCgiPath() { return phpCgiPath; }
    public void setPhpCgiPath(String phpCgiPath) { this.phpCgiPath = phpCgiPath; }
    public String getDocumentRoot() { return documentRoot; }
    public void setDocumentRoot(String documentRoot) { this.documentRoot = documentRoot; }
    public String getCgiBinPath() { return cgiBinPath; }
    public void setCgiBinPath(String cgiBinPath) { this.cgiBinPath = cgiBinPath; }
    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    public long getMaxBodySize() { return maxBodySize; }
    public void setMaxBodySize(long maxBodySize) { this.maxBodySize = maxBodySize; }
    public long getMaxResponseSize() { return maxResponseSize; }
    public void setMaxResponseSize(long maxResponseSize) { this.maxResponseSize = maxResponseSize; }
    public long getKillGraceMs() { return killGraceMs; }
    public void setKillGraceMs(long killGraceMs) { this.killGraceMs = killGraceMs; }
    public long getMaxStderrSize() { return maxStderrSize; }
    public void setMaxStderrSize(long maxStderrSize) { this.maxStderrSize = maxStderrSize; }
    public String getServerSoftware() { return serverSoftware; }
    public void setServerSoftware(String serverSoftware) { this.serverSoftware = serverSoftware; }
}
