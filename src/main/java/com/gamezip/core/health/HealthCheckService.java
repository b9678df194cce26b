package com.gamezip.core.health;

import com.gamezip.archive.ArchiveProperties;
import com.gamezip.archive.ZipManager;
import com.gamezip.cgi.CgiExecutor;
import com.gamezip.cgi.CgiProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Component checks behind {@code gamezip health}. The HTTP {@code /health} endpoint
 * deliberately does not use this service.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ArchiveProperties archiveProperties;
    private final CgiProperties cgiProperties;
    private final CgiExecutor cgiExecutor;
    private final ZipManager zipManager;

    public HealthCheckService(ArchiveProperties archiveProperties, CgiProperties cgiProperties,
                              CgiExecutor cgiExecutor, ZipManager zipManager) {
        this.archiveProperties = archiveProperties;
        this.cgiProperties = cgiProperties;
        this.cgiExecutor = cgiExecutor;
        this.zipManager = zipManager;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGamesDirectory());
        results.add(checkMounts());
        results.add(checkCgi());
        return results;
    }

    HealthStatus checkGamesDirectory() {
        Path games = Path.of(archiveProperties.getGamesPath());
        if (!Files.isDirectory(games)) {
            log.warn("Games directory missing: {}", games);
            return new HealthStatus("games", HealthStatus.Status.DOWN,
                    "Games directory not found", Map.of("path", games.toString()));
        }
        if (!Files.isReadable(games)) {
            return new HealthStatus("games", HealthStatus.Status.DOWN,
                    "Games directory not readable", Map.of("path", games.toString()));
        }
        return new HealthStatus("games", HealthStatus.Status.UP,
                "Games directory available", Map.of("path", games.toString()));
    }

    HealthStatus checkMounts() {
        int mounted = zipManager.getMountedArchives().size();
        return new HealthStatus("mounts", HealthStatus.Status.UP,
                mounted + " archive(s) mounted", Map.of("count", String.valueOf(mounted)));
    }

    HealthStatus checkCgi() {
        if (!cgiProperties.isEnabled()) {
            return new HealthStatus("cgi", HealthStatus.Status.DISABLED,
                    "CGI execution disabled", Map.of());
        }
        if (cgiExecutor.validateBinary()) {
            return new HealthStatus("cgi", HealthStatus.Status.UP,
                    "php-cgi available", Map.of("binary", cgiProperties.getPhpCgiPath()));
        }
        return new HealthStatus("cgi", HealthStatus.Status.DOWN,
                "php-cgi not found or not executable", Map.of("binary", cgiProperties.getPhpCgiPath()));
    }
}
