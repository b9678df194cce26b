package com.gamezip.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamezip.archive.ArchiveProperties;
import com.gamezip.archive.MountException;
import com.gamezip.archive.ZipManager;
import com.gamezip.core.http.BodySizeLimiter;
import com.gamezip.core.http.ResourceLimitExceededException;
import com.gamezip.core.logging.MdcContext;
import com.gamezip.core.metrics.GameZipMetrics;
import com.gamezip.core.security.InputValidationException;
import com.gamezip.core.security.InputValidator;
import com.gamezip.core.security.PathSecurity;
import com.gamezip.core.security.SecurityViolationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mount registry endpoints used by the main backend before and after a play session.
 */
@RestController
public class MountController {

    private static final Logger log = LoggerFactory.getLogger(MountController.class);

    private final ZipManager zipManager;
    private final ArchiveProperties archiveProperties;
    private final GatewayProperties gatewayProperties;
    private final ObjectMapper objectMapper;
    private final GameZipMetrics metrics;

    public MountController(ZipManager zipManager,
                           ArchiveProperties archiveProperties,
                           GatewayProperties gatewayProperties,
                           ObjectMapper objectMapper,
                           @Autowired(required = false) GameZipMetrics metrics) {
        this.zipManager = zipManager;
        this.archiveProperties = archiveProperties;
        this.gatewayProperties = gatewayProperties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * POST /mount/{id}: Mount an archive from inside the games directory.
     * Body: {@code {"zipPath": "..."}}
     */
    @PostMapping("/mount/{id}")
    public ResponseEntity<?> mount(@PathVariable String id, HttpServletRequest request) {
        try {
            InputValidator.validateGameId(id);
        } catch (InputValidationException e) {
            log.warn("[Security] Invalid mount ID rejected");
            return ErrorResponses.plain(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        MdcContext.setMount(id);

        byte[] body;
        try {
            if (request.getContentLengthLong() > gatewayProperties.getMaxRequestBodySize()) {
                throw new ResourceLimitExceededException("Request body too large",
                        gatewayProperties.getMaxRequestBodySize());
            }
            body = BodySizeLimiter.readAll(request.getInputStream(), gatewayProperties.getMaxRequestBodySize());
        } catch (ResourceLimitExceededException e) {
            return ErrorResponses.from(e);
        } catch (IOException e) {
            log.warn("Failed to read mount request body: {}", e.getMessage());
            return ErrorResponses.plain(HttpStatus.BAD_REQUEST, "Invalid JSON");
        }

        MountRequest mountRequest;
        try {
            mountRequest = objectMapper.readValue(body, MountRequest.class);
        } catch (IOException e) {
            return ErrorResponses.plain(HttpStatus.BAD_REQUEST, "Invalid JSON");
        }
        if (mountRequest == null || mountRequest.zipPath() == null || mountRequest.zipPath().isBlank()) {
            return ErrorResponses.plain(HttpStatus.BAD_REQUEST, "Missing zipPath in request body");
        }

        String zipPath = mountRequest.zipPath();
        Path resolved;
        try {
            resolved = PathSecurity.resolveInsideRoot(Path.of(archiveProperties.getGamesPath()), zipPath);
        } catch (SecurityViolationException | InputValidationException e) {
            return ErrorResponses.from(e);
        }

        try {
            zipManager.mount(id, resolved);
        } catch (MountException e) {
            log.error("Mount failed for {}: {}", id, e.getMessage());
            recordMount(false);
            return ErrorResponses.from(e);
        }
        recordMount(true);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("id", id);
        result.put("zipPath", zipPath);
        return ResponseEntity.ok(result);
    }

    @PostMapping({"/mount", "/mount/"})
    public ResponseEntity<?> mountWithoutId() {
        return ErrorResponses.plain(HttpStatus.BAD_REQUEST, "Missing mount ID");
    }

    /** Ids never contain '/', so a deeper path is an invalid id rather than a file request. */
    @PostMapping("/mount/{id}/**")
    public ResponseEntity<?> mountNestedId() {
        log.warn("[Security] Invalid mount ID rejected");
        return ErrorResponses.plain(HttpStatus.BAD_REQUEST, "Invalid game ID: Game ID contains invalid characters");
    }

    /**
     * DELETE /mount/{id}: 200 when the archive was unmounted, 404 when it was not mounted.
     */
    @DeleteMapping("/mount/{id}")
    public ResponseEntity<?> unmount(@PathVariable String id) {
        try {
            InputValidator.validateGameId(id);
        } catch (InputValidationException e) {
            log.warn("[Security] Invalid mount ID rejected");
            return ErrorResponses.plain(HttpStatus.BAD_REQUEST, "Invalid mount ID");
        }
        MdcContext.setMount(id);

        boolean removed = zipManager.unmount(id);
        if (metrics != null) {
            metrics.recordUnmount(removed);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", removed);
        result.put("id", id);
        return ResponseEntity.status(removed ? HttpStatus.OK : HttpStatus.NOT_FOUND).body(result);
    }

    @DeleteMapping({"/mount", "/mount/"})
    public ResponseEntity<?> unmountWithoutId() {
        return ErrorResponses.plain(HttpStatus.BAD_REQUEST, "Missing mount ID");
    }

    @DeleteMapping("/mount/{id}/**")
    public ResponseEntity<?> unmountNestedId() {
        log.warn("[Security] Invalid mount ID rejected");
        return ErrorResponses.plain(HttpStatus.BAD_REQUEST, "Invalid mount ID");
    }

    /**
     * GET /mounts: Active mounts in mount order.
     */
    @GetMapping("/mounts")
    public ResponseEntity<Map<String, Object>> mounts() {
        return ResponseEntity.ok(Map.of("mounts", zipManager.getMountedArchives()));
    }

    private void recordMount(boolean success) {
        if (metrics != null) {
            metrics.recordMount(success);
        }
    }
}
