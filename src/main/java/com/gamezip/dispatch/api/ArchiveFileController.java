package com.gamezip.dispatch.api;

import com.gamezip.archive.FoundFile;
import com.gamezip.archive.ZipManager;
import com.gamezip.cgi.CgiExecutionException;
import com.gamezip.cgi.CgiExecutor;
import com.gamezip.cgi.CgiProperties;
import com.gamezip.cgi.CgiRequest;
import com.gamezip.cgi.CgiResponse;
import com.gamezip.core.html.HtmlPolyfillInjector;
import com.gamezip.core.http.BodySizeLimiter;
import com.gamezip.core.http.ResourceLimitExceededException;
import com.gamezip.core.logging.MdcContext;
import com.gamezip.core.metrics.GameZipMetrics;
import com.gamezip.core.mime.MimeTypes;
import com.gamezip.core.security.InputValidationException;
import com.gamezip.core.security.InputValidator;
import com.gamezip.core.security.PathSecurity;
import com.gamezip.core.security.SecurityViolationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Catch-all route serving archived files out of the mounted ZIPs, with a CGI
 * fallback for legacy scripts that live on disk.
 */
@RestController
public class ArchiveFileController {

    private static final Logger log = LoggerFactory.getLogger(ArchiveFileController.class);

    static final String CACHE_CONTROL = "public, max-age=86400";

    /** Headers the servlet container manages itself. */
    private static final Set<String> HOP_BY_HOP = Set.of(
            "connection", "transfer-encoding", "keep-alive", "content-length");

    private final ZipManager zipManager;
    private final CgiExecutor cgiExecutor;
    private final CgiProperties cgiProperties;
    private final GatewayProperties gatewayProperties;
    private final GameZipMetrics metrics;

    public ArchiveFileController(ZipManager zipManager,
                                 CgiExecutor cgiExecutor,
                                 CgiProperties cgiProperties,
                                 GatewayProperties gatewayProperties,
                                 @Autowired(required = false) GameZipMetrics metrics) {
        this.zipManager = zipManager;
        this.cgiExecutor = cgiExecutor;
        this.cgiProperties = cgiProperties;
        this.gatewayProperties = gatewayProperties;
        this.metrics = metrics;
    }

    @RequestMapping(value = "/**", method = {RequestMethod.GET, RequestMethod.HEAD, RequestMethod.POST})
    public ResponseEntity<?> serve(HttpServletRequest request) {
        String host = request.getHeader(HttpHeaders.HOST);
        LegacyRequestTarget target = LegacyRequestTarget.parse(request.getRequestURI(), request.getQueryString(),
                host != null ? host : request.getServerName());

        String hostname;
        try {
            hostname = InputValidator.validateHostname(target.hostname());
        } catch (InputValidationException e) {
            log.error("Invalid hostname: {}", target.hostname());
            recordRequest("rejected");
            return ErrorResponses.plain(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        String relative;
        try {
            InputValidator.validateFilePath(target.path());
            PathSecurity.sanitizeUrlPath(target.path());
            relative = PathSecurity.normalizeRelative(PathSecurity.decodePath(target.path()));
        } catch (InputValidationException e) {
            log.error("Invalid URL path: {}", e.getMessage());
            recordRequest("rejected");
            return ErrorResponses.plain(HttpStatus.BAD_REQUEST, "Invalid URL path");
        }

        String relPath = hostname + "/" + relative;
        boolean isPost = "POST".equalsIgnoreCase(request.getMethod());
        log.info("Looking for: {}", relPath);

        if (!isPost) {
            Optional<FoundFile> found;
            try {
                found = zipManager.findFile(relPath);
            } catch (ResourceLimitExceededException e) {
                return ErrorResponses.from(e);
            }
            if (found.isPresent()) {
                return serveArchived(request, relPath, found.get());
            }
        }

        if (cgiProperties.isEnabled() && MimeTypes.isScript(relative)) {
            Optional<Path> script = locateScript(relPath);
            if (script.isPresent()) {
                return executeScript(request, target, script.get());
            }
        }

        if (isPost) {
            return ErrorResponses.plain(HttpStatus.NOT_FOUND, "Not Found");
        }
        log.debug("File not found in any mounted ZIP: {}", relPath);
        recordRequest("miss");
        return ErrorResponses.plain(HttpStatus.NOT_FOUND, "File not found in mounted ZIPs");
    }

    private ResponseEntity<?> serveArchived(HttpServletRequest request, String relPath, FoundFile file) {
        MdcContext.setMount(file.mountId());
        String contentType = MimeTypes.forPath(relPath);

        byte[] data = file.data();
        if (MimeTypes.isHtml(relPath)) {
            data = HtmlPolyfillInjector.inject(data);
            log.info("Injected polyfills into HTML file: {}", relPath);
        }

        log.info("Serving from ZIP {}: {} ({} bytes)", file.mountId(), relPath, data.length);
        recordRequest("hit");
        if (metrics != null) {
            metrics.recordBytesServed(data.length);
        }

        var builder = ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, contentType)
                .header(HttpHeaders.CONTENT_LENGTH, String.valueOf(data.length))
                .header(HttpHeaders.CACHE_CONTROL, CACHE_CONTROL)
                .header("X-Source", "gamezipserver:" + file.mountId());
        if ("HEAD".equalsIgnoreCase(request.getMethod())) {
            return builder.build();
        }
        return builder.body(data);
    }

    /** Looks for {@code <host>/<path>} under the document root, then under cgi-bin. */
    private Optional<Path> locateScript(String relPath) {
        for (String base : List.of(cgiProperties.getDocumentRoot(), cgiProperties.getCgiBinPath())) {
            try {
                Path candidate = PathSecurity.sanitizeAndValidatePath(Path.of(base), relPath);
                if (Files.isRegularFile(candidate)) {
                    return Optional.of(candidate);
                }
            } catch (SecurityViolationException e) {
                log.warn("[Security] Script candidate rejected under {}", base);
            }
        }
        return Optional.empty();
    }

    private ResponseEntity<?> executeScript(HttpServletRequest request, LegacyRequestTarget target, Path script) {
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
            log.warn("Failed to read request body: {}", e.getMessage());
            return ErrorResponses.plain(HttpStatus.BAD_REQUEST, "Bad Request");
        }

        var cgiRequest = new CgiRequest(request.getMethod(), target.hostname(), target.port(),
                target.path(), target.query(), headersOf(request), body.length > 0 ? body : null);

        CgiResponse response;
        try {
            response = cgiExecutor.execute(script, cgiRequest);
        } catch (CgiExecutionException | SecurityViolationException | ResourceLimitExceededException e) {
            log.error("CGI execution failed for {}: {}", target.path(), e.getMessage());
            return ErrorResponses.from(e);
        }
        recordRequest("cgi");

        byte[] data = response.body();
        String contentType = response.headers().getOrDefault(HttpHeaders.CONTENT_TYPE, "text/html");
        if (contentType.toLowerCase(Locale.ROOT).contains("text/html")) {
            data = HtmlPolyfillInjector.inject(data);
        }

        var builder = ResponseEntity.status(response.statusCode());
        response.headers().forEach((name, value) -> {
            if (!HOP_BY_HOP.contains(name.toLowerCase(Locale.ROOT))) {
                builder.header(name, value);
            }
        });
        builder.header(HttpHeaders.CONTENT_LENGTH, String.valueOf(data.length));
        if ("HEAD".equalsIgnoreCase(request.getMethod())) {
            return builder.build();
        }
        return builder.body(data);
    }

    private static Map<String, String> headersOf(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, String.join(", ", Collections.list(request.getHeaders(name))));
        }
        return headers;
    }

    private void recordRequest(String result) {
        if (metrics != null) {
            metrics.recordFileRequest(result);
        }
    }
}
