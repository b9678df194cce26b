package com.gamezip.core.mime;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extension to content-type lookup for archived web content.
 *
 * <p>The legacy table (Shockwave, Authorware, VRML, ...) wins over the standard
 * table; unknown extensions are served as {@code application/octet-stream}.
 */
public final class MimeTypes {

    public static final String DEFAULT_TYPE = "application/octet-stream";

    private static final Map<String, String> LEGACY = load("/mime-legacy.properties");
    private static final Map<String, String> STANDARD = load("/mime-standard.properties");

    private static final Set<String> SCRIPT_EXTENSIONS = Set.of("php", "php5", "phtml", "pl");
    private static final Set<String> HTML_EXTENSIONS = Set.of("html", "htm");

    private MimeTypes() {}

    public static String forExtension(String extension) {
        if (extension == null || extension.isEmpty()) {
            return DEFAULT_TYPE;
        }
        String ext = extension.toLowerCase(Locale.ROOT);
        String type = LEGACY.get(ext);
        if (type != null) {
            return type;
        }
        return STANDARD.getOrDefault(ext, DEFAULT_TYPE);
    }

    public static String forPath(String path) {
        return forExtension(extensionOf(path));
    }

    /**
     * Returns the lower-cased extension of the last path segment, or an empty string.
     */
    public static String extensionOf(String path) {
        if (path == null) {
            return "";
        }
        int slash = path.lastIndexOf('/');
        String name = slash >= 0 ? path.substring(slash + 1) : path;
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static boolean isScript(String path) {
        return SCRIPT_EXTENSIONS.contains(extensionOf(path));
    }

    public static boolean isHtml(String path) {
        return HTML_EXTENSIONS.contains(extensionOf(path));
    }

    private static Map<String, String> load(String resource) {
        var props = new Properties();
        try (InputStream in = MimeTypes.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing MIME table " + resource);
            }
            props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load MIME table " + resource, e);
        }
        return props.stringPropertyNames().stream()
                .collect(Collectors.toUnmodifiableMap(k -> k.toLowerCase(Locale.ROOT), props::getProperty));
    }
}
