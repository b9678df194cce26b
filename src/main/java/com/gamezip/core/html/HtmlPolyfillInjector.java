package com.gamezip.core.html;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites archived HTML so old game pages load in current browsers.
 *
 * <p>General shims are always injected. Unity WebGL shims are added only when the
 * page references a Unity loader. Injection goes right after the opening
 * {@code <head>} tag; a page without one gets a synthesized head after
 * {@code <html>}, and a bare fragment is wrapped in a full document.
 */
public final class HtmlPolyfillInjector {

    private static final Logger log = LoggerFactory.getLogger(HtmlPolyfillInjector.class);

    static final String UNITY_POLYFILLS = """

            <script>
            // Unity WebGL Polyfills
            window.UnityProgress = window.UnityProgress || function(gameInstance, progress) {
              if (!gameInstance.Module) return;
              if (!gameInstance.progress) {
                gameInstance.progress = { loaded: 0, total: 1 };
              }
              gameInstance.progress.loaded = progress;
              if (progress === 1) {
                console.log('[Unity] Game loaded successfully');
              }
            };

            window.createUnityInstance = window.createUnityInstance || function(canvas, config) {
              return new Promise((resolve) => {
                console.log('[Unity] createUnityInstance called - using polyfill');
                resolve({
                  Module: {},
                  SetFullscreen: function() {},
                  SendMessage: function() {},
                  Quit: function() { return Promise.resolve(); }
                });
              });
            };

            if (typeof UnityLoader2020 === 'undefined') {
              window.UnityLoader2020 = {
                Error: {
                  handler: function(message, filename, lineno) {
                    console.warn('[Unity] Error:', message, 'at', filename + ':' + lineno);
                    return true;
                  }
                }
              };
            }
            </script>
            """;

    static final String GENERAL_POLYFILLS = """

            <script>
            // General game compatibility polyfills
            if (typeof window.external === 'undefined') {
              window.external = {};
            }
            if (typeof AudioContext === 'undefined' && typeof webkitAudioContext !== 'undefined') {
              window.AudioContext = webkitAudioContext;
            }
            </script>
            """;

    private static final List<Pattern> UNITY_INDICATORS = List.of(
            Pattern.compile("UnityProgress", Pattern.CASE_INSENSITIVE),
            Pattern.compile("UnityLoader", Pattern.CASE_INSENSITIVE),
            Pattern.compile("createUnityInstance", Pattern.CASE_INSENSITIVE),
            Pattern.compile("unityFramework\\.js", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Build/.*\\.loader\\.js", Pattern.CASE_INSENSITIVE),
            Pattern.compile("UnityEngine", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern HEAD_OPEN = Pattern.compile("<head(?:\\s[^>]*)?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern HTML_OPEN = Pattern.compile("<html(?:\\s[^>]*)?>", Pattern.CASE_INSENSITIVE);

    private HtmlPolyfillInjector() {}

    /**
     * Returns the document with shims injected, or {@code html} itself when the
     * bytes do not look like an HTML document.
     */
    public static byte[] inject(byte[] html) {
        String document = new String(html, StandardCharsets.UTF_8);
        String lower = document.toLowerCase(Locale.ROOT);
        if (!lower.contains("<html") && !lower.contains("<head")) {
            return html;
        }

        var polyfills = new StringBuilder();
        if (needsUnityPolyfills(document)) {
            log.debug("Injecting Unity WebGL polyfills");
            polyfills.append(UNITY_POLYFILLS);
        }
        polyfills.append(GENERAL_POLYFILLS);

        return insert(document, polyfills.toString()).getBytes(StandardCharsets.UTF_8);
    }

    static boolean needsUnityPolyfills(String html) {
        for (Pattern indicator : UNITY_INDICATORS) {
            if (indicator.matcher(html).find()) {
                return true;
            }
        }
        return false;
    }

    private static String insert(String document, String polyfills) {
        Matcher head = HEAD_OPEN.matcher(document);
        if (head.find()) {
            return document.substring(0, head.end()) + polyfills + document.substring(head.end());
        }
        Matcher html = HTML_OPEN.matcher(document);
        if (html.find()) {
            return document.substring(0, html.end())
                    + "<head>" + polyfills + "</head>"
                    + document.substring(html.end());
        }
        return "<!DOCTYPE html><html><head>" + polyfills + "</head><body>" + document + "</body></html>";
    }
}
