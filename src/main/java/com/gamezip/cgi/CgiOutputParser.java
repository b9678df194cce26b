package com.gamezip.cgi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.LinkedCaseInsensitiveMap;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw CGI output into status, headers and body.
 *
 * <p>The header block ends at the first blank line ({@code CRLF CRLF} or
 * {@code LF LF}). Output without a blank line is served whole as an HTML body.
 */
public class CgiOutputParser {

    private static final Logger log = LoggerFactory.getLogger(CgiOutputParser.class);

    static final String DEFAULT_CONTENT_TYPE = "text/html";

    private static final Pattern STATUS = Pattern.compile("^(\\d{3})");

    public CgiResponse parse(byte[] output) {
        int[] separator = findSeparator(output);
        if (separator == null) {
            log.warn("No header separator found in CGI output, treating as plain body");
            var headers = new LinkedCaseInsensitiveMap<String>();
            headers.put("Content-Type", DEFAULT_CONTENT_TYPE);
            return new CgiResponse(200, headers, output);
        }

        String headerBlock = new String(output, 0, separator[0], StandardCharsets.ISO_8859_1);
        byte[] body = Arrays.copyOfRange(output, separator[0] + separator[1], output.length);

        var headers = new LinkedCaseInsensitiveMap<String>();
        Integer status = null;
        for (String line : headerBlock.split("\r?\n")) {
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String name = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            if ("status".equalsIgnoreCase(name)) {
                Matcher matcher = STATUS.matcher(value);
                if (matcher.find()) {
                    int code = Integer.parseInt(matcher.group(1));
                    if (code >= 100 && code <= 599) {
                        status = code;
                    } else {
                        log.warn("Ignoring out-of-range CGI Status: {}", code);
                    }
                }
            } else {
                headers.put(name, value);
            }
        }

        if (status == null) {
            // RFC 3875 6.2.3: a client redirect without Status is a 302
            status = headers.containsKey("Location") ? 302 : 200;
        }
        headers.putIfAbsent("Content-Type", DEFAULT_CONTENT_TYPE);
        return new CgiResponse(status, headers, body);
    }

    /**
     * True when the output contains a header block terminated by a blank line.
     */
    public boolean isWellFormed(byte[] output) {
        return findSeparator(output) != null;
    }

    /** Returns {index, length} of the first blank line, or null. */
    private static int[] findSeparator(byte[] output) {
        for (int i = 0; i < output.length - 1; i++) {
            if (output[i] != '\n') {
                continue;
            }
            if (output[i + 1] == '\n') {
                return new int[]{i, 2};
            }
            if (i + 2 < output.length && output[i + 1] == '\r' && output[i + 2] == '\n') {
                // "\r\n\r\n": the block ends before the first '\r'
                return i > 0 && output[i - 1] == '\r' ? new int[]{i - 1, 4} : new int[]{i, 3};
            }
        }
        return null;
    }
}
