package com.gamezip.dispatch.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LegacyRequestTargetTest {

    @Test
    @DisplayName("absolute URI on the request line")
    void absoluteForm() {
        var target = LegacyRequestTarget.parse("http://www.example.com/games/game.swf", "v=2", "ignored");

        assertEquals("www.example.com", target.hostname());
        assertEquals(-1, target.port());
        assertEquals("/games/game.swf", target.path());
        assertEquals("v=2", target.query());
    }

    @Test
    @DisplayName("absolute URL embedded in the path")
    void pathPrefixed() {
        var target = LegacyRequestTarget.parse("/http://example.com:8080/a/b.swf", null, "localhost:22501");

        assertEquals("example.com", target.hostname());
        assertEquals(8080, target.port());
        assertEquals("/a/b.swf", target.path());
        assertEquals("", target.query());
    }

    @Test
    @DisplayName("embedded URL whose double slash was collapsed")
    void collapsedSlashes() {
        var target = LegacyRequestTarget.parse("/https:/example.com/x.html", null, null);

        assertEquals("example.com", target.hostname());
        assertEquals("/x.html", target.path());
    }

    @Test
    @DisplayName("embedded URL without a path addresses the root")
    void hostOnly() {
        var target = LegacyRequestTarget.parse("/http://example.com", null, null);
        assertEquals("example.com", target.hostname());
        assertEquals("/", target.path());
    }

    @Test
    @DisplayName("plain path takes the host from the Host header, without its port")
    void plainPath() {
        var target = LegacyRequestTarget.parse("/games/game.swf", "token=abc", "example.com:22501");

        assertEquals("example.com", target.hostname());
        assertEquals(22501, target.port());
        assertEquals("/games/game.swf", target.path());
        assertEquals("token=abc", target.query());
    }

    @Test
    @DisplayName("plain path without a Host header defaults to localhost")
    void noHostHeader() {
        var target = LegacyRequestTarget.parse("/index.html", null, null);
        assertEquals("localhost", target.hostname());
        assertEquals(-1, target.port());
    }

    @Test
    @DisplayName("a path segment that merely starts with http is a plain path")
    void notAnUrl() {
        var target = LegacyRequestTarget.parse("/httpdocs/a.swf", null, "example.com");
        assertEquals("example.com", target.hostname());
        assertEquals("/httpdocs/a.swf", target.path());
    }
}
