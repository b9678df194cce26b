package com.gamezip.dispatch.api;

public record MountRequest(String zipPath) {}
