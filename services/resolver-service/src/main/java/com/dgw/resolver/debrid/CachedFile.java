package com.dgw.resolver.debrid;

public record CachedFile(String filename, long filesizeBytes) {}
