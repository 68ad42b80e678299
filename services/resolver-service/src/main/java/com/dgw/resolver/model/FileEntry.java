package com.dgw.resolver.model;

public record FileEntry(
    String name,
    double sizeGb,
    String id,
    boolean video,
    boolean subtitle,
    Integer season,
    Integer episode
) {}
