package com.dgw.resolver.model;

public record RawRelease(String title, String infoHash) {}
