package com.dgw.resolver.model;

import java.util.Locale;

public enum MediaKind {
    MOVIE("movie"),
    SHOW("show");

    private final String label;

    MediaKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static MediaKind from(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (MediaKind kind : values()) {
            if (kind.label.equals(normalized)) {
                return kind;
            }
        }
        if ("series".equals(normalized) || "episode".equals(normalized)) {
            return SHOW;
        }
        return null;
    }
}
