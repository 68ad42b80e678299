package com.dgw.resolver.ranking;

import com.dgw.resolver.model.Candidate;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

public enum ReleaseField {
    TITLE("title", Candidate::getTitle),
    LANGUAGES("languages", candidate -> List.copyOf(candidate.getLanguages())),
    RESOLUTION("resolution", Candidate::getResolution),
    SIZE_GB("size_gb", Candidate::getSizeGb),
    SEEDERS("seeders", Candidate::getSeeders),
    SOURCE("source", Candidate::getSource),
    HASH("hash", Candidate::getHash),
    CACHED("cached", candidate -> List.copyOf(candidate.getCached())),
    VIDEOS("videos", Candidate::getVideoCount),
    EPISODES("episodes", Candidate::getEpisodeCount),
    SEASONS("seasons", candidate -> List.copyOf(candidate.getSeasons())),
    VERSIONS("versions", candidate -> candidate.getVersions().size());

    private final String key;
    private final Function<Candidate, Object> reader;

    ReleaseField(String key, Function<Candidate, Object> reader) {
        this.key = key;
        this.reader = reader;
    }

    public String key() {
        return key;
    }

    public Object read(Candidate candidate) {
        return reader.apply(candidate);
    }

    public static ReleaseField fromKey(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("size".equals(normalized)) {
            return SIZE_GB;
        }
        for (ReleaseField field : values()) {
            if (field.key.equals(normalized)) {
                return field;
            }
        }
        return null;
    }
}
