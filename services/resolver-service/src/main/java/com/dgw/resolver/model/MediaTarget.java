package com.dgw.resolver.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

public final class MediaTarget {
    private final MediaKind kind;
    private final String externalId;
    private final SortedSet<Integer> seasons;
    private final Integer episode;

    private MediaTarget(MediaKind kind, String externalId, Collection<Integer> seasons, Integer episode) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId is required");
        }
        this.externalId = externalId.trim();
        TreeSet<Integer> copy = new TreeSet<>();
        if (kind == MediaKind.SHOW && seasons != null) {
            for (Integer season : seasons) {
                if (season != null) {
                    copy.add(season);
                }
            }
        }
        this.seasons = Collections.unmodifiableSortedSet(copy);
        this.episode = kind == MediaKind.SHOW ? episode : null;
    }

    public static MediaTarget movie(String externalId) {
        return new MediaTarget(MediaKind.MOVIE, externalId, null, null);
    }

    public static MediaTarget show(String externalId, Collection<Integer> seasons, Integer episode) {
        return new MediaTarget(MediaKind.SHOW, externalId, seasons, episode);
    }

    public static MediaTarget of(MediaKind kind, String externalId, Collection<Integer> seasons, Integer episode) {
        return new MediaTarget(kind, externalId, seasons, episode);
    }

    public MediaKind getKind() {
        return kind;
    }

    public String getExternalId() {
        return externalId;
    }

    public SortedSet<Integer> getSeasons() {
        return seasons;
    }

    public Integer getEpisode() {
        return episode;
    }

    public boolean hasEpisode() {
        return episode != null;
    }

    public String slotKey() {
        StringBuilder key = new StringBuilder(kind.label()).append(':').append(externalId);
        if (kind == MediaKind.SHOW) {
            key.append(":s=").append(seasons.stream().map(String::valueOf).collect(Collectors.joining(",")));
            if (episode != null) {
                key.append(":e=").append(episode);
            }
        }
        return key.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MediaTarget that)) {
            return false;
        }
        return kind == that.kind
            && externalId.equals(that.externalId)
            && seasons.equals(that.seasons)
            && Objects.equals(episode, that.episode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, externalId, seasons, episode);
    }

    @Override
    public String toString() {
        return slotKey();
    }
}
