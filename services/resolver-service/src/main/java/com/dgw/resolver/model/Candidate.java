package com.dgw.resolver.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One release under consideration, keyed by its lowercase content hash.
 *
 * <p>Instances are mutated while a resolution runs (cache matching promotes a version, filtering prunes
 * versions). Anything handed to a ranking profile must be a {@link #copy()}.
 */
public class Candidate {
    private String title;
    private List<String> languages = new ArrayList<>();
    private int resolution;
    private double sizeGb;
    private int seeders;
    private String source;
    private String hash;
    private String magnet;
    private MediaKind kind;
    private List<String> cached = new ArrayList<>();
    private List<Version> versions = new ArrayList<>();
    private int videoCount;
    private int episodeCount;
    private Set<Integer> seasons = new LinkedHashSet<>();

    public Candidate copy() {
        Candidate copy = new Candidate();
        copy.title = title;
        copy.languages = new ArrayList<>(languages);
        copy.resolution = resolution;
        copy.sizeGb = sizeGb;
        copy.seeders = seeders;
        copy.source = source;
        copy.hash = hash;
        copy.magnet = magnet;
        copy.kind = kind;
        copy.cached = new ArrayList<>(cached);
        copy.versions = new ArrayList<>(versions);
        copy.videoCount = videoCount;
        copy.episodeCount = episodeCount;
        copy.seasons = new LinkedHashSet<>(seasons);
        return copy;
    }

    public void promote(Version version) {
        this.sizeGb = version.getTotalSizeGb();
        this.videoCount = version.getVideoCount();
        this.episodeCount = version.getEpisodeCount();
        this.seasons = new LinkedHashSet<>(version.getSeasons());
    }

    public void addCachedProvider(String provider) {
        if (provider != null && !cached.contains(provider)) {
            cached.add(provider);
        }
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public List<String> getLanguages() {
        return languages;
    }

    public void setLanguages(List<String> languages) {
        this.languages = languages == null ? new ArrayList<>() : new ArrayList<>(languages);
    }

    public int getResolution() {
        return resolution;
    }

    public void setResolution(int resolution) {
        this.resolution = resolution;
    }

    public double getSizeGb() {
        return sizeGb;
    }

    public void setSizeGb(double sizeGb) {
        this.sizeGb = sizeGb;
    }

    public int getSeeders() {
        return seeders;
    }

    public void setSeeders(int seeders) {
        this.seeders = seeders;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getHash() {
        return hash;
    }

    public void setHash(String hash) {
        this.hash = hash;
    }

    public String getMagnet() {
        return magnet;
    }

    public void setMagnet(String magnet) {
        this.magnet = magnet;
    }

    public MediaKind getKind() {
        return kind;
    }

    public void setKind(MediaKind kind) {
        this.kind = kind;
    }

    public List<String> getCached() {
        return cached;
    }

    public void setCached(List<String> cached) {
        this.cached = cached == null ? new ArrayList<>() : new ArrayList<>(cached);
    }

    public List<Version> getVersions() {
        return versions;
    }

    public void setVersions(List<Version> versions) {
        this.versions = versions == null ? new ArrayList<>() : new ArrayList<>(versions);
    }

    public int getVideoCount() {
        return videoCount;
    }

    public int getEpisodeCount() {
        return episodeCount;
    }

    public Set<Integer> getSeasons() {
        return seasons;
    }

    @Override
    public String toString() {
        return "Candidate{" + hash + ", " + title + "}";
    }
}
