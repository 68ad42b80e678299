package com.dgw.resolver.api.dto;

import com.dgw.resolver.model.Candidate;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

public class ReleaseView {
    private String title;
    private List<String> languages;
    private int resolution;

    @JsonProperty("size_gb")
    private double sizeGb;

    private int seeders;
    private String source;
    private String hash;
    private String magnet;
    private String kind;
    private List<String> cached;
    private int videos;
    private int episodes;
    private List<Integer> seasons;
    private int versions;

    public static ReleaseView from(Candidate candidate) {
        ReleaseView view = new ReleaseView();
        view.title = candidate.getTitle();
        view.languages = new ArrayList<>(candidate.getLanguages());
        view.resolution = candidate.getResolution();
        view.sizeGb = candidate.getSizeGb();
        view.seeders = candidate.getSeeders();
        view.source = candidate.getSource();
        view.hash = candidate.getHash();
        view.magnet = candidate.getMagnet();
        view.kind = candidate.getKind() == null ? null : candidate.getKind().label();
        view.cached = new ArrayList<>(candidate.getCached());
        view.videos = candidate.getVideoCount();
        view.episodes = candidate.getEpisodeCount();
        view.seasons = new ArrayList<>(candidate.getSeasons());
        view.versions = candidate.getVersions().size();
        return view;
    }

    public static List<ReleaseView> fromAll(List<Candidate> candidates) {
        List<ReleaseView> views = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            views.add(from(candidate));
        }
        return views;
    }

    public String getTitle() {
        return title;
    }

    public List<String> getLanguages() {
        return languages;
    }

    public int getResolution() {
        return resolution;
    }

    public double getSizeGb() {
        return sizeGb;
    }

    public int getSeeders() {
        return seeders;
    }

    public String getSource() {
        return source;
    }

    public String getHash() {
        return hash;
    }

    public String getMagnet() {
        return magnet;
    }

    public String getKind() {
        return kind;
    }

    public List<String> getCached() {
        return cached;
    }

    public int getVideos() {
        return videos;
    }

    public int getEpisodes() {
        return episodes;
    }

    public List<Integer> getSeasons() {
        return seasons;
    }

    public int getVersions() {
        return versions;
    }
}
