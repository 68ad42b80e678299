package com.dgw.resolver.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class ResolveRequest {
    private String kind;

    @JsonProperty("external_id")
    private String externalId;

    private List<Integer> seasons;
    private Integer episode;
    private List<String> profiles;

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getExternalId() {
        return externalId;
    }

    public void setExternalId(String externalId) {
        this.externalId = externalId;
    }

    public List<Integer> getSeasons() {
        return seasons;
    }

    public void setSeasons(List<Integer> seasons) {
        this.seasons = seasons;
    }

    public Integer getEpisode() {
        return episode;
    }

    public void setEpisode(Integer episode) {
        this.episode = episode;
    }

    public List<String> getProfiles() {
        return profiles;
    }

    public void setProfiles(List<String> profiles) {
        this.profiles = profiles;
    }
}
