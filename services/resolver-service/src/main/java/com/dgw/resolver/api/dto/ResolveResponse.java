package com.dgw.resolver.api.dto;

import com.dgw.resolver.model.ResolutionHandle;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ResolveResponse {
    private Map<String, ProfileResult> results = new LinkedHashMap<>();

    public static ResolveResponse from(Map<String, ResolutionHandle> handles) {
        ResolveResponse response = new ResolveResponse();
        handles.forEach((profile, handle) -> {
            ProfileResult result = new ProfileResult();
            result.setHandle(handle.id());
            result.setReleases(ReleaseView.fromAll(handle.candidates()));
            response.results.put(profile, result);
        });
        return response;
    }

    public Map<String, ProfileResult> getResults() {
        return results;
    }

    public void setResults(Map<String, ProfileResult> results) {
        this.results = results;
    }

    public static class ProfileResult {
        private String handle;
        private List<ReleaseView> releases;

        public String getHandle() {
            return handle;
        }

        public void setHandle(String handle) {
            this.handle = handle;
        }

        public List<ReleaseView> getReleases() {
            return releases;
        }

        public void setReleases(List<ReleaseView> releases) {
            this.releases = releases;
        }
    }
}
