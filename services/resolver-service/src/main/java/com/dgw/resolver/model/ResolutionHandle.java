package com.dgw.resolver.model;

import java.util.List;

public record ResolutionHandle(String id, List<Candidate> candidates) {
    public ResolutionHandle {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public int size() {
        return candidates.size();
    }
}
