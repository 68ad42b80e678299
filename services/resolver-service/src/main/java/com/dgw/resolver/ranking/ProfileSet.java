package com.dgw.resolver.ranking;

import java.util.List;

public record ProfileSet(List<RankingProfile> profiles, List<String> errors) {
    public ProfileSet {
        profiles = List.copyOf(profiles);
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty() && !profiles.isEmpty();
    }
}
