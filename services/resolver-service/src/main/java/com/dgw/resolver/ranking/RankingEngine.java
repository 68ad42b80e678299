package com.dgw.resolver.ranking;

import com.dgw.resolver.model.Candidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class RankingEngine {
    private static final Comparator<Candidate> EPISODES_DESC =
        Comparator.comparingInt(Candidate::getEpisodeCount).reversed();

    public List<Candidate> rank(List<Candidate> candidates, RankingProfile profile) {
        List<Candidate> ranked = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (passes(candidate, profile.getFilters())) {
                ranked.add(candidate);
            }
        }
        ranked.sort(EPISODES_DESC);
        for (SortKey rule : profile.getSortRules()) {
            ranked.sort(rule.descending());
        }
        if (ranked.size() > profile.getResultLimit()) {
            return new ArrayList<>(ranked.subList(0, profile.getResultLimit()));
        }
        return ranked;
    }

    private boolean passes(Candidate candidate, List<ReleaseExpression> filters) {
        for (ReleaseExpression filter : filters) {
            if (!filter.test(candidate)) {
                return false;
            }
        }
        return true;
    }
}
