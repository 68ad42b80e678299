package com.dgw.resolver.ranking;

import java.util.List;

public final class RankingProfile {
    private final String name;
    private final int resultLimit;
    private final List<ReleaseExpression> filters;
    private final List<SortKey> sortRules;

    public RankingProfile(String name, int resultLimit, List<ReleaseExpression> filters, List<SortKey> sortRules) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("profile name is required");
        }
        if (resultLimit < 1) {
            throw new IllegalArgumentException("resultLimit must be positive: " + name);
        }
        this.name = name;
        this.resultLimit = resultLimit;
        this.filters = filters == null ? List.of() : List.copyOf(filters);
        this.sortRules = sortRules == null ? List.of() : List.copyOf(sortRules);
    }

    public String getName() {
        return name;
    }

    public int getResultLimit() {
        return resultLimit;
    }

    public List<ReleaseExpression> getFilters() {
        return filters;
    }

    public List<SortKey> getSortRules() {
        return sortRules;
    }
}
