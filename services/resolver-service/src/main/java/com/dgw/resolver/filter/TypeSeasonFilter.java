package com.dgw.resolver.filter;

import com.dgw.resolver.model.Candidate;
import com.dgw.resolver.model.MediaKind;
import com.dgw.resolver.model.MediaTarget;
import com.dgw.resolver.model.Version;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Structural accept/reject of cached candidates against the requested target.
 *
 * <p>A candidate is judged on its promoted aggregates, then its versions are pruned with the same rule.
 * Candidates left without versions are dropped. Removal is final for the resolution.
 */
@Component
public class TypeSeasonFilter {
    private static final Logger log = LoggerFactory.getLogger(TypeSeasonFilter.class);

    public List<Candidate> apply(List<Candidate> candidates, MediaTarget target) {
        List<Candidate> kept = new ArrayList<>();
        if (candidates == null) {
            return kept;
        }
        for (Candidate candidate : candidates) {
            if (!accepts(target, candidate.getVideoCount(), candidate.getEpisodeCount(), candidate.getSeasons())) {
                continue;
            }
            List<Version> versions = new ArrayList<>(candidate.getVersions().size());
            for (Version version : candidate.getVersions()) {
                if (accepts(target, version.getVideoCount(), version.getEpisodeCount(), version.getSeasons())) {
                    versions.add(version);
                }
            }
            if (versions.isEmpty()) {
                continue;
            }
            candidate.setVersions(versions);
            candidate.setKind(target.getKind());
            kept.add(candidate);
        }
        log.info("type filter done target={} in={} kept={}", target.slotKey(),
            candidates.size(), kept.size());
        return kept;
    }

    boolean accepts(MediaTarget target, int videoCount, int episodeCount, Set<Integer> seasons) {
        if (target.getKind() == MediaKind.MOVIE) {
            return videoCount > 0;
        }
        Set<Integer> requested = target.getSeasons();
        Set<Integer> missing = new HashSet<>(requested);
        missing.removeAll(seasons);
        if (requested.size() > 1) {
            return missing.size() <= requested.size() / 2.0 && episodeCount > 1;
        }
        if (!target.hasEpisode()) {
            return missing.isEmpty() && episodeCount > 1;
        }
        return missing.isEmpty() && episodeCount == 1;
    }
}
