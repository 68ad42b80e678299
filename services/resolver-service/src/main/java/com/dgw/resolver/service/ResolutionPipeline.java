package com.dgw.resolver.service;

import com.dgw.resolver.debrid.AvailabilityMatcher;
import com.dgw.resolver.filter.TypeSeasonFilter;
import com.dgw.resolver.model.Candidate;
import com.dgw.resolver.model.MediaTarget;
import com.dgw.resolver.model.RawRelease;
import com.dgw.resolver.parse.TitleParser;
import com.dgw.resolver.source.SourceAdapter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ResolutionPipeline {
    private static final Logger log = LoggerFactory.getLogger(ResolutionPipeline.class);

    private final SourceAdapter sourceAdapter;
    private final TitleParser titleParser;
    private final AvailabilityMatcher availabilityMatcher;
    private final TypeSeasonFilter typeSeasonFilter;

    public ResolutionPipeline(
        SourceAdapter sourceAdapter,
        TitleParser titleParser,
        AvailabilityMatcher availabilityMatcher,
        TypeSeasonFilter typeSeasonFilter
    ) {
        this.sourceAdapter = sourceAdapter;
        this.titleParser = titleParser;
        this.availabilityMatcher = availabilityMatcher;
        this.typeSeasonFilter = typeSeasonFilter;
    }

    public List<Candidate> run(MediaTarget target) {
        long started = System.nanoTime();
        List<RawRelease> entries = sourceAdapter.search(target);
        List<Candidate> parsed = titleParser.parseAll(entries);
        List<Candidate> cached = availabilityMatcher.match(parsed);
        List<Candidate> kept = typeSeasonFilter.apply(cached, target);
        log.info("pipeline done target={} entries={} parsed={} cached={} kept={} took_ms={}",
            target.slotKey(), entries.size(), parsed.size(), cached.size(), kept.size(),
            (System.nanoTime() - started) / 1_000_000L);
        return kept;
    }
}
