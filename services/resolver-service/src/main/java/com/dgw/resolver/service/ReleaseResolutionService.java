package com.dgw.resolver.service;

import com.dgw.resolver.catalog.QueryIdentifier;
import com.dgw.resolver.coalesce.RequestCoalescer;
import com.dgw.resolver.coalesce.SearchDebouncer;
import com.dgw.resolver.common.ReleaseTable;
import com.dgw.resolver.ledger.SelectionLedger;
import com.dgw.resolver.model.Candidate;
import com.dgw.resolver.model.MediaTarget;
import com.dgw.resolver.model.ResolutionHandle;
import com.dgw.resolver.ranking.RankingEngine;
import com.dgw.resolver.ranking.RankingProfile;
import com.dgw.resolver.ranking.ProfileRegistry;
import com.dgw.resolver.resilience.ExternalCallException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ReleaseResolutionService {
    private static final Logger log = LoggerFactory.getLogger(ReleaseResolutionService.class);
    private static final String SEARCH_SLOT_PREFIX = "search:";

    private final ResolutionPipeline pipeline;
    private final QueryIdentifier queryIdentifier;
    private final RequestCoalescer<List<Candidate>> coalescer;
    private final SearchDebouncer debouncer;
    private final ProfileRegistry profileRegistry;
    private final RankingEngine rankingEngine;
    private final SelectionLedger ledger;
    private final Counter pipelineRuns;
    private final Counter pipelineFailures;
    private final Counter searchSuperseded;

    public ReleaseResolutionService(
        ResolutionPipeline pipeline,
        QueryIdentifier queryIdentifier,
        RequestCoalescer<List<Candidate>> coalescer,
        SearchDebouncer debouncer,
        ProfileRegistry profileRegistry,
        RankingEngine rankingEngine,
        SelectionLedger ledger,
        MeterRegistry meterRegistry
    ) {
        this.pipeline = pipeline;
        this.queryIdentifier = queryIdentifier;
        this.coalescer = coalescer;
        this.debouncer = debouncer;
        this.profileRegistry = profileRegistry;
        this.rankingEngine = rankingEngine;
        this.ledger = ledger;
        this.pipelineRuns = meterRegistry.counter("resolver_pipeline_runs_total");
        this.pipelineFailures = meterRegistry.counter("resolver_pipeline_failures_total");
        this.searchSuperseded = meterRegistry.counter("resolver_search_superseded_total");
    }

    public Map<String, ResolutionHandle> resolve(MediaTarget target, Collection<String> profileNames) {
        List<RankingProfile> profiles = profileRegistry.select(profileNames);
        String slotKey = target.slotKey();
        List<Candidate> snapshot = coalescer.acquireOrAwait(slotKey,
            () -> runPipeline(slotKey, () -> pipeline.run(target)));
        return publish(slotKey, snapshot, profiles);
    }

    public Map<String, ResolutionHandle> resolveSearch(String query, Collection<String> profileNames) {
        List<RankingProfile> profiles = profileRegistry.select(profileNames);
        if (query == null || query.isBlank()) {
            return Map.of();
        }
        String normalized = query.trim();
        boolean current;
        try {
            current = debouncer.awaitQuiet(normalized);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("search wait interrupted query={}", normalized);
            return Map.of();
        }
        if (!current) {
            searchSuperseded.increment();
            log.info("search superseded query={}", normalized);
            return Map.of();
        }
        String slotKey = SEARCH_SLOT_PREFIX + normalized;
        List<Candidate> snapshot = coalescer.acquireOrAwait(slotKey, () -> runPipeline(slotKey,
            () -> queryIdentifier.identify(normalized).map(pipeline::run).orElseGet(() -> {
                log.info("query not identified query={}", normalized);
                return List.of();
            })));
        return publish(slotKey, snapshot, profiles);
    }

    public Candidate selectForDownload(String handleId, int offset) {
        return ledger.get(handleId, offset).orElseThrow(() -> new HandleNotFoundException(handleId, offset));
    }

    private List<Candidate> runPipeline(String slotKey, Supplier<List<Candidate>> work) {
        pipelineRuns.increment();
        try {
            return List.copyOf(work.get());
        } catch (ExternalCallException e) {
            pipelineFailures.increment();
            log.warn("pipeline failed slot={} call={} status={}", slotKey, e.getCallName(), e.getStatus());
            throw new ResolutionFailedException(slotKey, e);
        }
    }

    private Map<String, ResolutionHandle> publish(String slotKey, List<Candidate> snapshot,
        List<RankingProfile> profiles) {
        Map<String, ResolutionHandle> results = new LinkedHashMap<>();
        for (RankingProfile profile : profiles) {
            List<Candidate> copies = new ArrayList<>(snapshot.size());
            for (Candidate candidate : snapshot) {
                copies.add(candidate.copy());
            }
            List<Candidate> ranked = rankingEngine.rank(copies, profile);
            ResolutionHandle handle = ledger.put(ranked);
            results.put(profile.getName(), handle);
            log.info("profile ranked slot={} profile={} handle={} releases={}", slotKey, profile.getName(),
                handle.id(), ranked.size());
            if (log.isInfoEnabled()) {
                ReleaseTable.render(ranked).forEach(log::info);
            }
        }
        return results;
    }
}
