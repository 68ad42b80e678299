package com.dgw.resolver.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dgw.resolver.catalog.QueryIdentifier;
import com.dgw.resolver.coalesce.RequestCoalescer;
import com.dgw.resolver.coalesce.SearchDebouncer;
import com.dgw.resolver.ledger.LedgerProperties;
import com.dgw.resolver.ledger.SelectionLedger;
import com.dgw.resolver.model.Candidate;
import com.dgw.resolver.model.MediaTarget;
import com.dgw.resolver.model.ResolutionHandle;
import com.dgw.resolver.ranking.ProfileLoader;
import com.dgw.resolver.ranking.ProfileProperties;
import com.dgw.resolver.ranking.ProfileRegistry;
import com.dgw.resolver.ranking.RankingEngine;
import com.dgw.resolver.ranking.UnknownProfileException;
import com.dgw.resolver.resilience.ExternalCallException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReleaseResolutionServiceTest {

    @Mock
    private ResolutionPipeline pipeline;

    @Mock
    private QueryIdentifier queryIdentifier;

    private SimpleMeterRegistry meterRegistry;
    private SelectionLedger ledger;
    private ReleaseResolutionService service;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ledger = new SelectionLedger(new LedgerProperties());
        ProfileProperties profileProperties = new ProfileProperties();
        profileProperties.setPath("classpath:profiles.yml");
        ProfileRegistry registry = new ProfileRegistry(new ProfileLoader(), profileProperties);
        registry.init();
        service = new ReleaseResolutionService(
            pipeline,
            queryIdentifier,
            new RequestCoalescer<>(meterRegistry),
            new SearchDebouncer(Duration.ofMillis(200)),
            registry,
            new RankingEngine(),
            ledger,
            meterRegistry
        );
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void eachProfileGetsItsOwnHandleAndOrdering() {
        MediaTarget target = MediaTarget.movie("tt1");
        when(pipeline.run(target)).thenReturn(List.of(
            candidate("hd-big", 1080, 20.0, 10),
            candidate("uhd", 2160, 40.0, 3),
            candidate("hd-small", 1080, 4.0, 90)
        ));

        Map<String, ResolutionHandle> results = service.resolve(target, List.of("best", "small"));

        assertThat(results).containsOnlyKeys("best", "small");
        assertThat(results.get("best").candidates()).extracting(Candidate::getTitle)
            .containsExactly("uhd", "hd-big", "hd-small");
        assertThat(results.get("small").candidates()).extracting(Candidate::getTitle)
            .containsExactly("hd-small");
        assertThat(results.get("best").id()).isNotEqualTo(results.get("small").id());
        assertThat(service.selectForDownload(results.get("small").id(), 0).getTitle()).isEqualTo("hd-small");
        assertThat(meterRegistry.counter("resolver_pipeline_runs_total").count()).isEqualTo(1.0);
    }

    @Test
    void profilesRankIndependentCopies() {
        MediaTarget target = MediaTarget.movie("tt1");
        when(pipeline.run(target)).thenReturn(List.of(candidate("a", 1080, 2.0, 1)));

        Map<String, ResolutionHandle> results = service.resolve(target, List.of("best", "small"));

        assertThat(results.get("best").candidates().get(0))
            .isNotSameAs(results.get("small").candidates().get(0));
    }

    @Test
    void concurrentResolvesOfSameTargetRunPipelineOnce() throws Exception {
        MediaTarget target = MediaTarget.show("tt2", List.of(1), null);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(pipeline.run(target)).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of(candidate("pack", 1080, 10.0, 5));
        });

        List<Future<Map<String, ResolutionHandle>>> calls = new ArrayList<>();
        calls.add(executor.submit(() -> service.resolve(target, List.of("best"))));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        for (int i = 0; i < 3; i++) {
            calls.add(executor.submit(() -> service.resolve(MediaTarget.show("tt2", List.of(1), null), List.of("best"))));
        }
        awaitWaiters(3);
        release.countDown();

        for (Future<Map<String, ResolutionHandle>> call : calls) {
            assertThat(call.get(5, TimeUnit.SECONDS).get("best").candidates())
                .extracting(Candidate::getTitle).containsExactly("pack");
        }
        verify(pipeline, times(1)).run(any());
    }

    @Test
    void upstreamFailureBecomesResolutionFailure() {
        MediaTarget target = MediaTarget.movie("tt3");
        when(pipeline.run(target)).thenThrow(new ExternalCallException("torrentio_stream", "unavailable"));

        assertThatThrownBy(() -> service.resolve(target, List.of()))
            .isInstanceOf(ResolutionFailedException.class)
            .hasCauseInstanceOf(ExternalCallException.class);
        assertThat(meterRegistry.counter("resolver_pipeline_failures_total").count()).isEqualTo(1.0);
    }

    @Test
    void unknownProfileRejectedBeforeAnyWork() {
        assertThatThrownBy(() -> service.resolve(MediaTarget.movie("tt4"), List.of("nope")))
            .isInstanceOf(UnknownProfileException.class);
        verify(pipeline, never()).run(any());
    }

    @Test
    void supersededSearchReturnsNothing() throws Exception {
        MediaTarget target = MediaTarget.movie("tt1160419");
        when(queryIdentifier.identify("dune")).thenReturn(Optional.of(target));
        when(pipeline.run(target)).thenReturn(List.of(candidate("dune", 2160, 30.0, 50)));

        Future<Map<String, ResolutionHandle>> first = executor.submit(() -> service.resolveSearch("dun", List.of("best")));
        Thread.sleep(50);
        Future<Map<String, ResolutionHandle>> second = executor.submit(() -> service.resolveSearch("dune", List.of("best")));

        assertThat(first.get(5, TimeUnit.SECONDS)).isEmpty();
        assertThat(second.get(5, TimeUnit.SECONDS).get("best").candidates())
            .extracting(Candidate::getTitle).containsExactly("dune");
        assertThat(meterRegistry.counter("resolver_search_superseded_total").count()).isEqualTo(1.0);
        verify(queryIdentifier, never()).identify("dun");
    }

    @Test
    void unidentifiedSearchGivesEmptyHandles() {
        when(queryIdentifier.identify("zzzz")).thenReturn(Optional.empty());

        Map<String, ResolutionHandle> results = service.resolveSearch("zzzz", List.of("best"));

        assertThat(results.get("best").size()).isZero();
        verify(pipeline, never()).run(any());
    }

    @Test
    void missingSelectionIsNotFound() {
        assertThatThrownBy(() -> service.selectForDownload("missing", 0))
            .isInstanceOf(HandleNotFoundException.class);
    }

    private void awaitWaiters(int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (meterRegistry.counter("resolver_coalesced_waits_total").count() < expected
            && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    private static Candidate candidate(String title, int resolution, double sizeGb, int seeders) {
        Candidate candidate = new Candidate();
        candidate.setTitle(title);
        candidate.setHash(title);
        candidate.setResolution(resolution);
        candidate.setSizeGb(sizeGb);
        candidate.setSeeders(seeders);
        candidate.setSource("WEB");
        candidate.setLanguages(List.of("EN"));
        return candidate;
    }
}
