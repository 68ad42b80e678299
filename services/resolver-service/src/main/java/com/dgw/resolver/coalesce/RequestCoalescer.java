package com.dgw.resolver.coalesce;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-flight execution per slot key. The first caller on an idle slot runs the work; callers arriving while
 * it runs wait for and share its outcome, success or failure. The slot is idle again once the work returns or
 * throws.
 */
public class RequestCoalescer<T> {
    private static final Logger log = LoggerFactory.getLogger(RequestCoalescer.class);

    private final ConcurrentHashMap<String, CompletableFuture<T>> inFlight = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public RequestCoalescer(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public T acquireOrAwait(String slotKey, Supplier<T> work) {
        CompletableFuture<T> mine = new CompletableFuture<>();
        CompletableFuture<T> running = inFlight.putIfAbsent(slotKey, mine);
        if (running != null) {
            meterRegistry.counter("resolver_coalesced_waits_total").increment();
            log.debug("slot busy, awaiting result slot={}", slotKey);
            return await(running);
        }
        try {
            T result = work.get();
            mine.complete(result);
            return result;
        } catch (RuntimeException | Error ex) {
            mine.completeExceptionally(ex);
            throw ex;
        } finally {
            inFlight.remove(slotKey, mine);
        }
    }

    public boolean isResolving(String slotKey) {
        return inFlight.containsKey(slotKey);
    }

    private T await(CompletableFuture<T> running) {
        try {
            return running.join();
        } catch (CompletionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw ex;
        }
    }
}
