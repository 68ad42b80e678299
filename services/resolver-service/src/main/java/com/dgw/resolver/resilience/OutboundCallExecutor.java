package com.dgw.resolver.resilience;

import io.micrometer.core.instrument.MeterRegistry;
import java.net.SocketTimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

@Component
public class OutboundCallExecutor {
    private static final Logger log = LoggerFactory.getLogger(OutboundCallExecutor.class);

    private final MeterRegistry meterRegistry;

    public OutboundCallExecutor(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public <T> T execute(String callName, RetryProperties retry, Supplier<T> call) {
        int retries = Math.max(0, retry.getRetryCount());
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return call.get();
            } catch (ResourceAccessException e) {
                String reason = e.getCause() instanceof SocketTimeoutException ? "timeout" : "unavailable";
                if (attempt >= retries) {
                    log.warn("outbound call failed call={} reason={} attempts={}", callName, reason, attempt + 1);
                    throw new ExternalCallException(callName, reason, null, e);
                }
                log.debug("outbound call retry call={} reason={} attempt={}", callName, reason, attempt + 1);
            } catch (HttpStatusCodeException e) {
                int status = e.getStatusCode().value();
                if (!retry.isRetryable(status)) {
                    log.warn("outbound call rejected call={} status={}", callName, status);
                    throw new ExternalCallException(callName, "http_" + status, status, e);
                }
                if (attempt >= retries) {
                    log.warn("outbound call failed call={} status={} attempts={}", callName, status, attempt + 1);
                    throw new ExternalCallException(callName, "http_" + status, status, e);
                }
                log.debug("outbound call retry call={} status={} attempt={}", callName, status, attempt + 1);
            }
            meterRegistry.counter("resolver_outbound_retries_total", "call", callName).increment();
            pause(callName, retry.getBackoffMs());
        }
        throw new ExternalCallException(callName, "unavailable");
    }

    private void pause(String callName, long backoffMs) {
        if (backoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalCallException(callName, "interrupted", null, e);
        }
    }
}
