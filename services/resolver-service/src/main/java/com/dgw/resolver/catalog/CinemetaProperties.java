package com.dgw.resolver.catalog;

import com.dgw.resolver.resilience.RetryProperties;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "resolver.cinemeta")
public class CinemetaProperties {
    private String baseUrl = "https://v3-cinemeta.strem.io";
    private int timeoutMs = 10000;
    private RetryProperties retry = new RetryProperties(2, List.of(429, 503), 500);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }
}
