package com.dgw.resolver.resilience;

import java.util.ArrayList;
import java.util.List;

public class RetryProperties {
    private int retryCount = 2;
    private List<Integer> retryableStatuses = new ArrayList<>(List.of(429, 503));
    private long backoffMs = 1000;

    public RetryProperties() {
    }

    public RetryProperties(int retryCount, List<Integer> retryableStatuses, long backoffMs) {
        this.retryCount = retryCount;
        this.retryableStatuses = new ArrayList<>(retryableStatuses);
        this.backoffMs = backoffMs;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public List<Integer> getRetryableStatuses() {
        return retryableStatuses;
    }

    public void setRetryableStatuses(List<Integer> retryableStatuses) {
        this.retryableStatuses = retryableStatuses;
    }

    public long getBackoffMs() {
        return backoffMs;
    }

    public void setBackoffMs(long backoffMs) {
        this.backoffMs = backoffMs;
    }

    public boolean isRetryable(int status) {
        return retryableStatuses != null && retryableStatuses.contains(status);
    }
}
