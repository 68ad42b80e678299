package com.dgw.resolver.coalesce;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "resolver.coalescer")
public class CoalescerProperties {
    private long debounceQuietMs = 1000;

    public long getDebounceQuietMs() {
        return debounceQuietMs;
    }

    public void setDebounceQuietMs(long debounceQuietMs) {
        this.debounceQuietMs = debounceQuietMs;
    }
}
