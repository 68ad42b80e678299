package com.dgw.resolver.debrid;

import com.dgw.resolver.resilience.RetryProperties;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "resolver.realdebrid")
public class RealDebridProperties {
    private String baseUrl = "https://api.real-debrid.com/rest/1.0";
    private String apiKey;
    private String providerCode = "RD";
    private int timeoutMs = 60000;
    private RetryProperties retry = new RetryProperties(2, List.of(429, 503, 404, 400, 500), 1000);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getProviderCode() {
        return providerCode;
    }

    public void setProviderCode(String providerCode) {
        this.providerCode = providerCode;
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
