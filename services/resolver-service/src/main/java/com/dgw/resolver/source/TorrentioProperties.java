package com.dgw.resolver.source;

import com.dgw.resolver.resilience.RetryProperties;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "resolver.torrentio")
public class TorrentioProperties {
    private String baseUrl = "https://torrentio.strem.fun";
    private String options = "sort=qualitysize|qualityfilter=480p,scr,cam";
    private int timeoutMs = 60000;
    private RetryProperties retry = new RetryProperties(2, List.of(429, 503), 1000);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getOptions() {
        return options;
    }

    public void setOptions(String options) {
        this.options = options;
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
