package com.dgw.resolver.config;

import com.dgw.resolver.coalesce.CoalescerProperties;
import com.dgw.resolver.coalesce.RequestCoalescer;
import com.dgw.resolver.coalesce.SearchDebouncer;
import com.dgw.resolver.model.Candidate;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CoalescerProperties.class)
public class ResolverConfig {

    @Bean
    public RequestCoalescer<List<Candidate>> resolutionCoalescer(MeterRegistry meterRegistry) {
        return new RequestCoalescer<>(meterRegistry);
    }

    @Bean
    public SearchDebouncer searchDebouncer(CoalescerProperties properties) {
        return new SearchDebouncer(Duration.ofMillis(properties.getDebounceQuietMs()));
    }
}
