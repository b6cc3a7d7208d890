package com.clinicdocs.search.config;

import com.clinicdocs.search.infra.InMemoryDualRateLimiter;
import com.clinicdocs.search.infra.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("ocrLimiter")
    public RateLimiter ocrLimiter(
        @Value("${app.ocr.requests-per-minute:60}") int requestsPerMinute,
        @Value("${app.ocr.kilobytes-per-minute:512000}") int kilobytesPerMinute) {
        return new InMemoryDualRateLimiter(requestsPerMinute, kilobytesPerMinute);
    }
}
