package com.authplatform.authsvc.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ObservabilityConfig {

    @Bean
    public Counter rateLimitCounter(MeterRegistry registry) {
        return Counter.builder("auth.rate.limit.exceeded.total")
                .description("Requests rejected by the rate limiter")
                .tag("service", "auth-service")
                .register(registry);
    }

    @Bean
    public Counter refreshCounter(MeterRegistry registry) {
        return Counter.builder("auth.token.refresh.total")
                .description("Successful refresh-token rotations")
                .tag("service", "auth-service")
                .register(registry);
    }

    @Bean
    public Counter failedSignInCounter(MeterRegistry registry) {
        return Counter.builder("auth.signin.failed.total")
                .description("Rejected credential sign-ins")
                .tag("service", "auth-service")
                .register(registry);
    }
}
