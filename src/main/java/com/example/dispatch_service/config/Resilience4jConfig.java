package com.example.dispatch_service.config;

import com.example.dispatch_service.exception.DispatchException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.cloud.circuitbreaker.resilience4j.Resilience4JCircuitBreakerFactory;
import org.springframework.cloud.circuitbreaker.resilience4j.Resilience4JConfigBuilder;
import org.springframework.cloud.client.circuitbreaker.Customizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class Resilience4jConfig {

    @Bean
    public Customizer<Resilience4JCircuitBreakerFactory> storageCircuitBreakerCustomizer(DispatchProperties properties) {
        // 비즈니스 예외(여정 없음, 권한 없음 등)는 장애로 집계하지 않음
        CircuitBreakerConfig circuitBreakerConfig = CircuitBreakerConfig.custom()
                                                                        .ignoreExceptions(DispatchException.class)
                                                                        .build();

        TimeLimiterConfig timeLimiterConfig = TimeLimiterConfig.custom()
                                                               .timeoutDuration(properties.getStorage().getTimeout()
                                                                                          .plus(properties.getStorage().getTimeLimiterMargin()))
                                                               .build();

        return factory -> factory.configureDefault(id -> new Resilience4JConfigBuilder(id)
                .circuitBreakerConfig(circuitBreakerConfig)
                .timeLimiterConfig(timeLimiterConfig)
                .build());
    }
}
