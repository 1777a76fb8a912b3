package com.forrestgump.contactapi.infrastructure.config;

import com.forrestgump.contactapi.domain.exception.DuplicateSubmissionException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breakers for the store and the notification service. No retry is configured; each call is
 * attempted once per request.
 */
@Configuration
public class ResilienceConfig {

    @Bean(name = "dynamoCircuitBreaker")
    public CircuitBreaker dynamoCircuitBreaker() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(15))
                .permittedNumberOfCallsInHalfOpenState(5)
                .ignoreExceptions(DuplicateSubmissionException.class)
                .build();
        return CircuitBreaker.of("dynamoCircuitBreaker", config);
    }

    @Bean(name = "sesCircuitBreaker")
    public CircuitBreaker sesCircuitBreaker() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(20)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(5)
                .build();
        return CircuitBreaker.of("sesCircuitBreaker", config);
    }
}
