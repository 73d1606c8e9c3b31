package com.signalbot.backend.config;

import com.signalbot.backend.exception.TransientTransportException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ExchangeResilienceConfig {

    @Bean
    public CircuitBreaker exchangeCircuitBreaker(
            @Value("${exchange.resilience.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${exchange.resilience.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${exchange.resilience.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                // venue rejections are business outcomes, not transport health
                .recordExceptions(TransientTransportException.class)
                .build();
        return CircuitBreaker.of("exchange", config);
    }

    @Bean
    public RateLimiter exchangeRateLimiter(
            @Value("${exchange.resilience.rate.limit-per-second:10}") int limitPerSecond,
            @Value("${exchange.resilience.rate.timeout-ms:2000}") long timeoutMs
    ) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(limitPerSecond)
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .build();
        return RateLimiter.of("exchange", config);
    }

    @Bean
    public Retry exchangeRetry(
            @Value("${exchange.resilience.retry.max-attempts:3}") int maxAttempts,
            @Value("${exchange.resilience.retry.base-delay-ms:500}") long baseDelayMs,
            @Value("${exchange.resilience.retry.jitter-factor:0.2}") double jitterFactor
    ) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(baseDelayMs),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryExceptions(TransientTransportException.class)
                .build();
        return Retry.of("exchange", config);
    }

    @Bean
    public Retry protectiveOrderRetry(ExecutionProperties executionProperties) {
        ExecutionProperties.ProtectiveRetry cfg = executionProperties.getProtectiveRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(cfg.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Duration.ofMillis(Math.max(1, cfg.getInitialBackoffMs())), cfg.getMultiplier()))
                .retryExceptions(RuntimeException.class)
                .build();
        return Retry.of("protective-order", config);
    }

    @Bean
    public RateLimiter extractorRateLimiter(
            @Value("${extractor.rate.requests-per-minute:15}") int requestsPerMinute,
            @Value("${extractor.rate.max-wait-seconds:30}") long maxWaitSeconds
    ) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(requestsPerMinute)
                .timeoutDuration(Duration.ofSeconds(maxWaitSeconds))
                .build();
        return RateLimiter.of("signal-extractor", config);
    }
}
