package com.signalbot.backend.exchange;

import com.signalbot.backend.config.TradingMode;
import com.signalbot.backend.config.TradingProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.math.BigDecimal;
import java.util.Optional;

@Slf4j
@Configuration
public class ExchangeGatewayConfig {

    @Bean
    public PaperExchangeGateway paperExchangeGateway(
            @Value("${exchange.paper.starting-balance:10000}") BigDecimal startingBalance) {
        return new PaperExchangeGateway(startingBalance);
    }

    /**
     * The gateway every component talks to. LIVE mode needs a transport bean named
     * {@code liveExchangeTransport}; DEMO mode runs against the paper exchange.
     */
    @Bean
    @Primary
    public ExchangeGateway exchangeGateway(TradingProperties tradingProperties,
                                           PaperExchangeGateway paperExchangeGateway,
                                           @Qualifier("liveExchangeTransport") Optional<ExchangeGateway> liveExchangeTransport,
                                           CircuitBreaker exchangeCircuitBreaker,
                                           @Qualifier("exchangeRateLimiter") RateLimiter exchangeRateLimiter,
                                           @Qualifier("exchangeRetry") Retry exchangeRetry) {
        ExchangeGateway transport;
        if (tradingProperties.getMode() == TradingMode.LIVE) {
            transport = liveExchangeTransport.orElseThrow(() -> new IllegalStateException(
                    "LIVE mode requires an ExchangeGateway bean named 'liveExchangeTransport'"));
            log.warn("Exchange gateway running in LIVE mode");
        } else {
            transport = paperExchangeGateway;
            log.info("Exchange gateway running in DEMO mode against the paper exchange");
        }
        return new ResilientExchangeGateway(transport, exchangeCircuitBreaker, exchangeRateLimiter, exchangeRetry);
    }
}
