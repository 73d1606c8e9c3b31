package com.signalbot.backend.exchange;

import com.signalbot.backend.exception.ExchangeErrorType;
import com.signalbot.backend.exception.TransientTransportException;
import com.signalbot.backend.model.MarketType;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Supplier;

/**
 * Wraps an exchange transport with the process-wide rate limit, circuit breaker and transient-error retry.
 * Order placements carry a client order id so a retried submission is deduplicated by the venue.
 */
@Slf4j
public class ResilientExchangeGateway implements ExchangeGateway {

    private final ExchangeGateway delegate;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final Retry retry;

    public ResilientExchangeGateway(ExchangeGateway delegate, CircuitBreaker circuitBreaker,
                                    RateLimiter rateLimiter, Retry retry) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.retry = retry;
        retry.getEventPublisher().onRetry(event -> log.warn("Exchange call retry #{} after: {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "n/a"));
    }

    @Override
    public ExchangeOrder placeLimitOrder(OrderRequest request) {
        return call("placeLimitOrder", () -> delegate.placeLimitOrder(request));
    }

    @Override
    public ExchangeOrder placeStopOrder(OrderRequest request) {
        return call("placeStopOrder", () -> delegate.placeStopOrder(request));
    }

    @Override
    public ExchangeOrder placeTakeProfitOrder(OrderRequest request) {
        return call("placeTakeProfitOrder", () -> delegate.placeTakeProfitOrder(request));
    }

    @Override
    public void cancelOrder(String symbol, MarketType marketType, String orderId) {
        call("cancelOrder", () -> {
            delegate.cancelOrder(symbol, marketType, orderId);
            return null;
        });
    }

    @Override
    public void setLeverage(String symbol, int leverage) {
        call("setLeverage", () -> {
            delegate.setLeverage(symbol, leverage);
            return null;
        });
    }

    @Override
    public List<ExchangePosition> fetchOpenPositions() {
        return call("fetchOpenPositions", delegate::fetchOpenPositions);
    }

    @Override
    public ExchangeOrder fetchOrderStatus(String symbol, MarketType marketType, String orderId) {
        return call("fetchOrderStatus", () -> delegate.fetchOrderStatus(symbol, marketType, orderId));
    }

    @Override
    public Balance fetchBalance() {
        return call("fetchBalance", delegate::fetchBalance);
    }

    private <T> T call(String operation, Supplier<T> supplier) {
        Supplier<T> decorated = CircuitBreaker.decorateSupplier(circuitBreaker, supplier);
        decorated = RateLimiter.decorateSupplier(rateLimiter, decorated);
        decorated = Retry.decorateSupplier(retry, decorated);
        try {
            return decorated.get();
        } catch (RequestNotPermitted e) {
            throw TransientTransportException.rateLimited("Local exchange rate limit exhausted for " + operation);
        } catch (CallNotPermittedException e) {
            throw new TransientTransportException(ExchangeErrorType.NETWORK,
                    "Exchange circuit open, " + operation + " not attempted", e);
        }
    }
}
