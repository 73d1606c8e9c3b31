package com.signalbot.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Single reference to the current {@link TradingConfigSnapshot}. Swapped atomically, so readers
 * never observe a half-applied reload.
 */
@Slf4j
@Component
public class TradingConfigHolder {

    private final AtomicLong versions = new AtomicLong();
    private final AtomicReference<TradingConfigSnapshot> current;

    public TradingConfigHolder(TradingProperties properties) {
        this.current = new AtomicReference<>(TradingConfigSnapshot.from(properties, versions.incrementAndGet()));
    }

    public TradingConfigSnapshot current() {
        return current.get();
    }

    public TradingConfigSnapshot publish(TradingConfigSnapshot snapshot) {
        TradingConfigSnapshot versioned = snapshot.toBuilder().version(versions.incrementAndGet()).build();
        TradingConfigSnapshot previous = current.getAndSet(versioned);
        log.info("Trading config v{} published (previous v{})", versioned.version(), previous.version());
        return versioned;
    }

    public TradingConfigSnapshot update(UnaryOperator<TradingConfigSnapshot> change) {
        return publish(change.apply(current()));
    }
}
