package com.signalbot.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Service
@Slf4j
public class AsyncDelayService {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "poll-delay");
        thread.setDaemon(true);
        return thread;
    });

    /**
     * Blocks the calling thread for {@code millis}.
     *
     * @return false when the wait was interrupted; the interrupt flag is restored
     */
    public boolean awaitMillis(long millis) {
        return await(Duration.ofMillis(millis));
    }

    public boolean await(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return true;
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        scheduler.schedule(() -> future.complete(null), duration.toMillis(), TimeUnit.MILLISECONDS);
        try {
            future.get();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Delay of {} interrupted", duration);
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Delay failed", e.getCause());
        }
    }
}
