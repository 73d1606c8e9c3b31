package com.signalbot.backend.service.signal;

import com.signalbot.backend.model.CandidateSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fingerprints of accepted signals with their acceptance time. Entries only leave by TTL expiry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessedSignalCache {

    private final Clock clock;
    private final Map<String, Instant> seen = new ConcurrentHashMap<>();

    @Value("${signals.fingerprint-ttl:PT30M}")
    private Duration ttl;

    @Value("${signals.bucket-seconds:300}")
    private long bucketSeconds;

    public SignalFingerprint fingerprint(CandidateSignal signal) {
        return SignalFingerprint.of(signal, bucketSeconds);
    }

    public boolean contains(SignalFingerprint fingerprint) {
        Instant now = Instant.now(clock);
        return fingerprint.candidateKeys().stream().anyMatch(key -> isLive(seen.get(key), now));
    }

    /**
     * Records the fingerprint unless a live entry already matches it.
     *
     * @return false for a duplicate
     */
    public synchronized boolean tryRecord(SignalFingerprint fingerprint) {
        if (contains(fingerprint)) {
            return false;
        }
        seen.put(fingerprint.key(), Instant.now(clock));
        return true;
    }

    public int size() {
        return seen.size();
    }

    @Scheduled(fixedDelayString = "${signals.evict-interval-ms:60000}")
    public void evictExpired() {
        Instant now = Instant.now(clock);
        int before = seen.size();
        seen.entrySet().removeIf(entry -> !isLive(entry.getValue(), now));
        int evicted = before - seen.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired signal fingerprint(s)", evicted);
        }
    }

    private boolean isLive(Instant recordedAt, Instant now) {
        return recordedAt != null && recordedAt.plus(ttl).isAfter(now);
    }
}
