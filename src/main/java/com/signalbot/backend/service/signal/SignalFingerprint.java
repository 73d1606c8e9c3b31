package com.signalbot.backend.service.signal;

import com.signalbot.backend.model.CandidateSignal;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Content hash of symbol, direction, entry, stop and the arrival time bucket. A re-delivery that lands in
 * the neighbouring bucket is matched through {@link #candidateKeys()}.
 */
public record SignalFingerprint(String content, long bucket) {

    public static SignalFingerprint of(CandidateSignal signal, long bucketSeconds) {
        String content = String.join("|",
                signal.symbol(),
                signal.direction().name(),
                plain(signal.entryPrice()),
                plain(signal.stopLoss()));
        long bucket = signal.receivedAt().getEpochSecond() / Math.max(1, bucketSeconds);
        return new SignalFingerprint(content, bucket);
    }

    public String key() {
        return keyFor(bucket);
    }

    public List<String> candidateKeys() {
        return List.of(keyFor(bucket - 1), keyFor(bucket), keyFor(bucket + 1));
    }

    private String keyFor(long b) {
        return sha256(content + "|" + b);
    }

    private static String plain(BigDecimal value) {
        return value == null ? "market" : value.stripTrailingZeros().toPlainString();
    }

    private static String sha256(String raw) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(raw.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
