package com.signalbot.backend.service.signal;

import com.signalbot.backend.model.CandidateSignal;
import com.signalbot.backend.model.Rejection;
import com.signalbot.backend.model.RejectionReason;
import com.signalbot.backend.service.MetricsService;
import com.signalbot.backend.service.notification.TradeNotifier;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entry point for raw alerts. Drops obvious chatter, calls the extractor under its own rate limit and
 * forwards extracted candidates to the pipeline. Non-signals and parse failures are logged and dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalIntakeService {

    static final int MIN_CONTENT_LENGTH = 10;
    static final List<String> TRADING_KEYWORDS = List.of(
            "buy", "sell", "long", "short", "entry", "exit", "tp", "sl",
            "take profit", "stop loss", "leverage", "usdt", "btc", "eth",
            "target", "price", "position");
    private static final int EXTRACTION_CACHE_SIZE = 100;

    private final SignalExtractor signalExtractor;
    private final SignalPipelineService pipelineService;
    private final TradeNotifier tradeNotifier;
    private final MetricsService metricsService;
    @Qualifier("extractorRateLimiter")
    private final RateLimiter extractorRateLimiter;

    // identical content (e.g. an edited re-post) reuses the earlier extraction instead of another model call
    private final Map<String, CandidateSignal> extractionCache = new LinkedHashMap<>(16, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, CandidateSignal> eldest) {
            return size() > EXTRACTION_CACHE_SIZE;
        }
    };

    public IntakeResult onMessage(IncomingMessage message) {
        MDC.put("signalId", String.valueOf(message.messageId()));
        try {
            if (!passesPreFilter(message)) {
                log.debug("Message {} from {} dropped by pre-filter", message.messageId(), message.channel());
                return IntakeResult.dropped(IntakeResult.Status.FILTERED, "No trading content");
            }
            String cacheKey = cacheKey(message);
            CandidateSignal cached = cacheKey == null ? null : cachedCandidate(cacheKey);
            if (cached != null) {
                log.debug("Reusing extraction for message {} ({})", message.messageId(), cached.symbol());
                return forward(cached.toBuilder()
                        .sourceMessageId(message.messageId())
                        .receivedAt(message.receivedAt() != null ? message.receivedAt() : cached.receivedAt())
                        .build());
            }

            ExtractionResult extraction;
            try {
                extraction = RateLimiter.decorateSupplier(extractorRateLimiter,
                        () -> signalExtractor.extract(message)).get();
            } catch (RequestNotPermitted e) {
                Rejection rejection = Rejection.of(RejectionReason.EXTRACTOR_RATE_LIMITED,
                        "Extractor request ceiling reached, message " + message.messageId() + " not processed");
                log.warn(rejection.detail());
                metricsService.recordReject(rejection.reason());
                tradeNotifier.signalRejected(message.messageId(), null, rejection);
                return IntakeResult.rejected(PipelineResult.rejected(message.messageId(), rejection));
            } catch (RuntimeException e) {
                log.warn("Extraction of message {} failed: {}", message.messageId(), e.getMessage());
                return IntakeResult.dropped(IntakeResult.Status.PARSE_FAILED, e.getMessage());
            }

            switch (extraction.outcome()) {
                case NOT_A_SIGNAL -> {
                    log.info("Message {} is not a signal: {}", message.messageId(), extraction.detail());
                    return IntakeResult.dropped(IntakeResult.Status.NOT_A_SIGNAL, extraction.detail());
                }
                case PARSE_FAILED -> {
                    log.warn("Message {} could not be parsed: {}", message.messageId(), extraction.detail());
                    return IntakeResult.dropped(IntakeResult.Status.PARSE_FAILED, extraction.detail());
                }
                default -> {
                    if (cacheKey != null) {
                        cache(cacheKey, extraction.signal());
                    }
                    return forward(extraction.signal());
                }
            }
        } finally {
            MDC.remove("signalId");
        }
    }

    boolean passesPreFilter(IncomingMessage message) {
        if (message.hasImage()) {
            return true;
        }
        String text = message.text().trim();
        if (text.length() < MIN_CONTENT_LENGTH) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return TRADING_KEYWORDS.stream().anyMatch(lower::contains);
    }

    private IntakeResult forward(CandidateSignal candidate) {
        PipelineResult result = pipelineService.submit(candidate);
        return result.isAccepted() ? IntakeResult.submitted(result) : IntakeResult.rejected(result);
    }

    private String cacheKey(IncomingMessage message) {
        if (message.hasImage()) {
            return null;
        }
        String text = message.text();
        return text.length() > 500 ? text.substring(0, 500) : text;
    }

    private synchronized CandidateSignal cachedCandidate(String key) {
        return extractionCache.get(key);
    }

    private synchronized void cache(String key, CandidateSignal candidate) {
        extractionCache.put(key, candidate);
    }

    public record IntakeResult(Status status, PipelineResult pipelineResult, String detail) {

        public enum Status {
            FILTERED,
            NOT_A_SIGNAL,
            PARSE_FAILED,
            REJECTED,
            SUBMITTED
        }

        static IntakeResult dropped(Status status, String detail) {
            return new IntakeResult(status, null, detail);
        }

        static IntakeResult rejected(PipelineResult result) {
            return new IntakeResult(Status.REJECTED, result,
                    result.rejection() == null ? null : result.rejection().reason().name());
        }

        static IntakeResult submitted(PipelineResult result) {
            return new IntakeResult(Status.SUBMITTED, result, result.tradeId());
        }
    }
}
