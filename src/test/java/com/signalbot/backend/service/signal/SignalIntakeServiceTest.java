package com.signalbot.backend.service.signal;

import com.signalbot.backend.model.CandidateSignal;
import com.signalbot.backend.model.RejectionReason;
import com.signalbot.backend.service.MetricsService;
import com.signalbot.backend.service.notification.TradeNotifier;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;

import static com.signalbot.backend.util.TestSignalFactory.NOW;
import static com.signalbot.backend.util.TestSignalFactory.btcLong;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SignalIntakeServiceTest {

    private static final String ALERT = "BTC long entry 50000 sl 49000 tp 50500 / 51000";

    private SignalExtractor extractor;
    private SignalPipelineService pipeline;
    private TradeNotifier notifier;

    @BeforeEach
    void setUp() {
        extractor = mock(SignalExtractor.class);
        pipeline = mock(SignalPipelineService.class);
        notifier = mock(TradeNotifier.class);
        when(extractor.extract(any())).thenReturn(ExtractionResult.signal(btcLong()));
        when(pipeline.submit(any())).thenAnswer(invocation ->
                PipelineResult.accepted("msg-1", "T-0000000000000001"));
    }

    @Test
    void dropsChatterBeforeCallingExtractor() {
        SignalIntakeService intake = intake(generousLimiter());

        assertThat(intake.onMessage(message("m1", "hi", null)).status())
                .isEqualTo(SignalIntakeService.IntakeResult.Status.FILTERED);
        assertThat(intake.onMessage(message("m2", "lunch at noon today?", null)).status())
                .isEqualTo(SignalIntakeService.IntakeResult.Status.FILTERED);
        verify(extractor, never()).extract(any());
    }

    @Test
    void imageAlertBypassesKeywordFilter() {
        SignalIntakeService intake = intake(generousLimiter());

        SignalIntakeService.IntakeResult result = intake.onMessage(message("m1", "", "https://cdn.example/chart.png"));

        assertThat(result.status()).isEqualTo(SignalIntakeService.IntakeResult.Status.SUBMITTED);
        verify(extractor).extract(any());
    }

    @Test
    void extractedSignalIsSubmittedToPipeline() {
        SignalIntakeService intake = intake(generousLimiter());

        SignalIntakeService.IntakeResult result = intake.onMessage(message("m1", ALERT, null));

        assertThat(result.status()).isEqualTo(SignalIntakeService.IntakeResult.Status.SUBMITTED);
        assertThat(result.pipelineResult().tradeId()).isEqualTo("T-0000000000000001");
    }

    @Test
    void nonSignalAndParseFailureAreDropped() {
        SignalIntakeService intake = intake(generousLimiter());
        when(extractor.extract(any()))
                .thenReturn(ExtractionResult.notASignal("market commentary"))
                .thenReturn(ExtractionResult.parseFailed("Malformed JSON"));

        assertThat(intake.onMessage(message("m1", ALERT, null)).status())
                .isEqualTo(SignalIntakeService.IntakeResult.Status.NOT_A_SIGNAL);
        assertThat(intake.onMessage(message("m2", ALERT + " update", null)).status())
                .isEqualTo(SignalIntakeService.IntakeResult.Status.PARSE_FAILED);
        verify(pipeline, never()).submit(any());
    }

    @Test
    void extractorCeilingRejectsWithoutCallingModel() {
        RateLimiter oneCall = RateLimiter.of("extractor-test", RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        SignalIntakeService intake = intake(oneCall);

        intake.onMessage(message("m1", ALERT, null));
        SignalIntakeService.IntakeResult second = intake.onMessage(message("m2", "ETH short entry 3000 sl 3100", null));

        assertThat(second.status()).isEqualTo(SignalIntakeService.IntakeResult.Status.REJECTED);
        assertThat(second.pipelineResult().rejection().reason()).isEqualTo(RejectionReason.EXTRACTOR_RATE_LIMITED);
        verify(extractor, times(1)).extract(any());
        verify(notifier).signalRejected(eq("m2"), any(), any());
    }

    @Test
    void repeatedContentReusesExtraction() {
        SignalIntakeService intake = intake(generousLimiter());

        intake.onMessage(message("m1", ALERT, null));
        intake.onMessage(message("m2", ALERT, null));

        verify(extractor, times(1)).extract(any());
        ArgumentCaptor<CandidateSignal> captor = ArgumentCaptor.forClass(CandidateSignal.class);
        verify(pipeline, times(2)).submit(captor.capture());
        assertThat(captor.getAllValues().get(1).sourceMessageId()).isEqualTo("m2");
    }

    private SignalIntakeService intake(RateLimiter limiter) {
        return new SignalIntakeService(extractor, pipeline, notifier, mock(MetricsService.class), limiter);
    }

    private RateLimiter generousLimiter() {
        return RateLimiter.of("extractor-test", RateLimiterConfig.custom()
                .limitForPeriod(100)
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO)
                .build());
    }

    private IncomingMessage message(String id, String content, String imageUrl) {
        return new IncomingMessage(id, "vip-signals", content, imageUrl, NOW);
    }
}
