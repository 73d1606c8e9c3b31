package com.signalbot.backend.service.signal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalbot.backend.model.CandidateSignal;
import com.signalbot.backend.model.Direction;
import com.signalbot.backend.model.MarketType;
import org.junit.jupiter.api.Test;

import static com.signalbot.backend.util.TestSignalFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;

class JsonSignalExtractorTest {

    private final JsonSignalExtractor extractor = new JsonSignalExtractor(new ObjectMapper());

    @Test
    void readsFencedSnakeCasePayload() {
        String content = """
                ```json
                {"symbol":"btc","direction":"long","entry_price":50000,"stop_loss":49000,
                 "take_profits":[50500,51000],"leverage":10,"trade_type":"futures","confidence":0.9}
                ```
                """;

        ExtractionResult result = extractor.extract(message(content));

        assertThat(result.isSignal()).isTrue();
        CandidateSignal signal = result.signal();
        assertThat(signal.symbol()).isEqualTo("BTCUSDT");
        assertThat(signal.direction()).isEqualTo(Direction.LONG);
        assertThat(signal.marketType()).isEqualTo(MarketType.FUTURES);
        assertThat(signal.entryPrice()).isEqualByComparingTo("50000");
        assertThat(signal.stopLoss()).isEqualByComparingTo("49000");
        assertThat(signal.takeProfits()).hasSize(2);
        assertThat(signal.leverage()).isEqualTo(10);
        assertThat(signal.sourceMessageId()).isEqualTo("m1");
        assertThat(signal.receivedAt()).isEqualTo(NOW);
    }

    @Test
    void readsCamelCaseMarketEntry() {
        String content = "{\"symbol\":\"ETHUSDT\",\"direction\":\"sell\",\"entryPrice\":\"market\","
                + "\"stopLoss\":\"3100\",\"takeProfits\":[\"2950\"]}";

        CandidateSignal signal = extractor.extract(message(content)).signal();

        assertThat(signal.symbol()).isEqualTo("ETHUSDT");
        assertThat(signal.direction()).isEqualTo(Direction.SHORT);
        assertThat(signal.marketEntry()).isTrue();
        assertThat(signal.entryPrice()).isNull();
        assertThat(signal.leverage()).isNull();
        assertThat(signal.confidence()).isZero();
    }

    @Test
    void errorFieldAndPlainTextAreNotSignals() {
        assertThat(extractor.extract(message("{\"error\":\"not a trading signal\"}")).outcome())
                .isEqualTo(ExtractionResult.Outcome.NOT_A_SIGNAL);
        assertThat(extractor.extract(message("BTC looks bullish today")).outcome())
                .isEqualTo(ExtractionResult.Outcome.NOT_A_SIGNAL);
    }

    @Test
    void brokenPayloadsFailToParse() {
        ExtractionResult malformed = extractor.extract(message("{\"symbol\":\"BTC\","));
        ExtractionResult noDirection = extractor.extract(message("{\"symbol\":\"BTC\",\"stop_loss\":49000}"));
        ExtractionResult badDirection = extractor.extract(message("{\"symbol\":\"BTC\",\"direction\":\"up\"}"));

        assertThat(malformed.outcome()).isEqualTo(ExtractionResult.Outcome.PARSE_FAILED);
        assertThat(noDirection.outcome()).isEqualTo(ExtractionResult.Outcome.PARSE_FAILED);
        assertThat(noDirection.detail()).contains("direction");
        assertThat(badDirection.outcome()).isEqualTo(ExtractionResult.Outcome.PARSE_FAILED);
    }

    private IncomingMessage message(String content) {
        return new IncomingMessage("m1", "vip-signals", content, null, NOW);
    }
}
