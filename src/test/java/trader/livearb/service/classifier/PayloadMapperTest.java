package trader.livearb.service.classifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import trader.livearb.config.ArbitrageProperties;
import trader.livearb.model.OpportunityRecord;
import trader.livearb.model.Quote;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PayloadMapper")
class PayloadMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PayloadMapper mapper = new PayloadMapper(new ArbitrageProperties());

    private JsonNode json(String value) throws Exception {
        return objectMapper.readTree(value);
    }

    @Nested
    @DisplayName("quotes")
    class Quotes {

        @Test
        @DisplayName("derives the price from the bid/ask midpoint when it is missing")
        void midpointPrice() throws Exception {
            List<Quote> quotes = mapper.toQuotes(json(
                    "{\"pair\":\"BTC/USDT\",\"exchange\":\"OKX\",\"bid\":94990,\"ask\":95010}"), 1000);

            assertThat(quotes).singleElement().satisfies(quote -> {
                assertThat(quote.getPrice()).isEqualByComparingTo("95000");
                assertThat(quote.getTimestampMs()).isEqualTo(1000);
                assertThat(quote.getFeePercentage()).isNull();
            });
        }

        @Test
        @DisplayName("uses the price for missing bid and ask and reads the fee alias")
        void priceOnly() throws Exception {
            Quote quote = mapper.toQuotes(json(
                    "{\"pair\":\"BTC/USDT\",\"exchange\":\"OKX\",\"price\":\"95000.5\",\"fee\":0.08,\"timestamp\":42}"), 1000)
                    .get(0);

            assertThat(quote.getBid()).isEqualByComparingTo("95000.5");
            assertThat(quote.getAsk()).isEqualByComparingTo("95000.5");
            assertThat(quote.getFeePercentage()).isEqualByComparingTo("0.08");
            assertThat(quote.getTimestampMs()).isEqualTo(42);
        }

        @Test
        @DisplayName("rejects a quote without any price")
        void noPrice() {
            assertThatThrownBy(() -> mapper.toQuotes(json("{\"pair\":\"BTC/USDT\",\"exchange\":\"OKX\"}"), 1000))
                    .isInstanceOf(MalformedPayloadException.class)
                    .hasMessageContaining("no price");
        }

        @Test
        @DisplayName("rejects a non-numeric price")
        void textPrice() {
            assertThatThrownBy(() -> mapper.toQuotes(
                    json("{\"pair\":\"BTC/USDT\",\"exchange\":\"OKX\",\"price\":\"lots\"}"), 1000))
                    .isInstanceOf(MalformedPayloadException.class);
        }
    }

    @Nested
    @DisplayName("opportunities")
    class Opportunities {

        @Test
        @DisplayName("reads nested exchange sides, ISO expiry and the execution path")
        void fullShape() throws Exception {
            OpportunityRecord record = mapper.toOpportunity(json("{\"id\":\"sim_arb_1\",\"pair\":\"SOL/USDT\","
                    + "\"buyExchange\":{\"name\":\"Kraken\",\"price\":171.0,\"liquidity\":500000,\"fee\":0.1},"
                    + "\"sellExchange\":{\"name\":\"Gemini\",\"price\":171.5},"
                    + "\"profitPercentage\":0.29,\"netProfit\":0.09,\"confidence\":140,"
                    + "\"expiresAt\":\"2026-03-01T12:01:00Z\","
                    + "\"executionPath\":[\"Buy on Kraken\",\"Transfer\",\"Sell on Gemini\"]}"), 0);

            assertThat(record.getBuySide().getExchange()).isEqualTo("Kraken");
            assertThat(record.getSellSide().getPrice()).isEqualByComparingTo("171.5");
            assertThat(record.getConfidence()).isEqualTo(100.0);
            assertThat(record.getExpiresAt()).isEqualTo(Instant.parse("2026-03-01T12:01:00Z"));
            assertThat(record.getExecutionPath()).containsExactly("Buy on Kraken", "Transfer", "Sell on Gemini");
        }

        @Test
        @DisplayName("reads the compact shape and defaults the expiry to the configured lifetime")
        void compactShape() throws Exception {
            OpportunityRecord record = mapper.toOpportunity(json("{\"id\":\"arb_9\",\"pair\":\"ETH/USDT\","
                    + "\"exchanges\":[\"Bybit\",\"Gate.io\"],\"profit_percentage\":0.3,\"estimated_profit\":30}"), 10_000);

            assertThat(record.getBuySide().getExchange()).isEqualTo("Bybit");
            assertThat(record.getSellSide().getExchange()).isEqualTo("Gate.io");
            assertThat(record.getNetProfit()).isEqualByComparingTo("30");
            assertThat(record.getExpiresAt()).isEqualTo(Instant.ofEpochMilli(70_000));
        }

        @Test
        @DisplayName("requires an id")
        void missingId() {
            assertThatThrownBy(() -> mapper.toOpportunity(json("{\"pair\":\"ETH/USDT\"}"), 0))
                    .isInstanceOf(MalformedPayloadException.class)
                    .hasMessageContaining("id");
        }
    }
}
