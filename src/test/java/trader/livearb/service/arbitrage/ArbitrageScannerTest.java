package trader.livearb.service.arbitrage;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import trader.livearb.config.ArbitrageProperties;
import trader.livearb.config.FeedProperties;
import trader.livearb.model.OpportunityRecord;
import trader.livearb.model.Quote;
import trader.livearb.store.MarketDataStores;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ArbitrageScanner")
class ArbitrageScannerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String PAIR = "SOL/USDT";

    private MarketDataStores stores;
    private ArbitrageProperties properties;
    private Counter counter;
    private ArbitrageScanner scanner;

    @BeforeEach
    void setUp() {
        stores = new MarketDataStores(new FeedProperties());
        properties = new ArbitrageProperties();
        counter = new SimpleMeterRegistry().counter("arbitrage.opportunities.detected");
        scanner = new ArbitrageScanner(stores, properties, Clock.fixed(NOW, ZoneOffset.UTC), counter);
    }

    private void quote(String exchange, String bid, String ask) {
        quote(PAIR, exchange, bid, ask, "2000000", null);
    }

    private void quote(String pair, String exchange, String bid, String ask, String liquidity, String fee) {
        stores.getQuotes().upsert(Quote.builder()
                .pair(pair)
                .exchange(exchange)
                .price(new BigDecimal(bid))
                .bid(new BigDecimal(bid))
                .ask(new BigDecimal(ask))
                .volume24h(BigDecimal.ZERO)
                .liquidity(new BigDecimal(liquidity))
                .feePercentage(fee == null ? null : new BigDecimal(fee))
                .timestampMs(NOW.toEpochMilli())
                .build());
    }

    @Nested
    @DisplayName("detection")
    class Detection {

        @Test
        @DisplayName("buys at the lowest ask and sells at the highest bid on another exchange")
        void crossExchangeSpread() {
            quote("ExA", "99.90", "100.00");
            quote("ExB", "98.95", "99.00");

            Optional<OpportunityRecord> result = scanner.scan(PAIR);

            assertThat(result).hasValueSatisfying(opportunity -> {
                assertThat(opportunity.getBuySide().getExchange()).isEqualTo("ExB");
                assertThat(opportunity.getBuySide().getPrice()).isEqualByComparingTo("99.00");
                assertThat(opportunity.getSellSide().getExchange()).isEqualTo("ExA");
                assertThat(opportunity.getSellSide().getPrice()).isEqualByComparingTo("99.90");
                assertThat(opportunity.getProfitPercentage()).isEqualByComparingTo("0.909091");
                assertThat(opportunity.getNetProfit()).isEqualByComparingTo("0.809091");
                assertThat(opportunity.getRequiredCapital()).isEqualByComparingTo("10000");
                assertThat(opportunity.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofSeconds(60)));
                assertThat(opportunity.getExecutionPath()).containsExactly("Buy on ExB", "Transfer", "Sell on ExA");
                assertThat(opportunity.getId()).startsWith("arb_" + NOW.toEpochMilli() + "_");
            });
            assertThat(stores.getOpportunities().size()).isEqualTo(1);
            assertThat(counter.count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("emits nothing when the best bid does not exceed the best ask")
        void noCrossedBook() {
            quote("ExA", "99.90", "100.00");
            quote("ExB", "99.95", "100.05");

            assertThat(scanner.scan(PAIR)).isEmpty();
            assertThat(stores.getOpportunities().size()).isZero();
        }

        @Test
        @DisplayName("emits nothing at or below the profit threshold")
        void belowThreshold() {
            quote("ExA", "100.10", "100.20");
            quote("ExB", "99.90", "100.00");

            assertThat(scanner.scan(PAIR)).isEmpty();
        }

        @Test
        @DisplayName("needs quotes from at least two exchanges")
        void singleExchange() {
            quote("ExA", "101.00", "99.00");

            assertThat(scanner.scan(PAIR)).isEmpty();
        }

        @Test
        @DisplayName("breaks price ties towards the lexically smallest exchange")
        void tieBreak() {
            quote("Kraken", "99.00", "100.00");
            quote("Coinbase", "99.00", "100.00");
            quote("Bybit", "101.00", "102.00");
            quote("Okx", "101.00", "102.00");

            assertThat(scanner.scan(PAIR)).hasValueSatisfying(opportunity -> {
                assertThat(opportunity.getBuySide().getExchange()).isEqualTo("Coinbase");
                assertThat(opportunity.getSellSide().getExchange()).isEqualTo("Bybit");
            });
        }

        @Test
        @DisplayName("subtracts the quoted fees of both legs from the net profit")
        void quotedFees() {
            quote(PAIR, "ExA", "101.00", "101.10", "2000000", "0.2");
            quote(PAIR, "ExB", "99.90", "100.00", "2000000", "0.1");

            assertThat(scanner.scan(PAIR)).hasValueSatisfying(opportunity ->
                    assertThat(opportunity.getNetProfit()).isEqualByComparingTo("0.7"));
        }
    }

    @Nested
    @DisplayName("confidence")
    class Confidence {

        @Test
        @DisplayName("never exceeds the configured cap")
        void capped() {
            quote("ExA", "110.00", "110.10");
            quote("ExB", "99.90", "100.00");

            assertThat(scanner.scan(PAIR)).hasValueSatisfying(opportunity ->
                    assertThat(opportunity.getConfidence()).isEqualTo(95.0));
        }

        @Test
        @DisplayName("grows with the thinner side's liquidity")
        void liquidityTerm() {
            assertThat(scanner.calculateConfidence(new BigDecimal("0.5"), new BigDecimal("500000")))
                    .isEqualTo(30.0 + 15.0 + 20.0);
            assertThat(scanner.calculateConfidence(new BigDecimal("0.5"), BigDecimal.ZERO))
                    .isEqualTo(45.0);
        }
    }

    @Nested
    @DisplayName("active opportunities")
    class Active {

        @Test
        @DisplayName("filters expired records and ranks by net profit")
        void filtersAndRanks() {
            stores.getOpportunities().upsert(OpportunityRecord.builder().id("stale").netProfit(new BigDecimal("5"))
                    .expiresAt(NOW.minusSeconds(1)).build());
            stores.getOpportunities().upsert(OpportunityRecord.builder().id("small").netProfit(new BigDecimal("0.2"))
                    .expiresAt(NOW.plusSeconds(30)).build());
            stores.getOpportunities().upsert(OpportunityRecord.builder().id("large").netProfit(new BigDecimal("0.8"))
                    .expiresAt(NOW.plusSeconds(30)).build());

            List<OpportunityRecord> active = scanner.getActiveOpportunities();

            assertThat(active).extracting(OpportunityRecord::getId).containsExactly("large", "small");
        }

        @Test
        @DisplayName("scanAll covers every quoted pair")
        void scanAll() {
            quote("ETH/USDT", "ExA", "3420", "3421", "2000000", null);
            quote("ETH/USDT", "ExB", "3399", "3400", "2000000", null);
            quote("ExA", "99.90", "100.00");
            quote("ExB", "98.95", "99.00");

            assertThat(scanner.scanAll()).extracting(OpportunityRecord::getPair)
                    .containsExactlyInAnyOrder("ETH/USDT", PAIR);
        }
    }
}
