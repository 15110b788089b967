package trader.livearb.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import trader.livearb.config.FeedProperties;
import trader.livearb.model.DepthSnapshot;
import trader.livearb.model.MevAlert;
import trader.livearb.model.OpportunityRecord;
import trader.livearb.model.Quote;
import trader.livearb.model.RiskLevel;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MarketDataStores")
class MarketDataStoresTest {

    private MarketDataStores stores;

    @BeforeEach
    void setUp() {
        stores = new MarketDataStores(new FeedProperties());
    }

    private static Quote quote(String pair, String exchange, String price, long timestampMs) {
        BigDecimal value = new BigDecimal(price);
        return Quote.builder()
                .pair(pair)
                .exchange(exchange)
                .price(value)
                .bid(value)
                .ask(value)
                .volume24h(BigDecimal.ZERO)
                .liquidity(BigDecimal.ZERO)
                .timestampMs(timestampMs)
                .build();
    }

    @Test
    @DisplayName("keeps only the newest-timestamp quote per pair and exchange")
    void newestQuoteWins() {
        stores.getQuotes().upsert(quote("SOL/USDT", "Binance", "171.10", 2_000));

        boolean older = stores.getQuotes().upsert(quote("SOL/USDT", "Binance", "170.00", 1_000));
        boolean newer = stores.getQuotes().upsert(quote("SOL/USDT", "Binance", "171.50", 3_000));

        assertThat(older).isFalse();
        assertThat(newer).isTrue();
        assertThat(stores.quotesForPair("SOL/USDT"))
                .singleElement()
                .satisfies(q -> assertThat(q.getPrice()).isEqualByComparingTo("171.50"));
    }

    @Test
    @DisplayName("never holds more than 100 quotes")
    void quoteCapacity() {
        for (int i = 0; i < 150; i++) {
            stores.getQuotes().upsert(quote("P" + i + "/USDT", "Binance", "1", i));
        }

        assertThat(stores.getQuotes().size()).isEqualTo(100);
        assertThat(stores.quotesForPair("P0/USDT")).isEmpty();
        assertThat(stores.quotesForPair("P149/USDT")).hasSize(1);
    }

    @Test
    @DisplayName("holds at most 20 opportunities reflecting the latest update per id")
    void opportunityCapacityAndDedupe() {
        for (int i = 0; i < 25; i++) {
            stores.getOpportunities().upsert(OpportunityRecord.builder().id("arb_" + i).pair("ETH/USDT").build());
        }
        stores.getOpportunities().upsert(OpportunityRecord.builder().id("arb_24").pair("BTC/USDT").build());

        assertThat(stores.getOpportunities().size()).isEqualTo(20);
        assertThat(stores.getOpportunities().snapshot().get(0))
                .satisfies(o -> {
                    assertThat(o.getId()).isEqualTo("arb_24");
                    assertThat(o.getPair()).isEqualTo("BTC/USDT");
                });
        assertThat(stores.getOpportunities().find("arb_4")).isEmpty();
    }

    @Test
    @DisplayName("holds at most 10 MEV alerts, newest first")
    void mevAlertCapacity() {
        for (int i = 1; i <= 11; i++) {
            stores.getMevAlerts().upsert(MevAlert.builder()
                    .id("mev_" + i)
                    .threatType("Sandwiching")
                    .riskLevel(RiskLevel.HIGH)
                    .affectedTokens(Set.of("SOL"))
                    .timestampMs(i)
                    .build());
        }

        List<MevAlert> alerts = stores.getMevAlerts().snapshot();
        assertThat(alerts).hasSize(10);
        assertThat(alerts.get(0).getId()).isEqualTo("mev_11");
        assertThat(alerts.get(9).getId()).isEqualTo("mev_2");
        assertThat(stores.getMevAlerts().find("mev_1")).isEmpty();
    }

    @Test
    @DisplayName("holds at most 5 depth snapshots, newest first")
    void depthSnapshotCapacity() {
        for (long sequence = 1; sequence <= 6; sequence++) {
            stores.getDepthSnapshots().upsert(DepthSnapshot.builder()
                    .sequence(sequence)
                    .pair("SOL/USDT")
                    .bids(List.of())
                    .asks(List.of())
                    .timestampMs(sequence)
                    .build());
        }

        List<DepthSnapshot> snapshots = stores.getDepthSnapshots().snapshot();
        assertThat(snapshots).hasSize(5);
        assertThat(snapshots).extracting(DepthSnapshot::getSequence).containsExactly(6L, 5L, 4L, 3L, 2L);
    }
}
