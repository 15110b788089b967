package trader.livearb.store;

import lombok.Getter;
import org.springframework.stereotype.Component;
import trader.livearb.config.FeedProperties;
import trader.livearb.model.DepthSnapshot;
import trader.livearb.model.ExecutionUpdate;
import trader.livearb.model.MevAlert;
import trader.livearb.model.OpportunityRecord;
import trader.livearb.model.Quote;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The bounded buffers the feed writes into and the presentation layer reads from.
 */
@Getter
@Component
public class MarketDataStores {

    private final RetentionStore<Quote.Key, Quote> quotes;
    private final RetentionStore<String, OpportunityRecord> opportunities;
    private final RetentionStore<String, MevAlert> mevAlerts;
    private final RetentionStore<Long, DepthSnapshot> depthSnapshots;
    private final RetentionStore<String, ExecutionUpdate> executions;

    public MarketDataStores(FeedProperties feedProperties) {
        FeedProperties.Retention retention = feedProperties.getRetention();
        this.quotes = new RetentionStore<>("quotes", Quote::key, RetentionOrder.OLDEST_FIRST,
                retention.getQuotes(),
                (existing, incoming) -> incoming.getTimestampMs() >= existing.getTimestampMs());
        this.opportunities = new RetentionStore<>("opportunities", OpportunityRecord::getId,
                RetentionOrder.NEWEST_FIRST, retention.getOpportunities());
        this.mevAlerts = new RetentionStore<>("mevAlerts", MevAlert::getId,
                RetentionOrder.NEWEST_FIRST, retention.getMevAlerts());
        this.depthSnapshots = new RetentionStore<>("depthSnapshots", DepthSnapshot::getSequence,
                RetentionOrder.NEWEST_FIRST, retention.getDepthSnapshots());
        this.executions = new RetentionStore<>("executions", ExecutionUpdate::getOpportunityId,
                RetentionOrder.NEWEST_FIRST, retention.getExecutions());
    }

    public List<Quote> quotesForPair(String pair) {
        return quotes.snapshot().stream()
                .filter(quote -> quote.getPair().equals(pair))
                .collect(Collectors.toList());
    }
}
