package trader.livearb.service;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import trader.livearb.config.FeedProperties;
import trader.livearb.model.ConnectionStatus;
import trader.livearb.model.DepthSnapshot;
import trader.livearb.model.ExecutionUpdate;
import trader.livearb.model.MevAlert;
import trader.livearb.model.OpportunityRecord;
import trader.livearb.model.Quote;
import trader.livearb.model.Subscription;
import trader.livearb.service.arbitrage.ArbitrageScanner;
import trader.livearb.service.connection.FeedConnectionManager;
import trader.livearb.service.subscription.SubscriptionRegistry;
import trader.livearb.store.MarketDataStores;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Read model and lifecycle entry point for the presentation layer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiveMarketService {

    private final FeedConnectionManager connectionManager;
    private final SubscriptionRegistry subscriptionRegistry;
    private final ArbitrageScanner scanner;
    private final MarketDataStores stores;
    private final FeedProperties feedProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void initAfterStartup() {
        if (!feedProperties.isAutoConnect()) {
            log.info("Feed auto-connect disabled, waiting for an explicit open");
            return;
        }
        try {
            log.info("Initializing live market feed ({} mode)...", feedProperties.getMode());
            connectionManager.open();
        } catch (Exception e) {
            log.error("Failed to initialize live market feed: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        connectionManager.close();
    }

    public void open() {
        connectionManager.open();
    }

    public void close() {
        connectionManager.close();
    }

    public ConnectionStatus status() {
        return connectionManager.status();
    }

    public List<Quote> quotes(String pair) {
        return pair == null ? stores.getQuotes().snapshot() : stores.quotesForPair(pair);
    }

    public List<OpportunityRecord> opportunities(boolean activeOnly) {
        return activeOnly ? scanner.getActiveOpportunities() : stores.getOpportunities().snapshot();
    }

    public List<MevAlert> mevAlerts() {
        return stores.getMevAlerts().snapshot();
    }

    public List<DepthSnapshot> depthSnapshots() {
        return stores.getDepthSnapshots().snapshot();
    }

    public List<ExecutionUpdate> executions() {
        return stores.getExecutions().snapshot();
    }

    public Set<Subscription> subscriptions() {
        return subscriptionRegistry.subscriptions();
    }

    public void subscribe(Collection<String> channels, Collection<String> pairs) {
        subscriptionRegistry.subscribe(channels, pairs);
    }

    public void unsubscribe(Collection<String> channels) {
        subscriptionRegistry.unsubscribe(channels);
    }
}
