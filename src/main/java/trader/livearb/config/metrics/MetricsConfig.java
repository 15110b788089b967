package trader.livearb.config.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import trader.livearb.service.arbitrage.ArbitrageOpportunityProvider;
import trader.livearb.store.MarketDataStores;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter arbitrageOpportunityCounter(MeterRegistry registry) {
        return Counter.builder("arbitrage.opportunities.detected")
                .description("Number of arbitrage opportunities detected")
                .register(registry);
    }

    @Bean
    public Gauge arbitrageOpportunitiesGauge(MeterRegistry registry, ArbitrageOpportunityProvider opportunityProvider) {
        return Gauge.builder("arbitrage.opportunities.active",
                        () -> opportunityProvider.getActiveOpportunities().size())
                .description("Current number of unexpired arbitrage opportunities")
                .register(registry);
    }

    @Bean
    public Gauge retainedQuotesGauge(MeterRegistry registry, MarketDataStores stores) {
        return Gauge.builder("feed.quotes.retained", () -> stores.getQuotes().size())
                .description("Quotes currently held in the quote store")
                .register(registry);
    }
}
