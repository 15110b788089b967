package trader.livearb.service.arbitrage;

import io.micrometer.core.instrument.Counter;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import trader.livearb.config.ArbitrageProperties;
import trader.livearb.model.ExchangeSide;
import trader.livearb.model.OpportunityRecord;
import trader.livearb.model.Quote;
import trader.livearb.store.MarketDataStores;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Matches the best ask against the best bid across exchanges for a pair and records an
 * opportunity when the spread clears the profit threshold.
 */
@Slf4j
@Service
public class ArbitrageScanner implements ArbitrageOpportunityProvider {

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final BigDecimal TWO = new BigDecimal("2");

    private static final double BASE_CONFIDENCE = 30.0;
    private static final double PROFIT_WEIGHT = 30.0;
    // profit in percent at which the profit term saturates
    private static final double PROFIT_SATURATION = 1.0;
    private static final double LIQUIDITY_WEIGHT = 40.0;

    private static final Comparator<Quote> BEST_BUY = Comparator.comparing(Quote::getAsk)
            .thenComparing(Quote::getExchange);
    private static final Comparator<Quote> BEST_SELL = Comparator.comparing(Quote::getBid).reversed()
            .thenComparing(Quote::getExchange);
    private static final Comparator<OpportunityRecord> BY_NET_PROFIT = Comparator.comparing(
            OpportunityRecord::getNetProfit, Comparator.nullsLast(Comparator.reverseOrder()));

    private final MarketDataStores stores;
    private final ArbitrageProperties properties;
    private final Clock clock;
    private final Counter arbitrageOpportunityCounter;
    private final AtomicLong sequence = new AtomicLong();

    public ArbitrageScanner(MarketDataStores stores,
                            ArbitrageProperties properties,
                            Clock clock,
                            Counter arbitrageOpportunityCounter) {
        this.stores = stores;
        this.properties = properties;
        this.clock = clock;
        this.arbitrageOpportunityCounter = arbitrageOpportunityCounter;
    }

    /**
     * Scans the given pairs and returns what was emitted, best net profit first.
     */
    @Observed(name = "arbitrage.scan", contextualName = "scan-pairs")
    public List<OpportunityRecord> scanPairs(Collection<String> pairs) {
        List<OpportunityRecord> emitted = new ArrayList<>();
        for (String pair : pairs) {
            scan(pair).ifPresent(emitted::add);
        }
        emitted.sort(BY_NET_PROFIT);
        return emitted;
    }

    public List<OpportunityRecord> scanAll() {
        List<String> pairs = stores.getQuotes().snapshot().stream()
                .map(Quote::getPair)
                .distinct()
                .collect(Collectors.toList());
        return scanPairs(pairs);
    }

    public Optional<OpportunityRecord> scan(String pair) {
        List<Quote> quotes = stores.quotesForPair(pair).stream()
                .filter(ArbitrageScanner::isTradable)
                .collect(Collectors.toList());
        if (quotes.size() < 2) {
            log.debug("Not enough exchanges quoting {} to check for arbitrage", pair);
            return Optional.empty();
        }

        Quote bestBuy = quotes.stream().min(BEST_BUY).orElseThrow();
        Quote bestSell = quotes.stream().min(BEST_SELL).orElseThrow();
        if (bestBuy.getExchange().equals(bestSell.getExchange())
                || bestSell.getBid().compareTo(bestBuy.getAsk()) <= 0) {
            return Optional.empty();
        }

        BigDecimal profitPercentage = calculateProfitPercentage(bestBuy.getAsk(), bestSell.getBid());
        if (profitPercentage.compareTo(properties.getThreshold()) <= 0) {
            log.debug("Spread on {} below threshold: {}%", pair, profitPercentage);
            return Optional.empty();
        }

        BigDecimal buyFee = feeFor(bestBuy);
        BigDecimal sellFee = feeFor(bestSell);
        BigDecimal minLiquidity = bestBuy.getLiquidity().min(bestSell.getLiquidity());
        Instant now = clock.instant();

        OpportunityRecord opportunity = OpportunityRecord.builder()
                .id("arb_" + now.toEpochMilli() + "_" + sequence.incrementAndGet())
                .pair(pair)
                .buySide(side(bestBuy, bestBuy.getAsk(), buyFee))
                .sellSide(side(bestSell, bestSell.getBid(), sellFee))
                .profitPercentage(profitPercentage)
                .netProfit(profitPercentage.subtract(buyFee).subtract(sellFee))
                .requiredCapital(properties.getRequiredCapital())
                .confidence(calculateConfidence(profitPercentage, minLiquidity))
                .expiresAt(now.plus(properties.getOpportunityTtl()))
                .step("Buy on " + bestBuy.getExchange())
                .step("Transfer")
                .step("Sell on " + bestSell.getExchange())
                .build();

        stores.getOpportunities().upsert(opportunity);
        arbitrageOpportunityCounter.increment();
        logArbitrageOpportunity(opportunity);
        return Optional.of(opportunity);
    }

    /**
     * Stored opportunities that have not expired, best net profit first.
     */
    @Override
    public List<OpportunityRecord> getActiveOpportunities() {
        Instant now = clock.instant();
        return stores.getOpportunities().snapshot().stream()
                .filter(opportunity -> !opportunity.isExpired(now))
                .sorted(BY_NET_PROFIT)
                .collect(Collectors.toList());
    }

    protected BigDecimal calculateProfitPercentage(BigDecimal buyPrice, BigDecimal sellPrice) {
        return sellPrice.subtract(buyPrice)
                .divide(buyPrice, 8, RoundingMode.HALF_UP)
                .multiply(HUNDRED)
                .setScale(6, RoundingMode.HALF_UP);
    }

    /**
     * Grows with the profit and with the thinner side's liquidity, never above the configured cap.
     */
    protected double calculateConfidence(BigDecimal profitPercentage, BigDecimal minLiquidity) {
        double profitTerm = Math.min(profitPercentage.doubleValue() / PROFIT_SATURATION, 1.0) * PROFIT_WEIGHT;
        double liquidityRatio = properties.getLiquidityReference().signum() > 0
                ? minLiquidity.divide(properties.getLiquidityReference(), 8, RoundingMode.HALF_UP).doubleValue()
                : 1.0;
        double liquidityTerm = Math.min(Math.max(liquidityRatio, 0.0), 1.0) * LIQUIDITY_WEIGHT;
        double confidence = BASE_CONFIDENCE + profitTerm + liquidityTerm;
        return Math.max(0.0, Math.min(confidence, properties.getConfidenceCap()));
    }

    private BigDecimal feeFor(Quote quote) {
        if (quote.getFeePercentage() != null) {
            return quote.getFeePercentage();
        }
        return properties.getDefaultFeePercentage().divide(TWO, 8, RoundingMode.HALF_UP);
    }

    private static ExchangeSide side(Quote quote, BigDecimal price, BigDecimal fee) {
        return ExchangeSide.builder()
                .exchange(quote.getExchange())
                .price(price)
                .liquidity(quote.getLiquidity())
                .fee(fee)
                .build();
    }

    private static boolean isTradable(Quote quote) {
        return quote.getBid() != null && quote.getAsk() != null
                && quote.getBid().signum() > 0 && quote.getAsk().signum() > 0;
    }

    private void logArbitrageOpportunity(OpportunityRecord opportunity) {
        log.info("🚨 ARBITRAGE OPPORTUNITY DETECTED 🚨");
        log.info("Pair: {}", opportunity.getPair());
        log.info("Buy on {} at {}", opportunity.getBuySide().getExchange(), opportunity.getBuySide().getPrice());
        log.info("Sell on {} at {}", opportunity.getSellSide().getExchange(), opportunity.getSellSide().getPrice());
        log.info("Profit: {}% (net {}%), confidence {}",
                opportunity.getProfitPercentage(), opportunity.getNetProfit(),
                String.format("%.1f", opportunity.getConfidence()));
        log.info("Expires at: {}", opportunity.getExpiresAt());
        log.info("--------------------------------------");
    }
}
