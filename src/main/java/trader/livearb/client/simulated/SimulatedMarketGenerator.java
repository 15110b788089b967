package trader.livearb.client.simulated;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import trader.livearb.config.SimulationProperties;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Produces inbound envelope frames that look like the live feed: per-exchange quotes with a
 * venue bias and random jitter, occasional MEV alerts, depth snapshots and synthetic
 * opportunities.
 */
public class SimulatedMarketGenerator {

    private static final List<String> THREAT_TYPES = List.of("Frontrunning", "Sandwiching", "JIT Arbitrage");
    private static final List<String> RISK_LEVELS = List.of("High", "Medium", "Low");
    private static final int PRICE_SCALE = 4;

    private final SimulationProperties properties;
    private final ObjectMapper objectMapper;
    private final Random random;
    private final Clock clock;
    private long sequence;

    /**
     * @param quoteCapacity size of the quote store the batches land in; a batch larger than it
     *                      would evict its own first pairs before they can be scanned
     */
    public SimulatedMarketGenerator(SimulationProperties properties,
                                    int quoteCapacity,
                                    ObjectMapper objectMapper,
                                    Random random,
                                    Clock clock) {
        if (properties.getPairs().isEmpty() || properties.getExchanges().size() < 2) {
            throw new IllegalArgumentException("Simulation needs at least one pair and two exchanges");
        }
        int batchSize = quotesPerBatch(properties);
        if (batchSize > quoteCapacity) {
            throw new IllegalArgumentException(String.format(
                    "Simulated batch of %d pairs x %d exchanges = %d quotes exceeds the quote retention of %d",
                    properties.getPairs().size(), properties.getExchanges().size(), batchSize, quoteCapacity));
        }
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.random = random;
        this.clock = clock;
    }

    public static int quotesPerBatch(SimulationProperties properties) {
        return properties.getPairs().size() * properties.getExchanges().size();
    }

    /**
     * Frames emitted on every market tick: a price batch, a depth snapshot and sometimes an MEV alert.
     */
    public synchronized List<String> marketFrames() {
        List<String> frames = new ArrayList<>();
        frames.add(priceBatchFrame());
        frames.add(depthFrame(randomPair()));
        mevAlertFrame().ifPresent(frames::add);
        return frames;
    }

    public synchronized String priceBatchFrame() {
        ObjectNode prices = objectMapper.createObjectNode();
        for (Map.Entry<String, BigDecimal> pair : properties.getPairs().entrySet()) {
            ArrayNode venues = prices.putArray(pair.getKey());
            double reference = pair.getValue().doubleValue();
            properties.getExchanges().forEach((exchange, venue) -> venues.add(quote(exchange, venue, reference)));
        }
        ObjectNode data = objectMapper.createObjectNode();
        data.set("prices", prices);
        return envelope("price_update", data);
    }

    private ObjectNode quote(String exchange, SimulationProperties.Venue venue, double reference) {
        double variation = (random.nextDouble() - 0.5) * properties.getJitter();
        double price = reference * venue.getBias() * (1 + variation);
        ObjectNode quote = objectMapper.createObjectNode();
        quote.put("exchange", exchange);
        quote.put("price", scaled(price));
        quote.put("bid", scaled(price * (1 - venue.getSpread())));
        quote.put("ask", scaled(price * (1 + venue.getSpread())));
        quote.put("volume24h", Math.floor(between(venue.getMinVolume(), venue.getMaxVolume())));
        quote.put("liquidity", Math.floor(between(venue.getMinLiquidity(), venue.getMaxLiquidity())));
        if (venue.getFeePercentage() != null) {
            quote.put("fee", venue.getFeePercentage());
        }
        return quote;
    }

    public synchronized Optional<String> mevAlertFrame() {
        if (random.nextDouble() >= properties.getMevAlertProbability()) {
            return Optional.empty();
        }
        String threatType = pick(THREAT_TYPES);
        String riskLevel = pick(RISK_LEVELS);
        List<String> tokens = new ArrayList<>();
        for (String pair : properties.getPairs().keySet()) {
            tokens.add(pair.split("/")[0]);
        }
        ObjectNode data = objectMapper.createObjectNode();
        data.put("id", "mev_" + clock.millis() + "_" + (++sequence));
        data.put("threat_type", threatType);
        data.put("risk_level", riskLevel);
        data.put("description", threatType + " attack detected - " + riskLevel + " risk");
        ArrayNode affected = data.putArray("affected_tokens");
        affected.add(pick(tokens));
        affected.add(pick(tokens));
        data.put("timestamp", clock.millis());
        return Optional.of(envelope("mev_alert", data));
    }

    public synchronized String depthFrame(String pair) {
        double mid = properties.getPairs().get(pair).doubleValue();
        double tick = mid * 0.0001;
        ObjectNode data = objectMapper.createObjectNode();
        data.put("pair", pair);
        depthSide(data.putArray("bids"), mid - tick, -tick);
        depthSide(data.putArray("asks"), mid + tick, tick);
        data.put("timestamp", clock.millis());
        return envelope("market_depth", data);
    }

    private void depthSide(ArrayNode levels, double start, double step) {
        double total = 0;
        for (int i = 0; i < 3; i++) {
            double size = Math.floor(between(500, 1000));
            total += size;
            ObjectNode level = levels.addObject();
            level.put("price", scaled(start + step * i));
            level.put("size", size);
            level.put("total", total);
        }
    }

    /**
     * A made-up opportunity between two random venues, emitted whether or not the current
     * quotes actually cross.
     */
    public synchronized String opportunityFrame() {
        String pair = randomPair();
        List<String> exchanges = new ArrayList<>(properties.getExchanges().keySet());
        String buyExchange = exchanges.remove(random.nextInt(exchanges.size()));
        String sellExchange = exchanges.get(random.nextInt(exchanges.size()));
        double profitPercentage = between(0.1, 0.6);
        double buyPrice = properties.getPairs().get(pair).doubleValue();
        double sellPrice = buyPrice * (1 + profitPercentage / 100);

        ObjectNode data = objectMapper.createObjectNode();
        data.put("id", "sim_arb_" + clock.millis() + "_" + (++sequence));
        data.put("pair", pair);
        data.set("buyExchange", opportunitySide(buyExchange, buyPrice));
        data.set("sellExchange", opportunitySide(sellExchange, sellPrice));
        data.put("profitPercentage", profitPercentage);
        data.put("netProfit", profitPercentage - 0.2);
        data.put("requiredCapital", 10000);
        data.put("confidence", 70 + random.nextDouble() * 25);
        data.put("expiresAt", clock.instant().plusSeconds(60).toString());
        ArrayNode path = data.putArray("executionPath");
        path.add("Buy on " + buyExchange);
        path.add("Transfer");
        path.add("Sell on " + sellExchange);
        return envelope("opportunity_update", data);
    }

    private ObjectNode opportunitySide(String exchange, double price) {
        ObjectNode side = objectMapper.createObjectNode();
        side.put("name", exchange);
        side.put("price", scaled(price));
        side.put("liquidity", Math.floor(random.nextDouble() * 1_000_000));
        side.put("fee", 0.1);
        return side;
    }

    public synchronized String executionUpdateFrame(String opportunityId) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("opportunityId", opportunityId);
        data.put("status", "completed");
        data.put("message", "Trade executed successfully (simulated)");
        data.put("txHash", "0x" + Long.toHexString(random.nextLong()) + Long.toHexString(random.nextLong()));
        return envelope("execution_update", data);
    }

    private String envelope(String kind, ObjectNode data) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("message_type", kind);
        root.set("data", data);
        root.put("timestamp", clock.millis());
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize simulated " + kind, e);
        }
    }

    private String randomPair() {
        return pick(new ArrayList<>(properties.getPairs().keySet()));
    }

    private <T> T pick(List<T> values) {
        return values.get(random.nextInt(values.size()));
    }

    private double between(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }

    private static BigDecimal scaled(double value) {
        return BigDecimal.valueOf(value).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }
}
