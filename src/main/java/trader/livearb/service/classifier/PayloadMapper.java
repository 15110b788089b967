package trader.livearb.service.classifier;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import trader.livearb.config.ArbitrageProperties;
import trader.livearb.model.DepthSnapshot;
import trader.livearb.model.ExchangeSide;
import trader.livearb.model.ExecutionStatus;
import trader.livearb.model.ExecutionUpdate;
import trader.livearb.model.MevAlert;
import trader.livearb.model.OpportunityRecord;
import trader.livearb.model.Quote;
import trader.livearb.model.RiskLevel;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the {@code data} object of an inbound envelope into domain objects.
 * Field names are accepted in both the camelCase and the snake_case spelling the feed uses.
 */
@Component
@RequiredArgsConstructor
public class PayloadMapper {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final ArbitrageProperties arbitrageProperties;

    /**
     * Reads either a single quote or a {@code {"prices": {pair: [quote...]}}} batch.
     */
    public List<Quote> toQuotes(JsonNode data, long envelopeTimestampMs) {
        requireObject(data, "price_update");
        JsonNode prices = data.get("prices");
        if (prices == null) {
            return List.of(toQuote(data, text(data, "pair", "symbol"), envelopeTimestampMs));
        }
        if (!prices.isObject()) {
            throw new MalformedPayloadException("price_update batch 'prices' must be an object");
        }
        List<Quote> quotes = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> pairs = prices.fields();
        while (pairs.hasNext()) {
            Map.Entry<String, JsonNode> pair = pairs.next();
            if (!pair.getValue().isArray()) {
                throw new MalformedPayloadException("Quotes for pair " + pair.getKey() + " must be an array");
            }
            for (JsonNode entry : pair.getValue()) {
                quotes.add(toQuote(entry, pair.getKey(), envelopeTimestampMs));
            }
        }
        return quotes;
    }

    private Quote toQuote(JsonNode node, String pair, long envelopeTimestampMs) {
        requireObject(node, "quote");
        if (pair == null || pair.isBlank()) {
            throw new MalformedPayloadException("Quote without pair");
        }
        String exchange = requireText(node, "exchange", "name");
        BigDecimal price = decimal(node, "price", "lastPrice");
        BigDecimal bid = decimal(node, "bid");
        BigDecimal ask = decimal(node, "ask");
        if (price == null) {
            if (bid == null || ask == null) {
                throw new MalformedPayloadException("Quote " + pair + "@" + exchange + " has no price");
            }
            price = bid.add(ask).divide(TWO, Math.max(bid.scale(), ask.scale()) + 1, RoundingMode.HALF_UP);
        }
        return Quote.builder()
                .pair(pair)
                .exchange(exchange)
                .price(price)
                .bid(bid != null ? bid : price)
                .ask(ask != null ? ask : price)
                .volume24h(orZero(decimal(node, "volume24h", "volume_24h")))
                .liquidity(orZero(decimal(node, "liquidity")))
                .feePercentage(decimal(node, "feePercentage", "fee_percentage", "fee"))
                .timestampMs(longValue(node, envelopeTimestampMs, "timestamp"))
                .build();
    }

    public OpportunityRecord toOpportunity(JsonNode data, long envelopeTimestampMs) {
        requireObject(data, "opportunity_update");
        JsonNode exchanges = data.get("exchanges");
        ExchangeSide buySide = toSide(data, 0, exchanges, "buySide", "buyExchange", "buy_exchange", "buyPrice", "buy_price");
        ExchangeSide sellSide = toSide(data, 1, exchanges, "sellSide", "sellExchange", "sell_exchange", "sellPrice", "sell_price");

        OpportunityRecord.OpportunityRecordBuilder builder = OpportunityRecord.builder()
                .id(requireText(data, "id"))
                .pair(text(data, "pair"))
                .buySide(buySide)
                .sellSide(sellSide)
                .profitPercentage(decimal(data, "profitPercentage", "profit_percentage"))
                .netProfit(decimal(data, "netProfit", "net_profit", "estimated_profit"))
                .requiredCapital(decimal(data, "requiredCapital", "required_capital"))
                .confidence(clampConfidence(decimal(data, "confidence")))
                .expiresAt(expiresAt(data, envelopeTimestampMs));

        JsonNode path = data.get("executionPath");
        if (path == null) {
            path = data.get("execution_path");
        }
        if (path != null && path.isArray()) {
            path.forEach(step -> builder.step(step.asText()));
        }
        return builder.build();
    }

    private ExchangeSide toSide(JsonNode data, int exchangeIndex, JsonNode exchanges,
                                String objectField, String altObjectField, String nameField,
                                String priceField, String snakePriceField) {
        JsonNode side = data.get(objectField);
        if (side == null) {
            side = data.get(altObjectField);
        }
        if (side != null && side.isObject()) {
            return ExchangeSide.builder()
                    .exchange(text(side, "exchange", "name"))
                    .price(decimal(side, "price"))
                    .liquidity(decimal(side, "liquidity"))
                    .fee(decimal(side, "fee"))
                    .build();
        }
        String exchange = side != null && side.isTextual() ? side.asText() : text(data, nameField);
        if (exchange == null && exchanges != null && exchanges.isArray() && exchanges.size() > exchangeIndex) {
            exchange = exchanges.get(exchangeIndex).asText();
        }
        if (exchange == null) {
            return null;
        }
        return ExchangeSide.builder()
                .exchange(exchange)
                .price(decimal(data, priceField, snakePriceField))
                .build();
    }

    private Instant expiresAt(JsonNode data, long envelopeTimestampMs) {
        JsonNode node = data.get("expiresAt");
        if (node == null) {
            node = data.get("expires_at");
        }
        if (node == null || node.isNull()) {
            return Instant.ofEpochMilli(envelopeTimestampMs).plus(arbitrageProperties.getOpportunityTtl());
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            throw new MalformedPayloadException("Invalid expiresAt: " + node.asText(), e);
        }
    }

    private static double clampConfidence(BigDecimal confidence) {
        if (confidence == null) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, confidence.doubleValue()));
    }

    public MevAlert toMevAlert(JsonNode data, long envelopeTimestampMs) {
        requireObject(data, "mev_alert");
        RiskLevel riskLevel;
        try {
            riskLevel = RiskLevel.fromWireName(text(data, "riskLevel", "risk_level"));
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("Invalid MEV risk level: " + e.getMessage(), e);
        }
        Set<String> tokens = new LinkedHashSet<>();
        JsonNode affected = data.get("affectedTokens");
        if (affected == null) {
            affected = data.get("affected_tokens");
        }
        if (affected != null && affected.isArray()) {
            affected.forEach(token -> tokens.add(token.asText()));
        }
        return MevAlert.builder()
                .id(requireText(data, "id"))
                .threatType(requireText(data, "threatType", "threat_type"))
                .riskLevel(riskLevel)
                .description(text(data, "description"))
                .affectedTokens(Set.copyOf(tokens))
                .timestampMs(longValue(data, envelopeTimestampMs, "timestamp"))
                .build();
    }

    public DepthSnapshot toDepthSnapshot(JsonNode data, long sequence, long envelopeTimestampMs) {
        requireObject(data, "market_depth");
        return DepthSnapshot.builder()
                .sequence(sequence)
                .pair(requireText(data, "pair"))
                .bids(levels(data.get("bids")))
                .asks(levels(data.get("asks")))
                .timestampMs(longValue(data, envelopeTimestampMs, "timestamp"))
                .build();
    }

    private static List<DepthSnapshot.Level> levels(JsonNode array) {
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<DepthSnapshot.Level> levels = new ArrayList<>();
        for (JsonNode level : array) {
            levels.add(new DepthSnapshot.Level(
                    decimal(level, "price"),
                    decimal(level, "size"),
                    decimal(level, "total")));
        }
        return List.copyOf(levels);
    }

    public ExecutionUpdate toExecutionUpdate(JsonNode data, long envelopeTimestampMs) {
        requireObject(data, "execution_update");
        return ExecutionUpdate.builder()
                .opportunityId(requireText(data, "opportunityId", "opportunity_id"))
                .status(ExecutionStatus.fromWireName(text(data, "status")))
                .message(text(data, "message"))
                .txHash(text(data, "txHash", "tx_hash"))
                .timestampMs(longValue(data, envelopeTimestampMs, "timestamp"))
                .build();
    }

    private static void requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw new MalformedPayloadException("Payload of " + what + " must be a JSON object");
        }
    }

    private static String requireText(JsonNode node, String... names) {
        String value = text(node, names);
        if (value == null) {
            throw new MalformedPayloadException("Missing field '" + names[0] + "'");
        }
        return value;
    }

    private static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private static BigDecimal decimal(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isNumber()) {
                return value.decimalValue();
            }
            if (value.isTextual() && !value.asText().isBlank()) {
                try {
                    return new BigDecimal(value.asText().trim());
                } catch (NumberFormatException e) {
                    throw new MalformedPayloadException("Field '" + name + "' is not a number: " + value.asText(), e);
                }
            }
            throw new MalformedPayloadException("Field '" + name + "' is not a number: " + value);
        }
        return null;
    }

    private static long longValue(JsonNode node, long fallback, String name) {
        JsonNode value = node.get(name);
        if (value == null || !value.canConvertToLong()) {
            return fallback;
        }
        return value.asLong();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
