package trader.livearb.service.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import trader.livearb.model.InboundEnvelope;
import trader.livearb.model.MessageKind;
import trader.livearb.model.Quote;
import trader.livearb.service.connection.ConnectionStatsTracker;
import trader.livearb.store.MarketDataStores;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Parses inbound frames and routes each payload to the store for its message kind.
 * Malformed frames and unknown kinds are logged and dropped; nothing here throws.
 */
@Slf4j
@Service
public class MessageClassifier {

    private final ObjectMapper objectMapper;
    private final PayloadMapper payloadMapper;
    private final MarketDataStores stores;
    private final ConnectionStatsTracker stats;
    private final Clock clock;
    private final Counter malformedCounter;
    private final Counter ignoredCounter;
    private final AtomicLong depthSequence = new AtomicLong();

    public MessageClassifier(ObjectMapper objectMapper,
                             PayloadMapper payloadMapper,
                             MarketDataStores stores,
                             ConnectionStatsTracker stats,
                             Clock clock,
                             MeterRegistry meterRegistry) {
        this.objectMapper = objectMapper;
        this.payloadMapper = payloadMapper;
        this.stores = stores;
        this.stats = stats;
        this.clock = clock;
        this.malformedCounter = Counter.builder("feed.messages.malformed")
                .description("Inbound frames or payloads that could not be parsed")
                .register(meterRegistry);
        this.ignoredCounter = Counter.builder("feed.messages.ignored")
                .description("Inbound messages of an unrecognized kind")
                .register(meterRegistry);
    }

    public ClassificationResult classify(String frame) {
        InboundEnvelope envelope;
        try {
            envelope = parseEnvelope(frame);
        } catch (JsonProcessingException | MalformedPayloadException e) {
            malformedCounter.increment();
            log.warn("Error parsing feed message: {}", e.getMessage());
            return ClassificationResult.discarded(null);
        }

        stats.recordMessage(clock.millis());

        Optional<MessageKind> kind = MessageKind.fromWireName(envelope.getKind());
        if (kind.isEmpty()) {
            ignoredCounter.increment();
            log.debug("Unknown message type: {}", envelope.getKind());
            return ClassificationResult.ignored();
        }

        try {
            return route(kind.get(), envelope);
        } catch (MalformedPayloadException e) {
            malformedCounter.increment();
            log.warn("Discarding {} payload: {}", kind.get().getWireName(), e.getMessage());
            return ClassificationResult.discarded(kind.get());
        }
    }

    InboundEnvelope parseEnvelope(String frame) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(frame);
        if (root == null || !root.isObject()) {
            throw new MalformedPayloadException("Envelope must be a JSON object");
        }
        JsonNode kind = root.get("message_type");
        if (kind == null || !kind.isTextual()) {
            throw new MalformedPayloadException("Envelope has no message_type");
        }
        JsonNode data = root.has("data") ? root.get("data") : MissingNode.getInstance();
        long timestamp = root.path("timestamp").canConvertToLong()
                ? root.path("timestamp").asLong()
                : clock.millis();
        return new InboundEnvelope(kind.asText(), data, timestamp);
    }

    private ClassificationResult route(MessageKind kind, InboundEnvelope envelope) {
        JsonNode data = envelope.getPayload();
        long timestamp = envelope.getTimestampMs();
        switch (kind) {
            case PRICE_UPDATE:
                return storeQuotes(payloadMapper.toQuotes(data, timestamp));
            case OPPORTUNITY_UPDATE:
                stores.getOpportunities().upsert(payloadMapper.toOpportunity(data, timestamp));
                return ClassificationResult.stored(kind);
            case MEV_ALERT:
                stores.getMevAlerts().upsert(payloadMapper.toMevAlert(data, timestamp));
                return ClassificationResult.stored(kind);
            case MARKET_DEPTH:
                stores.getDepthSnapshots().upsert(
                        payloadMapper.toDepthSnapshot(data, depthSequence.incrementAndGet(), timestamp));
                return ClassificationResult.stored(kind);
            case EXECUTION_UPDATE:
                stores.getExecutions().upsert(payloadMapper.toExecutionUpdate(data, timestamp));
                return ClassificationResult.stored(kind);
            default:
                throw new IllegalStateException("Unhandled message kind " + kind);
        }
    }

    private ClassificationResult storeQuotes(List<Quote> quotes) {
        Set<String> updatedPairs = new LinkedHashSet<>();
        for (Quote quote : quotes) {
            if (stores.getQuotes().upsert(quote)) {
                updatedPairs.add(quote.getPair());
            } else {
                log.debug("Dropping out-of-date quote for {}@{}", quote.getPair(), quote.getExchange());
            }
        }
        return ClassificationResult.storedQuotes(updatedPairs);
    }
}
