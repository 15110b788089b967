package trader.livearb.client.simulated;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import trader.livearb.client.FeedSession;
import trader.livearb.client.FeedSessionHandler;
import trader.livearb.client.FeedTransport;
import trader.livearb.config.SimulationProperties;
import trader.livearb.model.command.IntentType;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process feed for development and demos. Every session handshakes immediately, streams
 * generated market frames on the configured intervals and answers execution intents with
 * a delayed {@code execution_update}.
 */
@Slf4j
public class SimulatedFeedTransport implements FeedTransport {

    private final SimulatedMarketGenerator generator;
    private final SimulationProperties properties;
    private final ObjectMapper objectMapper;
    private final Scheduler scheduler;
    private final AtomicLong sessionIds = new AtomicLong();

    public SimulatedFeedTransport(SimulatedMarketGenerator generator,
                                  SimulationProperties properties,
                                  ObjectMapper objectMapper,
                                  Scheduler scheduler) {
        this.generator = generator;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
    }

    @Override
    public Mono<Void> open(FeedSessionHandler handler) {
        return Mono.defer(() -> {
            Sinks.Many<String> replies = Sinks.many().unicast().onBackpressureBuffer();
            SimulatedSession session = new SimulatedSession("sim-" + sessionIds.incrementAndGet(), replies);
            log.info("Simulated feed session {} opened", session.getId());
            handler.onOpen(session);

            Flux<String> market = Flux.interval(Duration.ZERO, properties.getInterval(), scheduler)
                    .concatMapIterable(tick -> generator.marketFrames());
            Flux<String> opportunities = Flux.interval(properties.getOpportunityInterval(), scheduler)
                    .map(tick -> generator.opportunityFrame());

            return Flux.merge(market, opportunities, replies.asFlux())
                    .doOnNext(handler::onFrame)
                    .doFinally(signal -> log.info("Simulated feed session {} ended ({})", session.getId(), signal))
                    .then();
        });
    }

    @Override
    public String describe() {
        return "simulated market";
    }

    private void handleOutbound(String frame, Sinks.Many<String> replies) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            log.warn("Simulated feed received an unparseable frame: {}", e.getMessage());
            return;
        }
        log.debug("Simulated feed received: {}", frame);

        Optional<IntentType> intent = IntentType.fromWireName(root.path("type").asText(null));
        if (intent.isEmpty()
                || (intent.get() != IntentType.EXECUTE_ARBITRAGE && intent.get() != IntentType.EXECUTE_TRADE)) {
            return;
        }
        String opportunityId = root.path("data").path("opportunityId").asText("trade_" + System.currentTimeMillis());
        Mono.delay(properties.getExecutionDelay(), scheduler)
                .map(tick -> generator.executionUpdateFrame(opportunityId))
                .subscribe(
                        reply -> replies.emitNext(reply, Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100))),
                        error -> log.error("Error emitting simulated execution update: {}", error.getMessage())
                );
    }

    private final class SimulatedSession implements FeedSession {

        private final String id;
        private final Sinks.Many<String> replies;

        private SimulatedSession(String id, Sinks.Many<String> replies) {
            this.id = id;
            this.replies = replies;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public Mono<Void> send(String frame) {
            return Mono.fromRunnable(() -> handleOutbound(frame, replies));
        }
    }
}
