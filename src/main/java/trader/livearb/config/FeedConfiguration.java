package trader.livearb.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import trader.livearb.client.FeedTransport;
import trader.livearb.client.WebSocketFeedTransport;
import trader.livearb.client.simulated.SimulatedFeedTransport;
import trader.livearb.client.simulated.SimulatedMarketGenerator;
import trader.livearb.service.connection.ReconnectPolicy;

import java.net.URI;
import java.time.Clock;
import java.util.Random;

@Slf4j
@Configuration
public class FeedConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Reconnect timers and simulated ticks run here.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler feedScheduler() {
        return Schedulers.newSingle("feed-loop");
    }

    @Bean
    public ReconnectPolicy reconnectPolicy(FeedProperties properties) {
        FeedProperties.Reconnect reconnect = properties.getReconnect();
        return new ReconnectPolicy(reconnect.getBaseDelay(), reconnect.getMaxDelay(), reconnect.getMaxAttempts());
    }

    @Bean
    public FeedTransport feedTransport(FeedProperties feedProperties,
                                       SimulationProperties simulationProperties,
                                       ObjectMapper objectMapper,
                                       Scheduler feedScheduler,
                                       Clock clock) {
        if (feedProperties.getMode() == FeedMode.SIMULATED) {
            Random random = simulationProperties.getSeed() != null
                    ? new Random(simulationProperties.getSeed())
                    : new Random();
            log.info("Using simulated market feed with {} pairs on {} exchanges",
                    simulationProperties.getPairs().size(), simulationProperties.getExchanges().size());
            SimulatedMarketGenerator generator =
                    new SimulatedMarketGenerator(simulationProperties,
                            feedProperties.getRetention().getQuotes(), objectMapper, random, clock);
            return new SimulatedFeedTransport(generator, simulationProperties, objectMapper, feedScheduler);
        }
        log.info("Using live market feed at {}", feedProperties.getUrl());
        return new WebSocketFeedTransport(new ReactorNettyWebSocketClient(),
                URI.create(feedProperties.getUrl()), feedProperties.getPingInterval());
    }
}
