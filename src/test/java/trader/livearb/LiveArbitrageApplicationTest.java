package trader.livearb;

import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.reactive.server.WebTestClient;
import trader.livearb.client.FeedTransport;
import trader.livearb.client.simulated.SimulatedFeedTransport;
import trader.livearb.model.ConnectionState;
import trader.livearb.service.arbitrage.ArbitrageScanner;
import trader.livearb.service.connection.FeedConnectionManager;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"feed.mode=simulated", "feed.auto-connect=false"})
@DisplayName("Application context")
class LiveArbitrageApplicationTest {

    @Autowired
    private FeedTransport feedTransport;

    @Autowired
    private FeedConnectionManager connectionManager;

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private ArbitrageScanner scanner;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    @DisplayName("wires the simulated feed and stays disconnected without auto-connect")
    void contextLoads() {
        assertThat(feedTransport).isInstanceOf(SimulatedFeedTransport.class);
        assertThat(connectionManager.getState()).isEqualTo(ConnectionState.DISCONNECTED);

        webTestClient.get().uri("/feed/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.state").isEqualTo("DISCONNECTED");
    }

    @Test
    @DisplayName("records the arbitrage.scan observation for every scanned batch")
    void scanIsObserved() {
        scanner.scanPairs(List.of("SOL/USDT"));

        assertThat(meterRegistry.find("arbitrage.scan").timer())
                .isNotNull()
                .satisfies(timer -> assertThat(timer.count()).isGreaterThanOrEqualTo(1L));
    }
}
