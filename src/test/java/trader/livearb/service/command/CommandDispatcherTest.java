package trader.livearb.service.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import trader.livearb.client.FeedSession;
import trader.livearb.model.ConnectionState;
import trader.livearb.model.command.SubscriptionCommand;
import trader.livearb.service.connection.FeedConnection;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CommandDispatcher")
class CommandDispatcherTest {

    @Mock
    private FeedConnection connection;

    @Mock
    private FeedSession session;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new CommandDispatcher(connection, objectMapper);
    }

    private void connected() {
        when(connection.getState()).thenReturn(ConnectionState.CONNECTED);
        when(connection.currentSession()).thenReturn(Optional.of(session));
        when(session.send(anyString())).thenReturn(Mono.empty());
    }

    private JsonNode sentFrame() throws Exception {
        ArgumentCaptor<String> frame = ArgumentCaptor.forClass(String.class);
        verify(session).send(frame.capture());
        return objectMapper.readTree(frame.getValue());
    }

    @Test
    @DisplayName("writes subscriptions as {action, channels, pairs}")
    void subscriptionWireFormat() throws Exception {
        connected();

        StepVerifier.create(dispatcher.sendSubscription(
                        SubscriptionCommand.subscribe(List.of("prices", "depth"), List.of("SOL/USDT"))))
                .verifyComplete();

        JsonNode frame = sentFrame();
        assertThat(frame.path("action").asText()).isEqualTo("subscribe");
        assertThat(frame.path("channels").toString()).isEqualTo("[\"depth\",\"prices\"]");
        assertThat(frame.path("pairs").toString()).isEqualTo("[\"SOL/USDT\"]");
    }

    @Test
    @DisplayName("omits the pairs of an unfiltered subscription")
    void unfilteredSubscription() throws Exception {
        connected();

        dispatcher.sendSubscription(SubscriptionCommand.subscribe(List.of("mev"), null)).block();

        assertThat(sentFrame().has("pairs")).isFalse();
    }

    @Test
    @DisplayName("writes intents as {type, data}")
    void intentWireFormat() throws Exception {
        connected();

        dispatcher.executeArbitrage("arb_1", new BigDecimal("1000"), new BigDecimal("0.5")).block();

        JsonNode frame = sentFrame();
        assertThat(frame.path("type").asText()).isEqualTo("execute_arbitrage");
        assertThat(frame.path("data").path("opportunityId").asText()).isEqualTo("arb_1");
        assertThat(frame.path("data").path("amount").decimalValue()).isEqualByComparingTo("1000");
    }

    @Test
    @DisplayName("passes execute_trade data through untouched")
    void tradeDataIsOpaque() throws Exception {
        connected();

        dispatcher.executeTrade(Map.of("pair", "SOL/USDT", "side", "buy")).block();

        JsonNode frame = sentFrame();
        assertThat(frame.path("type").asText()).isEqualTo("execute_trade");
        assertThat(frame.path("data").path("side").asText()).isEqualTo("buy");
    }

    @Test
    @DisplayName("fails with FeedNotConnectedException and sends nothing while disconnected")
    void notConnected() {
        when(connection.getState()).thenReturn(ConnectionState.ERROR);
        when(connection.currentSession()).thenReturn(Optional.empty());

        StepVerifier.create(dispatcher.toggleAutoTrading(true))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(FeedNotConnectedException.class);
                    assertThat(((FeedNotConnectedException) error).getState()).isEqualTo(ConnectionState.ERROR);
                })
                .verify();
        verifyNoInteractions(session);
    }
}
