package trader.livearb.service.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import trader.livearb.client.FeedSession;
import trader.livearb.model.ConnectionState;
import trader.livearb.model.command.IntentCommand;
import trader.livearb.model.command.SubscriptionCommand;
import trader.livearb.service.connection.FeedConnection;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Serializes outbound commands onto the open feed session.
 * <p>
 * Every send is checked against the connection state at call time: when no session is
 * open the returned Mono fails with {@link FeedNotConnectedException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandDispatcher {

    private final FeedConnection connection;
    private final ObjectMapper objectMapper;

    public Mono<Void> sendSubscription(SubscriptionCommand command) {
        return send(command, command.getAction().getWireName());
    }

    public Mono<Void> sendIntent(IntentCommand command) {
        return send(command, command.getType().getWireName());
    }

    public Mono<Void> executeArbitrage(String opportunityId, BigDecimal amount, BigDecimal slippage) {
        return sendIntent(IntentCommand.executeArbitrage(opportunityId, amount, slippage));
    }

    public Mono<Void> executeTrade(Map<String, ?> trade) {
        return sendIntent(IntentCommand.executeTrade(trade));
    }

    public Mono<Void> cancelExecution(String opportunityId) {
        return sendIntent(IntentCommand.cancelExecution(opportunityId));
    }

    public Mono<Void> toggleAutoTrading(boolean enabled) {
        return sendIntent(IntentCommand.toggleAutoTrading(enabled));
    }

    public Mono<Void> walletConnect(String walletType, String address) {
        return sendIntent(IntentCommand.walletConnect(walletType, address));
    }

    public Mono<Void> walletDisconnect(String address) {
        return sendIntent(IntentCommand.walletDisconnect(address));
    }

    private Mono<Void> send(Object command, String description) {
        ConnectionState state = connection.getState();
        Optional<FeedSession> session = connection.currentSession();
        if (state != ConnectionState.CONNECTED || session.isEmpty()) {
            log.warn("Feed not connected, cannot send {}", description);
            return Mono.error(new FeedNotConnectedException(description, state));
        }

        String frame;
        try {
            frame = objectMapper.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            return Mono.error(new CommandSerializationException("Failed to serialize " + description, e));
        }

        return session.get().send(frame)
                .doOnSuccess(ignored -> log.debug("Sent message: {}", frame))
                .doOnError(error -> log.error("Error sending {}: {}", description, error.getMessage()));
    }
}
