package trader.livearb.service.connection;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import trader.livearb.model.ConnectionState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static trader.livearb.model.ConnectionState.CONNECTED;
import static trader.livearb.model.ConnectionState.CONNECTING;
import static trader.livearb.model.ConnectionState.DISCONNECTED;
import static trader.livearb.model.ConnectionState.ERROR;

/**
 * Holds the single connection state and rejects transitions missing from the table.
 * Not thread-safe on its own; the owner serializes calls to {@link #transition}.
 */
@Slf4j
public class ConnectionStateMachine {

    private static final Map<ConnectionState, Set<ConnectionState>> TRANSITIONS;

    static {
        Map<ConnectionState, Set<ConnectionState>> table = new EnumMap<>(ConnectionState.class);
        table.put(DISCONNECTED, EnumSet.of(CONNECTING, DISCONNECTED));
        table.put(CONNECTING, EnumSet.of(CONNECTED, DISCONNECTED, ERROR));
        table.put(CONNECTED, EnumSet.of(DISCONNECTED, ERROR));
        table.put(ERROR, EnumSet.of(CONNECTING, DISCONNECTED, ERROR));
        TRANSITIONS = Collections.unmodifiableMap(table);
    }

    private final Sinks.Many<ConnectionState> changes = Sinks.many().replay().latest();
    private volatile ConnectionState state = DISCONNECTED;

    public ConnectionStateMachine() {
        changes.tryEmitNext(DISCONNECTED);
    }

    public ConnectionState current() {
        return state;
    }

    public static boolean isAllowed(ConnectionState from, ConnectionState to) {
        return TRANSITIONS.get(from).contains(to);
    }

    /**
     * Moves to {@code target}. Staying in the same state is a silent no-op.
     *
     * @throws IllegalStateException when the table has no such transition
     */
    public void transition(ConnectionState target) {
        ConnectionState previous = state;
        if (!isAllowed(previous, target)) {
            throw new IllegalStateException("Illegal connection state transition " + previous + " -> " + target);
        }
        if (previous == target) {
            return;
        }
        state = target;
        log.debug("Connection state {} -> {}", previous, target);
        Sinks.EmitResult result = changes.tryEmitNext(target);
        if (result.isFailure()) {
            log.warn("Could not publish connection state {}: {}", target, result);
        }
    }

    /**
     * Current state on subscription, then every change.
     */
    public Flux<ConnectionState> changes() {
        return changes.asFlux();
    }
}
