package trader.livearb.service.connection;

import org.springframework.stereotype.Component;
import trader.livearb.model.ConnectionStats;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class ConnectionStatsTracker {

    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong lastMessageTimeMs = new AtomicLong();
    private final AtomicInteger reconnectAttempts = new AtomicInteger();

    public void recordMessage(long receivedAtMs) {
        messagesReceived.incrementAndGet();
        lastMessageTimeMs.set(receivedAtMs);
    }

    public int getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    public int incrementReconnectAttempts() {
        return reconnectAttempts.incrementAndGet();
    }

    public void resetReconnectAttempts() {
        reconnectAttempts.set(0);
    }

    public ConnectionStats snapshot() {
        return new ConnectionStats(messagesReceived.get(), lastMessageTimeMs.get(), reconnectAttempts.get());
    }
}
