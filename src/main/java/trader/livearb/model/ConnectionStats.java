package trader.livearb.model;

import lombok.Value;

@Value
public class ConnectionStats {
    long messagesReceived;
    long lastMessageTimeMs;
    int reconnectAttempts;
}
