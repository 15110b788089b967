package trader.livearb.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Inbound message kinds recognized on the feed. Anything else is ignored.
 */
public enum MessageKind {
    PRICE_UPDATE("price_update"),
    OPPORTUNITY_UPDATE("opportunity_update"),
    MEV_ALERT("mev_alert"),
    MARKET_DEPTH("market_depth"),
    EXECUTION_UPDATE("execution_update");

    private final String wireName;

    MessageKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<MessageKind> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equals(wireName))
                .findFirst();
    }
}
