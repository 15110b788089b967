package trader.livearb.model.command;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Intents forwarded to the remote execution service. The payloads are opaque here.
 */
public enum IntentType {
    EXECUTE_ARBITRAGE("execute_arbitrage"),
    EXECUTE_TRADE("execute_trade"),
    CANCEL_EXECUTION("cancel_execution"),
    TOGGLE_AUTO_TRADING("toggle_auto_trading"),
    WALLET_CONNECT("wallet_connect"),
    WALLET_DISCONNECT("wallet_disconnect");

    private final String wireName;

    IntentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<IntentType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}
