package trader.livearb.model.command;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class IntentCommand {
    IntentType type;
    Map<String, Object> data;

    public static IntentCommand of(IntentType type, Map<String, ?> data) {
        return new IntentCommand(type, Collections.unmodifiableMap(new LinkedHashMap<>(data)));
    }

    public static IntentCommand executeArbitrage(String opportunityId, BigDecimal amount, BigDecimal slippage) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("opportunityId", opportunityId);
        data.put("amount", amount);
        data.put("slippage", slippage);
        return of(IntentType.EXECUTE_ARBITRAGE, data);
    }

    public static IntentCommand executeTrade(Map<String, ?> data) {
        return of(IntentType.EXECUTE_TRADE, data);
    }

    public static IntentCommand cancelExecution(String opportunityId) {
        return of(IntentType.CANCEL_EXECUTION, Map.of("opportunityId", opportunityId));
    }

    public static IntentCommand toggleAutoTrading(boolean enabled) {
        return of(IntentType.TOGGLE_AUTO_TRADING, Map.of("enabled", enabled));
    }

    public static IntentCommand walletConnect(String walletType, String address) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("wallet_type", walletType);
        data.put("address", address);
        return of(IntentType.WALLET_CONNECT, data);
    }

    public static IntentCommand walletDisconnect(String address) {
        return of(IntentType.WALLET_DISCONNECT, Map.of("address", address));
    }
}
