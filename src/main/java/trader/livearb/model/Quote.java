package trader.livearb.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class Quote {
    String pair;
    String exchange;
    BigDecimal price;
    BigDecimal bid;
    BigDecimal ask;
    BigDecimal volume24h;
    BigDecimal liquidity;
    /**
     * Maker/taker fee in percent as reported by the exchange, null when unknown.
     */
    BigDecimal feePercentage;
    long timestampMs;

    public Key key() {
        return new Key(pair, exchange);
    }

    @Value
    public static class Key {
        String pair;
        String exchange;
    }
}
