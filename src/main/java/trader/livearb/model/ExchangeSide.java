package trader.livearb.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One leg of an opportunity: where to buy or sell, at what price.
 */
@Value
@Builder
public class ExchangeSide {
    String exchange;
    BigDecimal price;
    BigDecimal liquidity;
    BigDecimal fee;
}
