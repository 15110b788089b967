package trader.livearb.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class OpportunityRecord {
    String id;
    String pair;
    ExchangeSide buySide;
    ExchangeSide sellSide;
    BigDecimal profitPercentage;
    BigDecimal netProfit;
    BigDecimal requiredCapital;
    double confidence;
    Instant expiresAt;
    @Singular("step")
    List<String> executionPath;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
