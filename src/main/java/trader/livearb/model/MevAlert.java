package trader.livearb.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class MevAlert {
    String id;
    String threatType;
    RiskLevel riskLevel;
    String description;
    Set<String> affectedTokens;
    long timestampMs;
}
