package trader.livearb.model;

import java.util.Locale;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static RiskLevel fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Risk level is missing");
        }
        return RiskLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
