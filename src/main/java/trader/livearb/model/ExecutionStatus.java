package trader.livearb.model;

import java.util.Locale;

public enum ExecutionStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED,
    UNKNOWN;

    public static ExecutionStatus fromWireName(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        try {
            return ExecutionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
