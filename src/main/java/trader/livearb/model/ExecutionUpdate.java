package trader.livearb.model;

import lombok.Builder;
import lombok.Value;

/**
 * Progress report from the remote execution service for a previously sent intent.
 */
@Value
@Builder
public class ExecutionUpdate {
    String opportunityId;
    ExecutionStatus status;
    String message;
    String txHash;
    long timestampMs;
}
