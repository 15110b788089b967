package trader.livearb.model;

import lombok.Builder;
import lombok.Value;

/**
 * What a presentation layer needs to render the connection indicator.
 */
@Value
@Builder
public class ConnectionStatus {
    ConnectionState state;
    boolean terminal;
    boolean reconnectScheduled;
    ConnectionStats stats;
}
