package trader.livearb.service.command;

import lombok.Getter;
import trader.livearb.model.ConnectionState;

/**
 * An outbound command was attempted while no session is open. Commands are never queued.
 */
@Getter
public class FeedNotConnectedException extends RuntimeException {

    private final ConnectionState state;

    public FeedNotConnectedException(String command, ConnectionState state) {
        super("Feed is not connected (state " + state + "), cannot send " + command);
        this.state = state;
    }
}
