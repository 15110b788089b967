package trader.livearb.service.connection;

import reactor.core.publisher.Flux;
import trader.livearb.client.FeedSession;
import trader.livearb.model.ConnectionState;

import java.util.Optional;

/**
 * Read side of the connection, handed to components that send on it or react to it.
 */
public interface FeedConnection {

    ConnectionState getState();

    /**
     * The open session, present only while the state is {@link ConnectionState#CONNECTED}.
     */
    Optional<FeedSession> currentSession();

    Flux<ConnectionState> stateChanges();
}
