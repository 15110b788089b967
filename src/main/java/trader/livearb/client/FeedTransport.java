package trader.livearb.client;

import reactor.core.publisher.Mono;

/**
 * Source of inbound envelope frames. The live WebSocket connection and the simulated
 * market both implement it, so the connection manager never knows which one it drives.
 */
public interface FeedTransport {

    /**
     * Opens a session. {@link FeedSessionHandler#onOpen} is called once the handshake
     * completes, then every inbound text frame goes to {@link FeedSessionHandler#onFrame}.
     * <p>
     * The returned Mono completes on a clean close and errors on a failed handshake or an
     * abnormal close. Cancelling the subscription closes the session.
     */
    Mono<Void> open(FeedSessionHandler handler);

    String describe();
}
