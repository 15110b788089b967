package trader.livearb.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;

@Slf4j
public class WebSocketFeedTransport implements FeedTransport {

    private final WebSocketClient client;
    private final URI uri;
    private final Duration pingInterval;

    public WebSocketFeedTransport(WebSocketClient client, URI uri, Duration pingInterval) {
        this.client = client;
        this.uri = uri;
        this.pingInterval = pingInterval;
    }

    @Override
    public Mono<Void> open(FeedSessionHandler handler) {
        log.info("Connecting to feed WebSocket... {}", uri);
        return client.execute(uri, session -> handle(session, handler));
    }

    @Override
    public String describe() {
        return uri.toString();
    }

    private Mono<Void> handle(WebSocketSession session, FeedSessionHandler handler) {
        log.info("Feed WebSocket handshake completed, session {}", session.getId());
        handler.onOpen(new WebSocketFeedSession(session));

        Disposable heartbeat = setupPingScheduler(session);

        return session.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(handler::onFrame)
                .doFinally(signal -> heartbeat.dispose())
                .then(session.closeStatus().defaultIfEmpty(CloseStatus.NO_STATUS_CODE))
                .flatMap(this::checkCloseStatus);
    }

    private Mono<Void> checkCloseStatus(CloseStatus status) {
        if (status.equalsCode(CloseStatus.NORMAL)) {
            log.info("Feed WebSocket closed normally");
            return Mono.empty();
        }
        return Mono.error(new FeedClosedException(status.getCode(), status.getReason()));
    }

    private Disposable setupPingScheduler(WebSocketSession session) {
        return Flux.interval(pingInterval)
                .flatMap(i -> session.send(Mono.just(session.pingMessage(factory -> factory.wrap(new byte[0])))))
                .subscribe(
                        null,
                        error -> log.error("Error sending ping: {}", error.getMessage())
                );
    }

    private static final class WebSocketFeedSession implements FeedSession {

        private final WebSocketSession session;

        private WebSocketFeedSession(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public String getId() {
            return session.getId();
        }

        @Override
        public Mono<Void> send(String frame) {
            return session.send(Mono.just(session.textMessage(frame)));
        }
    }
}
