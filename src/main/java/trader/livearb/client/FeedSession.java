package trader.livearb.client;

import reactor.core.publisher.Mono;

public interface FeedSession {

    String getId();

    Mono<Void> send(String frame);
}
