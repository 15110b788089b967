package trader.livearb.controller;

import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;
import trader.livearb.model.command.IntentCommand;
import trader.livearb.model.command.IntentType;
import trader.livearb.service.LiveMarketService;
import trader.livearb.service.command.CommandDispatcher;
import trader.livearb.service.command.FeedNotConnectedException;

import java.util.List;
import java.util.Map;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class FeedController {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {
            };

    private final LiveMarketService marketService;
    private final CommandDispatcher commandDispatcher;

    @Bean
    public RouterFunction<ServerResponse> feedRoutes() {
        return RouterFunctions.route()
                .path("/feed", this::buildFeedRoutes)
                .build();
    }

    private RouterFunction<ServerResponse> buildFeedRoutes() {
        return RouterFunctions.route()
                .GET("/status", request -> ServerResponse.ok().bodyValue(marketService.status()))
                .GET("/quotes", this::handleGetQuotes)
                .GET("/opportunities", this::handleGetOpportunities)
                .GET("/alerts", request -> ServerResponse.ok().bodyValue(marketService.mevAlerts()))
                .GET("/depth", request -> ServerResponse.ok().bodyValue(marketService.depthSnapshots()))
                .GET("/executions", request -> ServerResponse.ok().bodyValue(marketService.executions()))
                .GET("/subscriptions", request -> ServerResponse.ok().bodyValue(marketService.subscriptions()))
                .POST("/subscriptions", this::handleSubscribe)
                .POST("/subscriptions/remove", this::handleUnsubscribe)
                .POST("/connection/open", this::handleOpen)
                .POST("/connection/close", this::handleClose)
                .POST("/commands/{type}", this::handleCommand)
                .build();
    }

    private Mono<ServerResponse> handleGetQuotes(ServerRequest request) {
        String pair = request.queryParam("pair").orElse(null);
        return ServerResponse.ok().bodyValue(marketService.quotes(pair));
    }

    private Mono<ServerResponse> handleGetOpportunities(ServerRequest request) {
        boolean activeOnly = request.queryParam("active").map(Boolean::parseBoolean).orElse(false);
        return ServerResponse.ok().bodyValue(marketService.opportunities(activeOnly));
    }

    private Mono<ServerResponse> handleSubscribe(ServerRequest request) {
        return request.bodyToMono(SubscriptionRequest.class)
                .flatMap(body -> {
                    if (body.getChannels() == null || body.getChannels().isEmpty()) {
                        return badRequest("channels must not be empty");
                    }
                    marketService.subscribe(body.getChannels(), body.getPairs());
                    return ServerResponse.ok().bodyValue(marketService.subscriptions());
                })
                .switchIfEmpty(badRequest("request body is required"));
    }

    private Mono<ServerResponse> handleUnsubscribe(ServerRequest request) {
        return request.bodyToMono(SubscriptionRequest.class)
                .flatMap(body -> {
                    if (body.getChannels() == null || body.getChannels().isEmpty()) {
                        return badRequest("channels must not be empty");
                    }
                    marketService.unsubscribe(body.getChannels());
                    return ServerResponse.ok().bodyValue(marketService.subscriptions());
                })
                .switchIfEmpty(badRequest("request body is required"));
    }

    private Mono<ServerResponse> handleOpen(ServerRequest request) {
        marketService.open();
        return ServerResponse.accepted().bodyValue(marketService.status());
    }

    private Mono<ServerResponse> handleClose(ServerRequest request) {
        marketService.close();
        return ServerResponse.ok().bodyValue(marketService.status());
    }

    private Mono<ServerResponse> handleCommand(ServerRequest request) {
        String wireName = request.pathVariable("type");
        return IntentType.fromWireName(wireName)
                .map(type -> request.bodyToMono(JSON_OBJECT)
                        .defaultIfEmpty(Map.of())
                        .flatMap(data -> commandDispatcher.sendIntent(IntentCommand.of(type, data)))
                        .then(ServerResponse.accepted().build())
                        .onErrorResume(FeedNotConnectedException.class, this::notConnected))
                .orElseGet(() -> badRequest("unknown command type: " + wireName));
    }

    private Mono<ServerResponse> notConnected(FeedNotConnectedException e) {
        return ServerResponse.status(HttpStatus.CONFLICT)
                .bodyValue(Map.of("error", e.getMessage(), "state", e.getState()));
    }

    private static Mono<ServerResponse> badRequest(String message) {
        return ServerResponse.badRequest().bodyValue(Map.of("error", message));
    }

    @Data
    public static class SubscriptionRequest {
        private List<String> channels;
        private List<String> pairs;
    }
}
