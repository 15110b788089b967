package trader.livearb.service.subscription;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import trader.livearb.config.FeedProperties;
import trader.livearb.model.ConnectionState;
import trader.livearb.model.Subscription;
import trader.livearb.model.command.SubscriptionCommand;
import trader.livearb.service.command.CommandDispatcher;
import trader.livearb.service.connection.FeedConnection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Channel subscriptions that must survive reconnects.
 * <p>
 * Changes are sent right away while connected. Otherwise they stay pending and go out with
 * the replay that follows the next successful handshake, together with the default channels.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionRegistry {

    private final FeedConnection connection;
    private final CommandDispatcher dispatcher;
    private final FeedProperties feedProperties;
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private Disposable connectionWatcher;

    @PostConstruct
    public void watchConnection() {
        connectionWatcher = connection.stateChanges()
                .filter(state -> state == ConnectionState.CONNECTED)
                .subscribe(
                        state -> replay(),
                        error -> log.error("Error watching connection state: {}", error.getMessage())
                );
    }

    @PreDestroy
    public void stopWatching() {
        if (connectionWatcher != null) {
            connectionWatcher.dispose();
        }
    }

    public void subscribe(Collection<String> channels, Collection<String> pairs) {
        List<String> changed = new ArrayList<>();
        for (String channel : channels) {
            Subscription subscription = Subscription.of(channel, pairs);
            Subscription previous = subscriptions.put(channel, subscription);
            if (!subscription.equals(previous)) {
                changed.add(channel);
            }
        }
        if (changed.isEmpty()) {
            log.debug("Already subscribed to {}", channels);
            return;
        }
        if (!isConnected()) {
            log.info("Feed not connected, subscription to {} pending until next connect", changed);
            return;
        }
        send(SubscriptionCommand.subscribe(changed, pairs));
        log.info("Subscribed to channels: {}", changed);
    }

    public void subscribe(Collection<String> channels) {
        subscribe(channels, null);
    }

    public void unsubscribe(Collection<String> channels) {
        List<String> removed = channels.stream()
                .filter(channel -> subscriptions.remove(channel) != null)
                .collect(Collectors.toList());
        if (removed.isEmpty() || !isConnected()) {
            return;
        }
        send(SubscriptionCommand.unsubscribe(removed));
        log.info("Unsubscribed from channels: {}", removed);
    }

    public Set<Subscription> subscriptions() {
        return Set.copyOf(subscriptions.values());
    }

    /**
     * Adds the default channels and re-sends every subscription, one command per distinct pair filter.
     */
    void replay() {
        for (String channel : feedProperties.getDefaultChannels()) {
            subscriptions.putIfAbsent(channel, Subscription.of(channel, null));
        }
        Map<Set<String>, List<String>> channelsByPairs = new LinkedHashMap<>();
        subscriptions.values().stream()
                .sorted((a, b) -> a.getChannel().compareTo(b.getChannel()))
                .forEach(subscription -> channelsByPairs
                        .computeIfAbsent(subscription.getPairs(), pairs -> new ArrayList<>())
                        .add(subscription.getChannel()));
        channelsByPairs.forEach((pairs, channels) -> send(SubscriptionCommand.subscribe(channels, pairs)));
        log.info("Replayed {} subscriptions after connect", subscriptions.size());
    }

    private boolean isConnected() {
        return connection.getState() == ConnectionState.CONNECTED;
    }

    private void send(SubscriptionCommand command) {
        dispatcher.sendSubscription(command)
                .subscribe(
                        null,
                        error -> log.error("Error sending {} for {}: {}",
                                command.getAction().getWireName(), command.getChannels(), error.getMessage())
                );
    }
}
