package trader.livearb.model;

import lombok.Value;

import java.util.Collection;
import java.util.Set;

/**
 * A channel subscription, optionally narrowed to a set of pairs.
 * An empty pair set means every pair on the channel.
 */
@Value
public class Subscription {
    String channel;
    Set<String> pairs;

    public static Subscription of(String channel, Collection<String> pairs) {
        return new Subscription(channel, pairs == null ? Set.of() : Set.copyOf(pairs));
    }

    public boolean isFiltered() {
        return !pairs.isEmpty();
    }
}
