package trader.livearb.model.command;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.Collection;
import java.util.List;

@Value
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class SubscriptionCommand {
    SubscriptionAction action;
    List<String> channels;
    List<String> pairs;

    public static SubscriptionCommand subscribe(Collection<String> channels, Collection<String> pairs) {
        return new SubscriptionCommand(SubscriptionAction.SUBSCRIBE, sorted(channels), sorted(pairs));
    }

    public static SubscriptionCommand unsubscribe(Collection<String> channels) {
        return new SubscriptionCommand(SubscriptionAction.UNSUBSCRIBE, sorted(channels), List.of());
    }

    private static List<String> sorted(Collection<String> values) {
        return values == null ? List.of() : values.stream().sorted().toList();
    }
}
