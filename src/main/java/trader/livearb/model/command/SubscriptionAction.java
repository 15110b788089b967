package trader.livearb.model.command;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SubscriptionAction {
    SUBSCRIBE("subscribe"),
    UNSUBSCRIBE("unsubscribe");

    private final String wireName;

    SubscriptionAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
