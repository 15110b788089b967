package trader.livearb.store;

/**
 * Order in which {@link RetentionStore#snapshot()} lists entries. Eviction always drops the oldest entry.
 */
public enum RetentionOrder {
    NEWEST_FIRST,
    OLDEST_FIRST
}
