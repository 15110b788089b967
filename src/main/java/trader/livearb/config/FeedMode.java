package trader.livearb.config;

public enum FeedMode {
    LIVE,
    SIMULATED
}
