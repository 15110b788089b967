package trader.livearb.model;

public enum ConnectionState {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    ERROR
}
