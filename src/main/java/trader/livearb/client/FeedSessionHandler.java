package trader.livearb.client;

public interface FeedSessionHandler {

    void onOpen(FeedSession session);

    void onFrame(String frame);
}
