package trader.livearb.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Order book depth for a pair. The sequence number identifies the snapshot
 * in the depth store since the feed does not assign ids.
 */
@Value
@Builder
public class DepthSnapshot {
    long sequence;
    String pair;
    List<Level> bids;
    List<Level> asks;
    long timestampMs;

    @Value
    public static class Level {
        BigDecimal price;
        BigDecimal size;
        BigDecimal total;
    }
}
