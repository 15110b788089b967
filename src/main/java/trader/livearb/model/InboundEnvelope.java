package trader.livearb.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class InboundEnvelope {
    String kind;
    JsonNode payload;
    long timestampMs;
}
