package trader.livearb.service.classifier;

import lombok.Value;
import trader.livearb.model.MessageKind;

import java.util.Set;

@Value
public class ClassificationResult {

    public enum Outcome {
        STORED,
        IGNORED,
        DISCARDED
    }

    // null when the frame never reached routing
    MessageKind kind;
    Outcome outcome;
    Set<String> updatedPairs;

    public static ClassificationResult stored(MessageKind kind) {
        return new ClassificationResult(kind, Outcome.STORED, Set.of());
    }

    public static ClassificationResult storedQuotes(Set<String> updatedPairs) {
        return new ClassificationResult(MessageKind.PRICE_UPDATE, Outcome.STORED, Set.copyOf(updatedPairs));
    }

    public static ClassificationResult ignored() {
        return new ClassificationResult(null, Outcome.IGNORED, Set.of());
    }

    public static ClassificationResult discarded(MessageKind kind) {
        return new ClassificationResult(kind, Outcome.DISCARDED, Set.of());
    }
}
