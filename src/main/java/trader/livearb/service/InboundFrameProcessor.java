package trader.livearb.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import trader.livearb.model.MessageKind;
import trader.livearb.service.arbitrage.ArbitrageScanner;
import trader.livearb.service.classifier.ClassificationResult;
import trader.livearb.service.classifier.MessageClassifier;

/**
 * Classifies every inbound frame and rescans the pairs a stored quote batch touched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboundFrameProcessor {

    private final MessageClassifier classifier;
    private final ArbitrageScanner scanner;

    public ClassificationResult process(String frame) {
        ClassificationResult result = classifier.classify(frame);
        if (result.getKind() == MessageKind.PRICE_UPDATE && !result.getUpdatedPairs().isEmpty()) {
            try {
                scanner.scanPairs(result.getUpdatedPairs());
            } catch (RuntimeException e) {
                log.error("Error scanning {} for arbitrage: {}", result.getUpdatedPairs(), e.getMessage(), e);
            }
        }
        return result;
    }
}
