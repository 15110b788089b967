package trader.livearb.config.metrics;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TracingConfig {

    /**
     * Backs {@code @Observed}: without it the {@code arbitrage.scan} observation around
     * {@code ArbitrageScanner.scanPairs} (timer and span per quote batch) is never recorded.
     */
    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }
}
