package trader.livearb.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "simulation")
public class SimulationProperties {
    private Duration interval = Duration.ofSeconds(2);
    private Duration opportunityInterval = Duration.ofSeconds(10);
    private Duration executionDelay = Duration.ofSeconds(1);
    private double mevAlertProbability = 0.1;
    // ±half of this fraction is applied to every generated price
    private double jitter = 0.002;
    private Long seed;
    /**
     * pair -> reference price
     */
    private Map<String, BigDecimal> pairs = new LinkedHashMap<>();
    private Map<String, Venue> exchanges = new LinkedHashMap<>();

    @Data
    public static class Venue {
        // multiplier applied to the reference price
        private double bias = 1.0;
        // half spread as a fraction of the price
        private double spread = 0.001;
        private double minLiquidity = 20_000_000;
        private double maxLiquidity = 50_000_000;
        private double minVolume = 5_000_000;
        private double maxVolume = 20_000_000;
        private BigDecimal feePercentage;
    }
}
