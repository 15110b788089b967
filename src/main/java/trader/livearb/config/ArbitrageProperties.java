package trader.livearb.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "arbitrage")
public class ArbitrageProperties {
    // percent, an opportunity must be strictly above it
    private BigDecimal threshold = new BigDecimal("0.1");
    private Duration opportunityTtl = Duration.ofSeconds(60);
    // percent, both legs together, used for legs whose quote carries no fee
    private BigDecimal defaultFeePercentage = new BigDecimal("0.1");
    private BigDecimal requiredCapital = new BigDecimal("10000");
    private double confidenceCap = 95.0;
    private BigDecimal liquidityReference = new BigDecimal("1000000");
}
