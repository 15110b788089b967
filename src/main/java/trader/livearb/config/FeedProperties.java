package trader.livearb.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "feed")
public class FeedProperties {
    private String url = "ws://localhost:3002";
    private FeedMode mode = FeedMode.LIVE;
    private boolean autoConnect = true;
    private Duration pingInterval = Duration.ofSeconds(15);
    private List<String> defaultChannels = new ArrayList<>(List.of("prices", "opportunities", "mev", "depth", "alpha"));
    private Reconnect reconnect = new Reconnect();
    private Retention retention = new Retention();

    @Data
    public static class Reconnect {
        private Duration baseDelay = Duration.ofMillis(3000);
        private Duration maxDelay = Duration.ofMillis(30000);
        private int maxAttempts = 5;
    }

    @Data
    public static class Retention {
        private int quotes = 100;
        private int opportunities = 20;
        private int mevAlerts = 10;
        private int depthSnapshots = 5;
        private int executions = 20;
    }
}
