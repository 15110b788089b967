package trader.livearb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiveArbitrageApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveArbitrageApplication.class, args);
    }
}
