package de.htwsaar.streamrelay.relay;

import de.htwsaar.streamrelay.common.logging.LoggingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;

@SpringBootApplication
@Import(LoggingConfig.class)
@Profile("relay")
public class RelayApp {
    public static void main(String[] args) {
        SpringApplication.run(RelayApp.class, args);
    }
}
