package io.factorialsystems.federationserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FederationServerApplication {
    public static void main(String[] args) {
        SpringApplication.run(FederationServerApplication.class, args);
    }
}
