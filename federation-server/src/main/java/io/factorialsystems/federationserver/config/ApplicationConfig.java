package io.factorialsystems.federationserver.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * General application configuration
 */
@Configuration
public class ApplicationConfig {

    /**
     * Clock used for every expiry decision (polls, feedback questions, memberships)
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
