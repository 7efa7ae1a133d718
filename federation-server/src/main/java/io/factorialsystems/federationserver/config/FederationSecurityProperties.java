package io.factorialsystems.federationserver.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "federation.security")
public class FederationSecurityProperties {

    /**
     * HMAC secret used to sign bearer tokens. Must be at least 32 bytes for HS256.
     */
    private String jwtSecret;

    private String issuer = "federation-server";

    private Duration tokenTtl = Duration.ofDays(7);

    /**
     * Membership length granted on self-registration.
     */
    private int membershipMonths = 3;

    private List<String> allowedOrigins = new ArrayList<>();

    private BootstrapAdmin bootstrapAdmin = new BootstrapAdmin();

    @Getter
    @Setter
    public static class BootstrapAdmin {
        private String username;
        private String email;
        private String password;

        public boolean isConfigured() {
            return username != null && !username.isBlank()
                    && email != null && !email.isBlank()
                    && password != null && !password.isBlank();
        }
    }
}
