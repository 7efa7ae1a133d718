package io.factorialsystems.federationserver.security;

import io.factorialsystems.federationserver.config.FederationSecurityProperties;
import io.factorialsystems.federationserver.model.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Issues HS256 bearer tokens for authenticated users.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenService {

    public static final String ROLE_CLAIM = "role";
    public static final String USERNAME_CLAIM = "username";
    public static final String AUTHORITIES_CLAIM = "authorities";

    private final JwtEncoder jwtEncoder;
    private final FederationSecurityProperties properties;
    private final Clock clock;

    public String issue(User user) {
        Instant now = clock.instant();
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(properties.getIssuer())
                .subject(user.getId())
                .issuedAt(now)
                .expiresAt(now.plus(properties.getTokenTtl()))
                .claim(ROLE_CLAIM, user.getRole().getValue())
                .claim(USERNAME_CLAIM, user.getUsername())
                .claim(AUTHORITIES_CLAIM, List.of(user.getRole().authority()))
                .build();

        String token = jwtEncoder.encode(JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims))
                .getTokenValue();
        log.debug("Issued token for user {} with role {}", user.getId(), user.getRole());
        return token;
    }
}
