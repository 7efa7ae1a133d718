package io.factorialsystems.federationserver.security;

import io.factorialsystems.federationserver.model.UserRole;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Caller identity carried by the bearer token: user id and role.
 */
public record AuthenticatedUser(String id, String username, UserRole role) {

    public static AuthenticatedUser from(Authentication authentication) {
        if (authentication == null || !(authentication.getPrincipal() instanceof Jwt jwt)) {
            throw new AuthenticationCredentialsNotFoundException("No authenticated user");
        }
        String role = jwt.getClaimAsString(TokenService.ROLE_CLAIM);
        return new AuthenticatedUser(
                jwt.getSubject(),
                jwt.getClaimAsString(TokenService.USERNAME_CLAIM),
                role == null ? UserRole.MEMBER : UserRole.fromValue(role));
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
