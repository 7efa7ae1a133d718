package io.factorialsystems.federationserver.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.oauth2.server.resource.web.BearerTokenResolver;
import org.springframework.security.oauth2.server.resource.web.DefaultBearerTokenResolver;

/**
 * Reads the bearer token from the Authorization header, except on public routes where a stale
 * or malformed token must not turn an anonymous read into a 401.
 */
public class PublicRouteBearerTokenResolver implements BearerTokenResolver {

    private final DefaultBearerTokenResolver delegate = new DefaultBearerTokenResolver();

    @Override
    public String resolve(HttpServletRequest request) {
        if (PublicRoutes.MATCHER.matches(request)) {
            return null;
        }
        return delegate.resolve(request);
    }
}
