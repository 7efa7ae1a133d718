package io.factorialsystems.federationserver.security;

import org.springframework.http.HttpMethod;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.AndRequestMatcher;
import org.springframework.security.web.util.matcher.NegatedRequestMatcher;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;

/**
 * Routes reachable without a bearer token. Tokens sent to these routes are ignored.
 */
public final class PublicRoutes {

    public static final RequestMatcher MATCHER = new OrRequestMatcher(
            post("/api/v1/auth/register"),
            post("/api/v1/auth/login"),
            get("/api/v1/industries"),
            get("/api/v1/industries/*"),
            get("/api/v1/updates"),
            get("/api/v1/updates/*"),
            get("/api/v1/emergency"),
            get("/api/v1/emergency/*"),
            get("/api/v1/workshops"),
            get("/api/v1/workshops/*"),
            get("/api/v1/feedback/questions"),
            new AndRequestMatcher(
                    get("/api/v1/feedback/questions/*"),
                    new NegatedRequestMatcher(get("/api/v1/feedback/questions/admin"))
            )
    );

    private PublicRoutes() {
    }

    private static RequestMatcher get(String pattern) {
        return new AntPathRequestMatcher(pattern, HttpMethod.GET.name());
    }

    private static RequestMatcher post(String pattern) {
        return new AntPathRequestMatcher(pattern, HttpMethod.POST.name());
    }
}
