package io.factorialsystems.federationserver.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Answers unauthenticated calls to protected routes with a 401 and a {@code {"msg"}} body
 * instead of the default WWW-Authenticate challenge.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String MISSING_TOKEN = "No token, authorization denied";
    static final String INVALID_TOKEN = "Token is not valid";

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        String message;
        if (authException instanceof InvalidBearerTokenException) {
            message = INVALID_TOKEN;
            log.warn("Rejected bearer token on {} {}: {}", request.getMethod(), request.getRequestURI(), authException.getMessage());
        } else {
            message = MISSING_TOKEN;
            log.debug("Unauthenticated request to {} {}", request.getMethod(), request.getRequestURI());
        }

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), Map.of("msg", message));
    }
}
