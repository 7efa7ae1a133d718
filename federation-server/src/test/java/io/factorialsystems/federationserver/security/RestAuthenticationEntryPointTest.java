package io.factorialsystems.federationserver.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.InsufficientAuthenticationException;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RestAuthenticationEntryPointTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RestAuthenticationEntryPoint entryPoint = new RestAuthenticationEntryPoint(objectMapper);

    @Test
    void missingTokenWritesJsonMessage() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        entryPoint.commence(new MockHttpServletRequest("GET", "/api/v1/polls"), response,
                new InsufficientAuthenticationException("Full authentication is required"));

        assertEquals(401, response.getStatus());
        assertTrue(response.getContentType().startsWith("application/json"));
        Map<?, ?> body = objectMapper.readValue(response.getContentAsString(), Map.class);
        assertEquals(Map.of("msg", "No token, authorization denied"), body);
    }

    @Test
    void rejectedTokenWritesInvalidTokenMessage() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        entryPoint.commence(new MockHttpServletRequest("PUT", "/api/v1/polls/p-1/vote"), response,
                new InvalidBearerTokenException("Malformed token"));

        assertEquals(401, response.getStatus());
        Map<?, ?> body = objectMapper.readValue(response.getContentAsString(), Map.class);
        assertEquals("Token is not valid", body.get("msg"));
    }
}
