package io.factorialsystems.federationserver.controller;

import io.factorialsystems.federationserver.config.FederationSecurityProperties;
import io.factorialsystems.federationserver.config.SecurityConfig;
import io.factorialsystems.federationserver.exception.CapacityExceededException;
import io.factorialsystems.federationserver.model.Workshop;
import io.factorialsystems.federationserver.security.AccessPolicy;
import io.factorialsystems.federationserver.security.RestAuthenticationEntryPoint;
import io.factorialsystems.federationserver.service.WorkshopService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WorkshopController.class)
@Import({SecurityConfig.class, RestAuthenticationEntryPoint.class, RequestValidator.class})
@EnableConfigurationProperties(FederationSecurityProperties.class)
class WorkshopControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WorkshopService workshopService;

    @MockBean(name = "accessPolicy")
    private AccessPolicy accessPolicy;

    @Test
    void publicListingIgnoresBadToken() throws Exception {
        when(workshopService.findAll()).thenReturn(List.of(Workshop.builder().id("ws-1").title("Export basics").build()));

        mockMvc.perform(get("/api/v1/workshops").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].title").value("Export basics"));
    }

    @Test
    void registeringWithBadTokenIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/v1/workshops/ws-1/register").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.msg").value("Token is not valid"));

        verifyNoInteractions(workshopService);
    }

    @Test
    void registeringForFullWorkshopIsConflict() throws Exception {
        when(workshopService.register("ws-1", "user-3")).thenThrow(new CapacityExceededException("Workshop is full"));

        mockMvc.perform(post("/api/v1/workshops/ws-1/register")
                        .with(jwt().authorities(new SimpleGrantedAuthority("ROLE_MEMBER"))
                                .jwt(token -> token.subject("user-3").claim("role", "member"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.msg").value("Workshop is full"));
    }

    @Test
    void memberCannotCreateWorkshop() throws Exception {
        mockMvc.perform(post("/api/v1/workshops")
                        .with(jwt().authorities(new SimpleGrantedAuthority("ROLE_MEMBER"))
                                .jwt(token -> token.subject("user-3").claim("role", "member")))
                        .contentType("application/json")
                        .content("{}"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(workshopService);
    }
}
