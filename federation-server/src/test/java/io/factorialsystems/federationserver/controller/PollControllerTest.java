package io.factorialsystems.federationserver.controller;

import io.factorialsystems.federationserver.config.FederationSecurityProperties;
import io.factorialsystems.federationserver.config.SecurityConfig;
import io.factorialsystems.federationserver.dto.PollRequest;
import io.factorialsystems.federationserver.exception.ConflictException;
import io.factorialsystems.federationserver.exception.ResourceNotFoundException;
import io.factorialsystems.federationserver.model.Poll;
import io.factorialsystems.federationserver.model.PollOption;
import io.factorialsystems.federationserver.security.AccessPolicy;
import io.factorialsystems.federationserver.security.RestAuthenticationEntryPoint;
import io.factorialsystems.federationserver.service.PollService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PollController.class)
@Import({SecurityConfig.class, RestAuthenticationEntryPoint.class, RequestValidator.class})
@EnableConfigurationProperties(FederationSecurityProperties.class)
class PollControllerTest {

    private static final String POLL_ID = "5f0c2b7e-1d3a-4e8b-9a6f-2c4d8e1f7a90";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PollService pollService;

    @MockBean(name = "accessPolicy")
    private AccessPolicy accessPolicy;

    private static RequestPostProcessor member(String id) {
        return jwt().authorities(new SimpleGrantedAuthority("ROLE_MEMBER"))
                .jwt(token -> token.subject(id).claim("role", "member").claim("username", id));
    }

    private static RequestPostProcessor admin(String id) {
        return jwt().authorities(new SimpleGrantedAuthority("ROLE_ADMIN"))
                .jwt(token -> token.subject(id).claim("role", "admin").claim("username", id));
    }

    @Test
    void listingPollsWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/v1/polls"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.msg").value("No token, authorization denied"));

        verifyNoInteractions(pollService);
    }

    @Test
    void listingPollsReturnsOpenPollsForCaller() throws Exception {
        Poll poll = Poll.builder()
                .id(POLL_ID)
                .question("Next meeting day?")
                .options(List.of(PollOption.of("Saturday"), PollOption.of("Sunday")))
                .build();
        when(pollService.findOpenForUser("user-1")).thenReturn(List.of(poll));

        mockMvc.perform(get("/api/v1/polls").with(member("user-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].question").value("Next meeting day?"))
                .andExpect(jsonPath("$[0].options[1].text").value("Sunday"));
    }

    @Test
    void memberCannotCreatePoll() throws Exception {
        mockMvc.perform(post("/api/v1/polls").with(member("user-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Q?\",\"options\":[\"a\",\"b\"]}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.msg").value("Not authorized"));

        verifyNoInteractions(pollService);
    }

    @Test
    void memberWithInvalidBodyIsStillForbidden() throws Exception {
        mockMvc.perform(post("/api/v1/polls").with(member("user-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isForbidden());
    }

    @Test
    void adminCreatingPollWithoutQuestionGetsFieldErrors() throws Exception {
        mockMvc.perform(post("/api/v1/polls").with(admin("admin-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"options\":[\"a\",\"b\"],\"expiresAt\":\"2030-01-01T00:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field").value("question"))
                .andExpect(jsonPath("$.errors[0].msg").exists());

        verifyNoInteractions(pollService);
    }

    @Test
    void adminCreatesPollWithZeroVoteOptions() throws Exception {
        Poll created = Poll.builder()
                .id(POLL_ID)
                .question("Lunch?")
                .options(List.of(PollOption.of("Pizza"), PollOption.of("Salad")))
                .build();
        when(pollService.create(any(PollRequest.class), eq("admin-1"))).thenReturn(created);

        mockMvc.perform(post("/api/v1/polls").with(admin("admin-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Lunch?\",\"options\":[\"Pizza\",\"Salad\"],"
                                + "\"expiresAt\":\"2030-01-01T00:00:00Z\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.options[0].text").value("Pizza"))
                .andExpect(jsonPath("$.options[0].votes").value(0))
                .andExpect(jsonPath("$.options[1].votes").value(0));
    }

    @Test
    void votingOnMissingPollIsNotFoundBeforeBodyValidation() throws Exception {
        when(accessPolicy.exists("POLL", POLL_ID)).thenThrow(new ResourceNotFoundException("Poll not found"));

        mockMvc.perform(put("/api/v1/polls/{id}/vote", POLL_ID).with(member("user-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.msg").value("Poll not found"));
    }

    @Test
    void votingTwiceIsConflict() throws Exception {
        when(accessPolicy.exists("POLL", POLL_ID)).thenReturn(true);
        when(pollService.vote(POLL_ID, 1, "user-1"))
                .thenThrow(new ConflictException("You have already voted on this poll"));

        mockMvc.perform(put("/api/v1/polls/{id}/vote", POLL_ID).with(member("user-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"optionIndex\":1}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.msg").value("You have already voted on this poll"));
    }

    @Test
    void votingWithoutOptionIsBadRequest() throws Exception {
        when(accessPolicy.exists("POLL", POLL_ID)).thenReturn(true);

        mockMvc.perform(put("/api/v1/polls/{id}/vote", POLL_ID).with(member("user-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field").value("optionId"))
                .andExpect(jsonPath("$.errors[0].msg").value("Option is required"));

        verify(pollService, never()).vote(anyString(), anyInt(), anyString());
    }

    @Test
    void adminDeletesPoll() throws Exception {
        when(accessPolicy.adminFor(eq("POLL"), eq(POLL_ID), any())).thenReturn(true);

        mockMvc.perform(delete("/api/v1/polls/{id}", POLL_ID).with(admin("admin-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.msg").value("Poll removed"));

        verify(pollService).delete(POLL_ID);
    }
}
