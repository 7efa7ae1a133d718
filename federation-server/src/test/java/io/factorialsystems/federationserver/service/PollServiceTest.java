package io.factorialsystems.federationserver.service;

import io.factorialsystems.federationserver.dto.PollRequest;
import io.factorialsystems.federationserver.exception.ConflictException;
import io.factorialsystems.federationserver.exception.ExpiredException;
import io.factorialsystems.federationserver.exception.RequestValidationException;
import io.factorialsystems.federationserver.exception.ResourceNotFoundException;
import io.factorialsystems.federationserver.mapper.PollMapper;
import io.factorialsystems.federationserver.model.Poll;
import io.factorialsystems.federationserver.model.PollOption;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PollServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);
    private static final String POLL_ID = "2b1f6a52-2d4e-4a0e-9d3b-5f4b7f0c9a11";

    @Mock
    private PollMapper pollMapper;

    private PollService pollService;

    @BeforeEach
    void setUp() {
        pollService = new PollService(pollMapper, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
    }

    private Poll lunchPoll(int pizzaVotes, int saladVotes, String... voters) {
        return Poll.builder()
                .id(POLL_ID)
                .question("Lunch?")
                .options(new ArrayList<>(List.of(new PollOption("Pizza", pizzaVotes), new PollOption("Salad", saladVotes))))
                .expiresAt(NOW.plusDays(1))
                .votedBy(new ArrayList<>(List.of(voters)))
                .createdById("admin-1")
                .build();
    }

    @Test
    void vote_recordsVoteAndReturnsUpdatedPoll() {
        // Given
        when(pollMapper.findById(POLL_ID)).thenReturn(lunchPoll(0, 0), lunchPoll(1, 0, "user-a"));
        when(pollMapper.recordVote(POLL_ID, 0, "user-a", NOW)).thenReturn(1);

        // When
        Poll result = pollService.vote(POLL_ID, 0, "user-a");

        // Then
        assertEquals(1, result.getOptions().get(0).getVotes());
        assertEquals(0, result.getOptions().get(1).getVotes());
        assertEquals(1, result.totalVotes());
        assertTrue(result.hasVoted("user-a"));
        verify(pollMapper).recordVote(POLL_ID, 0, "user-a", NOW);
    }

    @Test
    void vote_secondVoteBySameUserIsConflict() {
        when(pollMapper.findById(POLL_ID)).thenReturn(lunchPoll(1, 0, "user-a"));

        ConflictException ex = assertThrows(ConflictException.class, () -> pollService.vote(POLL_ID, 1, "user-a"));

        assertEquals("You have already voted on this poll", ex.getMessage());
        verify(pollMapper, never()).recordVote(anyString(), anyInt(), anyString(), any());
    }

    @Test
    void vote_outOfRangeOptionIsValidationError() {
        when(pollMapper.findById(POLL_ID)).thenReturn(lunchPoll(1, 0, "user-a"));

        RequestValidationException ex = assertThrows(RequestValidationException.class,
                () -> pollService.vote(POLL_ID, 5, "user-b"));

        assertEquals("optionId", ex.getViolations().get(0).field());
        assertEquals("Invalid option", ex.getViolations().get(0).msg());
        verify(pollMapper, never()).recordVote(anyString(), anyInt(), anyString(), any());
    }

    @Test
    void vote_negativeOptionIsValidationError() {
        when(pollMapper.findById(POLL_ID)).thenReturn(lunchPoll(0, 0));

        assertThrows(RequestValidationException.class, () -> pollService.vote(POLL_ID, -1, "user-b"));
    }

    @Test
    void vote_expiredPollIsRejected() {
        Poll expired = lunchPoll(0, 0);
        expired.setExpiresAt(NOW.minusMinutes(1));
        when(pollMapper.findById(POLL_ID)).thenReturn(expired);

        ExpiredException ex = assertThrows(ExpiredException.class, () -> pollService.vote(POLL_ID, 0, "user-a"));

        assertEquals("This poll has expired", ex.getMessage());
    }

    @Test
    void vote_pollExpiringExactlyNowIsRejected() {
        Poll expiring = lunchPoll(0, 0);
        expiring.setExpiresAt(NOW);
        when(pollMapper.findById(POLL_ID)).thenReturn(expiring);

        assertThrows(ExpiredException.class, () -> pollService.vote(POLL_ID, 0, "user-a"));
    }

    @Test
    void vote_missingPollIsNotFound() {
        when(pollMapper.findById(POLL_ID)).thenReturn(null);

        assertThrows(ResourceNotFoundException.class, () -> pollService.vote(POLL_ID, 0, "user-a"));
    }

    @Test
    void vote_concurrentDuplicateReportsConflictWhenUpdateMatchesNothing() {
        // Given - the pre-check passes but another request from the same user wins the conditional update
        when(pollMapper.findById(POLL_ID)).thenReturn(lunchPoll(0, 0), lunchPoll(1, 0, "user-a"));
        when(pollMapper.recordVote(POLL_ID, 0, "user-a", NOW)).thenReturn(0);

        // When / Then
        assertThrows(ConflictException.class, () -> pollService.vote(POLL_ID, 0, "user-a"));
        verify(pollMapper, times(2)).findById(POLL_ID);
    }

    @Test
    void create_startsEveryOptionAtZeroVotes() {
        PollRequest request = new PollRequest();
        request.setQuestion("  Lunch?  ");
        request.setOptions(List.of("Pizza", " Salad "));
        request.setExpiresAt(NOW.plusDays(2));
        when(pollMapper.insert(any(Poll.class))).thenReturn(1);
        when(pollMapper.findById(anyString())).thenAnswer(inv -> lunchPoll(0, 0));

        pollService.create(request, "admin-1");

        ArgumentCaptor<Poll> captor = ArgumentCaptor.forClass(Poll.class);
        verify(pollMapper).insert(captor.capture());
        Poll inserted = captor.getValue();
        assertNotNull(inserted.getId());
        assertEquals("Lunch?", inserted.getQuestion());
        assertEquals(List.of("Pizza", "Salad"), inserted.getOptions().stream().map(PollOption::getText).toList());
        assertTrue(inserted.getOptions().stream().allMatch(o -> o.getVotes() == 0));
        assertTrue(inserted.getVotedBy().isEmpty());
        assertEquals("admin-1", inserted.getCreatedById());
        assertEquals(NOW, inserted.getCreatedAt());
    }

    @Test
    void findOpenForUser_usesCurrentInstant() {
        when(pollMapper.findOpenForUser("user-a", NOW)).thenReturn(List.of(lunchPoll(0, 0)));

        List<Poll> polls = pollService.findOpenForUser("user-a");

        assertEquals(1, polls.size());
    }

    @Test
    void delete_missingPollIsNotFound() {
        when(pollMapper.delete(POLL_ID)).thenReturn(0);

        assertThrows(ResourceNotFoundException.class, () -> pollService.delete(POLL_ID));
    }
}
