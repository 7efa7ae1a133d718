package io.factorialsystems.federationserver.service;

import io.factorialsystems.federationserver.dto.PollRequest;
import io.factorialsystems.federationserver.exception.ConflictException;
import io.factorialsystems.federationserver.exception.ExpiredException;
import io.factorialsystems.federationserver.exception.RequestValidationException;
import io.factorialsystems.federationserver.exception.ResourceNotFoundException;
import io.factorialsystems.federationserver.mapper.PollMapper;
import io.factorialsystems.federationserver.model.Poll;
import io.factorialsystems.federationserver.model.PollOption;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PollService {

    static final String NOT_FOUND = "Poll not found";
    static final String EXPIRED = "This poll has expired";
    static final String ALREADY_VOTED = "You have already voted on this poll";
    static final String INVALID_OPTION = "Invalid option";

    private final PollMapper pollMapper;
    private final Clock clock;

    /**
     * Open polls the user can still vote on, newest first.
     */
    public List<Poll> findOpenForUser(String userId) {
        return pollMapper.findOpenForUser(userId, OffsetDateTime.now(clock));
    }

    public List<Poll> findAll() {
        return pollMapper.findAll();
    }

    public Poll findById(String id) {
        Poll poll = pollMapper.findById(id);
        if (poll == null) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        return poll;
    }

    @Transactional
    public Poll create(PollRequest request, String creatorId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<PollOption> options = new ArrayList<>();
        request.getOptions().forEach(text -> options.add(PollOption.of(text.trim())));

        Poll poll = Poll.builder()
                .id(UUID.randomUUID().toString())
                .question(request.getQuestion().trim())
                .options(options)
                .expiresAt(request.getExpiresAt())
                .votedBy(new ArrayList<>())
                .createdById(creatorId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        int result = pollMapper.insert(poll);
        if (result <= 0) {
            throw new RuntimeException("Failed to create poll");
        }

        log.info("Created poll: id={}, options={}, expiresAt={}", poll.getId(), options.size(), poll.getExpiresAt());
        return findById(poll.getId());
    }

    /**
     * Casts one vote. The increment and the voter record are written by a single conditional update,
     * so concurrent duplicate votes from the same user cannot both succeed.
     */
    @Transactional
    public Poll vote(String pollId, int optionIndex, String userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        requireVotable(findById(pollId), optionIndex, userId, now);

        int result = pollMapper.recordVote(pollId, optionIndex, userId, now);
        if (result <= 0) {
            // Lost a race: find out which guard rejected the vote.
            Poll current = pollMapper.findById(pollId);
            if (current == null) {
                throw new ResourceNotFoundException(NOT_FOUND);
            }
            requireVotable(current, optionIndex, userId, now);
            log.warn("Vote by {} on poll {} matched no row", userId, pollId);
            throw new ConflictException(ALREADY_VOTED);
        }

        log.info("User {} voted for option {} on poll {}", userId, optionIndex, pollId);
        return findById(pollId);
    }

    @Transactional
    public void delete(String id) {
        int result = pollMapper.delete(id);
        if (result <= 0) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        log.info("Deleted poll: {}", id);
    }

    private void requireVotable(Poll poll, int optionIndex, String userId, OffsetDateTime now) {
        if (poll.isExpired(now)) {
            log.warn("Vote by {} rejected, poll {} expired at {}", userId, poll.getId(), poll.getExpiresAt());
            throw new ExpiredException(EXPIRED);
        }
        if (poll.hasVoted(userId)) {
            log.warn("Vote by {} rejected, already voted on poll {}", userId, poll.getId());
            throw new ConflictException(ALREADY_VOTED);
        }
        if (!poll.hasOption(optionIndex)) {
            throw new RequestValidationException("optionId", INVALID_OPTION);
        }
    }
}
