package io.factorialsystems.federationserver.controller;

import io.factorialsystems.federationserver.dto.PollRequest;
import io.factorialsystems.federationserver.dto.VoteRequest;
import io.factorialsystems.federationserver.model.Poll;
import io.factorialsystems.federationserver.security.AuthenticatedUser;
import io.factorialsystems.federationserver.service.PollService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/polls")
@RequiredArgsConstructor
public class PollController {

    private final PollService pollService;
    private final RequestValidator requestValidator;

    /**
     * Open polls the caller has not voted on yet
     */
    @GetMapping
    public ResponseEntity<List<Poll>> getOpenPolls(Authentication authentication) {
        AuthenticatedUser caller = AuthenticatedUser.from(authentication);
        log.info("Listing open polls for user {}", caller.id());

        return ResponseEntity.ok(pollService.findOpenForUser(caller.id()));
    }

    /**
     * All polls, including expired ones (admin only)
     */
    @GetMapping("/admin")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<Poll>> getAllPolls() {
        log.info("Listing all polls");
        return ResponseEntity.ok(pollService.findAll());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Poll> getPoll(@PathVariable String id) {
        log.info("Getting poll: {}", id);
        return ResponseEntity.ok(pollService.findById(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Poll> createPoll(@RequestBody PollRequest request, Authentication authentication) {
        requestValidator.validate(request);
        AuthenticatedUser caller = AuthenticatedUser.from(authentication);
        log.info("Admin {} creating poll", caller.id());

        return ResponseEntity.ok(pollService.create(request, caller.id()));
    }

    @PutMapping("/{id}/vote")
    @PreAuthorize("@accessPolicy.exists('POLL', #id)")
    public ResponseEntity<Poll> vote(@PathVariable String id, @RequestBody VoteRequest request,
                                     Authentication authentication) {
        requestValidator.validate(request);
        AuthenticatedUser caller = AuthenticatedUser.from(authentication);
        log.info("User {} voting on poll {}", caller.id(), id);

        return ResponseEntity.ok(pollService.vote(id, request.getOptionId(), caller.id()));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("@accessPolicy.adminFor('POLL', #id, authentication)")
    public ResponseEntity<Map<String, Object>> deletePoll(@PathVariable String id) {
        log.info("Deleting poll: {}", id);

        pollService.delete(id);
        return ResponseEntity.ok(Map.of("msg", "Poll removed"));
    }
}
