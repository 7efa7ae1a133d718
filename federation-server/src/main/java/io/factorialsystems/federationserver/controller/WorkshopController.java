package io.factorialsystems.federationserver.controller;

import io.factorialsystems.federationserver.dto.WorkshopRequest;
import io.factorialsystems.federationserver.model.Workshop;
import io.factorialsystems.federationserver.security.AuthenticatedUser;
import io.factorialsystems.federationserver.service.WorkshopService;
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
@RequestMapping("/api/v1/workshops")
@RequiredArgsConstructor
public class WorkshopController {

    private final WorkshopService workshopService;
    private final RequestValidator requestValidator;

    /**
     * List workshops by date, soonest first
     */
    @GetMapping
    public ResponseEntity<List<Workshop>> getWorkshops() {
        log.info("Listing workshops");
        return ResponseEntity.ok(workshopService.findAll());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Workshop> getWorkshop(@PathVariable String id) {
        log.info("Getting workshop: {}", id);
        return ResponseEntity.ok(workshopService.findById(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Workshop> createWorkshop(@RequestBody WorkshopRequest request, Authentication authentication) {
        requestValidator.validate(request);
        AuthenticatedUser caller = AuthenticatedUser.from(authentication);
        log.info("Admin {} creating workshop: {}", caller.id(), request.getTitle());

        return ResponseEntity.ok(workshopService.create(request, caller.id()));
    }

    @PutMapping("/{id}")
    @PreAuthorize("@accessPolicy.adminFor('WORKSHOP', #id, authentication)")
    public ResponseEntity<Workshop> updateWorkshop(@PathVariable String id, @RequestBody WorkshopRequest request) {
        requestValidator.validate(request);
        log.info("Updating workshop: {}", id);

        return ResponseEntity.ok(workshopService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("@accessPolicy.adminFor('WORKSHOP', #id, authentication)")
    public ResponseEntity<Map<String, Object>> deleteWorkshop(@PathVariable String id) {
        log.info("Deleting workshop: {}", id);

        workshopService.delete(id);
        return ResponseEntity.ok(Map.of("msg", "Workshop removed"));
    }

    /**
     * Register the caller for a workshop
     */
    @PostMapping("/{id}/register")
    public ResponseEntity<Workshop> register(@PathVariable String id, Authentication authentication) {
        AuthenticatedUser caller = AuthenticatedUser.from(authentication);
        log.info("User {} registering for workshop {}", caller.id(), id);

        return ResponseEntity.ok(workshopService.register(id, caller.id()));
    }
}
