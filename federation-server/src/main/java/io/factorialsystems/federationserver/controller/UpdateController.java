package io.factorialsystems.federationserver.controller;

import io.factorialsystems.federationserver.dto.UpdateRequest;
import io.factorialsystems.federationserver.exception.RequestValidationException;
import io.factorialsystems.federationserver.model.Update;
import io.factorialsystems.federationserver.model.UpdateType;
import io.factorialsystems.federationserver.security.AuthenticatedUser;
import io.factorialsystems.federationserver.service.UpdateService;
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
@RequestMapping("/api/v1/updates")
@RequiredArgsConstructor
public class UpdateController {

    private final UpdateService updateService;
    private final RequestValidator requestValidator;

    /**
     * List updates, newest first, optionally filtered by type
     */
    @GetMapping
    public ResponseEntity<List<Update>> getUpdates(@RequestParam(required = false) String type) {
        log.info("Listing updates, type={}", type);
        return ResponseEntity.ok(updateService.findAll(parseType(type)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Update> getUpdate(@PathVariable String id) {
        log.info("Getting update: {}", id);
        return ResponseEntity.ok(updateService.findById(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Update> createUpdate(@RequestBody UpdateRequest request, Authentication authentication) {
        requestValidator.validate(request);
        AuthenticatedUser caller = AuthenticatedUser.from(authentication);
        log.info("Admin {} creating {} update", caller.id(), request.getType());

        return ResponseEntity.ok(updateService.create(request, caller.id()));
    }

    @PutMapping("/{id}")
    @PreAuthorize("@accessPolicy.adminFor('UPDATE', #id, authentication)")
    public ResponseEntity<Update> updateUpdate(@PathVariable String id, @RequestBody UpdateRequest request) {
        requestValidator.validate(request);
        log.info("Updating update: {}", id);

        return ResponseEntity.ok(updateService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("@accessPolicy.adminFor('UPDATE', #id, authentication)")
    public ResponseEntity<Map<String, Object>> deleteUpdate(@PathVariable String id) {
        log.info("Deleting update: {}", id);

        updateService.delete(id);
        return ResponseEntity.ok(Map.of("msg", "Update removed"));
    }

    private static UpdateType parseType(String type) {
        if (type == null || type.isBlank()) {
            return null;
        }
        try {
            return UpdateType.fromValue(type);
        } catch (IllegalArgumentException e) {
            throw new RequestValidationException("type", "Unknown update type: " + type);
        }
    }
}
