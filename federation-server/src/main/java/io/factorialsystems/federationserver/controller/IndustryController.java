package io.factorialsystems.federationserver.controller;

import io.factorialsystems.federationserver.dto.IndustryRequest;
import io.factorialsystems.federationserver.dto.OnCreate;
import io.factorialsystems.federationserver.model.Industry;
import io.factorialsystems.federationserver.security.AuthenticatedUser;
import io.factorialsystems.federationserver.service.IndustryService;
import jakarta.validation.groups.Default;
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
@RequestMapping("/api/v1/industries")
@RequiredArgsConstructor
public class IndustryController {

    private final IndustryService industryService;
    private final RequestValidator requestValidator;

    @GetMapping
    public ResponseEntity<List<Industry>> getIndustries() {
        log.info("Listing industries");
        return ResponseEntity.ok(industryService.findAll());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Industry> getIndustry(@PathVariable String id) {
        log.info("Getting industry: {}", id);
        return ResponseEntity.ok(industryService.findById(id));
    }

    /**
     * Create an industry owned by the caller
     */
    @PostMapping
    public ResponseEntity<Industry> createIndustry(@RequestBody IndustryRequest request, Authentication authentication) {
        requestValidator.validate(request, Default.class, OnCreate.class);
        AuthenticatedUser caller = AuthenticatedUser.from(authentication);
        log.info("User {} creating industry: {}", caller.id(), request.getName());

        return ResponseEntity.ok(industryService.create(request, caller.id()));
    }

    /**
     * Partially update an industry (owner or admin)
     */
    @PutMapping("/{id}")
    @PreAuthorize("@accessPolicy.ownerOrAdmin('INDUSTRY', #id, authentication)")
    public ResponseEntity<Industry> updateIndustry(@PathVariable String id, @RequestBody IndustryRequest request) {
        requestValidator.validate(request);
        log.info("Updating industry: {}", id);

        return ResponseEntity.ok(industryService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("@accessPolicy.ownerOrAdmin('INDUSTRY', #id, authentication)")
    public ResponseEntity<Map<String, Object>> deleteIndustry(@PathVariable String id) {
        log.info("Deleting industry: {}", id);

        industryService.delete(id);
        return ResponseEntity.ok(Map.of("msg", "Industry removed"));
    }
}
