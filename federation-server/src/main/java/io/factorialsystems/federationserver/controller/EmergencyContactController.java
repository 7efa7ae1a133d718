package io.factorialsystems.federationserver.controller;

import io.factorialsystems.federationserver.dto.EmergencyContactRequest;
import io.factorialsystems.federationserver.model.EmergencyContact;
import io.factorialsystems.federationserver.service.EmergencyContactService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/emergency")
@RequiredArgsConstructor
public class EmergencyContactController {

    private final EmergencyContactService emergencyContactService;
    private final RequestValidator requestValidator;

    /**
     * List contacts grouped by category, then by name
     */
    @GetMapping
    public ResponseEntity<List<EmergencyContact>> getContacts() {
        log.info("Listing emergency contacts");
        return ResponseEntity.ok(emergencyContactService.findAll());
    }

    @GetMapping("/{id}")
    public ResponseEntity<EmergencyContact> getContact(@PathVariable String id) {
        log.info("Getting emergency contact: {}", id);
        return ResponseEntity.ok(emergencyContactService.findById(id));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<EmergencyContact> createContact(@RequestBody EmergencyContactRequest request) {
        requestValidator.validate(request);
        log.info("Creating emergency contact: {}", request.getName());

        return ResponseEntity.ok(emergencyContactService.create(request));
    }

    @PutMapping("/{id}")
    @PreAuthorize("@accessPolicy.adminFor('EMERGENCY_CONTACT', #id, authentication)")
    public ResponseEntity<EmergencyContact> updateContact(@PathVariable String id,
                                                          @RequestBody EmergencyContactRequest request) {
        requestValidator.validate(request);
        log.info("Updating emergency contact: {}", id);

        return ResponseEntity.ok(emergencyContactService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("@accessPolicy.adminFor('EMERGENCY_CONTACT', #id, authentication)")
    public ResponseEntity<Map<String, Object>> deleteContact(@PathVariable String id) {
        log.info("Deleting emergency contact: {}", id);

        emergencyContactService.delete(id);
        return ResponseEntity.ok(Map.of("msg", "Emergency contact removed"));
    }
}
