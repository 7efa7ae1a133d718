package io.factorialsystems.federationserver.service;

import io.factorialsystems.federationserver.dto.EmergencyContactRequest;
import io.factorialsystems.federationserver.exception.ResourceNotFoundException;
import io.factorialsystems.federationserver.mapper.EmergencyContactMapper;
import io.factorialsystems.federationserver.model.EmergencyCategory;
import io.factorialsystems.federationserver.model.EmergencyContact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class EmergencyContactService {

    static final String NOT_FOUND = "Emergency contact not found";

    private final EmergencyContactMapper emergencyContactMapper;
    private final Clock clock;

    public List<EmergencyContact> findAll() {
        return emergencyContactMapper.findAll();
    }

    public EmergencyContact findById(String id) {
        EmergencyContact contact = emergencyContactMapper.findById(id);
        if (contact == null) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        return contact;
    }

    @Transactional
    public EmergencyContact create(EmergencyContactRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        EmergencyContact contact = EmergencyContact.builder()
                .id(UUID.randomUUID().toString())
                .name(request.getName().trim())
                .number(request.getNumber().trim())
                .category(EmergencyCategory.fromValue(request.getCategory()))
                .createdAt(now)
                .updatedAt(now)
                .build();

        int result = emergencyContactMapper.insert(contact);
        if (result <= 0) {
            throw new RuntimeException("Failed to create emergency contact");
        }

        log.info("Created emergency contact: id={}, name={}, category={}", contact.getId(), contact.getName(), contact.getCategory());
        return contact;
    }

    @Transactional
    public EmergencyContact update(String id, EmergencyContactRequest request) {
        EmergencyContact contact = findById(id);
        contact.setName(request.getName().trim());
        contact.setNumber(request.getNumber().trim());
        contact.setCategory(EmergencyCategory.fromValue(request.getCategory()));
        contact.setUpdatedAt(OffsetDateTime.now(clock));

        int result = emergencyContactMapper.update(contact);
        if (result <= 0) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }

        log.info("Updated emergency contact: {}", id);
        return contact;
    }

    @Transactional
    public void delete(String id) {
        int result = emergencyContactMapper.delete(id);
        if (result <= 0) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        log.info("Deleted emergency contact: {}", id);
    }
}
