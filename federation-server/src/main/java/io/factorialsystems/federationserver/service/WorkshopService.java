package io.factorialsystems.federationserver.service;

import io.factorialsystems.federationserver.dto.WorkshopRequest;
import io.factorialsystems.federationserver.exception.CapacityExceededException;
import io.factorialsystems.federationserver.exception.ConflictException;
import io.factorialsystems.federationserver.exception.RequestValidationException;
import io.factorialsystems.federationserver.exception.ResourceNotFoundException;
import io.factorialsystems.federationserver.mapper.WorkshopMapper;
import io.factorialsystems.federationserver.model.Workshop;
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
public class WorkshopService {

    static final String NOT_FOUND = "Workshop not found";
    static final String ALREADY_REGISTERED = "User already registered";
    static final String FULL = "Workshop is full";
    static final String CAPACITY_TOO_LOW = "Capacity can not be less than the number of registered users";

    private final WorkshopMapper workshopMapper;
    private final Clock clock;

    public List<Workshop> findAll() {
        return workshopMapper.findAll();
    }

    public Workshop findById(String id) {
        Workshop workshop = workshopMapper.findById(id);
        if (workshop == null) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        return workshop;
    }

    @Transactional
    public Workshop create(WorkshopRequest request, String creatorId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Workshop workshop = Workshop.builder()
                .id(UUID.randomUUID().toString())
                .title(request.getTitle().trim())
                .description(request.getDescription())
                .date(request.getDate())
                .location(request.getLocation().trim())
                .capacity(request.getCapacity())
                .registeredUsers(new ArrayList<>())
                .createdById(creatorId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        int result = workshopMapper.insert(workshop);
        if (result <= 0) {
            throw new RuntimeException("Failed to create workshop");
        }

        log.info("Created workshop: id={}, title={}, capacity={}", workshop.getId(), workshop.getTitle(), workshop.getCapacity());
        return findById(workshop.getId());
    }

    @Transactional
    public Workshop update(String id, WorkshopRequest request) {
        Workshop workshop = findById(id);
        requireCapacityCovers(workshop, request.getCapacity());

        workshop.setTitle(request.getTitle().trim());
        workshop.setDescription(request.getDescription());
        workshop.setDate(request.getDate());
        workshop.setLocation(request.getLocation().trim());
        workshop.setCapacity(request.getCapacity());
        workshop.setUpdatedAt(OffsetDateTime.now(clock));

        int result = workshopMapper.update(workshop);
        if (result <= 0) {
            // Registrations may have grown since the read.
            Workshop current = workshopMapper.findById(id);
            if (current == null) {
                throw new ResourceNotFoundException(NOT_FOUND);
            }
            requireCapacityCovers(current, request.getCapacity());
            throw new RuntimeException("Failed to update workshop");
        }

        log.info("Updated workshop: id={}, capacity={}", id, workshop.getCapacity());
        return workshop;
    }

    /**
     * Registers the user for the workshop. Membership and capacity are checked by the same statement
     * that adds the user.
     */
    @Transactional
    public Workshop register(String workshopId, String userId) {
        requireRegistrable(findById(workshopId), userId);

        int result = workshopMapper.register(workshopId, userId, OffsetDateTime.now(clock));
        if (result <= 0) {
            Workshop current = workshopMapper.findById(workshopId);
            if (current == null) {
                throw new ResourceNotFoundException(NOT_FOUND);
            }
            requireRegistrable(current, userId);
            log.warn("Registration of {} for workshop {} matched no row", userId, workshopId);
            throw new CapacityExceededException(FULL);
        }

        log.info("User {} registered for workshop {}", userId, workshopId);
        return findById(workshopId);
    }

    @Transactional
    public void delete(String id) {
        int result = workshopMapper.delete(id);
        if (result <= 0) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        log.info("Deleted workshop: {}", id);
    }

    private void requireRegistrable(Workshop workshop, String userId) {
        if (workshop.isRegistered(userId)) {
            log.warn("User {} already registered for workshop {}", userId, workshop.getId());
            throw new ConflictException(ALREADY_REGISTERED);
        }
        if (workshop.isFull()) {
            log.warn("Workshop {} is full ({} seats)", workshop.getId(), workshop.getCapacity());
            throw new CapacityExceededException(FULL);
        }
    }

    private void requireCapacityCovers(Workshop workshop, int capacity) {
        if (capacity < workshop.registrationCount()) {
            throw new RequestValidationException("capacity", CAPACITY_TOO_LOW);
        }
    }
}
