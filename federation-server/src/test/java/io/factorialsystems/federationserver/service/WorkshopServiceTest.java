package io.factorialsystems.federationserver.service;

import io.factorialsystems.federationserver.dto.WorkshopRequest;
import io.factorialsystems.federationserver.exception.CapacityExceededException;
import io.factorialsystems.federationserver.exception.ConflictException;
import io.factorialsystems.federationserver.exception.RequestValidationException;
import io.factorialsystems.federationserver.exception.ResourceNotFoundException;
import io.factorialsystems.federationserver.mapper.WorkshopMapper;
import io.factorialsystems.federationserver.model.Workshop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
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
class WorkshopServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 3, 1, 9, 30, 0, 0, ZoneOffset.UTC);
    private static final String WORKSHOP_ID = "7d0e3c1a-5b8f-4f7e-a2d4-1c9e6b3f8a20";

    @Mock
    private WorkshopMapper workshopMapper;

    private WorkshopService workshopService;

    @BeforeEach
    void setUp() {
        workshopService = new WorkshopService(workshopMapper, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
    }

    private Workshop workshop(int capacity, String... registered) {
        return Workshop.builder()
                .id(WORKSHOP_ID)
                .title("Export paperwork")
                .description("Filing GST returns for exporters")
                .date(NOW.plusWeeks(1))
                .location("Federation hall")
                .capacity(capacity)
                .registeredUsers(new ArrayList<>(List.of(registered)))
                .build();
    }

    private WorkshopRequest request(int capacity) {
        WorkshopRequest request = new WorkshopRequest();
        request.setTitle("Export paperwork");
        request.setDescription("Filing GST returns for exporters");
        request.setDate(NOW.plusWeeks(1));
        request.setLocation("Federation hall");
        request.setCapacity(capacity);
        return request;
    }

    @Test
    void register_addsUserWhenSeatIsFree() {
        when(workshopMapper.findById(WORKSHOP_ID)).thenReturn(workshop(2), workshop(2, "user-a"));
        when(workshopMapper.register(WORKSHOP_ID, "user-a", NOW)).thenReturn(1);

        Workshop result = workshopService.register(WORKSHOP_ID, "user-a");

        assertTrue(result.isRegistered("user-a"));
        verify(workshopMapper).register(WORKSHOP_ID, "user-a", NOW);
    }

    @Test
    void register_sameUserTwiceIsConflict() {
        when(workshopMapper.findById(WORKSHOP_ID)).thenReturn(workshop(5, "user-a"));

        ConflictException ex = assertThrows(ConflictException.class, () -> workshopService.register(WORKSHOP_ID, "user-a"));

        assertEquals("User already registered", ex.getMessage());
        verify(workshopMapper, never()).register(anyString(), anyString(), any());
    }

    @Test
    void register_fullWorkshopIsRejected() {
        when(workshopMapper.findById(WORKSHOP_ID)).thenReturn(workshop(1, "user-a"));

        CapacityExceededException ex = assertThrows(CapacityExceededException.class,
                () -> workshopService.register(WORKSHOP_ID, "user-b"));

        assertEquals("Workshop is full", ex.getMessage());
    }

    @Test
    void register_zeroCapacityWorkshopIsAlwaysFull() {
        when(workshopMapper.findById(WORKSHOP_ID)).thenReturn(workshop(0));

        assertThrows(CapacityExceededException.class, () -> workshopService.register(WORKSHOP_ID, "user-a"));
    }

    @Test
    void register_lastSeatTakenConcurrentlyReportsFull() {
        // Given - the seat was free when read but the conditional update found the workshop full
        when(workshopMapper.findById(WORKSHOP_ID)).thenReturn(workshop(1), workshop(1, "user-b"));
        when(workshopMapper.register(WORKSHOP_ID, "user-a", NOW)).thenReturn(0);

        // When / Then
        assertThrows(CapacityExceededException.class, () -> workshopService.register(WORKSHOP_ID, "user-a"));
    }

    @Test
    void register_missingWorkshopIsNotFound() {
        when(workshopMapper.findById(WORKSHOP_ID)).thenReturn(null);

        assertThrows(ResourceNotFoundException.class, () -> workshopService.register(WORKSHOP_ID, "user-a"));
    }

    @Test
    void update_capacityBelowRegistrationsIsValidationError() {
        when(workshopMapper.findById(WORKSHOP_ID)).thenReturn(workshop(3, "user-a", "user-b"));

        RequestValidationException ex = assertThrows(RequestValidationException.class,
                () -> workshopService.update(WORKSHOP_ID, request(1)));

        assertEquals("capacity", ex.getViolations().get(0).field());
        verify(workshopMapper, never()).update(any());
    }

    @Test
    void update_capacityEqualToRegistrationsIsAllowed() {
        when(workshopMapper.findById(WORKSHOP_ID)).thenReturn(workshop(3, "user-a", "user-b"));
        when(workshopMapper.update(any(Workshop.class))).thenReturn(1);

        Workshop result = workshopService.update(WORKSHOP_ID, request(2));

        assertEquals(2, result.getCapacity());
        assertEquals(NOW, result.getUpdatedAt());
    }
}
