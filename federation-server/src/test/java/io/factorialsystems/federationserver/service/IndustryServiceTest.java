package io.factorialsystems.federationserver.service;

import io.factorialsystems.federationserver.dto.IndustryRequest;
import io.factorialsystems.federationserver.exception.ConflictException;
import io.factorialsystems.federationserver.exception.ResourceNotFoundException;
import io.factorialsystems.federationserver.mapper.IndustryMapper;
import io.factorialsystems.federationserver.model.Industry;
import io.factorialsystems.federationserver.model.Product;
import io.factorialsystems.federationserver.model.Vacancy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IndustryServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 1, 20, 14, 0, 0, 0, ZoneOffset.UTC);

    @Mock
    private IndustryMapper industryMapper;

    private IndustryService industryService;

    @BeforeEach
    void setUp() {
        industryService = new IndustryService(industryMapper, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
    }

    private Industry stored() {
        return Industry.builder()
                .id("ind-1")
                .name("Rao Textiles")
                .description("Handloom fabrics")
                .products(List.of(Product.builder().name("Saree").price(new BigDecimal("1200")).build()))
                .materials(List.of("cotton"))
                .gstInfo("29ABCDE1234F1Z5")
                .contactNumber("9876543210")
                .vacancy(new Vacancy(true, "Weavers needed"))
                .ownerId("owner-1")
                .build();
    }

    @Test
    void create_withoutVacancyStoresClosedVacancy() {
        // Given
        IndustryRequest request = new IndustryRequest();
        request.setName("  Rao Textiles ");
        request.setDescription("Handloom fabrics");
        request.setGstInfo("29ABCDE1234F1Z5");
        request.setContactNumber("9876543210");
        when(industryMapper.countByName("Rao Textiles", null)).thenReturn(0);
        when(industryMapper.insert(any(Industry.class))).thenReturn(1);
        when(industryMapper.findById(anyString())).thenAnswer(inv -> Industry.builder().id(inv.getArgument(0)).build());

        // When
        industryService.create(request, "owner-1");

        // Then
        ArgumentCaptor<Industry> captor = ArgumentCaptor.forClass(Industry.class);
        verify(industryMapper).insert(captor.capture());
        Industry inserted = captor.getValue();
        assertEquals("Rao Textiles", inserted.getName());
        assertFalse(inserted.getVacancy().isAvailable());
        assertNull(inserted.getVacancy().getDescription());
        assertTrue(inserted.getProducts().isEmpty());
        assertTrue(inserted.getImages().isEmpty());
        assertEquals("owner-1", inserted.getOwnerId());
        assertEquals(NOW, inserted.getCreatedAt());
    }

    @Test
    void create_duplicateNameIsConflict() {
        IndustryRequest request = new IndustryRequest();
        request.setName("rao textiles");
        when(industryMapper.countByName("rao textiles", null)).thenReturn(1);

        ConflictException ex = assertThrows(ConflictException.class, () -> industryService.create(request, "owner-2"));

        assertEquals("An industry with this name already exists", ex.getMessage());
        verify(industryMapper, never()).insert(any());
    }

    @Test
    void update_appliesOnlySuppliedFields() {
        Industry existing = stored();
        when(industryMapper.findById("ind-1")).thenReturn(existing);
        when(industryMapper.update(existing)).thenReturn(1);

        IndustryRequest request = new IndustryRequest();
        request.setContactNumber("9000000000");

        Industry updated = industryService.update("ind-1", request);

        assertEquals("9000000000", updated.getContactNumber());
        assertEquals("Rao Textiles", updated.getName());
        assertEquals("Handloom fabrics", updated.getDescription());
        assertEquals(1, updated.getProducts().size());
        assertTrue(updated.getVacancy().isAvailable());
        assertEquals(NOW, updated.getUpdatedAt());
        verify(industryMapper, never()).countByName(anyString(), any());
    }

    @Test
    void update_closedVacancyDropsDescription() {
        Industry existing = stored();
        when(industryMapper.findById("ind-1")).thenReturn(existing);
        when(industryMapper.update(existing)).thenReturn(1);

        IndustryRequest request = new IndustryRequest();
        request.setVacancy(new Vacancy(false, "Weavers needed"));

        Industry updated = industryService.update("ind-1", request);

        assertFalse(updated.getVacancy().isAvailable());
        assertNull(updated.getVacancy().getDescription());
    }

    @Test
    void update_renameChecksOtherIndustries() {
        when(industryMapper.findById("ind-1")).thenReturn(stored());
        when(industryMapper.countByName("Kumar Metals", "ind-1")).thenReturn(1);

        IndustryRequest request = new IndustryRequest();
        request.setName("Kumar Metals");

        assertThrows(ConflictException.class, () -> industryService.update("ind-1", request));
        verify(industryMapper, never()).update(any());
    }

    @Test
    void findById_missingIsNotFound() {
        when(industryMapper.findById("missing")).thenReturn(null);

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> industryService.findById("missing"));

        assertEquals("Industry not found", ex.getMessage());
    }

    @Test
    void delete_removesIndustry() {
        when(industryMapper.delete("ind-1")).thenReturn(1);

        industryService.delete("ind-1");

        verify(industryMapper).delete("ind-1");
        verify(industryMapper, never()).countByName(anyString(), isNull());
    }
}
