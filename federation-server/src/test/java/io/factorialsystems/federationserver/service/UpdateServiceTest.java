package io.factorialsystems.federationserver.service;

import io.factorialsystems.federationserver.dto.UpdateRequest;
import io.factorialsystems.federationserver.exception.RequestValidationException;
import io.factorialsystems.federationserver.exception.ResourceNotFoundException;
import io.factorialsystems.federationserver.mapper.UpdateMapper;
import io.factorialsystems.federationserver.model.Update;
import io.factorialsystems.federationserver.model.UpdateType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UpdateServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 4, 2, 9, 30, 0, 0, ZoneOffset.UTC);

    @Mock
    private UpdateMapper updateMapper;

    private UpdateService updateService;

    @BeforeEach
    void setUp() {
        updateService = new UpdateService(updateMapper, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
    }

    private UpdateRequest request(String type, String redirectUrl) {
        UpdateRequest request = new UpdateRequest();
        request.setType(type);
        request.setTitle("Quarterly meetup");
        request.setContent("Join us at the community hall");
        request.setRedirectUrl(redirectUrl);
        return request;
    }

    @Test
    void create_newsDropsSuppliedRedirectUrl() {
        when(updateMapper.insert(any(Update.class))).thenReturn(1);
        when(updateMapper.findById(anyString())).thenAnswer(inv -> Update.builder().id(inv.getArgument(0)).build());

        updateService.create(request("news", "https://example.org/post"), "user-1");

        ArgumentCaptor<Update> captor = ArgumentCaptor.forClass(Update.class);
        verify(updateMapper).insert(captor.capture());
        assertEquals(UpdateType.NEWS, captor.getValue().getType());
        assertNull(captor.getValue().getRedirectUrl());
        assertEquals("user-1", captor.getValue().getCreatedById());
        assertEquals(NOW, captor.getValue().getCreatedAt());
    }

    @Test
    void create_blogWithoutRedirectUrlIsRejected() {
        RequestValidationException ex = assertThrows(RequestValidationException.class,
                () -> updateService.create(request("blogs", "  "), "user-1"));

        assertEquals("redirectUrl", ex.getViolations().get(0).field());
        assertEquals("Redirect URL is required for blogs", ex.getViolations().get(0).msg());
        verify(updateMapper, never()).insert(any());
    }

    @Test
    void create_blogKeepsTrimmedRedirectUrl() {
        when(updateMapper.insert(any(Update.class))).thenReturn(1);
        when(updateMapper.findById(anyString())).thenAnswer(inv -> Update.builder().id(inv.getArgument(0)).build());

        updateService.create(request("BLOGS", " https://example.org/post "), "user-1");

        ArgumentCaptor<Update> captor = ArgumentCaptor.forClass(Update.class);
        verify(updateMapper).insert(captor.capture());
        assertEquals(UpdateType.BLOGS, captor.getValue().getType());
        assertEquals("https://example.org/post", captor.getValue().getRedirectUrl());
    }

    @Test
    void update_blogWithoutNewLinkKeepsExistingOne() {
        Update existing = Update.builder()
                .id("u-1")
                .type(UpdateType.BLOGS)
                .redirectUrl("https://example.org/old")
                .build();
        when(updateMapper.findById("u-1")).thenReturn(existing);
        when(updateMapper.update(existing)).thenReturn(1);

        Update updated = updateService.update("u-1", request("blogs", null));

        assertEquals("https://example.org/old", updated.getRedirectUrl());
        assertEquals(NOW, updated.getUpdatedAt());
    }

    @Test
    void update_switchingAwayFromBlogClearsRedirectUrl() {
        Update existing = Update.builder()
                .id("u-1")
                .type(UpdateType.BLOGS)
                .redirectUrl("https://example.org/old")
                .build();
        when(updateMapper.findById("u-1")).thenReturn(existing);
        when(updateMapper.update(existing)).thenReturn(1);

        Update updated = updateService.update("u-1", request("announcement", null));

        assertEquals(UpdateType.ANNOUNCEMENT, updated.getType());
        assertNull(updated.getRedirectUrl());
    }

    @Test
    void update_switchingToBlogRequiresLink() {
        Update existing = Update.builder().id("u-1").type(UpdateType.NEWS).build();
        when(updateMapper.findById("u-1")).thenReturn(existing);

        assertThrows(RequestValidationException.class, () -> updateService.update("u-1", request("blogs", null)));
        verify(updateMapper, never()).update(any());
    }

    @Test
    void delete_missingIsNotFound() {
        when(updateMapper.delete("missing")).thenReturn(0);

        assertThrows(ResourceNotFoundException.class, () -> updateService.delete("missing"));
    }
}
