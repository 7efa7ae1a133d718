package io.factorialsystems.federationserver.service;

import io.factorialsystems.federationserver.dto.UpdateRequest;
import io.factorialsystems.federationserver.exception.RequestValidationException;
import io.factorialsystems.federationserver.exception.ResourceNotFoundException;
import io.factorialsystems.federationserver.mapper.UpdateMapper;
import io.factorialsystems.federationserver.model.Update;
import io.factorialsystems.federationserver.model.UpdateType;
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
public class UpdateService {

    static final String NOT_FOUND = "Update not found";
    static final String REDIRECT_REQUIRED = "Redirect URL is required for blogs";

    private final UpdateMapper updateMapper;
    private final Clock clock;

    public List<Update> findAll(UpdateType type) {
        return updateMapper.findAll(type);
    }

    public Update findById(String id) {
        Update update = updateMapper.findById(id);
        if (update == null) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        return update;
    }

    @Transactional
    public Update create(UpdateRequest request, String creatorId) {
        UpdateType type = UpdateType.fromValue(request.getType());
        OffsetDateTime now = OffsetDateTime.now(clock);

        Update update = Update.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .title(request.getTitle())
                .content(request.getContent())
                .imageUrl(request.getImageUrl())
                .redirectUrl(resolveRedirectUrl(type, request.getRedirectUrl(), null))
                .createdById(creatorId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        int result = updateMapper.insert(update);
        if (result <= 0) {
            throw new RuntimeException("Failed to create update");
        }

        log.info("Created update: id={}, type={}, title={}", update.getId(), type, update.getTitle());
        return findById(update.getId());
    }

    @Transactional
    public Update update(String id, UpdateRequest request) {
        Update existing = findById(id);
        UpdateType type = UpdateType.fromValue(request.getType());

        existing.setRedirectUrl(resolveRedirectUrl(type, request.getRedirectUrl(), existing));
        existing.setType(type);
        existing.setTitle(request.getTitle());
        existing.setContent(request.getContent());
        if (request.getImageUrl() != null) {
            existing.setImageUrl(request.getImageUrl());
        }
        existing.setUpdatedAt(OffsetDateTime.now(clock));

        int result = updateMapper.update(existing);
        if (result <= 0) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }

        log.info("Updated update: id={}, type={}", id, type);
        return existing;
    }

    @Transactional
    public void delete(String id) {
        int result = updateMapper.delete(id);
        if (result <= 0) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        log.info("Deleted update: {}", id);
    }

    /**
     * Derives the stored redirect URL from the type. Non-blog types never keep one; a blog keeps its
     * previous link when the request omits it.
     */
    static String resolveRedirectUrl(UpdateType type, String requested, Update existing) {
        if (!type.requiresRedirectUrl()) {
            return null;
        }
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        if (existing != null && existing.getType() == UpdateType.BLOGS
                && existing.getRedirectUrl() != null && !existing.getRedirectUrl().isBlank()) {
            return existing.getRedirectUrl();
        }
        throw new RequestValidationException("redirectUrl", REDIRECT_REQUIRED);
    }
}
