package io.factorialsystems.federationserver.service;

import io.factorialsystems.federationserver.dto.IndustryRequest;
import io.factorialsystems.federationserver.exception.ConflictException;
import io.factorialsystems.federationserver.exception.ResourceNotFoundException;
import io.factorialsystems.federationserver.mapper.IndustryMapper;
import io.factorialsystems.federationserver.model.Industry;
import io.factorialsystems.federationserver.model.Vacancy;
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
public class IndustryService {

    static final String NOT_FOUND = "Industry not found";
    static final String DUPLICATE_NAME = "An industry with this name already exists";

    private final IndustryMapper industryMapper;
    private final Clock clock;

    public List<Industry> findAll() {
        return industryMapper.findAll();
    }

    public Industry findById(String id) {
        Industry industry = industryMapper.findById(id);
        if (industry == null) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        return industry;
    }

    @Transactional
    public Industry create(IndustryRequest request, String ownerId) {
        String name = request.getName().trim();
        requireUniqueName(name, null);

        OffsetDateTime now = OffsetDateTime.now(clock);
        Industry industry = Industry.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .description(request.getDescription())
                .products(copyOrEmpty(request.getProducts()))
                .materials(copyOrEmpty(request.getMaterials()))
                .gstInfo(request.getGstInfo())
                .contactNumber(request.getContactNumber())
                .vacancy(request.getVacancy() == null ? Vacancy.none() : request.getVacancy().normalized())
                .images(copyOrEmpty(request.getImages()))
                .ownerId(ownerId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        int result = industryMapper.insert(industry);
        if (result <= 0) {
            throw new RuntimeException("Failed to create industry");
        }

        log.info("Created industry: id={}, name={}, owner={}", industry.getId(), industry.getName(), ownerId);
        return findById(industry.getId());
    }

    /**
     * Applies the supplied fields only. Omitted (null) fields keep their stored values.
     */
    @Transactional
    public Industry update(String id, IndustryRequest request) {
        Industry industry = findById(id);

        if (request.getName() != null) {
            String name = request.getName().trim();
            requireUniqueName(name, id);
            industry.setName(name);
        }
        if (request.getDescription() != null) {
            industry.setDescription(request.getDescription());
        }
        if (request.getProducts() != null) {
            industry.setProducts(new ArrayList<>(request.getProducts()));
        }
        if (request.getMaterials() != null) {
            industry.setMaterials(new ArrayList<>(request.getMaterials()));
        }
        if (request.getGstInfo() != null) {
            industry.setGstInfo(request.getGstInfo());
        }
        if (request.getContactNumber() != null) {
            industry.setContactNumber(request.getContactNumber());
        }
        if (request.getVacancy() != null) {
            industry.setVacancy(request.getVacancy().normalized());
        }
        if (request.getImages() != null) {
            industry.setImages(new ArrayList<>(request.getImages()));
        }
        industry.setUpdatedAt(OffsetDateTime.now(clock));

        int result = industryMapper.update(industry);
        if (result <= 0) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }

        log.info("Updated industry: id={}, name={}", id, industry.getName());
        return industry;
    }

    @Transactional
    public void delete(String id) {
        int result = industryMapper.delete(id);
        if (result <= 0) {
            throw new ResourceNotFoundException(NOT_FOUND);
        }
        log.info("Deleted industry: {}", id);
    }

    private void requireUniqueName(String name, String excludeId) {
        if (industryMapper.countByName(name, excludeId) > 0) {
            log.warn("Industry name already taken: {}", name);
            throw new ConflictException(DUPLICATE_NAME);
        }
    }

    private static <T> List<T> copyOrEmpty(List<T> source) {
        return source == null ? new ArrayList<>() : new ArrayList<>(source);
    }
}
