package io.factorialsystems.federationserver.security;

import io.factorialsystems.federationserver.exception.ResourceNotFoundException;
import io.factorialsystems.federationserver.mapper.*;
import io.factorialsystems.federationserver.model.ResourceOwnership;
import io.factorialsystems.federationserver.model.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Authorization predicates referenced from {@code @PreAuthorize} expressions, e.g.
 * {@code @accessPolicy.ownerOrAdmin('INDUSTRY', #id, authentication)}.
 * <p>
 * Existence is checked first: a missing resource raises {@link ResourceNotFoundException} before
 * any ownership or role decision is made. A {@code false} result becomes a 403.
 */
@Slf4j
@Component("accessPolicy")
public class AccessPolicy {

    public enum ResourceKind {
        INDUSTRY("Industry not found"),
        UPDATE("Update not found"),
        EMERGENCY_CONTACT("Emergency contact not found"),
        POLL("Poll not found"),
        WORKSHOP("Workshop not found"),
        FEEDBACK_QUESTION("Feedback question not found"),
        FEEDBACK_RESPONSE("Feedback response not found"),
        USER("User not found");

        private final String notFoundMessage;

        ResourceKind(String notFoundMessage) {
            this.notFoundMessage = notFoundMessage;
        }

        public String getNotFoundMessage() {
            return notFoundMessage;
        }
    }

    private final Map<ResourceKind, Function<String, ResourceOwnership>> lookups = new EnumMap<>(ResourceKind.class);

    public AccessPolicy(IndustryMapper industryMapper,
                        UpdateMapper updateMapper,
                        EmergencyContactMapper emergencyContactMapper,
                        PollMapper pollMapper,
                        WorkshopMapper workshopMapper,
                        FeedbackQuestionMapper feedbackQuestionMapper,
                        FeedbackResponseMapper feedbackResponseMapper,
                        UserMapper userMapper) {
        lookups.put(ResourceKind.INDUSTRY, industryMapper::findOwnership);
        lookups.put(ResourceKind.UPDATE, updateMapper::findOwnership);
        lookups.put(ResourceKind.EMERGENCY_CONTACT,
                id -> emergencyContactMapper.exists(id) ? new ResourceOwnership(id, null) : null);
        lookups.put(ResourceKind.POLL, pollMapper::findOwnership);
        lookups.put(ResourceKind.WORKSHOP, workshopMapper::findOwnership);
        lookups.put(ResourceKind.FEEDBACK_QUESTION, feedbackQuestionMapper::findOwnership);
        lookups.put(ResourceKind.FEEDBACK_RESPONSE, feedbackResponseMapper::findOwnership);
        lookups.put(ResourceKind.USER, id -> {
            User user = userMapper.findById(id);
            return user == null ? null : new ResourceOwnership(user.getId(), user.getId());
        });
    }

    /**
     * Allows admins and the user that owns the resource.
     */
    public boolean ownerOrAdmin(String kind, String id, Authentication authentication) {
        ResourceOwnership ownership = require(ResourceKind.valueOf(kind), id);
        AuthenticatedUser caller = AuthenticatedUser.from(authentication);

        boolean allowed = caller.isAdmin() || caller.id().equals(ownership.getOwnerId());
        if (!allowed) {
            log.warn("User {} denied access to {} {} owned by {}", caller.id(), kind, id, ownership.getOwnerId());
        }
        return allowed;
    }

    /**
     * Allows admins only, after confirming the resource exists.
     */
    public boolean adminFor(String kind, String id, Authentication authentication) {
        require(ResourceKind.valueOf(kind), id);
        AuthenticatedUser caller = AuthenticatedUser.from(authentication);

        if (!caller.isAdmin()) {
            log.warn("Non-admin user {} denied admin operation on {} {}", caller.id(), kind, id);
            return false;
        }
        return true;
    }

    /**
     * Allows any authenticated caller once the resource is known to exist.
     */
    public boolean exists(String kind, String id) {
        require(ResourceKind.valueOf(kind), id);
        return true;
    }

    private ResourceOwnership require(ResourceKind kind, String id) {
        ResourceOwnership ownership = id == null ? null : lookups.get(kind).apply(id);
        if (ownership == null) {
            throw new ResourceNotFoundException(kind.getNotFoundMessage());
        }
        return ownership;
    }
}
