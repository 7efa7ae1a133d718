package io.factorialsystems.federationserver.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.factorialsystems.federationserver.model.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Read-through cache of user profiles keyed by id. Cached entries never contain the password hash.
 * Redis failures are logged and treated as a miss.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserCacheService {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    private static final String USER_KEY_PREFIX = "federation:user:";

    private static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    /**
     * Cache user by ID
     */
    public void cacheUser(User user) {
        if (user == null) return;

        try {
            String userJson = objectMapper.writeValueAsString(user);
            redisTemplate.opsForValue().set(USER_KEY_PREFIX + user.getId(), userJson, DEFAULT_TTL);
            log.debug("Cached user: {} with TTL: {}", user.getId(), DEFAULT_TTL);

        } catch (JsonProcessingException e) {
            log.error("Failed to serialize user for caching: {}", user.getId(), e);
        } catch (RuntimeException e) {
            log.warn("Redis unavailable, user {} not cached: {}", user.getId(), e.getMessage());
        }
    }

    /**
     * Get cached user by ID
     */
    public User getCachedUser(String userId) {
        if (userId == null) return null;

        try {
            String userJson = redisTemplate.opsForValue().get(USER_KEY_PREFIX + userId);

            if (userJson != null) {
                log.debug("Cache hit for user: {}", userId);
                return objectMapper.readValue(userJson, User.class);
            }

            log.debug("Cache miss for user: {}", userId);
            return null;

        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize cached user: {}", userId, e);
            return null;
        } catch (RuntimeException e) {
            log.warn("Redis unavailable, reading user {} from database: {}", userId, e.getMessage());
            return null;
        }
    }

    /**
     * Invalidate user cache
     */
    public void evictUser(String userId) {
        if (userId == null) return;

        try {
            redisTemplate.delete(USER_KEY_PREFIX + userId);
            log.debug("Evicted user cache: {}", userId);
        } catch (RuntimeException e) {
            log.warn("Failed to evict cached user {}: {}", userId, e.getMessage());
        }
    }
}
