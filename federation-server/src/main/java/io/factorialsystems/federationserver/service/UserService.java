package io.factorialsystems.federationserver.service;

import io.factorialsystems.federationserver.config.FederationSecurityProperties;
import io.factorialsystems.federationserver.exception.ConflictException;
import io.factorialsystems.federationserver.exception.InactiveAccountException;
import io.factorialsystems.federationserver.exception.InvalidCredentialsException;
import io.factorialsystems.federationserver.exception.ResourceNotFoundException;
import io.factorialsystems.federationserver.mapper.UserMapper;
import io.factorialsystems.federationserver.model.User;
import io.factorialsystems.federationserver.model.UserRole;
import io.factorialsystems.federationserver.model.UserStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    static final String INACTIVE_ACCOUNT = "Account is inactive. Please contact an administrator.";
    static final String INVALID_CREDENTIALS = "Invalid Credentials";

    private final UserMapper userMapper;
    private final PasswordEncoder passwordEncoder;
    private final UserCacheService cacheService;
    private final FederationSecurityProperties securityProperties;
    private final Clock clock;

    public User findById(String id) {
        // Check cache first
        User cachedUser = cacheService.getCachedUser(id);
        if (cachedUser != null) {
            return cachedUser;
        }

        // Fetch from database and cache
        User user = userMapper.findById(id);
        if (user != null) {
            cacheService.cacheUser(user);
        }
        return user;
    }

    public User getProfile(String id) {
        User user = findById(id);
        if (user == null) {
            throw new ResourceNotFoundException("User not found");
        }
        return user;
    }

    public List<User> findAll() {
        return userMapper.findAll();
    }

    /**
     * Creates an active account whose membership runs for the configured number of months.
     */
    @Transactional
    public User createUser(String username, String email, String password, UserRole role) {
        String normalizedUsername = username.trim();
        String normalizedEmail = email.toLowerCase(Locale.ROOT).trim();

        // Check if user already exists
        if (userMapper.findByEmail(normalizedEmail) != null || userMapper.findByUsername(normalizedUsername) != null) {
            log.warn("Registration rejected, user already exists: username={}, email={}", normalizedUsername, normalizedEmail);
            throw new ConflictException("User already exists");
        }

        OffsetDateTime now = now();
        User user = User.builder()
                .id(UUID.randomUUID().toString())
                .username(normalizedUsername)
                .email(normalizedEmail)
                .password(passwordEncoder.encode(password))
                .role(role == null ? UserRole.MEMBER : role)
                .status(UserStatus.ACTIVE)
                .expiryDate(now.plusMonths(securityProperties.getMembershipMonths()))
                .createdAt(now)
                .updatedAt(now)
                .build();

        int result = userMapper.insert(user);
        if (result <= 0) {
            throw new RuntimeException("Failed to create user");
        }

        log.info("Created new user: id={}, username={}, email={}, role={}",
                user.getId(), user.getUsername(), user.getEmail(), user.getRole());

        cacheService.cacheUser(user);
        return user;
    }

    /**
     * Checks the credentials and the account state. A membership that lapsed since the last save is
     * persisted as inactive before the login is refused.
     */
    @Transactional(noRollbackFor = InactiveAccountException.class)
    public User authenticate(String email, String password) {
        User user = userMapper.findByEmail(email.toLowerCase(Locale.ROOT).trim());
        if (user == null || !passwordEncoder.matches(password, user.getPassword())) {
            log.warn("Login failed for email: {}", email);
            throw new InvalidCredentialsException(INVALID_CREDENTIALS);
        }

        if (user.expireIfLapsed(now())) {
            save(user);
            log.info("Membership expired for user {} at {}", user.getId(), user.getExpiryDate());
        }

        if (!user.isActive()) {
            log.warn("Login refused for inactive user: {}", user.getId());
            throw new InactiveAccountException(INACTIVE_ACCOUNT);
        }

        log.info("User {} logged in", user.getId());
        return user;
    }

    @Transactional
    public void deleteUser(String id) {
        int result = userMapper.delete(id);
        if (result <= 0) {
            throw new ResourceNotFoundException("User not found");
        }
        cacheService.evictUser(id);
        log.info("Deleted user: {}", id);
    }

    /**
     * Re-opens a membership for the given number of months, counted from now.
     */
    @Transactional
    public User reactivate(String id, int months) {
        User user = requireFromDatabase(id);
        user.setStatus(UserStatus.ACTIVE);
        user.setExpiryDate(now().plusMonths(months));
        save(user);

        log.info("Reactivated user {} for {} months", id, months);
        return user;
    }

    @Transactional
    public User toggleStatus(String id) {
        User user = requireFromDatabase(id);
        user.setStatus(user.getStatus().toggle());
        save(user);

        log.info("User {} status changed to {}", id, user.getStatus());
        return user;
    }

    /**
     * Deactivates every active account whose expiry date has passed.
     *
     * @return number of accounts deactivated
     */
    @Transactional
    public int deactivateExpiredUsers() {
        List<String> expiredIds = userMapper.deactivateExpired(now());
        expiredIds.forEach(cacheService::evictUser);
        if (!expiredIds.isEmpty()) {
            log.info("Deactivated {} expired memberships", expiredIds.size());
        }
        return expiredIds.size();
    }

    public boolean adminExists() {
        return userMapper.countByRole(UserRole.ADMIN) > 0;
    }

    private User requireFromDatabase(String id) {
        User user = userMapper.findById(id);
        if (user == null) {
            throw new ResourceNotFoundException("User not found");
        }
        return user;
    }

    private void save(User user) {
        OffsetDateTime now = now();
        user.expireIfLapsed(now);
        user.setUpdatedAt(now);

        int result = userMapper.update(user);
        if (result <= 0) {
            throw new RuntimeException("Failed to update user");
        }

        // Update cache with new user data
        cacheService.evictUser(user.getId());
        cacheService.cacheUser(user);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
