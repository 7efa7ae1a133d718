package io.factorialsystems.federationserver.controller;

import io.factorialsystems.federationserver.dto.*;
import io.factorialsystems.federationserver.model.User;
import io.factorialsystems.federationserver.model.UserRole;
import io.factorialsystems.federationserver.security.AuthenticatedUser;
import io.factorialsystems.federationserver.security.TokenService;
import io.factorialsystems.federationserver.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final UserService userService;
    private final TokenService tokenService;
    private final RequestValidator requestValidator;

    /**
     * Self-registration. Returns a token for the new member.
     */
    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        log.info("Registering user: {}", request.getEmail());

        User user = userService.createUser(request.getUsername(), request.getEmail(), request.getPassword(), UserRole.MEMBER);
        return ResponseEntity.ok(new AuthResponse(tokenService.issue(user), user.getRole()));
    }

    /**
     * Authenticate user and get token
     */
    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        log.info("Login attempt for: {}", request.getEmail());

        User user = userService.authenticate(request.getEmail(), request.getPassword());
        return ResponseEntity.ok(new AuthResponse(tokenService.issue(user), user.getRole()));
    }

    /**
     * Get current user info from JWT token
     */
    @GetMapping("/me")
    public ResponseEntity<UserResponse> getCurrentUser(Authentication authentication) {
        AuthenticatedUser caller = AuthenticatedUser.from(authentication);
        log.info("Getting current user info for {}", caller.id());

        return ResponseEntity.ok(UserResponse.from(userService.getProfile(caller.id())));
    }

    /**
     * Register a user on someone's behalf (admin only)
     */
    @PostMapping("/users")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> createUser(@RequestBody CreateUserRequest request) {
        requestValidator.validate(request);
        log.info("Admin registering user: {}", request.getEmail());

        UserRole role = request.getRole() == null ? UserRole.MEMBER : UserRole.fromValue(request.getRole());
        userService.createUser(request.getUsername(), request.getEmail(), request.getPassword(), role);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("msg", "User registered successfully"));
    }

    /**
     * List all users (admin only)
     */
    @GetMapping("/users")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<UserResponse>> listUsers() {
        log.info("Listing all users");
        return ResponseEntity.ok(userService.findAll().stream().map(UserResponse::from).toList());
    }

    @DeleteMapping("/users/{id}")
    @PreAuthorize("@accessPolicy.adminFor('USER', #id, authentication)")
    public ResponseEntity<Map<String, Object>> deleteUser(@PathVariable String id) {
        log.info("Deleting user: {}", id);

        userService.deleteUser(id);
        return ResponseEntity.ok(Map.of("msg", "User deleted"));
    }

    /**
     * Reactivate a membership for the given number of months
     */
    @PutMapping("/users/{id}/reactivate")
    @PreAuthorize("@accessPolicy.adminFor('USER', #id, authentication)")
    public ResponseEntity<Map<String, Object>> reactivateUser(@PathVariable String id,
                                                              @RequestBody ReactivateRequest request) {
        requestValidator.validate(request);
        log.info("Reactivating user {} for {} months", id, request.getMonths());

        userService.reactivate(id, request.getMonths());
        return ResponseEntity.ok(Map.of("msg", "User reactivated for " + request.getMonths() + " months."));
    }

    @PutMapping("/users/{id}/toggle-status")
    @PreAuthorize("@accessPolicy.adminFor('USER', #id, authentication)")
    public ResponseEntity<Map<String, Object>> toggleStatus(@PathVariable String id) {
        log.info("Toggling status for user: {}", id);

        User user = userService.toggleStatus(id);
        return ResponseEntity.ok(Map.of(
                "msg", "User status changed to " + user.getStatus().getValue() + ".",
                "user", UserResponse.from(user)));
    }
}
