package io.factorialsystems.federationserver.service;

import io.factorialsystems.federationserver.config.FederationSecurityProperties;
import io.factorialsystems.federationserver.model.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates the configured administrator on start-up when the store has none.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminBootstrap implements ApplicationRunner {

    private final UserService userService;
    private final FederationSecurityProperties securityProperties;

    @Override
    public void run(ApplicationArguments args) {
        FederationSecurityProperties.BootstrapAdmin admin = securityProperties.getBootstrapAdmin();
        if (!admin.isConfigured()) {
            log.debug("No bootstrap admin configured");
            return;
        }
        if (userService.adminExists()) {
            log.debug("Admin account already present, skipping bootstrap");
            return;
        }

        userService.createUser(admin.getUsername(), admin.getEmail(), admin.getPassword(), UserRole.ADMIN);
        log.info("Bootstrapped admin account {}", admin.getEmail());
    }
}
