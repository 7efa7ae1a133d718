package io.factorialsystems.federationserver.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class UserExpirySweeper {

    private final UserService userService;

    @Scheduled(fixedRateString = "${federation.expiry-sweep-interval:PT1H}", initialDelayString = "${federation.expiry-sweep-initial-delay:PT1M}")
    public void sweep() {
        try {
            userService.deactivateExpiredUsers();
        } catch (RuntimeException e) {
            log.error("Membership expiry sweep failed", e);
        }
    }
}
