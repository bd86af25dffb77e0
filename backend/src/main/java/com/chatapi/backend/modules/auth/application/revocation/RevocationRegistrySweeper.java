package com.chatapi.backend.modules.auth.application.revocation;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RevocationRegistrySweeper {

    private static final Logger log = LoggerFactory.getLogger(RevocationRegistrySweeper.class);

    private final RevocationRegistry revocationRegistry;
    private final Clock clock;

    public RevocationRegistrySweeper(RevocationRegistry revocationRegistry, Clock clock) {
        this.revocationRegistry = revocationRegistry;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.auth.revocation.sweep-interval:PT1H}")
    public void sweep() {
        int removed = revocationRegistry.sweepExpired(clock.instant());
        if (removed > 0) {
            log.info("Removed {} expired blacklist entries", removed);
        }
    }
}
