package com.chatapi.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 만료됐지만 아직 폐기 표시가 없는 리프레시 세션을 정리하고, 보존 기간이 지난 폐기 세션을 삭제한다.
 */
@Component
public class RefreshSessionMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshSessionMaintenanceScheduler.class);

    private final RefreshSessionService refreshSessionService;
    private final Duration retention;
    private final Clock clock;

    public RefreshSessionMaintenanceScheduler(
            RefreshSessionService refreshSessionService,
            @Value("${app.auth.refresh-session.retention:P90D}") Duration retention,
            Clock clock
    ) {
        this.refreshSessionService = refreshSessionService;
        this.retention = retention;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.auth.refresh-session.maintenance-interval:PT1H}")
    @Transactional
    public void runMaintenance() {
        int expired = refreshSessionService.revokeAllExpired();
        if (expired > 0) {
            log.info("Marked {} expired refresh sessions as revoked", expired);
        }
        if (retention.isZero() || retention.isNegative()) {
            return;
        }
        int purged = refreshSessionService.purgeRevokedBefore(OffsetDateTime.now(clock).minus(retention));
        if (purged > 0) {
            log.info("Purged {} refresh sessions older than {}", purged, retention);
        }
    }
}
