package com.chatapi.backend.health;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 헬스체크 엔드포인트. 인증 없이 호출된다.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    static final String SERVICE_NAME = "chat-api";

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;
    private final Instant startedAt;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * 프런트엔드/로드밸런서용 상태 요약
     */
    @GetMapping("/health")
    public ServiceHealthResponse health() {
        Instant now = clock.instant();
        return new ServiceHealthResponse(
                "ok",
                now.toString(),
                SERVICE_NAME,
                Duration.between(startedAt, now).toSeconds()
        );
    }

    /**
     * 기본 헬스체크 - 애플리케이션이 살아있는지만 확인
     */
    @GetMapping("/healthz")
    public ProbeResponse healthz() {
        return new ProbeResponse("UP", clock.instant().toString());
    }

    /**
     * 레디니스 체크 - DB 연결 확인
     */
    @GetMapping("/readyz")
    public ProbeResponse readyz() {
        try {
            HealthComponent healthComponent = healthEndpoint.health();
            String status = healthComponent.getStatus().getCode();

            if (healthComponent instanceof CompositeHealth composite) {
                HealthComponent db = composite.getComponents().get("db");
                if (db != null) {
                    status = db.getStatus().getCode();
                }
            }
            return new ProbeResponse(status, clock.instant().toString());
        } catch (RuntimeException e) {
            log.warn("Readiness check failed", e);
            return new ProbeResponse("DOWN", clock.instant().toString());
        }
    }

    public record ServiceHealthResponse(String status, String timestamp, String service, long uptimeSeconds) {
    }

    public record ProbeResponse(
            String status,   // "UP" | "DOWN"
            String timestamp
    ) {
    }
}
