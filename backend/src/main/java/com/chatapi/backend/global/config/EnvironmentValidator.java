package com.chatapi.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 인증 관련 필수 설정을 검증한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "ZGV2LW9ubHktY2hhdC1hcGktand0LXNlY3JldC1jaGFuZ2UtbWUtMjAyNQ==";
    private static final int MIN_SECRET_BYTES = 32;
    private static final long MIN_ACCESS_TTL_MILLIS = 60_000L;
    private static final long MAX_ACCESS_TTL_MILLIS = 86_400_000L;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Invalid authentication configuration: " + String.join("; ", problems));
        }
        log.info("Authentication configuration validated");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        Optional<String> secret = Optional.ofNullable(environment.getProperty("jwt.secret"))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
        if (secret.isEmpty()) {
            problems.add("jwt.secret is required");
        } else {
            if (secretLength(secret.get()) < MIN_SECRET_BYTES) {
                problems.add("jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
            }
            if (secret.get().equals(DEV_JWT_SECRET) && environment.acceptsProfiles(Profiles.of("prod"))) {
                problems.add("jwt.secret still uses the development default");
            }
        }

        Long accessTtl = readLong("jwt.expiration", problems);
        Long refreshTtl = readLong("jwt.refresh-expiration", problems);
        if (accessTtl != null && (accessTtl < MIN_ACCESS_TTL_MILLIS || accessTtl > MAX_ACCESS_TTL_MILLIS)) {
            problems.add("jwt.expiration must be between " + MIN_ACCESS_TTL_MILLIS + " and " + MAX_ACCESS_TTL_MILLIS + " ms");
        }
        if (accessTtl != null && refreshTtl != null && refreshTtl <= accessTtl) {
            problems.add("jwt.refresh-expiration must be longer than jwt.expiration");
        }
        return problems;
    }

    private Long readLong(String key, List<String> problems) {
        String raw = environment.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            problems.add(key + " must be a number of milliseconds");
            return null;
        }
    }

    private static int secretLength(String secret) {
        try {
            return Base64.getDecoder().decode(secret).length;
        } catch (IllegalArgumentException ex) {
            return secret.getBytes(StandardCharsets.UTF_8).length;
        }
    }
}
