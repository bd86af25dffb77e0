package com.chatapi.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.chatapi.backend.global.error.ProblemException;
import com.chatapi.backend.modules.auth.application.AuthService;
import com.chatapi.backend.modules.auth.application.AuthenticatedSession;
import com.chatapi.backend.modules.auth.application.ClientMetadata;
import com.chatapi.backend.modules.auth.infrastructure.persistence.RefreshSessionRepository;
import com.chatapi.backend.modules.auth.presentation.dto.LoginRequest;
import com.chatapi.backend.modules.auth.presentation.dto.SignupRequest;
import com.chatapi.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class RefreshRotationConcurrencyIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final int CALLERS = 8;

    @Autowired
    private AuthService authService;

    @Autowired
    private RefreshSessionRepository refreshSessionRepository;

    @Test
    void concurrentRefreshWithSameTokenHasSingleWinner() throws Exception {
        authService.signUp(new SignupRequest("race@x.com", "password1", "racer", null));
        AuthenticatedSession initial = authService.login(
                new LoginRequest("race@x.com", "password1"), ClientMetadata.unknown());
        String sharedToken = initial.refreshToken();

        ExecutorService executor = Executors.newFixedThreadPool(CALLERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < CALLERS; i++) {
                Callable<Boolean> call = () -> {
                    start.await();
                    try {
                        authService.refresh(sharedToken, ClientMetadata.unknown());
                        return true;
                    } catch (ProblemException ex) {
                        return false;
                    }
                };
                outcomes.add(executor.submit(call));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> outcome : outcomes) {
                if (outcome.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }

        // the original session plus the one minted by the winner
        assertThat(refreshSessionRepository.count()).isEqualTo(2);
    }
}
