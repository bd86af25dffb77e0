package com.chatapi.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.chatapi.backend.global.error.ProblemException;
import com.chatapi.backend.global.security.AuthenticatedUser;
import com.chatapi.backend.modules.auth.presentation.dto.LoginRequest;
import com.chatapi.backend.modules.auth.presentation.dto.SignupRequest;
import com.chatapi.backend.support.AuthFixture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.BadCredentialsException;

/**
 * 가입부터 로그아웃/탈퇴까지의 흐름을 가드(AccessTokenAuthenticator)와 함께 검증한다.
 */
class SessionLifecycleScenarioTest {

    private static final ClientMetadata CLIENT = ClientMetadata.unknown();

    private AuthFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new AuthFixture();
    }

    @Test
    void loggedOutAccessTokenIsRejectedBeforeItExpires() {
        UUID userId = fixture.authService.signUp(new SignupRequest("a@x.com", "password1", "u1", null)).id();
        AuthenticatedSession t0 = fixture.authService.login(new LoginRequest("a@x.com", "password1"), CLIENT);

        AuthenticatedUser principal = fixture.authenticator.authenticate(t0.accessToken());
        assertThat(principal.userId()).isEqualTo(userId);

        fixture.authService.logout(t0.accessToken(), t0.refreshToken());

        assertThat(fixture.accessTokenCodec.verify(t0.accessToken()).userId()).isEqualTo(userId);
        assertThatThrownBy(() -> fixture.authenticator.authenticate(t0.accessToken()))
                .isInstanceOf(BadCredentialsException.class);
        assertThatThrownBy(() -> fixture.authService.refresh(t0.refreshToken(), CLIENT))
                .isInstanceOf(ProblemException.class);
    }

    @Test
    void rotatedTokenPairKeepsWorkingWhileOldRefreshTokenIsDead() {
        fixture.authService.signUp(new SignupRequest("a@x.com", "password1", "u1", null));
        AuthenticatedSession first = fixture.authService.login(new LoginRequest("a@x.com", "password1"), CLIENT);

        AuthenticatedSession second = fixture.authService.refresh(first.refreshToken(), CLIENT);

        assertThat(second.accessToken()).isNotEqualTo(first.accessToken());
        assertThatThrownBy(() -> fixture.authService.refresh(first.refreshToken(), CLIENT))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED));
        assertThat(fixture.authenticator.authenticate(second.accessToken()).sessionId())
                .isEqualTo(fixture.accessTokenCodec.verify(second.accessToken()).sessionId());
    }

    @Test
    void deletedAccountCannotAuthenticateOrRefresh() {
        UUID userId = fixture.authService.signUp(new SignupRequest("a@x.com", "password1", "u1", null)).id();
        AuthenticatedSession phone = fixture.authService.login(new LoginRequest("a@x.com", "password1"), CLIENT);
        AuthenticatedSession laptop = fixture.authService.login(new LoginRequest("a@x.com", "password1"), CLIENT);

        fixture.authService.deleteAccount(userId, "password1", phone.accessToken());

        // laptop token was never blacklisted; the user lookup rejects it
        assertThatThrownBy(() -> fixture.authenticator.authenticate(laptop.accessToken()))
                .isInstanceOf(BadCredentialsException.class);
        assertThatThrownBy(() -> fixture.authService.refresh(laptop.refreshToken(), CLIENT))
                .isInstanceOf(ProblemException.class);
    }

    @Test
    void concurrentRefreshWithSameTokenHasExactlyOneWinner() throws Exception {
        fixture.authService.signUp(new SignupRequest("a@x.com", "password1", "u1", null));
        String refreshToken = fixture.authService.login(new LoginRequest("a@x.com", "password1"), CLIENT).refreshToken();

        int callers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AuthenticatedSession>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                Callable<AuthenticatedSession> call = () -> {
                    start.await();
                    return fixture.authService.refresh(refreshToken, CLIENT);
                };
                results.add(executor.submit(call));
            }
            start.countDown();

            int succeeded = 0;
            int rejected = 0;
            for (Future<AuthenticatedSession> result : results) {
                try {
                    result.get(10, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException ex) {
                    assertThat(ex.getCause()).isInstanceOf(ProblemException.class);
                    assertThat(((ProblemException) ex.getCause()).getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
                    rejected++;
                }
            }

            assertThat(succeeded).isEqualTo(1);
            assertThat(rejected).isEqualTo(callers - 1);
        } finally {
            executor.shutdownNow();
        }
        assertThat(fixture.repositories.sessions().values().stream().filter(s -> !s.isRevoked())).hasSize(1);
    }
}
