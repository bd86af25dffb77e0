package com.chatapi.backend.modules.auth.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.cookie;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.chatapi.backend.global.security.AccessTokenAuthenticator;
import com.chatapi.backend.global.security.AuthCookies;
import com.chatapi.backend.global.security.RefreshTokenGuard;
import com.chatapi.backend.global.security.RestAuthenticationEntryPoint;
import com.chatapi.backend.global.security.SecurityConfig;
import com.chatapi.backend.modules.auth.application.AuthService;
import com.chatapi.backend.support.AuthFixture;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/**
 * 실제 보안 필터 체인과 컨트롤러를 DB 없이 구동한다. 서비스는 Map 저장소 위의 실제 구현이다.
 */
@WebMvcTest(controllers = {AuthController.class, ProfileController.class})
@Import({SecurityConfig.class, RestAuthenticationEntryPoint.class, AuthCookies.class, RefreshTokenGuard.class})
class AuthControllerTest {

    private static final String EMAIL = "frank@example.com";
    private static final String PASSWORD = "password1";

    @TestConfiguration
    static class AuthFixtureBeans {

        @Bean
        AuthFixture authFixture() {
            return new AuthFixture();
        }

        @Bean
        AuthService authService(AuthFixture fixture) {
            return fixture.authService;
        }

        @Bean
        AccessTokenAuthenticator accessTokenAuthenticator(AuthFixture fixture) {
            return fixture.authenticator;
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AuthFixture fixture;

    @BeforeEach
    void setUp() throws Exception {
        fixture.repositories.sessions().clear();
        fixture.repositories.users().clear();

        mockMvc.perform(
                        post("/auth/signup")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {"email": "%s", "password": "%s", "nickname": "frank"}
                                        """.formatted(EMAIL, PASSWORD))
                )
                .andExpect(status().isCreated());
    }

    @Test
    void accessTokenStopsWorkingAfterLogout() throws Exception {
        MvcResult login = login();
        String accessToken = accessToken(login);
        Cookie refreshCookie = login.getResponse().getCookie("refresh_token");

        mockMvc.perform(get("/users/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(EMAIL));

        mockMvc.perform(
                        post("/auth/logout")
                                .header("Authorization", "Bearer " + accessToken)
                                .cookie(refreshCookie)
                )
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Logged out successfully"))
                .andExpect(cookie().maxAge("jwt", 0))
                .andExpect(cookie().maxAge("refresh_token", 0));

        mockMvc.perform(get("/users/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
        mockMvc.perform(get("/users/me").cookie(new Cookie("jwt", accessToken)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void replayedRefreshTokenIsRejectedAndCookiesCleared() throws Exception {
        MvcResult login = login();
        Cookie original = login.getResponse().getCookie("refresh_token");

        MvcResult rotated = mockMvc.perform(post("/auth/refresh").cookie(original))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user.email").value(EMAIL))
                .andReturn();
        Cookie successor = rotated.getResponse().getCookie("refresh_token");
        assertThat(successor.getValue()).isNotEqualTo(original.getValue());

        mockMvc.perform(post("/auth/refresh").cookie(original))
                .andExpect(status().isUnauthorized())
                .andExpect(cookie().maxAge("jwt", 0))
                .andExpect(cookie().maxAge("refresh_token", 0));

        mockMvc.perform(get("/users/me").header("Authorization", "Bearer " + accessToken(rotated)))
                .andExpect(status().isOk());
    }

    @Test
    void protectedEndpointWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/users/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
        mockMvc.perform(post("/auth/logout"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void refreshWithoutCookieIsUnauthorized() throws Exception {
        mockMvc.perform(post("/auth/refresh"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("MISSING_REFRESH_TOKEN"));
    }

    private MvcResult login() throws Exception {
        return mockMvc.perform(
                        post("/auth/login")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {"email": "%s", "password": "%s"}
                                        """.formatted(EMAIL, PASSWORD))
                )
                .andExpect(status().isCreated())
                .andExpect(cookie().httpOnly("jwt", true))
                .andExpect(cookie().path("refresh_token", "/auth"))
                .andReturn();
    }

    private String accessToken(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString()).path("token").asText();
    }
}
