package com.chatapi.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private static final String GOOD_SECRET = "dGVzdC1jaGF0LWFwaS1qd3Qtc2VjcmV0LTAxMjM0NTY3ODlhYmNkZWY=";

    @Test
    void acceptsSaneConfiguration() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("jwt.secret", GOOD_SECRET)
                .withProperty("jwt.expiration", "3600000")
                .withProperty("jwt.refresh-expiration", "2592000000");

        assertThat(new EnvironmentValidator(environment).validate()).isEmpty();
    }

    @Test
    void reportsEveryProblem() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("jwt.secret", "short")
                .withProperty("jwt.expiration", "1000")
                .withProperty("jwt.refresh-expiration", "500");

        assertThat(new EnvironmentValidator(environment).validate()).hasSize(3);
    }

    @Test
    void developmentSecretIsRejectedInProd() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("jwt.secret", EnvironmentValidator.DEV_JWT_SECRET);
        environment.setActiveProfiles("prod");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("development default");
    }

    @Test
    void missingSecretIsReported() {
        assertThat(new EnvironmentValidator(new MockEnvironment()).validate())
                .containsExactly("jwt.secret is required");
    }
}
