package com.chatapi.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignupRequest(
        @NotBlank(message = "email is required")
        @Email(message = "email must be well-formed")
        @Size(max = 320, message = "email must be at most 320 characters")
        String email,

        // BCrypt only considers the first 72 bytes
        @NotBlank(message = "password is required")
        @Size(min = 8, max = 72, message = "password must be between 8 and 72 characters")
        String password,

        @NotBlank(message = "nickname is required")
        @Size(max = 50, message = "nickname must be at most 50 characters")
        String nickname,

        @Size(max = 2048, message = "imageUrl must be at most 2048 characters")
        String imageUrl
) {
}
