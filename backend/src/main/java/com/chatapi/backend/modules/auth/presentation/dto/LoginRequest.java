package com.chatapi.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be well-formed") String email,
        @NotBlank(message = "password is required") String password
) {
}
