package com.chatapi.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record DeleteAccountRequest(@NotBlank(message = "password is required") String password) {
}
