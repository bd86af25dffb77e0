package com.chatapi.backend.modules.auth.presentation.dto;

public record PasswordChangeResponse(boolean success) {
}
