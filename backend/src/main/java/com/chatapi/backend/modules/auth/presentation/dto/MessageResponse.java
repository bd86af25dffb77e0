package com.chatapi.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
