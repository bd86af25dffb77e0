package com.chatapi.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record UserProfileResponse(
        UUID id,
        String email,
        String nickname,
        String imageUrl,
        OffsetDateTime createdAt
) {
}
