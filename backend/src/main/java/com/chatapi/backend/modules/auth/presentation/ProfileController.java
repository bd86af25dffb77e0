package com.chatapi.backend.modules.auth.presentation;

import com.chatapi.backend.global.security.AuthenticatedUser;
import com.chatapi.backend.modules.auth.application.AuthService;
import com.chatapi.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "내 프로필 조회")
    @GetMapping("/users/me")
    public ResponseEntity<UserProfileResponse> currentUser(@AuthenticationPrincipal AuthenticatedUser principal) {
        return ResponseEntity.ok(authService.loadProfile(principal.userId()));
    }
}
