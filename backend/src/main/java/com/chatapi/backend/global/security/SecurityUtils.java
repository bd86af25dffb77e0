package com.chatapi.backend.global.security;

import java.util.UUID;

import com.chatapi.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static AuthenticatedUser getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof AuthenticatedUser principal)) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, AccessTokenAuthenticator.UNAUTHORIZED);
        }
        return principal;
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    /**
     * Raw access token the current request authenticated with.
     */
    public static String getCurrentAccessToken() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getCredentials() instanceof String token)) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, AccessTokenAuthenticator.UNAUTHORIZED);
        }
        return token;
    }
}
