package com.chatapi.backend.modules.auth.domain;

/**
 * 리프레시 세션이 폐기된 사유.
 */
public enum RevocationReason {
    LOGOUT,
    ROTATED,
    ACCOUNT_DELETED,
    PASSWORD_CHANGED,
    EXPIRED
}
