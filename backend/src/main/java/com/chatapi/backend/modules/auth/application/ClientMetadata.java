package com.chatapi.backend.modules.auth.application;

/**
 * 세션 발급 시 함께 기록하는 클라이언트 정보. 컬럼 길이에 맞춰 잘라서 보관한다.
 */
public record ClientMetadata(String userAgent, String ipAddress) {

    static final int USER_AGENT_MAX_LENGTH = 512;
    static final int IP_ADDRESS_MAX_LENGTH = 64;

    public static ClientMetadata of(String userAgent, String ipAddress) {
        return new ClientMetadata(
                normalize(userAgent, USER_AGENT_MAX_LENGTH),
                normalize(ipAddress, IP_ADDRESS_MAX_LENGTH)
        );
    }

    public static ClientMetadata unknown() {
        return new ClientMetadata(null, null);
    }

    private static String normalize(String raw, int maxLength) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}
