package com.roombroker.domain.auth.dto;

import java.util.Objects;

/**
 * 자격 증명 검증 결과. 성공이면 userId, 실패면 거절 사유만 담는다.
 */
public final class AuthResult {

    private final String userId;
    private final String error;

    private AuthResult(String userId, String error) {
        this.userId = userId;
        this.error = error;
    }

    public static AuthResult success(String userId) {
        return new AuthResult(Objects.requireNonNull(userId, "userId must not be null"), null);
    }

    public static AuthResult failure(String error) {
        return new AuthResult(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isValid() {
        return userId != null;
    }

    public String getUserId() {
        return userId;
    }

    public String getError() {
        return error;
    }
}
