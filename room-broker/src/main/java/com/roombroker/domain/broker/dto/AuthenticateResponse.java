package com.roombroker.domain.broker.dto;

/**
 * Authenticate 응답. 실패해도 호출 자체는 성공하며 valid=false와 사유를 돌려준다.
 */
public class AuthenticateResponse {

    private boolean valid;
    private String userId = "";
    private String error = "";

    public AuthenticateResponse() {
    }

    public AuthenticateResponse(boolean valid, String userId, String error) {
        this.valid = valid;
        setUserId(userId);
        setError(error);
    }

    public static AuthenticateResponse valid(String userId) {
        return new AuthenticateResponse(true, userId, "");
    }

    public static AuthenticateResponse invalid(String error) {
        return new AuthenticateResponse(false, "", error);
    }

    public boolean isValid() {
        return valid;
    }

    public void setValid(boolean valid) {
        this.valid = valid;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId == null ? "" : userId;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error == null ? "" : error;
    }
}
