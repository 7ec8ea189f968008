package com.roombroker.domain.broker.dto;

public class AuthenticateRequest {

    private String token;

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }
}
