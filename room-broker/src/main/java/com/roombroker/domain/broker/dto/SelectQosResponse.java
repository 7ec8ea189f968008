package com.roombroker.domain.broker.dto;

public class SelectQosResponse {

    private boolean accepted;
    private String error = "";

    public SelectQosResponse() {
    }

    public SelectQosResponse(boolean accepted, String error) {
        this.accepted = accepted;
        setError(error);
    }

    public boolean isAccepted() {
        return accepted;
    }

    public void setAccepted(boolean accepted) {
        this.accepted = accepted;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error == null ? "" : error;
    }
}
