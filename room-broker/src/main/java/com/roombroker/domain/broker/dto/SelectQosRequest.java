package com.roombroker.domain.broker.dto;

public class SelectQosRequest {

    private String roomId;
    private int bandwidthKb;
    private int latencyMs;

    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }

    public int getBandwidthKb() {
        return bandwidthKb;
    }

    public void setBandwidthKb(int bandwidthKb) {
        this.bandwidthKb = bandwidthKb;
    }

    public int getLatencyMs() {
        return latencyMs;
    }

    public void setLatencyMs(int latencyMs) {
        this.latencyMs = latencyMs;
    }
}
