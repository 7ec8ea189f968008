package com.roombroker.domain.broker.dto;

public class CreateRoomResponse {

    private String roomId = "";
    private String error = "";

    public CreateRoomResponse() {
    }

    public CreateRoomResponse(String roomId, String error) {
        setRoomId(roomId);
        setError(error);
    }

    public static CreateRoomResponse created(String roomId) {
        return new CreateRoomResponse(roomId, "");
    }

    public static CreateRoomResponse failed(String error) {
        return new CreateRoomResponse("", error);
    }

    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId == null ? "" : roomId;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error == null ? "" : error;
    }
}
