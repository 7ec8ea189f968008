package com.roombroker.domain.broker.dto;

/**
 * 방 생성 요청 바디. 빈 값 검증은 BrokerService가 응답 데이터로 처리한다.
 */
public class CreateRoomRequest {

    private String userId;
    private String roomName;

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getRoomName() {
        return roomName;
    }

    public void setRoomName(String roomName) {
        this.roomName = roomName;
    }
}
