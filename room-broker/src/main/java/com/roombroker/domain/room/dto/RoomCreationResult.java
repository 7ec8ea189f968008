package com.roombroker.domain.room.dto;

import java.util.Objects;

/**
 * 방 등록 결과. 성공이면 roomId, 실패면 저장소 오류 메시지를 담는다.
 */
public final class RoomCreationResult {

    private final String roomId;
    private final String error;
    private final boolean transientFailure;

    private RoomCreationResult(String roomId, String error, boolean transientFailure) {
        this.roomId = roomId;
        this.error = error;
        this.transientFailure = transientFailure;
    }

    public static RoomCreationResult created(String roomId) {
        return new RoomCreationResult(Objects.requireNonNull(roomId, "roomId must not be null"), null, false);
    }

    public static RoomCreationResult failed(String error, boolean transientFailure) {
        return new RoomCreationResult(null, Objects.requireNonNull(error, "error must not be null"), transientFailure);
    }

    public boolean isCreated() {
        return roomId != null;
    }

    public String getRoomId() {
        return roomId;
    }

    public String getError() {
        return error;
    }

    /**
     * 제한 시간 초과처럼 쓰기 반영 여부를 알 수 없는 실패인지 여부.
     */
    public boolean isTransientFailure() {
        return transientFailure;
    }
}
