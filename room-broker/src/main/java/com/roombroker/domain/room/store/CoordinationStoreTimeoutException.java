package com.roombroker.domain.room.store;

/**
 * 제한 시간 안에 저장소 응답을 받지 못했다. 쓰기였다면 반영 여부를 알 수 없다.
 */
public class CoordinationStoreTimeoutException extends CoordinationStoreException {

    public CoordinationStoreTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
