package com.roombroker.domain.room.store;

/**
 * 분산 저장소 호출 실패를 표현하는 런타임 예외.
 */
public class CoordinationStoreException extends RuntimeException {

    public CoordinationStoreException(String message) {
        super(message);
    }

    public CoordinationStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 재시도하면 성공할 수도 있는 실패인지 여부. 결과가 불확실한 쓰기도 여기에 속한다.
     */
    public boolean isTransient() {
        return false;
    }
}
