package com.roombroker.domain.room.store;

import java.time.Duration;
import java.util.Optional;

/**
 * 플릿 전체가 관찰하는 분산 키-값 저장소.
 * 모든 호출은 주어진 제한 시간 안에 끝나거나 {@link CoordinationStoreTimeoutException}을 던진다.
 */
public interface CoordinationStore {

    /**
     * 키가 아직 없을 때만 값을 기록한다.
     *
     * @return 기록했으면 true, 키가 이미 존재하면 false
     */
    boolean putIfAbsent(String key, String value, Duration timeout);

    Optional<String> get(String key, Duration timeout);
}
