package com.roombroker.domain.room.store;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 단일 키 단위로 직렬화되는 etcd 동작을 흉내 내는 테스트용 저장소.
 */
public class InMemoryCoordinationStore implements CoordinationStore {

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public boolean putIfAbsent(String key, String value, Duration timeout) {
        return entries.putIfAbsent(key, value) == null;
    }

    @Override
    public Optional<String> get(String key, Duration timeout) {
        return Optional.ofNullable(entries.get(key));
    }

    public Map<String, String> entries() {
        return entries;
    }
}
