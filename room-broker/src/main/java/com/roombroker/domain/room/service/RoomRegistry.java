package com.roombroker.domain.room.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roombroker.domain.room.dto.RoomCreationResult;
import com.roombroker.domain.room.entity.RoomRecord;
import com.roombroker.domain.room.store.CoordinationStore;
import com.roombroker.domain.room.store.CoordinationStoreException;
import com.roombroker.global.config.RegistryProperties;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 방 ID를 발급하고 분산 저장소에 방 정보를 한 번만 기록한다.
 * ownerId/name 검증은 호출자(BrokerService)의 책임이다.
 */
@Service
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final CoordinationStore store;
    private final RoomIdGenerator idGenerator;
    private final ObjectMapper objectMapper;
    private final RegistryProperties properties;
    private final Clock clock;

    public RoomRegistry(CoordinationStore store, RoomIdGenerator idGenerator, ObjectMapper objectMapper,
            RegistryProperties properties, Clock clock) {
        this.store = store;
        this.idGenerator = idGenerator;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public RoomCreationResult createRoom(String ownerId, String name) {
        return createRoom(ownerId, name, null);
    }

    /**
     * 새 방을 등록한다. 호출자가 준 제한 시간은 설정된 쓰기 제한 시간을 넘을 수 없다.
     * 키 충돌이면 ID를 다시 만들어 시도하지만, 시간 초과나 저장소 오류는 재시도하지 않는다.
     */
    public RoomCreationResult createRoom(String ownerId, String name, Duration requestedTimeout) {
        Duration timeout = effectiveTimeout(requestedTimeout);
        long deadline = System.nanoTime() + timeout.toNanos();
        int maxAttempts = properties.getMaxIdAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String roomId = idGenerator.nextId();
            String value;
            try {
                value = objectMapper.writeValueAsString(new RoomRecord(roomId, name, ownerId, clock.instant()));
            } catch (JsonProcessingException ex) {
                log.error("Failed to encode room record {}", roomId, ex);
                return RoomCreationResult.failed("failed to encode room record: " + ex.getOriginalMessage(), false);
            }
            Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
            if (remaining.isNegative() || remaining.isZero()) {
                return RoomCreationResult.failed("store write timed out after " + timeout.toMillis() + "ms", true);
            }
            try {
                if (store.putIfAbsent(keyOf(roomId), value, remaining)) {
                    log.info("Room {} registered by {}", roomId, ownerId);
                    return RoomCreationResult.created(roomId);
                }
            } catch (CoordinationStoreException ex) {
                log.warn("Room registration failed for owner {}: {}", ownerId, ex.getMessage());
                return RoomCreationResult.failed(ex.getMessage(), ex.isTransient());
            }
            log.warn("Room id collision on {} (attempt {}/{})", roomId, attempt, maxAttempts);
        }
        return RoomCreationResult.failed("could not allocate a unique room id after " + maxAttempts + " attempts",
                false);
    }

    /**
     * 등록된 방 정보를 조회한다. 저장소 오류는 {@link CoordinationStoreException}으로 전파된다.
     */
    public Optional<RoomRecord> findRoom(String roomId) {
        Optional<String> raw = store.get(keyOf(roomId), properties.getReadTimeout());
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw.get(), RoomRecord.class));
        } catch (JsonProcessingException ex) {
            throw new CoordinationStoreException("room record " + roomId + " is unreadable", ex);
        }
    }

    String keyOf(String roomId) {
        return properties.getNormalizedKeyPrefix() + roomId;
    }

    private Duration effectiveTimeout(Duration requested) {
        Duration configured = properties.getWriteTimeout();
        if (requested == null || requested.isNegative() || requested.isZero()) {
            return configured;
        }
        return requested.compareTo(configured) < 0 ? requested : configured;
    }
}
