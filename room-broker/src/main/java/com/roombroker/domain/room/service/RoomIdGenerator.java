package com.roombroker.domain.room.service;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Objects;

/**
 * 여러 브로커 인스턴스가 동시에 호출해도 겹치지 않는 방 ID를 만든다.
 * 형식: room-&lt;epoch millis, 36진수&gt;-&lt;instanceId&gt;-&lt;64비트 난수, 16진수&gt;
 */
public class RoomIdGenerator {

    private static final String PREFIX = "room-";
    private static final int RANDOM_BYTES = 8;

    private final String instanceId;
    private final Clock clock;
    private final SecureRandom random;

    public RoomIdGenerator(String instanceId, Clock clock) {
        this(instanceId, clock, new SecureRandom());
    }

    RoomIdGenerator(String instanceId, Clock clock, SecureRandom random) {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId is required");
        }
        this.instanceId = instanceId;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * 설정값이 비어 있을 때 사용할 짧은 인스턴스 식별자를 만든다.
     */
    public static String randomInstanceId() {
        byte[] bytes = new byte[3];
        new SecureRandom().nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public String nextId() {
        byte[] suffix = new byte[RANDOM_BYTES];
        random.nextBytes(suffix);
        return PREFIX + Long.toString(clock.millis(), 36) + "-" + instanceId + "-" + HexFormat.of().formatHex(suffix);
    }

    public String getInstanceId() {
        return instanceId;
    }
}
