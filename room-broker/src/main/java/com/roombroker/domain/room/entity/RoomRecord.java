package com.roombroker.domain.room.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * 분산 저장소의 rooms/&lt;id&gt; 아래 한 번만 기록되는 방 정보. 기록 후에는 바뀌지 않는다.
 */
public final class RoomRecord {

    private final String id;
    private final String name;
    private final String ownerId;
    private final Instant createdAt;

    @JsonCreator
    public RoomRecord(@JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("ownerId") String ownerId,
            @JsonProperty("createdAt") Instant createdAt) {
        this.id = Objects.requireNonNull(id, "room id must not be null");
        this.name = name;
        this.ownerId = ownerId;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
