package com.roombroker.domain.room.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.roombroker.domain.room.dto.RoomCreationResult;
import com.roombroker.domain.room.entity.RoomRecord;
import com.roombroker.domain.room.store.CoordinationStore;
import com.roombroker.domain.room.store.CoordinationStoreException;
import com.roombroker.domain.room.store.CoordinationStoreTimeoutException;
import com.roombroker.domain.room.store.InMemoryCoordinationStore;
import com.roombroker.global.config.RegistryProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RoomRegistryTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
    private RegistryProperties properties;

    @BeforeEach
    void setUp() {
        properties = new RegistryProperties();
    }

    @Test
    void storesRecordUnderRoomsNamespace() throws Exception {
        InMemoryCoordinationStore store = new InMemoryCoordinationStore();
        RoomRegistry registry = registry(store, "node1");

        RoomCreationResult result = registry.createRoom("u1", "lobby");

        assertThat(result.isCreated()).isTrue();
        assertThat(result.getRoomId()).isNotBlank();
        String stored = store.entries().get("rooms/" + result.getRoomId());
        assertThat(stored).isNotNull();
        JsonNode json = objectMapper.readTree(stored);
        assertThat(json.path("id").asText()).isEqualTo(result.getRoomId());
        assertThat(json.path("name").asText()).isEqualTo("lobby");
        assertThat(json.path("ownerId").asText()).isEqualTo("u1");
    }

    @Test
    void findRoomReadsBackRegisteredRecord() {
        InMemoryCoordinationStore store = new InMemoryCoordinationStore();
        RoomRegistry registry = registry(store, "node1");
        String roomId = registry.createRoom("u1", "lobby").getRoomId();

        RoomRecord record = registry.findRoom(roomId).orElseThrow();

        assertThat(record.getName()).isEqualTo("lobby");
        assertThat(record.getOwnerId()).isEqualTo("u1");
        assertThat(record.getCreatedAt()).isEqualTo(FIXED.instant());
        assertThat(registry.findRoom("room-unknown")).isEmpty();
    }

    @Test
    void unreadableRecordSurfacesAsStoreFailure() {
        InMemoryCoordinationStore store = new InMemoryCoordinationStore();
        store.entries().put("rooms/broken", "not json");
        RoomRegistry registry = registry(store, "node1");

        assertThatThrownBy(() -> registry.findRoom("broken")).isInstanceOf(CoordinationStoreException.class);
    }

    @Test
    void concurrentCreatesAcrossInstancesNeverShareAnId() throws Exception {
        InMemoryCoordinationStore store = new InMemoryCoordinationStore();
        List<RoomRegistry> fleet = List.of(registry(store, "node1"), registry(store, "node2"));
        Set<String> ids = ConcurrentHashMap.newKeySet();
        int threads = 12;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                RoomRegistry registry = fleet.get(t % fleet.size());
                Callable<Integer> task = () -> {
                    int created = 0;
                    for (int i = 0; i < perThread; i++) {
                        RoomCreationResult result = registry.createRoom("u" + i, "room");
                        if (result.isCreated()) {
                            ids.add(result.getRoomId());
                            created++;
                        }
                    }
                    return created;
                };
                futures.add(pool.submit(task));
            }
            int total = 0;
            for (Future<Integer> future : futures) {
                total += future.get();
            }
            assertThat(total).isEqualTo(threads * perThread);
        } finally {
            pool.shutdownNow();
        }

        assertThat(ids).hasSize(threads * perThread);
        assertThat(store.entries()).hasSize(threads * perThread);
    }

    @Test
    void regeneratesIdWhenKeyAlreadyExists() {
        CoordinationStore store = mock(CoordinationStore.class);
        when(store.putIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false, true);
        RoomRegistry registry = registry(store, "node1");

        RoomCreationResult result = registry.createRoom("u1", "lobby");

        ArgumentCaptor<String> keys = ArgumentCaptor.forClass(String.class);
        verify(store, times(2)).putIfAbsent(keys.capture(), anyString(), any(Duration.class));
        assertThat(keys.getAllValues().get(0)).isNotEqualTo(keys.getAllValues().get(1));
        assertThat(result.isCreated()).isTrue();
        assertThat(keys.getAllValues().get(1)).isEqualTo("rooms/" + result.getRoomId());
    }

    @Test
    void givesUpAfterConfiguredAttempts() {
        CoordinationStore store = mock(CoordinationStore.class);
        when(store.putIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(false);
        RoomRegistry registry = registry(store, "node1");

        RoomCreationResult result = registry.createRoom("u1", "lobby");

        assertThat(result.isCreated()).isFalse();
        assertThat(result.getError()).contains("3 attempts");
        verify(store, times(3)).putIfAbsent(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void storeFailureIsReportedWithoutRetry() {
        CoordinationStore store = mock(CoordinationStore.class);
        when(store.putIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new CoordinationStoreException("etcd put failed: connection refused"));
        RoomRegistry registry = registry(store, "node1");

        RoomCreationResult result = registry.createRoom("u1", "lobby");

        assertThat(result.isCreated()).isFalse();
        assertThat(result.getError()).contains("connection refused");
        assertThat(result.isTransientFailure()).isFalse();
        verify(store, times(1)).putIfAbsent(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void timeoutIsTransientAndNotRetried() {
        CoordinationStore store = mock(CoordinationStore.class);
        when(store.putIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new CoordinationStoreTimeoutException("etcd put timed out after 3000ms", null));
        RoomRegistry registry = registry(store, "node1");

        RoomCreationResult result = registry.createRoom("u1", "lobby");

        assertThat(result.isCreated()).isFalse();
        assertThat(result.isTransientFailure()).isTrue();
        assertThat(result.getError()).contains("timed out");
        verify(store, times(1)).putIfAbsent(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void callerDeadlineIsCappedByConfiguredWriteTimeout() {
        CoordinationStore store = mock(CoordinationStore.class);
        when(store.putIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
        RoomRegistry registry = registry(store, "node1");

        registry.createRoom("u1", "lobby", Duration.ofSeconds(30));
        registry.createRoom("u1", "lobby", Duration.ofMillis(250));

        ArgumentCaptor<Duration> timeouts = ArgumentCaptor.forClass(Duration.class);
        verify(store, times(2)).putIfAbsent(anyString(), anyString(), timeouts.capture());
        assertThat(timeouts.getAllValues().get(0)).isPositive().isLessThanOrEqualTo(Duration.ofSeconds(3));
        assertThat(timeouts.getAllValues().get(1)).isPositive().isLessThanOrEqualTo(Duration.ofMillis(250));
    }

    @Test
    void lookupUsesReadTimeoutRatherThanWriteTimeout() {
        properties.setReadTimeout(Duration.ofMillis(150));
        properties.setWriteTimeout(Duration.ofSeconds(5));
        CoordinationStore store = mock(CoordinationStore.class);
        when(store.get(anyString(), any(Duration.class))).thenReturn(Optional.empty());
        RoomRegistry registry = registry(store, "node1");

        assertThat(registry.findRoom("room-1")).isEmpty();

        verify(store).get("rooms/room-1", Duration.ofMillis(150));
    }

    @Test
    void keyPrefixWithoutTrailingSlashIsNormalized() {
        properties.setKeyPrefix("rooms");
        CoordinationStore store = mock(CoordinationStore.class);
        when(store.putIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(true);
        RoomRegistry registry = registry(store, "node1");

        String roomId = registry.createRoom("u1", "lobby").getRoomId();

        verify(store).putIfAbsent(eq("rooms/" + roomId), anyString(), any(Duration.class));
    }

    private RoomRegistry registry(CoordinationStore store, String instanceId) {
        return new RoomRegistry(store, new RoomIdGenerator(instanceId, FIXED), objectMapper, properties, FIXED);
    }
}
