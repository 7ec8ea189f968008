package com.roombroker.domain.broker.service;

import com.roombroker.domain.auth.dto.AuthResult;
import com.roombroker.domain.auth.service.CredentialValidator;
import com.roombroker.domain.broker.dto.AuthenticateResponse;
import com.roombroker.domain.broker.dto.CreateRoomResponse;
import com.roombroker.domain.broker.dto.SelectQosResponse;
import com.roombroker.domain.qos.dto.QosDecision;
import com.roombroker.domain.qos.service.QosPolicyEngine;
import com.roombroker.domain.room.dto.RoomCreationResult;
import com.roombroker.domain.room.entity.RoomRecord;
import com.roombroker.domain.room.service.RoomRegistry;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Authenticate / CreateRoom / SelectQoS 세 연산을 각 컴포넌트에 위임하고 응답 형태로 바꾼다.
 * 비즈니스 거절은 예외가 아니라 응답의 error 필드로 돌려준다.
 */
@Service
public class BrokerService {

    public static final String ROOM_FIELDS_REQUIRED = "userId and roomName required";
    public static final String ROOM_ID_REQUIRED = "roomId required";

    private static final Logger log = LoggerFactory.getLogger(BrokerService.class);

    private final CredentialValidator credentialValidator;
    private final RoomRegistry roomRegistry;
    private final QosPolicyEngine qosPolicyEngine;

    public BrokerService(CredentialValidator credentialValidator, RoomRegistry roomRegistry,
            QosPolicyEngine qosPolicyEngine) {
        this.credentialValidator = credentialValidator;
        this.roomRegistry = roomRegistry;
        this.qosPolicyEngine = qosPolicyEngine;
    }

    public AuthenticateResponse authenticate(String token) {
        AuthResult result = credentialValidator.validate(token);
        if (!result.isValid()) {
            log.debug("Authentication rejected: {}", result.getError());
            return AuthenticateResponse.invalid(result.getError());
        }
        return AuthenticateResponse.valid(result.getUserId());
    }

    public CreateRoomResponse createRoom(String userId, String roomName) {
        return createRoom(userId, roomName, null);
    }

    /**
     * @param timeout 호출자가 지정한 제한 시간. null이면 설정값을 쓴다.
     */
    public CreateRoomResponse createRoom(String userId, String roomName, Duration timeout) {
        if (isEmpty(userId) || isEmpty(roomName)) {
            return CreateRoomResponse.failed(ROOM_FIELDS_REQUIRED);
        }
        RoomCreationResult result = roomRegistry.createRoom(userId, roomName, timeout);
        if (!result.isCreated()) {
            return CreateRoomResponse.failed(result.getError());
        }
        return CreateRoomResponse.created(result.getRoomId());
    }

    public SelectQosResponse selectQos(String roomId, int bandwidthKb, int latencyMs) {
        if (isEmpty(roomId)) {
            return new SelectQosResponse(false, ROOM_ID_REQUIRED);
        }
        QosDecision decision = qosPolicyEngine.evaluate(bandwidthKb, latencyMs);
        return new SelectQosResponse(decision.isAccepted(), decision.getReason());
    }

    public Optional<RoomRecord> findRoom(String roomId) {
        if (isEmpty(roomId)) {
            return Optional.empty();
        }
        return roomRegistry.findRoom(roomId);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
