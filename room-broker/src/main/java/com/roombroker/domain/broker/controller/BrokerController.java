package com.roombroker.domain.broker.controller;

import com.roombroker.domain.broker.dto.AuthenticateRequest;
import com.roombroker.domain.broker.dto.AuthenticateResponse;
import com.roombroker.domain.broker.dto.CreateRoomRequest;
import com.roombroker.domain.broker.dto.CreateRoomResponse;
import com.roombroker.domain.broker.dto.SelectQosRequest;
import com.roombroker.domain.broker.dto.SelectQosResponse;
import com.roombroker.domain.broker.service.BrokerService;
import com.roombroker.domain.room.dto.RoomResponse;
import com.roombroker.domain.room.entity.RoomRecord;
import java.time.Duration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class BrokerController {

    static final String TIMEOUT_HEADER = "X-Request-Timeout-Ms";

    private final BrokerService brokerService;

    public BrokerController(BrokerService brokerService) {
        this.brokerService = brokerService;
    }

    @PostMapping("/auth/authenticate")
    public ResponseEntity<AuthenticateResponse> authenticate(
            @RequestBody(required = false) AuthenticateRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String token = request != null && request.getToken() != null && !request.getToken().isEmpty()
                ? request.getToken()
                : authorization;
        return ResponseEntity.ok(brokerService.authenticate(token));
    }

    @PostMapping("/rooms")
    public ResponseEntity<CreateRoomResponse> createRoom(@RequestBody CreateRoomRequest request,
            @RequestHeader(value = TIMEOUT_HEADER, required = false) Long timeoutMs) {
        Duration timeout = timeoutMs == null ? null : Duration.ofMillis(timeoutMs);
        return ResponseEntity.ok(brokerService.createRoom(request.getUserId(), request.getRoomName(), timeout));
    }

    @GetMapping("/rooms/{roomId}")
    public ResponseEntity<RoomResponse> getRoom(@PathVariable String roomId) {
        return brokerService.findRoom(roomId)
                .map(room -> ResponseEntity.ok(toResponse(room)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/qos/select")
    public ResponseEntity<SelectQosResponse> selectQos(@RequestBody SelectQosRequest request) {
        return ResponseEntity.ok(brokerService.selectQos(request.getRoomId(), request.getBandwidthKb(),
                request.getLatencyMs()));
    }

    private RoomResponse toResponse(RoomRecord room) {
        RoomResponse response = new RoomResponse();
        response.setId(room.getId());
        response.setName(room.getName());
        response.setOwnerId(room.getOwnerId());
        response.setCreatedAt(room.getCreatedAt());
        return response;
    }
}
