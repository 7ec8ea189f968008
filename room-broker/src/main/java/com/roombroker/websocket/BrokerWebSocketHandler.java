package com.roombroker.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.roombroker.domain.broker.dto.AuthenticateResponse;
import com.roombroker.domain.broker.dto.CreateRoomResponse;
import com.roombroker.domain.broker.dto.SelectQosResponse;
import com.roombroker.domain.broker.service.BrokerService;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket으로 들어온 브로커 요청을 BrokerService에 전달하고 결과를 같은 세션으로 돌려준다.
 * 세션은 응답 채널일 뿐이며 세션별 상태는 두지 않는다.
 */
@Component
public class BrokerWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(BrokerWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final BrokerService brokerService;

    public BrokerWebSocketHandler(ObjectMapper objectMapper, BrokerService brokerService) {
        this.objectMapper = objectMapper;
        this.brokerService = brokerService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.debug("WebSocket connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException ex) {
            log.debug("Unparseable frame from session {}: {}", session.getId(), ex.getOriginalMessage());
            sendError(session, null, "Malformed message");
            return;
        }
        if (payload == null || !payload.isObject()) {
            sendError(session, null, "Malformed message");
            return;
        }
        String action = text(payload, "action");
        log.debug("Incoming action {} from session {}", action, session.getId());
        switch (action) {
            case "authenticate" -> handleAuthenticate(session, payload);
            case "createRoom" -> handleCreateRoom(session, payload);
            case "selectQos" -> handleSelectQos(session, payload);
            default -> sendError(session, action, "Unknown action: " + action);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("WebSocket closed: {} ({})", session.getId(), status);
    }

    private void handleAuthenticate(WebSocketSession session, JsonNode payload) {
        AuthenticateResponse result = brokerService.authenticate(text(payload, "token"));
        ObjectNode response = objectMapper.createObjectNode();
        response.put("type", "authenticated");
        response.put("valid", result.isValid());
        response.put("userId", result.getUserId());
        response.put("error", result.getError());
        send(session, response);
    }

    private void handleCreateRoom(WebSocketSession session, JsonNode payload) {
        JsonNode timeoutNode = payload.get("timeoutMs");
        Duration timeout = timeoutNode != null && timeoutNode.canConvertToLong()
                ? Duration.ofMillis(timeoutNode.asLong())
                : null;
        CreateRoomResponse result = brokerService.createRoom(text(payload, "userId"), text(payload, "roomName"),
                timeout);
        ObjectNode response = objectMapper.createObjectNode();
        response.put("type", "roomCreated");
        response.put("roomId", result.getRoomId());
        response.put("error", result.getError());
        send(session, response);
    }

    private void handleSelectQos(WebSocketSession session, JsonNode payload) {
        Integer bandwidthKb = int32(payload, "bandwidthKb");
        Integer latencyMs = int32(payload, "latencyMs");
        if (bandwidthKb == null || latencyMs == null) {
            sendError(session, "selectQos", "Malformed message");
            return;
        }
        SelectQosResponse result = brokerService.selectQos(text(payload, "roomId"), bandwidthKb, latencyMs);
        ObjectNode response = objectMapper.createObjectNode();
        response.put("type", "qosSelected");
        response.put("accepted", result.isAccepted());
        response.put("error", result.getError());
        send(session, response);
    }

    private String text(JsonNode node, String field) {
        // 없거나 null인 필드는 빈 문자열로 취급한다.
        JsonNode valueNode = node.get(field);
        if (valueNode == null || valueNode.isNull()) {
            return "";
        }
        return valueNode.asText();
    }

    private Integer int32(JsonNode node, String field) {
        // 없는 필드는 0, int32 범위를 벗어나거나 정수가 아니면 null.
        JsonNode valueNode = node.get(field);
        if (valueNode == null || valueNode.isNull()) {
            return 0;
        }
        return valueNode.isInt() ? valueNode.intValue() : null;
    }

    private void send(WebSocketSession session, ObjectNode payload) {
        try {
            session.sendMessage(new TextMessage(payload.toString()));
        } catch (IOException ex) {
            log.error("Failed to send message to session {}", session.getId(), ex);
        }
    }

    private void sendError(WebSocketSession session, String action, String message) {
        ObjectNode error = objectMapper.createObjectNode();
        error.put("type", "error");
        error.put("action", action);
        error.put("message", message);
        send(session, error);
    }
}
