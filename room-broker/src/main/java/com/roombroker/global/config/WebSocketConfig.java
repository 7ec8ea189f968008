package com.roombroker.global.config;

import com.roombroker.websocket.BrokerWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * 브로커 WebSocket 엔드포인트를 broker.websocket 설정에 따라 등록한다.
 * 허용 출처가 비어 있으면 같은 출처 요청만 받는다.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

    private final BrokerWebSocketHandler brokerWebSocketHandler;
    private final WebSocketProperties properties;

    public WebSocketConfig(BrokerWebSocketHandler brokerWebSocketHandler, WebSocketProperties properties) {
        this.brokerWebSocketHandler = brokerWebSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = properties.getAllowedOriginPatterns().toArray(new String[0]);
        registry.addHandler(brokerWebSocketHandler, properties.getPath())
                .setAllowedOriginPatterns(origins);
        log.info("Broker WebSocket endpoint {} accepts origins {}", properties.getPath(),
                properties.getAllowedOriginPatterns());
    }
}
