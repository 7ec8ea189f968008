package com.roombroker.global.config;

import com.roombroker.domain.room.service.RoomIdGenerator;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RegistryConfig {

    private static final Logger log = LoggerFactory.getLogger(RegistryConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RoomIdGenerator roomIdGenerator(RegistryProperties properties, Clock clock) {
        String instanceId = properties.getInstanceId();
        if (instanceId == null || instanceId.isBlank()) {
            // 인스턴스마다 다른 값이 되도록 기동 시 한 번만 만든다.
            instanceId = RoomIdGenerator.randomInstanceId();
        }
        log.info("Room ids will be issued with instance id {}", instanceId);
        return new RoomIdGenerator(instanceId, clock);
    }
}
