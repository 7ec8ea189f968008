package com.roombroker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot 진입점. 룸 브로커 서버 전체를 실행한다.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RoomBrokerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoomBrokerApplication.class, args);
    }
}
