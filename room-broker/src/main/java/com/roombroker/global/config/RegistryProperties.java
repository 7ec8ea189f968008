package com.roombroker.global.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 룸 레지스트리의 키 네임스페이스와 쓰기 제한 시간을 바인딩한다.
 */
@Validated
@ConfigurationProperties(prefix = "broker.registry")
public class RegistryProperties {

    @NotBlank
    private String keyPrefix = "rooms/";

    private Duration writeTimeout = Duration.ofSeconds(3);

    private Duration readTimeout = Duration.ofSeconds(2);

    @Min(1)
    private int maxIdAttempts = 3;

    private String instanceId;

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public Duration getWriteTimeout() {
        return writeTimeout;
    }

    public void setWriteTimeout(Duration writeTimeout) {
        this.writeTimeout = writeTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public int getMaxIdAttempts() {
        return maxIdAttempts;
    }

    public void setMaxIdAttempts(int maxIdAttempts) {
        this.maxIdAttempts = maxIdAttempts;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    /**
     * 후행 슬래시가 보장된 키 접두사를 반환한다.
     */
    public String getNormalizedKeyPrefix() {
        if (keyPrefix == null || keyPrefix.isBlank()) {
            throw new IllegalStateException("broker.registry.key-prefix must be configured");
        }
        return keyPrefix.endsWith("/") ? keyPrefix : keyPrefix + "/";
    }
}
