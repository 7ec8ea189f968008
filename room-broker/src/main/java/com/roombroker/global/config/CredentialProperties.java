package com.roombroker.global.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.nio.charset.StandardCharsets;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 브로커 플릿이 공유하는 토큰 서명 검증 설정.
 */
@Validated
@ConfigurationProperties(prefix = "broker.credential")
public class CredentialProperties {

    @NotBlank
    private String secret;

    private boolean requireExpiry = false;

    @Min(0)
    private long leewaySeconds = 0;

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public boolean isRequireExpiry() {
        return requireExpiry;
    }

    public void setRequireExpiry(boolean requireExpiry) {
        this.requireExpiry = requireExpiry;
    }

    public long getLeewaySeconds() {
        return leewaySeconds;
    }

    public void setLeewaySeconds(long leewaySeconds) {
        this.leewaySeconds = leewaySeconds;
    }

    public byte[] getSecretBytes() {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("broker.credential.secret must be configured");
        }
        return secret.getBytes(StandardCharsets.UTF_8);
    }
}
