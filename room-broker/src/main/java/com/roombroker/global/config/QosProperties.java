package com.roombroker.global.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * QoS 승인 임계값. 두 경계 모두 승인 쪽에 포함된다.
 */
@Validated
@ConfigurationProperties(prefix = "broker.qos")
public class QosProperties {

    @Min(0)
    private int minBandwidthKb = 1000;

    @Min(0)
    private int maxLatencyMs = 100;

    public int getMinBandwidthKb() {
        return minBandwidthKb;
    }

    public void setMinBandwidthKb(int minBandwidthKb) {
        this.minBandwidthKb = minBandwidthKb;
    }

    public int getMaxLatencyMs() {
        return maxLatencyMs;
    }

    public void setMaxLatencyMs(int maxLatencyMs) {
        this.maxLatencyMs = maxLatencyMs;
    }
}
