package com.roombroker.domain.qos.service;

import com.roombroker.domain.qos.dto.QosDecision;
import com.roombroker.global.config.QosProperties;
import org.springframework.stereotype.Service;

@Service
public class QosPolicyEngine {

    public static final String OUT_OF_POLICY = "QoS parameters out of policy";

    private final int minBandwidthKb;
    private final int maxLatencyMs;

    public QosPolicyEngine(QosProperties properties) {
        this.minBandwidthKb = properties.getMinBandwidthKb();
        this.maxLatencyMs = properties.getMaxLatencyMs();
    }

    // 어느 경계를 벗어났는지는 구분하지 않는다.
    public QosDecision evaluate(int bandwidthKb, int latencyMs) {
        if (latencyMs <= maxLatencyMs && bandwidthKb >= minBandwidthKb) {
            return QosDecision.accept();
        }
        return QosDecision.reject(OUT_OF_POLICY);
    }
}
