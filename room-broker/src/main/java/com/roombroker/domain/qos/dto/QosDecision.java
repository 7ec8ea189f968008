package com.roombroker.domain.qos.dto;

/**
 * QoS 승인 결정. 거절일 때만 reason이 채워진다.
 */
public final class QosDecision {

    private static final QosDecision ACCEPTED = new QosDecision(true, null);

    private final boolean accepted;
    private final String reason;

    private QosDecision(boolean accepted, String reason) {
        this.accepted = accepted;
        this.reason = reason;
    }

    public static QosDecision accept() {
        return ACCEPTED;
    }

    public static QosDecision reject(String reason) {
        return new QosDecision(false, reason);
    }

    public boolean isAccepted() {
        return accepted;
    }

    public String getReason() {
        return reason;
    }
}
