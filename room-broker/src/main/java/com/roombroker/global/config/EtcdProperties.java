package com.roombroker.global.config;

import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * etcd 클러스터 접속 정보를 바인딩한다.
 */
@Validated
@ConfigurationProperties(prefix = "etcd")
public class EtcdProperties {

    @NotEmpty
    private List<String> endpoints = new ArrayList<>();

    private Duration connectTimeout = Duration.ofSeconds(3);

    public List<String> getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(List<String> endpoints) {
        if (endpoints == null) {
            this.endpoints = new ArrayList<>();
            return;
        }
        List<String> flattened = new ArrayList<>();
        for (String entry : endpoints) {
            if (entry == null) {
                continue;
            }
            for (String part : entry.split(",")) {
                flattened.add(part);
            }
        }
        this.endpoints = flattened.stream()
                .map(String::trim)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toList());
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }
}
