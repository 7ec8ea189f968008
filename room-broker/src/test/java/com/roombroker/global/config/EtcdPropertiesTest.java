package com.roombroker.global.config;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EtcdPropertiesTest {

    @Test
    void splitsCommaSeparatedEndpointsFromEnvironment() {
        EtcdProperties properties = new EtcdProperties();

        properties.setEndpoints(List.of("http://etcd-0:2379, http://etcd-1:2379", " ", "http://etcd-2:2379"));

        assertThat(properties.getEndpoints())
                .containsExactly("http://etcd-0:2379", "http://etcd-1:2379", "http://etcd-2:2379");
    }

    @Test
    void blankOrMissingEndpointsLeaveListEmpty() {
        EtcdProperties properties = new EtcdProperties();

        properties.setEndpoints(Arrays.asList("", null));
        assertThat(properties.getEndpoints()).isEmpty();

        properties.setEndpoints(null);
        assertThat(properties.getEndpoints()).isEmpty();
    }
}
