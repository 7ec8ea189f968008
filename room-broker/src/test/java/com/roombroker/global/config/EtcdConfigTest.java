package com.roombroker.global.config;

import io.etcd.jetcd.Client;
import io.etcd.jetcd.ClientBuilder;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.Answers;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class EtcdConfigTest {

    private final EtcdConfig config = new EtcdConfig();

    @Test
    void clientIsBuiltWithoutAutomaticRetries() {
        ClientBuilder builder = mock(ClientBuilder.class, Answers.RETURNS_SELF);
        EtcdProperties properties = properties("http://etcd-0:2379");

        EtcdConfig.configure(builder, properties);

        verify(builder).retryMaxAttempts(0);
        verify(builder).connectTimeout(Duration.ofSeconds(1));
    }

    @Test
    void unreachableStoreAbortsStartup() {
        EtcdProperties properties = properties("http://127.0.0.1:1");
        Client client = config.etcdClient(properties);
        try {
            assertThatThrownBy(() -> config.coordinationStore(client, properties, new RegistryProperties()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("etcd is unreachable");
        } finally {
            client.close();
        }
    }

    @Test
    void missingEndpointsAbortStartup() {
        assertThatThrownBy(() -> config.etcdClient(new EtcdProperties()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("etcd.endpoints");
    }

    private static EtcdProperties properties(String endpoint) {
        EtcdProperties properties = new EtcdProperties();
        properties.setEndpoints(List.of(endpoint));
        properties.setConnectTimeout(Duration.ofSeconds(1));
        return properties;
    }
}
