package com.roombroker.global.config;

import com.roombroker.domain.room.store.CoordinationStore;
import com.roombroker.domain.room.store.CoordinationStoreException;
import com.roombroker.domain.room.store.EtcdCoordinationStore;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.ClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * etcd 클라이언트와 저장소 Bean을 정의한다.
 * 시작 시 한 번 접속을 확인하고, 실패하면 컨텍스트 기동을 중단시킨다.
 */
@Configuration
public class EtcdConfig {

    private static final Logger log = LoggerFactory.getLogger(EtcdConfig.class);

    @Bean(destroyMethod = "close")
    public Client etcdClient(EtcdProperties properties) {
        if (properties.getEndpoints().isEmpty()) {
            throw new IllegalStateException("etcd.endpoints must be configured");
        }
        return configure(Client.builder(), properties).build();
    }

    /**
     * jetcd의 자동 재시도를 끈다. 이미 반영된 트랜잭션이 재전송되면 충돌로 보여 방이 중복 기록된다.
     */
    static ClientBuilder configure(ClientBuilder builder, EtcdProperties properties) {
        return builder
                .endpoints(properties.getEndpoints().toArray(new String[0]))
                .connectTimeout(properties.getConnectTimeout())
                .retryMaxAttempts(0);
    }

    @Bean
    public CoordinationStore coordinationStore(Client etcdClient, EtcdProperties etcdProperties,
            RegistryProperties registryProperties) {
        EtcdCoordinationStore store = new EtcdCoordinationStore(etcdClient.getKVClient());
        verifyConnection(store, etcdProperties, registryProperties);
        return store;
    }

    private void verifyConnection(CoordinationStore store, EtcdProperties etcdProperties,
            RegistryProperties registryProperties) {
        try {
            store.get(registryProperties.getNormalizedKeyPrefix(), etcdProperties.getConnectTimeout());
        } catch (CoordinationStoreException ex) {
            throw new IllegalStateException("etcd is unreachable at " + etcdProperties.getEndpoints(), ex);
        }
        log.info("Connected to etcd at {}", etcdProperties.getEndpoints());
    }
}
