package com.roombroker.domain.room.store;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.PutOption;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * jetcd KV 클라이언트 위에 구현한 {@link CoordinationStore}.
 * KV 클라이언트는 스레드 안전하므로 하나의 인스턴스를 모든 요청이 공유한다.
 */
public class EtcdCoordinationStore implements CoordinationStore {

    private static final Logger log = LoggerFactory.getLogger(EtcdCoordinationStore.class);

    private final KV kv;

    public EtcdCoordinationStore(KV kv) {
        this.kv = kv;
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration timeout) {
        ByteSequence keyBytes = bytes(key);
        // version == 0 이면 아직 한 번도 기록되지 않은 키다.
        CompletableFuture<TxnResponse> future = kv.txn()
                .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.version(0L)))
                .Then(Op.put(keyBytes, bytes(value), PutOption.DEFAULT))
                .commit();
        TxnResponse response = await(future, "put " + key, timeout);
        log.debug("etcd conditional put {} succeeded={}", key, response.isSucceeded());
        return response.isSucceeded();
    }

    @Override
    public Optional<String> get(String key, Duration timeout) {
        GetResponse response = await(kv.get(bytes(key)), "get " + key, timeout);
        List<KeyValue> kvs = response.getKvs();
        if (kvs.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(kvs.get(0).getValue().toString(StandardCharsets.UTF_8));
    }

    private <T> T await(CompletableFuture<T> future, String operation, Duration timeout) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new CoordinationStoreTimeoutException(
                    "etcd " + operation + " timed out after " + timeout.toMillis() + "ms", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CoordinationStoreException("etcd " + operation + " interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            throw new CoordinationStoreException("etcd " + operation + " failed: " + cause.getMessage(), cause);
        }
    }

    private static ByteSequence bytes(String value) {
        return ByteSequence.from(value, StandardCharsets.UTF_8);
    }
}
