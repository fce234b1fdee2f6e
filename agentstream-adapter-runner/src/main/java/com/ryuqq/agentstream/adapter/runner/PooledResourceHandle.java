package com.ryuqq.agentstream.adapter.runner;

import com.ryuqq.agentstream.application.resource.ResourceHandle;
import com.ryuqq.agentstream.core.error.ResourceConnectionException;
import com.ryuqq.agentstream.core.model.RequestId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;
import com.ryuqq.agentstream.core.spi.ResourceClient;
import com.ryuqq.agentstream.core.spi.ResourceCommand;
import com.ryuqq.agentstream.core.spi.ResourceConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * UserResourceFactory가 발급하는 핸들.
 *
 * <p>하위 클라이언트는 첫 {@link #execute} 시점에 연결되고 health check를 거칩니다.
 * 연결은 핸들 자체의 lock으로 직렬화되며, 팩토리 lock과는 무관합니다.</p>
 *
 * <p>acquire 횟수({@code holders})는 팩토리 lock 안에서만 변경됩니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
final class PooledResourceHandle implements ResourceHandle {

    private static final Logger log = LoggerFactory.getLogger(PooledResourceHandle.class);

    private final HandleKey key;
    private final ThreadId threadId;
    private final ResourceConnector connector;
    private final Clock clock;
    private final long createdAt;
    private final Object connectLock = new Object();
    private final AtomicLong operationCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();

    private volatile long lastUsedAt;
    private volatile ResourceClient client;
    private volatile boolean released;
    private volatile int holders;

    PooledResourceHandle(HandleKey key, ThreadId threadId, ResourceConnector connector, Clock clock) {
        this.key = key;
        this.threadId = threadId;
        this.connector = connector;
        this.clock = clock;
        this.createdAt = clock.millis();
        this.lastUsedAt = createdAt;
    }

    @Override
    public Object execute(String operation, Map<String, Object> parameters) throws Exception {
        if (released) {
            throw new IllegalStateException("Resource handle for " + key.userId() + " / " + key.requestId() + " has been released");
        }
        ResourceClient connected = ensureConnected();
        ResourceCommand command = new ResourceCommand(operation, key.userId(), parameters);
        lastUsedAt = clock.millis();
        operationCount.incrementAndGet();
        try {
            return connected.execute(command);
        } catch (Exception e) {
            errorCount.incrementAndGet();
            throw e;
        } finally {
            lastUsedAt = clock.millis();
        }
    }

    private ResourceClient ensureConnected() {
        ResourceClient current = client;
        if (current != null) {
            return current;
        }
        synchronized (connectLock) {
            if (client != null) {
                return client;
            }
            ResourceClient candidate;
            try {
                candidate = connector.connect(key.userId());
            } catch (Exception e) {
                errorCount.incrementAndGet();
                throw new ResourceConnectionException("Failed to connect resource client for " + key.userId(), e);
            }
            if (candidate == null) {
                errorCount.incrementAndGet();
                throw new ResourceConnectionException("Connector returned no client for " + key.userId());
            }

            boolean healthy;
            try {
                healthy = candidate.healthCheck();
            } catch (RuntimeException e) {
                errorCount.incrementAndGet();
                candidate.close();
                throw new ResourceConnectionException("Health check failed for " + key.userId(), e);
            }
            if (!healthy) {
                errorCount.incrementAndGet();
                candidate.close();
                throw new ResourceConnectionException("Health check failed for " + key.userId());
            }
            client = candidate;
            log.debug("Initialized resource client for {} / {}", key.userId(), key.requestId());
            return candidate;
        }
    }

    /**
     * 레지스트리에서 제거되었음을 표시. 팩토리 lock 안에서 호출됩니다.
     */
    void markReleased() {
        released = true;
    }

    /**
     * 하위 클라이언트 연결 해제. 팩토리 lock 밖에서 호출됩니다.
     */
    void closeClient() {
        ResourceClient current;
        synchronized (connectLock) {
            current = client;
            client = null;
        }
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close resource client for {} / {}", key.userId(), key.requestId(), e);
        }
    }

    void hold() {
        holders++;
    }

    /**
     * acquire 한 번 반환.
     *
     * @return 남은 사용자가 없으면 true
     */
    boolean dropHold() {
        if (holders > 0) {
            holders--;
        }
        return holders == 0;
    }

    long idleMillis(long now) {
        return now - lastUsedAt;
    }

    HandleKey key() {
        return key;
    }

    @Override
    public UserId userId() {
        return key.userId();
    }

    @Override
    public RequestId requestId() {
        return key.requestId();
    }

    @Override
    public ThreadId threadId() {
        return threadId;
    }

    @Override
    public long createdAt() {
        return createdAt;
    }

    @Override
    public long lastUsedAt() {
        return lastUsedAt;
    }

    @Override
    public long operationCount() {
        return operationCount.get();
    }

    @Override
    public long errorCount() {
        return errorCount.get();
    }

    @Override
    public boolean isInitialized() {
        return client != null;
    }

    @Override
    public boolean isReleased() {
        return released;
    }

    @Override
    public boolean isInUse() {
        return holders > 0;
    }

    @Override
    public String toString() {
        return "ResourceHandle{" + key.userId() + ", " + key.requestId() + '}';
    }
}
