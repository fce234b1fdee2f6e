package com.ryuqq.agentstream.adapter.runner;

import com.ryuqq.agentstream.application.resource.HandleCallback;
import com.ryuqq.agentstream.application.resource.ResourceFactory;
import com.ryuqq.agentstream.application.resource.ResourceHandle;
import com.ryuqq.agentstream.application.runtime.Lifecycle;
import com.ryuqq.agentstream.core.error.QuotaExceededException;
import com.ryuqq.agentstream.core.model.RequestId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;
import com.ryuqq.agentstream.core.spi.ResourceConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 사용자별로 격리된 리소스 핸들을 발급하는 ResourceFactory 구현체.
 *
 * <p><strong>동시성:</strong> 하나의 {@link ReentrantLock}이 핸들 레지스트리와 사용자별
 * 카운터를 보호합니다. lock은 bookkeeping 동안에만 잡히며, 하위 클라이언트 연결과
 * 해제(close)는 항상 lock 밖에서 수행됩니다.</p>
 *
 * <p><strong>한도 처리:</strong></p>
 * <pre>
 * createHandle / acquireHandle(user, request):
 *   1. 같은 (user, request)의 live 핸들 → 그대로 반환 (acquire면 사용자 수 증가)
 *   2. user의 live 핸들 수 ≥ maxClientsPerUser
 *      → 사용 중이 아니고 quotaSweepIdleMs 이상 유휴인 user 핸들 정리
 *      → 여전히 한도 이상이면 QuotaExceededException
 *   3. 전체 live 핸들 수 ≥ maxTotalHandles → QuotaExceededException
 *   4. 새 핸들 등록 (클라이언트는 첫 사용 시 연결)
 * </pre>
 *
 * <p><strong>유휴 회수:</strong> {@link #start()}를 호출해야 {@link IdleHandleReaper}가
 * 스케줄됩니다. 사용 중인 핸들은 회수되지 않습니다. 생성만으로는 백그라운드 작업이 시작되지 않습니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public final class UserResourceFactory implements ResourceFactory, IdleHandleRegistry, Lifecycle {

    private static final Logger log = LoggerFactory.getLogger(UserResourceFactory.class);

    private final ResourceConnector connector;
    private final ResourceFactoryConfig config;
    private final ReaperConfig reaperConfig;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<HandleKey, PooledResourceHandle> handles = new LinkedHashMap<>();
    private final Map<UserId, Integer> liveCounts = new HashMap<>();
    private final IdleHandleReaper reaper;

    private ScheduledExecutorService scheduler;

    public UserResourceFactory(ResourceConnector connector, ResourceFactoryConfig config) {
        this(connector, config, new ReaperConfig(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param connector 사용자별 클라이언트 연결 팩토리
     * @param config 한도 및 TTL 설정
     * @param reaperConfig 유휴 회수 주기 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public UserResourceFactory(
        ResourceConnector connector,
        ResourceFactoryConfig config,
        ReaperConfig reaperConfig,
        Clock clock
    ) {
        if (connector == null) {
            throw new IllegalArgumentException("connector cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (reaperConfig == null) {
            throw new IllegalArgumentException("reaperConfig cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.connector = connector;
        this.config = config;
        this.reaperConfig = reaperConfig;
        this.clock = clock;
        this.reaper = new IdleHandleReaper(this, reaperConfig, config.clientTtlMs());
    }

    @Override
    public ResourceHandle createHandle(UserId userId, RequestId requestId, ThreadId threadId) {
        return obtain(userId, requestId, threadId, false);
    }

    @Override
    public ResourceHandle acquireHandle(UserId userId, RequestId requestId, ThreadId threadId) {
        return obtain(userId, requestId, threadId, true);
    }

    private ResourceHandle obtain(UserId userId, RequestId requestId, ThreadId threadId, boolean hold) {
        if (userId == null || requestId == null || threadId == null) {
            throw new IllegalArgumentException("userId, requestId and threadId cannot be null");
        }
        HandleKey key = new HandleKey(userId, requestId);
        List<PooledResourceHandle> swept = new ArrayList<>();
        QuotaExceededException rejection = null;
        PooledResourceHandle handle = null;

        lock.lock();
        try {
            PooledResourceHandle existing = handles.get(key);
            if (existing != null) {
                if (hold) {
                    existing.hold();
                }
                return existing;
            }

            if (countFor(userId) >= config.maxClientsPerUser()) {
                long now = clock.millis();
                for (PooledResourceHandle candidate : handlesOf(userId)) {
                    if (!candidate.isInUse() && candidate.idleMillis(now) >= config.quotaSweepIdleMs()) {
                        unregister(candidate);
                        swept.add(candidate);
                    }
                }
            }

            if (countFor(userId) >= config.maxClientsPerUser()) {
                rejection = new QuotaExceededException(
                    userId.getValue(),
                    config.maxClientsPerUser(),
                    "User " + userId.getValue() + " reached the limit of " + config.maxClientsPerUser() + " resource handles"
                );
            } else if (handles.size() >= config.maxTotalHandles()) {
                rejection = new QuotaExceededException(
                    userId.getValue(),
                    config.maxTotalHandles(),
                    "Global limit of " + config.maxTotalHandles() + " resource handles reached"
                );
            } else {
                handle = new PooledResourceHandle(key, threadId, connector, clock);
                if (hold) {
                    handle.hold();
                }
                handles.put(key, handle);
                liveCounts.merge(userId, 1, Integer::sum);
            }
        } finally {
            lock.unlock();
        }

        closeAll(swept);
        if (!swept.isEmpty()) {
            log.info("Swept {} idle handles for {} before quota check", swept.size(), userId);
        }
        if (rejection != null) {
            log.warn("Rejected handle for {} / {}: {}", userId, requestId, rejection.getMessage());
            throw rejection;
        }
        log.debug("Created handle for {} / {}", userId, requestId);
        return handle;
    }

    @Override
    public boolean release(ResourceHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (!(handle instanceof PooledResourceHandle pooled)) {
            throw new IllegalArgumentException("handle was not issued by this factory: " + handle);
        }

        lock.lock();
        try {
            if (handles.get(pooled.key()) != pooled) {
                return false;
            }
            if (pooled.isInUse() && !pooled.dropHold()) {
                log.debug("Handle for {} / {} still in use", pooled.userId(), pooled.requestId());
                return false;
            }
            unregister(pooled);
        } finally {
            lock.unlock();
        }

        pooled.closeClient();
        log.debug("Released handle for {} / {}", pooled.userId(), pooled.requestId());
        return true;
    }

    @Override
    public int cleanupUser(UserId userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        List<PooledResourceHandle> removed;
        lock.lock();
        try {
            removed = handlesOf(userId);
            for (PooledResourceHandle handle : removed) {
                unregister(handle);
            }
        } finally {
            lock.unlock();
        }

        closeAll(removed);
        if (!removed.isEmpty()) {
            log.info("Cleaned up {} handles for {}", removed.size(), userId);
        }
        return removed.size();
    }

    @Override
    public <T> T withHandle(UserId userId, RequestId requestId, ThreadId threadId, HandleCallback<T> callback) throws Exception {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        ResourceHandle handle = acquireHandle(userId, requestId, threadId);
        try {
            return callback.apply(handle);
        } finally {
            release(handle);
        }
    }

    @Override
    public Optional<ResourceHandle> findHandle(UserId userId, RequestId requestId) {
        if (userId == null || requestId == null) {
            throw new IllegalArgumentException("userId and requestId cannot be null");
        }
        lock.lock();
        try {
            return Optional.ofNullable(handles.get(new HandleKey(userId, requestId)));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int liveHandleCount(UserId userId) {
        lock.lock();
        try {
            return countFor(userId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int totalLiveHandles() {
        lock.lock();
        try {
            return handles.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ResourceHandle> findIdleHandles(long idleThresholdMs, int limit) {
        long now = clock.millis();
        List<PooledResourceHandle> idle = new ArrayList<>();
        lock.lock();
        try {
            for (PooledResourceHandle handle : handles.values()) {
                if (!handle.isInUse() && handle.idleMillis(now) >= idleThresholdMs) {
                    idle.add(handle);
                }
            }
        } finally {
            lock.unlock();
        }
        idle.sort(Comparator.comparingLong(PooledResourceHandle::lastUsedAt));
        return new ArrayList<>(idle.subList(0, Math.min(limit, idle.size())));
    }

    @Override
    public boolean releaseIfIdle(ResourceHandle handle, long idleThresholdMs) {
        if (!(handle instanceof PooledResourceHandle pooled)) {
            throw new IllegalArgumentException("handle was not issued by this factory: " + handle);
        }
        lock.lock();
        try {
            if (handles.get(pooled.key()) != pooled
                || pooled.isInUse()
                || pooled.idleMillis(clock.millis()) < idleThresholdMs) {
                return false;
            }
            unregister(pooled);
        } finally {
            lock.unlock();
        }
        pooled.closeClient();
        return true;
    }

    /**
     * 유휴 핸들 회수를 즉시 한 번 수행.
     *
     * @return 회수된 핸들 수
     */
    public int reapIdleHandles() {
        return reaper.scan();
    }

    @Override
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "agentstream-handle-reaper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(
            this::scheduledScan,
            reaperConfig.scanIntervalMs(),
            reaperConfig.scanIntervalMs(),
            TimeUnit.MILLISECONDS
        );
        log.info("Idle handle reaper started (interval {}ms, ttl {}ms)", reaperConfig.scanIntervalMs(), config.clientTtlMs());
    }

    @Override
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            scheduler = null;
        }
        log.info("Idle handle reaper stopped");
    }

    @Override
    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    private void scheduledScan() {
        try {
            reaper.scan();
        } catch (RuntimeException e) {
            log.error("Idle handle scan failed", e);
        }
    }

    private int countFor(UserId userId) {
        return liveCounts.getOrDefault(userId, 0);
    }

    private List<PooledResourceHandle> handlesOf(UserId userId) {
        List<PooledResourceHandle> result = new ArrayList<>();
        for (PooledResourceHandle handle : handles.values()) {
            if (handle.userId().equals(userId)) {
                result.add(handle);
            }
        }
        return result;
    }

    private void unregister(PooledResourceHandle handle) {
        handles.remove(handle.key());
        liveCounts.computeIfPresent(handle.userId(), (user, count) -> count > 1 ? count - 1 : null);
        handle.markReleased();
    }

    private void closeAll(List<PooledResourceHandle> released) {
        for (PooledResourceHandle handle : released) {
            handle.closeClient();
        }
    }
}
