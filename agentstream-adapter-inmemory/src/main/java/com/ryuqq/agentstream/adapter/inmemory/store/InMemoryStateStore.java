package com.ryuqq.agentstream.adapter.inmemory.store;

import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;
import com.ryuqq.agentstream.core.spi.SaveResult;
import com.ryuqq.agentstream.core.spi.StateStore;
import com.ryuqq.agentstream.core.spi.ThreadContext;
import com.ryuqq.agentstream.core.state.RequestState;
import com.ryuqq.agentstream.core.state.RunSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-Memory StateStore 구현체.
 *
 * <p>테스트 및 단일 인스턴스 배포용 참조 구현입니다. run마다 최신 스냅샷 하나를
 * JSON 문자열로 보관하므로, load는 항상 역직렬화를 거쳐 새 인스턴스를 반환합니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>소유자 검사: 다른 사용자가 소유한 runId에 대한 save는 거부 (success=false)</li>
 *   <li>TTL: savedAt + snapshotTtlMs가 지난 스냅샷은 조회되지 않으며 purgeExpired()로 삭제</li>
 *   <li>스레드 요약: 해당 스레드의 스냅샷들에서 도출</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> ConcurrentHashMap.compute로 run 단위 원자성 보장</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public class InMemoryStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStateStore.class);

    private final ConcurrentHashMap<RunId, RunSnapshot> snapshots;
    private final RequestStateSerializer serializer;
    private final StateStoreConfig config;
    private final Clock clock;
    private final AtomicLong snapshotSequence;

    public InMemoryStateStore() {
        this(new StateStoreConfig(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param clock 시간 소스 (TTL 계산)
     */
    public InMemoryStateStore(StateStoreConfig config, Clock clock) {
        this(config, clock, new RequestStateSerializer());
    }

    public InMemoryStateStore(StateStoreConfig config, Clock clock, RequestStateSerializer serializer) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (serializer == null) {
            throw new IllegalArgumentException("serializer cannot be null");
        }
        this.snapshots = new ConcurrentHashMap<>();
        this.serializer = serializer;
        this.config = config;
        this.clock = clock;
        this.snapshotSequence = new AtomicLong();
    }

    @Override
    public SaveResult save(RunId runId, ThreadId threadId, UserId userId, RequestState state) {
        if (runId == null || threadId == null || userId == null || state == null) {
            throw new IllegalArgumentException("runId, threadId, userId and state cannot be null");
        }
        if (!state.getRunId().equals(runId) || !state.getUserId().equals(userId)) {
            log.warn("Rejected snapshot for {}: state identity does not match ({}, {})",
                runId, state.getRunId(), state.getUserId());
            return SaveResult.rejected("state does not belong to " + runId + " / " + userId);
        }

        String json = serializer.serialize(state);
        AtomicReference<SaveResult> result = new AtomicReference<>();
        long now = clock.millis();

        snapshots.compute(runId, (key, existing) -> {
            if (existing != null && !isExpired(existing, now) && !existing.isOwnedBy(userId)) {
                result.set(SaveResult.rejected("run " + runId.getValue() + " is owned by another user"));
                return existing;
            }
            String snapshotId = "snap-" + snapshotSequence.incrementAndGet();
            result.set(SaveResult.saved(snapshotId));
            return new RunSnapshot(snapshotId, runId, threadId, userId, json, now);
        });

        if (!result.get().success()) {
            log.warn("Rejected snapshot for {} from {}: {}", runId, userId, result.get().failureReason());
        }
        return result.get();
    }

    @Override
    public Optional<RequestState> load(RunId runId) {
        return findSnapshot(runId).map(snapshot -> serializer.deserialize(snapshot.stateJson()));
    }

    @Override
    public Optional<RequestState> load(RunId runId, UserId userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        return findSnapshot(runId)
            .filter(snapshot -> snapshot.isOwnedBy(userId))
            .map(snapshot -> serializer.deserialize(snapshot.stateJson()));
    }

    @Override
    public Optional<ThreadContext> getThreadContext(ThreadId threadId) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        long now = clock.millis();
        RunSnapshot latest = null;
        int runCount = 0;
        for (RunSnapshot snapshot : snapshots.values()) {
            if (!snapshot.threadId().equals(threadId) || isExpired(snapshot, now)) {
                continue;
            }
            runCount++;
            if (latest == null || snapshot.savedAt() >= latest.savedAt()) {
                latest = snapshot;
            }
        }
        if (latest == null) {
            return Optional.empty();
        }
        return Optional.of(new ThreadContext(
            threadId,
            latest.userId(),
            latest.runId(),
            serializer.deserialize(latest.stateJson()),
            runCount,
            latest.savedAt()
        ));
    }

    @Override
    public int purgeExpired() {
        long now = clock.millis();
        List<RunSnapshot> expired = new ArrayList<>();
        for (RunSnapshot snapshot : snapshots.values()) {
            if (isExpired(snapshot, now)) {
                expired.add(snapshot);
            }
        }
        int purged = 0;
        for (RunSnapshot snapshot : expired) {
            if (snapshots.remove(snapshot.runId(), snapshot)) {
                purged++;
            }
        }
        if (purged > 0) {
            log.info("Purged {} expired snapshots", purged);
        }
        return purged;
    }

    /**
     * 유효한 최신 스냅샷 조회.
     *
     * @param runId run 식별자
     * @return 스냅샷 (없거나 만료되면 empty)
     */
    public Optional<RunSnapshot> findSnapshot(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        RunSnapshot snapshot = snapshots.get(runId);
        if (snapshot == null || isExpired(snapshot, clock.millis())) {
            return Optional.empty();
        }
        return Optional.of(snapshot);
    }

    public int size() {
        return snapshots.size();
    }

    public void clear() {
        snapshots.clear();
    }

    private boolean isExpired(RunSnapshot snapshot, long now) {
        return snapshot.savedAt() + config.snapshotTtlMs() <= now;
    }
}
