package com.ryuqq.agentstream.adapter.inmemory.store;

import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;
import com.ryuqq.agentstream.core.spi.SaveResult;
import com.ryuqq.agentstream.core.spi.ThreadContext;
import com.ryuqq.agentstream.core.state.RequestState;
import com.ryuqq.agentstream.core.state.RunStatus;
import com.ryuqq.agentstream.core.state.StageResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;

/**
 * InMemoryStateStore 테스트.
 *
 * <ul>
 *   <li>save → load 무손실 round trip</li>
 *   <li>소유자 검사</li>
 *   <li>스레드 요약</li>
 *   <li>TTL 만료 및 purge</li>
 * </ul>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class InMemoryStateStoreTest {

    private static final UserId ALICE = UserId.of("alice");
    private static final UserId BOB = UserId.of("bob");
    private static final ThreadId THREAD = ThreadId.of("thread-1");

    @Mock
    private Clock clock;

    private long now;
    private InMemoryStateStore store;

    @BeforeEach
    void setUp() {
        now = 1_000_000L;
        lenient().when(clock.millis()).thenAnswer(invocation -> now);
        store = new InMemoryStateStore(new StateStoreConfig(60_000L), clock);
    }

    // ============================================================
    // 1. Round trip
    // ============================================================

    @Test
    void save_후_load는_같은_상태를_반환() {
        // given
        RunId runId = RunId.of("run-1");
        RequestState state = RequestState.create(ALICE, THREAD, runId, "Optimize my GPU utilization", 10L)
            .transitionTo(RunStatus.RUNNING, 11L)
            .withStageResult(StageResult.completed("triage", 1, "category=gpu", 12L))
            .withStageResult(StageResult.skipped("data", 13L))
            .withStageResult(StageResult.failed("optimization", 3, "model unavailable", 14L))
            .withAttribute("triage.category", "gpu");

        // when
        SaveResult result = store.save(runId, THREAD, ALICE, state);
        Optional<RequestState> loaded = store.load(runId);

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.snapshotId()).isNotBlank();
        assertThat(loaded).contains(state);
        assertThat(loaded.get()).isNotSameAs(state);
        assertThat(loaded.get().getStageResults().keySet()).containsExactly("triage", "data", "optimization");
    }

    @Test
    void 알_수_없는_runId는_empty() {
        assertThat(store.load(RunId.of("missing"))).isEmpty();
        assertThat(store.load(RunId.of("missing"), ALICE)).isEmpty();
    }

    @Test
    void 같은_run을_다시_저장하면_최신_스냅샷으로_교체() {
        // given
        RunId runId = RunId.of("run-1");
        RequestState pending = RequestState.create(ALICE, THREAD, runId, "hello", 10L);
        RequestState running = pending.transitionTo(RunStatus.RUNNING, 20L);

        // when
        SaveResult first = store.save(runId, THREAD, ALICE, pending);
        SaveResult second = store.save(runId, THREAD, ALICE, running);

        // then
        assertThat(first.snapshotId()).isNotEqualTo(second.snapshotId());
        assertThat(store.load(runId)).contains(running);
        assertThat(store.size()).isEqualTo(1);
    }

    // ============================================================
    // 2. 소유자 검사
    // ============================================================

    @Test
    void 다른_사용자가_소유한_run_저장은_거부() {
        // given
        RunId runId = RunId.of("run-1");
        store.save(runId, THREAD, ALICE, RequestState.create(ALICE, THREAD, runId, "alice", 10L));
        RequestState bobsState = RequestState.create(BOB, THREAD, runId, "bob", 20L);

        // when
        SaveResult result = store.save(runId, THREAD, BOB, bobsState);

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.failureReason()).contains("owned by another user");
        assertThat(store.load(runId).get().getUserRequest()).isEqualTo("alice");
    }

    @Test
    void 상태의_소유자와_userId가_다르면_거부() {
        // given
        RunId runId = RunId.of("run-1");
        RequestState state = RequestState.create(ALICE, THREAD, runId, "alice", 10L);

        // when
        SaveResult result = store.save(runId, THREAD, BOB, state);

        // then
        assertThat(result.success()).isFalse();
        assertThat(store.load(runId)).isEmpty();
    }

    @Test
    void 소유자_범위_load는_다른_사용자에게_보이지_않음() {
        // given
        RunId runId = RunId.of("run-1");
        store.save(runId, THREAD, ALICE, RequestState.create(ALICE, THREAD, runId, "alice", 10L));

        // then
        assertThat(store.load(runId, ALICE)).isPresent();
        assertThat(store.load(runId, BOB)).isEmpty();
    }

    // ============================================================
    // 3. 스레드 요약
    // ============================================================

    @Test
    void 스레드_컨텍스트는_최신_run과_run_수를_반환() {
        // given
        RunId first = RunId.of("run-1");
        RunId second = RunId.of("run-2");
        store.save(first, THREAD, ALICE, RequestState.create(ALICE, THREAD, first, "one", 10L));
        now += 100;
        store.save(second, THREAD, ALICE, RequestState.create(ALICE, THREAD, second, "two", 20L));

        // when
        Optional<ThreadContext> context = store.getThreadContext(THREAD);

        // then
        assertThat(context).isPresent();
        assertThat(context.get().latestRunId()).isEqualTo(second);
        assertThat(context.get().latestState().getUserRequest()).isEqualTo("two");
        assertThat(context.get().runCount()).isEqualTo(2);
        assertThat(context.get().userId()).isEqualTo(ALICE);
        assertThat(context.get().lastSavedAt()).isEqualTo(now);
    }

    @Test
    void 저장된_run이_없는_스레드는_empty() {
        assertThat(store.getThreadContext(ThreadId.of("empty"))).isEmpty();
    }

    // ============================================================
    // 4. TTL
    // ============================================================

    @Test
    void TTL이_지난_스냅샷은_조회되지_않고_purge로_삭제() {
        // given
        RunId runId = RunId.of("run-1");
        store.save(runId, THREAD, ALICE, RequestState.create(ALICE, THREAD, runId, "hello", 10L));

        // when
        now += 60_000L;

        // then
        assertThat(store.load(runId)).isEmpty();
        assertThat(store.getThreadContext(THREAD)).isEmpty();
        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(store.size()).isZero();
    }

    @Test
    void TTL_이전에는_purge되지_않음() {
        // given
        RunId runId = RunId.of("run-1");
        store.save(runId, THREAD, ALICE, RequestState.create(ALICE, THREAD, runId, "hello", 10L));

        // when
        now += 59_999L;

        // then
        assertThat(store.purgeExpired()).isZero();
        assertThat(store.load(runId)).isPresent();
    }

    @Test
    void 만료된_run은_다른_사용자가_다시_사용할_수_있음() {
        // given
        RunId runId = RunId.of("run-1");
        store.save(runId, THREAD, ALICE, RequestState.create(ALICE, THREAD, runId, "alice", 10L));
        now += 60_000L;

        // when
        SaveResult result = store.save(runId, THREAD, BOB, RequestState.create(BOB, THREAD, runId, "bob", 20L));

        // then
        assertThat(result.success()).isTrue();
        assertThat(store.load(runId, BOB)).isPresent();
    }

    @Test
    void 설정_검증() {
        assertThatThrownBy(() -> new StateStoreConfig(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("snapshotTtlMs must be positive");
        assertThat(new StateStoreConfig().snapshotTtlMs()).isEqualTo(86_400_000L);
    }
}
