package com.ryuqq.agentstream.adapter.runner;

import com.ryuqq.agentstream.application.notifier.DeliveryResult;
import com.ryuqq.agentstream.core.error.TransportException;
import com.ryuqq.agentstream.core.event.AgentEvent;
import com.ryuqq.agentstream.core.event.EventType;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.spi.EventTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * OrderedEventNotifier 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>스레드별 순번은 1부터 빈틈없이 증가</li>
 *   <li>전송 실패는 재시도 후 버려지고 예외로 전파되지 않음</li>
 *   <li>동시 발행에서도 스레드별 전달 순서 = 순번 순서</li>
 * </ul>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class OrderedEventNotifierTest {

    private static final ThreadId THREAD_A = ThreadId.of("thread-a");
    private static final ThreadId THREAD_B = ThreadId.of("thread-b");

    @Mock
    private EventTransport transport;

    private OrderedEventNotifier notifier;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_000L), ZoneOffset.UTC);
        notifier = new OrderedEventNotifier(transport, new NotifierConfig(3, 0L), clock);
    }

    // ============================================================
    // 1. 순번 할당
    // ============================================================

    @Test
    void 스레드별로_순번이_1부터_증가() {
        // when
        DeliveryResult first = notifier.emit(THREAD_A, EventType.AGENT_STARTED, Map.of());
        DeliveryResult second = notifier.emit(THREAD_A, EventType.AGENT_THINKING, Map.of());
        DeliveryResult other = notifier.emit(THREAD_B, EventType.AGENT_STARTED, Map.of());

        // then
        assertThat(first.sequenceNumber()).isEqualTo(1L);
        assertThat(second.sequenceNumber()).isEqualTo(2L);
        assertThat(other.sequenceNumber()).isEqualTo(1L);
        assertThat(notifier.lastSequence(THREAD_A)).isEqualTo(2L);
        assertThat(notifier.deliveredCount()).isEqualTo(3L);
    }

    @Test
    void 전송되는_이벤트는_타입과_페이로드를_유지() {
        // given
        ArgumentCaptor<AgentEvent> captor = ArgumentCaptor.forClass(AgentEvent.class);

        // when
        notifier.emit(THREAD_A, EventType.TOOL_EXECUTING, Map.of("tool_name", "search"));

        // then
        verify(transport).send(captor.capture());
        AgentEvent sent = captor.getValue();
        assertThat(sent.type()).isEqualTo(EventType.TOOL_EXECUTING);
        assertThat(sent.threadId()).isEqualTo(THREAD_A);
        assertThat(sent.get("tool_name")).isEqualTo("search");
        assertThat(sent.timestamp()).isEqualTo(1_000L);
    }

    @Test
    void resetThread_후에는_순번이_다시_1부터() {
        // given
        notifier.emit(THREAD_A, EventType.AGENT_STARTED, Map.of());
        notifier.emit(THREAD_A, EventType.AGENT_COMPLETED, Map.of());

        // when
        notifier.resetThread(THREAD_A);
        DeliveryResult result = notifier.emit(THREAD_A, EventType.AGENT_STARTED, Map.of());

        // then
        assertThat(result.sequenceNumber()).isEqualTo(1L);
    }

    // ============================================================
    // 2. 전송 실패 처리
    // ============================================================

    @Test
    void 일시적_실패는_재시도로_전달() {
        // given
        doThrow(new TransportException("flaky"))
            .doNothing()
            .when(transport).send(any());

        // when
        DeliveryResult result = notifier.emit(THREAD_A, EventType.AGENT_STARTED, Map.of());

        // then
        assertThat(result.delivered()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(notifier.failureCount()).isZero();
    }

    @Test
    void 재시도를_소진하면_예외_없이_버리고_실패_카운터_증가() {
        // given
        doThrow(new TransportException("No active connection for thread-a"))
            .when(transport).send(any());

        // when
        DeliveryResult result = notifier.emit(THREAD_A, EventType.AGENT_COMPLETED, Map.of());

        // then
        assertThat(result.delivered()).isFalse();
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.failureReason()).contains("No active connection");
        assertThat(notifier.failureCount()).isEqualTo(1L);
        assertThat(notifier.deliveredCount()).isZero();
        verify(transport, times(3)).send(any());
    }

    @Test
    void 버려진_이벤트도_순번을_소비() {
        // given
        doThrow(new TransportException("down"))
            .doThrow(new TransportException("down"))
            .doThrow(new TransportException("down"))
            .doNothing()
            .when(transport).send(any());

        // when
        DeliveryResult dropped = notifier.emit(THREAD_A, EventType.AGENT_THINKING, Map.of());
        DeliveryResult next = notifier.emit(THREAD_A, EventType.AGENT_THINKING, Map.of());

        // then
        assertThat(dropped.delivered()).isFalse();
        assertThat(next.delivered()).isTrue();
        assertThat(next.sequenceNumber()).isGreaterThan(dropped.sequenceNumber());
    }

    // ============================================================
    // 3. 동시 발행
    // ============================================================

    @Test
    void 동시_발행에서도_전달_순서가_순번_순서() throws InterruptedException {
        // given
        List<Long> received = Collections.synchronizedList(new ArrayList<>());
        doAnswer(invocation -> {
            AgentEvent event = invocation.getArgument(0);
            received.add(event.sequenceNumber());
            return null;
        }).when(transport).send(any());

        int producers = 8;
        int perProducer = 50;
        ExecutorService executor = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(producers);

        // when
        for (int i = 0; i < producers; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int j = 0; j < perProducer; j++) {
                        notifier.emit(THREAD_A, EventType.AGENT_THINKING, Map.of());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        // then
        assertThat(received).hasSize(producers * perProducer);
        for (int i = 0; i < received.size(); i++) {
            assertThat(received.get(i)).isEqualTo(i + 1L);
        }
    }

    @Test
    void null_스레드는_거부() {
        assertThatThrownBy(() -> notifier.emit(null, EventType.PONG, Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("threadId");
    }
}
