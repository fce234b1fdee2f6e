package com.ryuqq.agentstream.adapter.runner;

import com.ryuqq.agentstream.application.notifier.DeliveryResult;
import com.ryuqq.agentstream.application.notifier.EventNotifier;
import com.ryuqq.agentstream.core.event.AgentEvent;
import com.ryuqq.agentstream.core.event.EventType;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.spi.EventTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 스레드별 순서를 보장하는 EventNotifier 구현체.
 *
 * <p><strong>처리 흐름 (스레드별 lock 안에서 수행):</strong></p>
 * <pre>
 * 1. 다음 sequenceNumber 할당 (1부터 시작)
 * 2. transport.send(event)
 * 3. 실패 시 retryDelayMs 대기 후 maxSendAttempts까지 재시도
 * 4. 모두 실패하면 버리고 failureCount 증가 (예외 전파 없음)
 * </pre>
 *
 * <p>서로 다른 스레드의 이벤트는 독립적으로 전송되며, 스레드 간 순서는 보장하지 않습니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public final class OrderedEventNotifier implements EventNotifier {

    private static final Logger log = LoggerFactory.getLogger(OrderedEventNotifier.class);

    private final EventTransport transport;
    private final NotifierConfig config;
    private final Clock clock;
    private final ConcurrentHashMap<ThreadId, ThreadChannel> channels;
    private final AtomicLong delivered;
    private final AtomicLong failures;

    public OrderedEventNotifier(EventTransport transport) {
        this(transport, new NotifierConfig(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param transport 전송 계층
     * @param config 설정
     * @param clock 이벤트 timestamp 소스
     */
    public OrderedEventNotifier(EventTransport transport, NotifierConfig config, Clock clock) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.transport = transport;
        this.config = config;
        this.clock = clock;
        this.channels = new ConcurrentHashMap<>();
        this.delivered = new AtomicLong();
        this.failures = new AtomicLong();
    }

    @Override
    public DeliveryResult emit(ThreadId threadId, EventType type, Map<String, Object> payload) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }

        ThreadChannel channel = channels.computeIfAbsent(threadId, key -> new ThreadChannel());
        channel.lock.lock();
        try {
            long sequence = ++channel.lastSequence;
            AgentEvent event = new AgentEvent(type, threadId, payload, clock.millis(), sequence);
            return deliver(event);
        } finally {
            channel.lock.unlock();
        }
    }

    private DeliveryResult deliver(AgentEvent event) {
        String lastError = null;
        int attempt = 0;
        while (attempt < config.maxSendAttempts()) {
            attempt++;
            try {
                transport.send(event);
                delivered.incrementAndGet();
                log.debug("Delivered {} #{} to {}", event.type().wireName(), event.sequenceNumber(), event.threadId());
                return DeliveryResult.delivered(event.sequenceNumber(), attempt);
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                if (attempt < config.maxSendAttempts() && !pause()) {
                    break;
                }
            }
        }

        failures.incrementAndGet();
        log.warn("Dropped {} #{} for {} after {} attempts: {}",
            event.type().wireName(), event.sequenceNumber(), event.threadId(), attempt, lastError);
        return DeliveryResult.dropped(event.sequenceNumber(), attempt, lastError);
    }

    /**
     * 재시도 간격 대기.
     *
     * @return 인터럽트되었으면 false
     */
    private boolean pause() {
        if (config.retryDelayMs() == 0) {
            return true;
        }
        try {
            Thread.sleep(config.retryDelayMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public long deliveredCount() {
        return delivered.get();
    }

    @Override
    public long failureCount() {
        return failures.get();
    }

    @Override
    public void resetThread(ThreadId threadId) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        channels.remove(threadId);
    }

    /**
     * 스레드에 마지막으로 할당된 순번.
     *
     * @param threadId 스레드
     * @return 순번 (이벤트가 없었으면 0)
     */
    public long lastSequence(ThreadId threadId) {
        ThreadChannel channel = channels.get(threadId);
        if (channel == null) {
            return 0L;
        }
        channel.lock.lock();
        try {
            return channel.lastSequence;
        } finally {
            channel.lock.unlock();
        }
    }

    private static final class ThreadChannel {
        private final ReentrantLock lock = new ReentrantLock();
        private long lastSequence;
    }
}
