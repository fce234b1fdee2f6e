package com.ryuqq.agentstream.adapter.inmemory.transport;

import com.ryuqq.agentstream.core.error.TransportException;
import com.ryuqq.agentstream.core.event.AgentEvent;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;
import com.ryuqq.agentstream.core.spi.EventTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-Memory EventTransport 구현체.
 *
 * <p>스레드마다 하나의 연결(channel)을 가지며, 전달된 이벤트는 채널 기록에 쌓입니다.
 * 연결이 없는 스레드로 send하면 {@link TransportException}이 발생합니다.</p>
 *
 * <p><strong>테스트 지원:</strong></p>
 * <ul>
 *   <li>{@link #disconnect(ThreadId)}: run 도중 연결 끊김 시뮬레이션</li>
 *   <li>{@link #failNextSends(ThreadId, int)}: 일시적 전송 실패 주입</li>
 *   <li>{@link #eventsFor(UserId, ThreadId)}: 소유자 범위 이벤트 조회</li>
 * </ul>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public class InMemoryEventTransport implements EventTransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventTransport.class);

    private final ConcurrentHashMap<ThreadId, Channel> channels = new ConcurrentHashMap<>();

    /**
     * 연결 수립. 기존 채널이 있으면 소유자를 갱신하고 연결 상태로 되돌립니다.
     *
     * @param threadId 스레드
     * @param userId 연결한 사용자
     */
    public void connect(ThreadId threadId, UserId userId) {
        if (threadId == null) {
            throw new IllegalArgumentException("threadId cannot be null");
        }
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        channels.compute(threadId, (key, existing) -> {
            Channel channel = existing != null && existing.owner.equals(userId) ? existing : new Channel(userId);
            channel.connected = true;
            return channel;
        });
        log.debug("Connected {} for {}", threadId, userId);
    }

    /**
     * 연결 해제. 이후 send는 실패합니다. 전달된 이벤트 기록은 유지됩니다.
     *
     * @param threadId 스레드
     */
    public void disconnect(ThreadId threadId) {
        Channel channel = channels.get(threadId);
        if (channel != null) {
            channel.connected = false;
            log.debug("Disconnected {}", threadId);
        }
    }

    /**
     * 다음 count번의 send를 실패시킴.
     *
     * @param threadId 스레드
     * @param count 실패 횟수
     */
    public void failNextSends(ThreadId threadId, int count) {
        Channel channel = channels.get(threadId);
        if (channel == null) {
            throw new IllegalStateException("No channel for " + threadId);
        }
        channel.pendingFailures.set(count);
    }

    @Override
    public void send(AgentEvent event) throws TransportException {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        Channel channel = channels.get(event.threadId());
        if (channel == null || !channel.connected) {
            throw new TransportException("No active connection for " + event.threadId());
        }
        if (channel.pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new TransportException("Simulated send failure on " + event.threadId());
        }
        channel.delivered.add(event);
    }

    @Override
    public boolean isConnected(ThreadId threadId) {
        Channel channel = channels.get(threadId);
        return channel != null && channel.connected;
    }

    /**
     * 스레드로 전달된 이벤트 목록 (전달 순서).
     *
     * @param threadId 스레드
     * @return 이벤트 목록 복사본
     */
    public List<AgentEvent> eventsFor(ThreadId threadId) {
        Channel channel = channels.get(threadId);
        return channel == null ? List.of() : List.copyOf(channel.delivered);
    }

    /**
     * 소유자 범위 이벤트 조회. 스레드의 소유자가 다르면 빈 목록입니다.
     *
     * @param userId 조회 사용자
     * @param threadId 스레드
     * @return 이벤트 목록 복사본
     */
    public List<AgentEvent> eventsFor(UserId userId, ThreadId threadId) {
        Channel channel = channels.get(threadId);
        if (channel == null || !channel.owner.equals(userId)) {
            return List.of();
        }
        return List.copyOf(channel.delivered);
    }

    public Optional<UserId> ownerOf(ThreadId threadId) {
        Channel channel = channels.get(threadId);
        return channel == null ? Optional.empty() : Optional.of(channel.owner);
    }

    public void clear() {
        channels.clear();
    }

    private static final class Channel {
        private final UserId owner;
        private final List<AgentEvent> delivered = new CopyOnWriteArrayList<>();
        private final AtomicInteger pendingFailures = new AtomicInteger();
        private volatile boolean connected;

        private Channel(UserId owner) {
            this.owner = owner;
        }
    }
}
