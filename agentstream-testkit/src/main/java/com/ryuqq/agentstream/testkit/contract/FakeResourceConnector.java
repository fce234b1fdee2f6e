package com.ryuqq.agentstream.testkit.contract;

import com.ryuqq.agentstream.core.model.UserId;
import com.ryuqq.agentstream.core.spi.ResourceClient;
import com.ryuqq.agentstream.core.spi.ResourceCommand;
import com.ryuqq.agentstream.core.spi.ResourceConnector;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory ResourceConnector that records every command it receives.
 *
 * <p>Each {@link #connect(UserId)} produces a new client bound to that user. Commands are
 * recorded together with the user the client was connected for, so isolation tests can check
 * that no command carries a foreign owner tag.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public final class FakeResourceConnector implements ResourceConnector {

    private final List<RecordedCommand> commands = new CopyOnWriteArrayList<>();
    private final Map<UserId, AtomicInteger> connections = new ConcurrentHashMap<>();
    private final AtomicInteger openClients = new AtomicInteger();
    private volatile boolean healthy = true;

    @Override
    public ResourceClient connect(UserId userId) {
        connections.computeIfAbsent(userId, key -> new AtomicInteger()).incrementAndGet();
        openClients.incrementAndGet();
        return new FakeResourceClient(userId);
    }

    /**
     * Makes subsequently connected clients fail their health check.
     *
     * @param healthy health check result
     */
    public void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    public List<RecordedCommand> commands() {
        return new ArrayList<>(commands);
    }

    public List<RecordedCommand> commandsFor(UserId userId) {
        List<RecordedCommand> result = new ArrayList<>();
        for (RecordedCommand command : commands) {
            if (command.clientOwner().equals(userId)) {
                result.add(command);
            }
        }
        return result;
    }

    public int connectionCount(UserId userId) {
        AtomicInteger count = connections.get(userId);
        return count == null ? 0 : count.get();
    }

    public int openClients() {
        return openClients.get();
    }

    /**
     * A command as seen by a client.
     *
     * @param clientOwner user the client was connected for
     * @param command command received
     */
    public record RecordedCommand(UserId clientOwner, ResourceCommand command) {
    }

    private final class FakeResourceClient implements ResourceClient {

        private final UserId owner;
        private volatile boolean closed;

        FakeResourceClient(UserId owner) {
            this.owner = owner;
        }

        @Override
        public boolean healthCheck() {
            return healthy;
        }

        @Override
        public Object execute(ResourceCommand command) {
            if (closed) {
                throw new IllegalStateException("client for " + owner + " is closed");
            }
            commands.add(new RecordedCommand(owner, command));
            return command.operation() + ":" + owner.getValue();
        }

        @Override
        public synchronized void close() {
            if (!closed) {
                closed = true;
                openClients.decrementAndGet();
            }
        }
    }
}
