package com.ryuqq.agentstream.adapter.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.agentstream.application.inbound.InboundAction;
import com.ryuqq.agentstream.application.inbound.InboundResult;
import com.ryuqq.agentstream.application.inbound.MessageHandler;
import com.ryuqq.agentstream.application.notifier.EventNotifier;
import com.ryuqq.agentstream.application.orchestrator.Orchestrator;
import com.ryuqq.agentstream.application.orchestrator.RunRequest;
import com.ryuqq.agentstream.core.error.ValidationException;
import com.ryuqq.agentstream.core.event.EventType;
import com.ryuqq.agentstream.core.model.RunId;
import com.ryuqq.agentstream.core.model.ThreadId;
import com.ryuqq.agentstream.core.model.UserId;
import com.ryuqq.agentstream.core.state.RequestState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

/**
 * JSON 수신 메시지를 run 제출 또는 즉시 응답 이벤트로 라우팅.
 *
 * <p>응답 이벤트는 모두 같은 스레드의 {@link EventNotifier}로 발행되므로,
 * 해당 스레드의 다른 이벤트와 순서가 섞이지 않습니다.</p>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public final class InboundMessageRouter implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(InboundMessageRouter.class);

    static final String INVALID_MESSAGE = "INVALID_MESSAGE";

    private static final TypeReference<Map<String, Object>> MESSAGE_TYPE = new TypeReference<>() {
    };

    private final Orchestrator orchestrator;
    private final EventNotifier notifier;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InboundMessageRouter(Orchestrator orchestrator, EventNotifier notifier) {
        this(orchestrator, notifier, new ObjectMapper(), Clock.systemUTC());
    }

    public InboundMessageRouter(Orchestrator orchestrator, EventNotifier notifier, ObjectMapper objectMapper, Clock clock) {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.orchestrator = orchestrator;
        this.notifier = notifier;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void onConnect(UserId userId, ThreadId threadId) {
        if (userId == null || threadId == null) {
            throw new IllegalArgumentException("userId and threadId cannot be null");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", userId.getValue());
        payload.put("thread_id", threadId.getValue());
        payload.put("timestamp", clock.millis());
        notifier.emit(threadId, EventType.CONNECTION_ESTABLISHED, payload);
        log.info("Connection established for {} on {}", userId, threadId);
    }

    @Override
    public InboundResult handle(UserId userId, ThreadId threadId, String rawMessage) {
        if (userId == null || threadId == null) {
            throw new IllegalArgumentException("userId and threadId cannot be null");
        }
        if (rawMessage == null || rawMessage.isBlank()) {
            return reject(threadId, "Message is empty");
        }

        JsonNode message;
        try {
            message = objectMapper.readTree(rawMessage);
        } catch (JsonProcessingException e) {
            log.debug("Malformed message on {}: {}", threadId, e.getOriginalMessage());
            return reject(threadId, "Message is not valid JSON: " + e.getOriginalMessage());
        }
        if (message == null || !message.isObject()) {
            return reject(threadId, "Message must be a JSON object");
        }

        JsonNode type = message.get("type");
        if (type == null || !type.isTextual() || type.asText().isBlank()) {
            return reject(threadId, "Message has no 'type' field");
        }

        switch (type.asText()) {
            case "ping":
                notifier.emit(threadId, EventType.PONG, Map.of("timestamp", clock.millis()));
                return InboundResult.of(InboundAction.PONG);
            case "chat_message":
            case "user_message":
                return submitRun(userId, threadId, message.path("payload"));
            default:
                notifier.emit(threadId, EventType.ECHO, objectMapper.convertValue(message, MESSAGE_TYPE));
                return InboundResult.of(InboundAction.ECHO);
        }
    }

    private InboundResult submitRun(UserId userId, ThreadId threadId, JsonNode payload) {
        JsonNode text = payload.get("text");
        if (text == null || !text.isTextual() || text.asText().isBlank()) {
            return reject(threadId, "Message payload requires a non-empty 'text' field");
        }

        try {
            JsonNode runIdNode = payload.get("run_id");
            RunId runId = runIdNode != null && runIdNode.isTextual()
                ? RunId.of(runIdNode.asText())
                : RunId.generate();

            CompletableFuture<RequestState> run = orchestrator.submit(
                new RunRequest(text.asText(), threadId, userId, runId)
            );
            log.info("Submitted run {} for {} on {}", runId, userId, threadId);
            return InboundResult.submitted(runId, run);
        } catch (ValidationException e) {
            return reject(threadId, e.getMessage());
        } catch (RejectedExecutionException e) {
            log.warn("Run submission rejected for {} on {}", userId, threadId, e);
            return reject(threadId, "Run could not be scheduled");
        }
    }

    private InboundResult reject(ThreadId threadId, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error_code", INVALID_MESSAGE);
        payload.put("message", reason);
        notifier.emit(threadId, EventType.ERROR, payload);
        return InboundResult.of(InboundAction.REJECTED);
    }
}
