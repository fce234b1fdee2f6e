package com.ryuqq.agentstream.testkit.contract;

import com.ryuqq.agentstream.core.error.StageExecutionException;
import com.ryuqq.agentstream.core.stage.Stage;
import com.ryuqq.agentstream.core.stage.StageContext;
import com.ryuqq.agentstream.core.state.RequestState;
import com.ryuqq.agentstream.core.state.StageResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Configurable Stage for contract tests.
 *
 * <p>Behaviour is scripted through a builder. On each attempt the stage, in order:</p>
 * <ol>
 *   <li>records its name in the shared execution log</li>
 *   <li>fails transiently while fewer than {@code transientFailures} attempts have been made</li>
 *   <li>fails permanently when configured to</li>
 *   <li>emits a thinking event, sleeps, runs one tool and calls the run's resource handle</li>
 *   <li>stores {@code <stage>.output}</li>
 * </ol>
 *
 * <pre>
 * Stage stage = ScriptedStage.named("data")
 *     .recordingTo(executionLog)
 *     .failingTransiently(1)
 *     .withTool("query_metrics")
 *     .build();
 * </pre>
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
public final class ScriptedStage implements Stage {

    private final String name;
    private final Predicate<RequestState> entryCondition;
    private final List<String> executionLog;
    private final int transientFailures;
    private final boolean permanentFailure;
    private final String toolName;
    private final String resourceOperation;
    private final long sleepMillis;
    private final long toolMillis;
    private final AtomicInteger attempts = new AtomicInteger();

    private ScriptedStage(Builder builder) {
        this.name = builder.name;
        this.entryCondition = builder.entryCondition;
        this.executionLog = builder.executionLog;
        this.transientFailures = builder.transientFailures;
        this.permanentFailure = builder.permanentFailure;
        this.toolName = builder.toolName;
        this.resourceOperation = builder.resourceOperation;
        this.sleepMillis = builder.sleepMillis;
        this.toolMillis = builder.toolMillis;
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean checkEntryConditions(RequestState state) {
        return entryCondition.test(state);
    }

    @Override
    public RequestState execute(RequestState state, StageContext context) throws Exception {
        int attempt = attempts.incrementAndGet();
        if (executionLog != null) {
            executionLog.add(name);
        }
        if (attempt <= transientFailures) {
            throw StageExecutionException.transientFailure(name, name + " attempt " + attempt + " failed");
        }
        if (permanentFailure) {
            throw StageExecutionException.permanentFailure(name, name + " cannot complete");
        }

        context.thinking("Working on " + name);
        if (sleepMillis > 0) {
            Thread.sleep(sleepMillis);
        }
        if (toolName != null) {
            context.executeTool(toolName, () -> {
                if (toolMillis > 0) {
                    Thread.sleep(toolMillis);
                }
                return toolName + " done";
            });
        }
        if (resourceOperation != null) {
            context.callResource(resourceOperation, Map.of("stage", name, "run_id", context.runId().getValue()));
        }
        return state.withAttribute(StageResult.outputAttribute(name), name + " finished for " + state.getUserRequest());
    }

    /**
     * Number of times {@link #execute} has been called.
     */
    public int attempts() {
        return attempts.get();
    }

    public static final class Builder {

        private final String name;
        private Predicate<RequestState> entryCondition = state -> true;
        private List<String> executionLog;
        private int transientFailures;
        private boolean permanentFailure;
        private String toolName;
        private String resourceOperation;
        private long sleepMillis;
        private long toolMillis;

        private Builder(String name) {
            this.name = name;
        }

        public Builder enteringWhen(Predicate<RequestState> entryCondition) {
            this.entryCondition = entryCondition;
            return this;
        }

        public Builder skipped() {
            this.entryCondition = state -> false;
            return this;
        }

        /**
         * @param executionLog thread-safe list receiving the stage name on every attempt
         */
        public Builder recordingTo(List<String> executionLog) {
            this.executionLog = executionLog;
            return this;
        }

        public Builder failingTransiently(int times) {
            this.transientFailures = times;
            return this;
        }

        public Builder failingPermanently() {
            this.permanentFailure = true;
            return this;
        }

        public Builder withTool(String toolName) {
            this.toolName = toolName;
            return this;
        }

        /**
         * Runs a tool that takes {@code millis} to finish.
         */
        public Builder withSlowTool(String toolName, long millis) {
            this.toolName = toolName;
            this.toolMillis = millis;
            return this;
        }

        public Builder callingResource(String operation) {
            this.resourceOperation = operation;
            return this;
        }

        public Builder sleeping(long millis) {
            this.sleepMillis = millis;
            return this;
        }

        public ScriptedStage build() {
            return new ScriptedStage(this);
        }
    }
}
