package com.ryuqq.stageflow.testkit.support;

import com.ryuqq.stageflow.core.outcome.Ok;
import com.ryuqq.stageflow.core.outcome.Outcome;
import com.ryuqq.stageflow.core.stage.StageContext;
import com.ryuqq.stageflow.core.stage.StageHandler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A {@link StageHandler} that plays back a script of results, one per invocation.
 *
 * <p>Each step either returns an {@link Outcome} or throws. Once the script is exhausted the
 * fallback outcome is returned for every further call. Every invocation's context is recorded
 * so tests can assert on attempts and the accumulated data a stage saw.</p>
 *
 * <pre>
 * ScriptedStageHandler handler = ScriptedStageHandler.builder()
 *     .thenThrow(new TransientInfrastructureException("Connection reset"))
 *     .thenThrow(new TransientInfrastructureException("Connection reset"))
 *     .thenReturn(Ok.of(Map.of("draftId", "d-1")))
 *     .build();
 * </pre>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class ScriptedStageHandler implements StageHandler {

    private final Deque<Function<StageContext, Outcome>> steps;
    private final Outcome fallback;
    private final Predicate<StageContext> shouldRun;
    private final Predicate<Throwable> retryable;
    private final List<StageContext> invocations = new ArrayList<>();

    private ScriptedStageHandler(Builder builder) {
        this.steps = new ArrayDeque<>(builder.steps);
        this.fallback = builder.fallback;
        this.shouldRun = builder.shouldRun;
        this.retryable = builder.retryable;
    }

    /**
     * Handler that always succeeds with the given output.
     *
     * @param output stage output
     * @return handler
     */
    public static ScriptedStageHandler alwaysOk(Map<String, ?> output) {
        return builder().otherwise(Ok.of(output)).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public synchronized Outcome handle(StageContext context) {
        invocations.add(context);
        Function<StageContext, Outcome> step = steps.poll();
        return step == null ? fallback : step.apply(context);
    }

    @Override
    public boolean shouldRun(StageContext context) {
        return shouldRun.test(context);
    }

    @Override
    public boolean isRetryable(Throwable error) {
        return retryable.test(error);
    }

    /**
     * Returns the contexts of all invocations in call order.
     *
     * @return recorded contexts
     */
    public synchronized List<StageContext> invocations() {
        return new ArrayList<>(invocations);
    }

    public synchronized int invocationCount() {
        return invocations.size();
    }

    /**
     * Builder for {@link ScriptedStageHandler}.
     */
    public static final class Builder {

        private final List<Function<StageContext, Outcome>> steps = new ArrayList<>();
        private Outcome fallback = Ok.empty();
        private Predicate<StageContext> shouldRun = context -> true;
        private Predicate<Throwable> retryable = error -> false;

        private Builder() {
        }

        public Builder thenReturn(Outcome outcome) {
            if (outcome == null) {
                throw new IllegalArgumentException("outcome cannot be null");
            }
            steps.add(context -> outcome);
            return this;
        }

        public Builder thenThrow(RuntimeException error) {
            if (error == null) {
                throw new IllegalArgumentException("error cannot be null");
            }
            steps.add(context -> {
                throw error;
            });
            return this;
        }

        /**
         * Adds a step computed from the invocation context.
         *
         * @param step step function
         * @return this builder
         */
        public Builder then(Function<StageContext, Outcome> step) {
            if (step == null) {
                throw new IllegalArgumentException("step cannot be null");
            }
            steps.add(step);
            return this;
        }

        public Builder otherwise(Outcome outcome) {
            if (outcome == null) {
                throw new IllegalArgumentException("outcome cannot be null");
            }
            this.fallback = outcome;
            return this;
        }

        public Builder runWhen(Predicate<StageContext> predicate) {
            if (predicate == null) {
                throw new IllegalArgumentException("predicate cannot be null");
            }
            this.shouldRun = predicate;
            return this;
        }

        public Builder retryableWhen(Predicate<Throwable> predicate) {
            if (predicate == null) {
                throw new IllegalArgumentException("predicate cannot be null");
            }
            this.retryable = predicate;
            return this;
        }

        public ScriptedStageHandler build() {
            return new ScriptedStageHandler(this);
        }
    }
}
