package com.taskengine.engine.handler;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted task handlers for tests.
 */
public final class TestHandlers {

    private TestHandlers() {
    }

    @FunctionalInterface
    public interface Behavior {
        void run(TaskContext context) throws Exception;
    }

    public static CountingHandler of(String type, Behavior behavior) {
        return new CountingHandler(type, behavior);
    }

    public static CountingHandler succeeding(String type) {
        return of(type, ctx -> { });
    }

    public static CountingHandler failingTransiently(String type, String code) {
        return of(type, ctx -> {
            throw TaskHandlerException.transientFailure(code, "simulated " + code);
        });
    }

    public static CountingHandler failingPermanently(String type, String code) {
        return of(type, ctx -> {
            throw TaskHandlerException.permanentFailure(code, "simulated " + code);
        });
    }

    public static final class CountingHandler implements TaskHandler {
        private final String type;
        private final Behavior behavior;
        private final AtomicInteger invocations = new AtomicInteger();

        private CountingHandler(String type, Behavior behavior) {
            this.type = type;
            this.behavior = behavior;
        }

        @Override
        public String type() {
            return type;
        }

        @Override
        public void handle(TaskContext context) throws Exception {
            invocations.incrementAndGet();
            behavior.run(context);
        }

        public int invocations() {
            return invocations.get();
        }
    }
}
