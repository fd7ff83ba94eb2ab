package com.example.crond.logging;

import org.slf4j.MDC;

/**
 * MDC helpers so every line logged while a task runs carries its name under {@code task}.
 * Call {@link #start(String)} when a run begins and {@link #clear()} in a finally block.
 */
public final class LogContext {
    public static final String TASK_KEY = "task";

    private LogContext() {
    }

    public static void start(String taskName) {
        MDC.put(TASK_KEY, taskName);
    }

    public static void clear() {
        MDC.remove(TASK_KEY);
    }
}
