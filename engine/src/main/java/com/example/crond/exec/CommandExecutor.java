package com.example.crond.exec;

import com.example.crond.config.Task;

/**
 * Runs a task's command once and classifies the outcome. Blocks the calling thread only.
 */
public interface CommandExecutor {
    ExecutionResult execute(Task task);
}
