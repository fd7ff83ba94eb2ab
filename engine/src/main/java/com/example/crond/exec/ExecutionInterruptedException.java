package com.example.crond.exec;

/**
 * The calling thread was interrupted while a command was running. The process has been killed.
 */
public class ExecutionInterruptedException extends RuntimeException {
    public ExecutionInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
