package com.example.crond.exec;

/**
 * Outcome of one command run: completed (any exit status), timed out, or never spawned.
 */
public final class ExecutionResult {
    public enum Kind {
        COMPLETED, TIMED_OUT, SPAWN_FAILED
    }

    private final Kind kind;
    private final int exitStatus;
    private final String stdout;
    private final String stderr;
    private final String error;

    private ExecutionResult(Kind kind, int exitStatus, String stdout, String stderr, String error) {
        this.kind = kind;
        this.exitStatus = exitStatus;
        this.stdout = stdout;
        this.stderr = stderr;
        this.error = error;
    }

    public static ExecutionResult completed(int exitStatus, String stdout, String stderr) {
        return new ExecutionResult(Kind.COMPLETED, exitStatus, stdout, stderr, null);
    }

    public static ExecutionResult timedOut(long timeoutSeconds) {
        return new ExecutionResult(Kind.TIMED_OUT, -1, null, null,
                "Command timed out after " + timeoutSeconds + " seconds");
    }

    public static ExecutionResult spawnFailed(String error) {
        return new ExecutionResult(Kind.SPAWN_FAILED, -1, null, null, error);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * True only for a completed run with exit status 0.
     */
    public boolean isSuccess() {
        return kind == Kind.COMPLETED && exitStatus == 0;
    }

    public int getExitStatus() {
        requireCompleted();
        return exitStatus;
    }

    public String getStdout() {
        requireCompleted();
        return stdout;
    }

    public String getStderr() {
        requireCompleted();
        return stderr;
    }

    /**
     * Failure description for {@link Kind#TIMED_OUT} and {@link Kind#SPAWN_FAILED}; null otherwise.
     */
    public String getError() {
        return error;
    }

    private void requireCompleted() {
        if (kind != Kind.COMPLETED) {
            throw new IllegalStateException("no process output for a " + kind + " result");
        }
    }

    @Override
    public String toString() {
        if (kind == Kind.COMPLETED) {
            return "ExecutionResult{COMPLETED, exitStatus=" + exitStatus + "}";
        }
        return "ExecutionResult{" + kind + ", error=" + error + "}";
    }
}
