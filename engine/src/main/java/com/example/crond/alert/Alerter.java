package com.example.crond.alert;

/**
 * Best-effort failure notification. Implementations must not throw.
 */
public interface Alerter {
    void alert(String webhookUrl, String taskName, String message);

    static Alerter noop() {
        return (webhookUrl, taskName, message) -> {
        };
    }
}
