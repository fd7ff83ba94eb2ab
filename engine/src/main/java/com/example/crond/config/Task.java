package com.example.crond.config;

import com.example.crond.schedule.Schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One scheduled command. Immutable once built.
 */
public final class Task {
    private final String name;
    private final Schedule schedule;
    private final String command;
    private final List<String> args;
    private final Long timeoutSeconds;
    private final String webhookUrl;
    private final String cwd;
    private final Map<String, String> env;

    private Task(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name");
        this.schedule = Objects.requireNonNull(b.schedule, "schedule");
        this.command = Objects.requireNonNull(b.command, "command");
        this.args = b.args == null ? List.of() : List.copyOf(b.args);
        this.timeoutSeconds = b.timeoutSeconds;
        this.webhookUrl = b.webhookUrl;
        this.cwd = b.cwd;
        this.env = b.env == null ? Map.of() : copyEnv(b.env);
    }

    private static Map<String, String> copyEnv(Map<String, String> source) {
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "env name"),
                Objects.requireNonNull(v, () -> "env value for " + k)));
        return Collections.unmodifiableMap(copy);
    }

    public static Builder builder(String name, Schedule schedule, String command) {
        return new Builder(name, schedule, command);
    }

    public String getName() {
        return name;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public String getCommand() {
        return command;
    }

    public List<String> getArgs() {
        return args;
    }

    /**
     * Timeout in whole seconds. Empty means unbounded; zero is a real (immediate) deadline.
     */
    public Optional<Long> getTimeoutSeconds() {
        return Optional.ofNullable(timeoutSeconds);
    }

    public Optional<String> getWebhookUrl() {
        return Optional.ofNullable(webhookUrl);
    }

    public Optional<String> getCwd() {
        return Optional.ofNullable(cwd);
    }

    /**
     * Extra variables layered over the inherited environment. Never null.
     */
    public Map<String, String> getEnv() {
        return env;
    }

    @Override
    public String toString() {
        return "Task{name=" + name + ", schedule=" + schedule.expression() + ", command=" + command
                + ", args=" + args + "}";
    }

    public static final class Builder {
        private final String name;
        private final Schedule schedule;
        private final String command;
        private List<String> args;
        private Long timeoutSeconds;
        private String webhookUrl;
        private String cwd;
        private Map<String, String> env;

        private Builder(String name, Schedule schedule, String command) {
            this.name = name;
            this.schedule = schedule;
            this.command = command;
        }

        public Builder args(List<String> args) {
            this.args = args;
            return this;
        }

        public Builder args(String... args) {
            this.args = List.of(args);
            return this;
        }

        public Builder timeoutSeconds(Long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder webhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
            return this;
        }

        public Builder cwd(String cwd) {
            this.cwd = cwd;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }
}
