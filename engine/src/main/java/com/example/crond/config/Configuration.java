package com.example.crond.config;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered, immutable task list. A new instance always replaces the previous one wholesale.
 */
public final class Configuration {
    private static final Configuration EMPTY = new Configuration(List.of());

    private final List<Task> tasks;

    public Configuration(List<Task> tasks) {
        this.tasks = List.copyOf(tasks);
    }

    public static Configuration empty() {
        return EMPTY;
    }

    public List<Task> getTasks() {
        return tasks;
    }

    public int size() {
        return tasks.size();
    }

    /**
     * First task with the given name. Duplicate names are allowed; later ones are unreachable here.
     */
    public Optional<Task> findTask(String name) {
        return tasks.stream().filter(t -> t.getName().equals(name)).findFirst();
    }

    public List<String> taskNames() {
        return tasks.stream().map(Task::getName).collect(Collectors.toList());
    }
}
