package com.example.crond.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ConfigDocument {
    private List<TaskDefinition> tasks;

    public ConfigDocument() {
    }

    public ConfigDocument(List<TaskDefinition> tasks) {
        this.tasks = tasks;
    }

    public List<TaskDefinition> getTasks() {
        return tasks;
    }

    public void setTasks(List<TaskDefinition> tasks) {
        this.tasks = tasks;
    }
}
