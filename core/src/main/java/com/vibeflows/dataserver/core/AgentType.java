package com.vibeflows.dataserver.core;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of agent. {@link #GEMINI} is only accepted by registration.
 */
public enum AgentType {
    WORKFLOW_CREATOR("workflow_creator"),
    PROBLEM_UNDERSTANDING("problem_understanding"),
    TASK_EXECUTOR("task_executor"),
    CODE_GENERATOR("code_generator"),
    DATA_PROCESSOR("data_processor"),
    SYSTEM("system"),
    GEMINI("gemini");

    private final String value;

    AgentType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<AgentType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst();
    }
}
