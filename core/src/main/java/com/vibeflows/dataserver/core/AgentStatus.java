package com.vibeflows.dataserver.core;

import java.util.Arrays;
import java.util.Optional;

public enum AgentStatus {
    ACTIVE("active"),
    INACTIVE("inactive"),
    ARCHIVED("archived");

    private final String value;

    AgentStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<AgentStatus> fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equals(value))
                .findFirst();
    }
}
