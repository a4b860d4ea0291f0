package com.vibeflows.dataserver.core;

import java.util.Map;
import java.util.Objects;

/**
 * Everything the gateway needs from its environment. Passed explicitly to the
 * components that need it; there is no global settings object.
 */
public record GatewayConfig(
        String connectionString,
        String databaseName,
        int retentionDays,
        String adminId
) {
    public static final String DEFAULT_CONNECTION_STRING = "mongodb://localhost:27017";
    public static final String DEFAULT_DATABASE = "workflow_automation";
    public static final int DEFAULT_RETENTION_DAYS = 30;
    public static final String DEFAULT_ADMIN_ID = "admin";

    public GatewayConfig {
        Objects.requireNonNull(connectionString, "connectionString");
        Objects.requireNonNull(databaseName, "databaseName");
        Objects.requireNonNull(adminId, "adminId");
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must not be negative: " + retentionDays);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code MONGODB_URI}, {@code MONGODB_DATABASE}, {@code DATA_CUT_OFF_DAYS} and
     * {@code ADMIN_ID}. Missing or blank entries fall back to the defaults.
     *
     * @param env usually {@link System#getenv()}
     */
    public static GatewayConfig fromEnvironment(Map<String, String> env) {
        String retention = getEnv(env, "DATA_CUT_OFF_DAYS", String.valueOf(DEFAULT_RETENTION_DAYS));
        int retentionDays;
        try {
            retentionDays = Integer.parseInt(retention.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("DATA_CUT_OFF_DAYS is not a number: " + retention, e);
        }

        return builder()
                .connectionString(getEnv(env, "MONGODB_URI", DEFAULT_CONNECTION_STRING))
                .databaseName(getEnv(env, "MONGODB_DATABASE", DEFAULT_DATABASE))
                .retentionDays(retentionDays)
                .adminId(getEnv(env, "ADMIN_ID", DEFAULT_ADMIN_ID))
                .build();
    }

    private static String getEnv(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    public static class Builder {
        private String connectionString = DEFAULT_CONNECTION_STRING;
        private String databaseName = DEFAULT_DATABASE;
        private int retentionDays = DEFAULT_RETENTION_DAYS;
        private String adminId = DEFAULT_ADMIN_ID;

        public Builder connectionString(String connectionString) {
            this.connectionString = connectionString;
            return this;
        }

        public Builder databaseName(String databaseName) {
            this.databaseName = databaseName;
            return this;
        }

        public Builder retentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
            return this;
        }

        public Builder adminId(String adminId) {
            this.adminId = adminId;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(connectionString, databaseName, retentionDays, adminId);
        }
    }
}
