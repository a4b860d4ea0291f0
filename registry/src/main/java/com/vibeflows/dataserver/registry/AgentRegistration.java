package com.vibeflows.dataserver.registry;

import java.util.List;
import java.util.Map;

/**
 * A request to create or upgrade the agent identified by ({@code actorId}, {@code name}, {@code type}).
 *
 * @param type         raw type name, validated on registration
 * @param description  optional
 * @param capabilities {@code null} keeps the stored value on upgrade
 * @param metadata     {@code null} keeps the stored value on upgrade
 */
public record AgentRegistration(
        String actorId,
        String name,
        String type,
        String version,
        Map<String, Object> config,
        String systemMessage,
        String src,
        String command,
        String description,
        List<String> capabilities,
        Map<String, Object> metadata
) {
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String actorId;
        private String name;
        private String type;
        private String version;
        private Map<String, Object> config = Map.of();
        private String systemMessage;
        private String src;
        private String command;
        private String description;
        private List<String> capabilities;
        private Map<String, Object> metadata;

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config;
            return this;
        }

        public Builder systemMessage(String systemMessage) {
            this.systemMessage = systemMessage;
            return this;
        }

        public Builder src(String src) {
            this.src = src;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder capabilities(List<String> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public AgentRegistration build() {
            return new AgentRegistration(actorId, name, type, version, config, systemMessage, src, command,
                    description, capabilities, metadata);
        }
    }
}
