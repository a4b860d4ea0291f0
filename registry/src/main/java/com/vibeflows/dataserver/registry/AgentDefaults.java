package com.vibeflows.dataserver.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibeflows.dataserver.core.AgentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default configuration per agent type, overridden key by key by what a
 * registration supplies.
 */
public class AgentDefaults {
    private static final Logger logger = LoggerFactory.getLogger(AgentDefaults.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static final String RESOURCE = "agent-defaults.json";

    private final Map<AgentType, Map<String, Object>> defaults;

    public AgentDefaults(Map<AgentType, Map<String, Object>> defaults) {
        this.defaults = new EnumMap<>(AgentType.class);
        defaults.forEach((type, config) -> this.defaults.put(type, Collections.unmodifiableMap(new LinkedHashMap<>(config))));
    }

    /**
     * Loads the bundled {@value #RESOURCE}.
     */
    public static AgentDefaults load() {
        return load(RESOURCE);
    }

    public static AgentDefaults load(String resource) {
        try (InputStream is = AgentDefaults.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new FileNotFoundException("Agent defaults not found: " + resource);
            }
            Map<String, Map<String, Object>> raw = OBJECT_MAPPER.readValue(is, new TypeReference<>() {});

            Map<AgentType, Map<String, Object>> byType = new EnumMap<>(AgentType.class);
            raw.forEach((name, config) -> {
                AgentType type = AgentType.fromValue(name)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown agent type in " + resource + ": " + name));
                byType.put(type, config);
            });
            logger.info("Loaded agent defaults for {} types from {}", byType.size(), resource);
            return new AgentDefaults(byType);
        } catch (IOException e) {
            logger.error("Failed to load agent defaults: {}", resource, e);
            throw new RuntimeException("Failed to load agent defaults: " + resource, e);
        }
    }

    /**
     * @return the type's defaults, empty for a type without any
     */
    public Map<String, Object> configFor(AgentType type) {
        return defaults.getOrDefault(type, Collections.emptyMap());
    }

    /**
     * Defaults for {@code type} with every key of {@code overrides} written over them.
     */
    public Map<String, Object> merge(AgentType type, Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(configFor(type));
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return merged;
    }
}
