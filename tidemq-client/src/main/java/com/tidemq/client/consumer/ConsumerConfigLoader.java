package com.tidemq.client.consumer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tidemq.common.exception.ConfigurationException;
import com.tidemq.common.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads a {@link ConsumerConfig} from a JSON file of snake_case keys,
 * e.g. {@code {"broker_url": "http://localhost:8081", "group_id": "audit"}}.
 */
@Slf4j
public final class ConsumerConfigLoader {

    public static final String DEFAULT_CONFIG_PATH = "config/consumer.json";

    private ConsumerConfigLoader() {
    }

    public static ConsumerConfig load(Path path) {
        File configFile = path.toFile();
        if (!configFile.exists()) {
            throw new ConfigurationException("Consumer configuration not found: " + configFile.getAbsolutePath());
        }
        try {
            Map<String, Object> properties = JsonUtils.mapper()
                    .readValue(configFile, new TypeReference<Map<String, Object>>() { });
            log.info("Loaded consumer configuration from {}", configFile.getAbsolutePath());
            return ConsumerConfig.fromProperties(properties).validate();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read consumer configuration from " + path, e);
        }
    }

    /**
     * Load {@link #DEFAULT_CONFIG_PATH} if it exists, otherwise the defaults.
     */
    public static ConsumerConfig loadDefault() {
        Path path = Path.of(DEFAULT_CONFIG_PATH);
        if (path.toFile().exists()) {
            return load(path);
        }
        log.warn("No consumer configuration at {}, using defaults", path.toAbsolutePath());
        return ConsumerConfig.builder().build();
    }
}
