package com.tidemq.client.consumer;

import com.tidemq.common.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConsumerConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Loads a JSON file of snake_case keys")
    void testLoad() throws Exception {
        Path file = tempDir.resolve("consumer.json");
        Files.writeString(file, "{\n"
                + "  \"broker_url\": \"http://broker-1:8081\",\n"
                + "  \"group_id\": \"audit\",\n"
                + "  \"auto_offset_reset\": \"earliest\",\n"
                + "  \"max_poll_records\": 50,\n"
                + "  \"max_buffer_size\": null\n"
                + "}");

        ConsumerConfig config = ConsumerConfigLoader.load(file);

        assertEquals("http://broker-1:8081", config.getBrokerUrl());
        assertEquals("audit", config.getGroupId());
        assertEquals(OffsetResetStrategy.EARLIEST, config.resetStrategy());
        assertEquals(50, config.getMaxPollRecords());
        assertNull(config.getMaxBufferSize());
    }

    @Test
    @DisplayName("Missing file is a configuration error")
    void testMissingFile() {
        assertThrows(ConfigurationException.class, () -> ConsumerConfigLoader.load(tempDir.resolve("absent.json")));
    }

    @Test
    @DisplayName("Malformed JSON is a configuration error")
    void testMalformed() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ \"group_id\": ");

        assertThrows(ConfigurationException.class, () -> ConsumerConfigLoader.load(file));
    }

    @Test
    @DisplayName("Invalid values in the file are rejected")
    void testInvalidValue() throws Exception {
        Path file = tempDir.resolve("invalid.json");
        Files.writeString(file, "{ \"max_partition_fetch_bytes\": 4096, \"max_buffer_size\": 1024 }");

        assertThrows(ConfigurationException.class, () -> ConsumerConfigLoader.load(file));
    }

    @Test
    @DisplayName("Defaults apply when no configuration file is present")
    void testLoadDefault() {
        assertFalse(Files.exists(Path.of(ConsumerConfigLoader.DEFAULT_CONFIG_PATH)));

        ConsumerConfig config = ConsumerConfigLoader.loadDefault();

        assertEquals("tidemq-consumer", config.getClientId());
        assertEquals(OffsetResetStrategy.LATEST, config.resetStrategy());
    }
}
