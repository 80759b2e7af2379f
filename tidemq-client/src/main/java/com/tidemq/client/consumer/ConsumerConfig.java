package com.tidemq.client.consumer;

import com.tidemq.common.codec.CompressionCodec;
import com.tidemq.common.exception.ConfigurationException;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for Consumer
 */
@Slf4j
@Data
@Builder
public class ConsumerConfig {

    // Broker endpoint, used by the HTTP transport
    private String brokerUrl;

    // Group used to store and resume committed offsets; null disables commits
    private String groupId;

    @Builder.Default
    private String clientId = "tidemq-consumer";

    @Builder.Default
    private String autoOffsetReset = "latest"; // earliest, latest, none

    // Apply autoOffsetReset when a fetch position falls out of range mid-stream
    @Builder.Default
    private Boolean resetOnOutOfRange = true;

    @Builder.Default
    private Boolean enableAutoCommit = true;

    // <= 0 disables the time trigger
    @Builder.Default
    private Long autoCommitIntervalMs = 5000L;

    // <= 0 disables the message-count trigger
    @Builder.Default
    private Integer autoCommitEveryN = 0;

    @Builder.Default
    private Integer fetchMaxBytes = 52428800; // 50MB per fetch round

    // Initial fetch buffer of each partition
    @Builder.Default
    private Integer maxPartitionFetchBytes = 1048576; // 1MB

    // Ceiling for buffer growth; null lets the buffer grow without bound
    @Builder.Default
    private Integer maxBufferSize = 52428800;

    @Builder.Default
    private Integer maxPollRecords = 500;

    // Idle time after which next() and iteration give up
    @Builder.Default
    private Long consumerTimeoutMs = 5000L;

    @Builder.Default
    private Long requestTimeoutMs = 30000L;

    @Builder.Default
    private Long retryBackoffMs = 100L;

    @Builder.Default
    private Long fetchMaxWaitMs = 500L;

    @Builder.Default
    private Set<CompressionCodec> disabledCodecs = new HashSet<>();

    public OffsetResetStrategy resetStrategy() {
        return OffsetResetStrategy.fromConfig(autoOffsetReset);
    }

    public boolean isAutoCommitEnabled() {
        return Boolean.TRUE.equals(enableAutoCommit) && groupId != null;
    }

    /**
     * Check that every value is usable. Called by the consumer before it starts.
     */
    public ConsumerConfig validate() {
        try {
            resetStrategy();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        requirePositive("fetch_max_bytes", fetchMaxBytes);
        requirePositive("max_partition_fetch_bytes", maxPartitionFetchBytes);
        requirePositive("max_poll_records", maxPollRecords);
        requirePositive("consumer_timeout_ms", consumerTimeoutMs);
        requirePositive("request_timeout_ms", requestTimeoutMs);
        requirePositive("retry_backoff_ms", retryBackoffMs);
        if (fetchMaxWaitMs == null || fetchMaxWaitMs < 0) {
            throw new ConfigurationException("fetch_max_wait_ms must be >= 0, got " + fetchMaxWaitMs);
        }
        if (maxBufferSize != null && maxBufferSize < maxPartitionFetchBytes) {
            throw new ConfigurationException("max_buffer_size (" + maxBufferSize
                    + ") must not be smaller than max_partition_fetch_bytes (" + maxPartitionFetchBytes + ")");
        }
        if (Boolean.TRUE.equals(enableAutoCommit) && groupId == null) {
            log.info("enable_auto_commit is set but no group_id is configured; offsets will not be committed");
        }
        return this;
    }

    private static void requirePositive(String name, Number value) {
        if (value == null || value.longValue() <= 0) {
            throw new ConfigurationException(name + " must be positive, got " + value);
        }
    }

    /**
     * Build a configuration from snake_case keys, e.g. {@code auto_offset_reset}.
     * Unknown keys are logged and ignored.
     */
    public static ConsumerConfig fromProperties(Map<String, ?> properties) {
        ConsumerConfigBuilder builder = ConsumerConfig.builder();
        for (Map.Entry<String, ?> entry : properties.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            try {
                switch (key) {
                    case "broker_url":
                        builder.brokerUrl(asString(value));
                        break;
                    case "group_id":
                        builder.groupId(asString(value));
                        break;
                    case "client_id":
                        builder.clientId(asString(value));
                        break;
                    case "auto_offset_reset":
                        builder.autoOffsetReset(value == null ? "none" : asString(value));
                        break;
                    case "reset_on_out_of_range":
                        builder.resetOnOutOfRange(asBoolean(value));
                        break;
                    case "enable_auto_commit":
                        builder.enableAutoCommit(asBoolean(value));
                        break;
                    case "auto_commit_interval_ms":
                        builder.autoCommitIntervalMs(value == null ? 0L : asLong(value));
                        break;
                    case "auto_commit_every_n":
                        builder.autoCommitEveryN(value == null ? 0 : asInt(value));
                        break;
                    case "fetch_max_bytes":
                        builder.fetchMaxBytes(asInt(value));
                        break;
                    case "max_partition_fetch_bytes":
                        builder.maxPartitionFetchBytes(asInt(value));
                        break;
                    case "max_buffer_size":
                        builder.maxBufferSize(value == null ? null : asInt(value));
                        break;
                    case "max_poll_records":
                        builder.maxPollRecords(asInt(value));
                        break;
                    case "consumer_timeout_ms":
                        builder.consumerTimeoutMs(asLong(value));
                        break;
                    case "request_timeout_ms":
                        builder.requestTimeoutMs(asLong(value));
                        break;
                    case "retry_backoff_ms":
                        builder.retryBackoffMs(asLong(value));
                        break;
                    case "fetch_max_wait_ms":
                        builder.fetchMaxWaitMs(asLong(value));
                        break;
                    case "disabled_codecs":
                        builder.disabledCodecs(asCodecs(value));
                        break;
                    default:
                        log.warn("Ignoring unknown consumer configuration key: {}", key);
                }
            } catch (ClassCastException | IllegalArgumentException e) {
                throw new ConfigurationException("Invalid value for " + key + ": " + value, e);
            }
        }
        return builder.build();
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static Boolean asBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = String.valueOf(value).trim();
        if (!text.equalsIgnoreCase("true") && !text.equalsIgnoreCase("false")) {
            throw new IllegalArgumentException("not a boolean: " + value);
        }
        return Boolean.parseBoolean(text);
    }

    private static Long asLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(String.valueOf(value).trim());
    }

    private static Integer asInt(Object value) {
        return Math.toIntExact(asLong(value));
    }

    private static Set<CompressionCodec> asCodecs(Object value) {
        Set<CompressionCodec> codecs = new HashSet<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                codecs.add(CompressionCodec.forName(String.valueOf(item)));
            }
        } else if (value != null) {
            for (String item : String.valueOf(value).split(",")) {
                if (!item.isBlank()) {
                    codecs.add(CompressionCodec.forName(item));
                }
            }
        }
        return codecs;
    }
}
