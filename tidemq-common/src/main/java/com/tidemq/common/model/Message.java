package com.tidemq.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;

/**
 * A message read from a partition log
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message implements Serializable {
    private static final long serialVersionUID = 1L;

    private String topic;
    private Integer partition;
    private Long offset;
    private Long timestamp;
    private String key;
    private byte[] value;

    public TopicPartition topicPartition() {
        return new TopicPartition(topic, partition);
    }

    public String valueAsString() {
        return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }
}
