package com.tidemq.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to read a message set from one partition
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchRequest {
    private String clientId;
    private String topic;
    private Integer partition;
    private Long offset;
    private Integer maxBytes;
    private Long maxWaitMs;
}
