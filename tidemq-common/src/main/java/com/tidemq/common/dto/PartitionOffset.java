package com.tidemq.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One partition entry of an offset request or response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartitionOffset {
    private String topic;
    private Integer partition;
    private Long offset;
    /** Target timestamp in list-offsets requests, message timestamp in responses. */
    private Long timestamp;
    private Integer errorCode;
}
