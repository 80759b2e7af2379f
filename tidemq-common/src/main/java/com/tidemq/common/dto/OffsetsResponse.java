package com.tidemq.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response shared by offset commit, offset fetch and list-offsets requests
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OffsetsResponse {
    private boolean success;
    private Integer errorCode;
    private String errorMessage;
    private List<PartitionOffset> partitions;
}
