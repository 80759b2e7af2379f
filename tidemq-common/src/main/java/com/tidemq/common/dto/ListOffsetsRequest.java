package com.tidemq.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to resolve timestamps (or the earliest / latest sentinels) to offsets
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListOffsetsRequest {
    private String clientId;
    private List<PartitionOffset> partitions;
}
