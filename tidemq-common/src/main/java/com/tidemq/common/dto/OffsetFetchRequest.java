package com.tidemq.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request for the committed positions of a group
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OffsetFetchRequest {
    private String groupId;
    private List<PartitionOffset> partitions;
}
