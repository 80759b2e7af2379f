package com.tidemq.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to durably store consumed positions for a group
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OffsetCommitRequest {
    private String groupId;
    private String clientId;
    private List<PartitionOffset> offsets;
}
