package com.tidemq.common.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a timestamp lookup: the first offset whose timestamp is at or after the target
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OffsetAndTimestamp {
    private long offset;
    private long timestamp;
}
