package com.tidemq.client.consumer.internals;

import com.tidemq.common.codec.DecodedBatch;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A decoded batch and the cursor epoch it belongs to.
 */
@Getter
@AllArgsConstructor
public class FetchedBatch {
    private final DecodedBatch batch;
    private final long epoch;
}
