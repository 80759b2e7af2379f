package com.tidemq.common.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response to a fetch request. {@code records} holds the raw message set,
 * possibly ending in a partial entry when it hit {@code maxBytes}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchResponse {
    private boolean success;
    private Integer errorCode;
    private String errorMessage;

    @JsonDeserialize(using = Base64ByteArrayDeserializer.class)
    @JsonSerialize(using = Base64ByteArraySerializer.class)
    private byte[] records;

    private Long highWaterMark;
    private Long logStartOffset;
    /** Set when the broker refuses to return a partial message that does not fit maxBytes. */
    private Integer requiredBytes;
}
