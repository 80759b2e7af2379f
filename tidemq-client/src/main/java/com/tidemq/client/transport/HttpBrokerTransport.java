package com.tidemq.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tidemq.common.dto.FetchRequest;
import com.tidemq.common.dto.FetchResponse;
import com.tidemq.common.dto.ListOffsetsRequest;
import com.tidemq.common.dto.OffsetCommitRequest;
import com.tidemq.common.dto.OffsetFetchRequest;
import com.tidemq.common.dto.OffsetsResponse;
import com.tidemq.common.dto.PartitionOffset;
import com.tidemq.common.exception.ErrorCode;
import com.tidemq.common.exception.TideTimeoutException;
import com.tidemq.common.exception.TransportException;
import com.tidemq.common.model.TopicPartition;
import com.tidemq.common.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link BrokerTransport} speaking JSON over HTTP to a TideMQ storage broker.
 * Message sets travel Base64 encoded inside {@link FetchResponse}.
 */
@Slf4j
public class HttpBrokerTransport implements BrokerTransport {

    private final String brokerUrl;
    private final String clientId;
    private final long fetchMaxWaitMs;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private volatile Boolean timestampLookupSupported;

    public HttpBrokerTransport(String brokerUrl, String clientId, long fetchMaxWaitMs, long connectTimeoutMs) {
        this.brokerUrl = brokerUrl.endsWith("/") ? brokerUrl.substring(0, brokerUrl.length() - 1) : brokerUrl;
        this.clientId = clientId;
        this.fetchMaxWaitMs = fetchMaxWaitMs;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();
        this.objectMapper = JsonUtils.mapper();
        log.info("HttpBrokerTransport initialized for broker {}", this.brokerUrl);
    }

    @Override
    public FetchResult fetch(TopicPartition partition, long offset, int maxBytes, long timeoutMs) {
        FetchRequest request = FetchRequest.builder()
                .clientId(clientId)
                .topic(partition.getTopic())
                .partition(partition.getPartition())
                .offset(offset)
                .maxBytes(maxBytes)
                .maxWaitMs(Math.min(fetchMaxWaitMs, timeoutMs))
                .build();

        log.debug("Fetching {} at offset {} with maxBytes={}", partition, offset, maxBytes);
        FetchResponse response = post("/api/v1/storage/fetch", request, FetchResponse.class, timeoutMs);

        long highWaterMark = response.getHighWaterMark() != null ? response.getHighWaterMark() : -1L;
        long logStartOffset = response.getLogStartOffset() != null ? response.getLogStartOffset() : -1L;

        if (!response.isSuccess()) {
            ErrorCode error = errorOf(response.getErrorCode());
            if (error == ErrorCode.OFFSET_OUT_OF_RANGE) {
                return FetchResult.offsetOutOfRange(highWaterMark, logStartOffset);
            }
            throw new TransportException(error, "Fetch from " + partition + " failed: " + response.getErrorMessage());
        }
        if (response.getRequiredBytes() != null) {
            return FetchResult.sizeTooSmall(response.getRequiredBytes(), highWaterMark, logStartOffset);
        }
        if (response.getRecords() == null || response.getRecords().length == 0) {
            return FetchResult.empty(highWaterMark, logStartOffset);
        }
        return FetchResult.records(response.getRecords(), highWaterMark, logStartOffset);
    }

    @Override
    public void commit(String groupId, Map<TopicPartition, Long> offsets, long timeoutMs) {
        List<PartitionOffset> entries = new ArrayList<>();
        offsets.forEach((partition, offset) -> entries.add(PartitionOffset.builder()
                .topic(partition.getTopic())
                .partition(partition.getPartition())
                .offset(offset)
                .build()));

        OffsetCommitRequest request = OffsetCommitRequest.builder()
                .groupId(groupId)
                .clientId(clientId)
                .offsets(entries)
                .build();

        OffsetsResponse response = post("/api/v1/consumer-groups/offsets/commit", request,
                OffsetsResponse.class, timeoutMs);
        if (!response.isSuccess()) {
            throw new TransportException(errorOf(response.getErrorCode()),
                    "Offset commit for group " + groupId + " failed: " + response.getErrorMessage());
        }
        log.debug("Committed offsets for group {}: {}", groupId, offsets);
    }

    @Override
    public Map<TopicPartition, Long> fetchCommitted(String groupId, Set<TopicPartition> partitions, long timeoutMs) {
        OffsetFetchRequest request = OffsetFetchRequest.builder()
                .groupId(groupId)
                .partitions(toEntries(partitions))
                .build();

        OffsetsResponse response = post("/api/v1/consumer-groups/offsets/fetch", request,
                OffsetsResponse.class, timeoutMs);
        if (!response.isSuccess()) {
            throw new TransportException(errorOf(response.getErrorCode()),
                    "Offset fetch for group " + groupId + " failed: " + response.getErrorMessage());
        }

        Map<TopicPartition, Long> committed = new HashMap<>();
        if (response.getPartitions() != null) {
            for (PartitionOffset entry : response.getPartitions()) {
                if (entry.getOffset() != null && entry.getOffset() >= 0) {
                    committed.put(new TopicPartition(entry.getTopic(), entry.getPartition()), entry.getOffset());
                }
            }
        }
        return committed;
    }

    @Override
    public Map<TopicPartition, ListOffsetsResult> listOffsets(Map<TopicPartition, Long> targets, long timeoutMs) {
        List<PartitionOffset> entries = new ArrayList<>();
        targets.forEach((partition, timestamp) -> entries.add(PartitionOffset.builder()
                .topic(partition.getTopic())
                .partition(partition.getPartition())
                .timestamp(timestamp)
                .build()));

        ListOffsetsRequest request = ListOffsetsRequest.builder()
                .clientId(clientId)
                .partitions(entries)
                .build();

        OffsetsResponse response = post("/api/v1/storage/list-offsets", request, OffsetsResponse.class, timeoutMs);
        if (!response.isSuccess()) {
            throw new TransportException(errorOf(response.getErrorCode()),
                    "List offsets failed: " + response.getErrorMessage());
        }

        Map<TopicPartition, ListOffsetsResult> results = new HashMap<>();
        if (response.getPartitions() != null) {
            for (PartitionOffset entry : response.getPartitions()) {
                TopicPartition partition = new TopicPartition(entry.getTopic(), entry.getPartition());
                if (entry.getErrorCode() != null && entry.getErrorCode() != 0) {
                    results.put(partition, ListOffsetsResult.failed(errorOf(entry.getErrorCode())));
                } else if (entry.getOffset() == null || entry.getOffset() < 0) {
                    results.put(partition, ListOffsetsResult.notFound());
                } else {
                    long timestamp = entry.getTimestamp() != null ? entry.getTimestamp() : -1L;
                    results.put(partition, ListOffsetsResult.found(entry.getOffset(), timestamp));
                }
            }
        }
        return results;
    }

    @Override
    public boolean supportsTimestampLookup() {
        Boolean supported = timestampLookupSupported;
        if (supported == null) {
            supported = probeFeatures();
            timestampLookupSupported = supported;
        }
        return supported;
    }

    private boolean probeFeatures() {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(brokerUrl + "/api/v1/storage/features"))
                .GET()
                .timeout(Duration.ofSeconds(5))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.info("Broker {} does not advertise features (HTTP {}), assuming no timestamp lookup",
                        brokerUrl, response.statusCode());
                return false;
            }
            JsonNode features = objectMapper.readTree(response.body());
            return features.path("timestampLookup").asBoolean(false);
        } catch (HttpTimeoutException e) {
            throw new TideTimeoutException("Timed out probing features of broker " + brokerUrl, e);
        } catch (IOException e) {
            throw new TransportException("Failed to probe features of broker " + brokerUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while probing broker " + brokerUrl, e);
        }
    }

    private <T> T post(String path, Object body, Class<T> responseType, long timeoutMs) {
        String url = brokerUrl + path;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .timeout(Duration.ofMillis(Math.max(1L, timeoutMs)))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new TransportException(ErrorCode.NETWORK_ERROR,
                        "Request to " + url + " failed: HTTP " + response.statusCode() + " - " + response.body());
            }
            return objectMapper.readValue(response.body(), responseType);
        } catch (HttpTimeoutException e) {
            throw new TideTimeoutException("Request to " + url + " timed out after " + timeoutMs + "ms", e);
        } catch (IOException e) {
            throw new TransportException("Request to " + url + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while calling " + url, e);
        }
    }

    private static List<PartitionOffset> toEntries(Set<TopicPartition> partitions) {
        List<PartitionOffset> entries = new ArrayList<>();
        for (TopicPartition partition : partitions) {
            entries.add(PartitionOffset.builder()
                    .topic(partition.getTopic())
                    .partition(partition.getPartition())
                    .build());
        }
        return entries;
    }

    private static ErrorCode errorOf(Integer code) {
        return code == null ? ErrorCode.UNKNOWN_ERROR : ErrorCode.fromCode(code);
    }

    @Override
    public void close() {
        log.info("HttpBrokerTransport for {} closed", brokerUrl);
    }
}
