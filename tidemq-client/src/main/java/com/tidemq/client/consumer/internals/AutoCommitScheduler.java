package com.tidemq.client.consumer.internals;

import com.tidemq.client.transport.BrokerTransport;
import com.tidemq.common.exception.CommitFailedException;
import com.tidemq.common.exception.TideMQException;
import com.tidemq.common.model.TopicPartition;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Commits consumed positions of the group.
 *
 * <p>Automatic commits fire on elapsed time (background thread) and on the
 * number of consumed messages (consumption thread). Only one commit runs at a
 * time; an automatic trigger that finds one running is skipped. Automatic
 * failures are logged and retried by the next trigger.
 */
@Slf4j
public class AutoCommitScheduler {

    private final PartitionCursorTable table;
    private final BrokerTransport transport;
    private final String groupId;
    private final boolean autoCommitEnabled;
    private final long intervalMs;
    private final int everyN;
    private final long requestTimeoutMs;
    private final ScheduledExecutorService commitExecutor;

    private final ReentrantLock commitLock = new ReentrantLock();
    private int consumedSinceCommit;
    private volatile boolean closed = false;

    public AutoCommitScheduler(PartitionCursorTable table, BrokerTransport transport, String groupId,
                               boolean autoCommitEnabled, long intervalMs, int everyN,
                               long requestTimeoutMs, String clientId) {
        this.table = table;
        this.transport = transport;
        this.groupId = groupId;
        this.autoCommitEnabled = autoCommitEnabled && groupId != null;
        this.intervalMs = intervalMs;
        this.everyN = everyN;
        this.requestTimeoutMs = requestTimeoutMs;
        this.commitExecutor = groupId == null ? null : Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("tidemq-consumer-commit-" + clientId);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the time trigger if it is enabled.
     */
    public void start() {
        if (!autoCommitEnabled || intervalMs <= 0) {
            log.debug("Time based auto-commit disabled");
            return;
        }
        commitExecutor.scheduleAtFixedRate(() -> tryCommit("interval"), intervalMs, intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Started auto-commit for group {} with interval: {}ms", groupId, intervalMs);
    }

    /**
     * Count messages handed to the application; commits inline every {@code everyN}.
     */
    public void recordConsumed(int count) {
        if (!autoCommitEnabled || everyN <= 0 || count <= 0) {
            return;
        }
        consumedSinceCommit += count;
        if (consumedSinceCommit >= everyN) {
            consumedSinceCommit = 0;
            tryCommit("count");
        }
    }

    /**
     * Commit now and wait for the result.
     *
     * @throws CommitFailedException if the broker rejects the commit or cannot be reached
     */
    public void commitSync() {
        requireGroup();
        commitLock.lock();
        try {
            commitSnapshot();
        } catch (TideMQException e) {
            throw new CommitFailedException("Offset commit for group " + groupId + " failed: " + e.getMessage(), e);
        } finally {
            commitLock.unlock();
        }
    }

    /**
     * Commit on the background thread. Failures are logged.
     */
    public void commitAsync() {
        requireGroup();
        try {
            commitExecutor.execute(() -> {
                commitLock.lock();
                try {
                    commitSnapshot();
                } catch (RuntimeException e) {
                    log.warn("Async offset commit for group {} failed: {}", groupId, e.getMessage(), e);
                } finally {
                    commitLock.unlock();
                }
            });
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Consumer is closed", e);
        }
    }

    /**
     * Stop the timer and make one best-effort commit when auto-commit is on.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (commitExecutor != null) {
            commitExecutor.shutdown();
            try {
                if (!commitExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    commitExecutor.shutdownNow();
                    log.warn("Commit thread did not terminate gracefully");
                }
            } catch (InterruptedException e) {
                commitExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (autoCommitEnabled) {
            commitLock.lock();
            try {
                commitSnapshot();
                log.info("Final offsets committed for group {}", groupId);
            } catch (RuntimeException e) {
                log.warn("Failed to commit final offsets for group {}: {}", groupId, e.getMessage(), e);
            } finally {
                commitLock.unlock();
            }
        }
    }

    public boolean isAutoCommitEnabled() {
        return autoCommitEnabled;
    }

    private void tryCommit(String trigger) {
        if (!commitLock.tryLock()) {
            log.debug("Skipping {} auto-commit, another commit is in flight", trigger);
            return;
        }
        try {
            commitSnapshot();
        } catch (RuntimeException e) {
            // an escaping exception would cancel the periodic task for good
            log.warn("Auto-commit ({}) for group {} failed, will retry on the next trigger: {}",
                    trigger, groupId, e.getMessage(), e);
        } finally {
            commitLock.unlock();
        }
    }

    private void commitSnapshot() {
        Map<TopicPartition, Long> snapshot = table.snapshotCommittable();
        if (snapshot.isEmpty()) {
            log.debug("No offsets to commit");
            return;
        }
        transport.commit(groupId, snapshot, requestTimeoutMs);
        table.markCommitted(snapshot);
        log.debug("Committed offsets for group {}: {}", groupId, snapshot);
    }

    private void requireGroup() {
        if (groupId == null) {
            throw new IllegalStateException("Cannot commit offsets without a group_id");
        }
    }
}
