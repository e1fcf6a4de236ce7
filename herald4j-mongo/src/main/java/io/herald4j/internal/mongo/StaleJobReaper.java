package io.herald4j.internal.mongo;

import io.herald4j.JobStateMachine;
import io.herald4j.core.Job;
import io.herald4j.core.JobStatus;
import io.herald4j.core.RetryPolicy;
import io.herald4j.core.TransitionException;
import io.herald4j.core.TransitionFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Recovers jobs abandoned by crashed instances.
 *
 * <ul>
 *   <li>RUNNING past the stale threshold: the worker is gone, so FAILED (retry now) or DEAD_LETTER at max attempts</li>
 *   <li>FAILED with no retry time past the stale threshold: the worker died between FAILED and DEAD_LETTER</li>
 *   <li>PLANNED past the stale threshold: the tick died before enqueueing, so ENQUEUED</li>
 * </ul>
 * Also prunes selection history past its retention.
 */
public class StaleJobReaper {
    private static final Logger log = LoggerFactory.getLogger(StaleJobReaper.class);

    static final String WORKER_LOST = "stale: worker lost";

    public record ReapResult(int failed, int deadLettered, int enqueued, long historyPruned) {
        public boolean isEmpty() {
            return failed == 0 && deadLettered == 0 && enqueued == 0 && historyPruned == 0;
        }
    }

    private final MongoJobStore jobStore;
    private final MongoSelectionHistoryStore historyStore;
    private final JobStateMachine stateMachine;
    private final RetryPolicy retryPolicy;
    private final Duration staleThreshold;
    private final Duration historyRetention;
    private final int batchSize;

    public StaleJobReaper(MongoJobStore jobStore,
                          MongoSelectionHistoryStore historyStore,
                          JobStateMachine stateMachine,
                          RetryPolicy retryPolicy,
                          Duration staleThreshold,
                          Duration historyRetention,
                          int batchSize) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore must not be null");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.staleThreshold = Objects.requireNonNull(staleThreshold, "staleThreshold must not be null");
        this.historyRetention = historyRetention;
        this.batchSize = Math.max(1, batchSize);
    }

    public ReapResult reapOnce(Instant now) {
        Instant staleBefore = now.minus(staleThreshold);
        int failed = 0;
        int deadLettered = 0;
        int enqueued = 0;

        for (Job job : jobStore.findStaleRunning(staleBefore, batchSize)) {
            try {
                if (retryPolicy.isExhausted(job.attempt())) {
                    Optional<Job> reaped = stateMachine.transitionIfStatus(job.id(), JobStatus.RUNNING, JobStatus.FAILED,
                            TransitionFields.error(WORKER_LOST));
                    if (reaped.isPresent() && deadLetter(job, WORKER_LOST)) {
                        log.warn("herald stale job dead-lettered id={} attempt={} lockedBy={}", job.id(), job.attempt(), job.lockedBy());
                        deadLettered++;
                    }
                    continue;
                }
                Optional<Job> reaped = stateMachine.transitionIfStatus(job.id(), JobStatus.RUNNING, JobStatus.FAILED,
                        TransitionFields.retryAt(WORKER_LOST, now));
                if (reaped.isPresent()) {
                    log.warn("herald stale job failed for retry id={} attempt={} lockedBy={}", job.id(), job.attempt(), job.lockedBy());
                    failed++;
                }
            } catch (TransitionException e) {
                log.error("herald stale job not reaped id={} msg={}", job.id(), e.getMessage(), e);
            }
        }

        for (Job job : jobStore.findUnfinishedDeadLetters(staleBefore, batchSize)) {
            try {
                if (deadLetter(job, job.lastError())) {
                    log.warn("herald failed job dead-lettered after worker loss id={} attempt={} msg={}",
                            job.id(), job.attempt(), job.lastError());
                    deadLettered++;
                }
            } catch (TransitionException e) {
                log.error("herald failed job not dead-lettered id={} msg={}", job.id(), e.getMessage(), e);
            }
        }

        for (Job job : jobStore.findStalePlanned(staleBefore, batchSize)) {
            try {
                Optional<Job> queued = stateMachine.transitionIfStatus(job.id(), JobStatus.PLANNED, JobStatus.ENQUEUED,
                        TransitionFields.availableAt(job.plannedAt()));
                if (queued.isPresent()) {
                    log.warn("herald orphaned planned job enqueued id={} scheduleId={} plannedAt={}",
                            job.id(), job.scheduleId(), job.plannedAt());
                    enqueued++;
                }
            } catch (TransitionException e) {
                log.error("herald orphaned job not enqueued id={} msg={}", job.id(), e.getMessage(), e);
            }
        }

        long pruned = 0;
        if (historyRetention != null && !historyRetention.isZero() && !historyRetention.isNegative()) {
            pruned = historyStore.pruneOlderThan(now.minus(historyRetention));
            if (pruned > 0) {
                log.debug("herald selection history pruned count={}", pruned);
            }
        }
        return new ReapResult(failed, deadLettered, enqueued, pruned);
    }

    private boolean deadLetter(Job job, String error) {
        return stateMachine.transitionIfStatus(job.id(), JobStatus.FAILED, JobStatus.DEAD_LETTER,
                TransitionFields.error(error)).isPresent();
    }
}
