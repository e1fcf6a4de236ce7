package io.herald4j.internal.mongo;

import io.herald4j.ContentSource;
import io.herald4j.JobStateMachine;
import io.herald4j.Publisher;
import io.herald4j.core.FixedContent;
import io.herald4j.core.Job;
import io.herald4j.core.JobStatus;
import io.herald4j.core.PermanentPublishException;
import io.herald4j.core.PublishResult;
import io.herald4j.core.PublishedRecord;
import io.herald4j.core.RetryPolicy;
import io.herald4j.core.TransientPublishException;
import io.herald4j.core.TransitionException;
import io.herald4j.core.TransitionFields;
import io.herald4j.core.ValidationException;
import io.herald4j.core.Variant;
import io.herald4j.selection.VariantValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes one publish job: claim, publish, record, finish.
 *
 * <p>The job document is never held across the external call: the claim (-> RUNNING) and the outcome
 * (-> SUCCEEDED / FAILED / DEAD_LETTER) are two separate atomic writes. A {@link PublishedRecord} is written before
 * SUCCEEDED, so a retry after a crash in between finishes the job without publishing twice.
 */
public class PublishWorker {
    private static final Logger log = LoggerFactory.getLogger(PublishWorker.class);

    public enum Outcome {
        /** Not runnable any more, or claimed by another worker. */
        SKIPPED,
        SUCCEEDED,
        RETRY_SCHEDULED,
        DEAD_LETTERED
    }

    private record Payload(String text, List<String> mediaRefs) {
    }

    private final MongoJobStore jobStore;
    private final JobStateMachine stateMachine;
    private final MongoPublishedRecordStore publishedStore;
    private final ContentSource contentSource;
    private final VariantValidator validator;
    private final Publisher publisher;
    private final RetryPolicy retryPolicy;
    private final Duration publishTimeout;
    private final ExecutorService publishExecutor;
    private final String workerId;
    private final Clock clock;

    public PublishWorker(MongoJobStore jobStore,
                         JobStateMachine stateMachine,
                         MongoPublishedRecordStore publishedStore,
                         ContentSource contentSource,
                         VariantValidator validator,
                         Publisher publisher,
                         RetryPolicy retryPolicy,
                         Duration publishTimeout,
                         ExecutorService publishExecutor,
                         String workerId,
                         Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        this.publishedStore = Objects.requireNonNull(publishedStore, "publishedStore must not be null");
        this.contentSource = Objects.requireNonNull(contentSource, "contentSource must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.publishTimeout = Objects.requireNonNull(publishTimeout, "publishTimeout must not be null");
        this.publishExecutor = Objects.requireNonNull(publishExecutor, "publishExecutor must not be null");
        this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public List<String> findRunnable(Instant now, int limit) {
        return jobStore.findRunnableIds(now, limit);
    }

    public Outcome process(String jobId) {
        Optional<Job> current = jobStore.findById(jobId);
        if (current.isEmpty()) {
            log.warn("herald job vanished before processing id={}", jobId);
            return Outcome.SKIPPED;
        }
        JobStatus status = current.get().status();
        if (status != JobStatus.ENQUEUED && status != JobStatus.FAILED) {
            log.debug("herald job not runnable id={} status={}", jobId, status);
            return Outcome.SKIPPED;
        }

        Optional<Job> claimed = stateMachine.transitionIfStatus(jobId, status, JobStatus.RUNNING,
                TransitionFields.worker(workerId));
        if (claimed.isEmpty()) {
            log.debug("herald job claimed elsewhere id={}", jobId);
            return Outcome.SKIPPED;
        }
        Job job = claimed.get();
        log.debug("herald job started id={} scheduleId={} attempt={}", job.id(), job.scheduleId(), job.attempt());

        try {
            Optional<PublishedRecord> existing = publishedStore.findByJobId(jobId);
            if (existing.isPresent()) {
                log.info("herald job already published, completing id={} externalId={}", jobId, existing.get().externalId());
                stateMachine.transition(jobId, JobStatus.SUCCEEDED, TransitionFields.published(existing.get().externalId()));
                return Outcome.SUCCEEDED;
            }

            Payload payload = resolvePayload(job);
            PublishResult result = publish(payload);

            publishedStore.insert(new PublishedRecord(jobId, job.scheduleId(), result.externalId(),
                    clock.instant(), job.templateId(), job.variantId()));
            stateMachine.transition(jobId, JobStatus.SUCCEEDED, TransitionFields.published(result.externalId()));
            log.debug("herald job succeeded id={} externalId={}", jobId, result.externalId());
            return Outcome.SUCCEEDED;
        } catch (PermanentPublishException e) {
            return deadLetter(job, "permanent: " + e.getMessage());
        } catch (TransientPublishException e) {
            return fail(job, "transient: " + e.getMessage());
        } catch (TransitionException e) {
            log.error("herald job transition rejected id={} msg={}", jobId, e.getMessage(), e);
            return Outcome.SKIPPED;
        } catch (Exception e) {
            log.error("herald job failed unexpectedly id={} msg={}", jobId, e.getMessage(), e);
            return fail(job, "unexpected: " + e);
        }
    }

    private Outcome fail(Job job, String error) {
        if (retryPolicy.isExhausted(job.attempt())) {
            return deadLetter(job, error + " (attempts exhausted: " + job.attempt() + ")");
        }
        Instant nextAttemptAt = retryPolicy.nextAttemptAt(clock.instant(), job.attempt());
        try {
            stateMachine.transition(job.id(), JobStatus.FAILED, TransitionFields.retryAt(error, nextAttemptAt));
        } catch (TransitionException e) {
            log.error("herald job failure not recorded id={} msg={}", job.id(), e.getMessage(), e);
            return Outcome.SKIPPED;
        }
        log.warn("herald job failed id={} attempt={} nextAttemptAt={} msg={}", job.id(), job.attempt(), nextAttemptAt, error);
        return Outcome.RETRY_SCHEDULED;
    }

    private Outcome deadLetter(Job job, String error) {
        Optional<Job> dead;
        try {
            // FAILED without nextAttemptAt is not claimable; if we die here the reaper finishes the move
            stateMachine.transition(job.id(), JobStatus.FAILED, TransitionFields.error(error));
            dead = stateMachine.transitionIfStatus(job.id(), JobStatus.FAILED, JobStatus.DEAD_LETTER,
                    TransitionFields.error(error));
        } catch (TransitionException e) {
            log.error("herald job dead-letter not recorded id={} msg={}", job.id(), e.getMessage(), e);
            return Outcome.SKIPPED;
        }
        if (dead.isEmpty()) {
            log.warn("herald job left FAILED before dead-lettering id={} msg={}", job.id(), error);
            return Outcome.SKIPPED;
        }
        log.warn("herald job dead-lettered id={} scheduleId={} attempt={} msg={}", job.id(), job.scheduleId(), job.attempt(), error);
        return Outcome.DEAD_LETTERED;
    }

    private Payload resolvePayload(Job job) throws PermanentPublishException {
        try {
            if (job.isVariantBased()) {
                Variant variant = contentSource.findVariant(job.templateId(), job.variantId())
                        .orElseThrow(() -> new PermanentPublishException(
                                "variant " + job.variantId() + " of template " + job.templateId() + " no longer exists"));
                Optional<String> rejection = validator.rejectionReason(variant);
                if (rejection.isPresent()) {
                    throw new PermanentPublishException(rejection.get());
                }
                return new Payload(variant.text(), List.of());
            }
            if (job.contentId() != null) {
                FixedContent content = contentSource.fixedContent(job.contentId())
                        .orElseThrow(() -> new PermanentPublishException("content " + job.contentId() + " no longer exists"));
                if (content.deleted()) {
                    throw new PermanentPublishException("content " + job.contentId() + " was deleted");
                }
                if (content.text() == null || content.text().isBlank()) {
                    throw new PermanentPublishException("content " + job.contentId() + " has no text");
                }
                return new Payload(content.text(), content.mediaRefs());
            }
        } catch (ValidationException e) {
            throw new PermanentPublishException(e.getMessage(), e);
        }
        throw new PermanentPublishException("job " + job.id() + " references no content");
    }

    private PublishResult publish(Payload payload) throws TransientPublishException, PermanentPublishException {
        Future<PublishResult> future = publishExecutor.submit(() -> publisher.publish(payload.text(), payload.mediaRefs()));
        PublishResult result;
        try {
            result = future.get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientPublishException("publish timed out after " + publishTimeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientPublishException("interrupted while publishing", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransientPublishException t) {
                throw t;
            }
            if (cause instanceof PermanentPublishException p) {
                throw p;
            }
            throw new TransientPublishException("publisher failed: " + cause, cause);
        }
        if (result == null) {
            throw new TransientPublishException("publisher returned no result");
        }
        return result;
    }
}
