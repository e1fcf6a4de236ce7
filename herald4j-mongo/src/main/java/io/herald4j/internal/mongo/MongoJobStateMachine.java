package io.herald4j.internal.mongo;

import io.herald4j.JobStateMachine;
import io.herald4j.core.InvalidTransitionException;
import io.herald4j.core.Job;
import io.herald4j.core.JobNotFoundException;
import io.herald4j.core.JobStatus;
import io.herald4j.core.TransitionConflictException;
import io.herald4j.core.TransitionFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Job state machine on top of {@code findAndModify}.
 *
 * <p>Every write is guarded by the status (and, for {@link #transition}, the version) the caller validated
 * against, so a concurrent writer makes the write miss instead of overwriting. A missed write is re-read and
 * re-validated up to {@link #MAX_CAS_ATTEMPTS} times.
 */
public class MongoJobStateMachine implements JobStateMachine {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStateMachine.class);

    static final int MAX_CAS_ATTEMPTS = 5;

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoJobStateMachine(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Job transition(String jobId, JobStatus target, TransitionFields fields) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(target, "target must not be null");

        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            PublishJobDocument current = mongoTemplate.findById(jobId, PublishJobDocument.class);
            if (current == null) {
                throw new JobNotFoundException(jobId);
            }
            JobStatus from = current.getStatus();
            if (from == null || !from.canTransitionTo(target)
                    || (isRetryClaim(from, target) && current.getNextAttemptAt() == null)) {
                throw new InvalidTransitionException(jobId, from, target);
            }

            Query q = new Query(claimable(
                    Criteria.where("_id").is(jobId)
                            .and("status").is(from)
                            .and("version").is(current.getVersion()), from, target));
            PublishJobDocument updated = apply(q, target, fields);
            if (updated != null) {
                log.debug("herald job transition id={} {}->{} version={}", jobId, from, target, updated.getVersion());
                return MongoJobStore.toJob(updated);
            }
            log.debug("herald job transition conflict id={} {}->{} attempt={}", jobId, from, target, attempt);
        }
        throw new TransitionConflictException(jobId, target, MAX_CAS_ATTEMPTS);
    }

    @Override
    public Optional<Job> transitionIfStatus(String jobId, JobStatus expected, JobStatus target, TransitionFields fields) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(expected, "expected must not be null");
        if (!expected.canTransitionTo(target)) {
            throw new InvalidTransitionException(jobId, expected, target);
        }

        Query q = new Query(claimable(Criteria.where("_id").is(jobId).and("status").is(expected), expected, target));
        PublishJobDocument updated = apply(q, target, fields);
        if (updated == null) {
            return Optional.empty();
        }
        log.debug("herald job transition id={} {}->{} version={}", jobId, expected, target, updated.getVersion());
        return Optional.of(MongoJobStore.toJob(updated));
    }

    private static boolean isRetryClaim(JobStatus from, JobStatus target) {
        return from == JobStatus.FAILED && target == JobStatus.RUNNING;
    }

    /**
     * A FAILED job is only claimable while it has a retry time. Without one it is waiting for DEAD_LETTER.
     */
    private static Criteria claimable(Criteria criteria, JobStatus from, JobStatus target) {
        return isRetryClaim(from, target) ? criteria.and("nextAttemptAt").ne(null) : criteria;
    }

    private PublishJobDocument apply(Query q, JobStatus target, TransitionFields fields) {
        TransitionFields f = fields == null ? TransitionFields.none() : fields;
        Instant now = clock.instant();

        Update u = new Update()
                .set("status", target)
                .set("updatedAt", now)
                .inc("version", 1);

        switch (target) {
            case ENQUEUED -> u
                    .set("enqueuedAt", now)
                    .set("availableAt", f.availableAt() != null ? f.availableAt() : now);
            case RUNNING -> {
                u.set("startedAt", now)
                        .inc("attempt", 1)
                        .unset("finishedAt")
                        .unset("nextAttemptAt");
                if (f.workerId() != null) {
                    u.set("lockedBy", f.workerId());
                }
            }
            case SUCCEEDED -> {
                u.set("finishedAt", now).unset("lastError");
                if (f.externalId() != null) {
                    u.set("externalId", f.externalId());
                }
            }
            case FAILED -> {
                u.set("finishedAt", now).set("lastError", f.error());
                if (f.nextAttemptAt() != null) {
                    u.set("nextAttemptAt", f.nextAttemptAt());
                } else {
                    u.unset("nextAttemptAt");
                }
            }
            case DEAD_LETTER, CANCELLED -> {
                u.set("finishedAt", now).unset("nextAttemptAt");
                if (f.error() != null) {
                    u.set("lastError", f.error());
                }
            }
            case PLANNED -> throw new IllegalArgumentException("PLANNED is only set on insert");
        }

        return mongoTemplate.findAndModify(q, u, FindAndModifyOptions.options().returnNew(true), PublishJobDocument.class);
    }
}
