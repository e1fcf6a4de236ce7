package io.herald4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.herald4j.core.ContentRef;
import io.herald4j.core.NoRepeatScope;
import io.herald4j.core.RecurrenceKind;
import io.herald4j.core.Schedule;
import io.herald4j.core.SelectionPolicy;
import io.herald4j.core.ValidationException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for schedules.
 *
 * <p>The scheduler tick owns nextRunAt, lastRunAt, roundRobinCursor and the lease fields
 * (lockedAt, lockUntil, lockedBy); everything else is written through {@link #upsert}.
 */
public class MongoScheduleStore {

    public static final String EXHAUSTED = "exhausted";

    private final MongoTemplate mongoTemplate;

    public MongoScheduleStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create or replace the definition of a schedule. Runtime state owned by the tick (lastRunAt, cursor, lease)
     * is kept.
     */
    public Schedule upsert(Schedule schedule, Instant now) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        if (isBlank(schedule.id())) {
            throw new ValidationException("schedule id must not be blank");
        }

        Update u = new Update()
                .set("kind", schedule.kind().name())
                .set("spec", schedule.spec())
                .set("createdAt", schedule.createdAt())
                .set("selectionPolicy", schedule.policyOrDefault().name())
                .set("noRepeatWindow", schedule.noRepeatWindow())
                .set("noRepeatScope", schedule.scopeOrDefault().name())
                .set("nextRunAt", schedule.nextRunAt())
                .set("enabled", schedule.enabled())
                .set("updatedAt", now);

        setOrUnset(u, "timezone", schedule.timezone());
        setOrUnset(u, "contentId", schedule.content().contentId());
        setOrUnset(u, "templateId", schedule.content().templateId());
        setOrUnset(u, "disabledReason", schedule.disabledReason());

        mongoTemplate.upsert(new Query(Criteria.where("_id").is(schedule.id())), u, ScheduleDocument.class);
        return findById(schedule.id()).orElseThrow();
    }

    public Optional<ScheduleDocument> findDocument(String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, ScheduleDocument.class));
    }

    /**
     * @throws ValidationException if the stored document is not a valid schedule
     */
    public Optional<Schedule> findById(String id) {
        return findDocument(id).map(MongoScheduleStore::toSchedule);
    }

    /**
     * Enabled schedules that were created without a first run.
     */
    public List<ScheduleDocument> findUninitialized(int limit) {
        Query q = new Query(Criteria.where("enabled").is(true).and("nextRunAt").is(null));
        q.limit(limit);
        return mongoTemplate.find(q, ScheduleDocument.class);
    }

    public boolean initializeNextRunAt(String id, Instant nextRunAt, Instant now) {
        Query q = new Query(Criteria.where("_id").is(id).and("nextRunAt").is(null));
        Update u = new Update()
                .set("nextRunAt", nextRunAt)
                .set("updatedAt", now);
        return mongoTemplate.updateFirst(q, u, ScheduleDocument.class).getModifiedCount() > 0;
    }

    /**
     * Atomically leases at most {@code batchSize} due schedules.
     *
     * <p>A schedule is due when it is enabled, {@code nextRunAt <= now}, and it is not leased or its lease has
     * expired. Each claim is a {@code findAndModify}, so a schedule held by another instance is skipped rather
     * than waited on.
     */
    public List<ScheduleDocument> claimDueSchedules(Instant now, int batchSize, Duration leaseLifetime, String workerId) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(leaseLifetime, "leaseLifetime must not be null");
        if (batchSize <= 0) {
            return List.of();
        }
        if (leaseLifetime.isZero() || leaseLifetime.isNegative()) {
            throw new IllegalArgumentException("leaseLifetime must be a positive duration");
        }
        if (isBlank(workerId)) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Query baseQuery = new Query(
                Criteria.where("enabled").is(true)
                        .and("nextRunAt").ne(null).lte(now)
                        .andOperator(
                                new Criteria().orOperator(
                                        Criteria.where("lockUntil").is(null),
                                        Criteria.where("lockUntil").lte(now)
                                )
                        )
        );
        baseQuery.with(Sort.by(Sort.Order.asc("nextRunAt")));

        Update lockUpdate = new Update()
                .set("lockedAt", now)
                .set("lockUntil", now.plus(leaseLifetime))
                .set("lockedBy", workerId);

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        List<ScheduleDocument> claimed = new ArrayList<>(Math.min(batchSize, 64));
        for (int i = 0; i < batchSize; i++) {
            ScheduleDocument doc = mongoTemplate.findAndModify(baseQuery, lockUpdate, options, ScheduleDocument.class);
            if (doc == null) {
                break;
            }
            claimed.add(doc);
        }
        return claimed;
    }

    /**
     * Moves the schedule past a fired occurrence and releases the lease.
     *
     * <p>Only applies while {@code workerId} still holds the lease and nextRunAt is still {@code firedAt}, so
     * nextRunAt never moves backwards. A null {@code nextRunAt} disables the schedule as exhausted.
     *
     * @param cursorOrNull new round-robin cursor, or null to leave it untouched
     * @return false if the lease was lost or the schedule moved on meanwhile
     */
    public boolean advance(String id, String workerId, Instant firedAt, Instant nextRunAt, Integer cursorOrNull, Instant now) {
        Query q = new Query(
                Criteria.where("_id").is(id)
                        .and("lockedBy").is(workerId)
                        .and("nextRunAt").is(firedAt)
        );

        Update u = new Update()
                .set("nextRunAt", nextRunAt)
                .set("lastRunAt", firedAt)
                .set("updatedAt", now)
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");

        if (cursorOrNull != null) {
            u.set("roundRobinCursor", cursorOrNull);
        }
        if (nextRunAt == null) {
            u.set("enabled", false).set("disabledReason", EXHAUSTED);
        }

        UpdateResult r = mongoTemplate.updateFirst(q, u, ScheduleDocument.class);
        return r.getMatchedCount() > 0;
    }

    /**
     * Disable a schedule and release any lease on it.
     */
    public long disable(String id, String reason, Instant now) {
        Query q = new Query(Criteria.where("_id").is(id));
        Update u = new Update()
                .set("enabled", false)
                .set("disabledReason", reason)
                .set("lastError", reason)
                .set("updatedAt", now)
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");
        return mongoTemplate.updateFirst(q, u, ScheduleDocument.class).getModifiedCount();
    }

    public long releaseLease(String id, String workerId) {
        Query q = new Query(Criteria.where("_id").is(id).and("lockedBy").is(workerId));
        Update u = new Update()
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");
        return mongoTemplate.updateFirst(q, u, ScheduleDocument.class).getModifiedCount();
    }

    /**
     * Enabled schedules whose next run is before {@code dueBefore}.
     */
    public long countOverdue(Instant dueBefore) {
        Query q = new Query(Criteria.where("enabled").is(true).and("nextRunAt").ne(null).lt(dueBefore));
        return mongoTemplate.count(q, ScheduleDocument.class);
    }

    /**
     * Reads a stored document into the domain model.
     *
     * @throws ValidationException for an unknown kind, policy or scope, or a broken content reference
     */
    public static Schedule toSchedule(ScheduleDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        return new Schedule(
                doc.getId(),
                RecurrenceKind.parse(doc.getKind()),
                doc.getSpec(),
                doc.getTimezone(),
                doc.getCreatedAt(),
                new ContentRef(doc.getContentId(), doc.getTemplateId()),
                SelectionPolicy.parse(doc.getSelectionPolicy()),
                Math.max(0, doc.getNoRepeatWindow()),
                NoRepeatScope.parse(doc.getNoRepeatScope()),
                doc.getNextRunAt(),
                doc.getLastRunAt(),
                doc.getRoundRobinCursor(),
                doc.isEnabled(),
                doc.getDisabledReason()
        );
    }

    private static void setOrUnset(Update u, String field, String value) {
        if (!isBlank(value)) {
            u.set(field, value);
        } else {
            u.unset(field);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
