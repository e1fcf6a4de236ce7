package io.herald4j.internal.mongo;

import io.herald4j.core.DuplicateJobException;
import io.herald4j.core.Job;
import io.herald4j.core.JobStatus;
import io.herald4j.core.Schedule;
import io.herald4j.selection.Selection;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for publish jobs.
 *
 * <p>Jobs are only inserted here; every later change goes through {@link MongoJobStateMachine}. The unique index
 * on (scheduleId, plannedAt) is what makes job creation at-most-once.
 */
public class MongoJobStore {

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Insert the job for one occurrence in PLANNED.
     *
     * @param selection the variant draw for template-based schedules, null for fixed content
     * @throws DuplicateJobException if the occurrence already has a job
     */
    public Job insertPlanned(Schedule schedule, Instant plannedAt, Selection selection, Instant now) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(plannedAt, "plannedAt must not be null");

        PublishJobDocument doc = new PublishJobDocument();
        doc.setScheduleId(schedule.id());
        doc.setPlannedAt(plannedAt);
        doc.setTemplateId(schedule.content().templateId());
        doc.setContentId(schedule.content().contentId());
        if (selection != null) {
            doc.setVariantId(selection.variant().id());
            doc.setSelectionPolicy(selection.policy());
            doc.setSelectionSeed(selection.seed());
        }
        doc.setStatus(JobStatus.PLANNED);
        doc.setAttempt(0);
        doc.setVersion(0);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);

        try {
            return toJob(mongoTemplate.insert(doc));
        } catch (DuplicateKeyException e) {
            throw new DuplicateJobException(schedule.id(), plannedAt, e);
        }
    }

    public Optional<PublishJobDocument> findDocument(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(mongoTemplate.findById(id, PublishJobDocument.class));
    }

    public Optional<Job> findById(String id) {
        return findDocument(id).map(MongoJobStore::toJob);
    }

    public Optional<Job> findByOccurrence(String scheduleId, Instant plannedAt) {
        Query q = new Query(Criteria.where("scheduleId").is(scheduleId).and("plannedAt").is(plannedAt));
        return Optional.ofNullable(mongoTemplate.findOne(q, PublishJobDocument.class)).map(MongoJobStore::toJob);
    }

    public List<Job> findBySchedule(String scheduleId) {
        Query q = new Query(Criteria.where("scheduleId").is(scheduleId));
        q.with(Sort.by(Sort.Order.asc("plannedAt")));
        return mongoTemplate.find(q, PublishJobDocument.class).stream().map(MongoJobStore::toJob).toList();
    }

    public List<Job> findByStatus(JobStatus status, int limit) {
        Query q = new Query(Criteria.where("status").is(status));
        q.with(Sort.by(Sort.Order.asc("plannedAt")));
        q.limit(Math.max(1, limit));
        return mongoTemplate.find(q, PublishJobDocument.class).stream().map(MongoJobStore::toJob).toList();
    }

    /**
     * Ids of jobs a worker may claim: ENQUEUED and available, or FAILED and due for retry. Oldest first.
     */
    public List<String> findRunnableIds(Instant now, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Query q = new Query(new Criteria().orOperator(
                Criteria.where("status").is(JobStatus.ENQUEUED).and("availableAt").lte(now),
                Criteria.where("status").is(JobStatus.FAILED).and("nextAttemptAt").lte(now)
        ));
        q.with(Sort.by(Sort.Order.asc("plannedAt")));
        q.limit(limit);
        q.fields().include("_id");
        return mongoTemplate.find(q, PublishJobDocument.class).stream()
                .map(PublishJobDocument::getId)
                .filter(Objects::nonNull)
                .toList();
    }

    public List<Job> findStaleRunning(Instant startedBefore, int limit) {
        Query q = new Query(Criteria.where("status").is(JobStatus.RUNNING).and("startedAt").lt(startedBefore));
        q.limit(Math.max(1, limit));
        return mongoTemplate.find(q, PublishJobDocument.class).stream().map(MongoJobStore::toJob).toList();
    }

    /**
     * PLANNED jobs that were never enqueued, e.g. after a crash between insert and enqueue.
     */
    public List<Job> findStalePlanned(Instant createdBefore, int limit) {
        Query q = new Query(Criteria.where("status").is(JobStatus.PLANNED).and("createdAt").lt(createdBefore));
        q.limit(Math.max(1, limit));
        return mongoTemplate.find(q, PublishJobDocument.class).stream().map(MongoJobStore::toJob).toList();
    }

    /**
     * FAILED jobs with no retry scheduled. They were headed for DEAD_LETTER when their worker stopped.
     */
    public List<Job> findUnfinishedDeadLetters(Instant finishedBefore, int limit) {
        Query q = new Query(Criteria.where("status").is(JobStatus.FAILED)
                .and("nextAttemptAt").is(null)
                .and("finishedAt").lt(finishedBefore));
        q.limit(Math.max(1, limit));
        return mongoTemplate.find(q, PublishJobDocument.class).stream().map(MongoJobStore::toJob).toList();
    }

    public long countStaleRunning(Instant startedBefore) {
        Query q = new Query(Criteria.where("status").is(JobStatus.RUNNING).and("startedAt").lt(startedBefore));
        return mongoTemplate.count(q, PublishJobDocument.class);
    }

    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, mongoTemplate.count(new Query(Criteria.where("status").is(status)), PublishJobDocument.class));
        }
        return counts;
    }

    public static Job toJob(PublishJobDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        return new Job(
                doc.getId(),
                doc.getScheduleId(),
                doc.getPlannedAt(),
                doc.getTemplateId(),
                doc.getContentId(),
                doc.getVariantId(),
                doc.getSelectionPolicy(),
                doc.getSelectionSeed(),
                doc.getStatus(),
                doc.getAttempt(),
                doc.getVersion(),
                doc.getCreatedAt(),
                doc.getEnqueuedAt(),
                doc.getAvailableAt(),
                doc.getStartedAt(),
                doc.getFinishedAt(),
                doc.getNextAttemptAt(),
                doc.getUpdatedAt(),
                doc.getLastError(),
                doc.getExternalId(),
                doc.getLockedBy()
        );
    }
}
