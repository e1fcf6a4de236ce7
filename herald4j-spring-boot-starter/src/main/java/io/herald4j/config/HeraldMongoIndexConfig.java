package io.herald4j.config;

import io.herald4j.internal.mongo.PublishJobDocument;
import io.herald4j.internal.mongo.PublishedRecordDocument;
import io.herald4j.internal.mongo.ScheduleDocument;
import io.herald4j.internal.mongo.SelectionHistoryDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for herald4j.
 *
 * <p>Two of them carry correctness, not just speed:
 * <ul>
 *   <li><b>ux_job_schedule_planned</b> makes job creation at-most-once per occurrence. Without it concurrent ticks
 *       can create duplicate jobs.</li>
 *   <li><b>ux_published_job</b> keeps one published record per job.</li>
 * </ul>
 * The rest serve the polling queries.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li>{@code publish_jobs}: ux_job_schedule_planned { scheduleId: 1, plannedAt: 1 } unique</li>
 *   <li>{@code publish_jobs}: idx_job_runnable { status: 1, availableAt: 1 }</li>
 *   <li>{@code publish_jobs}: idx_job_retry { status: 1, nextAttemptAt: 1 }</li>
 *   <li>{@code schedules}: idx_schedule_due { enabled: 1, nextRunAt: 1, lockUntil: 1 }</li>
 *   <li>{@code published_records}: ux_published_job { jobId: 1 } unique</li>
 *   <li>{@code variant_selection_history}: idx_history_template { templateId: 1, plannedAt: -1 }</li>
 *   <li>{@code variant_selection_history}: idx_history_schedule { scheduleId: 1, plannedAt: -1 }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.publish_jobs.createIndex({ scheduleId: 1, plannedAt: 1 }, { name: "ux_job_schedule_planned", unique: true });
 * db.publish_jobs.createIndex({ status: 1, availableAt: 1 }, { name: "idx_job_runnable" });
 * db.publish_jobs.createIndex({ status: 1, nextAttemptAt: 1 }, { name: "idx_job_retry" });
 * db.schedules.createIndex({ enabled: 1, nextRunAt: 1, lockUntil: 1 }, { name: "idx_schedule_due" });
 * db.published_records.createIndex({ jobId: 1 }, { name: "ux_published_job", unique: true });
 * db.variant_selection_history.createIndex({ templateId: 1, plannedAt: -1 }, { name: "idx_history_template" });
 * db.variant_selection_history.createIndex({ scheduleId: 1, plannedAt: -1 }, { name: "idx_history_schedule" });
 * </pre>
 */
public class HeraldMongoIndexConfig {
    private static final Logger log = LoggerFactory.getLogger(HeraldMongoIndexConfig.class);

    public static final String UX_JOB_SCHEDULE_PLANNED = "ux_job_schedule_planned";
    public static final String IDX_JOB_RUNNABLE = "idx_job_runnable";
    public static final String IDX_JOB_RETRY = "idx_job_retry";
    public static final String IDX_SCHEDULE_DUE = "idx_schedule_due";
    public static final String UX_PUBLISHED_JOB = "ux_published_job";
    public static final String IDX_HISTORY_TEMPLATE = "idx_history_template";
    public static final String IDX_HISTORY_SCHEDULE = "idx_history_schedule";

    private final MongoTemplate mongoTemplate;

    public HeraldMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create all required indexes. Existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(PublishJobDocument.class).ensureIndex(jobOccurrenceUniqueIndex());
        mongoTemplate.indexOps(PublishJobDocument.class).ensureIndex(jobRunnableIndex());
        mongoTemplate.indexOps(PublishJobDocument.class).ensureIndex(jobRetryIndex());
        mongoTemplate.indexOps(ScheduleDocument.class).ensureIndex(scheduleDueIndex());
        mongoTemplate.indexOps(PublishedRecordDocument.class).ensureIndex(publishedJobUniqueIndex());
        mongoTemplate.indexOps(SelectionHistoryDocument.class).ensureIndex(historyTemplateIndex());
        mongoTemplate.indexOps(SelectionHistoryDocument.class).ensureIndex(historyScheduleIndex());
        log.info("herald indexes ensured");
    }

    public static Index jobOccurrenceUniqueIndex() {
        return new Index()
                .on("scheduleId", Sort.Direction.ASC)
                .on("plannedAt", Sort.Direction.ASC)
                .unique()
                .named(UX_JOB_SCHEDULE_PLANNED);
    }

    public static Index jobRunnableIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("availableAt", Sort.Direction.ASC)
                .named(IDX_JOB_RUNNABLE);
    }

    public static Index jobRetryIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("nextAttemptAt", Sort.Direction.ASC)
                .named(IDX_JOB_RETRY);
    }

    /**
     * Index for leasing due schedules.
     * Keys: enabled ASC, nextRunAt ASC, lockUntil ASC
     */
    public static Index scheduleDueIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .on("nextRunAt", Sort.Direction.ASC)
                .on("lockUntil", Sort.Direction.ASC)
                .named(IDX_SCHEDULE_DUE);
    }

    public static Index publishedJobUniqueIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .unique()
                .named(UX_PUBLISHED_JOB);
    }

    public static Index historyTemplateIndex() {
        return new Index()
                .on("templateId", Sort.Direction.ASC)
                .on("plannedAt", Sort.Direction.DESC)
                .named(IDX_HISTORY_TEMPLATE);
    }

    public static Index historyScheduleIndex() {
        return new Index()
                .on("scheduleId", Sort.Direction.ASC)
                .on("plannedAt", Sort.Direction.DESC)
                .named(IDX_HISTORY_SCHEDULE);
    }
}
