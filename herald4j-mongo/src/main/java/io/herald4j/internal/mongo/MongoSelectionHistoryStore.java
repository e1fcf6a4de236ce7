package io.herald4j.internal.mongo;

import io.herald4j.core.NoRepeatScope;
import io.herald4j.core.SelectionHistoryEntry;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Append-only variant selection history, read by the no-repeat window.
 */
public class MongoSelectionHistoryStore {

    private final MongoTemplate mongoTemplate;

    public MongoSelectionHistoryStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void append(SelectionHistoryEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        Objects.requireNonNull(entry.jobId(), "history entries are written after the job exists");

        SelectionHistoryDocument doc = new SelectionHistoryDocument();
        doc.setTemplateId(entry.templateId());
        doc.setVariantId(entry.variantId());
        doc.setScheduleId(entry.scheduleId());
        doc.setJobId(entry.jobId());
        doc.setPlannedAt(entry.plannedAt());
        doc.setRecordedAt(entry.recordedAt());
        mongoTemplate.insert(doc);
    }

    /**
     * Variant ids of the last {@code limit} selections in scope, newest first. Only entries planned at or before
     * {@code plannedAt} count.
     */
    public List<String> recentVariantIds(NoRepeatScope scope, String scheduleId, String templateId,
                                         Instant plannedAt, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Criteria c = Criteria.where("templateId").is(templateId).and("plannedAt").lte(plannedAt);
        if (scope == NoRepeatScope.SCHEDULE) {
            c = c.and("scheduleId").is(scheduleId);
        }
        Query q = new Query(c);
        q.with(Sort.by(Sort.Order.desc("plannedAt"), Sort.Order.desc("recordedAt")));
        q.limit(limit);
        q.fields().include("variantId");
        return mongoTemplate.find(q, SelectionHistoryDocument.class).stream()
                .map(SelectionHistoryDocument::getVariantId)
                .toList();
    }

    /**
     * Delete entries planned before {@code cutoff}.
     *
     * @return deleted count
     */
    public long pruneOlderThan(Instant cutoff) {
        Query q = new Query(Criteria.where("plannedAt").lt(cutoff));
        return mongoTemplate.remove(q, SelectionHistoryDocument.class).getDeletedCount();
    }
}
