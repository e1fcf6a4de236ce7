package io.herald4j.internal.mongo;

import io.herald4j.core.PublishedRecord;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Successful publications, at most one per job (unique index on jobId).
 */
public class MongoPublishedRecordStore {

    private final MongoTemplate mongoTemplate;

    public MongoPublishedRecordStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * @return false if the job already has a record
     */
    public boolean insert(PublishedRecord record) {
        Objects.requireNonNull(record, "record must not be null");

        PublishedRecordDocument doc = new PublishedRecordDocument();
        doc.setJobId(record.jobId());
        doc.setScheduleId(record.scheduleId());
        doc.setExternalId(record.externalId());
        doc.setPublishedAt(record.publishedAt());
        doc.setTemplateId(record.templateId());
        doc.setVariantId(record.variantId());
        try {
            mongoTemplate.insert(doc);
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public Optional<PublishedRecord> findByJobId(String jobId) {
        Query q = new Query(Criteria.where("jobId").is(jobId));
        return Optional.ofNullable(mongoTemplate.findOne(q, PublishedRecordDocument.class))
                .map(MongoPublishedRecordStore::toRecord);
    }

    /**
     * The last {@code limit} variant-based publications across all schedules, newest first.
     */
    public List<PublishedRecord> recentVariantPublications(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Query q = new Query(Criteria.where("variantId").ne(null));
        q.with(Sort.by(Sort.Order.desc("publishedAt")));
        q.limit(limit);
        return mongoTemplate.find(q, PublishedRecordDocument.class).stream()
                .map(MongoPublishedRecordStore::toRecord)
                .toList();
    }

    private static PublishedRecord toRecord(PublishedRecordDocument doc) {
        return new PublishedRecord(doc.getJobId(), doc.getScheduleId(), doc.getExternalId(), doc.getPublishedAt(),
                doc.getTemplateId(), doc.getVariantId());
    }
}
