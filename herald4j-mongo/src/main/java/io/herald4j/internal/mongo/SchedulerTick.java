package io.herald4j.internal.mongo;

import io.herald4j.ContentSource;
import io.herald4j.DedupeGuard;
import io.herald4j.JobStateMachine;
import io.herald4j.config.HeraldProperties;
import io.herald4j.core.DuplicateJobException;
import io.herald4j.core.Job;
import io.herald4j.core.JobStatus;
import io.herald4j.core.Schedule;
import io.herald4j.core.SelectionHistoryEntry;
import io.herald4j.core.TransitionException;
import io.herald4j.core.TransitionFields;
import io.herald4j.core.ValidationException;
import io.herald4j.core.Variant;
import io.herald4j.recurrence.RecurrenceResolver;
import io.herald4j.selection.DuplicateContentCheck;
import io.herald4j.selection.Selection;
import io.herald4j.selection.SelectionContext;
import io.herald4j.selection.VariantSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns due schedule occurrences into publish jobs.
 *
 * <p>One run:
 * <ol>
 *   <li>give enabled schedules without nextRunAt their first run</li>
 *   <li>lease up to batchSize due schedules</li>
 *   <li>per schedule: select the variant, insert the job (PLANNED), record history, advance the schedule,
 *       enqueue the job</li>
 * </ol>
 * Every schedule is handled on its own: a failure is logged, the lease released, and the batch continues.
 *
 * <p>There is no multi-document transaction, so writes are ordered for crash recovery. A crash after the insert
 * leaves a PLANNED job (enqueued later by {@link StaleJobReaper}) and an unadvanced schedule (the next tick hits
 * the unique index and advances it).
 */
public class SchedulerTick {
    private static final Logger log = LoggerFactory.getLogger(SchedulerTick.class);

    /**
     * Counters of one tick.
     */
    public record TickResult(int initialized, int claimed, int created, int duplicates, int skipped,
                             int disabled, int failed) {
    }

    private enum Outcome { CREATED, DUPLICATE, SKIPPED, DISABLED, FAILED }

    private final MongoScheduleStore scheduleStore;
    private final MongoJobStore jobStore;
    private final MongoSelectionHistoryStore historyStore;
    private final MongoPublishedRecordStore publishedStore;
    private final JobStateMachine stateMachine;
    private final ContentSource contentSource;
    private final RecurrenceResolver resolver;
    private final VariantSelector selector;
    private final DuplicateContentCheck duplicateCheck;
    private final DedupeGuard dedupeGuard;
    private final HeraldProperties props;
    private final String workerId;

    public SchedulerTick(MongoScheduleStore scheduleStore,
                         MongoJobStore jobStore,
                         MongoSelectionHistoryStore historyStore,
                         MongoPublishedRecordStore publishedStore,
                         JobStateMachine stateMachine,
                         ContentSource contentSource,
                         RecurrenceResolver resolver,
                         VariantSelector selector,
                         DuplicateContentCheck duplicateCheck,
                         DedupeGuard dedupeGuard,
                         HeraldProperties props,
                         String workerId) {
        this.scheduleStore = Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore must not be null");
        this.publishedStore = Objects.requireNonNull(publishedStore, "publishedStore must not be null");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        this.contentSource = Objects.requireNonNull(contentSource, "contentSource must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.duplicateCheck = Objects.requireNonNull(duplicateCheck, "duplicateCheck must not be null");
        this.dedupeGuard = Objects.requireNonNull(dedupeGuard, "dedupeGuard must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");
    }

    public TickResult runOnce(Instant now) {
        int initialized = initialize(now);

        List<ScheduleDocument> claimed = scheduleStore.claimDueSchedules(
                now, props.getBatchSize(), props.getScheduleLeaseLifetime(), workerId);

        log.debug("herald tick claimed schedules count={} now={}", claimed.size(), now);

        int created = 0;
        int duplicates = 0;
        int skipped = 0;
        int disabled = 0;
        int failed = 0;
        for (ScheduleDocument doc : claimed) {
            switch (fireSafely(doc, now)) {
                case CREATED -> created++;
                case DUPLICATE -> duplicates++;
                case SKIPPED -> skipped++;
                case DISABLED -> disabled++;
                case FAILED -> failed++;
            }
        }
        return new TickResult(initialized, claimed.size(), created, duplicates, skipped, disabled, failed);
    }

    private int initialize(Instant now) {
        int initialized = 0;
        for (ScheduleDocument doc : scheduleStore.findUninitialized(props.getBatchSize())) {
            try {
                Schedule schedule = MongoScheduleStore.toSchedule(doc);
                Optional<Instant> first = resolver.resolve(schedule, now);
                if (first.isEmpty()) {
                    disable(doc.getId(), MongoScheduleStore.EXHAUSTED, now);
                } else if (scheduleStore.initializeNextRunAt(doc.getId(), first.get(), now)) {
                    log.debug("herald schedule initialized id={} nextRunAt={}", doc.getId(), first.get());
                    initialized++;
                }
            } catch (ValidationException e) {
                disable(doc.getId(), e.getMessage(), now);
            } catch (Exception e) {
                log.error("herald schedule initialize failed id={} msg={}", doc.getId(), e.getMessage(), e);
            }
        }
        return initialized;
    }

    private Outcome fireSafely(ScheduleDocument doc, Instant now) {
        try {
            return fire(MongoScheduleStore.toSchedule(doc), now);
        } catch (ValidationException e) {
            disable(doc.getId(), e.getMessage(), now);
            return Outcome.DISABLED;
        } catch (Exception e) {
            log.error("herald schedule fire failed id={} plannedAt={} msg={}",
                    doc.getId(), doc.getNextRunAt(), e.getMessage(), e);
            try {
                scheduleStore.releaseLease(doc.getId(), workerId);
            } catch (Exception releaseEx) {
                log.error("herald schedule lease release failed id={} msg={}", doc.getId(), releaseEx.getMessage(), releaseEx);
            }
            return Outcome.FAILED;
        }
    }

    private Outcome fire(Schedule schedule, Instant now) {
        Instant plannedAt = schedule.nextRunAt();

        // resolve before writing anything, so a broken spec disables the schedule without leaving a job behind
        Optional<Instant> next = resolver.resolve(schedule, advanceFrom(plannedAt, now));

        if (!tryAcquire(schedule.id(), plannedAt)) {
            log.debug("herald occurrence held elsewhere scheduleId={} plannedAt={}", schedule.id(), plannedAt);
            scheduleStore.releaseLease(schedule.id(), workerId);
            return Outcome.SKIPPED;
        }
        try {
            Selection selection = null;
            if (schedule.isTemplateBased()) {
                Optional<Selection> drawn = select(schedule, plannedAt);
                if (drawn.isEmpty()) {
                    log.warn("herald template has no eligible variants, occurrence skipped scheduleId={} templateId={} plannedAt={}",
                            schedule.id(), schedule.content().templateId(), plannedAt);
                    advance(schedule, plannedAt, next, null, now);
                    return Outcome.SKIPPED;
                }
                selection = drawn.get();
            }

            Job job;
            try {
                job = jobStore.insertPlanned(schedule, plannedAt, selection, now);
            } catch (DuplicateJobException e) {
                log.debug("herald job already exists scheduleId={} plannedAt={}", schedule.id(), plannedAt);
                advance(schedule, plannedAt, next, null, now);
                return Outcome.DUPLICATE;
            }

            if (selection != null && schedule.noRepeatWindow() > 0) {
                historyStore.append(new SelectionHistoryEntry(schedule.content().templateId(), selection.variant().id(),
                        schedule.id(), job.id(), plannedAt, now));
            }

            Integer cursor = selection != null && selection.policy().isStateful()
                    ? selection.roundRobinCursor()
                    : null;
            advance(schedule, plannedAt, next, cursor, now);
            enqueue(job);

            log.debug("herald job created id={} scheduleId={} plannedAt={} variantId={}",
                    job.id(), schedule.id(), plannedAt, job.variantId());
            return Outcome.CREATED;
        } finally {
            release(schedule.id(), plannedAt);
        }
    }

    private Optional<Selection> select(Schedule schedule, Instant plannedAt) {
        String templateId = schedule.content().templateId();
        List<Variant> variants = contentSource.activeVariants(templateId);

        List<String> recent = schedule.noRepeatWindow() > 0
                ? historyStore.recentVariantIds(schedule.scopeOrDefault(), schedule.id(), templateId, plannedAt,
                schedule.noRepeatWindow())
                : List.of();
        SelectionContext ctx = new SelectionContext(schedule.id(), templateId, schedule.roundRobinCursor(),
                schedule.noRepeatWindow(), recent);

        Optional<Selection> selection = selector.select(variants, schedule.policyOrDefault(), ctx, plannedAt, null);
        if (selection.isPresent() && props.getDuplicateCheckWindow() > 0) {
            duplicateCheck.warnIfDuplicate(schedule.id(), selection.get().variant().text(),
                    this::recentlyPublishedTexts);
        }
        return selection;
    }

    private List<String> recentlyPublishedTexts() {
        return publishedStore.recentVariantPublications(props.getDuplicateCheckWindow()).stream()
                .filter(record -> record.templateId() != null)
                .map(record -> contentSource.findVariant(record.templateId(), record.variantId()))
                .flatMap(Optional::stream)
                .map(Variant::text)
                .toList();
    }

    private Instant advanceFrom(Instant plannedAt, Instant now) {
        return props.isSkipMissedOccurrences() && now.isAfter(plannedAt) ? now : plannedAt;
    }

    private void advance(Schedule schedule, Instant plannedAt, Optional<Instant> next, Integer cursor, Instant now) {
        boolean advanced = scheduleStore.advance(schedule.id(), workerId, plannedAt, next.orElse(null), cursor, now);
        if (!advanced) {
            log.warn("herald schedule changed while firing, not advanced scheduleId={} plannedAt={}",
                    schedule.id(), plannedAt);
        } else if (next.isEmpty()) {
            log.info("herald schedule exhausted and disabled scheduleId={} lastRunAt={}", schedule.id(), plannedAt);
        }
    }

    private void enqueue(Job job) {
        try {
            stateMachine.transitionIfStatus(job.id(), JobStatus.PLANNED, JobStatus.ENQUEUED,
                            TransitionFields.availableAt(job.plannedAt()))
                    .ifPresentOrElse(
                            j -> log.debug("herald job enqueued id={} availableAt={}", j.id(), j.availableAt()),
                            () -> log.debug("herald job left PLANNED before enqueue id={}", job.id()));
        } catch (TransitionException e) {
            log.error("herald job enqueue failed id={} msg={}", job.id(), e.getMessage(), e);
        }
    }

    private void disable(String scheduleId, String reason, Instant now) {
        try {
            scheduleStore.disable(scheduleId, reason, now);
            log.info("herald schedule disabled id={} reason={}", scheduleId, reason);
        } catch (Exception e) {
            log.error("herald schedule disable failed id={} msg={}", scheduleId, e.getMessage(), e);
        }
    }

    private boolean tryAcquire(String scheduleId, Instant plannedAt) {
        try {
            return dedupeGuard.tryAcquire(scheduleId, plannedAt);
        } catch (Exception e) {
            log.warn("herald dedupe guard unavailable, proceeding scheduleId={} msg={}", scheduleId, e.getMessage());
            return true;
        }
    }

    private void release(String scheduleId, Instant plannedAt) {
        try {
            dedupeGuard.release(scheduleId, plannedAt);
        } catch (Exception e) {
            log.warn("herald dedupe guard release failed scheduleId={} msg={}", scheduleId, e.getMessage());
        }
    }
}
