package io.herald4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.herald4j.JobStateMachine;
import io.herald4j.Publisher;
import io.herald4j.config.HeraldProperties;
import io.herald4j.core.DuplicateJobException;
import io.herald4j.core.InvalidTransitionException;
import io.herald4j.core.Job;
import io.herald4j.core.JobNotFoundException;
import io.herald4j.core.JobStatus;
import io.herald4j.core.NoRepeatScope;
import io.herald4j.core.NoopDedupeGuard;
import io.herald4j.core.PermanentPublishException;
import io.herald4j.core.PublishResult;
import io.herald4j.core.PublishedRecord;
import io.herald4j.core.RetryPolicy;
import io.herald4j.core.Schedule;
import io.herald4j.core.SelectionHistoryEntry;
import io.herald4j.core.SelectionPolicy;
import io.herald4j.core.TransientPublishException;
import io.herald4j.core.TransitionFields;
import io.herald4j.recurrence.RecurrenceResolver;
import io.herald4j.selection.DuplicateContentCheck;
import io.herald4j.selection.Selection;
import io.herald4j.selection.VariantSelector;
import io.herald4j.selection.VariantValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Testcontainers(disabledWithoutDocker = true)
class MongoHeraldIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant CREATED = Instant.parse("2024-06-01T10:15:00Z");
    private static final Instant FIRST_RUN = Instant.parse("2024-06-01T11:00:00Z");

    private static final List<Class<?>> COLLECTIONS = List.of(ScheduleDocument.class, PublishJobDocument.class,
            TemplateDocument.class, ContentDocument.class, SelectionHistoryDocument.class, PublishedRecordDocument.class);

    private MongoTemplate mongoTemplate;
    private MutableClock clock;
    private MongoScheduleStore scheduleStore;
    private MongoJobStore jobStore;
    private MongoSelectionHistoryStore historyStore;
    private MongoPublishedRecordStore publishedStore;
    private MongoJobStateMachine stateMachine;
    private MongoContentSource contentSource;
    private Publisher publisher;
    private ExecutorService publishExecutor;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "herald4j_test");
        COLLECTIONS.forEach(mongoTemplate::dropCollection);
        mongoTemplate.indexOps(PublishJobDocument.class).ensureIndex(new Index()
                .on("scheduleId", Sort.Direction.ASC)
                .on("plannedAt", Sort.Direction.ASC)
                .unique()
                .named("ux_job_schedule_planned"));
        mongoTemplate.indexOps(PublishedRecordDocument.class).ensureIndex(new Index()
                .on("jobId", Sort.Direction.ASC)
                .unique()
                .named("ux_published_job"));

        clock = new MutableClock(CREATED);
        scheduleStore = new MongoScheduleStore(mongoTemplate);
        jobStore = new MongoJobStore(mongoTemplate);
        historyStore = new MongoSelectionHistoryStore(mongoTemplate);
        publishedStore = new MongoPublishedRecordStore(mongoTemplate);
        stateMachine = new MongoJobStateMachine(mongoTemplate, clock);
        contentSource = new MongoContentSource(mongoTemplate, new ObjectMapper());
        publisher = mock(Publisher.class);
        publishExecutor = Executors.newCachedThreadPool();

        insertTemplate("t-1", "Good morning", "Rise and shine", "Coffee first");
    }

    @AfterEach
    void tearDown() {
        publishExecutor.shutdownNow();
        COLLECTIONS.forEach(mongoTemplate::dropCollection);
    }

    @Test
    void builderSaveShouldPersistScheduleWithFirstRun() {
        MongoHerald herald = herald(defaultProps(), clock);

        Schedule saved = herald.create("hourly")
                .cron("0 * * * *")
                .template("t-1")
                .policy(SelectionPolicy.ROUND_ROBIN)
                .noRepeat(2, NoRepeatScope.SCHEDULE)
                .save();

        assertEquals(FIRST_RUN, saved.nextRunAt());
        Schedule loaded = herald.findSchedule("hourly").orElseThrow();
        assertEquals(SelectionPolicy.ROUND_ROBIN, loaded.selectionPolicy());
        assertEquals(2, loaded.noRepeatWindow());
        assertEquals(NoRepeatScope.SCHEDULE, loaded.noRepeatScope());
        assertTrue(loaded.enabled());

        List<Instant> upcoming = herald.upcomingOccurrences("hourly", CREATED.plus(Duration.ofHours(4)), 3);
        assertEquals(List.of(FIRST_RUN, FIRST_RUN.plusSeconds(3600), FIRST_RUN.plusSeconds(7200)), upcoming);
    }

    @Test
    void pastOneShotShouldBeSavedDisabled() {
        MongoHerald herald = herald(defaultProps(), clock);

        Schedule saved = herald.create("too-late").at(CREATED.minusSeconds(60)).content("c-1").save();

        assertFalse(saved.enabled());
        assertEquals(MongoScheduleStore.EXHAUSTED, saved.disabledReason());
        assertNull(saved.nextRunAt());
    }

    @Test
    void concurrentTicksShouldCreateOneJobPerOccurrence() throws Exception {
        herald(defaultProps(), clock).create("hourly").cron("0 * * * *").template("t-1").save();
        Instant now = FIRST_RUN.plusSeconds(30);
        clock.set(now);

        int ticks = 4;
        ExecutorService pool = Executors.newFixedThreadPool(ticks);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<SchedulerTick.TickResult>> results = new ArrayList<>();
        for (int i = 0; i < ticks; i++) {
            SchedulerTick tick = tick("tick-" + i);
            results.add(pool.submit(() -> {
                go.await();
                return tick.runOnce(now);
            }));
        }
        go.countDown();

        int created = 0;
        for (Future<SchedulerTick.TickResult> f : results) {
            created += f.get(30, TimeUnit.SECONDS).created();
        }
        pool.shutdown();

        assertEquals(1, created);
        List<Job> jobs = jobStore.findBySchedule("hourly");
        assertEquals(1, jobs.size());
        Job job = jobs.get(0);
        assertEquals(FIRST_RUN, job.plannedAt());
        assertEquals(JobStatus.ENQUEUED, job.status());
        assertEquals(FIRST_RUN, job.availableAt());
        assertNotNull(job.variantId());
        assertNotNull(job.selectionSeed());

        ScheduleDocument schedule = scheduleStore.findDocument("hourly").orElseThrow();
        assertEquals(FIRST_RUN.plusSeconds(3600), schedule.getNextRunAt());
        assertEquals(FIRST_RUN, schedule.getLastRunAt());
        assertNull(schedule.getLockedBy());
    }

    @Test
    void secondJobForSameOccurrenceShouldBeRejected() {
        Schedule schedule = herald(defaultProps(), clock).create("fixed").cron("0 * * * *").content("c-1").save();

        jobStore.insertPlanned(schedule, FIRST_RUN, null, CREATED);

        assertThrows(DuplicateJobException.class, () -> jobStore.insertPlanned(schedule, FIRST_RUN, null, CREATED));
    }

    @Test
    void previewShouldMatchTheVariantTheTickPicks() {
        MongoHerald herald = herald(defaultProps(), clock);
        herald.create("hourly").cron("0 * * * *").template("t-1").policy(SelectionPolicy.WEIGHTED_RANDOM).save();

        Selection preview = herald.previewSelection("hourly", FIRST_RUN).orElseThrow();
        tick("tick-A").runOnce(FIRST_RUN);

        Job job = jobStore.findByOccurrence("hourly", FIRST_RUN).orElseThrow();
        assertEquals(preview.variant().id(), job.variantId());
        assertEquals(preview.seed(), job.selectionSeed());
    }

    @Test
    void roundRobinShouldRotateAcrossTicks() {
        herald(defaultProps(), clock).create("rr").cron("0 * * * *").template("t-1")
                .policy(SelectionPolicy.ROUND_ROBIN).save();

        SchedulerTick tick = tick("tick-A");
        List<String> picked = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Instant plannedAt = FIRST_RUN.plusSeconds(3600L * i);
            tick.runOnce(plannedAt);
            picked.add(jobStore.findByOccurrence("rr", plannedAt).orElseThrow().variantId());
        }

        assertEquals(List.of("t-1-v0", "t-1-v1", "t-1-v2", "t-1-v0"), picked);
    }

    @Test
    void stateMachineShouldRejectInvalidEdgesAndStaleExpectations() {
        Schedule schedule = herald(defaultProps(), clock).create("fixed").cron("0 * * * *").content("c-1").save();
        Job job = jobStore.insertPlanned(schedule, FIRST_RUN, null, CREATED);

        assertThrows(InvalidTransitionException.class,
                () -> stateMachine.transition(job.id(), JobStatus.SUCCEEDED, TransitionFields.none()));
        assertThrows(JobNotFoundException.class,
                () -> stateMachine.transition("000000000000000000000000", JobStatus.ENQUEUED, TransitionFields.none()));

        Job enqueued = stateMachine.transition(job.id(), JobStatus.ENQUEUED, TransitionFields.availableAt(FIRST_RUN));
        assertEquals(JobStatus.ENQUEUED, enqueued.status());
        assertEquals(1, enqueued.version());

        assertTrue(stateMachine.transitionIfStatus(job.id(), JobStatus.PLANNED, JobStatus.ENQUEUED,
                TransitionFields.none()).isEmpty());

        Job running = stateMachine.transitionIfStatus(job.id(), JobStatus.ENQUEUED, JobStatus.RUNNING,
                TransitionFields.worker("worker-1")).orElseThrow();
        assertEquals(1, running.attempt());
        assertEquals("worker-1", running.lockedBy());
        assertEquals(CREATED, running.startedAt());
    }

    @Test
    void retriedJobShouldKeepItsVariantAndSeed() throws Exception {
        herald(defaultProps(), clock).create("hourly").cron("0 * * * *").template("t-1").save();
        clock.set(FIRST_RUN);
        tick("tick-A").runOnce(FIRST_RUN);
        Job created = jobStore.findByOccurrence("hourly", FIRST_RUN).orElseThrow();

        when(publisher.publish(anyString(), anyList()))
                .thenThrow(new TransientPublishException("503"))
                .thenReturn(new PublishResult("ext-1"));
        PublishWorker worker = worker();

        assertEquals(PublishWorker.Outcome.RETRY_SCHEDULED, worker.process(created.id()));
        Job failed = jobStore.findById(created.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(FIRST_RUN.plusSeconds(10), failed.nextAttemptAt());
        assertTrue(worker.findRunnable(FIRST_RUN.plusSeconds(5), 10).isEmpty());

        clock.advance(Duration.ofSeconds(10));
        assertEquals(List.of(created.id()), worker.findRunnable(clock.instant(), 10));
        assertEquals(PublishWorker.Outcome.SUCCEEDED, worker.process(created.id()));

        Job done = jobStore.findById(created.id()).orElseThrow();
        assertEquals(JobStatus.SUCCEEDED, done.status());
        assertEquals(2, done.attempt());
        assertEquals("ext-1", done.externalId());
        assertEquals(created.variantId(), done.variantId());
        assertEquals(created.selectionSeed(), done.selectionSeed());
        assertEquals("ext-1", publishedStore.findByJobId(created.id()).orElseThrow().externalId());
    }

    @Test
    void reaperShouldRecoverAbandonedJobs() {
        Schedule schedule = herald(defaultProps(), clock).create("fixed").cron("0 * * * *").content("c-1").save();
        Job running = jobStore.insertPlanned(schedule, FIRST_RUN, null, CREATED);
        stateMachine.transition(running.id(), JobStatus.ENQUEUED, TransitionFields.availableAt(FIRST_RUN));
        stateMachine.transition(running.id(), JobStatus.RUNNING, TransitionFields.worker("dead-worker"));
        Job orphan = jobStore.insertPlanned(schedule, FIRST_RUN.plusSeconds(3600), null, CREATED);

        clock.advance(Duration.ofMinutes(11));
        StaleJobReaper reaper = new StaleJobReaper(jobStore, historyStore, stateMachine, RetryPolicy.defaults(),
                Duration.ofMinutes(10), Duration.ofDays(90), 50);
        StaleJobReaper.ReapResult result = reaper.reapOnce(clock.instant());

        assertEquals(1, result.failed());
        assertEquals(1, result.enqueued());
        Job reaped = jobStore.findById(running.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, reaped.status());
        assertEquals(StaleJobReaper.WORKER_LOST, reaped.lastError());
        assertEquals(clock.instant(), reaped.nextAttemptAt());
        assertEquals(JobStatus.ENQUEUED, jobStore.findById(orphan.id()).orElseThrow().status());
    }

    @Test
    void deadLetteringShouldNeverLeaveAClaimableFailedJob() throws Exception {
        herald(defaultProps(), clock).create("hourly").cron("0 * * * *").template("t-1").save();
        clock.set(FIRST_RUN);
        tick("tick-A").runOnce(FIRST_RUN);
        Job created = jobStore.findByOccurrence("hourly", FIRST_RUN).orElseThrow();
        when(publisher.publish(anyString(), anyList())).thenThrow(new PermanentPublishException("account suspended"));

        List<String> runnableInBetween = new ArrayList<>();
        AtomicReference<Job> failedInBetween = new AtomicReference<>();
        AtomicReference<Optional<Job>> competingClaim = new AtomicReference<>();
        JobStateMachine observing = new JobStateMachine() {
            @Override
            public Job transition(String jobId, JobStatus target, TransitionFields fields) {
                return stateMachine.transition(jobId, target, fields);
            }

            @Override
            public Optional<Job> transitionIfStatus(String jobId, JobStatus expected, JobStatus target,
                                                    TransitionFields fields) {
                if (target == JobStatus.DEAD_LETTER) {
                    failedInBetween.set(jobStore.findById(jobId).orElseThrow());
                    runnableInBetween.addAll(jobStore.findRunnableIds(clock.instant().plusSeconds(3600), 10));
                    competingClaim.set(stateMachine.transitionIfStatus(jobId, JobStatus.FAILED, JobStatus.RUNNING,
                            TransitionFields.worker("worker-2")));
                }
                return stateMachine.transitionIfStatus(jobId, expected, target, fields);
            }
        };

        assertEquals(PublishWorker.Outcome.DEAD_LETTERED, worker(observing).process(created.id()));

        assertEquals(JobStatus.FAILED, failedInBetween.get().status());
        assertNull(failedInBetween.get().nextAttemptAt());
        assertTrue(runnableInBetween.isEmpty());
        assertTrue(competingClaim.get().isEmpty());
        Job dead = jobStore.findById(created.id()).orElseThrow();
        assertEquals(JobStatus.DEAD_LETTER, dead.status());
        assertEquals(1, dead.attempt());
        assertEquals("permanent: account suspended", dead.lastError());
        verify(publisher, times(1)).publish(anyString(), anyList());
    }

    @Test
    void reaperShouldFinishDeadLetterAbandonedAfterFailed() {
        Schedule schedule = herald(defaultProps(), clock).create("fixed").cron("0 * * * *").content("c-1").save();
        Job job = jobStore.insertPlanned(schedule, FIRST_RUN, null, CREATED);
        stateMachine.transition(job.id(), JobStatus.ENQUEUED, TransitionFields.availableAt(FIRST_RUN));
        stateMachine.transition(job.id(), JobStatus.RUNNING, TransitionFields.worker("dead-worker"));
        stateMachine.transition(job.id(), JobStatus.FAILED, TransitionFields.error("permanent: gone"));

        assertTrue(jobStore.findRunnableIds(clock.instant().plusSeconds(3600), 10).isEmpty());
        assertThrows(InvalidTransitionException.class,
                () -> stateMachine.transition(job.id(), JobStatus.RUNNING, TransitionFields.worker("worker-2")));

        StaleJobReaper reaper = new StaleJobReaper(jobStore, historyStore, stateMachine, RetryPolicy.defaults(),
                Duration.ofMinutes(10), Duration.ofDays(90), 50);
        assertTrue(reaper.reapOnce(clock.instant()).isEmpty());

        clock.advance(Duration.ofMinutes(11));
        StaleJobReaper.ReapResult result = reaper.reapOnce(clock.instant());

        assertEquals(1, result.deadLettered());
        Job dead = jobStore.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.DEAD_LETTER, dead.status());
        assertEquals("permanent: gone", dead.lastError());
    }

    @Test
    void reaperShouldDeadLetterStaleJobOnItsLastAttempt() {
        Schedule schedule = herald(defaultProps(), clock).create("fixed").cron("0 * * * *").content("c-1").save();
        Job job = jobStore.insertPlanned(schedule, FIRST_RUN, null, CREATED);
        stateMachine.transition(job.id(), JobStatus.ENQUEUED, TransitionFields.availableAt(FIRST_RUN));
        stateMachine.transition(job.id(), JobStatus.RUNNING, TransitionFields.worker("dead-worker"));

        clock.advance(Duration.ofMinutes(11));
        RetryPolicy singleAttempt = new RetryPolicy(1, Duration.ofSeconds(10), Duration.ofMinutes(10), 0.2, () -> 0.0);
        StaleJobReaper reaper = new StaleJobReaper(jobStore, historyStore, stateMachine, singleAttempt,
                Duration.ofMinutes(10), Duration.ofDays(90), 50);
        StaleJobReaper.ReapResult result = reaper.reapOnce(clock.instant());

        assertEquals(0, result.failed());
        assertEquals(1, result.deadLettered());
        Job dead = jobStore.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.DEAD_LETTER, dead.status());
        assertEquals(StaleJobReaper.WORKER_LOST, dead.lastError());
        assertNull(dead.nextAttemptAt());
    }

    @Test
    void historyWindowShouldFilterByScopeAndPlannedAt() {
        Instant t1 = FIRST_RUN;
        Instant t2 = FIRST_RUN.plusSeconds(3600);
        Instant t3 = FIRST_RUN.plusSeconds(7200);
        Instant t4 = FIRST_RUN.plusSeconds(10800);
        Instant t5 = FIRST_RUN.plusSeconds(14400);
        appendHistory("t-1", "v0", "a", t1);
        appendHistory("t-1", "v1", "b", t2);
        appendHistory("t-1", "v2", "a", t3);
        appendHistory("t-1", "v3", "a", t5);
        appendHistory("t-2", "w0", "a", t2);

        assertEquals(List.of("v2", "v0"),
                historyStore.recentVariantIds(NoRepeatScope.SCHEDULE, "a", "t-1", t4, 10));
        assertEquals(List.of("v2", "v1", "v0"),
                historyStore.recentVariantIds(NoRepeatScope.TEMPLATE, "a", "t-1", t4, 10));
        assertEquals(List.of("v2", "v1"),
                historyStore.recentVariantIds(NoRepeatScope.TEMPLATE, "a", "t-1", t4, 2));
        assertEquals(List.of("v2"),
                historyStore.recentVariantIds(NoRepeatScope.TEMPLATE, "b", "t-1", t3, 1));
        assertEquals(List.of("v1"),
                historyStore.recentVariantIds(NoRepeatScope.SCHEDULE, "b", "t-1", t5, 10));
        assertEquals(List.of("v3", "v2", "v1"),
                historyStore.recentVariantIds(NoRepeatScope.TEMPLATE, "a", "t-1", t5, 3));
        assertTrue(historyStore.recentVariantIds(NoRepeatScope.TEMPLATE, "a", "t-1", t4, 0).isEmpty());
    }

    @Test
    void noRepeatWindowShouldHoldAcrossConsecutiveTicks() {
        herald(defaultProps(), clock).create("fresh").cron("0 * * * *").template("t-1")
                .policy(SelectionPolicy.UNIFORM_RANDOM).noRepeat(2, NoRepeatScope.SCHEDULE).save();

        SchedulerTick tick = tick("tick-A");
        List<String> picked = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            Instant plannedAt = FIRST_RUN.plusSeconds(3600L * i);
            tick.runOnce(plannedAt);
            String variantId = jobStore.findByOccurrence("fresh", plannedAt).orElseThrow().variantId();
            assertFalse(picked.subList(Math.max(0, i - 2), i).contains(variantId),
                    "occurrence " + i + " repeated " + variantId + " within " + picked);
            picked.add(variantId);
        }

        assertEquals(3, picked.stream().distinct().count());
        assertEquals(picked.subList(0, 3), picked.subList(3, 6));
        assertEquals(List.of(picked.get(5), picked.get(4)),
                historyStore.recentVariantIds(NoRepeatScope.SCHEDULE, "fresh", "t-1", FIRST_RUN.plusSeconds(3600L * 5), 2));
    }

    @Test
    void reaperShouldPruneHistoryPastRetention() {
        Instant now = clock.instant();
        appendHistory("t-1", "v0", "a", now.minus(Duration.ofDays(120)));
        appendHistory("t-1", "v1", "a", now.minus(Duration.ofDays(91)));
        appendHistory("t-1", "v2", "a", now.minus(Duration.ofDays(1)));

        StaleJobReaper reaper = new StaleJobReaper(jobStore, historyStore, stateMachine, RetryPolicy.defaults(),
                Duration.ofMinutes(10), Duration.ofDays(90), 50);
        StaleJobReaper.ReapResult result = reaper.reapOnce(now);

        assertEquals(2, result.historyPruned());
        assertEquals(List.of("v2"), historyStore.recentVariantIds(NoRepeatScope.TEMPLATE, "a", "t-1", now, 10));
    }

    @Test
    void publishedRecordsShouldListRecentVariantPublicationsNewestFirst() {
        publishedStore.insert(new PublishedRecord("job-1", "a", "ext-1", FIRST_RUN, "t-1", "t-1-v0"));
        publishedStore.insert(new PublishedRecord("job-2", "b", "ext-2", FIRST_RUN.plusSeconds(60), null, null));
        publishedStore.insert(new PublishedRecord("job-3", "a", "ext-3", FIRST_RUN.plusSeconds(120), "t-1", "t-1-v1"));

        assertFalse(publishedStore.insert(new PublishedRecord("job-1", "a", "ext-x", FIRST_RUN, "t-1", "t-1-v2")));
        assertEquals(List.of("job-3", "job-1"), publishedStore.recentVariantPublications(5).stream()
                .map(PublishedRecord::jobId).toList());
        assertEquals(List.of("job-3"), publishedStore.recentVariantPublications(1).stream()
                .map(PublishedRecord::jobId).toList());
        assertEquals("t-1", publishedStore.findByJobId("job-1").orElseThrow().templateId());
    }

    @Test
    void cancelShouldOnlyApplyBeforeRunning() {
        MongoHerald herald = herald(defaultProps(), clock);
        Schedule schedule = herald.create("fixed").cron("0 * * * *").content("c-1").save();
        Job job = jobStore.insertPlanned(schedule, FIRST_RUN, null, CREATED);

        Job cancelled = herald.cancel(job.id(), "campaign pulled");

        assertEquals(JobStatus.CANCELLED, cancelled.status());
        assertEquals("campaign pulled", cancelled.lastError());
        assertThrows(InvalidTransitionException.class, () -> herald.cancel(job.id(), "again"));
        assertEquals(1L, herald.jobStatistics().get(JobStatus.CANCELLED));
    }

    @Test
    void healthShouldReportOverdueSchedules() {
        MongoHerald herald = herald(defaultProps(), clock);
        herald.create("hourly").cron("0 * * * *").template("t-1").save();

        assertEquals(0, herald.health().overdueSchedules());

        clock.set(FIRST_RUN.plus(Duration.ofMinutes(6)));
        assertEquals(1, herald.health().overdueSchedules());
    }

    @Test
    void startedHeraldShouldPublishDueOneShot() throws Exception {
        HeraldProperties props = defaultProps();
        props.setTickEvery(Duration.ofMillis(200));
        props.setWorkerPollEvery(Duration.ofMillis(200));
        props.setReaperEvery(Duration.ofSeconds(5));
        when(publisher.publish(anyString(), anyList())).thenReturn(new PublishResult("ext-live"));

        MongoHerald herald = herald(props, Clock.systemUTC());
        herald.create("launch").at(Instant.now().plusMillis(500)).template("t-1").save();

        herald.start();
        try {
            assertTrue(waitUntil(() -> herald.findJobs("launch").stream()
                    .anyMatch(j -> j.status() == JobStatus.SUCCEEDED), Duration.ofSeconds(15)));
        } finally {
            herald.stop();
        }

        Schedule schedule = herald.findSchedule("launch").orElseThrow();
        assertFalse(schedule.enabled());
        assertEquals(MongoScheduleStore.EXHAUSTED, schedule.disabledReason());
        assertFalse(herald.isRunning());
        assertTrue(Thread.getAllStackTraces().keySet().stream()
                .filter(Thread::isAlive)
                .map(Thread::getName)
                .noneMatch(name -> List.of("herald.tick", "herald.worker", "herald.reaper").contains(name)));
    }

    private MongoHerald herald(HeraldProperties props, Clock heraldClock) {
        return new MongoHerald(props, scheduleStore, jobStore, historyStore, publishedStore,
                new MongoJobStateMachine(mongoTemplate, heraldClock), contentSource, publisher,
                NoopDedupeGuard.INSTANCE, new RecurrenceResolver(), heraldClock);
    }

    private SchedulerTick tick(String workerId) {
        return new SchedulerTick(scheduleStore, jobStore, historyStore, publishedStore, stateMachine, contentSource,
                new RecurrenceResolver(), new VariantSelector(), new DuplicateContentCheck(),
                NoopDedupeGuard.INSTANCE, defaultProps(), workerId);
    }

    private PublishWorker worker() {
        return worker(stateMachine);
    }

    private PublishWorker worker(JobStateMachine jobStateMachine) {
        RetryPolicy retryPolicy = new RetryPolicy(5, Duration.ofSeconds(10), Duration.ofMinutes(10), 0.2, () -> 0.0);
        return new PublishWorker(jobStore, jobStateMachine, publishedStore, contentSource, new VariantValidator(),
                publisher, retryPolicy, Duration.ofSeconds(5), publishExecutor, "worker-1", clock);
    }

    private static HeraldProperties defaultProps() {
        HeraldProperties props = new HeraldProperties();
        props.setWorkerId("test-worker");
        return props;
    }

    private void appendHistory(String templateId, String variantId, String scheduleId, Instant plannedAt) {
        historyStore.append(new SelectionHistoryEntry(templateId, variantId, scheduleId, "job-" + variantId,
                plannedAt, plannedAt));
    }

    private void insertTemplate(String id, String... texts) {
        TemplateDocument template = new TemplateDocument();
        template.setId(id);
        template.setName(id);
        List<VariantDocument> variants = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            VariantDocument v = new VariantDocument();
            v.setId(id + "-v" + i);
            v.setText(texts[i]);
            v.setWeight(1);
            v.setActive(true);
            variants.add(v);
        }
        template.setVariants(variants);
        mongoTemplate.insert(template);
    }

    private static boolean waitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return condition.getAsBoolean();
    }
}
