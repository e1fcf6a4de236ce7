package io.herald4j.internal.mongo;

import io.herald4j.ContentSource;
import io.herald4j.DedupeGuard;
import io.herald4j.Herald;
import io.herald4j.JobStateMachine;
import io.herald4j.Publisher;
import io.herald4j.ScheduleBuilder;
import io.herald4j.config.HeraldProperties;
import io.herald4j.core.HealthSnapshot;
import io.herald4j.core.HeraldException;
import io.herald4j.core.Job;
import io.herald4j.core.JobStatus;
import io.herald4j.core.RetryPolicy;
import io.herald4j.core.Schedule;
import io.herald4j.core.TransitionFields;
import io.herald4j.internal.SimpleScheduleBuilder;
import io.herald4j.recurrence.RecurrenceResolver;
import io.herald4j.selection.DuplicateContentCheck;
import io.herald4j.selection.Selection;
import io.herald4j.selection.SelectionContext;
import io.herald4j.selection.VariantSelector;
import io.herald4j.selection.VariantValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Herald is a Mongo-backed publication scheduler &amp; runner.
 *
 * <p>Three background loops run on every instance:
 * <ul>
 *   <li>tick: turns due schedule occurrences into jobs ({@link SchedulerTick})</li>
 *   <li>worker: claims runnable jobs and publishes them on a fixed pool ({@link PublishWorker})</li>
 *   <li>reaper: recovers jobs abandoned by dead instances ({@link StaleJobReaper}) and logs health</li>
 * </ul>
 * Instances coordinate only through the store, so any number of them may run side by side.
 *
 * <p>Typical usage:
 * <pre>{@code
 * herald.start();
 *
 * herald.create("morning-post")
 *       .timezone("America/Chicago")
 *       .rrule("FREQ=DAILY;BYHOUR=9;BYMINUTE=0")
 *       .template("greetings")
 *       .policy(SelectionPolicy.WEIGHTED_RANDOM)
 *       .save();
 *
 * herald.stop();
 * }</pre>
 */
public class MongoHerald implements Herald {
    private static final Logger log = LoggerFactory.getLogger(MongoHerald.class);

    static final int MAX_SYSTEM_ERRORS = 30;
    static final Duration OVERDUE_GRACE = Duration.ofMinutes(5);
    static final int HEALTH_MAX_OVERDUE_SCHEDULES = 10;
    static final int HEALTH_MAX_STUCK_JOBS = 5;

    private final HeraldProperties props;
    private final MongoScheduleStore scheduleStore;
    private final MongoJobStore jobStore;
    private final MongoSelectionHistoryStore historyStore;
    private final MongoPublishedRecordStore publishedStore;
    private final JobStateMachine stateMachine;
    private final ContentSource contentSource;
    private final Publisher publisher;
    private final RecurrenceResolver resolver;
    private final VariantSelector selector;
    private final VariantValidator validator;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final String workerId;

    private final SchedulerTick tick;
    private final StaleJobReaper reaper;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private ExecutorService workerPool;
    private ExecutorService publishExecutor;
    private volatile PublishWorker worker;

    private Thread tickThread;
    private Thread workerThread;
    private Thread reaperThread;

    private final ConcurrentHashMap<String, Boolean> inFlight = new ConcurrentHashMap<>();
    private final Semaphore refillSignal = new Semaphore(0);
    private final Semaphore permits;

    public MongoHerald(HeraldProperties props,
                       MongoScheduleStore scheduleStore,
                       MongoJobStore jobStore,
                       MongoSelectionHistoryStore historyStore,
                       MongoPublishedRecordStore publishedStore,
                       JobStateMachine stateMachine,
                       ContentSource contentSource,
                       Publisher publisher,
                       DedupeGuard dedupeGuard,
                       RecurrenceResolver resolver,
                       Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.scheduleStore = Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore must not be null");
        this.publishedStore = Objects.requireNonNull(publishedStore, "publishedStore must not be null");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        this.contentSource = Objects.requireNonNull(contentSource, "contentSource must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.workerId = resolveWorkerId(props.getWorkerId());

        this.validator = new VariantValidator(props.getMaxTextLength());
        this.selector = new VariantSelector(validator);
        this.retryPolicy = new RetryPolicy(props.getMaxAttempts(), props.getRetryBaseDelay(),
                props.getRetryMaxDelay(), props.getRetryJitterRatio());
        this.permits = new Semaphore(props.getMaxConcurrency());

        this.tick = new SchedulerTick(scheduleStore, jobStore, historyStore, publishedStore, stateMachine, contentSource, resolver,
                selector, new DuplicateContentCheck(props.getDuplicateSimilarityThreshold()),
                Objects.requireNonNull(dedupeGuard, "dedupeGuard must not be null"), props, workerId);
        this.reaper = new StaleJobReaper(jobStore, historyStore, stateMachine, retryPolicy,
                props.getStaleRunningThreshold(), props.getHistoryRetention(), props.getBatchSize());
    }

    /**
     * Start the tick, worker and reaper loops. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        requirePositive(props.getTickEvery(), "herald.tickEvery");
        requirePositive(props.getWorkerPollEvery(), "herald.workerPollEvery");
        requirePositive(props.getReaperEvery(), "herald.reaperEvery");
        requirePositive(props.getPublishTimeout(), "herald.publishTimeout");
        requirePositive(props.getScheduleLeaseLifetime(), "herald.scheduleLeaseLifetime");
        requirePositive(props.getShutdownTimeout(), "herald.shutdownTimeout");

        log.info("Herald starting with tickEvery={}, workerPollEvery={}, reaperEvery={}, workerId={}, maxConcurrency={}, batchSize={}",
                props.getTickEvery(),
                props.getWorkerPollEvery(),
                props.getReaperEvery(),
                workerId,
                props.getMaxConcurrency(),
                props.getBatchSize());

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), daemon("herald.workerPool"));
        }
        if (publishExecutor == null) {
            publishExecutor = Executors.newCachedThreadPool(daemon("herald.publish"));
        }
        worker = new PublishWorker(jobStore, stateMachine, publishedStore, contentSource, validator, publisher,
                retryPolicy, props.getPublishTimeout(), publishExecutor, workerId, clock);

        if (tickThread == null) {
            tickThread = loopThread("herald.tick", props.getTickEvery(), this::tickOnce);
        }
        if (workerThread == null) {
            workerThread = loopThread("herald.worker", props.getWorkerPollEvery(), this::pollWorkerOnce);
        }
        if (reaperThread == null) {
            reaperThread = loopThread("herald.reaper", props.getReaperEvery(), this::reapOnce);
        }
        log.info("Herald started successfully.");
    }

    /**
     * Stop all loops and wait for running publishes, bounded by {@code herald.shutdown-timeout}. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Herald stopping...");
        long deadline = System.nanoTime() + props.getShutdownTimeout().toNanos();

        List<Thread> loops = new ArrayList<>();
        for (Thread t : new Thread[]{tickThread, workerThread, reaperThread}) {
            // a loop giving up after repeated failures calls stop() from its own thread and exits by itself
            if (t != null && t != Thread.currentThread()) {
                t.interrupt();
                loops.add(t);
            }
        }
        tickThread = null;
        workerThread = null;
        reaperThread = null;

        try {
            for (Thread t : loops) {
                t.join(Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime())));
                if (t.isAlive()) {
                    log.warn("Herald loop did not stop within shutdownTimeout name={}", t.getName());
                }
            }
            if (workerPool != null) {
                workerPool.shutdown();
                if (!workerPool.awaitTermination(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                    log.warn("Herald publishes still running after shutdownTimeout={}, interrupting", props.getShutdownTimeout());
                    workerPool.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (workerPool != null) {
                workerPool.shutdownNow();
            }
        } finally {
            workerPool = null;
        }
        if (publishExecutor != null) {
            publishExecutor.shutdownNow();
            publishExecutor = null;
        }

        inFlight.clear();
        refillSignal.drainPermits();
        log.info("Herald stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Create a schedule builder. Nothing is persisted until save() is called.
     */
    @Override
    public ScheduleBuilder create(String scheduleId) {
        return new SimpleScheduleBuilder(scheduleId, resolver, s -> scheduleStore.upsert(s, clock.instant()), clock);
    }

    @Override
    public Optional<Schedule> findSchedule(String scheduleId) {
        return scheduleStore.findById(scheduleId);
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        return jobStore.findById(jobId);
    }

    @Override
    public List<Job> findJobs(String scheduleId) {
        return jobStore.findBySchedule(scheduleId);
    }

    @Override
    public List<Job> findJobsByStatus(JobStatus status, int limit) {
        Objects.requireNonNull(status, "status must not be null");
        return jobStore.findByStatus(status, limit);
    }

    @Override
    public Map<JobStatus, Long> jobStatistics() {
        return jobStore.countByStatus();
    }

    @Override
    public List<Instant> upcomingOccurrences(String scheduleId, Instant until, int max) {
        Schedule schedule = requireSchedule(scheduleId);
        if (!schedule.enabled()) {
            return List.of();
        }
        return resolver.occurrences(schedule, clock.instant(), until, max);
    }

    @Override
    public Optional<Selection> previewSelection(String scheduleId, Instant plannedAt) {
        Objects.requireNonNull(plannedAt, "plannedAt must not be null");
        Schedule schedule = requireSchedule(scheduleId);
        if (!schedule.isTemplateBased()) {
            return Optional.empty();
        }
        String templateId = schedule.content().templateId();
        List<String> recent = schedule.noRepeatWindow() > 0
                ? historyStore.recentVariantIds(schedule.scopeOrDefault(), scheduleId, templateId, plannedAt,
                schedule.noRepeatWindow())
                : List.of();
        SelectionContext ctx = new SelectionContext(scheduleId, templateId, schedule.roundRobinCursor(),
                schedule.noRepeatWindow(), recent);
        return selector.select(contentSource.activeVariants(templateId), schedule.policyOrDefault(), ctx, plannedAt, null);
    }

    @Override
    public Job cancel(String jobId, String reason) {
        Job cancelled = stateMachine.transition(jobId, JobStatus.CANCELLED,
                TransitionFields.error(reason == null || reason.isBlank() ? "cancelled" : reason));
        log.info("herald job cancelled id={} scheduleId={} reason={}", jobId, cancelled.scheduleId(), reason);
        return cancelled;
    }

    @Override
    public HealthSnapshot health() {
        Instant now = clock.instant();
        HealthSnapshot snapshot = new HealthSnapshot(
                now,
                scheduleStore.countOverdue(now.minus(OVERDUE_GRACE)),
                jobStore.countStaleRunning(now.minus(props.getStaleRunningThreshold())),
                jobStore.countByStatus());
        if (!snapshot.isHealthy(HEALTH_MAX_OVERDUE_SCHEDULES, HEALTH_MAX_STUCK_JOBS)) {
            log.warn("herald unhealthy overdueSchedules={} stuckJobs={} jobsByStatus={}",
                    snapshot.overdueSchedules(), snapshot.stuckJobs(), snapshot.jobsByStatus());
        }
        return snapshot;
    }

    private Schedule requireSchedule(String scheduleId) {
        return scheduleStore.findById(scheduleId)
                .orElseThrow(() -> new HeraldException("Schedule " + scheduleId + " not found"));
    }

    private boolean tickOnce() {
        SchedulerTick.TickResult result = tick.runOnce(clock.instant());
        if (result.created() > 0 || result.disabled() > 0 || result.failed() > 0) {
            log.debug("herald tick result={}", result);
        }
        return result.claimed() >= props.getBatchSize();
    }

    private boolean reapOnce() {
        StaleJobReaper.ReapResult result = reaper.reapOnce(clock.instant());
        if (!result.isEmpty()) {
            log.info("herald reaper result={}", result);
        }
        health();
        return false;
    }

    private boolean pollWorkerOnce() {
        int free = permits.availablePermits();
        if (free == 0) {
            return true;
        }

        List<String> ids = worker.findRunnable(clock.instant(), free + inFlight.size());
        log.debug("herald polled runnable jobs count={} free={}", ids.size(), free);

        int submitted = 0;
        for (String id : ids) {
            if (inFlight.putIfAbsent(id, Boolean.TRUE) != null) {
                continue;
            }
            if (!permits.tryAcquire()) {
                inFlight.remove(id);
                return true;
            }
            submit(id);
            submitted++;
        }
        return submitted >= free;
    }

    private void submit(String jobId) {
        PublishWorker current = worker;
        try {
            workerPool.submit(() -> {
                try {
                    current.process(jobId);
                } catch (Exception e) {
                    log.error("herald job processing failed id={} msg={}", jobId, e.getMessage(), e);
                } finally {
                    inFlight.remove(jobId);
                    permits.release();
                    refillSignal.release();
                }
            });
        } catch (RuntimeException e) {
            inFlight.remove(jobId);
            permits.release();
            throw e;
        }
    }

    private Thread loopThread(String name, Duration every, BooleanSupplier body) {
        Thread t = new Thread(() -> runLoop(name, every, body));
        t.setName(name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private void runLoop(String name, Duration every, BooleanSupplier body) {
        int systemErrorCount = 0;
        while (started.get()) {
            boolean backlog;
            try {
                backlog = body.getAsBoolean();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("{} failed msg={}", name, e.getMessage(), e);
                if (systemErrorCount >= MAX_SYSTEM_ERRORS) {
                    log.error("Herald stopped due to repeated system failures in {}...", name);
                    stop();
                    break;
                }

                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                if (backlog) {
                    refillSignal.tryAcquire(200, TimeUnit.MILLISECONDS);
                } else {
                    Thread.sleep(every.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated loop failures: 2s, 4s, 8s... capped at 60s.
    static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r);
            t.setName(name);
            t.setDaemon(true);
            return t;
        };
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    /**
     * The configured worker id, or host-pid-uuid capped at 128 characters.
     */
    public static String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "herald4j";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (java.io.IOException e) {
            log.debug("herald host name unavailable msg={}", e.getMessage());
        }

        String pid = Long.toString(ProcessHandle.current().pid());

        String generated = host + "-" + pid + "-" + java.util.UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }
}
