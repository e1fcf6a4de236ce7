package io.herald4j;

import io.herald4j.core.HealthSnapshot;
import io.herald4j.core.Job;
import io.herald4j.core.JobStatus;
import io.herald4j.core.Schedule;
import io.herald4j.selection.Selection;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main publication scheduler API.
 *
 * <p>Supports three schedule kinds:
 * <ul>
 *   <li>One-shot (a single occurrence at an absolute time)</li>
 *   <li>Cron (5 or 6 fields, evaluated in the schedule zone)</li>
 *   <li>Recurrence rule (RFC 5545 RRULE, evaluated in floating local time)</li>
 * </ul>
 * Every occurrence becomes exactly one publish job, which is retried until it succeeds or is dead-lettered.
 */
public interface Herald {
    void start();

    /**
     * Stop the loops and wait, up to the configured shutdown timeout, for them and any in-flight publish to finish.
     */
    void stop();

    boolean isRunning();

    /**
     * Start configuring a schedule. {@link ScheduleBuilder#save()} upserts it and computes the first run.
     */
    ScheduleBuilder create(String scheduleId);

    Optional<Schedule> findSchedule(String scheduleId);

    Optional<Job> findJob(String jobId);

    /**
     * All jobs of a schedule ordered by plannedAt.
     */
    List<Job> findJobs(String scheduleId);

    List<Job> findJobsByStatus(JobStatus status, int limit);

    Map<JobStatus, Long> jobStatistics();

    /**
     * Occurrences after now up to {@code until}, for calendars and previews. Nothing is persisted.
     */
    List<Instant> upcomingOccurrences(String scheduleId, Instant until, int max);

    /**
     * The variant the occurrence would get if it fired now. Read-only.
     *
     * @return empty for fixed-content schedules or templates without eligible variants
     */
    Optional<Selection> previewSelection(String scheduleId, Instant plannedAt);

    /**
     * Cancel a job that has not started yet (PLANNED or ENQUEUED).
     *
     * @throws io.herald4j.core.InvalidTransitionException if the job already ran or is running
     * @throws io.herald4j.core.JobNotFoundException       if there is no such job
     */
    Job cancel(String jobId, String reason);

    HealthSnapshot health();
}
