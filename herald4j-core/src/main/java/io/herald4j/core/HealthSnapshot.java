package io.herald4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time view of scheduler backlog and stuck work.
 *
 * overdueSchedules : enabled schedules whose nextRunAt is more than the grace period in the past
 * stuckJobs        : RUNNING jobs started before the stale threshold
 * jobsByStatus     : job count per status
 */
public record HealthSnapshot(
        Instant takenAt,
        long overdueSchedules,
        long stuckJobs,
        Map<JobStatus, Long> jobsByStatus
) {

    public HealthSnapshot {
        jobsByStatus = jobsByStatus == null ? Map.of() : Map.copyOf(jobsByStatus);
    }

    public boolean isHealthy(long maxOverdueSchedules, long maxStuckJobs) {
        return overdueSchedules <= maxOverdueSchedules && stuckJobs <= maxStuckJobs;
    }
}
