package io.herald4j;

import io.herald4j.core.InvalidTransitionException;
import io.herald4j.core.Job;
import io.herald4j.core.JobNotFoundException;
import io.herald4j.core.JobStatus;
import io.herald4j.core.TransitionConflictException;
import io.herald4j.core.TransitionFields;

import java.util.Optional;

/**
 * Validated, atomic job status changes. Side effects (timestamps, attempt counter) are written in the same
 * atomic operation as the status.
 */
public interface JobStateMachine {

    /**
     * Move the job to {@code target} from whatever status it is in now.
     *
     * @throws JobNotFoundException        if the job does not exist
     * @throws InvalidTransitionException  if the current status has no edge to {@code target}
     * @throws TransitionConflictException if concurrent writers kept winning
     */
    Job transition(String jobId, JobStatus target, TransitionFields fields);

    /**
     * Compare-and-set: move the job to {@code target} only if it is currently in {@code expected}.
     *
     * @return the updated job, or empty if the job was not in {@code expected} (someone else got there first)
     * @throws InvalidTransitionException if {@code expected -> target} is not a valid edge
     */
    Optional<Job> transitionIfStatus(String jobId, JobStatus expected, JobStatus target, TransitionFields fields);
}
