package bldr.jobsrv.repository;

import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobGroup;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for groups and jobs. The only writer of job and group state and
 * of worker load counters.
 *
 * <p>
 * Reads never lock. All writes after creation go through
 * {@link #apply(TransitionBatch)}, which is all-or-nothing.
 */
public interface JobStore {

    /**
     * Persist a new group with its jobs and dependency edges in one transaction.
     *
     * @param group the group, in state QUEUED
     * @param jobs  member jobs in topological order
     */
    void createGroup(JobGroup group, List<Job> jobs);

    /**
     * Find a group by ID, including its member job IDs.
     *
     * @param groupId the group ID
     * @return the group if found
     */
    Optional<JobGroup> findGroup(String groupId);

    /**
     * Get the most recently created groups.
     *
     * @param limit maximum results
     * @return groups, newest first
     */
    List<JobGroup> findRecentGroups(int limit);

    /**
     * IDs of all groups that are not terminal yet.
     */
    List<String> findActiveGroupIds();

    /**
     * Find a job by ID, including its dependency list.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findJob(String jobId);

    /**
     * All jobs of a group in topological order.
     *
     * @param groupId the group ID
     * @return list of jobs, empty if the group is unknown
     */
    List<Job> findJobsByGroup(String groupId);

    /**
     * READY jobs across all groups, oldest first.
     *
     * @param limit maximum results
     * @return list of ready jobs
     */
    List<Job> findReadyJobs(int limit);

    /**
     * DISPATCHED or RUNNING jobs held by a worker.
     *
     * @param workerId the worker ID
     * @return list of jobs
     */
    List<Job> findJobsAssignedTo(String workerId);

    /**
     * DISPATCHED or RUNNING jobs that were dispatched before the given instant.
     * Used by the reaper to recover jobs whose worker went silent about them.
     *
     * @param dispatchedBefore cutoff
     * @return list of overdue jobs
     */
    List<Job> findOverdueJobs(Instant dispatchedBefore);

    /**
     * Read a group and all of its jobs consistently.
     *
     * @param groupId the group ID
     * @return the snapshot, empty if the group is unknown
     */
    Optional<GroupSnapshot> snapshot(String groupId);

    /**
     * Apply a batch atomically. Every group in the batch is locked in id order;
     * its version is checked where the batch expects one and is incremented.
     * Each job transition must find the job in its expected prior state.
     *
     * @param batch the batch to apply
     * @throws TransitionConflictException if any guard fails; nothing is written
     * @throws StoreException              if the store itself fails
     */
    void apply(TransitionBatch batch);
}
