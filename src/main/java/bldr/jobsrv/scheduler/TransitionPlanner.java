package bldr.jobsrv.scheduler;

import bldr.jobsrv.graph.DependencyIndex;
import bldr.jobsrv.model.GroupState;
import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobState;
import bldr.jobsrv.repository.GroupSnapshot;
import bldr.jobsrv.repository.JobTransition;
import bldr.jobsrv.repository.TransitionBatch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plans the transitions caused by one event on one group, without touching the
 * store.
 *
 * <p>
 * A planner starts from a {@link GroupSnapshot} and keeps a working view of the
 * job states. Every step records a {@link JobTransition} into the shared batch
 * and updates the view, so later steps (promotion, cascade, group state) see
 * the effects of earlier ones. {@link #finish()} adds the derived group state.
 * The batch pins the snapshot version; if the group moved on meanwhile the
 * store rejects the whole plan.
 */
public final class TransitionPlanner {

    private final GroupSnapshot snapshot;
    private final DependencyIndex index;
    private final Instant now;
    private final TransitionBatch.Builder batch;
    private final Map<String, Job> view = new LinkedHashMap<>();
    private final List<Job> abortTargets = new ArrayList<>();
    private boolean cancelRequested;
    private boolean changed;

    public TransitionPlanner(GroupSnapshot snapshot, DependencyIndex index, Instant now) {
        this(snapshot, index, now, TransitionBatch.builder());
    }

    /**
     * Plan into an existing batch, e.g. one that spans several groups.
     */
    public TransitionPlanner(GroupSnapshot snapshot, DependencyIndex index, Instant now, TransitionBatch.Builder batch) {
        this.snapshot = snapshot;
        this.index = index;
        this.now = now;
        this.batch = batch;
        this.cancelRequested = snapshot.group().cancelRequested();
        snapshot.jobs().forEach(j -> view.put(j.id(), j));
        batch.expectVersion(snapshot.group().id(), snapshot.version());
    }

    /** Current planned state of a job, or null if it is not in this group */
    public Job job(String jobId) {
        return view.get(jobId);
    }

    /**
     * DISPATCHED -> RUNNING.
     *
     * @return false if the job is not DISPATCHED
     */
    public boolean start(String jobId) {
        Job job = view.get(jobId);
        if (job == null || job.state() != JobState.DISPATCHED) {
            return false;
        }
        move(job, job.toBuilder().state(JobState.RUNNING).startedAt(now).build());
        return true;
    }

    /**
     * DISPATCHED/RUNNING -> COMPLETE, releasing the worker slot and promoting
     * direct dependents whose dependencies are now all complete.
     *
     * @return false if the job is not assigned
     */
    public boolean succeed(String jobId) {
        Job job = view.get(jobId);
        if (job == null || !job.state().isAssigned()) {
            return false;
        }
        move(job, job.toBuilder().state(JobState.COMPLETE).completedAt(now).build());
        batch.adjustLoad(job.workerId(), -1);
        promoteDependents(jobId);
        return true;
    }

    /**
     * DISPATCHED/RUNNING -> FAILED, releasing the worker slot and cascading
     * DEPENDENCY_FAILED to every non-terminal transitive dependent.
     *
     * @return false if the job is not assigned
     */
    public boolean fail(String jobId, String reason) {
        Job job = view.get(jobId);
        if (job == null || !job.state().isAssigned()) {
            return false;
        }
        move(job, job.toBuilder().state(JobState.FAILED).failureReason(reason).completedAt(now).build());
        batch.adjustLoad(job.workerId(), -1);
        cascadeFailure(job);
        return true;
    }

    /**
     * The job's assignment is gone (worker lost, aborted, timed out). Requeue
     * it when the retry budget allows, otherwise fail it with cascade.
     *
     * @param releaseLoad whether to give the slot back; false when the worker is
     *                    being marked dead in the same batch
     * @return false if the job is not assigned
     */
    public boolean lose(String jobId, String reason, boolean releaseLoad) {
        Job job = view.get(jobId);
        if (job == null || !job.state().isAssigned()) {
            return false;
        }
        if (releaseLoad) {
            batch.adjustLoad(job.workerId(), -1);
        }

        if (!job.canRetry()) {
            String failure = reason + " (retry budget of " + job.maxRetries() + " exhausted)";
            move(job, job.toBuilder().state(JobState.FAILED).failureReason(failure).completedAt(now).build());
            cascadeFailure(view.get(jobId));
            return true;
        }

        Job pending = move(job, job.toBuilder()
                .state(JobState.PENDING)
                .workerId(null)
                .retryCount(job.retryCount() + 1)
                .failureReason(null)
                .dispatchedAt(null)
                .startedAt(null)
                .build());
        if (dependenciesComplete(pending)) {
            move(pending, pending.toBuilder().state(JobState.READY).build());
        }
        return true;
    }

    /**
     * Request cancellation: every non-terminal job becomes CANCELED. Jobs that
     * held a worker slot release it and are collected in {@link #abortTargets()}.
     *
     * @return false if there was nothing left to cancel
     */
    public boolean cancel() {
        boolean any = false;
        for (Job job : new ArrayList<>(view.values())) {
            if (job.state().isTerminal()) {
                continue;
            }
            if (job.state().isAssigned()) {
                batch.adjustLoad(job.workerId(), -1);
                abortTargets.add(job);
            }
            move(job, job.toBuilder().state(JobState.CANCELED).completedAt(now).build());
            any = true;
        }
        if (any) {
            cancelRequested = true;
            batch.requestCancel(snapshot.group().id());
        }
        return any;
    }

    /**
     * Settle jobs a crash may have left behind: PENDING jobs whose dependencies
     * are all complete become READY, and PENDING or READY jobs with a failed
     * dependency become DEPENDENCY_FAILED.
     *
     * @return whether anything changed
     */
    public boolean settle() {
        boolean any = false;
        for (Job job : new ArrayList<>(view.values())) {
            Job current = view.get(job.id());
            if (current.state() != JobState.PENDING && current.state() != JobState.READY) {
                continue;
            }
            Job failedDependency = firstUnsuccessfulDependency(current);
            if (failedDependency != null) {
                move(current, current.toBuilder()
                        .state(JobState.DEPENDENCY_FAILED)
                        .failureReason("dependency " + failedDependency.project().ref() + " did not complete")
                        .completedAt(now)
                        .build());
                any = true;
            } else if (current.state() == JobState.PENDING && dependenciesComplete(current)) {
                move(current, current.toBuilder().state(JobState.READY).build());
                any = true;
            }
        }
        return any;
    }

    /**
     * Record the derived group state if it differs from the stored one.
     *
     * @return the batch, shared with other planners if it was passed in
     */
    public TransitionBatch.Builder finish() {
        GroupState derived = derivedState();
        if (derived != snapshot.group().state()) {
            batch.groupState(snapshot.group().id(), derived);
            changed = true;
        }
        return batch;
    }

    public GroupState derivedState() {
        return GroupStates.derive(view.values(), cancelRequested);
    }

    /** Whether any step changed a job or the group */
    public boolean hasChanges() {
        return changed;
    }

    /** Jobs that were assigned when they got canceled; their workers should get an abort */
    public List<Job> abortTargets() {
        return Collections.unmodifiableList(abortTargets);
    }

    // Helper methods

    private Job move(Job before, Job after) {
        batch.transition(new JobTransition(before, after));
        view.put(after.id(), after);
        changed = true;
        return after;
    }

    private void promoteDependents(String jobId) {
        for (String dependentId : index.dependents(jobId)) {
            Job dependent = view.get(dependentId);
            if (dependent != null && dependent.state() == JobState.PENDING && dependenciesComplete(dependent)) {
                move(dependent, dependent.toBuilder().state(JobState.READY).build());
            }
        }
    }

    private void cascadeFailure(Job failed) {
        String reason = "dependency " + failed.project().ref() + " failed";
        for (String dependentId : index.transitiveDependents(failed.id())) {
            Job dependent = view.get(dependentId);
            if (dependent == null) {
                continue;
            }
            // Assigned dependents cannot exist: nothing is dispatched before its dependencies complete
            if (dependent.state() == JobState.PENDING || dependent.state() == JobState.READY) {
                move(dependent, dependent.toBuilder()
                        .state(JobState.DEPENDENCY_FAILED)
                        .failureReason(reason)
                        .completedAt(now)
                        .build());
            }
        }
    }

    private boolean dependenciesComplete(Job job) {
        for (String dependencyId : job.dependencies()) {
            Job dependency = view.get(dependencyId);
            if (dependency == null || dependency.state() != JobState.COMPLETE) {
                return false;
            }
        }
        return true;
    }

    private Job firstUnsuccessfulDependency(Job job) {
        for (String dependencyId : job.dependencies()) {
            Job dependency = view.get(dependencyId);
            if (dependency != null && dependency.state().isTerminal() && dependency.state() != JobState.COMPLETE) {
                return dependency;
            }
        }
        return null;
    }
}
