package bldr.jobsrv.repository;

import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobState;

import java.util.Objects;

/**
 * One compare-and-set step on a job row: applies only if the stored state still
 * equals {@code before.state()}, and then writes the fields of {@code after}.
 */
public record JobTransition(Job before, Job after) {

    public JobTransition {
        Objects.requireNonNull(before, "before is required");
        Objects.requireNonNull(after, "after is required");
        if (!before.id().equals(after.id())) {
            throw new IllegalArgumentException("Transition must stay on one job");
        }
        if (!before.state().canTransitionTo(after.state())) {
            throw new IllegalStateException(
                    "Illegal transition for job " + before.id() + ": " + before.state() + " -> " + after.state());
        }
    }

    public String jobId() {
        return after.id();
    }

    public String groupId() {
        return after.groupId();
    }

    public JobState from() {
        return before.state();
    }

    public JobState to() {
        return after.state();
    }

    @Override
    public String toString() {
        return jobId() + ": " + from() + " -> " + to();
    }
}
