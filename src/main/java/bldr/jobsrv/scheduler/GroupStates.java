package bldr.jobsrv.scheduler;

import bldr.jobsrv.model.GroupState;
import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobState;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Derivation of group state from member job states.
 */
public final class GroupStates {

    private GroupStates() {
    }

    /**
     * QUEUED while any job is non-terminal. Once all are terminal: CANCELED if
     * cancellation was requested, else FAILED if any job failed or was
     * cascade-failed, else COMPLETE.
     */
    public static GroupState derive(Collection<Job> jobs, boolean cancelRequested) {
        boolean failed = false;
        for (Job job : jobs) {
            if (!job.state().isTerminal()) {
                return GroupState.QUEUED;
            }
            if (job.state() == JobState.FAILED || job.state() == JobState.DEPENDENCY_FAILED) {
                failed = true;
            }
        }
        if (cancelRequested) {
            return GroupState.CANCELED;
        }
        if (failed) {
            return GroupState.FAILED;
        }
        // Only reachable with every job COMPLETE: CANCELED jobs imply a cancel request
        return GroupState.COMPLETE;
    }

    /** Jobs that failed on their own, as opposed to cascade victims */
    public static List<Job> rootCauses(Collection<Job> jobs) {
        return jobs.stream().filter(j -> j.state() == JobState.FAILED).toList();
    }

    public static Map<JobState, Integer> countByState(Collection<Job> jobs) {
        Map<JobState, Integer> counts = new EnumMap<>(JobState.class);
        for (JobState state : JobState.values()) {
            counts.put(state, 0);
        }
        for (Job job : jobs) {
            counts.merge(job.state(), 1, Integer::sum);
        }
        return counts;
    }
}
