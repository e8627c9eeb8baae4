package bldr.jobsrv.scheduler;

import bldr.jobsrv.model.GroupState;
import bldr.jobsrv.model.Job;

import java.util.List;

/**
 * Result of a cancellation request.
 *
 * @param found   whether the group exists
 * @param state   group state after the request
 * @param aborted jobs that were assigned when canceled; their workers get an abort
 */
public record CancelOutcome(boolean found, GroupState state, List<Job> aborted) {

    public static CancelOutcome notFound() {
        return new CancelOutcome(false, null, List.of());
    }

    public static CancelOutcome unchanged(GroupState state) {
        return new CancelOutcome(true, state, List.of());
    }
}
