package bldr.jobsrv.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job lifecycle state.
 *
 * <pre>
 * PENDING -> READY -> DISPATCHED -> RUNNING -> COMPLETE
 * PENDING/READY -> DEPENDENCY_FAILED
 * DISPATCHED/RUNNING -> FAILED
 * DISPATCHED/RUNNING -> PENDING   (requeue after worker loss)
 * any non-terminal -> CANCELED
 * </pre>
 */
public enum JobState {
    /** Waiting for dependencies to complete */
    PENDING,
    /** All dependencies complete, eligible for dispatch */
    READY,
    /** Assignment sent to a worker */
    DISPATCHED,
    /** Worker reported that the build started */
    RUNNING,
    /** Build succeeded */
    COMPLETE,
    /** Build failed, or worker loss with the retry budget exhausted */
    FAILED,
    /** A transitive dependency failed; never dispatched */
    DEPENDENCY_FAILED,
    /** Canceled by request */
    CANCELED;

    private static final Set<JobState> TERMINAL = EnumSet.of(COMPLETE, FAILED, DEPENDENCY_FAILED, CANCELED);
    private static final Set<JobState> ASSIGNED = EnumSet.of(DISPATCHED, RUNNING);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** DISPATCHED or RUNNING: the job holds a slot on a worker */
    public boolean isAssigned() {
        return ASSIGNED.contains(this);
    }

    /** Terminal and not successful */
    public boolean isUnsuccessful() {
        return this == FAILED || this == DEPENDENCY_FAILED || this == CANCELED;
    }

    public boolean canTransitionTo(JobState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == CANCELED) {
            return true;
        }
        return switch (this) {
            case PENDING -> next == READY || next == DEPENDENCY_FAILED;
            case READY -> next == DISPATCHED || next == DEPENDENCY_FAILED;
            case DISPATCHED -> next == RUNNING || next == COMPLETE || next == FAILED || next == PENDING;
            case RUNNING -> next == COMPLETE || next == FAILED || next == PENDING;
            default -> false;
        };
    }

    public static Set<JobState> terminalStates() {
        return EnumSet.copyOf(TERMINAL);
    }

    public static Set<JobState> assignedStates() {
        return EnumSet.copyOf(ASSIGNED);
    }
}
