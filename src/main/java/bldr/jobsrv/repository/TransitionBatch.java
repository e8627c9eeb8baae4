package bldr.jobsrv.repository;

import bldr.jobsrv.model.GroupState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A set of job transitions, worker updates and group updates that the store
 * applies atomically or not at all.
 *
 * <p>
 * Every group touched by the batch is locked in id order before anything is
 * written. Job transitions are applied in the order they were added, so one job
 * may appear more than once (e.g. RUNNING -> PENDING -> READY on requeue).
 */
public final class TransitionBatch {

    /**
     * Per-group part of a batch.
     *
     * @param expectedVersion version the plan was computed from, null to lock without checking
     * @param newState        derived state to store, null to leave it unchanged
     * @param requestCancel   set the cancel-requested flag
     */
    public record GroupUpdate(String groupId, Long expectedVersion, GroupState newState, boolean requestCancel) {
    }

    /**
     * Per-worker part of a batch. A positive load delta is refused when it would
     * exceed capacity or the worker is not alive.
     *
     * @param markDeadBefore if non-null, mark the worker DEAD with zero load, provided
     *                       its last heartbeat is still older than this instant
     * @param expectedLoad   load the worker must still have when marked dead; a
     *                       dispatch recorded after the plan was made breaks it
     */
    public record WorkerUpdate(String workerId, int loadDelta, Instant markDeadBefore, int expectedLoad) {

        public boolean marksDead() {
            return markDeadBefore != null;
        }
    }

    private final Map<String, GroupUpdate> groups;
    private final List<JobTransition> transitions;
    private final List<WorkerUpdate> workers;

    private TransitionBatch(Builder builder) {
        this.groups = Collections.unmodifiableMap(new TreeMap<>(builder.groups));
        this.transitions = List.copyOf(builder.transitions);
        List<WorkerUpdate> updates = new ArrayList<>();
        TreeSet<String> workerIds = new TreeSet<>(builder.loadDeltas.keySet());
        workerIds.addAll(builder.deadBefore.keySet());
        for (String id : workerIds) {
            int delta = builder.loadDeltas.getOrDefault(id, 0);
            Instant deadBefore = builder.deadBefore.get(id);
            if (delta != 0 || deadBefore != null) {
                updates.add(new WorkerUpdate(id, delta, deadBefore, builder.expectedLoad.getOrDefault(id, 0)));
            }
        }
        this.workers = List.copyOf(updates);
    }

    /** Group updates keyed and ordered by group id */
    public Collection<GroupUpdate> groups() {
        return groups.values();
    }

    public List<JobTransition> transitions() {
        return transitions;
    }

    public List<WorkerUpdate> workers() {
        return workers;
    }

    public boolean isEmpty() {
        return transitions.isEmpty() && workers.isEmpty()
                && groups.values().stream().noneMatch(g -> g.newState() != null || g.requestCancel());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "TransitionBatch{groups=" + groups.keySet() + ", transitions=" + transitions + ", workers=" + workers + "}";
    }

    public static final class Builder {
        private final Map<String, GroupUpdate> groups = new LinkedHashMap<>();
        private final List<JobTransition> transitions = new ArrayList<>();
        // Sorted so that concurrent batches lock worker rows in the same order
        private final Map<String, Integer> loadDeltas = new TreeMap<>();
        private final Map<String, Instant> deadBefore = new TreeMap<>();
        private final Map<String, Integer> expectedLoad = new TreeMap<>();

        /** Require the group to still be at the given version */
        public Builder expectVersion(String groupId, long version) {
            GroupUpdate current = groups.get(groupId);
            groups.put(groupId, current == null
                    ? new GroupUpdate(groupId, version, null, false)
                    : new GroupUpdate(groupId, version, current.newState(), current.requestCancel()));
            return this;
        }

        public Builder groupState(String groupId, GroupState state) {
            GroupUpdate current = groups.get(groupId);
            groups.put(groupId, current == null
                    ? new GroupUpdate(groupId, null, state, false)
                    : new GroupUpdate(groupId, current.expectedVersion(), state, current.requestCancel()));
            return this;
        }

        public Builder requestCancel(String groupId) {
            GroupUpdate current = groups.get(groupId);
            groups.put(groupId, current == null
                    ? new GroupUpdate(groupId, null, null, true)
                    : new GroupUpdate(groupId, current.expectedVersion(), current.newState(), true));
            return this;
        }

        public Builder transition(JobTransition transition) {
            transitions.add(transition);
            groups.putIfAbsent(transition.groupId(), new GroupUpdate(transition.groupId(), null, null, false));
            return this;
        }

        public Builder adjustLoad(String workerId, int delta) {
            loadDeltas.merge(workerId, delta, Integer::sum);
            return this;
        }

        public Builder markWorkerDead(String workerId, Instant heartbeatBefore, int currentLoad) {
            deadBefore.put(workerId, heartbeatBefore);
            expectedLoad.put(workerId, currentLoad);
            return this;
        }

        public boolean hasTransitions() {
            return !transitions.isEmpty();
        }

        public TransitionBatch build() {
            return new TransitionBatch(this);
        }
    }
}
