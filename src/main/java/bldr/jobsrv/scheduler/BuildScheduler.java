package bldr.jobsrv.scheduler;

import bldr.jobsrv.config.JobServerConfig;
import bldr.jobsrv.graph.BuildGraph;
import bldr.jobsrv.graph.DependencyIndex;
import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobReport;
import bldr.jobsrv.model.JobState;
import bldr.jobsrv.model.ReportOutcome;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.repository.GroupSnapshot;
import bldr.jobsrv.repository.JobStore;
import bldr.jobsrv.repository.JobTransition;
import bldr.jobsrv.repository.TransitionBatch;
import bldr.jobsrv.repository.TransitionConflictException;
import bldr.jobsrv.repository.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Owns every job and group state change after submission.
 *
 * <p>
 * Each operation reads a fresh {@link GroupSnapshot}, plans the resulting
 * transitions with a {@link TransitionPlanner} and hands the batch to the
 * {@link JobStore}. When the store reports a conflict the operation starts over
 * from a new snapshot, up to the configured attempt limit; after that the
 * conflict propagates to the caller.
 *
 * <p>
 * The only in-memory state is a cache of reverse-dependency indexes, one per
 * active group, which can always be rebuilt from the stored dependency lists.
 */
public class BuildScheduler {

    private static final Logger log = LoggerFactory.getLogger(BuildScheduler.class);

    private final JobStore store;
    private final WorkerRepository workers;
    private final int retryLimit;
    private final Map<String, DependencyIndex> indexes = new ConcurrentHashMap<>();
    private final InFlightDispatches inFlight = new InFlightDispatches();

    public BuildScheduler(JobStore store, WorkerRepository workers, JobServerConfig config) {
        this.store = store;
        this.workers = workers;
        this.retryLimit = Math.max(1, config.transitionRetryLimit());
    }

    /**
     * Remember the index of a freshly stored graph so the first event does not
     * have to rebuild it.
     */
    public void register(BuildGraph graph) {
        indexes.put(graph.group().id(), graph.index());
    }

    /**
     * Apply a worker report to its job.
     *
     * @param report the report
     * @return APPLIED if the job changed, DUPLICATE if the job is already past the
     *         reported step, STALE if the reporter does not own the job, DEFERRED
     *         if the reporter's assignment is still being recorded, NOT_FOUND for
     *         unknown jobs
     */
    public ReportOutcome onReport(JobReport report) {
        return withRetry("report " + report.kind() + " for job " + report.jobId(), () -> applyReport(report));
    }

    private ReportOutcome applyReport(JobReport report) {
        Optional<Job> stored = store.findJob(report.jobId());
        if (stored.isEmpty()) {
            return ReportOutcome.NOT_FOUND;
        }
        Optional<GroupSnapshot> snapshot = store.snapshot(stored.get().groupId());
        if (snapshot.isEmpty()) {
            return ReportOutcome.NOT_FOUND;
        }
        GroupSnapshot snap = snapshot.get();
        Job job = snap.job(report.jobId()).orElseThrow();

        if (!report.workerId().equals(job.workerId())) {
            if (job.state() == JobState.READY) {
                Optional<ReportOutcome> early = applyEarlyReport(report);
                if (early.isPresent()) {
                    return early.get();
                }
            }
            log.warn("Ignoring {} for job {} from worker {}: job is {} on worker {}",
                    report.kind(), job.id(), report.workerId(), job.state(), job.workerId());
            return ReportOutcome.STALE;
        }

        TransitionPlanner planner = new TransitionPlanner(snap, indexFor(snap), Instant.now());
        boolean applied = switch (report.kind()) {
            case STARTED, PROGRESS -> planner.start(job.id());
            case SUCCEEDED -> planner.succeed(job.id());
            case FAILED -> planner.fail(job.id(), report.reason() != null ? report.reason() : "build failed");
            case ABORTED -> planner.lose(job.id(), "aborted by worker " + report.workerId(), true);
        };

        if (!applied) {
            log.debug("Duplicate {} for job {} in state {}", report.kind(), job.id(), job.state());
            return ReportOutcome.DUPLICATE;
        }

        commit(snap, planner);
        log.info("Job {} ({}) {} -> {}", job.id(), job.project(), job.state(), planner.job(job.id()).state());
        return ReportOutcome.APPLIED;
    }

    /**
     * A report on a READY job can only be legitimate if its sender was just
     * handed the job. Hold it until the dispatch is recorded.
     */
    private Optional<ReportOutcome> applyEarlyReport(JobReport report) {
        Optional<InFlightDispatches.Entry> pending = inFlight.find(report.jobId());
        if (pending.isPresent()) {
            if (!pending.get().workerId().equals(report.workerId())) {
                return Optional.empty();
            }
            if (pending.get().hold(report)) {
                log.debug("Holding {} for job {} from worker {} until its dispatch is recorded",
                        report.kind(), report.jobId(), report.workerId());
                return Optional.of(ReportOutcome.DEFERRED);
            }
        }
        // The dispatch may have been recorded since the job was read
        boolean nowOwned = store.findJob(report.jobId())
                .map(j -> report.workerId().equals(j.workerId()))
                .orElse(false);
        return nowOwned ? Optional.of(applyReport(report)) : Optional.empty();
    }

    /**
     * Announce an assignment about to be sent. Until {@link #recordDispatch} or
     * {@link #abandonDispatch} ends it, reports from the worker on this job are
     * held instead of rejected.
     *
     * @return false if the job already has an assignment in flight
     */
    public boolean beginDispatch(Job job, Worker worker) {
        return inFlight.begin(job.id(), worker.id());
    }

    /**
     * The assignment was not delivered. Reports held for it are dropped.
     */
    public void abandonDispatch(String jobId) {
        List<JobReport> dropped = inFlight.end(jobId);
        if (!dropped.isEmpty()) {
            log.warn("Dropping {} report(s) for job {}: its assignment was never recorded", dropped.size(), jobId);
        }
    }

    public boolean isDispatching(String jobId) {
        return inFlight.contains(jobId);
    }

    /** Assignments in flight per worker id */
    public Map<String, Integer> dispatchingByWorker() {
        return inFlight.countByWorker();
    }

    /**
     * Record a sent assignment: READY -> DISPATCHED and one more slot on the
     * worker, both guarded. Not retried: losing the race means the assignment
     * is void. Ends the assignment's in-flight entry either way; reports held
     * for it are replayed if the dispatch was recorded.
     *
     * @return true if recorded, false if the job is no longer READY or the
     *         worker is full or gone
     */
    public boolean recordDispatch(Job job, Worker worker) {
        Job dispatched = job.toBuilder()
                .state(JobState.DISPATCHED)
                .workerId(worker.id())
                .dispatchedAt(Instant.now())
                .build();
        TransitionBatch batch = TransitionBatch.builder()
                .transition(new JobTransition(job, dispatched))
                .adjustLoad(worker.id(), 1)
                .build();
        try {
            store.apply(batch);
        } catch (TransitionConflictException e) {
            log.debug("Dispatch of job {} to worker {} lost a race: {}", job.id(), worker.id(), e.getMessage());
            abandonDispatch(job.id());
            return false;
        } catch (RuntimeException e) {
            abandonDispatch(job.id());
            throw e;
        }
        log.info("Dispatched job {} ({}) to worker {}", job.id(), job.project(), worker.id());

        for (JobReport held : inFlight.end(job.id())) {
            try {
                ReportOutcome outcome = onReport(held);
                log.debug("Replayed {} for job {}: {}", held.kind(), held.jobId(), outcome);
            } catch (RuntimeException e) {
                log.error("Failed to replay {} for job {} from worker {}", held.kind(), held.jobId(),
                        held.workerId(), e);
            }
        }
        return true;
    }

    /**
     * Handle a worker whose heartbeat lapsed. In one atomic batch the worker is
     * marked DEAD with zero load, and each of its assigned jobs is requeued
     * within its retry budget or failed with cascade.
     *
     * @param workerId        the expired worker
     * @param heartbeatBefore the worker only counts as lost if its last
     *                        heartbeat is still older than this
     * @return number of jobs taken off the worker, or -1 if the worker turned
     *         out not to be expired
     */
    public int handleWorkerLoss(String workerId, Instant heartbeatBefore) {
        return withRetry("loss of worker " + workerId, () -> applyWorkerLoss(workerId, heartbeatBefore));
    }

    private int applyWorkerLoss(String workerId, Instant heartbeatBefore) {
        // Worker before jobs: a dispatch committed in between then fails the load guard
        Optional<Worker> found = workers.findById(workerId);
        if (found.isEmpty() || !found.get().isAlive() || !found.get().lastHeartbeat().isBefore(heartbeatBefore)) {
            return -1;
        }
        Worker worker = found.get();
        List<Job> assigned = store.findJobsAssignedTo(workerId);

        Map<String, List<Job>> byGroup = new TreeMap<>();
        for (Job job : assigned) {
            byGroup.computeIfAbsent(job.groupId(), k -> new ArrayList<>()).add(job);
        }

        Instant now = Instant.now();
        TransitionBatch.Builder batch = TransitionBatch.builder()
                .markWorkerDead(workerId, heartbeatBefore, worker.activeJobs());
        List<GroupCommit> commits = new ArrayList<>();
        int moved = 0;

        for (Map.Entry<String, List<Job>> entry : byGroup.entrySet()) {
            Optional<GroupSnapshot> snapshot = store.snapshot(entry.getKey());
            if (snapshot.isEmpty()) {
                continue;
            }
            TransitionPlanner planner = new TransitionPlanner(snapshot.get(), indexFor(snapshot.get()), now, batch);
            for (Job job : entry.getValue()) {
                Job current = planner.job(job.id());
                if (current != null && workerId.equals(current.workerId())
                        && planner.lose(job.id(), "worker " + workerId + " lost", false)) {
                    moved++;
                }
            }
            planner.finish();
            commits.add(new GroupCommit(snapshot.get(), planner));
        }

        store.apply(batch.build());
        commits.forEach(c -> evictIfDone(c.snapshot(), c.planner()));

        log.warn("Worker {} marked dead, {} job(s) requeued or failed", workerId, moved);
        return moved;
    }

    /**
     * Take an overdue job away from its worker: requeue within the retry budget,
     * else fail with cascade. Nothing happens if the job has moved on since it
     * was found.
     *
     * @return true if the job was requeued or failed
     */
    public boolean expire(Job overdue, String reason) {
        return withRetry("expiry of job " + overdue.id(), () -> {
            Optional<GroupSnapshot> snapshot = store.snapshot(overdue.groupId());
            if (snapshot.isEmpty()) {
                return false;
            }
            Job current = snapshot.get().job(overdue.id()).orElse(null);
            if (current == null || !current.state().isAssigned()
                    || !Objects.equals(current.workerId(), overdue.workerId())
                    || current.retryCount() != overdue.retryCount()) {
                return false;
            }
            TransitionPlanner planner = new TransitionPlanner(snapshot.get(), indexFor(snapshot.get()), Instant.now());
            planner.lose(current.id(), reason, true);
            commit(snapshot.get(), planner);
            log.warn("Job {} ({}) on worker {} expired: {} -> {}", current.id(), current.project(),
                    current.workerId(), current.state(), planner.job(current.id()).state());
            return true;
        });
    }

    /**
     * Cancel a group: flag it and move every non-terminal job to CANCELED in one
     * batch. Idempotent on terminal groups. Aborting the workers is up to the
     * caller, after this returns.
     */
    public CancelOutcome cancel(String groupId) {
        return withRetry("cancel of group " + groupId, () -> {
            Optional<GroupSnapshot> snapshot = store.snapshot(groupId);
            if (snapshot.isEmpty()) {
                return CancelOutcome.notFound();
            }
            GroupSnapshot snap = snapshot.get();
            if (snap.group().isTerminal()) {
                return CancelOutcome.unchanged(snap.group().state());
            }
            TransitionPlanner planner = new TransitionPlanner(snap, indexFor(snap), Instant.now());
            planner.cancel();
            commit(snap, planner);
            log.info("Group {} canceled, {} running job(s) to abort", groupId, planner.abortTargets().size());
            return new CancelOutcome(true, planner.derivedState(), planner.abortTargets());
        });
    }

    /**
     * Settle every active group after a restart: promote PENDING jobs whose
     * dependencies completed, cascade failures that were not propagated and
     * store the derived group state.
     *
     * @return number of groups that changed
     */
    public int recover() {
        int changed = 0;
        for (String groupId : store.findActiveGroupIds()) {
            try {
                if (withRetry("recovery of group " + groupId, () -> settle(groupId))) {
                    changed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to recover group {}", groupId, e);
            }
        }
        if (changed > 0) {
            log.info("Recovery settled {} group(s)", changed);
        }
        return changed;
    }

    private boolean settle(String groupId) {
        Optional<GroupSnapshot> snapshot = store.snapshot(groupId);
        if (snapshot.isEmpty()) {
            return false;
        }
        TransitionPlanner planner = new TransitionPlanner(snapshot.get(), indexFor(snapshot.get()), Instant.now());
        planner.settle();
        planner.finish();
        if (!planner.hasChanges()) {
            return false;
        }
        commit(snapshot.get(), planner);
        return true;
    }

    /** Number of cached dependency indexes (one per active group seen) */
    public int cachedIndexes() {
        return indexes.size();
    }

    // Helper methods

    private void commit(GroupSnapshot snapshot, TransitionPlanner planner) {
        store.apply(planner.finish().build());
        evictIfDone(snapshot, planner);
    }

    private void evictIfDone(GroupSnapshot snapshot, TransitionPlanner planner) {
        if (planner.derivedState().isTerminal()) {
            indexes.remove(snapshot.group().id());
        }
    }

    private DependencyIndex indexFor(GroupSnapshot snapshot) {
        return indexes.computeIfAbsent(snapshot.group().id(), id -> DependencyIndex.of(snapshot.jobs()));
    }

    private <T> T withRetry(String operation, Supplier<T> attempt) {
        TransitionConflictException last = null;
        for (int i = 1; i <= retryLimit; i++) {
            try {
                return attempt.get();
            } catch (TransitionConflictException e) {
                last = e;
                log.debug("Conflict on {} (attempt {}/{}): {}", operation, i, retryLimit, e.getMessage());
            }
        }
        log.warn("Giving up on {} after {} conflicting attempts", operation, retryLimit);
        throw last;
    }

    private record GroupCommit(GroupSnapshot snapshot, TransitionPlanner planner) {
    }
}
