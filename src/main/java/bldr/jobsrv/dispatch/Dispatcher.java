package bldr.jobsrv.dispatch;

import bldr.jobsrv.config.JobServerConfig;
import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobAssignment;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.repository.JobStore;
import bldr.jobsrv.scheduler.BuildScheduler;
import bldr.jobsrv.service.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Moves READY jobs onto workers.
 *
 * <p>
 * A pass reads the oldest READY jobs and the available workers and matches
 * them with {@link WorkerMatcher}. It then hands the sends to a bounded pool,
 * one chain per worker, and returns without waiting for them. Each chain sends
 * its assignments in order and records each one through
 * {@link BuildScheduler#recordDispatch} as soon as the worker accepts it, so a
 * slow worker only delays its own jobs.
 *
 * <p>
 * Assignments on the wire are announced to the scheduler first. Later passes
 * skip those jobs and count them against their worker's capacity. A job whose
 * send fails stays READY and its worker is flagged suspect; an assignment whose
 * record loses a race gets a best-effort abort.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final JobStore store;
    private final WorkerRegistry registry;
    private final BuildScheduler scheduler;
    private final WorkerClient client;
    private final ExecutorService sendPool;
    private final WorkerMatcher matcher;
    private final int batchSize;

    public Dispatcher(JobStore store, WorkerRegistry registry, BuildScheduler scheduler,
            WorkerClient client, ExecutorService sendPool, JobServerConfig config) {
        this.store = store;
        this.registry = registry;
        this.scheduler = scheduler;
        this.client = client;
        this.sendPool = sendPool;
        this.matcher = new WorkerMatcher();
        this.batchSize = config.dispatchBatchSize();
    }

    /**
     * Run one pass and wait for all of its sends.
     */
    public DispatchResult dispatchPass() {
        return startPass().join();
    }

    /**
     * Match READY jobs and start sending. Matching is serialized; the sends are
     * not.
     *
     * @return completes with the pass counters once every send has finished
     */
    public synchronized CompletableFuture<DispatchResult> startPass() {
        List<Job> ready = store.findReadyJobs(batchSize).stream()
                .filter(job -> !scheduler.isDispatching(job.id()))
                .toList();
        if (ready.isEmpty()) {
            return CompletableFuture.completedFuture(DispatchResult.EMPTY);
        }

        Map<String, Integer> onTheWire = scheduler.dispatchingByWorker();
        List<Worker> available = registry.available().stream()
                .map(w -> withPendingLoad(w, onTheWire.getOrDefault(w.id(), 0)))
                .toList();
        List<WorkerMatcher.Assignment> assignments = matcher.assign(ready, available);

        int unmatched = ready.size() - assignments.size();
        if (unmatched > 0) {
            log.debug("{} ready job(s) without a fitting worker ({} available)", unmatched, available.size());
        }

        Map<String, List<WorkerMatcher.Assignment>> byWorker = new LinkedHashMap<>();
        for (WorkerMatcher.Assignment assignment : assignments) {
            if (scheduler.beginDispatch(assignment.job(), assignment.worker())) {
                byWorker.computeIfAbsent(assignment.worker().id(), k -> new ArrayList<>()).add(assignment);
            } else {
                unmatched++;
            }
        }

        DispatchResult matched = new DispatchResult(ready.size(), 0, unmatched, 0, 0);
        List<CompletableFuture<DispatchResult>> chains = new ArrayList<>();
        for (List<WorkerMatcher.Assignment> chain : byWorker.values()) {
            try {
                chains.add(CompletableFuture.supplyAsync(() -> sendChain(chain), sendPool));
            } catch (RejectedExecutionException e) {
                log.warn("Send pool is shut down, leaving {} job(s) READY", chain.size());
                chain.forEach(a -> scheduler.abandonDispatch(a.job().id()));
                matched = matched.plus(new DispatchResult(0, 0, chain.size(), 0, 0));
            }
        }

        DispatchResult base = matched;
        return CompletableFuture.allOf(chains.toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    DispatchResult total = base;
                    for (CompletableFuture<DispatchResult> chain : chains) {
                        total = total.plus(chain.join());
                    }
                    if (total.dispatched() > 0 || total.sendFailures() > 0 || total.lostRaces() > 0) {
                        log.info("Dispatch pass: {} ready, {} dispatched, {} unmatched, {} send failure(s), {} lost race(s)",
                                total.ready(), total.dispatched(), total.unmatched(), total.sendFailures(),
                                total.lostRaces());
                    }
                    return total;
                });
    }

    /**
     * Scheduled entry point. Does not wait for the sends; the next pass skips
     * whatever is still on the wire.
     */
    public void run() {
        startPass().whenComplete((result, error) -> {
            if (error != null) {
                log.error("Dispatch sends failed", error);
            }
        });
    }

    /**
     * Send one worker's assignments in order. After the first refusal the rest
     * stay READY for a later pass.
     */
    private DispatchResult sendChain(List<WorkerMatcher.Assignment> chain) {
        int dispatched = 0;
        int skipped = 0;
        int sendFailures = 0;
        int lostRaces = 0;
        boolean refused = false;

        for (WorkerMatcher.Assignment assignment : chain) {
            Job job = assignment.job();
            Worker worker = assignment.worker();
            if (refused) {
                scheduler.abandonDispatch(job.id());
                skipped++;
                continue;
            }

            try {
                client.assign(worker, JobAssignment.forJob(job));
            } catch (WorkerUnreachableException e) {
                log.warn("Could not send job {} to worker {}: {}", job.id(), worker.id(), e.getMessage());
                scheduler.abandonDispatch(job.id());
                registry.flagSuspect(worker.id());
                sendFailures++;
                refused = true;
                continue;
            } catch (RuntimeException e) {
                log.error("Send of job {} to worker {} failed", job.id(), worker.id(), e);
                scheduler.abandonDispatch(job.id());
                skipped++;
                continue;
            }

            try {
                if (scheduler.recordDispatch(job, worker)) {
                    dispatched++;
                } else {
                    lostRaces++;
                    abortQuietly(worker, job.id());
                }
            } catch (RuntimeException e) {
                log.error("Could not record dispatch of job {} to worker {}", job.id(), worker.id(), e);
                lostRaces++;
                abortQuietly(worker, job.id());
            }
        }
        return new DispatchResult(0, dispatched, skipped, sendFailures, lostRaces);
    }

    private static Worker withPendingLoad(Worker worker, int pending) {
        return pending == 0 ? worker : worker.toBuilder().activeJobs(worker.activeJobs() + pending).build();
    }

    private void abortQuietly(Worker worker, String jobId) {
        try {
            client.abort(worker, jobId);
        } catch (WorkerUnreachableException e) {
            log.debug("Abort of job {} on worker {} not delivered: {}", jobId, worker.id(), e.getMessage());
        }
    }
}
