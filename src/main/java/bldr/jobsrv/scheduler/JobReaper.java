package bldr.jobsrv.scheduler;

import bldr.jobsrv.config.JobServerConfig;
import bldr.jobsrv.dispatch.WorkerClient;
import bldr.jobsrv.dispatch.WorkerUnreachableException;
import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.repository.JobStore;
import bldr.jobsrv.repository.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Background task that takes back jobs a worker has held too long.
 * 
 * Jobs can overrun if:
 * - A build hangs on the worker
 * - The worker keeps heartbeating but lost track of the job
 * - The completion report never arrived
 * 
 * The reaper:
 * 1. Finds jobs DISPATCHED or RUNNING since before the timeout
 * 2. For each one, requeues it within its retry budget or fails it with
 * cascade, then tells the worker to abort it
 */
public class JobReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobReaper.class);

    private final JobStore store;
    private final WorkerRepository workers;
    private final BuildScheduler scheduler;
    private final WorkerClient client;
    private final JobServerConfig config;

    public JobReaper(JobStore store, WorkerRepository workers, BuildScheduler scheduler,
            WorkerClient client, JobServerConfig config) {
        this.store = store;
        this.workers = workers;
        this.scheduler = scheduler;
        this.client = client;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reapOverdueJobs(Instant.now());
        } catch (Exception e) {
            log.error("Job reaper error", e);
        }
    }

    /**
     * Expire every job dispatched before {@code now - jobTimeout}.
     *
     * @return number of jobs requeued or failed
     */
    public int reapOverdueJobs(Instant now) {
        Instant cutoff = now.minus(config.jobTimeout());
        List<Job> overdue = store.findOverdueJobs(cutoff);

        if (overdue.isEmpty()) {
            log.debug("No overdue jobs found");
            return 0;
        }

        int reaped = 0;
        for (Job job : overdue) {
            try {
                if (scheduler.expire(job, "timed out after " + config.jobTimeout())) {
                    reaped++;
                    abort(job);
                }
            } catch (Exception e) {
                log.error("Failed to reap job {}", job.id(), e);
            }
        }

        log.info("Job reaper: {} of {} overdue job(s) taken back", reaped, overdue.size());
        return reaped;
    }

    private void abort(Job job) {
        Optional<Worker> worker = workers.findById(job.workerId());
        if (worker.isEmpty() || !worker.get().isAlive()) {
            return;
        }
        try {
            client.abort(worker.get(), job.id());
        } catch (WorkerUnreachableException e) {
            log.debug("Abort of overdue job {} on worker {} not delivered: {}", job.id(), job.workerId(),
                    e.getMessage());
        }
    }
}
