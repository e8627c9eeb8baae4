package bldr.jobsrv.service;

import bldr.jobsrv.config.JobServerConfig;
import bldr.jobsrv.model.Heartbeat;
import bldr.jobsrv.model.JobReport;
import bldr.jobsrv.model.ReportOutcome;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.scheduler.BuildScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Entry point for everything workers send back.
 *
 * <p>
 * Work is spread over a fixed number of single-threaded lanes. A report goes to
 * the lane picked by its job id and a heartbeat to the lane picked by its worker
 * id, so messages about one job (or one worker) are handled strictly in arrival
 * order while unrelated jobs proceed in parallel.
 */
public class StatusIngestor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StatusIngestor.class);

    private final BuildScheduler scheduler;
    private final WorkerRegistry registry;
    private final List<ExecutorService> lanes;

    private volatile boolean closed = false;

    public StatusIngestor(BuildScheduler scheduler, WorkerRegistry registry, JobServerConfig config) {
        this.scheduler = scheduler;
        this.registry = registry;
        int count = Math.max(1, config.ingestLanes());
        this.lanes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String name = "jobsrv-ingest-" + i;
            lanes.add(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                return t;
            }));
        }
        log.info("Status ingestor started with {} lane(s)", count);
    }

    /**
     * Queue a job report.
     *
     * @return completes with the outcome once the report is applied, or
     *         exceptionally if the store failed
     */
    public CompletableFuture<ReportOutcome> submit(JobReport report) {
        return enqueue(report.jobId(), () -> {
            ReportOutcome outcome = scheduler.onReport(report);
            log.debug("Report {} for job {} from worker {}: {}", report.kind(), report.jobId(),
                    report.workerId(), outcome);
            return outcome;
        });
    }

    /**
     * Queue a heartbeat.
     */
    public CompletableFuture<Worker> submit(Heartbeat heartbeat) {
        return enqueue(heartbeat.workerId(), () -> registry.heartbeat(heartbeat));
    }

    public int laneCount() {
        return lanes.size();
    }

    int laneFor(String key) {
        return Math.floorMod(key.hashCode(), lanes.size());
    }

    private <T> CompletableFuture<T> enqueue(String key, Supplier<T> work) {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Status ingestor is closed"));
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return work.get();
                } catch (RuntimeException e) {
                    log.error("Failed to ingest message for {}", key, e);
                    throw e;
                }
            }, lanes.get(laneFor(key)));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Status ingestor is closed", e));
        }
    }

    /**
     * Stop accepting messages and drain what is queued.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        lanes.forEach(ExecutorService::shutdown);
        try {
            for (ExecutorService lane : lanes) {
                if (!lane.awaitTermination(5, TimeUnit.SECONDS)) {
                    lane.shutdownNow();
                    log.warn("Ingest lane forcefully stopped");
                }
            }
            log.info("Status ingestor stopped");
        } catch (InterruptedException e) {
            lanes.forEach(ExecutorService::shutdownNow);
            Thread.currentThread().interrupt();
        }
    }
}
