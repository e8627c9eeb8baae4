package bldr.jobsrv.service;

import bldr.jobsrv.config.JobServerConfig;
import bldr.jobsrv.model.Heartbeat;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.model.WorkerStatus;
import bldr.jobsrv.repository.WorkerRepository;
import bldr.jobsrv.scheduler.BuildScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Tracks the worker fleet: heartbeats in, lost workers out.
 *
 * <p>
 * Workers are created by their first heartbeat. A worker whose heartbeat is
 * older than {@code workerHeartbeatTimeout} is handed to
 * {@link BuildScheduler#handleWorkerLoss} by {@link #sweep(Instant)}, which
 * marks it DEAD and takes its jobs back in one batch.
 */
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final WorkerRepository workers;
    private final BuildScheduler scheduler;
    private final JobServerConfig config;

    public WorkerRegistry(WorkerRepository workers, BuildScheduler scheduler, JobServerConfig config) {
        this.workers = workers;
        this.scheduler = scheduler;
        this.config = config;
    }

    /**
     * Register or refresh a worker.
     *
     * @return the worker as stored after the heartbeat
     */
    public Worker heartbeat(Heartbeat heartbeat, Instant now) {
        if (heartbeat.capacity() < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        return workers.heartbeat(heartbeat, now);
    }

    public Worker heartbeat(Heartbeat heartbeat) {
        return heartbeat(heartbeat, Instant.now());
    }

    /**
     * Declare every ALIVE worker with a lapsed heartbeat lost.
     *
     * @return number of workers marked dead
     */
    public int sweep(Instant now) {
        Instant cutoff = now.minus(config.workerHeartbeatTimeout());
        List<Worker> expired = workers.findExpired(cutoff);
        if (expired.isEmpty()) {
            return 0;
        }

        int lost = 0;
        for (Worker worker : expired) {
            try {
                if (scheduler.handleWorkerLoss(worker.id(), cutoff) >= 0) {
                    lost++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to handle loss of worker {}", worker.id(), e);
            }
        }
        if (lost > 0) {
            log.info("Liveness sweep: {} of {} expired worker(s) marked dead", lost, expired.size());
        }
        return lost;
    }

    /**
     * Scheduled entry point.
     */
    public void sweep() {
        sweep(Instant.now());
    }

    public List<Worker> list() {
        return workers.findAll();
    }

    public Optional<Worker> find(String workerId) {
        return workers.findById(workerId);
    }

    /** ALIVE workers that are not suspect and have spare capacity */
    public List<Worker> available() {
        return workers.findByStatus(WorkerStatus.ALIVE).stream()
                .filter(Worker::isAvailable)
                .toList();
    }

    /**
     * Exclude a worker from matching until its next heartbeat.
     */
    public boolean flagSuspect(String workerId) {
        boolean flagged = workers.flagSuspect(workerId);
        if (flagged) {
            log.warn("Worker {} flagged suspect", workerId);
        }
        return flagged;
    }

    public int countAlive() {
        return workers.countByStatus(WorkerStatus.ALIVE);
    }
}
