package bldr.jobsrv.repository;

import bldr.jobsrv.model.Heartbeat;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.model.WorkerStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for worker registrations. Load counters are not written
 * here; they change only through {@link JobStore#apply(TransitionBatch)}.
 */
public interface WorkerRepository {

    /**
     * Record a heartbeat. Creates the worker on first contact, revives a DEAD
     * worker with zero load and clears the suspect flag.
     *
     * @param heartbeat the heartbeat
     * @param now       receive time
     * @return the worker after the update
     */
    Worker heartbeat(Heartbeat heartbeat, Instant now);

    /**
     * Find a worker by ID.
     *
     * @param workerId the worker ID
     * @return the worker if found
     */
    Optional<Worker> findById(String workerId);

    /**
     * Get all workers.
     *
     * @return list of all workers
     */
    List<Worker> findAll();

    /**
     * Get all workers with the given status.
     *
     * @param status the status filter
     * @return list of workers
     */
    List<Worker> findByStatus(WorkerStatus status);

    /**
     * ALIVE workers whose last heartbeat is older than the cutoff.
     *
     * @param heartbeatBefore cutoff
     * @return list of expired workers
     */
    List<Worker> findExpired(Instant heartbeatBefore);

    /**
     * Exclude a worker from matching until its next heartbeat.
     *
     * @param workerId the worker ID
     * @return true if the worker exists
     */
    boolean flagSuspect(String workerId);

    /**
     * Get count of workers by status.
     *
     * @param status the status
     * @return count
     */
    int countByStatus(WorkerStatus status);
}
