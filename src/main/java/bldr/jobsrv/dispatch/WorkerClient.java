package bldr.jobsrv.dispatch;

import bldr.jobsrv.model.JobAssignment;
import bldr.jobsrv.model.Worker;

/**
 * Scheduler-to-worker messages. Calls block until the worker accepted the
 * message and are never made while a group is locked.
 */
public interface WorkerClient {

    /**
     * Hand a job to a worker.
     *
     * @throws WorkerUnreachableException if the worker did not accept it
     */
    void assign(Worker worker, JobAssignment assignment);

    /**
     * Ask a worker to stop a job. Best effort: the job's state does not depend
     * on the worker acting on it.
     *
     * @throws WorkerUnreachableException if the worker did not accept it
     */
    void abort(Worker worker, String jobId);
}
