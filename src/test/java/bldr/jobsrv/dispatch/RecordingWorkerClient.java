package bldr.jobsrv.dispatch;

import bldr.jobsrv.model.JobAssignment;
import bldr.jobsrv.model.Worker;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * WorkerClient that records every call and can refuse chosen workers.
 */
public class RecordingWorkerClient implements WorkerClient {

    public record Call(String workerId, String jobId) {
    }

    private final List<Call> assigned = new ArrayList<>();
    private final List<Call> aborted = new ArrayList<>();
    private final Set<String> unreachable = new HashSet<>();
    private volatile BiConsumer<Worker, JobAssignment> beforeAssign = (w, a) -> {
    };

    @Override
    public void assign(Worker worker, JobAssignment assignment) {
        synchronized (this) {
            if (unreachable.contains(worker.id())) {
                throw new WorkerUnreachableException("worker " + worker.id() + " refused");
            }
        }
        // Outside the lock so sends to different workers can overlap
        beforeAssign.accept(worker, assignment);
        synchronized (this) {
            assigned.add(new Call(worker.id(), assignment.jobId()));
        }
    }

    @Override
    public synchronized void abort(Worker worker, String jobId) {
        if (unreachable.contains(worker.id())) {
            throw new WorkerUnreachableException("worker " + worker.id() + " refused");
        }
        aborted.add(new Call(worker.id(), jobId));
    }

    public synchronized void refuse(String workerId) {
        unreachable.add(workerId);
    }

    /** Hook run inside every accepted assign, before it is recorded */
    public void beforeAssign(Runnable hook) {
        beforeAssign((w, a) -> hook.run());
    }

    public void beforeAssign(BiConsumer<Worker, JobAssignment> hook) {
        this.beforeAssign = hook;
    }

    public synchronized List<Call> assigned() {
        return List.copyOf(assigned);
    }

    public synchronized List<Call> aborted() {
        return List.copyOf(aborted);
    }
}
