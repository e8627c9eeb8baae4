package bldr.jobsrv.simulation;

import bldr.jobsrv.dispatch.WorkerClient;
import bldr.jobsrv.dispatch.WorkerUnreachableException;
import bldr.jobsrv.model.Heartbeat;
import bldr.jobsrv.model.JobAssignment;
import bldr.jobsrv.model.JobReport;
import bldr.jobsrv.model.ReportKind;
import bldr.jobsrv.model.ReportOutcome;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.service.StatusIngestor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process stand-in for a fleet of build workers.
 *
 * <p>
 * Plugs in as the {@link WorkerClient}: assignments are queued per worker
 * instead of sent over HTTP. Nothing happens on its own; callers step the
 * fleet with {@link #drain()} or the per-job methods, and every step goes
 * through the {@link StatusIngestor} exactly like a real worker's report, so
 * runs are deterministic.
 */
public final class SimulatedWorkerFleet implements WorkerClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedWorkerFleet.class);

    private final StatusIngestor ingestor;

    private final Map<String, Heartbeat> members = new ConcurrentHashMap<>();
    private final Map<String, Map<String, JobAssignment>> held = new ConcurrentHashMap<>();
    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private final Set<String> failingProjects = ConcurrentHashMap.newKeySet();
    private final List<String> aborts = new CopyOnWriteArrayList<>();
    private final List<JobAssignment> received = new CopyOnWriteArrayList<>();

    public SimulatedWorkerFleet(StatusIngestor ingestor) {
        this.ingestor = ingestor;
    }

    /**
     * Add a worker and send its first heartbeat.
     */
    public Worker addWorker(String workerId, int capacity, String... tags) {
        Heartbeat heartbeat = new Heartbeat(workerId, capacity, Set.of(tags), "sim://" + workerId);
        members.put(workerId, heartbeat);
        held.computeIfAbsent(workerId, k -> new LinkedHashMap<>());
        return ingestor.submit(heartbeat).join();
    }

    /** Heartbeat every member; a lost worker just stops calling this */
    public void heartbeatAll() {
        members.values().forEach(h -> ingestor.submit(h).join());
    }

    public void heartbeat(String workerId) {
        Heartbeat heartbeat = members.get(workerId);
        if (heartbeat == null) {
            throw new IllegalArgumentException("Unknown simulated worker: " + workerId);
        }
        ingestor.submit(heartbeat).join();
    }

    /** Refuse further assignments to this worker, as if its endpoint were down */
    public void setUnreachable(String workerId, boolean down) {
        if (down) {
            unreachable.add(workerId);
        } else {
            unreachable.remove(workerId);
        }
    }

    /** Builds of this project (name@target) will report FAILED */
    public void failProject(String projectRef) {
        failingProjects.add(projectRef);
    }

    @Override
    public void assign(Worker worker, JobAssignment assignment) {
        if (unreachable.contains(worker.id())) {
            throw new WorkerUnreachableException("Simulated worker " + worker.id() + " is unreachable");
        }
        received.add(assignment);
        synchronized (held) {
            held.computeIfAbsent(worker.id(), k -> new LinkedHashMap<>()).put(assignment.jobId(), assignment);
        }
        log.debug("Simulated worker {} accepted job {} ({})", worker.id(), assignment.jobId(), assignment.projectRef());
    }

    @Override
    public void abort(Worker worker, String jobId) {
        if (unreachable.contains(worker.id())) {
            throw new WorkerUnreachableException("Simulated worker " + worker.id() + " is unreachable");
        }
        aborts.add(jobId);
        synchronized (held) {
            Map<String, JobAssignment> jobs = held.get(worker.id());
            if (jobs != null) {
                jobs.remove(jobId);
            }
        }
    }

    /**
     * Let every reachable worker build what it holds: STARTED, then SUCCEEDED or
     * FAILED depending on {@link #failProject}.
     *
     * @return number of jobs finished
     */
    public int drain() {
        int finished = 0;
        for (String workerId : new ArrayList<>(held.keySet())) {
            if (unreachable.contains(workerId)) {
                continue;
            }
            for (JobAssignment assignment : heldBy(workerId)) {
                report(workerId, assignment.jobId(), ReportKind.STARTED, null);
                if (failingProjects.contains(assignment.projectRef())) {
                    report(workerId, assignment.jobId(), ReportKind.FAILED, "simulated build failure");
                } else {
                    report(workerId, assignment.jobId(), ReportKind.SUCCEEDED, null);
                }
                release(workerId, assignment.jobId());
                finished++;
            }
        }
        return finished;
    }

    /**
     * Send one report for a job as the given worker and wait for the outcome.
     * The job leaves the worker's hands on SUCCEEDED, FAILED and ABORTED.
     */
    public ReportOutcome report(String workerId, String jobId, ReportKind kind, String reason) {
        ReportOutcome outcome = ingestor.submit(new JobReport(jobId, workerId, kind, reason)).join();
        if (kind == ReportKind.SUCCEEDED || kind == ReportKind.FAILED || kind == ReportKind.ABORTED) {
            release(workerId, jobId);
        }
        return outcome;
    }

    /** Assignments a worker currently holds, in arrival order */
    public List<JobAssignment> heldBy(String workerId) {
        synchronized (held) {
            Map<String, JobAssignment> jobs = held.get(workerId);
            return jobs == null ? List.of() : List.copyOf(jobs.values());
        }
    }

    /** Every assignment ever accepted, in arrival order */
    public List<JobAssignment> received() {
        return List.copyOf(received);
    }

    /** Job ids of every abort delivered */
    public List<String> aborts() {
        return List.copyOf(aborts);
    }

    private void release(String workerId, String jobId) {
        synchronized (held) {
            Map<String, JobAssignment> jobs = held.get(workerId);
            if (jobs != null) {
                jobs.remove(jobId);
            }
        }
    }
}
