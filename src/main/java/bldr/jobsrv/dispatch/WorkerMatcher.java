package bldr.jobsrv.dispatch;

import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.Worker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure matching of READY jobs to workers.
 *
 * <p>
 * A worker fits a job when it is alive, not suspect, below capacity and its
 * tags cover every tag the job requires. Among fitting workers the one with the
 * most spare capacity wins; ties go to the worker idle longest, then to the
 * lowest id. Load is tracked tentatively across the pass so one call never
 * overbooks a worker.
 */
public class WorkerMatcher {

    /** One job paired with the worker chosen for it */
    public record Assignment(Job job, Worker worker) {
    }

    private static final Comparator<Slot> PREFERENCE = Comparator
            .comparingInt(Slot::spare).reversed()
            .thenComparing(Slot::idleSince)
            .thenComparing(s -> s.worker.id());

    /**
     * @param readyJobs        jobs in dispatch order (oldest first)
     * @param availableWorkers candidate workers
     * @return assignments in job order; unmatched jobs are left out
     */
    public List<Assignment> assign(List<Job> readyJobs, List<Worker> availableWorkers) {
        return assign(readyJobs, availableWorkers, Instant.now());
    }

    List<Assignment> assign(List<Job> readyJobs, List<Worker> availableWorkers, Instant now) {
        Map<String, Slot> slots = new HashMap<>();
        for (Worker worker : availableWorkers) {
            if (worker.isAvailable()) {
                slots.put(worker.id(), new Slot(worker));
            }
        }

        List<Assignment> assignments = new ArrayList<>();
        for (Job job : readyJobs) {
            Slot best = null;
            for (Slot slot : slots.values()) {
                if (slot.spare() > 0 && slot.worker.supports(job.requiredTags())
                        && (best == null || PREFERENCE.compare(slot, best) < 0)) {
                    best = slot;
                }
            }
            if (best != null) {
                best.load++;
                best.idleSince = now;
                assignments.add(new Assignment(job, best.worker));
            }
        }
        return assignments;
    }

    private static final class Slot {
        final Worker worker;
        int load;
        Instant idleSince;

        Slot(Worker worker) {
            this.worker = worker;
            this.load = worker.activeJobs();
            // Never-assigned workers count as idle since registration
            Instant since = worker.idleSince() != null ? worker.idleSince() : worker.registeredAt();
            this.idleSince = since != null ? since : Instant.EPOCH;
        }

        int spare() {
            return worker.capacity() - load;
        }

        Instant idleSince() {
            return idleSince;
        }
    }
}
