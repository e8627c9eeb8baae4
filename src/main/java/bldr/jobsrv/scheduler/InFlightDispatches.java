package bldr.jobsrv.scheduler;

import bldr.jobsrv.model.JobReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Assignments handed to a worker but not yet recorded as DISPATCHED.
 *
 * <p>
 * A fast worker can report on a job before its dispatch is recorded. Such
 * reports are held on the entry and handed back when the entry ends, so the
 * caller can replay them against the recorded job or drop them if the dispatch
 * never landed.
 */
final class InFlightDispatches {

    private final Map<String, Entry> byJob = new ConcurrentHashMap<>();

    static final class Entry {
        private final String workerId;
        private final List<JobReport> held = new ArrayList<>();
        private boolean ended = false;

        private Entry(String workerId) {
            this.workerId = workerId;
        }

        String workerId() {
            return workerId;
        }

        /**
         * @return false once the entry has ended; the caller must re-read the job
         */
        synchronized boolean hold(JobReport report) {
            if (ended) {
                return false;
            }
            held.add(report);
            return true;
        }

        private synchronized List<JobReport> end() {
            ended = true;
            List<JobReport> out = List.copyOf(held);
            held.clear();
            return out;
        }
    }

    /**
     * @return false if the job already has an assignment in flight
     */
    boolean begin(String jobId, String workerId) {
        return byJob.putIfAbsent(jobId, new Entry(workerId)) == null;
    }

    Optional<Entry> find(String jobId) {
        return Optional.ofNullable(byJob.get(jobId));
    }

    /**
     * Forget the job's in-flight assignment.
     *
     * @return reports held while it was in flight, in arrival order
     */
    List<JobReport> end(String jobId) {
        // Unmapped before ending: a report that still sees the entry either
        // lands in the returned list or is told to re-read
        Entry entry = byJob.remove(jobId);
        return entry == null ? List.of() : entry.end();
    }

    boolean contains(String jobId) {
        return byJob.containsKey(jobId);
    }

    /** In-flight assignments per worker id */
    Map<String, Integer> countByWorker() {
        return byJob.values().stream()
                .collect(Collectors.toMap(Entry::workerId, e -> 1, Integer::sum));
    }

    int size() {
        return byJob.size();
    }
}
