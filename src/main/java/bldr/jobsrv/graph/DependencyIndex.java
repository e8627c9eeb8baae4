package bldr.jobsrv.graph;

import bldr.jobsrv.model.Job;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reverse-dependency index of one group: for every job, the jobs that depend on it.
 * Built once from the fixed dependency lists and never mutated.
 */
public final class DependencyIndex {

    private final Map<String, List<String>> dependents;

    private DependencyIndex(Map<String, List<String>> dependents) {
        this.dependents = dependents;
    }

    public static DependencyIndex of(Collection<Job> jobs) {
        Map<String, List<String>> dependents = new HashMap<>();
        for (Job job : jobs) {
            dependents.putIfAbsent(job.id(), new ArrayList<>());
            for (String dependency : job.dependencies()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(job.id());
            }
        }
        Map<String, List<String>> frozen = new HashMap<>();
        dependents.forEach((id, list) -> frozen.put(id, List.copyOf(list)));
        return new DependencyIndex(frozen);
    }

    /** Direct dependents of a job */
    public List<String> dependents(String jobId) {
        return dependents.getOrDefault(jobId, Collections.emptyList());
    }

    /**
     * All jobs that transitively depend on the given job, in breadth-first order.
     * The job itself is not included.
     */
    public Set<String> transitiveDependents(String jobId) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(dependents(jobId));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(dependents(next));
            }
        }
        return seen;
    }

    public int size() {
        return dependents.size();
    }
}
