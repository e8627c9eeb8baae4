package bldr.jobsrv.graph;

import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobGroup;
import bldr.jobsrv.model.JobState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, immutable build graph of one submission: the new group, one job per
 * project in topological order (dependencies first) and the reverse index.
 */
public final class BuildGraph {

    private final JobGroup group;
    private final List<Job> jobs;
    private final Map<String, Job> byRef;
    private final DependencyIndex index;

    BuildGraph(JobGroup group, List<Job> jobs) {
        this.group = group;
        this.jobs = List.copyOf(jobs);
        this.byRef = new LinkedHashMap<>();
        for (Job job : jobs) {
            byRef.put(job.project().ref(), job);
        }
        this.index = DependencyIndex.of(jobs);
    }

    public JobGroup group() {
        return group;
    }

    /** Jobs in topological order */
    public List<Job> jobs() {
        return jobs;
    }

    public Optional<Job> jobFor(String projectRef) {
        return Optional.ofNullable(byRef.get(projectRef));
    }

    public DependencyIndex index() {
        return index;
    }

    /** Jobs that are dispatchable immediately */
    public List<Job> initiallyReady() {
        return jobs.stream().filter(j -> j.state() == JobState.READY).toList();
    }

    public int size() {
        return jobs.size();
    }
}
