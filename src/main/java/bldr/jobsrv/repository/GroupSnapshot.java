package bldr.jobsrv.repository;

import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobGroup;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Consistent read of one group and all of its jobs, taken in one transaction.
 * The group's version identifies the state the snapshot reflects.
 */
public final class GroupSnapshot {

    private final JobGroup group;
    private final Map<String, Job> jobs;

    public GroupSnapshot(JobGroup group, List<Job> jobs) {
        this.group = group;
        Map<String, Job> byId = new LinkedHashMap<>();
        for (Job job : jobs) {
            byId.put(job.id(), job);
        }
        this.jobs = Collections.unmodifiableMap(byId);
    }

    public JobGroup group() {
        return group;
    }

    public long version() {
        return group.version();
    }

    public Collection<Job> jobs() {
        return jobs.values();
    }

    public Optional<Job> job(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }
}
