package bldr.jobsrv.service;

import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobGroup;
import bldr.jobsrv.model.JobState;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of a group.
 *
 * @param group      the group row
 * @param jobs       member jobs in submission order
 * @param rootCauses jobs that failed on their own (not cascade victims)
 * @param counts     number of jobs per state, every state present
 */
public record GroupStatus(JobGroup group, List<Job> jobs, List<Job> rootCauses, Map<JobState, Integer> counts) {
}
