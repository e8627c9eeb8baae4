package bldr.jobsrv.service;

import bldr.jobsrv.config.JobServerConfig;
import bldr.jobsrv.dispatch.WorkerClient;
import bldr.jobsrv.dispatch.WorkerUnreachableException;
import bldr.jobsrv.graph.BuildGraph;
import bldr.jobsrv.graph.GraphBuilder;
import bldr.jobsrv.graph.ProjectSpec;
import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobGroup;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.repository.JobStore;
import bldr.jobsrv.scheduler.BuildScheduler;
import bldr.jobsrv.scheduler.CancelOutcome;
import bldr.jobsrv.scheduler.GroupStates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Business logic for build groups.
 * Handles submission, status queries and cancellation.
 */
public class GroupService {

    private static final Logger log = LoggerFactory.getLogger(GroupService.class);

    private final JobStore store;
    private final BuildScheduler scheduler;
    private final WorkerRegistry registry;
    private final WorkerClient client;
    private final GraphBuilder graphBuilder;

    public GroupService(JobStore store, BuildScheduler scheduler, WorkerRegistry registry,
            WorkerClient client, JobServerConfig config) {
        this.store = store;
        this.scheduler = scheduler;
        this.registry = registry;
        this.client = client;
        this.graphBuilder = new GraphBuilder(config.maxRetries());
    }

    /**
     * Validate and store a new group.
     *
     * @param target   target platform of the group
     * @param projects projects to build, with their dependencies
     * @return the stored graph
     * @throws bldr.jobsrv.graph.GraphValidationException if the projects do not
     *                                                    form a valid graph;
     *                                                    nothing is stored then
     */
    public BuildGraph submit(String target, List<ProjectSpec> projects) {
        BuildGraph graph = graphBuilder.build(target, projects);
        store.createGroup(graph.group(), graph.jobs());
        scheduler.register(graph);
        log.info("Submitted group {} for {} with {} job(s), {} ready",
                graph.group().id(), target, graph.size(), graph.initiallyReady().size());
        return graph;
    }

    public Optional<JobGroup> findGroup(String groupId) {
        return store.findGroup(groupId);
    }

    public Optional<Job> findJob(String jobId) {
        return store.findJob(jobId);
    }

    /**
     * Group with its jobs, root-cause failures and per-state counts.
     */
    public Optional<GroupStatus> groupStatus(String groupId) {
        return store.snapshot(groupId).map(snapshot -> {
            List<Job> jobs = List.copyOf(snapshot.jobs());
            return new GroupStatus(snapshot.group(), jobs,
                    GroupStates.rootCauses(jobs), GroupStates.countByState(jobs));
        });
    }

    public List<JobGroup> recentGroups(int limit) {
        return store.findRecentGroups(limit);
    }

    /**
     * Cancel a group. Workers of jobs that were dispatched or running get a
     * best-effort abort once the cancellation is stored.
     */
    public CancelOutcome cancel(String groupId) {
        CancelOutcome outcome = scheduler.cancel(groupId);
        for (Job job : outcome.aborted()) {
            abort(job);
        }
        return outcome;
    }

    private void abort(Job job) {
        Optional<Worker> worker = registry.find(job.workerId());
        if (worker.isEmpty()) {
            return;
        }
        try {
            client.abort(worker.get(), job.id());
        } catch (WorkerUnreachableException e) {
            log.warn("Abort of job {} on worker {} not delivered: {}", job.id(), job.workerId(), e.getMessage());
        }
    }
}
