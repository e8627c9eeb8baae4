package bldr.jobsrv.scheduler;

import bldr.jobsrv.graph.BuildGraph;
import bldr.jobsrv.graph.GraphBuilder;
import bldr.jobsrv.graph.ProjectSpec;
import bldr.jobsrv.model.GroupState;
import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobState;
import bldr.jobsrv.repository.GroupSnapshot;
import bldr.jobsrv.repository.JobTransition;
import bldr.jobsrv.repository.TransitionBatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Planner tests on an in-memory diamond: app -> (lib, tools) -> zlib.
 */
class TransitionPlannerTest {

    private static final String T = "x86_64-linux";

    private BuildGraph graph;
    private Map<String, Job> jobs;

    @BeforeEach
    void buildDiamond() {
        graph = new GraphBuilder(1).build(T, List.of(
                ProjectSpec.of("app", "lib", "tools"),
                ProjectSpec.of("lib", "zlib"),
                ProjectSpec.of("tools", "zlib"),
                ProjectSpec.of("zlib")));
        jobs = new HashMap<>();
        graph.jobs().forEach(j -> jobs.put(j.project().name(), j));
    }

    private void set(String name, UnaryOperator<Job.Builder> change) {
        jobs.put(name, change.apply(jobs.get(name).toBuilder()).build());
    }

    private void assign(String name, String workerId, JobState state) {
        set(name, b -> b.state(state).workerId(workerId).dispatchedAt(Instant.now()));
    }

    private TransitionPlanner planner() {
        List<Job> current = new ArrayList<>();
        graph.jobs().forEach(j -> current.add(jobs.get(j.project().name())));
        return new TransitionPlanner(new GroupSnapshot(graph.group(), current), graph.index(), Instant.now());
    }

    private String id(String name) {
        return jobs.get(name).id();
    }

    @Test
    void startMovesDispatchedToRunningOnce() {
        assign("zlib", "w1", JobState.DISPATCHED);
        TransitionPlanner p = planner();

        assertTrue(p.start(id("zlib")));
        assertEquals(JobState.RUNNING, p.job(id("zlib")).state());
        assertNotNull(p.job(id("zlib")).startedAt());
        assertFalse(p.start(id("zlib")));
    }

    @Test
    void successPromotesOnlyDependentsWithAllDependenciesComplete() {
        assign("zlib", "w1", JobState.RUNNING);
        TransitionPlanner p = planner();

        assertTrue(p.succeed(id("zlib")));

        assertEquals(JobState.COMPLETE, p.job(id("zlib")).state());
        assertEquals(JobState.READY, p.job(id("lib")).state());
        assertEquals(JobState.READY, p.job(id("tools")).state());
        assertEquals(JobState.PENDING, p.job(id("app")).state());

        TransitionBatch batch = p.finish().build();
        assertEquals(3, batch.transitions().size());
        assertEquals(1, batch.workers().size());
        assertEquals(-1, batch.workers().get(0).loadDelta());
    }

    @Test
    void lastDependencyPromotesTheJoin() {
        set("zlib", b -> b.state(JobState.COMPLETE));
        set("tools", b -> b.state(JobState.COMPLETE));
        assign("lib", "w1", JobState.RUNNING);
        TransitionPlanner p = planner();

        p.succeed(id("lib"));

        assertEquals(JobState.READY, p.job(id("app")).state());
        assertEquals(GroupState.QUEUED, p.derivedState());
    }

    @Test
    void failureCascadesToEveryTransitiveDependent() {
        assign("zlib", "w1", JobState.RUNNING);
        TransitionPlanner p = planner();

        assertTrue(p.fail(id("zlib"), "compile error"));

        assertEquals(JobState.FAILED, p.job(id("zlib")).state());
        assertEquals("compile error", p.job(id("zlib")).failureReason());
        for (String name : List.of("lib", "tools", "app")) {
            assertEquals(JobState.DEPENDENCY_FAILED, p.job(id(name)).state(), name);
            assertEquals("dependency zlib@" + T + " failed", p.job(id(name)).failureReason());
        }
        assertEquals(GroupState.FAILED, p.derivedState());

        TransitionBatch batch = p.finish().build();
        TransitionBatch.GroupUpdate group = batch.groups().iterator().next();
        assertEquals(GroupState.FAILED, group.newState());
        assertEquals(Long.valueOf(graph.group().version()), group.expectedVersion());
    }

    @Test
    void groupStaysQueuedWhileASiblingStillRuns() {
        set("zlib", b -> b.state(JobState.COMPLETE));
        assign("lib", "w1", JobState.RUNNING);
        assign("tools", "w2", JobState.RUNNING);
        TransitionPlanner p = planner();

        p.fail(id("lib"), "boom");

        assertEquals(JobState.DEPENDENCY_FAILED, p.job(id("app")).state());
        assertEquals(JobState.RUNNING, p.job(id("tools")).state());
        assertEquals(GroupState.QUEUED, p.derivedState());
    }

    @Test
    void lostJobWithBudgetIsRequeuedStraightToReady() {
        assign("zlib", "w1", JobState.RUNNING);
        TransitionPlanner p = planner();

        assertTrue(p.lose(id("zlib"), "worker w1 lost", false));

        Job requeued = p.job(id("zlib"));
        assertEquals(JobState.READY, requeued.state());
        assertNull(requeued.workerId());
        assertEquals(1, requeued.retryCount());
        assertNull(requeued.dispatchedAt());

        TransitionBatch batch = p.finish().build();
        List<JobState> path = batch.transitions().stream().map(JobTransition::to).toList();
        assertEquals(List.of(JobState.PENDING, JobState.READY), path);
        assertTrue(batch.workers().isEmpty());
    }

    @Test
    void lostJobWithoutBudgetFailsAndCascades() {
        assign("zlib", "w1", JobState.DISPATCHED);
        set("zlib", b -> b.retryCount(1));
        TransitionPlanner p = planner();

        p.lose(id("zlib"), "timed out", true);

        assertEquals(JobState.FAILED, p.job(id("zlib")).state());
        assertTrue(p.job(id("zlib")).failureReason().contains("retry budget of 1 exhausted"));
        assertEquals(JobState.DEPENDENCY_FAILED, p.job(id("app")).state());
        assertEquals(-1, p.finish().build().workers().get(0).loadDelta());
    }

    @Test
    void reportsOnUnassignedJobsAreNoOps() {
        TransitionPlanner p = planner();

        assertFalse(p.succeed(id("zlib")));
        assertFalse(p.fail(id("zlib"), "x"));
        assertFalse(p.lose(id("zlib"), "x", true));
        assertFalse(p.start("no-such-job"));
        assertFalse(p.hasChanges());
    }

    @Test
    void cancelStopsEverythingAndCollectsAbortTargets() {
        assign("zlib", "w1", JobState.RUNNING);
        TransitionPlanner p = planner();

        assertTrue(p.cancel());

        for (Job job : graph.jobs()) {
            assertEquals(JobState.CANCELED, p.job(job.id()).state());
        }
        assertEquals(List.of(id("zlib")), p.abortTargets().stream().map(Job::id).toList());
        assertEquals(GroupState.CANCELED, p.derivedState());

        TransitionBatch batch = p.finish().build();
        TransitionBatch.GroupUpdate group = batch.groups().iterator().next();
        assertTrue(group.requestCancel());
        assertEquals(GroupState.CANCELED, group.newState());
    }

    @Test
    void settlePromotesAndCascadesLeftovers() {
        set("zlib", b -> b.state(JobState.COMPLETE));
        set("lib", b -> b.state(JobState.FAILED));
        TransitionPlanner p = planner();

        assertTrue(p.settle());

        assertEquals(JobState.READY, p.job(id("tools")).state());
        assertEquals(JobState.DEPENDENCY_FAILED, p.job(id("app")).state());
    }

    @Test
    void settleOnConsistentGroupChangesNothing() {
        TransitionPlanner p = planner();

        assertFalse(p.settle());
        p.finish();
        assertFalse(p.hasChanges());
    }
}
