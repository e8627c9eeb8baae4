package bldr.jobsrv.integration;

import bldr.jobsrv.config.Dependencies;
import bldr.jobsrv.config.JobServerConfig;
import bldr.jobsrv.dispatch.DispatchResult;
import bldr.jobsrv.graph.BuildGraph;
import bldr.jobsrv.graph.ProjectSpec;
import bldr.jobsrv.model.GroupState;
import bldr.jobsrv.model.Heartbeat;
import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobState;
import bldr.jobsrv.model.ReportKind;
import bldr.jobsrv.model.ReportOutcome;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.model.WorkerStatus;
import bldr.jobsrv.scheduler.CancelOutcome;
import bldr.jobsrv.simulation.SimulatedWorkerFleet;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs through submission, dispatch, worker reports and liveness,
 * with an in-process worker fleet stepped by hand.
 */
class FullFlowIntegrationTest {

    private static final String T = "x86_64-linux";

    private Dependencies deps;
    private SimulatedWorkerFleet fleet;

    @BeforeEach
    void setup() {
        JobServerConfig config = JobServerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:flow-" + UUID.randomUUID()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        deps = Dependencies.create(config, SimulatedWorkerFleet::new);
        fleet = (SimulatedWorkerFleet) deps.workerClient();
    }

    @AfterEach
    void teardown() {
        deps.close();
    }

    private BuildGraph submit(ProjectSpec... projects) {
        return deps.groupService().submit(T, List.of(projects));
    }

    private Job job(BuildGraph graph, String name) {
        return deps.groupService().findJob(graph.jobFor(name + "@" + T).orElseThrow().id()).orElseThrow();
    }

    private GroupState groupState(BuildGraph graph) {
        return deps.groupService().findGroup(graph.group().id()).orElseThrow().state();
    }

    private DispatchResult dispatch() {
        DispatchResult result = deps.dispatcher().dispatchPass();
        for (Worker worker : deps.workerRegistry().list()) {
            assertTrue(worker.activeJobs() <= worker.capacity(), "worker " + worker.id() + " overbooked");
        }
        return result;
    }

    /** Dispatch and drain until the group is terminal */
    private void runToEnd(BuildGraph graph, int maxRounds) {
        for (int round = 0; round < maxRounds; round++) {
            if (deps.groupService().findGroup(graph.group().id()).orElseThrow().isTerminal()) {
                return;
            }
            dispatch();
            fleet.drain();
        }
        fail("group " + graph.group().id() + " still " + groupState(graph) + " after " + maxRounds + " rounds");
    }

    @Test
    @DisplayName("Scenario A: dependency completes, dependent is dispatched and the group completes")
    void chainCompletes() {
        fleet.addWorker("w1", 2, T);
        BuildGraph graph = submit(ProjectSpec.of("a", "b"), ProjectSpec.of("b"));

        assertEquals(JobState.PENDING, job(graph, "a").state());
        assertEquals(1, dispatch().dispatched());
        assertEquals(JobState.DISPATCHED, job(graph, "b").state());
        assertEquals(JobState.PENDING, job(graph, "a").state());

        assertEquals(1, fleet.drain());
        assertEquals(JobState.COMPLETE, job(graph, "b").state());
        assertEquals(JobState.READY, job(graph, "a").state());

        assertEquals(1, dispatch().dispatched());
        assertEquals(1, fleet.drain());

        assertEquals(JobState.COMPLETE, job(graph, "a").state());
        assertEquals(GroupState.COMPLETE, groupState(graph));
        assertEquals(0, deps.workerRegistry().find("w1").orElseThrow().activeJobs());
        assertEquals(List.of("b@" + T, "a@" + T),
                fleet.received().stream().map(a -> a.projectRef()).toList());
    }

    @Test
    @DisplayName("Scenario B: failed dependency fails its dependent without dispatching it")
    void failureCascades() {
        fleet.addWorker("w1", 2, T);
        fleet.failProject("b@" + T);
        BuildGraph graph = submit(ProjectSpec.of("a", "b"), ProjectSpec.of("b"));

        dispatch();
        fleet.drain();

        Job a = job(graph, "a");
        assertEquals(JobState.FAILED, job(graph, "b").state());
        assertEquals("simulated build failure", job(graph, "b").failureReason());
        assertEquals(JobState.DEPENDENCY_FAILED, a.state());
        assertNull(a.dispatchedAt());
        assertEquals(GroupState.FAILED, groupState(graph));
        assertEquals(1, fleet.received().size());

        var status = deps.groupService().groupStatus(graph.group().id()).orElseThrow();
        assertEquals(List.of(job(graph, "b").id()), status.rootCauses().stream().map(Job::id).toList());
    }

    @Test
    @DisplayName("Scenario C: job of a lost worker is requeued and completes on another worker")
    void lostWorkerJobMovesOn() {
        Instant now = Instant.now();
        // w1 was last heard from a minute ago
        deps.workerRegistry().heartbeat(new Heartbeat("w1", 1, Set.of(T), "sim://w1"), now.minusSeconds(60));
        BuildGraph graph = submit(ProjectSpec.of("c"));

        dispatch();
        assertEquals("w1", job(graph, "c").workerId());

        fleet.setUnreachable("w1", true);
        fleet.addWorker("w2", 1, T);
        assertEquals(1, deps.workerRegistry().sweep(Instant.now()));

        Job requeued = job(graph, "c");
        assertEquals(JobState.READY, requeued.state());
        assertEquals(1, requeued.retryCount());
        assertEquals(WorkerStatus.DEAD, deps.workerRegistry().find("w1").orElseThrow().status());

        dispatch();
        assertEquals("w2", job(graph, "c").workerId());
        fleet.drain();

        assertEquals(JobState.COMPLETE, job(graph, "c").state());
        assertEquals(GroupState.COMPLETE, groupState(graph));

        // The lost worker comes back and reports the job it once held
        fleet.setUnreachable("w1", false);
        assertEquals(ReportOutcome.STALE, fleet.report("w1", requeued.id(), ReportKind.SUCCEEDED, null));
    }

    @Test
    @DisplayName("Scenario D: cancel while running cancels at once and aborts the worker")
    void cancelWhileRunning() {
        fleet.addWorker("w1", 2, T);
        BuildGraph graph = submit(ProjectSpec.of("app", "d"), ProjectSpec.of("d"));
        dispatch();
        Job d = job(graph, "d");
        assertEquals(ReportOutcome.APPLIED, fleet.report("w1", d.id(), ReportKind.STARTED, null));
        assertEquals(JobState.RUNNING, job(graph, "d").state());

        CancelOutcome outcome = deps.groupService().cancel(graph.group().id());

        assertEquals(GroupState.CANCELED, outcome.state());
        assertEquals(JobState.CANCELED, job(graph, "d").state());
        assertEquals(JobState.CANCELED, job(graph, "app").state());
        assertEquals(GroupState.CANCELED, groupState(graph));
        assertEquals(List.of(d.id()), fleet.aborts());
        assertTrue(fleet.heldBy("w1").isEmpty());
        assertEquals(0, deps.workerRegistry().find("w1").orElseThrow().activeJobs());

        // A success that was already on the wire changes nothing
        assertEquals(ReportOutcome.DUPLICATE, fleet.report("w1", d.id(), ReportKind.SUCCEEDED, null));
        assertEquals(JobState.CANCELED, job(graph, "d").state());
    }

    @Test
    @DisplayName("Random DAG builds in dependency order across several workers")
    void randomGraphCompletesInOrder() {
        fleet.addWorker("w1", 2, T);
        fleet.addWorker("w2", 3, T);
        fleet.addWorker("w3", 1, T);
        List<ProjectSpec> projects = randomDag(40, new Random(11));
        BuildGraph graph = deps.groupService().submit(T, projects);

        runToEnd(graph, 100);

        assertEquals(GroupState.COMPLETE, groupState(graph));
        Map<String, Job> byId = new HashMap<>();
        deps.groupService().groupStatus(graph.group().id()).orElseThrow().jobs().forEach(j -> byId.put(j.id(), j));
        for (Job job : byId.values()) {
            assertEquals(JobState.COMPLETE, job.state());
            for (String dep : job.dependencies()) {
                assertFalse(job.dispatchedAt().isBefore(byId.get(dep).completedAt()),
                        job.project() + " dispatched before " + byId.get(dep).project() + " completed");
            }
        }
        assertEquals(40, fleet.received().size());
    }

    @Test
    @DisplayName("Random DAG with one failing project fails exactly its dependents")
    void randomGraphFailureCascadesExactly() {
        fleet.addWorker("w1", 4, T);
        List<ProjectSpec> projects = randomDag(30, new Random(5));
        String failing = projects.get(3).name();
        fleet.failProject(failing + "@" + T);
        BuildGraph graph = deps.groupService().submit(T, projects);

        runToEnd(graph, 100);

        assertEquals(GroupState.FAILED, groupState(graph));
        Set<String> expectedVictims = dependentsOf(failing, projects);
        for (ProjectSpec spec : projects) {
            JobState state = job(graph, spec.name()).state();
            if (spec.name().equals(failing)) {
                assertEquals(JobState.FAILED, state);
            } else if (expectedVictims.contains(spec.name())) {
                assertEquals(JobState.DEPENDENCY_FAILED, state, spec.name());
            } else {
                assertEquals(JobState.COMPLETE, state, spec.name());
            }
        }
    }

    @Test
    @DisplayName("Restart settles groups and work continues")
    void restartRecovery() {
        fleet.addWorker("w1", 2, T);
        BuildGraph graph = submit(ProjectSpec.of("a", "b"), ProjectSpec.of("b"));
        dispatch();
        fleet.drain();

        assertEquals(0, deps.scheduler().recover());

        dispatch();
        fleet.drain();
        assertEquals(GroupState.COMPLETE, groupState(graph));
    }

    // p0 has no dependencies; pi depends on a few of p0..p(i-1)
    private static List<ProjectSpec> randomDag(int size, Random random) {
        List<ProjectSpec> projects = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            List<String> deps = new ArrayList<>();
            int count = i == 0 ? 0 : random.nextInt(Math.min(i, 3) + 1);
            Set<Integer> picked = new HashSet<>();
            while (picked.size() < count) {
                picked.add(random.nextInt(i));
            }
            picked.stream().sorted().forEach(d -> deps.add("p" + d));
            projects.add(ProjectSpec.of("p" + i, deps.toArray(new String[0])));
        }
        return projects;
    }

    private static Set<String> dependentsOf(String name, List<ProjectSpec> projects) {
        Set<String> victims = new HashSet<>();
        boolean grew = true;
        while (grew) {
            grew = false;
            for (ProjectSpec spec : projects) {
                if (victims.contains(spec.name())) {
                    continue;
                }
                for (String dep : spec.dependencies()) {
                    if (dep.equals(name) || victims.contains(dep)) {
                        victims.add(spec.name());
                        grew = true;
                        break;
                    }
                }
            }
        }
        return victims;
    }
}
