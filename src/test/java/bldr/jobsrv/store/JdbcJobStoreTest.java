package bldr.jobsrv.store;

import bldr.jobsrv.config.JobServerConfig;
import bldr.jobsrv.graph.BuildGraph;
import bldr.jobsrv.graph.GraphBuilder;
import bldr.jobsrv.graph.ProjectSpec;
import bldr.jobsrv.model.GroupState;
import bldr.jobsrv.model.Heartbeat;
import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobGroup;
import bldr.jobsrv.model.JobState;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.model.WorkerStatus;
import bldr.jobsrv.repository.GroupSnapshot;
import bldr.jobsrv.repository.JobTransition;
import bldr.jobsrv.repository.TransitionBatch;
import bldr.jobsrv.repository.TransitionConflictException;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobStoreTest {

    private static final String T = "x86_64-linux";

    private static Database db;
    private static JdbcJobStore store;
    private static JdbcWorkerRepository workers;

    @BeforeAll
    static void setup() {
        JobServerConfig config = JobServerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-jobstore;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        store = new JdbcJobStore(db);
        workers = new JdbcWorkerRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM job_dependencies");
            st.execute("DELETE FROM jobs");
            st.execute("DELETE FROM job_groups");
            st.execute("DELETE FROM workers");
            conn.commit();
        }
    }

    private BuildGraph storeChain() {
        BuildGraph graph = new GraphBuilder(2).build(T, List.of(
                new ProjectSpec("app", null, List.of("lib"), "inputs/app", Set.of("docker")),
                ProjectSpec.of("lib")));
        store.createGroup(graph.group(), graph.jobs());
        return graph;
    }

    private Job job(BuildGraph graph, String name) {
        return store.findJob(graph.jobFor(name + "@" + T).orElseThrow().id()).orElseThrow();
    }

    private Worker worker(String id, int capacity) {
        return workers.heartbeat(new Heartbeat(id, capacity, Set.of(T), "http://" + id), Instant.now());
    }

    private static TransitionBatch dispatch(Job job, String workerId) {
        Job after = job.toBuilder().state(JobState.DISPATCHED).workerId(workerId).dispatchedAt(Instant.now()).build();
        return TransitionBatch.builder()
                .transition(new JobTransition(job, after))
                .adjustLoad(workerId, 1)
                .build();
    }

    @Test
    void createGroupStoresJobsAndDependencies() {
        BuildGraph graph = storeChain();

        JobGroup group = store.findGroup(graph.group().id()).orElseThrow();
        assertEquals(GroupState.QUEUED, group.state());
        assertEquals(T, group.target());
        assertEquals(0, group.version());
        assertEquals(graph.group().jobIds(), group.jobIds());

        Job app = job(graph, "app");
        Job lib = job(graph, "lib");
        assertEquals(JobState.PENDING, app.state());
        assertEquals(List.of(lib.id()), app.dependencies());
        assertEquals(Set.of(T, "docker"), app.requiredTags());
        assertEquals("inputs/app", app.inputsRef());
        assertEquals(2, app.maxRetries());
        assertEquals(JobState.READY, lib.state());
    }

    @Test
    void snapshotHoldsJobsInSubmissionOrder() {
        BuildGraph graph = storeChain();

        GroupSnapshot snapshot = store.snapshot(graph.group().id()).orElseThrow();

        assertEquals(0, snapshot.version());
        assertEquals(graph.jobs().stream().map(Job::id).toList(),
                snapshot.jobs().stream().map(Job::id).toList());
        assertTrue(store.snapshot("missing").isEmpty());
    }

    @Test
    void readyJobsComeOldestFirst() throws InterruptedException {
        BuildGraph first = storeChain();
        Thread.sleep(5);
        BuildGraph second = storeChain();

        List<Job> ready = store.findReadyJobs(10);

        assertEquals(2, ready.size());
        assertEquals(first.jobFor("lib@" + T).orElseThrow().id(), ready.get(0).id());
        assertEquals(second.jobFor("lib@" + T).orElseThrow().id(), ready.get(1).id());
        assertEquals(1, store.findReadyJobs(1).size());
    }

    @Test
    void applyMovesJobAndWorkerLoadAndBumpsVersion() {
        BuildGraph graph = storeChain();
        worker("w1", 2);

        store.apply(dispatch(job(graph, "lib"), "w1"));

        Job lib = job(graph, "lib");
        assertEquals(JobState.DISPATCHED, lib.state());
        assertEquals("w1", lib.workerId());
        assertNotNull(lib.dispatchedAt());
        assertEquals(1, workers.findById("w1").orElseThrow().activeJobs());
        assertEquals(1, store.findGroup(graph.group().id()).orElseThrow().version());
        assertEquals(List.of(lib.id()), store.findJobsAssignedTo("w1").stream().map(Job::id).toList());
    }

    @Test
    void staleJobStateRollsBackWholeBatch() {
        BuildGraph graph = storeChain();
        worker("w1", 2);
        Job lib = job(graph, "lib");
        store.apply(dispatch(lib, "w1"));

        // Same READY -> DISPATCHED again: the job is no longer READY
        assertThrows(TransitionConflictException.class, () -> store.apply(dispatch(lib, "w1")));

        assertEquals(1, workers.findById("w1").orElseThrow().activeJobs());
        assertEquals(1, store.findGroup(graph.group().id()).orElseThrow().version());
    }

    @Test
    void versionMismatchIsAConflict() {
        BuildGraph graph = storeChain();
        worker("w1", 1);
        GroupSnapshot before = store.snapshot(graph.group().id()).orElseThrow();
        store.apply(dispatch(job(graph, "lib"), "w1"));

        TransitionBatch stale = TransitionBatch.builder()
                .expectVersion(graph.group().id(), before.version())
                .requestCancel(graph.group().id())
                .build();

        assertThrows(TransitionConflictException.class, () -> store.apply(stale));
        assertFalse(store.findGroup(graph.group().id()).orElseThrow().cancelRequested());
    }

    @Test
    void capacityGuardRefusesOverbooking() {
        BuildGraph a = storeChain();
        BuildGraph b = storeChain();
        worker("w1", 1);
        store.apply(dispatch(job(a, "lib"), "w1"));

        assertThrows(TransitionConflictException.class, () -> store.apply(dispatch(job(b, "lib"), "w1")));

        assertEquals(JobState.READY, job(b, "lib").state());
        assertEquals(1, workers.findById("w1").orElseThrow().activeJobs());
    }

    @Test
    void deadWorkerCannotTakeJobs() {
        BuildGraph graph = storeChain();
        Worker w = workers.heartbeat(new Heartbeat("w1", 2, Set.of(T), "http://w1"), Instant.now().minusSeconds(60));
        store.apply(TransitionBatch.builder().markWorkerDead("w1", Instant.now(), w.activeJobs()).build());

        assertEquals(WorkerStatus.DEAD, workers.findById("w1").orElseThrow().status());
        assertThrows(TransitionConflictException.class, () -> store.apply(dispatch(job(graph, "lib"), "w1")));
    }

    @Test
    void markDeadRequiresUnchangedHeartbeatAndLoad() {
        BuildGraph graph = storeChain();
        workers.heartbeat(new Heartbeat("w1", 2, Set.of(T), "http://w1"), Instant.now().minusSeconds(60));
        store.apply(dispatch(job(graph, "lib"), "w1"));

        // Planned with load 0, but a dispatch landed meanwhile
        TransitionBatch stale = TransitionBatch.builder().markWorkerDead("w1", Instant.now(), 0).build();
        assertThrows(TransitionConflictException.class, () -> store.apply(stale));

        // Fresh heartbeat after the cutoff
        worker("w1", 2);
        TransitionBatch late = TransitionBatch.builder().markWorkerDead("w1", Instant.now().minusSeconds(30), 1).build();
        assertThrows(TransitionConflictException.class, () -> store.apply(late));

        assertEquals(WorkerStatus.ALIVE, workers.findById("w1").orElseThrow().status());
    }

    @Test
    void terminalGroupStateStampsCompletion() {
        BuildGraph graph = storeChain();
        GroupSnapshot snapshot = store.snapshot(graph.group().id()).orElseThrow();

        TransitionBatch.Builder batch = TransitionBatch.builder().expectVersion(graph.group().id(), snapshot.version());
        for (Job job : snapshot.jobs()) {
            batch.transition(new JobTransition(job, job.toBuilder().state(JobState.CANCELED).build()));
        }
        batch.requestCancel(graph.group().id()).groupState(graph.group().id(), GroupState.CANCELED);
        store.apply(batch.build());

        JobGroup group = store.findGroup(graph.group().id()).orElseThrow();
        assertEquals(GroupState.CANCELED, group.state());
        assertTrue(group.cancelRequested());
        assertNotNull(group.completedAt());
        assertTrue(store.findActiveGroupIds().isEmpty());
    }

    @Test
    void overdueJobsAreFoundByDispatchTime() {
        BuildGraph graph = storeChain();
        worker("w1", 1);
        store.apply(dispatch(job(graph, "lib"), "w1"));

        assertTrue(store.findOverdueJobs(Instant.now().minusSeconds(60)).isEmpty());
        assertEquals(1, store.findOverdueJobs(Instant.now().plusSeconds(1)).size());
    }

    @Test
    void recentGroupsNewestFirst() throws InterruptedException {
        BuildGraph first = storeChain();
        Thread.sleep(5);
        BuildGraph second = storeChain();

        List<JobGroup> recent = store.findRecentGroups(10);

        assertEquals(List.of(second.group().id(), first.group().id()), recent.stream().map(JobGroup::id).toList());
        assertEquals(2, recent.get(0).jobIds().size());
    }

    @Test
    void missingJobIsEmpty() {
        Optional<Job> job = store.findJob("nope");
        assertTrue(job.isEmpty());
        assertTrue(store.findJobsByGroup("nope").isEmpty());
    }
}
