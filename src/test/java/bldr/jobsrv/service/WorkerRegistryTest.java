package bldr.jobsrv.service;

import bldr.jobsrv.config.JobServerConfig;
import bldr.jobsrv.graph.BuildGraph;
import bldr.jobsrv.graph.GraphBuilder;
import bldr.jobsrv.graph.ProjectSpec;
import bldr.jobsrv.model.Heartbeat;
import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobState;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.model.WorkerStatus;
import bldr.jobsrv.scheduler.BuildScheduler;
import bldr.jobsrv.store.Database;
import bldr.jobsrv.store.JdbcJobStore;
import bldr.jobsrv.store.JdbcWorkerRepository;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WorkerRegistryTest {

    private static final String T = "x86_64-linux";

    private static Database db;
    private static JdbcJobStore store;
    private static JdbcWorkerRepository workers;
    private static JobServerConfig config;

    private BuildScheduler scheduler;
    private WorkerRegistry registry;

    @BeforeAll
    static void setup() {
        config = JobServerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-registry;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
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
        scheduler = new BuildScheduler(store, workers, config);
        registry = new WorkerRegistry(workers, scheduler, config);
    }

    private static Heartbeat beat(String id, int capacity) {
        return new Heartbeat(id, capacity, Set.of(T), "http://" + id);
    }

    @Test
    void heartbeatRejectsZeroCapacity() {
        assertThrows(IllegalArgumentException.class, () -> registry.heartbeat(beat("w1", 0)));
        assertTrue(registry.find("w1").isEmpty());
    }

    @Test
    void heartbeatRegistersAndLists() {
        registry.heartbeat(beat("w2", 1));
        registry.heartbeat(beat("w1", 2));

        assertEquals(List.of("w1", "w2"), registry.list().stream().map(Worker::id).toList());
        assertEquals(2, registry.countAlive());
        assertEquals(2, registry.find("w1").orElseThrow().capacity());
    }

    @Test
    void availableLeavesOutSuspectAndFullWorkers() {
        registry.heartbeat(beat("free", 1));
        registry.heartbeat(beat("suspect", 1));
        registry.heartbeat(beat("full", 1));
        registry.flagSuspect("suspect");

        BuildGraph graph = new GraphBuilder(3).build(T, List.of(ProjectSpec.of("lib")));
        store.createGroup(graph.group(), graph.jobs());
        assertTrue(scheduler.recordDispatch(graph.jobs().get(0), registry.find("full").orElseThrow()));

        assertEquals(List.of("free"), registry.available().stream().map(Worker::id).toList());
    }

    @Test
    void sweepTakesJobsBackFromLapsedWorkers() {
        Instant now = Instant.now();
        registry.heartbeat(beat("gone", 2), now.minus(config.workerHeartbeatTimeout()).minusSeconds(5));
        registry.heartbeat(beat("fresh", 2), now);

        BuildGraph graph = new GraphBuilder(3).build(T, List.of(ProjectSpec.of("lib")));
        store.createGroup(graph.group(), graph.jobs());
        Job lib = graph.jobs().get(0);
        assertTrue(scheduler.recordDispatch(lib, registry.find("gone").orElseThrow()));

        assertEquals(1, registry.sweep(now));

        assertEquals(WorkerStatus.DEAD, registry.find("gone").orElseThrow().status());
        assertEquals(WorkerStatus.ALIVE, registry.find("fresh").orElseThrow().status());
        Job requeued = store.findJob(lib.id()).orElseThrow();
        assertEquals(JobState.READY, requeued.state());
        assertEquals(1, requeued.retryCount());

        assertEquals(0, registry.sweep(now));
    }

    @Test
    void deadWorkerRejoinsOnHeartbeat() {
        Instant now = Instant.now();
        registry.heartbeat(beat("w1", 2), now.minusSeconds(600));
        registry.sweep(now);
        assertEquals(0, registry.countAlive());

        Worker back = registry.heartbeat(beat("w1", 2));

        assertEquals(WorkerStatus.ALIVE, back.status());
        assertEquals(List.of("w1"), registry.available().stream().map(Worker::id).toList());
    }

    @Test
    void flaggingUnknownWorkerIsFalse() {
        assertFalse(registry.flagSuspect("ghost"));
    }
}
