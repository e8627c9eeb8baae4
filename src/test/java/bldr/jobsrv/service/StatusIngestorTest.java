package bldr.jobsrv.service;

import bldr.jobsrv.config.JobServerConfig;
import bldr.jobsrv.graph.BuildGraph;
import bldr.jobsrv.graph.GraphBuilder;
import bldr.jobsrv.graph.ProjectSpec;
import bldr.jobsrv.model.Heartbeat;
import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobReport;
import bldr.jobsrv.model.JobState;
import bldr.jobsrv.model.ReportKind;
import bldr.jobsrv.model.ReportOutcome;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.scheduler.BuildScheduler;
import bldr.jobsrv.store.Database;
import bldr.jobsrv.store.JdbcJobStore;
import bldr.jobsrv.store.JdbcWorkerRepository;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class StatusIngestorTest {

    private static final String T = "x86_64-linux";

    private static Database db;
    private static JdbcJobStore store;
    private static JdbcWorkerRepository workers;
    private static JobServerConfig config;

    private BuildScheduler scheduler;
    private WorkerRegistry registry;
    private StatusIngestor ingestor;

    @BeforeAll
    static void setup() {
        config = JobServerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-ingestor;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
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
        ingestor = new StatusIngestor(scheduler, registry, config);
    }

    @AfterEach
    void closeIngestor() {
        ingestor.close();
    }

    private Job dispatchedLib(String workerId) {
        BuildGraph graph = new GraphBuilder(3).build(T, List.of(ProjectSpec.of("lib")));
        store.createGroup(graph.group(), graph.jobs());
        scheduler.register(graph);
        Job lib = graph.jobs().get(0);
        assertTrue(scheduler.recordDispatch(lib, registry.find(workerId).orElseThrow()));
        return lib;
    }

    @Test
    void heartbeatRegistersWorker() {
        Worker worker = ingestor.submit(new Heartbeat("w1", 2, Set.of(T), "http://w1")).join();

        assertEquals("w1", worker.id());
        assertTrue(registry.find("w1").isPresent());
    }

    @Test
    void reportsForOneJobApplyInArrivalOrder() {
        ingestor.submit(new Heartbeat("w1", 2, Set.of(T), "http://w1")).join();
        Job lib = dispatchedLib("w1");

        CompletableFuture<ReportOutcome> started = ingestor.submit(JobReport.of(lib.id(), "w1", ReportKind.STARTED));
        CompletableFuture<ReportOutcome> done = ingestor.submit(JobReport.of(lib.id(), "w1", ReportKind.SUCCEEDED));
        CompletableFuture<ReportOutcome> replay = ingestor.submit(JobReport.of(lib.id(), "w1", ReportKind.SUCCEEDED));

        assertEquals(ReportOutcome.APPLIED, started.join());
        assertEquals(ReportOutcome.APPLIED, done.join());
        assertEquals(ReportOutcome.DUPLICATE, replay.join());
        assertEquals(JobState.COMPLETE, store.findJob(lib.id()).orElseThrow().state());
    }

    @Test
    void sameKeyAlwaysUsesSameLane() {
        StatusIngestor wide = new StatusIngestor(scheduler, registry, JobServerConfig.defaults().withIngestLanes(3));
        try {
            assertEquals(3, wide.laneCount());
            for (String key : List.of("job-1", "job-2", "w1", "", "a-much-longer-key-than-the-others")) {
                int lane = wide.laneFor(key);
                assertTrue(lane >= 0 && lane < 3);
                assertEquals(lane, wide.laneFor(key));
            }
        } finally {
            wide.close();
        }
    }

    @Test
    void failedWorkCompletesExceptionally() {
        CompletableFuture<Worker> future = ingestor.submit(new Heartbeat("w1", 0, Set.of(), "http://w1"));

        CompletionException e = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void closedIngestorRefusesWork() {
        ingestor.close();

        CompletableFuture<ReportOutcome> future = ingestor.submit(JobReport.of("job-1", "w1", ReportKind.STARTED));

        CompletionException e = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
