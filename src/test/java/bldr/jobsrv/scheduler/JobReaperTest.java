package bldr.jobsrv.scheduler;

import bldr.jobsrv.config.JobServerConfig;
import bldr.jobsrv.dispatch.RecordingWorkerClient;
import bldr.jobsrv.graph.BuildGraph;
import bldr.jobsrv.graph.GraphBuilder;
import bldr.jobsrv.graph.ProjectSpec;
import bldr.jobsrv.model.GroupState;
import bldr.jobsrv.model.Heartbeat;
import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobState;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.store.Database;
import bldr.jobsrv.store.JdbcJobStore;
import bldr.jobsrv.store.JdbcWorkerRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JobReaperTest {

    private static final String T = "x86_64-linux";
    private static final Duration TIMEOUT = Duration.ofMinutes(10);

    private static Database db;
    private static JdbcJobStore store;
    private static JdbcWorkerRepository workers;
    private static JobServerConfig config;

    private BuildScheduler scheduler;
    private RecordingWorkerClient client;
    private JobReaper reaper;

    @BeforeAll
    static void setup() {
        config = JobServerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-reaper;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withJobTimeout(TIMEOUT);
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
        client = new RecordingWorkerClient();
        reaper = new JobReaper(store, workers, scheduler, client, config);
    }

    private BuildGraph submitSingle(int maxRetries) {
        BuildGraph graph = new GraphBuilder(maxRetries).build(T, List.of(ProjectSpec.of("lib")));
        store.createGroup(graph.group(), graph.jobs());
        scheduler.register(graph);
        return graph;
    }

    private Job lib(BuildGraph graph) {
        return store.findJob(graph.jobFor("lib@" + T).orElseThrow().id()).orElseThrow();
    }

    private Worker worker(String id) {
        return workers.heartbeat(new Heartbeat(id, 2, Set.of(T), "http://" + id), Instant.now());
    }

    @Test
    void nothingOverdueBeforeTimeout() {
        BuildGraph graph = submitSingle(3);
        scheduler.recordDispatch(lib(graph), worker("w1"));

        assertEquals(0, reaper.reapOverdueJobs(Instant.now()));
        assertEquals(JobState.DISPATCHED, lib(graph).state());
        assertTrue(client.aborted().isEmpty());
    }

    @Test
    void overdueJobIsRequeuedAndAborted() {
        BuildGraph graph = submitSingle(3);
        scheduler.recordDispatch(lib(graph), worker("w1"));
        String jobId = lib(graph).id();

        assertEquals(1, reaper.reapOverdueJobs(Instant.now().plus(TIMEOUT).plusSeconds(1)));

        Job requeued = lib(graph);
        assertEquals(JobState.READY, requeued.state());
        assertEquals(1, requeued.retryCount());
        assertEquals(0, workers.findById("w1").orElseThrow().activeJobs());
        assertEquals(List.of(new RecordingWorkerClient.Call("w1", jobId)), client.aborted());
    }

    @Test
    void overdueJobWithoutBudgetFails() {
        BuildGraph graph = submitSingle(0);
        scheduler.recordDispatch(lib(graph), worker("w1"));

        assertEquals(1, reaper.reapOverdueJobs(Instant.now().plus(TIMEOUT).plusSeconds(1)));

        Job failed = lib(graph);
        assertEquals(JobState.FAILED, failed.state());
        assertTrue(failed.failureReason().startsWith("timed out after"));
        assertEquals(GroupState.FAILED, store.findGroup(graph.group().id()).orElseThrow().state());
    }

    @Test
    void unreachableWorkerDoesNotStopReaping() {
        BuildGraph graph = submitSingle(3);
        scheduler.recordDispatch(lib(graph), worker("w1"));
        client.refuse("w1");

        assertEquals(1, reaper.reapOverdueJobs(Instant.now().plus(TIMEOUT).plusSeconds(1)));
        assertEquals(JobState.READY, lib(graph).state());
    }
}
