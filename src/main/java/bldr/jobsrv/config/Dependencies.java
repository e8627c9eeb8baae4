package bldr.jobsrv.config;

import bldr.jobsrv.api.internal.v1.HeartbeatController;
import bldr.jobsrv.api.internal.v1.ReportController;
import bldr.jobsrv.api.v1.GroupController;
import bldr.jobsrv.api.v1.HealthController;
import bldr.jobsrv.api.v1.JobController;
import bldr.jobsrv.api.v1.WorkerController;
import bldr.jobsrv.dispatch.Dispatcher;
import bldr.jobsrv.dispatch.HttpWorkerClient;
import bldr.jobsrv.dispatch.WorkerClient;
import bldr.jobsrv.repository.JobStore;
import bldr.jobsrv.repository.WorkerRepository;
import bldr.jobsrv.scheduler.BuildScheduler;
import bldr.jobsrv.scheduler.JobReaper;
import bldr.jobsrv.scheduler.SchedulerLoops;
import bldr.jobsrv.server.RouterHandler;
import bldr.jobsrv.service.GroupService;
import bldr.jobsrv.service.StatusIngestor;
import bldr.jobsrv.service.WorkerRegistry;
import bldr.jobsrv.store.Database;
import bldr.jobsrv.store.JdbcJobStore;
import bldr.jobsrv.store.JdbcWorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 * 
 * Usage:
 * 
 * <pre>
 * Dependencies deps = Dependencies.create(JobServerConfig.fromEnv());
 * deps.scheduler().recover(); // settle groups left by a previous run
 * deps.startLoops(); // dispatch, liveness sweep, job reaper
 * GroupService groups = deps.groupService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final JobServerConfig config;
    private final Database database;
    private final JobStore jobStore;
    private final WorkerRepository workerRepository;
    private final BuildScheduler scheduler;
    private final WorkerRegistry workerRegistry;
    private final StatusIngestor statusIngestor;
    private final WorkerClient workerClient;
    private final ExecutorService dispatchSends;
    private final Dispatcher dispatcher;
    private final GroupService groupService;
    private final JobReaper jobReaper;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Background loops (lazy-initialized)
    private SchedulerLoops loops;

    private Dependencies(JobServerConfig config, Function<StatusIngestor, WorkerClient> clientFactory) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.jobStore = new JdbcJobStore(database);
        this.workerRepository = new JdbcWorkerRepository(database);

        // Services
        this.scheduler = new BuildScheduler(jobStore, workerRepository, config);
        this.workerRegistry = new WorkerRegistry(workerRepository, scheduler, config);
        this.statusIngestor = new StatusIngestor(scheduler, workerRegistry, config);
        this.workerClient = clientFactory.apply(statusIngestor);
        this.dispatchSends = newSendPool(config.dispatchSendThreads());
        this.dispatcher = new Dispatcher(jobStore, workerRegistry, scheduler, workerClient, dispatchSends, config);
        this.groupService = new GroupService(jobStore, scheduler, workerRegistry, workerClient, config);
        this.jobReaper = new JobReaper(jobStore, workerRepository, scheduler, workerClient, config);

        log.info("Dependencies initialized successfully");
    }

    private static ExecutorService newSendPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "jobsrv-dispatch-send-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Create dependencies with the given config, talking to workers over HTTP.
     */
    public static Dependencies create(JobServerConfig config) {
        return create(config, ingestor -> new HttpWorkerClient(
                RouterHandler.mapper(), config.workerConnectTimeout(), config.workerRequestTimeout()));
    }

    /**
     * Create dependencies with a custom worker client, e.g. a simulated fleet
     * that reports back through the ingestor.
     */
    public static Dependencies create(JobServerConfig config, Function<StatusIngestor, WorkerClient> clientFactory) {
        return new Dependencies(config, clientFactory);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(JobServerConfig.fromEnv());
    }

    // Getters
    public JobServerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobStore jobStore() {
        return jobStore;
    }

    public WorkerRepository workerRepository() {
        return workerRepository;
    }

    public BuildScheduler scheduler() {
        return scheduler;
    }

    public WorkerRegistry workerRegistry() {
        return workerRegistry;
    }

    public StatusIngestor statusIngestor() {
        return statusIngestor;
    }

    public WorkerClient workerClient() {
        return workerClient;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public GroupService groupService() {
        return groupService;
    }

    public JobReaper jobReaper() {
        return jobReaper;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(new HealthController(database, jobStore, workerRegistry,
                            () -> loops != null && loops.isRunning()))
                    .registerController(new GroupController(groupService))
                    .registerController(new JobController(groupService))
                    .registerController(new WorkerController(workerRegistry))
                    .registerController(new HeartbeatController(statusIngestor))
                    .registerController(new ReportController(statusIngestor));
            log.info("RouterHandler created with controllers {}", routerHandler.controllerNames());
        }
        return routerHandler;
    }

    /**
     * Get the background loops (creates them if not yet created).
     */
    public SchedulerLoops loops() {
        if (loops == null) {
            loops = new SchedulerLoops(dispatcher::run, workerRegistry::sweep, jobReaper, config);
        }
        return loops;
    }

    /**
     * Start dispatch, liveness sweep and job reaper.
     * Should be called after server startup.
     */
    public void startLoops() {
        loops().start();
    }

    public void stopLoops() {
        if (loops != null) {
            loops.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop producers of store traffic first
        if (loops != null) {
            try {
                loops.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler loops: {}", e.getMessage());
            }
        }

        // Sends still on the wire record their dispatch or give it up
        dispatchSends.shutdown();
        try {
            if (!dispatchSends.awaitTermination(config.workerRequestTimeout().toMillis() + 1000,
                    TimeUnit.MILLISECONDS)) {
                dispatchSends.shutdownNow();
                log.warn("Dispatch sends forcefully stopped");
            }
        } catch (InterruptedException e) {
            dispatchSends.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            statusIngestor.close();
        } catch (Exception e) {
            log.warn("Error stopping status ingestor: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
