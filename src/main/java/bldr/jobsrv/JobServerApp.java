package bldr.jobsrv;

import bldr.jobsrv.config.Dependencies;
import bldr.jobsrv.config.JobServerConfig;
import bldr.jobsrv.server.JobServerNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Job server entry point.
 * 
 * Settles groups left behind by a previous run, starts the HTTP server and
 * then the background loops. Stops everything on JVM shutdown.
 */
public final class JobServerApp {

    private static final Logger log = LoggerFactory.getLogger(JobServerApp.class);

    private JobServerApp() {
    }

    public static void main(String[] args) throws InterruptedException {
        JobServerConfig config = JobServerConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        JobServerNettyServer server = new JobServerNettyServer(deps.routerHandler());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down job server...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "jobsrv-shutdown"));

        try {
            deps.scheduler().recover();
            server.start(config.serverHost(), config.serverPort());
            deps.startLoops();
        } catch (RuntimeException e) {
            log.error("Job server failed to start", e);
            System.exit(1); // shutdown hook releases what was started
        }

        stopped.await();
    }
}
