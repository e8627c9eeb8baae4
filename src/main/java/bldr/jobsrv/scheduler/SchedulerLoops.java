package bldr.jobsrv.scheduler;

import bldr.jobsrv.config.JobServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Coordinates background scheduled tasks:
 * - dispatch pass: sends READY jobs to workers
 * - liveness sweep: declares workers with a lapsed heartbeat lost
 * - job reaper: takes back jobs held past the job timeout
 * 
 * Each loop logs and swallows its own errors so one failed tick never stops
 * the schedule.
 */
public class SchedulerLoops implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoops.class);

    private final ScheduledExecutorService executor;
    private final Runnable dispatchPass;
    private final Runnable livenessSweep;
    private final JobReaper jobReaper;
    private final JobServerConfig config;

    private volatile boolean running = false;
    private volatile long lastDispatchMillis = 0;

    /**
     * @param dispatchPass  one dispatch pass (typically Dispatcher::run)
     * @param livenessSweep one liveness sweep (typically WorkerRegistry::sweep)
     * @param jobReaper     overdue job reaper
     * @param config        configuration
     */
    public SchedulerLoops(Runnable dispatchPass, Runnable livenessSweep, JobReaper jobReaper, JobServerConfig config) {
        // Two threads: a slow worker send must not hold up the liveness sweep
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "jobsrv-scheduler-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.dispatchPass = dispatchPass;
        this.livenessSweep = livenessSweep;
        this.jobReaper = jobReaper;
        this.config = config;
    }

    /**
     * Start all loops.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler loops already running");
            return;
        }

        running = true;

        long dispatchMs = config.dispatchInterval().toMillis();
        executor.scheduleWithFixedDelay(
                wrapRunnable("dispatch", () -> {
                    dispatchPass.run();
                    lastDispatchMillis = System.currentTimeMillis();
                }),
                0,
                dispatchMs,
                TimeUnit.MILLISECONDS);
        log.info("Dispatch pass scheduled every {}ms", dispatchMs);

        long sweepMs = config.workerSweepInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("liveness-sweep", livenessSweep),
                sweepMs,
                sweepMs,
                TimeUnit.MILLISECONDS);
        log.info("Liveness sweep scheduled every {}ms", sweepMs);

        long reaperMs = config.jobReaperInterval().toMillis();
        executor.scheduleAtFixedRate(
                jobReaper,
                reaperMs,
                reaperMs,
                TimeUnit.MILLISECONDS);
        log.info("Job reaper scheduled every {}ms", reaperMs);

        log.info("Scheduler loops started");
    }

    /**
     * Stop the loops gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler loops forcefully stopped");
            } else {
                log.info("Scheduler loops stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Epoch millis of the last finished dispatch pass, 0 if none yet.
     */
    public long lastDispatchMillis() {
        return lastDispatchMillis;
    }

    public JobReaper jobReaper() {
        return jobReaper;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
