package bldr.jobsrv.config;

import java.time.Duration;

/**
 * Configuration holder for job server settings.
 * All settings have sensible defaults.
 */
public final class JobServerConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/jobsrv;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 9636;
    private String serverHost = "0.0.0.0";

    // Scheduling settings
    private int maxRetries = 3; // requeues after worker loss before a job fails
    private int transitionRetryLimit = 5;
    private Duration dispatchInterval = Duration.ofSeconds(1);
    private int dispatchBatchSize = 200;
    private int dispatchSendThreads = 8; // concurrent assignment sends
    private int ingestLanes = 4;

    // Job timeout reaper
    private Duration jobTimeout = Duration.ofHours(2);
    private Duration jobReaperInterval = Duration.ofSeconds(30);

    // Worker settings
    private Duration workerHeartbeatTimeout = Duration.ofSeconds(30);
    private Duration workerSweepInterval = Duration.ofSeconds(5);
    private Duration workerConnectTimeout = Duration.ofSeconds(2);
    private Duration workerRequestTimeout = Duration.ofSeconds(10);

    // Auth settings (optional)
    private String workerKey = null; // If set, workers must provide X-Bldr-Worker-Key header

    private JobServerConfig() {
    }

    public static JobServerConfig defaults() {
        return new JobServerConfig();
    }

    public static JobServerConfig fromEnv() {
        JobServerConfig config = new JobServerConfig();

        String dbUrl = System.getenv("BLDR_JOBSRV_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("BLDR_JOBSRV_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String workerKey = System.getenv("BLDR_JOBSRV_WORKER_KEY");
        if (workerKey != null && !workerKey.isBlank()) {
            config.workerKey = workerKey;
        }

        String maxRetries = System.getenv("BLDR_JOBSRV_MAX_RETRIES");
        if (maxRetries != null && !maxRetries.isBlank()) {
            config.maxRetries = Integer.parseInt(maxRetries);
        }

        String heartbeatTimeout = System.getenv("BLDR_JOBSRV_HEARTBEAT_TIMEOUT_SECONDS");
        if (heartbeatTimeout != null && !heartbeatTimeout.isBlank()) {
            config.workerHeartbeatTimeout = Duration.ofSeconds(Long.parseLong(heartbeatTimeout));
        }

        String jobTimeout = System.getenv("BLDR_JOBSRV_JOB_TIMEOUT_MINUTES");
        if (jobTimeout != null && !jobTimeout.isBlank()) {
            config.jobTimeout = Duration.ofMinutes(Long.parseLong(jobTimeout));
        }

        String sendThreads = System.getenv("BLDR_JOBSRV_DISPATCH_THREADS");
        if (sendThreads != null && !sendThreads.isBlank()) {
            config.dispatchSendThreads = Integer.parseInt(sendThreads);
        }

        String lanes = System.getenv("BLDR_JOBSRV_INGEST_LANES");
        if (lanes != null && !lanes.isBlank()) {
            config.ingestLanes = Integer.parseInt(lanes);
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public int transitionRetryLimit() {
        return transitionRetryLimit;
    }

    public Duration dispatchInterval() {
        return dispatchInterval;
    }

    public int dispatchBatchSize() {
        return dispatchBatchSize;
    }

    public int dispatchSendThreads() {
        return dispatchSendThreads;
    }

    public int ingestLanes() {
        return ingestLanes;
    }

    public Duration jobTimeout() {
        return jobTimeout;
    }

    public Duration jobReaperInterval() {
        return jobReaperInterval;
    }

    public Duration workerHeartbeatTimeout() {
        return workerHeartbeatTimeout;
    }

    public Duration workerSweepInterval() {
        return workerSweepInterval;
    }

    public Duration workerConnectTimeout() {
        return workerConnectTimeout;
    }

    public Duration workerRequestTimeout() {
        return workerRequestTimeout;
    }

    public String workerKey() {
        return workerKey;
    }

    public boolean hasWorkerKey() {
        return workerKey != null && !workerKey.isBlank();
    }

    // Fluent setters for testing/customization
    public JobServerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public JobServerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public JobServerConfig withWorkerKey(String key) {
        this.workerKey = key;
        return this;
    }

    public JobServerConfig withMaxRetries(int retries) {
        this.maxRetries = retries;
        return this;
    }

    public JobServerConfig withTransitionRetryLimit(int limit) {
        this.transitionRetryLimit = limit;
        return this;
    }

    public JobServerConfig withIngestLanes(int lanes) {
        this.ingestLanes = lanes;
        return this;
    }

    public JobServerConfig withJobTimeout(Duration timeout) {
        this.jobTimeout = timeout;
        return this;
    }

    public JobServerConfig withWorkerHeartbeatTimeout(Duration timeout) {
        this.workerHeartbeatTimeout = timeout;
        return this;
    }

    public JobServerConfig withDispatchInterval(Duration interval) {
        this.dispatchInterval = interval;
        return this;
    }

    public JobServerConfig withDispatchSendThreads(int threads) {
        this.dispatchSendThreads = threads;
        return this;
    }

    public JobServerConfig withWorkerRequestTimeout(Duration timeout) {
        this.workerRequestTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "JobServerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", maxRetries=" + maxRetries +
                ", heartbeatTimeout=" + workerHeartbeatTimeout +
                ", jobTimeout=" + jobTimeout +
                ", dispatchSendThreads=" + dispatchSendThreads +
                ", ingestLanes=" + ingestLanes +
                ", workerKeySet=" + hasWorkerKey() +
                '}';
    }
}
