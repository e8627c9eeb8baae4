package bldr.jobsrv.dispatch;

import bldr.jobsrv.model.JobAssignment;
import bldr.jobsrv.model.Worker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the worker agent.
 *
 * <p>
 * {@code POST {endpoint}/assign} with {@code {jobId, projectRef, inputsRef}} and
 * {@code POST {endpoint}/abort} with {@code {jobId}}. Any non-2xx answer, I/O
 * error or timeout is a {@link WorkerUnreachableException}.
 */
public class HttpWorkerClient implements WorkerClient {

    private static final Logger log = LoggerFactory.getLogger(HttpWorkerClient.class);

    private final HttpClient http;
    private final ObjectMapper json;
    private final Duration requestTimeout;

    public HttpWorkerClient(ObjectMapper json, Duration connectTimeout, Duration requestTimeout) {
        this.json = json;
        this.requestTimeout = requestTimeout;
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public void assign(Worker worker, JobAssignment assignment) {
        log.debug("Sending job {} ({}) to worker {}", assignment.jobId(), assignment.projectRef(), worker.id());
        post(worker, "/assign", toJson(assignment), "assign " + assignment.jobId());
    }

    @Override
    public void abort(Worker worker, String jobId) {
        log.debug("Sending abort of job {} to worker {}", jobId, worker.id());
        post(worker, "/abort", toJson(Map.of("jobId", jobId)), "abort " + jobId);
    }

    private void post(Worker worker, String path, String body, String operation) {
        if (worker.endpoint() == null || worker.endpoint().isBlank()) {
            throw new WorkerUnreachableException("Worker " + worker.id() + " has no endpoint");
        }
        String base = worker.endpoint().endsWith("/")
                ? worker.endpoint().substring(0, worker.endpoint().length() - 1)
                : worker.endpoint();
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(base + path))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new WorkerUnreachableException(
                        operation + " on worker " + worker.id() + " failed: HTTP " + resp.statusCode() + ": "
                                + resp.body());
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new WorkerUnreachableException(operation + " on worker " + worker.id() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerUnreachableException(operation + " on worker " + worker.id() + " interrupted", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }
}
