package bldr.jobsrv.dispatch;

import bldr.jobsrv.model.JobAssignment;
import bldr.jobsrv.model.Worker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HttpWorkerClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private final List<String> paths = new CopyOnWriteArrayList<>();
    private final List<JsonNode> bodies = new CopyOnWriteArrayList<>();
    private volatile int status = 200;

    private final HttpWorkerClient client = new HttpWorkerClient(MAPPER, Duration.ofSeconds(1), Duration.ofSeconds(2));

    @BeforeEach
    void startAgent() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            paths.add(exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath());
            bodies.add(MAPPER.readTree(exchange.getRequestBody()));
            byte[] reply = "{}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, reply.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(reply);
            }
        });
        server.start();
    }

    @AfterEach
    void stopAgent() {
        server.stop(0);
    }

    private Worker agent(String endpoint) {
        return Worker.builder().id("w1").endpoint(endpoint).build();
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @Test
    void assignPostsJobToAgent() {
        client.assign(agent(baseUrl()), new JobAssignment("job-1", "core/zlib@x86_64-linux", "inputs/zlib"));

        assertEquals(List.of("POST /assign"), paths);
        JsonNode body = bodies.get(0);
        assertEquals("job-1", body.get("jobId").asText());
        assertEquals("core/zlib@x86_64-linux", body.get("projectRef").asText());
        assertEquals("inputs/zlib", body.get("inputsRef").asText());
    }

    @Test
    void trailingSlashOnEndpointIsIgnored() {
        client.abort(agent(baseUrl() + "/"), "job-2");

        assertEquals(List.of("POST /abort"), paths);
        assertEquals("job-2", bodies.get(0).get("jobId").asText());
    }

    @Test
    void errorStatusIsUnreachable() {
        status = 503;

        WorkerUnreachableException e = assertThrows(WorkerUnreachableException.class,
                () -> client.assign(agent(baseUrl()), new JobAssignment("job-1", "a@t", null)));
        assertTrue(e.getMessage().contains("HTTP 503"));
    }

    @Test
    void missingEndpointIsUnreachable() {
        assertThrows(WorkerUnreachableException.class,
                () -> client.assign(agent(null), new JobAssignment("job-1", "a@t", null)));
        assertThrows(WorkerUnreachableException.class, () -> client.abort(agent(" "), "job-1"));
        assertTrue(paths.isEmpty());
    }

    @Test
    void refusedConnectionIsUnreachable() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        assertThrows(WorkerUnreachableException.class,
                () -> client.abort(agent("http://127.0.0.1:" + closedPort), "job-1"));
    }
}
