package bldr.jobsrv.model;

import java.util.Objects;
import java.util.Set;

/**
 * Periodic liveness signal from a worker. The first heartbeat registers the worker.
 */
public record Heartbeat(String workerId, int capacity, Set<String> tags, String endpoint) {

    public Heartbeat {
        Objects.requireNonNull(workerId, "workerId is required");
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }
}
