package bldr.jobsrv.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable domain model representing a remote build worker.
 */
public final class Worker {
    private final String id;
    private final Set<String> tags;
    private final int capacity;
    private final String endpoint;
    private final WorkerStatus status;
    private final boolean suspect;
    private final int activeJobs;
    private final Instant lastHeartbeat;
    private final Instant idleSince;
    private final Instant registeredAt;

    private Worker(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.tags = Set.copyOf(builder.tags);
        this.capacity = builder.capacity;
        this.endpoint = builder.endpoint;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.suspect = builder.suspect;
        this.activeJobs = builder.activeJobs;
        this.lastHeartbeat = builder.lastHeartbeat;
        this.idleSince = builder.idleSince;
        this.registeredAt = builder.registeredAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public Set<String> tags() {
        return tags;
    }

    public int capacity() {
        return capacity;
    }

    public String endpoint() {
        return endpoint;
    }

    public WorkerStatus status() {
        return status;
    }

    public boolean suspect() {
        return suspect;
    }

    public int activeJobs() {
        return activeJobs;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public Instant idleSince() {
        return idleSince;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    public int spareCapacity() {
        return Math.max(0, capacity - activeJobs);
    }

    public boolean isAlive() {
        return status == WorkerStatus.ALIVE;
    }

    /** Alive, not suspect and below capacity */
    public boolean isAvailable() {
        return isAlive() && !suspect && activeJobs < capacity;
    }

    /** Whether this worker's tags cover every required tag */
    public boolean supports(Set<String> requiredTags) {
        return tags.containsAll(requiredTags);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .tags(tags)
                .capacity(capacity)
                .endpoint(endpoint)
                .status(status)
                .suspect(suspect)
                .activeJobs(activeJobs)
                .lastHeartbeat(lastHeartbeat)
                .idleSince(idleSince)
                .registeredAt(registeredAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private Set<String> tags = Set.of();
        private int capacity = 1;
        private String endpoint;
        private WorkerStatus status = WorkerStatus.ALIVE;
        private boolean suspect;
        private int activeJobs;
        private Instant lastHeartbeat;
        private Instant idleSince;
        private Instant registeredAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder status(WorkerStatus status) {
            this.status = status;
            return this;
        }

        public Builder suspect(boolean suspect) {
            this.suspect = suspect;
            return this;
        }

        public Builder activeJobs(int activeJobs) {
            this.activeJobs = activeJobs;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public Builder idleSince(Instant idleSince) {
            this.idleSince = idleSince;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public Worker build() {
            return new Worker(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Worker worker))
            return false;
        return Objects.equals(id, worker.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Worker{id='" + id + "', status=" + status + ", load=" + activeJobs + "/" + capacity + ", tags=" + tags + "}";
    }
}
