package bldr.jobsrv.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable domain model for a client build submission.
 * Membership is fixed at creation; state is derived from the member jobs.
 */
public final class JobGroup {
    private final String id;
    private final String target;
    private final GroupState state;
    private final boolean cancelRequested;
    private final long version;
    private final List<String> jobIds;
    private final Instant createdAt;
    private final Instant completedAt;

    private JobGroup(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.target = Objects.requireNonNull(builder.target, "target is required");
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.cancelRequested = builder.cancelRequested;
        this.version = builder.version;
        this.jobIds = List.copyOf(builder.jobIds);
        this.createdAt = builder.createdAt;
        this.completedAt = builder.completedAt;
    }

    public String id() {
        return id;
    }

    public String target() {
        return target;
    }

    public GroupState state() {
        return state;
    }

    public boolean cancelRequested() {
        return cancelRequested;
    }

    /** Optimistic concurrency counter, bumped by every applied batch */
    public long version() {
        return version;
    }

    public List<String> jobIds() {
        return jobIds;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .target(target)
                .state(state)
                .cancelRequested(cancelRequested)
                .version(version)
                .jobIds(jobIds)
                .createdAt(createdAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String target;
        private GroupState state = GroupState.QUEUED;
        private boolean cancelRequested;
        private long version;
        private List<String> jobIds = List.of();
        private Instant createdAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder state(GroupState state) {
            this.state = state;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder jobIds(List<String> jobIds) {
            this.jobIds = jobIds;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public JobGroup build() {
            return new JobGroup(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobGroup that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobGroup{id='" + id + "', state=" + state + ", jobs=" + jobIds.size() + ", version=" + version + "}";
    }
}
