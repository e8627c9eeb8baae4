package bldr.jobsrv.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable domain model for one build attempt of one project within a group.
 * State changes produce a new instance through {@link #toBuilder()}.
 */
public final class Job {
    private final String id;
    private final String groupId;
    private final Project project;
    private final List<String> dependencies; // job ids, fixed at creation
    private final Set<String> requiredTags;
    private final String inputsRef; // opaque artifact store key
    private final JobState state;
    private final String workerId; // null unless DISPATCHED/RUNNING
    private final int retryCount;
    private final int maxRetries;
    private final String failureReason;
    private final Instant createdAt;
    private final Instant dispatchedAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.groupId = Objects.requireNonNull(builder.groupId, "groupId is required");
        this.project = Objects.requireNonNull(builder.project, "project is required");
        this.dependencies = List.copyOf(builder.dependencies);
        this.requiredTags = builder.requiredTags == null ? Set.of(project.target()) : Set.copyOf(builder.requiredTags);
        this.inputsRef = builder.inputsRef;
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.workerId = builder.workerId;
        this.retryCount = builder.retryCount;
        this.maxRetries = builder.maxRetries;
        this.failureReason = builder.failureReason;
        this.createdAt = builder.createdAt;
        this.dispatchedAt = builder.dispatchedAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    public String id() {
        return id;
    }

    public String groupId() {
        return groupId;
    }

    public Project project() {
        return project;
    }

    public List<String> dependencies() {
        return dependencies;
    }

    public Set<String> requiredTags() {
        return requiredTags;
    }

    public String inputsRef() {
        return inputsRef;
    }

    public JobState state() {
        return state;
    }

    public String workerId() {
        return workerId;
    }

    public int retryCount() {
        return retryCount;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public String failureReason() {
        return failureReason;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant dispatchedAt() {
        return dispatchedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    /** Whether a lost assignment may be requeued instead of failing the job */
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .groupId(groupId)
                .project(project)
                .dependencies(dependencies)
                .requiredTags(requiredTags)
                .inputsRef(inputsRef)
                .state(state)
                .workerId(workerId)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .failureReason(failureReason)
                .createdAt(createdAt)
                .dispatchedAt(dispatchedAt)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String groupId;
        private Project project;
        private List<String> dependencies = List.of();
        private Set<String> requiredTags;
        private String inputsRef;
        private JobState state = JobState.PENDING;
        private String workerId;
        private int retryCount = 0;
        private int maxRetries = 3;
        private String failureReason;
        private Instant createdAt;
        private Instant dispatchedAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder groupId(String groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder project(Project project) {
            this.project = project;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder requiredTags(Set<String> requiredTags) {
            this.requiredTags = requiredTags;
            return this;
        }

        public Builder inputsRef(String inputsRef) {
            this.inputsRef = inputsRef;
            return this;
        }

        public Builder state(JobState state) {
            this.state = state;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder failureReason(String failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder dispatchedAt(Instant dispatchedAt) {
            this.dispatchedAt = dispatchedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', project=" + project + ", state=" + state + ", worker='" + workerId + "'}";
    }
}
