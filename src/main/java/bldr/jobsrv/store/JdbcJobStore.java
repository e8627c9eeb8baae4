package bldr.jobsrv.store;

import bldr.jobsrv.model.GroupState;
import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobGroup;
import bldr.jobsrv.model.JobState;
import bldr.jobsrv.model.Project;
import bldr.jobsrv.repository.GroupSnapshot;
import bldr.jobsrv.repository.JobStore;
import bldr.jobsrv.repository.JobTransition;
import bldr.jobsrv.repository.StoreException;
import bldr.jobsrv.repository.TransitionBatch;
import bldr.jobsrv.repository.TransitionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of JobStore.
 *
 * <p>
 * Transition batches lock their group rows with {@code SELECT ... FOR UPDATE}
 * in id order, then apply every job update as a compare-and-set on the prior
 * state. Any guard that does not hold rolls the whole transaction back.
 */
public class JdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private static final String ASSIGNED_STATES = "('DISPATCHED', 'RUNNING')";

    private final Database db;

    public JdbcJobStore(Database db) {
        this.db = db;
    }

    @Override
    public void createGroup(JobGroup group, List<Job> jobs) {
        String groupSql = """
                    INSERT INTO job_groups (id, target, state, cancel_requested, version, created_at, completed_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;
        String jobSql = """
                    INSERT INTO jobs (id, group_id, job_order, project_name, project_target, required_tags, inputs_ref,
                                      state, worker_id, retry_count, max_retries, failure_reason, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        String depSql = "INSERT INTO job_dependencies (job_id, depends_on_job_id, dep_order) VALUES (?, ?, ?)";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement groupPs = conn.prepareStatement(groupSql);
                    PreparedStatement jobPs = conn.prepareStatement(jobSql);
                    PreparedStatement depPs = conn.prepareStatement(depSql)) {

                Instant createdAt = group.createdAt() != null ? group.createdAt() : Instant.now();
                groupPs.setString(1, group.id());
                groupPs.setString(2, group.target());
                groupPs.setString(3, group.state().name());
                groupPs.setBoolean(4, group.cancelRequested());
                groupPs.setLong(5, group.version());
                setTimestamp(groupPs, 6, createdAt);
                setTimestamp(groupPs, 7, group.completedAt());
                groupPs.executeUpdate();

                int order = 0;
                for (Job job : jobs) {
                    jobPs.setString(1, job.id());
                    jobPs.setString(2, group.id());
                    jobPs.setInt(3, order++);
                    jobPs.setString(4, job.project().name());
                    jobPs.setString(5, job.project().target());
                    jobPs.setString(6, Tags.encode(job.requiredTags()));
                    jobPs.setString(7, job.inputsRef());
                    jobPs.setString(8, job.state().name());
                    jobPs.setString(9, job.workerId());
                    jobPs.setInt(10, job.retryCount());
                    jobPs.setInt(11, job.maxRetries());
                    jobPs.setString(12, job.failureReason());
                    setTimestamp(jobPs, 13, job.createdAt() != null ? job.createdAt() : createdAt);
                    jobPs.addBatch();
                }
                jobPs.executeBatch();

                for (Job job : jobs) {
                    int depOrder = 0;
                    for (String dependency : job.dependencies()) {
                        depPs.setString(1, job.id());
                        depPs.setString(2, dependency);
                        depPs.setInt(3, depOrder++);
                        depPs.addBatch();
                    }
                }
                depPs.executeBatch();

                conn.commit();
                log.debug("Stored group {} with {} jobs", group.id(), jobs.size());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to create group: " + group.id(), e);
        }
    }

    @Override
    public Optional<JobGroup> findGroup(String groupId) {
        try (Connection conn = db.getConnection()) {
            try {
                return readGroup(conn, groupId);
            } finally {
                conn.rollback();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find group: " + groupId, e);
        }
    }

    @Override
    public List<JobGroup> findRecentGroups(int limit) {
        String sql = "SELECT * FROM job_groups ORDER BY created_at DESC, id LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<JobGroup.Builder> builders = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    builders.add(mapGroup(rs));
                }
            }
            List<JobGroup> groups = new ArrayList<>(builders.size());
            for (JobGroup.Builder builder : builders) {
                JobGroup partial = builder.build();
                groups.add(builder.jobIds(readJobIds(conn, partial.id())).build());
            }
            conn.rollback();
            return groups;
        } catch (SQLException e) {
            throw new StoreException("Failed to find recent groups", e);
        }
    }

    @Override
    public List<String> findActiveGroupIds() {
        String sql = "SELECT id FROM job_groups WHERE state = 'QUEUED' ORDER BY created_at";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            List<String> ids = new ArrayList<>();
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
            return ids;
        } catch (SQLException e) {
            throw new StoreException("Failed to find active groups", e);
        }
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM jobs WHERE id = ?")) {

            ps.setString(1, jobId);
            List<Job> jobs = queryJobs(conn, ps);
            return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
        } catch (SQLException e) {
            throw new StoreException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findJobsByGroup(String groupId) {
        try (Connection conn = db.getConnection()) {
            return readJobsOfGroup(conn, groupId);
        } catch (SQLException e) {
            throw new StoreException("Failed to find jobs for group: " + groupId, e);
        }
    }

    @Override
    public List<Job> findReadyJobs(int limit) {
        String sql = "SELECT * FROM jobs WHERE state = 'READY' ORDER BY created_at, job_order LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return queryJobs(conn, ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find ready jobs", e);
        }
    }

    @Override
    public List<Job> findJobsAssignedTo(String workerId) {
        String sql = "SELECT * FROM jobs WHERE worker_id = ? AND state IN " + ASSIGNED_STATES
                + " ORDER BY dispatched_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workerId);
            return queryJobs(conn, ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find jobs assigned to worker: " + workerId, e);
        }
    }

    @Override
    public List<Job> findOverdueJobs(Instant dispatchedBefore) {
        String sql = "SELECT * FROM jobs WHERE state IN " + ASSIGNED_STATES
                + " AND dispatched_at < ? ORDER BY dispatched_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(dispatchedBefore));
            return queryJobs(conn, ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find overdue jobs", e);
        }
    }

    @Override
    public Optional<GroupSnapshot> snapshot(String groupId) {
        try (Connection conn = db.getConnection()) {
            try {
                // Group first: a batch committing in between shows up as a version mismatch
                Optional<JobGroup> group = readGroup(conn, groupId);
                if (group.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(new GroupSnapshot(group.get(), readJobsOfGroup(conn, groupId)));
            } finally {
                conn.rollback();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read snapshot of group: " + groupId, e);
        }
    }

    @Override
    public void apply(TransitionBatch batch) {
        if (batch.isEmpty()) {
            return;
        }

        try (Connection conn = db.getConnection()) {
            try {
                Instant now = Instant.now();
                lockGroups(conn, batch);
                applyJobTransitions(conn, batch.transitions());
                applyWorkerUpdates(conn, batch.workers(), now);
                applyGroupUpdates(conn, batch, now);
                conn.commit();

                log.debug("Applied {}", batch);
            } catch (TransitionConflictException e) {
                conn.rollback();
                throw e;
            } catch (SQLTransientException e) {
                conn.rollback();
                throw new TransitionConflictException("Lock wait failed: " + e.getMessage(), e);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to apply transition batch", e);
        }
    }

    private void lockGroups(Connection conn, TransitionBatch batch) throws SQLException {
        String sql = "SELECT version FROM job_groups WHERE id = ? FOR UPDATE";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (TransitionBatch.GroupUpdate group : batch.groups()) {
                ps.setString(1, group.groupId());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new TransitionConflictException("Group not found: " + group.groupId());
                    }
                    long version = rs.getLong(1);
                    if (group.expectedVersion() != null && group.expectedVersion() != version) {
                        throw new TransitionConflictException("Group " + group.groupId() + " is at version "
                                + version + ", expected " + group.expectedVersion());
                    }
                }
            }
        }
    }

    private void applyJobTransitions(Connection conn, List<JobTransition> transitions) throws SQLException {
        String sql = """
                    UPDATE jobs
                    SET state = ?, worker_id = ?, retry_count = ?, failure_reason = ?,
                        dispatched_at = ?, started_at = ?, completed_at = ?
                    WHERE id = ? AND group_id = ? AND state = ? AND retry_count = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (JobTransition t : transitions) {
                Job after = t.after();
                ps.setString(1, after.state().name());
                ps.setString(2, after.workerId());
                ps.setInt(3, after.retryCount());
                ps.setString(4, after.failureReason());
                setTimestamp(ps, 5, after.dispatchedAt());
                setTimestamp(ps, 6, after.startedAt());
                setTimestamp(ps, 7, after.completedAt());
                ps.setString(8, t.jobId());
                ps.setString(9, t.groupId());
                ps.setString(10, t.from().name());
                ps.setInt(11, t.before().retryCount());

                if (ps.executeUpdate() != 1) {
                    throw new TransitionConflictException("Job " + t.jobId() + " is no longer " + t.from());
                }
            }
        }
    }

    private void applyWorkerUpdates(Connection conn, List<TransitionBatch.WorkerUpdate> updates, Instant now)
            throws SQLException {
        String deadSql = """
                    UPDATE workers SET status = 'DEAD', active_jobs = 0, idle_since = ?
                    WHERE id = ? AND status = 'ALIVE' AND last_heartbeat < ? AND active_jobs = ?
                """;
        String acquireSql = """
                    UPDATE workers SET active_jobs = active_jobs + ?, idle_since = ?
                    WHERE id = ? AND status = 'ALIVE' AND active_jobs + ? <= capacity
                """;
        String releaseSql = """
                    UPDATE workers SET active_jobs = GREATEST(active_jobs + ?, 0), idle_since = ?
                    WHERE id = ?
                """;

        for (TransitionBatch.WorkerUpdate update : updates) {
            if (update.marksDead()) {
                try (PreparedStatement ps = conn.prepareStatement(deadSql)) {
                    ps.setTimestamp(1, Timestamp.from(now));
                    ps.setString(2, update.workerId());
                    ps.setTimestamp(3, Timestamp.from(update.markDeadBefore()));
                    ps.setInt(4, update.expectedLoad());
                    if (ps.executeUpdate() != 1) {
                        throw new TransitionConflictException(
                                "Worker " + update.workerId() + " heartbeat or load changed since the plan was made");
                    }
                }
            } else if (update.loadDelta() > 0) {
                try (PreparedStatement ps = conn.prepareStatement(acquireSql)) {
                    ps.setInt(1, update.loadDelta());
                    ps.setTimestamp(2, Timestamp.from(now));
                    ps.setString(3, update.workerId());
                    ps.setInt(4, update.loadDelta());
                    if (ps.executeUpdate() != 1) {
                        throw new TransitionConflictException(
                                "Worker " + update.workerId() + " has no spare capacity or is not alive");
                    }
                }
            } else {
                try (PreparedStatement ps = conn.prepareStatement(releaseSql)) {
                    ps.setInt(1, update.loadDelta());
                    ps.setTimestamp(2, Timestamp.from(now));
                    ps.setString(3, update.workerId());
                    if (ps.executeUpdate() != 1) {
                        log.debug("Load release for unknown worker {}", update.workerId());
                    }
                }
            }
        }
    }

    private void applyGroupUpdates(Connection conn, TransitionBatch batch, Instant now) throws SQLException {
        String bumpSql = """
                    UPDATE job_groups
                    SET version = version + 1, cancel_requested = (cancel_requested OR ?)
                    WHERE id = ?
                """;
        String stateSql = """
                    UPDATE job_groups
                    SET version = version + 1, cancel_requested = (cancel_requested OR ?), state = ?, completed_at = ?
                    WHERE id = ?
                """;

        for (TransitionBatch.GroupUpdate group : batch.groups()) {
            if (group.newState() == null) {
                try (PreparedStatement ps = conn.prepareStatement(bumpSql)) {
                    ps.setBoolean(1, group.requestCancel());
                    ps.setString(2, group.groupId());
                    ps.executeUpdate();
                }
            } else {
                try (PreparedStatement ps = conn.prepareStatement(stateSql)) {
                    ps.setBoolean(1, group.requestCancel());
                    ps.setString(2, group.newState().name());
                    setTimestamp(ps, 3, group.newState().isTerminal() ? now : null);
                    ps.setString(4, group.groupId());
                    ps.executeUpdate();
                }
                if (group.newState().isTerminal()) {
                    log.info("Group {} finished: {}", group.groupId(), group.newState());
                }
            }
        }
    }

    // Helper methods

    private Optional<JobGroup> readGroup(Connection conn, String groupId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM job_groups WHERE id = ?")) {
            ps.setString(1, groupId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                JobGroup.Builder builder = mapGroup(rs);
                return Optional.of(builder.jobIds(readJobIds(conn, groupId)).build());
            }
        }
    }

    private List<String> readJobIds(Connection conn, String groupId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM jobs WHERE group_id = ? ORDER BY job_order")) {
            ps.setString(1, groupId);
            List<String> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
            return ids;
        }
    }

    private List<Job> readJobsOfGroup(Connection conn, String groupId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM jobs WHERE group_id = ? ORDER BY job_order")) {
            ps.setString(1, groupId);
            return queryJobs(conn, ps);
        }
    }

    private List<Job> queryJobs(Connection conn, PreparedStatement ps) throws SQLException {
        List<Job.Builder> builders = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString("id"));
                builders.add(mapJob(rs));
            }
        }
        Map<String, List<String>> deps = readDependencies(conn, ids);
        List<Job> jobs = new ArrayList<>(builders.size());
        for (int i = 0; i < builders.size(); i++) {
            jobs.add(builders.get(i).dependencies(deps.getOrDefault(ids.get(i), List.of())).build());
        }
        return jobs;
    }

    private Map<String, List<String>> readDependencies(Connection conn, List<String> jobIds) throws SQLException {
        if (jobIds.isEmpty()) {
            return Collections.emptyMap();
        }
        String placeholders = String.join(", ", Collections.nCopies(jobIds.size(), "?"));
        String sql = "SELECT job_id, depends_on_job_id FROM job_dependencies WHERE job_id IN (" + placeholders
                + ") ORDER BY job_id, dep_order";

        Map<String, List<String>> deps = new HashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < jobIds.size(); i++) {
                ps.setString(i + 1, jobIds.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    deps.computeIfAbsent(rs.getString(1), k -> new ArrayList<>()).add(rs.getString(2));
                }
            }
        }
        return deps;
    }

    private JobGroup.Builder mapGroup(ResultSet rs) throws SQLException {
        return JobGroup.builder()
                .id(rs.getString("id"))
                .target(rs.getString("target"))
                .state(GroupState.valueOf(rs.getString("state")))
                .cancelRequested(rs.getBoolean("cancel_requested"))
                .version(rs.getLong("version"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")));
    }

    private Job.Builder mapJob(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .groupId(rs.getString("group_id"))
                .project(new Project(rs.getString("project_name"), rs.getString("project_target")))
                .requiredTags(Tags.decode(rs.getString("required_tags")))
                .inputsRef(rs.getString("inputs_ref"))
                .state(JobState.valueOf(rs.getString("state")))
                .workerId(rs.getString("worker_id"))
                .retryCount(rs.getInt("retry_count"))
                .maxRetries(rs.getInt("max_retries"))
                .failureReason(rs.getString("failure_reason"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .dispatchedAt(toInstant(rs.getTimestamp("dispatched_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")));
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
