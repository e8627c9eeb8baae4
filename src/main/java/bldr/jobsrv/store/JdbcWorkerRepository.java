package bldr.jobsrv.store;

import bldr.jobsrv.model.Heartbeat;
import bldr.jobsrv.model.Worker;
import bldr.jobsrv.model.WorkerStatus;
import bldr.jobsrv.repository.StoreException;
import bldr.jobsrv.repository.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static bldr.jobsrv.store.JdbcJobStore.toInstant;

/**
 * JDBC implementation of WorkerRepository.
 */
public class JdbcWorkerRepository implements WorkerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkerRepository.class);

    private final Database db;

    public JdbcWorkerRepository(Database db) {
        this.db = db;
    }

    @Override
    public Worker heartbeat(Heartbeat heartbeat, Instant now) {
        // SET expressions see the old row, so a DEAD worker comes back with zero load.
        // Capacity never drops below the current load; it shrinks on later heartbeats as jobs finish.
        String updateSql = """
                    UPDATE workers
                    SET tags = ?,
                        capacity = CASE WHEN status = 'DEAD' THEN ? ELSE GREATEST(?, active_jobs) END,
                        endpoint = ?, suspect = FALSE, last_heartbeat = ?,
                        active_jobs = CASE WHEN status = 'DEAD' THEN 0 ELSE active_jobs END,
                        idle_since = CASE WHEN status = 'DEAD' THEN ? ELSE idle_since END,
                        status = 'ALIVE'
                    WHERE id = ?
                """;

        String insertSql = """
                    INSERT INTO workers (id, tags, capacity, endpoint, status, suspect, active_jobs,
                                         last_heartbeat, idle_since, registered_at)
                    VALUES (?, ?, ?, ?, 'ALIVE', FALSE, 0, ?, ?, ?)
                """;

        String workerId = heartbeat.workerId();
        try (Connection conn = db.getConnection()) {
            try {
                Timestamp ts = Timestamp.from(now);
                boolean revived = isDead(conn, workerId);

                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, Tags.encode(heartbeat.tags()));
                    ps.setInt(2, heartbeat.capacity());
                    ps.setInt(3, heartbeat.capacity());
                    ps.setString(4, heartbeat.endpoint());
                    ps.setTimestamp(5, ts);
                    ps.setTimestamp(6, ts);
                    ps.setString(7, workerId);
                    updated = ps.executeUpdate();
                }

                if (updated == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        ps.setString(1, workerId);
                        ps.setString(2, Tags.encode(heartbeat.tags()));
                        ps.setInt(3, heartbeat.capacity());
                        ps.setString(4, heartbeat.endpoint());
                        ps.setTimestamp(5, ts);
                        ps.setTimestamp(6, ts);
                        ps.setTimestamp(7, ts);
                        ps.executeUpdate();
                    }
                    log.info("Registered worker {} (capacity={}, tags={})", workerId, heartbeat.capacity(),
                            heartbeat.tags());
                } else if (revived) {
                    log.info("Worker {} is back after being marked dead", workerId);
                }

                Worker worker = readWorker(conn, workerId)
                        .orElseThrow(() -> new SQLException("Worker vanished after heartbeat: " + workerId));
                conn.commit();
                if (worker.capacity() > heartbeat.capacity()) {
                    log.info("Worker {} declared capacity {} but runs {} job(s); keeping capacity {} until they finish",
                            workerId, heartbeat.capacity(), worker.activeJobs(), worker.capacity());
                }
                return worker;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to record heartbeat for worker: " + workerId, e);
        }
    }

    @Override
    public Optional<Worker> findById(String workerId) {
        try (Connection conn = db.getConnection()) {
            return readWorker(conn, workerId);
        } catch (SQLException e) {
            throw new StoreException("Failed to find worker: " + workerId, e);
        }
    }

    @Override
    public List<Worker> findAll() {
        String sql = "SELECT * FROM workers ORDER BY id";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            return mapRows(rs);
        } catch (SQLException e) {
            throw new StoreException("Failed to find all workers", e);
        }
    }

    @Override
    public List<Worker> findByStatus(WorkerStatus status) {
        String sql = "SELECT * FROM workers WHERE status = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find workers by status: " + status, e);
        }
    }

    @Override
    public List<Worker> findExpired(Instant heartbeatBefore) {
        String sql = "SELECT * FROM workers WHERE status = 'ALIVE' AND last_heartbeat < ? ORDER BY last_heartbeat";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(heartbeatBefore));
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find expired workers", e);
        }
    }

    @Override
    public boolean flagSuspect(String workerId) {
        String sql = "UPDATE workers SET suspect = TRUE WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workerId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to flag worker as suspect: " + workerId, e);
        }
    }

    @Override
    public int countByStatus(WorkerStatus status) {
        String sql = "SELECT COUNT(*) FROM workers WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count workers by status", e);
        }
    }

    // Helper methods

    private boolean isDead(Connection conn, String workerId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT status FROM workers WHERE id = ?")) {
            ps.setString(1, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && WorkerStatus.DEAD.name().equals(rs.getString(1));
            }
        }
    }

    private Optional<Worker> readWorker(Connection conn, String workerId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM workers WHERE id = ?")) {
            ps.setString(1, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        }
    }

    private List<Worker> mapRows(ResultSet rs) throws SQLException {
        List<Worker> results = new ArrayList<>();
        while (rs.next()) {
            results.add(mapRow(rs));
        }
        return results;
    }

    private Worker mapRow(ResultSet rs) throws SQLException {
        return Worker.builder()
                .id(rs.getString("id"))
                .tags(Tags.decode(rs.getString("tags")))
                .capacity(rs.getInt("capacity"))
                .endpoint(rs.getString("endpoint"))
                .status(WorkerStatus.valueOf(rs.getString("status")))
                .suspect(rs.getBoolean("suspect"))
                .activeJobs(rs.getInt("active_jobs"))
                .lastHeartbeat(toInstant(rs.getTimestamp("last_heartbeat")))
                .idleSince(toInstant(rs.getTimestamp("idle_since")))
                .registeredAt(toInstant(rs.getTimestamp("registered_at")))
                .build();
    }
}
