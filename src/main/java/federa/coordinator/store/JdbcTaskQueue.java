package federa.coordinator.store;

import federa.common.model.Node;
import federa.common.model.TaskIns;
import federa.common.model.TaskRes;
import federa.common.model.TaskType;
import federa.coordinator.queue.DriverQueue;
import federa.coordinator.queue.FleetQueue;
import federa.coordinator.queue.UnknownNodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * JDBC implementation of both sides of the task queue.
 * Uses pessimistic locking so each instruction and each result is delivered once.
 */
public class JdbcTaskQueue implements DriverQueue, FleetQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskQueue.class);

    private final Database db;

    public JdbcTaskQueue(Database db) {
        this.db = db;
    }

    // ---------- runs and nodes ----------

    @Override
    public long createRun() {
        long runId = ThreadLocalRandom.current().nextLong(1, Long.MAX_VALUE);
        String sql = "INSERT INTO runs (id, created_at) VALUES (?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, runId);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.executeUpdate();
            conn.commit();

            log.info("Created run {}", runId);
            return runId;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create run", e);
        }
    }

    @Override
    public List<Node> getNodes(long runId) {
        String sql = "SELECT id, anonymous FROM nodes ORDER BY registered_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<Node> nodes = new ArrayList<>();
            while (rs.next()) {
                nodes.add(new Node(rs.getLong("id"), rs.getBoolean("anonymous")));
            }
            return nodes;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list nodes for run " + runId, e);
        }
    }

    @Override
    public Node createNode(boolean anonymous) {
        long nodeId = ThreadLocalRandom.current().nextLong(1, Long.MAX_VALUE);
        String sql = "INSERT INTO nodes (id, anonymous, registered_at) VALUES (?, ?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, nodeId);
            ps.setBoolean(2, anonymous);
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            ps.executeUpdate();
            conn.commit();

            log.info("Registered node {} (anonymous={})", nodeId, anonymous);
            return new Node(nodeId, anonymous);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create node", e);
        }
    }

    @Override
    public void deleteNode(long nodeId) {
        try (Connection conn = db.getConnection();
                PreparedStatement deleteNode = conn.prepareStatement("DELETE FROM nodes WHERE id = ?");
                PreparedStatement dropPending = conn.prepareStatement(
                        "DELETE FROM task_ins WHERE node_id = ? AND delivered_at IS NULL")) {

            deleteNode.setLong(1, nodeId);
            if (deleteNode.executeUpdate() == 0) {
                conn.rollback();
                throw new UnknownNodeException(nodeId);
            }

            dropPending.setLong(1, nodeId);
            int dropped = dropPending.executeUpdate();
            conn.commit();

            log.info("Deleted node {} ({} pending instructions dropped)", nodeId, dropped);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete node: " + nodeId, e);
        }
    }

    // ---------- instructions ----------

    @Override
    public String pushTaskIns(TaskIns taskIns) {
        String taskId = UUID.randomUUID().toString();
        String sql = """
                    INSERT INTO task_ins (id, group_id, run_id, node_id, task_type, ttl, content, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            if (!exists(conn, "SELECT 1 FROM nodes WHERE id = ?", taskIns.nodeId())) {
                throw new UnknownNodeException(taskIns.nodeId());
            }
            if (!exists(conn, "SELECT 1 FROM runs WHERE id = ?", taskIns.runId())) {
                throw new IllegalArgumentException("Unknown run: " + taskIns.runId());
            }

            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, taskId);
                ps.setString(2, taskIns.groupId());
                ps.setLong(3, taskIns.runId());
                ps.setLong(4, taskIns.nodeId());
                ps.setString(5, taskIns.taskType().tag());
                ps.setString(6, taskIns.ttl());
                ps.setString(7, ContentJson.write(taskIns.content()));
                ps.setTimestamp(8, Timestamp.from(Instant.now()));
                ps.executeUpdate();
            }
            conn.commit();

            log.debug("Pushed {} instruction {} to node {}", taskIns.taskType().tag(), taskId, taskIns.nodeId());
            return taskId;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to push instruction to node: " + taskIns.nodeId(), e);
        }
    }

    @Override
    public List<TaskIns> pullTaskIns(long nodeId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }

        String selectSql = """
                    SELECT * FROM task_ins
                    WHERE node_id = ? AND delivered_at IS NULL
                    ORDER BY created_at
                    LIMIT ?
                    FOR UPDATE
                """;

        String updateSql = "UPDATE task_ins SET delivered_at = ? WHERE id = ?";

        List<TaskIns> pulled = new ArrayList<>();

        try (Connection conn = db.getConnection()) {
            if (!exists(conn, "SELECT 1 FROM nodes WHERE id = ?", nodeId)) {
                throw new UnknownNodeException(nodeId);
            }

            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement updatePs = conn.prepareStatement(updateSql)) {

                selectPs.setLong(1, nodeId);
                selectPs.setInt(2, limit);

                Timestamp now = Timestamp.from(Instant.now());
                try (ResultSet rs = selectPs.executeQuery()) {
                    while (rs.next()) {
                        TaskIns taskIns = mapTaskIns(rs);
                        pulled.add(taskIns);

                        updatePs.setTimestamp(1, now);
                        updatePs.setString(2, taskIns.taskId());
                        updatePs.addBatch();
                    }
                }

                if (!pulled.isEmpty()) {
                    updatePs.executeBatch();
                }
            }
            conn.commit();

            if (!pulled.isEmpty()) {
                log.debug("Node {} pulled {} instructions", nodeId, pulled.size());
            }
            return pulled;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to pull instructions for node: " + nodeId, e);
        }
    }

    // ---------- results ----------

    @Override
    public String pushTaskRes(TaskRes taskRes) {
        String taskId = UUID.randomUUID().toString();
        String sql = """
                    INSERT INTO task_res (id, group_id, run_id, node_id, task_ins_id, task_type, content, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            long insRunId = instructionRun(conn, taskRes.taskInsId());
            if (insRunId != taskRes.runId()) {
                throw new IllegalArgumentException("Result for instruction " + taskRes.taskInsId()
                        + " names run " + taskRes.runId() + ", instruction belongs to run " + insRunId);
            }

            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, taskId);
                ps.setString(2, taskRes.groupId());
                ps.setLong(3, taskRes.runId());
                ps.setLong(4, taskRes.nodeId());
                ps.setString(5, taskRes.taskInsId());
                ps.setString(6, taskRes.taskType().tag());
                ps.setString(7, ContentJson.write(taskRes.content()));
                ps.setTimestamp(8, Timestamp.from(Instant.now()));
                ps.executeUpdate();
            }
            conn.commit();

            log.debug("Node {} pushed result {} for instruction {}", taskRes.nodeId(), taskId, taskRes.taskInsId());
            return taskId;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to push result for instruction: " + taskRes.taskInsId(), e);
        }
    }

    @Override
    public List<TaskRes> pullTaskRes(Set<String> taskInsIds) {
        if (taskInsIds.isEmpty()) {
            return List.of();
        }

        String placeholders = String.join(", ", Collections.nCopies(taskInsIds.size(), "?"));
        String selectSql = "SELECT * FROM task_res WHERE delivered_at IS NULL AND task_ins_id IN (" + placeholders
                + ") ORDER BY created_at FOR UPDATE";
        String updateSql = "UPDATE task_res SET delivered_at = ? WHERE id = ?";

        List<TaskRes> pulled = new ArrayList<>();

        try (Connection conn = db.getConnection();
                PreparedStatement selectPs = conn.prepareStatement(selectSql);
                PreparedStatement updatePs = conn.prepareStatement(updateSql)) {

            int index = 1;
            for (String id : taskInsIds) {
                selectPs.setString(index++, id);
            }

            Timestamp now = Timestamp.from(Instant.now());
            try (ResultSet rs = selectPs.executeQuery()) {
                while (rs.next()) {
                    TaskRes taskRes = mapTaskRes(rs);
                    pulled.add(taskRes);

                    updatePs.setTimestamp(1, now);
                    updatePs.setString(2, taskRes.taskId());
                    updatePs.addBatch();
                }
            }

            if (!pulled.isEmpty()) {
                updatePs.executeBatch();
            }
            conn.commit();

            return pulled;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to pull results for " + taskInsIds.size() + " instructions", e);
        }
    }

    // ---------- housekeeping ----------

    /**
     * Delete instructions and results created before the cutoff, delivered or not.
     *
     * @return number of rows deleted
     */
    public int deleteExpired(Instant cutoff) {
        try (Connection conn = db.getConnection();
                PreparedStatement deleteIns = conn.prepareStatement("DELETE FROM task_ins WHERE created_at < ?");
                PreparedStatement deleteRes = conn.prepareStatement("DELETE FROM task_res WHERE created_at < ?")) {

            Timestamp ts = Timestamp.from(cutoff);
            deleteIns.setTimestamp(1, ts);
            deleteRes.setTimestamp(1, ts);
            int deleted = deleteIns.executeUpdate() + deleteRes.executeUpdate();
            conn.commit();

            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete tasks created before " + cutoff, e);
        }
    }

    // ---------- helpers ----------

    private static boolean exists(Connection conn, String sql, Object key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static long instructionRun(Connection conn, String taskInsId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT run_id FROM task_ins WHERE id = ?")) {
            ps.setString(1, taskInsId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalArgumentException("Unknown instruction: " + taskInsId);
                }
                return rs.getLong("run_id");
            }
        }
    }

    private TaskIns mapTaskIns(ResultSet rs) throws SQLException {
        return TaskIns.builder()
                .taskId(rs.getString("id"))
                .groupId(rs.getString("group_id"))
                .runId(rs.getLong("run_id"))
                .nodeId(rs.getLong("node_id"))
                .taskType(TaskType.fromTag(rs.getString("task_type")))
                .ttl(rs.getString("ttl"))
                .content(ContentJson.read(rs.getString("content")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }

    private TaskRes mapTaskRes(ResultSet rs) throws SQLException {
        return TaskRes.builder()
                .taskId(rs.getString("id"))
                .groupId(rs.getString("group_id"))
                .runId(rs.getLong("run_id"))
                .nodeId(rs.getLong("node_id"))
                .taskInsId(rs.getString("task_ins_id"))
                .taskType(TaskType.fromTag(rs.getString("task_type")))
                .content(ContentJson.read(rs.getString("content")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
