package dumb.normcode.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import dumb.normcode.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static dumb.normcode.Log.message;

/**
 * Checkpoints in a SQLite database, one row per (run, cycle). State blocks are stored as JSON text so the
 * database can be inspected with any SQLite client.
 */
public class SqliteCheckpointStore implements CheckpointStore {

    private static final String SCHEMA = """
            CREATE TABLE IF NOT EXISTS checkpoints (
                run_id TEXT NOT NULL,
                cycle INTEGER NOT NULL,
                inference_count INTEGER NOT NULL,
                timestamp TEXT NOT NULL,
                blackboard TEXT NOT NULL,
                workspace TEXT NOT NULL,
                tracker TEXT NOT NULL,
                completed_concepts TEXT NOT NULL,
                signatures TEXT NOT NULL,
                PRIMARY KEY (run_id, cycle)
            )""";

    private static final String EXECUTIONS = """
            CREATE TABLE IF NOT EXISTS executions (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                run_id TEXT NOT NULL,
                cycle INTEGER NOT NULL,
                flow_index TEXT NOT NULL,
                inference_type TEXT,
                status TEXT NOT NULL,
                concept_inferred TEXT,
                message TEXT,
                timestamp TEXT NOT NULL
            )""";

    private static final String COLUMNS = "run_id, cycle, inference_count, timestamp, blackboard, workspace, tracker, completed_concepts, signatures";

    private final Path file;
    private final Connection db;

    public SqliteCheckpointStore(Path file) {
        this.file = file.toAbsolutePath().normalize();
        try {
            if (this.file.getParent() != null) Files.createDirectories(this.file.getParent());
            db = DriverManager.getConnection("jdbc:sqlite:" + this.file);
            try (var st = db.createStatement()) {
                st.execute(SCHEMA);
                st.execute(EXECUTIONS);
            }
        } catch (SQLException | IOException e) {
            throw new StoreException("Cannot open checkpoint database " + this.file + ": " + e.getMessage(), e);
        }
        message("Checkpoint database: " + this.file);
    }

    public Path file() {
        return file;
    }

    /** Writes the checkpoint row and the executions of its cycle in one transaction. */
    @Override
    public synchronized void append(Checkpoint cp) {
        try {
            try (var q = db.prepareStatement("SELECT MAX(cycle) FROM checkpoints WHERE run_id = ?")) {
                q.setString(1, cp.runId());
                try (var rs = q.executeQuery()) {
                    if (rs.next()) {
                        var last = rs.getInt(1);
                        if (!rs.wasNull() && cp.cycle() <= last)
                            throw new StoreException("Cycle " + cp.cycle() + " of run " + cp.runId() + " is not after " + last);
                    }
                }
            }
            db.setAutoCommit(false);
            try {
                insert(cp);
                db.commit();
            } catch (SQLException e) {
                db.rollback();
                throw e;
            } finally {
                db.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot append checkpoint " + cp.runId() + "@" + cp.cycle() + ": " + e.getMessage(), e);
        }
    }

    private void insert(Checkpoint cp) throws SQLException {
        try (var ins = db.prepareStatement("INSERT INTO checkpoints (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            ins.setString(1, cp.runId());
            ins.setInt(2, cp.cycle());
            ins.setInt(3, cp.inferenceCount());
            ins.setString(4, cp.timestamp().toString());
            ins.setString(5, Json.compact(cp.blackboard()));
            ins.setString(6, Json.compact(cp.workspace()));
            ins.setString(7, Json.compact(cp.tracker()));
            ins.setString(8, Json.compact(cp.completedConcepts()));
            ins.setString(9, Json.compact(cp.signatures()));
            ins.executeUpdate();
        }
        var executions = cp.executions();
        if (executions.isEmpty()) return;
        try (var ins = db.prepareStatement("INSERT INTO executions (run_id, cycle, flow_index, inference_type, status, "
                + "concept_inferred, message, timestamp) VALUES (?, ?, ?, ?, ?, ?, ?, ?)")) {
            for (var x : executions) {
                ins.setString(1, cp.runId());
                ins.setInt(2, x.cycle());
                ins.setString(3, x.flowIndex());
                ins.setString(4, x.inferenceType());
                ins.setString(5, x.status());
                ins.setString(6, x.conceptInferred());
                ins.setString(7, x.message());
                ins.setString(8, cp.timestamp().toString());
                ins.addBatch();
            }
            ins.executeBatch();
        }
    }

    @Override
    public synchronized Optional<Checkpoint> latest(String runId) {
        return one("SELECT " + COLUMNS + " FROM checkpoints WHERE run_id = ? ORDER BY cycle DESC LIMIT 1", runId, null);
    }

    @Override
    public synchronized Optional<Checkpoint> at(String runId, int cycle) {
        return one("SELECT " + COLUMNS + " FROM checkpoints WHERE run_id = ? AND cycle = ?", runId, cycle);
    }

    private Optional<Checkpoint> one(String sql, String runId, Integer cycle) {
        try (var q = db.prepareStatement(sql)) {
            q.setString(1, runId);
            if (cycle != null) q.setInt(2, cycle);
            try (var rs = q.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot read checkpoint of run " + runId + ": " + e.getMessage(), e);
        }
    }

    private static Checkpoint read(ResultSet rs) throws SQLException {
        try {
            return new Checkpoint(
                    rs.getString("run_id"),
                    rs.getInt("cycle"),
                    rs.getInt("inference_count"),
                    Instant.parse(rs.getString("timestamp")),
                    Json.the.readTree(rs.getString("blackboard")),
                    Json.the.readTree(rs.getString("workspace")),
                    Json.the.readTree(rs.getString("tracker")),
                    Json.the.readValue(rs.getString("completed_concepts"), new TypeReference<List<String>>() {
                    }),
                    Json.the.readValue(rs.getString("signatures"), new TypeReference<Map<String, String>>() {
                    }));
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt checkpoint row: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized List<Checkpoint.Summary> list(String runId) {
        try (var q = db.prepareStatement("SELECT cycle, inference_count, timestamp FROM checkpoints WHERE run_id = ? ORDER BY cycle")) {
            q.setString(1, runId);
            var out = new ArrayList<Checkpoint.Summary>();
            try (var rs = q.executeQuery()) {
                while (rs.next())
                    out.add(new Checkpoint.Summary(rs.getInt(1), rs.getInt(2), Instant.parse(rs.getString(3))));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Cannot list checkpoints of run " + runId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized List<Checkpoint.Run> listRuns() {
        var sql = "SELECT run_id, COUNT(*), MAX(cycle), MAX(timestamp) FROM checkpoints GROUP BY run_id ORDER BY run_id";
        try (var st = db.createStatement(); var rs = st.executeQuery(sql)) {
            var out = new ArrayList<Checkpoint.Run>();
            while (rs.next())
                out.add(new Checkpoint.Run(rs.getString(1), rs.getInt(2), rs.getInt(3), Instant.parse(rs.getString(4))));
            return out;
        } catch (SQLException e) {
            throw new StoreException("Cannot list runs: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized List<Checkpoint.Execution> executions(String runId) {
        var sql = "SELECT cycle, flow_index, inference_type, concept_inferred, status, message FROM executions WHERE run_id = ? ORDER BY id";
        try (var q = db.prepareStatement(sql)) {
            q.setString(1, runId);
            var out = new ArrayList<Checkpoint.Execution>();
            try (var rs = q.executeQuery()) {
                while (rs.next())
                    out.add(new Checkpoint.Execution(rs.getInt(1), rs.getString(2), rs.getString(3), rs.getString(4),
                            rs.getString(5), rs.getString(6)));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Cannot list executions of run " + runId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            db.close();
        } catch (SQLException e) {
            throw new StoreException("Cannot close checkpoint database: " + e.getMessage(), e);
        }
    }
}
