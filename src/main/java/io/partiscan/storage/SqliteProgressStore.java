package io.partiscan.storage;

import io.partiscan.model.PartitionProgress;
import io.partiscan.progress.ProgressCondition;
import io.partiscan.progress.ProgressKey;
import io.partiscan.progress.ProgressMutation;
import io.partiscan.progress.ProgressStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ProgressStore} over the {@code partition_progress} table. The conditional update is a
 * single {@code UPDATE ... WHERE next_offset=? AND completed=?}; one affected row means it applied.
 */
public final class SqliteProgressStore implements ProgressStore {
    private static final String SELECT_COLUMNS =
            "SELECT run_id,partition_id,next_offset,completed,created_at_ms,updated_at_ms FROM partition_progress";

    private final Database database;

    public SqliteProgressStore(Database database) {
        this.database = database;
    }

    @Override
    public PartitionProgress insertIfAbsent(ProgressKey key, long nowMs) {
        try (Connection c = database.openConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT OR IGNORE INTO partition_progress(run_id,partition_id,next_offset,completed,created_at_ms,updated_at_ms) VALUES(?,?,0,0,?,?)")) {
                ps.setString(1, key.runId());
                ps.setString(2, key.partitionId());
                ps.setLong(3, nowMs);
                ps.setLong(4, nowMs);
                ps.executeUpdate();
            }
            return find(c, key).orElseThrow(() -> new IllegalStateException("Progress row vanished after insert: " + key));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize partition progress: " + key, e);
        }
    }

    @Override
    public Optional<PartitionProgress> find(ProgressKey key) {
        try (Connection c = database.openConnection()) {
            return find(c, key);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read partition progress: " + key, e);
        }
    }

    @Override
    public boolean conditionalUpdate(ProgressKey key, ProgressCondition condition, ProgressMutation mutation, long nowMs) {
        String sql = "UPDATE partition_progress SET next_offset=?,completed=?,updated_at_ms=? "
                + "WHERE run_id=? AND partition_id=? AND next_offset=? AND completed=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, mutation.nextOffset());
            ps.setInt(2, mutation.completed() ? 1 : 0);
            ps.setLong(3, nowMs);
            ps.setString(4, key.runId());
            ps.setString(5, key.partitionId());
            ps.setLong(6, condition.expectedOffset());
            ps.setInt(7, condition.expectedCompleted() ? 1 : 0);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update partition progress: " + key, e);
        }
    }

    @Override
    public List<PartitionProgress> listByRun(String runId) {
        List<PartitionProgress> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(SELECT_COLUMNS + " WHERE run_id=? ORDER BY partition_id")) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readRow(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list partition progress for run: " + runId, e);
        }
    }

    private Optional<PartitionProgress> find(Connection c, ProgressKey key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SELECT_COLUMNS + " WHERE run_id=? AND partition_id=?")) {
            ps.setString(1, key.runId());
            ps.setString(2, key.partitionId());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(readRow(rs));
            }
        }
    }

    private static PartitionProgress readRow(ResultSet rs) throws SQLException {
        return new PartitionProgress(
                rs.getString("run_id"),
                rs.getString("partition_id"),
                rs.getLong("next_offset"),
                rs.getInt("completed") == 1,
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }
}
