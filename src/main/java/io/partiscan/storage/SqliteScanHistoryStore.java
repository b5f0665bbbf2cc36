package io.partiscan.storage;

import io.partiscan.model.ScanConfig;
import io.partiscan.model.ScanRecord;
import io.partiscan.model.ScanResult;
import io.partiscan.model.ScanType;
import io.partiscan.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Stores config and result as JSON documents in {@code scan_history}.
 */
public final class SqliteScanHistoryStore implements ScanHistoryStore {
    private final Database database;

    public SqliteScanHistoryStore(Database database) {
        this.database = database;
    }

    @Override
    public void record(ScanRecord record) {
        String sql = """
                INSERT OR REPLACE INTO scan_history(feed,scan_type,config_json,result_json,recorded_at_ms)
                VALUES(?,?,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, record.feed());
            ps.setString(2, record.scanType().storageKey());
            ps.setString(3, Jsons.toCompactJson(record.config()));
            ps.setString(4, Jsons.toCompactJson(record.result()));
            ps.setLong(5, record.recordedAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record scan history for feed: " + record.feed(), e);
        }
    }

    @Override
    public Optional<ScanRecord> latest(String feed, ScanType scanType) {
        String sql = "SELECT config_json,result_json,recorded_at_ms FROM scan_history WHERE feed=? AND scan_type=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, feed);
            ps.setString(2, scanType.storageKey());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new ScanRecord(
                        feed,
                        scanType,
                        Jsons.fromJson(rs.getString("config_json"), ScanConfig.class),
                        Jsons.fromJson(rs.getString("result_json"), ScanResult.class),
                        rs.getLong("recorded_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read scan history for feed: " + feed, e);
        }
    }
}
