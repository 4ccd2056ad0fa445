package io.skipkp.storage;

import io.skipkp.model.KeyProviderException;
import io.skipkp.model.KeyRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class SqliteKeyRecordRepository implements KeyRecordRepository {
    private static final String RECORD_COLUMNS =
            "r.key_id,r.key_material,r.remote_system_id,r.size_bits,r.created_at_ms,r.consumed,r.origin";

    private final Database database;

    public SqliteKeyRecordRepository(Database database) {
        this.database = database;
    }

    @Override
    public boolean insert(KeyRecord record) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ins = c.prepareStatement(
                    "INSERT OR IGNORE INTO key_records(key_id,key_material,remote_system_id,size_bits,created_at_ms,consumed,consumed_at_ms,origin) VALUES(?,?,?,?,?,?,?,?)");
                 PreparedStatement peer = c.prepareStatement(
                         "INSERT OR IGNORE INTO key_peer_state(key_id,peer_id,synced_at_ms,notified_at_ms) VALUES(?,?,?,NULL)")) {
                long createdMs = record.createdAt().toEpochMilli();
                ins.setString(1, record.keyId());
                if (record.consumed() || record.keyMaterial() == null) {
                    ins.setNull(2, Types.BLOB);
                } else {
                    ins.setBytes(2, record.keyMaterial());
                }
                ins.setString(3, record.remoteSystemId());
                ins.setInt(4, record.sizeBits());
                ins.setLong(5, createdMs);
                ins.setInt(6, record.consumed() ? 1 : 0);
                if (record.consumed()) {
                    ins.setLong(7, createdMs);
                } else {
                    ins.setNull(7, Types.INTEGER);
                }
                ins.setString(8, record.origin());
                if (ins.executeUpdate() == 0) {
                    c.rollback();
                    return false;
                }
                for (String peerId : record.syncedPeers()) {
                    peer.setString(1, record.keyId());
                    peer.setString(2, peerId);
                    peer.setLong(3, createdMs);
                    peer.executeUpdate();
                }
                c.commit();
                return true;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw unavailable("insert key record", e);
        }
    }

    @Override
    public Optional<KeyRecord> find(String keyId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + RECORD_COLUMNS + " FROM key_records r WHERE r.key_id=?")) {
            ps.setString(1, keyId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapRecord(rs, syncedPeers(c, keyId)));
            }
        } catch (SQLException e) {
            throw unavailable("read key record", e);
        }
    }

    @Override
    public ConsumeResult consume(String keyId, Instant now) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement claim = c.prepareStatement(
                    "UPDATE key_records SET consumed=1,consumed_at_ms=? WHERE key_id=? AND consumed=0");
                 PreparedStatement read = c.prepareStatement(
                         "SELECT key_material,remote_system_id FROM key_records WHERE key_id=?");
                 PreparedStatement erase = c.prepareStatement(
                         "UPDATE key_records SET key_material=NULL WHERE key_id=?");
                 PreparedStatement exists = c.prepareStatement(
                         "SELECT 1 FROM key_records WHERE key_id=?")) {
                // The claiming write takes the database write lock before anything is read.
                claim.setLong(1, now.toEpochMilli());
                claim.setString(2, keyId);
                if (claim.executeUpdate() == 0) {
                    exists.setString(1, keyId);
                    boolean present;
                    try (ResultSet rs = exists.executeQuery()) {
                        present = rs.next();
                    }
                    c.rollback();
                    return ConsumeResult.of(present ? ConsumeOutcome.ALREADY_CONSUMED : ConsumeOutcome.NOT_FOUND);
                }
                byte[] material;
                String remoteSystemId;
                read.setString(1, keyId);
                try (ResultSet rs = read.executeQuery()) {
                    rs.next();
                    material = rs.getBytes(1);
                    remoteSystemId = rs.getString(2);
                }
                erase.setString(1, keyId);
                erase.executeUpdate();
                c.commit();
                return new ConsumeResult(ConsumeOutcome.CONSUMED, material == null ? new byte[0] : material, remoteSystemId);
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw unavailable("consume key record", e);
        }
    }

    @Override
    public int deleteCreatedBefore(Instant cutoff) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM key_records WHERE created_at_ms<?")) {
            ps.setLong(1, cutoff.toEpochMilli());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw unavailable("sweep key records", e);
        }
    }

    @Override
    public List<KeyRecord> pendingReplication(String peerId, int limit) {
        String sql = """
                SELECT %s
                FROM key_records r
                WHERE r.consumed=0 AND r.origin<>?
                AND NOT EXISTS (
                    SELECT 1 FROM key_peer_state s
                    WHERE s.key_id=r.key_id AND s.peer_id=? AND s.synced_at_ms IS NOT NULL
                )
                ORDER BY r.created_at_ms ASC, r.key_id ASC
                LIMIT ?
                """.formatted(RECORD_COLUMNS);
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, peerId);
            ps.setString(2, peerId);
            ps.setInt(3, Math.max(1, limit));
            List<KeyRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapRecord(rs, Set.of()));
                }
            }
            return out;
        } catch (SQLException e) {
            throw unavailable("list pending replication", e);
        }
    }

    @Override
    public void markSynced(String keyId, String peerId, Instant now) {
        markPeerState(keyId, peerId, "synced_at_ms", now);
    }

    @Override
    public List<String> pendingConsumptionNotices(String peerId, int limit) {
        String sql = """
                SELECT r.key_id
                FROM key_records r
                JOIN key_peer_state s ON s.key_id=r.key_id
                WHERE r.consumed=1 AND s.peer_id=? AND s.synced_at_ms IS NOT NULL AND s.notified_at_ms IS NULL
                ORDER BY r.consumed_at_ms ASC, r.key_id ASC
                LIMIT ?
                """;
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, peerId);
            ps.setInt(2, Math.max(1, limit));
            List<String> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw unavailable("list pending consumption notices", e);
        }
    }

    @Override
    public void markNotified(String keyId, String peerId, Instant now) {
        markPeerState(keyId, peerId, "notified_at_ms", now);
    }

    @Override
    public long countLive() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM key_records WHERE consumed=0");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw unavailable("count key records", e);
        }
    }

    @Override
    public Stats stats() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT COUNT(*), COALESCE(SUM(consumed),0) FROM key_records");
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return new Stats(0L, 0L, 0L);
            }
            long total = rs.getLong(1);
            long consumed = rs.getLong(2);
            return new Stats(total - consumed, consumed, total);
        } catch (SQLException e) {
            throw unavailable("read key statistics", e);
        }
    }

    @Override
    public boolean healthy() {
        return database.ping();
    }

    private void markPeerState(String keyId, String peerId, String column, Instant now) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ensure = c.prepareStatement(
                    "INSERT OR IGNORE INTO key_peer_state(key_id,peer_id) SELECT key_id,? FROM key_records WHERE key_id=?");
                 PreparedStatement update = c.prepareStatement(
                         "UPDATE key_peer_state SET " + column + "=? WHERE key_id=? AND peer_id=?")) {
                ensure.setString(1, peerId);
                ensure.setString(2, keyId);
                ensure.executeUpdate();
                update.setLong(1, now.toEpochMilli());
                update.setString(2, keyId);
                update.setString(3, peerId);
                update.executeUpdate();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw unavailable("update peer state", e);
        }
    }

    private Set<String> syncedPeers(Connection c, String keyId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT peer_id FROM key_peer_state WHERE key_id=? AND synced_at_ms IS NOT NULL")) {
            ps.setString(1, keyId);
            Set<String> out = new HashSet<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        }
    }

    private static KeyRecord mapRecord(ResultSet rs, Set<String> syncedPeers) throws SQLException {
        byte[] material = rs.getBytes("key_material");
        return new KeyRecord(
                rs.getString("key_id"),
                material == null ? new byte[0] : material,
                rs.getString("remote_system_id"),
                rs.getInt("size_bits"),
                Instant.ofEpochMilli(rs.getLong("created_at_ms")),
                rs.getInt("consumed") == 1,
                rs.getString("origin"),
                syncedPeers
        );
    }

    private static KeyProviderException unavailable(String operation, SQLException e) {
        return new KeyProviderException(
                KeyProviderException.Reason.STORAGE_UNAVAILABLE,
                "Key storage unavailable",
                new SQLException("Failed to " + operation, e)
        );
    }
}
