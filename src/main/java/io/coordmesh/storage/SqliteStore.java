package io.coordmesh.storage;

import io.coordmesh.util.Jsons;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Embedded-database backend: keyed records in {@code records}, append-only collections in
 * {@code record_log}. Each write is a single statement and therefore a single transaction.
 */
public final class SqliteStore implements Store {
    private final Database database;

    public SqliteStore(Database database) {
        this.database = database;
    }

    @Override
    public <T> Optional<T> read(RecordKind kind, String key, Class<T> type) {
        Store.requireKeyed(kind);
        String sql = "SELECT body FROM records WHERE kind=? AND record_key=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, kind.name());
            ps.setString(2, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(Jsons.mapper().readValue(rs.getString("body"), type));
            }
        } catch (SQLException | IOException e) {
            throw new StoreException("Failed to read " + kind.dirName() + " record: " + key, e);
        }
    }

    @Override
    public <T> List<T> readAll(RecordKind kind, Class<T> type) {
        Store.requireKeyed(kind);
        String sql = "SELECT body FROM records WHERE kind=? ORDER BY record_key";
        return query(sql, kind, type);
    }

    @Override
    public void write(RecordKind kind, String key, Object record) {
        Store.requireKeyed(kind);
        String sql = "INSERT OR REPLACE INTO records(kind,record_key,body,updated_at_ms) VALUES(?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, kind.name());
            ps.setString(2, key);
            ps.setString(3, Jsons.toCompactJson(record));
            ps.setLong(4, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to write " + kind.dirName() + " record: " + key, e);
        }
    }

    @Override
    public boolean delete(RecordKind kind, String key) {
        Store.requireKeyed(kind);
        String sql = "DELETE FROM records WHERE kind=? AND record_key=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, kind.name());
            ps.setString(2, key);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete " + kind.dirName() + " record: " + key, e);
        }
    }

    @Override
    public void append(RecordKind kind, Object record) {
        Store.requireAppendOnly(kind);
        String sql = "INSERT INTO record_log(kind,body,appended_at_ms) VALUES(?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, kind.name());
            ps.setString(2, Jsons.toCompactJson(record));
            ps.setLong(3, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to append to " + kind.dirName() + " log", e);
        }
    }

    @Override
    public <T> List<T> readLog(RecordKind kind, Class<T> type) {
        Store.requireAppendOnly(kind);
        return query("SELECT body FROM record_log WHERE kind=? ORDER BY seq", kind, type);
    }

    @Override
    public <T> Optional<T> readLast(RecordKind kind, Class<T> type) {
        Store.requireAppendOnly(kind);
        List<T> rows = query("SELECT body FROM record_log WHERE kind=? ORDER BY seq DESC LIMIT 1", kind, type);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public String describe() {
        return "sqlite:" + database.dbFile();
    }

    private <T> List<T> query(String sql, RecordKind kind, Class<T> type) {
        List<T> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, kind.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(Jsons.mapper().readValue(rs.getString("body"), type));
                }
            }
            return out;
        } catch (SQLException | IOException e) {
            throw new StoreException("Failed to read " + kind.dirName() + " collection", e);
        }
    }
}
