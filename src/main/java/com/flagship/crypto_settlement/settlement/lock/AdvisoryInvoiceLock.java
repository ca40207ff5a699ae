package com.flagship.crypto_settlement.settlement.lock;

import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * PostgreSQL session-level advisory lock, shared by every instance that
 * uses the same database.
 *
 * Session locks belong to a connection, so each held lock pins one
 * connection until release. Those connections come from a pool of their own;
 * the settlement work done under the lock uses the application pool. When
 * the lock pool is exhausted the attempt is reported as "not acquired",
 * like any other acquisition error. The lock key is the invoice id's upper
 * 64 bits.
 */
@Slf4j
public class AdvisoryInvoiceLock implements InvoiceLock, AutoCloseable {

    private final HikariDataSource lockPool;
    private final ConcurrentMap<UUID, Connection> held = new ConcurrentHashMap<>();

    public AdvisoryInvoiceLock(HikariDataSource lockPool) {
        this.lockPool = lockPool;
    }

    @Override
    public boolean tryAcquire(UUID invoiceId) {
        long key = lockKey(invoiceId);
        Connection connection = null;
        try {
            connection = lockPool.getConnection();
            connection.setAutoCommit(true);
            if (!queryBoolean(connection, "SELECT pg_try_advisory_lock(?)", key)) {
                log.warn("Failed to acquire payment lock: invoiceId={}, lockKey={}", invoiceId, key);
                connection.close();
                return false;
            }
            if (held.putIfAbsent(invoiceId, connection) != null) {
                // Another thread of this process holds it on its own connection; undo ours.
                unlock(connection, key);
                connection.close();
                return false;
            }
            log.debug("Payment lock acquired: invoiceId={}, lockKey={}", invoiceId, key);
            return true;
        } catch (SQLException e) {
            log.error("Error acquiring payment lock: invoiceId={}, error={}", invoiceId, e.getMessage());
            closeQuietly(connection);
            return false;
        }
    }

    @Override
    public void release(UUID invoiceId) {
        Connection connection = held.remove(invoiceId);
        if (connection == null) {
            log.warn("Release of payment lock not held ignored: invoiceId={}", invoiceId);
            return;
        }
        long key = lockKey(invoiceId);
        try {
            unlock(connection, key);
            connection.close();
            log.debug("Payment lock released: invoiceId={}, lockKey={}", invoiceId, key);
        } catch (SQLException e) {
            log.error("Error releasing payment lock, evicting connection: invoiceId={}, error={}",
                invoiceId, e.getMessage());
            evict(connection);
        }
    }

    static long lockKey(UUID invoiceId) {
        return invoiceId.getMostSignificantBits();
    }

    private void unlock(Connection connection, long key) throws SQLException {
        if (!queryBoolean(connection, "SELECT pg_advisory_unlock(?)", key)) {
            log.warn("Advisory unlock reported lock not held: lockKey={}", key);
        }
    }

    private boolean queryBoolean(Connection connection, String sql, long key) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, key);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    /**
     * A connection whose unlock failed may still hold the session lock, so it
     * must not go back to the pool.
     */
    private void evict(Connection connection) {
        try {
            lockPool.evictConnection(connection);
        } catch (RuntimeException e) {
            log.error("Failed to evict lock connection: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        if (!held.isEmpty()) {
            log.warn("Closing lock pool with {} payment locks still held", held.size());
        }
        lockPool.close();
    }

    private void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Failed to close lock connection: {}", e.getMessage());
        }
    }
}
