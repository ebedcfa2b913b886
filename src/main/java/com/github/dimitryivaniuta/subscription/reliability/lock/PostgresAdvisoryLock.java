package com.github.dimitryivaniuta.subscription.reliability.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.UncategorizedSQLException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * PostgreSQL session advisory lock.
 * <p>
 * The lock belongs to the connection that took it, so that connection is kept out of the pool until
 * {@link #exit(long)}. Acquisition polls {@code pg_try_advisory_lock} so that waiting stays interruptible.
 * <p>
 * Returning a connection to a pool keeps its database session alive, and with it any advisory lock the
 * session still holds. A connection whose lock state is unknown after an error is therefore aborted,
 * which terminates the session, instead of being closed.
 */
@Slf4j
@RequiredArgsConstructor
public class PostgresAdvisoryLock implements DistributedLock {

    private static final String TRY_LOCK = "select pg_try_advisory_lock(?)";
    private static final String UNLOCK = "select pg_advisory_unlock(?)";

    private final DataSource dataSource;
    private final Duration pollInterval;
    private final ConcurrentMap<Long, Connection> sessions = new ConcurrentHashMap<>();

    @Override
    public void tryEnter(long lockId) throws InterruptedException {
        Connection connection = null;
        try {
            connection = dataSource.getConnection();
            connection.setAutoCommit(true);
            while (!call(connection, TRY_LOCK, lockId)) {
                Thread.sleep(pollInterval.toMillis());
            }
            sessions.put(lockId, connection);
        } catch (SQLException e) {
            abortQuietly(connection);
            throw new UncategorizedSQLException("advisory lock " + lockId, TRY_LOCK, e);
        } catch (InterruptedException | RuntimeException e) {
            closeQuietly(connection);
            throw e;
        }
    }

    @Override
    public void exit(long lockId) {
        Connection connection = sessions.remove(lockId);
        if (connection == null) return;

        try {
            if (!call(connection, UNLOCK, lockId)) {
                log.warn("[LOCK] advisory lock {} was not held at release", lockId);
            }
        } catch (SQLException e) {
            abortQuietly(connection);
            throw new UncategorizedSQLException("advisory unlock " + lockId, UNLOCK, e);
        } catch (RuntimeException e) {
            abortQuietly(connection);
            throw e;
        }
        closeQuietly(connection);
    }

    private static boolean call(Connection connection, String sql, long lockId) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setLong(1, lockId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    private static void abortQuietly(Connection connection) {
        if (connection == null) return;
        try {
            connection.abort(Runnable::run);
        } catch (SQLException | RuntimeException e) {
            log.warn("[LOCK] failed to abort lock connection", e);
        }
        closeQuietly(connection);
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) return;
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("[LOCK] failed to close lock connection", e);
        }
    }
}
