package com.hostsentinel.monitor.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import com.zaxxer.hikari.pool.HikariPool;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HikariCP pool of SQLite connections shared by the store.
 *
 * <h3>Sizing</h3>
 * <p>
 * The pool is fixed: {@code maximumPoolSize} and {@code minimumIdle} both
 * equal the configured size, and the first connection is opened in the
 * constructor so a bad database path fails immediately. When every pooled
 * connection stays borrowed past the short acquisition timeout,
 * {@link #withConnection} opens a temporary connection, logs a degraded-mode
 * warning, and closes it after the call. Exhaustion is never an error;
 * {@link #getTemporaryConnectionCount()} reports how often it happened.
 * </p>
 *
 * <h3>Connection setup</h3>
 * <p>
 * Pooled and temporary connections share one {@link SQLiteConfig}:
 * {@code journal_mode=WAL}, {@code synchronous=NORMAL} and
 * {@code cache_size=10000}.
 * </p>
 *
 * @since 1.0.0
 */
public class ConnectionPool implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionPool.class);

    public static final int DEFAULT_SIZE = 5;

    static final String POOL_NAME = "host-sentinel-db";

    /** Hikari's lower bound for {@code connectionTimeout}. */
    static final Duration ACQUIRE_TIMEOUT = Duration.ofMillis(250);

    private final String jdbcUrl;
    private final int size;
    private final SQLiteConfig sqliteConfig;
    private final HikariDataSource dataSource;
    private final AtomicLong temporaryConnections = new AtomicLong();

    /**
     * @see #ConnectionPool(String, int, MeterRegistry)
     */
    public ConnectionPool(String databasePath, int size) {
        this(databasePath, size, null);
    }

    /**
     * Open a pool of {@code size} connections to the database file.
     *
     * @param databasePath  SQLite file path, created if absent
     * @param size          number of pooled connections, at least 1
     * @param meterRegistry registry for Hikari's pool meters, or {@code null}
     * @throws PersistenceException if the database cannot be opened
     */
    public ConnectionPool(String databasePath, int size, MeterRegistry meterRegistry) {
        Objects.requireNonNull(databasePath, "databasePath must not be null");
        if (size < 1) {
            throw new IllegalArgumentException("pool size must be >= 1, got: " + size);
        }
        this.jdbcUrl = "jdbc:sqlite:" + databasePath;
        this.size = size;
        this.sqliteConfig = sqliteConfig();

        HikariConfig config = new HikariConfig();
        config.setPoolName(POOL_NAME);
        config.setJdbcUrl(jdbcUrl);
        config.setDataSourceProperties(sqliteConfig.toProperties());
        config.setMaximumPoolSize(size);
        config.setMinimumIdle(size);
        config.setConnectionTimeout(ACQUIRE_TIMEOUT.toMillis());
        config.setInitializationFailTimeout(1);
        if (meterRegistry != null) {
            config.setMetricRegistry(meterRegistry);
        }

        try {
            this.dataSource = new HikariDataSource(config);
        } catch (HikariPool.PoolInitializationException e) {
            throw new PersistenceException("Failed to open connection pool for " + databasePath, e);
        }
        LOG.info("Opened pool '{}' of {} connection(s) to {}", POOL_NAME, size, databasePath);
    }

    private static SQLiteConfig sqliteConfig() {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setCacheSize(10000);
        return config;
    }

    /**
     * Run {@code work} on a pooled connection, falling back to a temporary one
     * when none frees up within the acquisition timeout.
     *
     * @throws PersistenceException if the pool is closed or {@code work} fails
     */
    public <R> R withConnection(SqlFunction<R> work) {
        if (dataSource.isClosed()) {
            throw new PersistenceException("Connection pool is closed");
        }
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLTransientConnectionException e) {
            return withTemporaryConnection(work);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to borrow a connection: " + e.getMessage(), e);
        }
        try (Connection pooled = connection) {
            return work.apply(pooled);
        } catch (SQLException e) {
            throw new PersistenceException("Database operation failed: " + e.getMessage(), e);
        }
    }

    private <R> R withTemporaryConnection(SqlFunction<R> work) {
        long count = temporaryConnections.incrementAndGet();
        LOG.warn("Connection pool exhausted ({} pooled), using temporary connection (#{})", size, count);
        try (Connection temporary = sqliteConfig.createConnection(jdbcUrl)) {
            return work.apply(temporary);
        } catch (SQLException e) {
            throw new PersistenceException("Database operation failed: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle / stats
    // ---------------------------------------------------------------

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            LOG.info("Closed pool '{}'", POOL_NAME);
        }
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    public int getSize() {
        return size;
    }

    /**
     * @return connections currently idle in the pool, 0 once closed
     */
    public int getIdleCount() {
        HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
        return dataSource.isClosed() || pool == null ? 0 : pool.getIdleConnections();
    }

    /**
     * @return connections currently borrowed from the pool
     */
    public int getActiveCount() {
        HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
        return dataSource.isClosed() || pool == null ? 0 : pool.getActiveConnections();
    }

    /**
     * @return temporary connections opened since creation
     */
    public long getTemporaryConnectionCount() {
        return temporaryConnections.get();
    }
}
