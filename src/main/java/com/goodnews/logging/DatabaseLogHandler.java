package com.goodnews.logging;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.text.MessageFormat;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.ErrorManager;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Ships JUL records to the central {@code app_logs} table on a background thread.
 * Construction fails with {@link IllegalStateException} when no JDBC URL is configured.
 */
public final class DatabaseLogHandler extends Handler {

    private static final String INSERT_SQL = """
        INSERT INTO app_logs (logged_at, level, logger, message, details, thread_name, host, thrown_type, thrown_msg)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    private static final int QUEUE_CAPACITY = 512;

    private final BlockingQueue<LogRecord> pending = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private final HikariDataSource dataSource;
    private final String hostName;
    private final Thread writer;

    private volatile boolean open = true;

    public DatabaseLogHandler() {
        this(LogDatabaseSettings.resolve());
    }

    DatabaseLogHandler(LogDatabaseSettings settings) {
        if (!settings.enabled()) {
            throw new IllegalStateException("no JDBC URL configured for " + LogDatabaseSettings.RESOURCE_NAME);
        }
        this.dataSource = openPool(settings);
        this.hostName = localHostName();
        this.writer = new Thread(this::writeLoop, "goodnews-log-writer");
        this.writer.setDaemon(true);
        this.writer.start();
        setLevel(Level.ALL);
    }

    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record);
        if (!open || !isLoggable(record)) {
            return;
        }
        while (!pending.offer(record)) {
            // oldest records are dropped first when the database falls behind
            pending.poll();
        }
    }

    @Override
    public void flush() {
        // records are written by the background thread
    }

    @Override
    public void close() {
        open = false;
        writer.interrupt();
        try {
            writer.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
        dataSource.close();
    }

    private void writeLoop() {
        while (open) {
            try {
                LogRecord record = pending.poll(500, TimeUnit.MILLISECONDS);
                if (record != null) {
                    insert(record);
                }
            } catch (InterruptedException interrupted) {
                break;
            } catch (SQLException ex) {
                reportError("Failed to write log record", ex, ErrorManager.WRITE_FAILURE);
            }
        }

        // clear a pending interrupt so the pool hands out connections for the final drain
        Thread.interrupted();
        LogRecord leftover;
        while ((leftover = pending.poll()) != null) {
            try {
                insert(leftover);
            } catch (SQLException ex) {
                reportError("Failed to write log record during shutdown", ex, ErrorManager.CLOSE_FAILURE);
            }
        }
    }

    private void insert(LogRecord record) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            Throwable thrown = record.getThrown();
            statement.setTimestamp(1, Timestamp.from(Instant.ofEpochMilli(record.getMillis())));
            statement.setString(2, record.getLevel().getName());
            statement.setString(3, record.getLoggerName());
            statement.setString(4, render(record));
            statement.setString(5, details(record));
            statement.setString(6, record.getThreadID() == 0 ? null : "thread-" + record.getThreadID());
            statement.setString(7, hostName);
            statement.setString(8, thrown == null ? null : thrown.getClass().getName());
            statement.setString(9, thrown == null ? null : thrown.getMessage());
            statement.executeUpdate();
        }
    }

    private static String render(LogRecord record) {
        String message = record.getMessage();
        Object[] params = record.getParameters();
        if (message == null) {
            return "";
        }
        if (params == null || params.length == 0) {
            return message;
        }
        try {
            return MessageFormat.format(message, params);
        } catch (IllegalArgumentException ex) {
            return message;
        }
    }

    private static String details(LogRecord record) {
        Object[] params = record.getParameters();
        return (params == null || params.length == 0) ? null : Arrays.toString(params);
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    private static HikariDataSource openPool(LogDatabaseSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.url());
        config.setUsername(settings.username());
        config.setPassword(settings.password());
        config.setMaximumPoolSize(settings.poolSize());
        config.setPoolName("GoodNewsLogPool");
        config.setAutoCommit(true);
        config.setInitializationFailTimeout(-1);
        return new HikariDataSource(config);
    }
}
