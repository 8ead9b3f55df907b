package io.hearth.core.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import org.sqlite.SQLiteConfig;

/**
 * Connection factory for one SQLite file. Write transactions start as {@code BEGIN IMMEDIATE} so a
 * read-modify-write holds the write lock from its first read.
 */
public final class SqliteDatabase {
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final Path path;
    private final String jdbcUrl;
    private final SQLiteConfig config;

    public SqliteDatabase(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        this.path = dbPath.toAbsolutePath();
        Files.createDirectories(path.getParent());
        this.jdbcUrl = "jdbc:sqlite:" + path;
        this.config = new SQLiteConfig();
        this.config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        this.config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        this.config.setBusyTimeout(BUSY_TIMEOUT_MS);
        this.config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
    }

    public Path path() {
        return path;
    }

    public Connection open() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, config.toProperties());
    }

    public static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
