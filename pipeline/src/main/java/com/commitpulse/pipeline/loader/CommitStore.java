package com.commitpulse.pipeline.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Connection target of the relational store. A plain path is opened as a
 * SQLite database file; a value starting with {@code jdbc:} is used verbatim.
 */
public final class CommitStore {

    private static final Logger logger = LoggerFactory.getLogger(CommitStore.class);

    private final String jdbcUrl;
    private final Path file;

    private CommitStore(String jdbcUrl, Path file) {
        this.jdbcUrl = jdbcUrl;
        this.file = file;
    }

    public static CommitStore forTarget(String target) {
        if (target.startsWith("jdbc:")) {
            return new CommitStore(target, null);
        }
        Path path = Path.of(target);
        return new CommitStore("jdbc:sqlite:" + path, path);
    }

    public static CommitStore forFile(Path path) {
        return new CommitStore("jdbc:sqlite:" + path, path);
    }

    /**
     * Opens a new connection, creating the parent directory of a file-backed
     * store on first use.
     */
    public Connection connect() throws SQLException {
        if (file != null) {
            ensureParentDirectory();
        }
        return DriverManager.getConnection(jdbcUrl);
    }

    /**
     * Opens a read-only connection. Nothing is created on disk; a store that
     * does not exist fails to open.
     */
    public Connection connectReadOnly() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        return DriverManager.getConnection(jdbcUrl, config.toProperties());
    }

    private void ensureParentDirectory() throws SQLException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent == null || Files.isDirectory(parent)) {
            return;
        }
        try {
            Files.createDirectories(parent);
            logger.info("Created store directory: {}", parent);
        } catch (IOException e) {
            throw new SQLException("Cannot create store directory " + parent, e);
        }
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    @Override
    public String toString() {
        return jdbcUrl;
    }
}
