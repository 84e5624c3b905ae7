package com.commitpulse.pipeline.loader;

import com.commitpulse.pipeline.model.Identity;
import com.commitpulse.pipeline.transform.CommitRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes one run's identities and commits into the relational store.
 *
 * <p>Every load recreates the schema, so the store only ever holds the window
 * of the latest run. All statements run in one transaction; a failure rolls it
 * back and is reported as {@link LoadException}.</p>
 */
public class SqliteLoader {

    private static final Logger logger = LoggerFactory.getLogger(SqliteLoader.class);

    private final CommitStore store;

    public SqliteLoader(CommitStore store) {
        this.store = store;
    }

    /**
     * Recreates the schema and inserts the given rows. Commits repeating a sha
     * already inserted in this load are skipped; the first one is kept.
     *
     * @return number of commit rows inserted
     */
    public int load(List<Identity> identities, List<CommitRecord> commits) throws LoadException {
        logger.info("Loading {} identities and {} commits into {}",
                identities.size(), commits.size(), store);

        try (Connection connection = store.connect()) {
            try (Statement statement = connection.createStatement()) {
                statement.execute("PRAGMA foreign_keys = ON");
            }
            connection.setAutoCommit(false);

            try {
                recreateSchema(connection);
                Map<String, Long> identityIds = insertIdentities(connection, identities);
                int loaded = insertCommits(connection, commits, identityIds);
                connection.commit();

                logger.info("Loaded {} commits ({} duplicates skipped) and {} identities",
                        loaded, commits.size() - loaded, identityIds.size());
                return loaded;
            } catch (SQLException | LoadException e) {
                rollback(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new LoadException("Failed to load commits into " + store, e);
        }
    }

    // =========================================================================
    // Schema
    // =========================================================================

    void recreateSchema(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String sql : StoreSchema.recreateStatements()) {
                statement.execute(sql);
            }
        }
        logger.debug("Recreated tables {} and {}", StoreSchema.TABLE_IDENTITIES, StoreSchema.TABLE_COMMITS);
    }

    // =========================================================================
    // Rows
    // =========================================================================

    /**
     * Inserts identities and returns the generated id of each stable key.
     * A repeated stable key keeps the row inserted first.
     */
    private Map<String, Long> insertIdentities(Connection connection, List<Identity> identities)
            throws SQLException {
        try (PreparedStatement insert = connection.prepareStatement(StoreSchema.INSERT_IDENTITY)) {
            for (Identity identity : identities) {
                insert.setString(1, identity.stableKey());
                insert.setString(2, identity.login());
                insert.setString(3, identity.name());
                insert.setString(4, identity.email());
                insert.addBatch();
            }
            insert.executeBatch();
        }

        Map<String, Long> ids = new HashMap<>();
        try (Statement select = connection.createStatement();
             ResultSet rows = select.executeQuery(StoreSchema.SELECT_IDENTITY_IDS)) {
            while (rows.next()) {
                ids.put(rows.getString("stable_key"), rows.getLong("id"));
            }
        }
        return ids;
    }

    private int insertCommits(Connection connection, List<CommitRecord> commits,
                              Map<String, Long> identityIds) throws SQLException, LoadException {
        int loaded = 0;
        try (PreparedStatement insert = connection.prepareStatement(StoreSchema.INSERT_COMMIT)) {
            for (CommitRecord commit : commits) {
                insert.setString(1, commit.sha());
                insert.setLong(2, resolve(identityIds, commit.authorKey(), commit.sha()));
                insert.setLong(3, resolve(identityIds, commit.committerKey(), commit.sha()));
                insert.setString(4, StoreSchema.formatTimestamp(commit.authoredAt()));
                insert.setString(5, StoreSchema.formatTimestamp(commit.committedAt()));
                insert.setString(6, commit.message());

                int inserted = insert.executeUpdate();
                if (inserted == 0) {
                    logger.debug("Skipping duplicate commit {}", commit.sha());
                }
                loaded += inserted;
            }
        }
        return loaded;
    }

    private static long resolve(Map<String, Long> identityIds, String key, String sha) throws LoadException {
        Long id = identityIds.get(key);
        if (id == null) {
            throw new LoadException("Commit " + sha + " references unknown identity '" + key + "'");
        }
        return id;
    }

    private static void rollback(Connection connection, Exception failure) {
        try {
            connection.rollback();
        } catch (SQLException rollbackError) {
            failure.addSuppressed(rollbackError);
        }
        logger.error("Load failed, transaction rolled back: {}", failure.getMessage());
    }
}
