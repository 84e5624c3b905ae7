package com.commitpulse.pipeline.loader;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * DDL for the relational store: one identities table shared by authors and
 * committers, and one commits table referencing it twice.
 *
 * <p>Timestamps are stored as UTC text so the engine's date functions group
 * them by UTC calendar day.</p>
 */
public final class StoreSchema {

    private StoreSchema() {}

    public static final String TABLE_IDENTITIES = "identities";
    public static final String TABLE_COMMITS = "commits";

    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    static final String CREATE_IDENTITIES = """
            CREATE TABLE identities (
                id         INTEGER PRIMARY KEY AUTOINCREMENT,
                stable_key TEXT NOT NULL UNIQUE,
                login      TEXT,
                name       TEXT,
                email      TEXT
            )""";

    static final String CREATE_COMMITS = """
            CREATE TABLE commits (
                id           INTEGER PRIMARY KEY AUTOINCREMENT,
                sha          TEXT NOT NULL UNIQUE,
                author_id    INTEGER NOT NULL REFERENCES identities(id),
                committer_id INTEGER NOT NULL REFERENCES identities(id),
                authored_at  TEXT,
                committed_at TEXT NOT NULL,
                message      TEXT
            )""";

    static final String CREATE_COMMITS_AUTHOR_INDEX =
            "CREATE INDEX idx_commits_author ON commits(author_id)";

    static final String CREATE_COMMITS_COMMITTER_INDEX =
            "CREATE INDEX idx_commits_committer ON commits(committer_id)";

    static final String INSERT_IDENTITY = """
            INSERT INTO identities (stable_key, login, name, email)
            VALUES (?, ?, ?, ?)
            ON CONFLICT(stable_key) DO NOTHING""";

    static final String SELECT_IDENTITY_IDS = "SELECT id, stable_key FROM identities";

    static final String INSERT_COMMIT = """
            INSERT INTO commits (sha, author_id, committer_id, authored_at, committed_at, message)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT(sha) DO NOTHING""";

    /**
     * Statements that recreate the schema from scratch. Commits are dropped
     * first because they reference identities.
     */
    static List<String> recreateStatements() {
        return List.of(
                "DROP TABLE IF EXISTS " + TABLE_COMMITS,
                "DROP TABLE IF EXISTS " + TABLE_IDENTITIES,
                CREATE_IDENTITIES,
                CREATE_COMMITS,
                CREATE_COMMITS_AUTHOR_INDEX,
                CREATE_COMMITS_COMMITTER_INDEX);
    }

    public static String formatTimestamp(Instant instant) {
        return instant == null ? null : TIMESTAMP_FORMAT.format(instant);
    }
}
