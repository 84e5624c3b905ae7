package com.commitpulse.pipeline.analysis;

import com.commitpulse.pipeline.loader.CommitStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only analytical queries over a loaded store. Queries may run in any
 * order and any number of times; none of them mutates the store.
 */
public class CommitAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(CommitAnalyzer.class);

    public static final int DEFAULT_LIMIT = 5;

    private static final String IDENTITY_LABEL = "COALESCE(i.login, i.name, i.email, 'Unknown')";

    // Ties keep identity insertion order.
    static final String TOP_AUTHORS_QUERY = """
            SELECT %s AS label, COUNT(c.id) AS commit_count
            FROM commits c
            JOIN identities i ON c.author_id = i.id
            GROUP BY i.id
            ORDER BY commit_count DESC, i.id ASC
            LIMIT ?""".formatted(IDENTITY_LABEL);

    static final String TOP_COMMITTERS_QUERY = """
            SELECT %s AS label, COUNT(c.id) AS commit_count
            FROM commits c
            JOIN identities i ON c.committer_id = i.id
            GROUP BY i.id
            ORDER BY commit_count DESC, i.id ASC
            LIMIT ?""".formatted(IDENTITY_LABEL);

    /*
     * Gap grouping: within one author's ascending active days, day ordinal minus
     * row number is constant across consecutive days and jumps at every gap.
     */
    static final String LONGEST_STREAK_QUERY = """
            WITH active_days AS (
                SELECT c.author_id AS author_id, DATE(c.authored_at) AS active_day
                FROM commits c
                WHERE c.authored_at IS NOT NULL
                GROUP BY c.author_id, DATE(c.authored_at)
            ),
            numbered_days AS (
                SELECT author_id,
                       active_day,
                       CAST(julianday(active_day) AS INTEGER)
                           - ROW_NUMBER() OVER (PARTITION BY author_id ORDER BY active_day) AS group_id
                FROM active_days
            ),
            streaks AS (
                SELECT author_id,
                       MIN(active_day) AS streak_start,
                       MAX(active_day) AS streak_end,
                       COUNT(*) AS streak_length
                FROM numbered_days
                GROUP BY author_id, group_id
            )
            SELECT %s AS label, s.streak_start, s.streak_end, s.streak_length
            FROM streaks s
            JOIN identities i ON s.author_id = i.id
            ORDER BY s.streak_length DESC, s.streak_start ASC, s.author_id ASC
            LIMIT 1""".formatted(IDENTITY_LABEL);

    static final String HEATMAP_QUERY = """
            SELECT CAST(strftime('%w', authored_at) AS INTEGER) AS day_of_week,
                   CAST(strftime('%H', authored_at) AS INTEGER) AS hour,
                   COUNT(*) AS commit_count
            FROM commits
            WHERE authored_at IS NOT NULL
            GROUP BY day_of_week, hour
            ORDER BY day_of_week, hour""";

    private final CommitStore store;

    public CommitAnalyzer(CommitStore store) {
        this.store = store;
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public List<ContributorCount> topAuthors() throws AnalysisException {
        return topAuthors(DEFAULT_LIMIT);
    }

    /**
     * Authors ranked by number of authored commits.
     */
    public List<ContributorCount> topAuthors(int limit) throws AnalysisException {
        logger.info("Analyzing top {} authors by commit count", limit);
        return topContributors(TOP_AUTHORS_QUERY, limit);
    }

    public List<ContributorCount> topCommitters() throws AnalysisException {
        return topCommitters(DEFAULT_LIMIT);
    }

    /**
     * Committers ranked by number of committed commits.
     */
    public List<ContributorCount> topCommitters(int limit) throws AnalysisException {
        logger.info("Analyzing top {} committers by commit count", limit);
        return topContributors(TOP_COMMITTERS_QUERY, limit);
    }

    /**
     * The author with the longest run of consecutive active days (by UTC
     * authored date). Ties go to the earliest streak start.
     *
     * @return empty when the store holds no dated commits
     */
    public Optional<Streak> longestStreak() throws AnalysisException {
        logger.info("Analyzing author with longest commit streak");
        List<Streak> rows = query(LONGEST_STREAK_QUERY, statement -> { }, rs -> new Streak(
                rs.getString("label"),
                LocalDate.parse(rs.getString("streak_start")),
                LocalDate.parse(rs.getString("streak_end")),
                rs.getInt("streak_length")));

        if (rows.isEmpty()) {
            logger.warn("No commit streaks found");
            return Optional.empty();
        }
        Streak streak = rows.get(0);
        logger.info("Longest streak: {} with {} consecutive days ({} to {})",
                streak.label(), streak.lengthDays(), streak.start(), streak.end());
        return Optional.of(streak);
    }

    /**
     * Commit counts per (day of week, hour of day) of the authored timestamp.
     * Only populated slots are present.
     */
    public Map<HeatmapSlot, Long> heatmap() throws AnalysisException {
        logger.info("Generating commit heatmap by day of week and hour of day");
        List<Map.Entry<HeatmapSlot, Long>> rows = query(HEATMAP_QUERY, statement -> { }, rs -> Map.entry(
                new HeatmapSlot(rs.getInt("day_of_week"), rs.getInt("hour")),
                rs.getLong("commit_count")));

        Map<HeatmapSlot, Long> heatmap = new LinkedHashMap<>();
        rows.forEach(row -> heatmap.put(row.getKey(), row.getValue()));

        if (heatmap.isEmpty()) {
            logger.warn("No commit data found for heatmap");
        }
        return heatmap;
    }

    // =========================================================================
    // JDBC plumbing
    // =========================================================================

    private List<ContributorCount> topContributors(String sql, int limit) throws AnalysisException {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        List<Map.Entry<String, Long>> rows = query(sql, statement -> statement.setInt(1, limit),
                rs -> Map.entry(rs.getString("label"), rs.getLong("commit_count")));

        List<ContributorCount> ranked = new ArrayList<>(rows.size());
        for (Map.Entry<String, Long> row : rows) {
            ranked.add(new ContributorCount(ranked.size() + 1, row.getKey(), row.getValue()));
        }
        return ranked;
    }

    private <T> List<T> query(String sql, ParameterBinder binder, RowMapper<T> mapper)
            throws AnalysisException {
        try (Connection connection = store.connectReadOnly();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            binder.bind(statement);
            List<T> results = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new AnalysisException("Analysis query failed against " + store
                    + " (was the store loaded?)", e);
        }
    }

    @FunctionalInterface
    private interface ParameterBinder {
        void bind(PreparedStatement statement) throws SQLException;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }
}
