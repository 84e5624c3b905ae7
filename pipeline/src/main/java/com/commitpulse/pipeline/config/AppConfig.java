package com.commitpulse.pipeline.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;

/**
 * Configuration management class that reads environment variables
 * and .env file settings using dotenv-java. Validates required
 * variables on startup.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final int DEFAULT_MONTHS = 6;
    static final String DEFAULT_DB_PATH = "github_commits.db";
    static final String DEFAULT_OUTPUT_DIR = "output";

    private static final Set<String> TRUTHY = Set.of("true", "yes", "1");

    private final String githubRepo;
    private final String githubToken;
    private final int months;
    private final String dbPath;
    private final boolean runAnalysis;
    private final String outputDir;

    public AppConfig() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        this.githubRepo = resolve(dotenv, "GITHUB_REPO");
        this.githubToken = resolve(dotenv, "GITHUB_TOKEN");
        this.months = parseMonths(resolve(dotenv, "MONTHS"));
        this.dbPath = orDefault(resolve(dotenv, "DB_PATH"), DEFAULT_DB_PATH);
        this.runAnalysis = parseFlag(resolve(dotenv, "RUN_ANALYSIS"), true);
        this.outputDir = orDefault(resolve(dotenv, "OUTPUT_DIR"), DEFAULT_OUTPUT_DIR);

        validate();

        logger.info("Configuration loaded: repo={}, months={}, dbPath={}, runAnalysis={}, outputDir={}, token={}",
                githubRepo, months, dbPath, runAnalysis, outputDir, isBlank(githubToken) ? "none" : "****");
    }

    /**
     * Constructor for testing; accepts values directly.
     */
    public AppConfig(String githubRepo, String githubToken, int months, String dbPath,
                     boolean runAnalysis, String outputDir) {
        this.githubRepo = githubRepo;
        this.githubToken = githubToken;
        this.months = months;
        this.dbPath = orDefault(dbPath, DEFAULT_DB_PATH);
        this.runAnalysis = runAnalysis;
        this.outputDir = orDefault(outputDir, DEFAULT_OUTPUT_DIR);

        validate();
    }

    private void validate() {
        StringBuilder problems = new StringBuilder();
        if (isBlank(githubRepo)) {
            problems.append("GITHUB_REPO is required; ");
        } else if (!isOwnerSlashName(githubRepo)) {
            problems.append("GITHUB_REPO must be in the format 'owner/repo_name'; ");
        }
        if (months <= 0) {
            problems.append("MONTHS must be a positive integer; ");
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid configuration: " + problems.toString().trim());
        }

        if (isBlank(githubToken)) {
            logger.warn("No GitHub API token provided. Rate limits will be restrictive.");
        }
    }

    static boolean isOwnerSlashName(String repo) {
        String[] parts = repo.split("/", -1);
        return parts.length == 2 && !parts[0].isBlank() && !parts[1].isBlank();
    }

    private static int parseMonths(String value) {
        if (isBlank(value)) {
            return DEFAULT_MONTHS;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid configuration: MONTHS must be a positive integer, got '"
                    + value + "'", e);
        }
    }

    static boolean parseFlag(String value, boolean defaultValue) {
        if (isBlank(value)) {
            return defaultValue;
        }
        return TRUTHY.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    private static String resolve(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        return dotenv.get(key);
    }

    private static String orDefault(String value, String defaultValue) {
        return isBlank(value) ? defaultValue : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getGithubRepo() {
        return githubRepo;
    }

    public String getGithubToken() {
        return githubToken;
    }

    public int getMonths() {
        return months;
    }

    public String getDbPath() {
        return dbPath;
    }

    public boolean isRunAnalysis() {
        return runAnalysis;
    }

    public String getOutputDir() {
        return outputDir;
    }
}
