package com.commitpulse.pipeline.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AppConfig} validation logic.
 */
class AppConfigTest {

    @Test
    @DisplayName("Test constructor creates config with valid values")
    void validConfig() {
        AppConfig config = new AppConfig("octo/demo", "ghp_test_token", 3, "data/commits.db", false, "reports");

        assertEquals("octo/demo", config.getGithubRepo());
        assertEquals("ghp_test_token", config.getGithubToken());
        assertEquals(3, config.getMonths());
        assertEquals("data/commits.db", config.getDbPath());
        assertFalse(config.isRunAnalysis());
        assertEquals("reports", config.getOutputDir());
    }

    @Test
    @DisplayName("Blank paths fall back to defaults")
    void blankPaths_useDefaults() {
        AppConfig config = new AppConfig("octo/demo", null, AppConfig.DEFAULT_MONTHS, "", true, null);

        assertEquals(AppConfig.DEFAULT_DB_PATH, config.getDbPath());
        assertEquals(AppConfig.DEFAULT_OUTPUT_DIR, config.getOutputDir());
    }

    @Test
    @DisplayName("A missing token is allowed")
    void missingToken_allowed() {
        AppConfig config = new AppConfig("octo/demo", "", 6, null, true, null);

        assertEquals("", config.getGithubToken());
    }

    @Test
    @DisplayName("Throws when GITHUB_REPO is missing")
    void missingRepo_throws() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig("", "token", 6, null, true, null));

        assertTrue(ex.getMessage().contains("GITHUB_REPO is required"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"octo", "octo/", "/demo", "octo/demo/extra"})
    @DisplayName("Throws when GITHUB_REPO is not owner/name")
    void malformedRepo_throws(String repo) {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig(repo, "token", 6, null, true, null));

        assertTrue(ex.getMessage().contains("owner/repo_name"));
    }

    @Test
    @DisplayName("Throws when MONTHS is not positive")
    void nonPositiveMonths_throws() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig("octo/demo", "token", 0, null, true, null));

        assertTrue(ex.getMessage().contains("MONTHS"));
    }

    @Test
    @DisplayName("Throws with all problems listed in message")
    void allInvalid_listsAll() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig(null, null, -1, null, true, null));

        assertTrue(ex.getMessage().contains("GITHUB_REPO"));
        assertTrue(ex.getMessage().contains("MONTHS"));
    }

    @Test
    @DisplayName("parseFlag accepts true, yes and 1 in any case")
    void parseFlag() {
        assertTrue(AppConfig.parseFlag("TRUE", false));
        assertTrue(AppConfig.parseFlag("yes", false));
        assertTrue(AppConfig.parseFlag(" 1 ", false));
        assertFalse(AppConfig.parseFlag("no", true));
        assertFalse(AppConfig.parseFlag("0", true));
        assertTrue(AppConfig.parseFlag(null, true));
        assertFalse(AppConfig.parseFlag("", false));
    }
}
