package com.commitpulse.pipeline.orchestrator;

import com.commitpulse.pipeline.analysis.AnalysisReportWriter;
import com.commitpulse.pipeline.analysis.CommitAnalyzer;
import com.commitpulse.pipeline.analysis.ContributorCount;
import com.commitpulse.pipeline.analysis.HeatmapSlot;
import com.commitpulse.pipeline.client.GitHubApiClient;
import com.commitpulse.pipeline.config.AppConfig;
import com.commitpulse.pipeline.loader.CommitStore;
import com.commitpulse.pipeline.loader.SqliteLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main entry point for the commit history pipeline.
 * Loads configuration, runs the ETL pipeline, optionally runs the analyses,
 * and exits with appropriate status codes.
 *
 * <p>Usage:
 * <pre>
 *   java -jar pipeline.jar                  # extract, transform, load, then analyze
 *   java -jar pipeline.jar --analyze-only   # analyze an existing store only
 * </pre>
 */
public class PipelineApp {

    private static final Logger logger = LoggerFactory.getLogger(PipelineApp.class);

    public static void main(String[] args) {
        boolean analyzeOnly = parseAnalyzeOnly(args);
        logger.info("Starting Commit Pulse (mode: {})", analyzeOnly ? "ANALYZE-ONLY" : "ETL");

        try {
            AppConfig config = new AppConfig();
            CommitStore store = CommitStore.forTarget(config.getDbPath());
            GitHubApiClient client = new GitHubApiClient(config.getGithubToken());
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(client, new SqliteLoader(store));

            if (!analyzeOnly) {
                RunScope scope = RunScope.trailingMonths(
                        config.getGithubRepo(), config.getMonths(), Clock.systemUTC());
                PipelineSummary summary = orchestrator.runEtl(scope);
                printSummary(summary);
            }

            if (analyzeOnly || config.isRunAnalysis()) {
                AnalysisReport report = orchestrator.analyze(
                        new CommitAnalyzer(store),
                        new AnalysisReportWriter(Path.of(config.getOutputDir())));
                printReport(report);
            }

            logger.info("Commit Pulse finished successfully.");
            System.exit(0);

        } catch (PipelineException e) {
            logger.error("Pipeline aborted in stage '{}'", e.getStage(), e);
            System.exit(1);
        } catch (Exception e) {
            logger.error("Fatal error during pipeline run", e);
            System.exit(1);
        }
    }

    static boolean parseAnalyzeOnly(String[] args) {
        for (String arg : args) {
            if ("--analyze-only".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static void printSummary(PipelineSummary summary) {
        System.out.println();
        System.out.println("=== Commit Pulse ETL Summary ===");
        System.out.println("Repository: " + summary.scope().repoFullName());
        System.out.println("Window:     " + summary.scope().since() + " .. " + summary.scope().until());
        System.out.println("Duration:   " + summary.totalDurationMs() + "ms");
        System.out.println();
        for (StageResult stage : summary.stages()) {
            System.out.printf("  %-10s in=%-6d out=%-6d %dms%n",
                    stage.stage(), stage.recordsIn(), stage.recordsOut(), stage.durationMs());
        }
        System.out.println();
    }

    private static void printReport(AnalysisReport report) {
        printContributors("Top authors:", report.topAuthors());
        printContributors("Top committers:", report.topCommitters());
        report.longestStreak().ifPresentOrElse(
                streak -> System.out.printf("Longest streak: %s, %d days (%s to %s)%n",
                        streak.label(), streak.lengthDays(), streak.start(), streak.end()),
                () -> System.out.println("Longest streak: none"));
        System.out.println("Heatmap cells populated: " + report.heatmap().size());
        busiestSlot(report.heatmap()).ifPresent(cell -> System.out.printf(
                "Busiest slot: %s %02d:00 UTC, %d commits%n",
                cell.getKey().dayName(), cell.getKey().hour(), cell.getValue()));
        System.out.println();
    }

    /**
     * Most populated heatmap cell; ties go to the first cell in map order.
     */
    static Optional<Map.Entry<HeatmapSlot, Long>> busiestSlot(Map<HeatmapSlot, Long> heatmap) {
        Map.Entry<HeatmapSlot, Long> busiest = null;
        for (Map.Entry<HeatmapSlot, Long> cell : heatmap.entrySet()) {
            if (busiest == null || cell.getValue() > busiest.getValue()) {
                busiest = cell;
            }
        }
        return Optional.ofNullable(busiest);
    }

    private static void printContributors(String title, List<ContributorCount> rows) {
        System.out.println(title);
        for (ContributorCount row : rows) {
            System.out.printf("  %d. %-30s %d%n", row.rank(), row.label(), row.commitCount());
        }
    }
}
