package com.commitpulse.pipeline.orchestrator;

import com.commitpulse.pipeline.analysis.AnalysisException;
import com.commitpulse.pipeline.analysis.AnalysisReportWriter;
import com.commitpulse.pipeline.analysis.CommitAnalyzer;
import com.commitpulse.pipeline.client.CommitFetcher;
import com.commitpulse.pipeline.client.GitHubApiClient;
import com.commitpulse.pipeline.loader.LoadException;
import com.commitpulse.pipeline.loader.SqliteLoader;
import com.commitpulse.pipeline.model.Commit;
import com.commitpulse.pipeline.model.RepositoryInfo;
import com.commitpulse.pipeline.transform.CommitTransformer;
import com.commitpulse.pipeline.transform.TransformResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Coordinates one pipeline run: extract -> transform -> load, then analyze -> export.
 * Stages run strictly in sequence and the first failure aborts the run with a
 * {@link PipelineException} naming the stage.
 */
public class PipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String STAGE_EXTRACT = "extract";
    static final String STAGE_TRANSFORM = "transform";
    static final String STAGE_LOAD = "load";
    static final String STAGE_ANALYZE = "analyze";
    static final String STAGE_EXPORT = "export";

    private final GitHubApiClient client;
    private final CommitFetcher fetcher;
    private final CommitTransformer transformer;
    private final SqliteLoader loader;

    public PipelineOrchestrator(GitHubApiClient client, SqliteLoader loader) {
        this(client, new CommitFetcher(client), new CommitTransformer(), loader);
    }

    // Visible for testing
    PipelineOrchestrator(GitHubApiClient client, CommitFetcher fetcher,
                         CommitTransformer transformer, SqliteLoader loader) {
        this.client = client;
        this.fetcher = fetcher;
        this.transformer = transformer;
        this.loader = loader;
    }

    /**
     * Runs extract, transform and load for the given scope. The store is
     * recreated, so on success it holds exactly this run's window.
     */
    public PipelineSummary runEtl(RunScope scope) throws PipelineException {
        Instant runStart = Instant.now();
        logger.info("Starting ETL pipeline for {} (since: {})", scope.repoFullName(), scope.since());

        List<StageResult> results = new ArrayList<>();

        // Step 1: Extract
        long stepStart = System.currentTimeMillis();
        List<Commit> rawCommits = extract(scope);
        results.add(new StageResult(STAGE_EXTRACT, 0, rawCommits.size(),
                System.currentTimeMillis() - stepStart));

        // Step 2: Transform
        stepStart = System.currentTimeMillis();
        TransformResult transformed;
        try {
            transformed = transformer.transform(rawCommits);
        } catch (RuntimeException e) {
            throw new PipelineException(STAGE_TRANSFORM, "Failed to transform commits", e);
        }
        results.add(new StageResult(STAGE_TRANSFORM, rawCommits.size(), transformed.commits().size(),
                System.currentTimeMillis() - stepStart));

        // Step 3: Load
        stepStart = System.currentTimeMillis();
        int loaded;
        try {
            loaded = loader.load(transformed.identities(), transformed.commits());
        } catch (LoadException e) {
            throw new PipelineException(STAGE_LOAD, "Failed to load store (state undefined, re-run required)", e);
        }
        results.add(new StageResult(STAGE_LOAD, transformed.commits().size(), loaded,
                System.currentTimeMillis() - stepStart));

        PipelineSummary summary = new PipelineSummary(scope, results, elapsed(runStart));
        logSummary(summary);
        return summary;
    }

    /**
     * Runs every analysis against the store and exports them as CSV.
     */
    public AnalysisReport analyze(CommitAnalyzer analyzer, AnalysisReportWriter writer)
            throws PipelineException {
        AnalysisReport report;
        try {
            report = new AnalysisReport(
                    analyzer.topAuthors(),
                    analyzer.topCommitters(),
                    analyzer.longestStreak(),
                    analyzer.heatmap());
        } catch (AnalysisException e) {
            throw new PipelineException(STAGE_ANALYZE, "Analysis failed", e);
        }

        try {
            writer.writeTopAuthors(report.topAuthors());
            writer.writeTopCommitters(report.topCommitters());
            writer.writeLongestStreak(report.longestStreak());
            writer.writeHeatmap(report.heatmap());
        } catch (IOException e) {
            throw new PipelineException(STAGE_EXPORT, "Failed to write analysis files", e);
        }

        logger.info("All analyses completed");
        return report;
    }

    private List<Commit> extract(RunScope scope) throws PipelineException {
        String repo = scope.repoFullName();
        try {
            RepositoryInfo info = client.getRepository(repo);
            logger.info("Repository {} found (id: {})", info.fullName(), info.id());

            List<Commit> commits = fetcher.fetchCommits(repo, scope.since());
            if (commits.isEmpty()) {
                throw new PipelineException(STAGE_EXTRACT,
                        "No commits found for " + repo + " since " + scope.since());
            }
            return commits;
        } catch (IOException e) {
            throw new PipelineException(STAGE_EXTRACT, "Failed to fetch commits for " + repo, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(STAGE_EXTRACT, "Interrupted while fetching commits for " + repo, e);
        }
    }

    private void logSummary(PipelineSummary summary) {
        logger.info("=== ETL Summary for {} ===", summary.scope().repoFullName());
        logger.info("Total duration: {}ms", summary.totalDurationMs());
        for (StageResult stage : summary.stages()) {
            logger.info("  {}: in={}, out={}, {}ms",
                    stage.stage(), stage.recordsIn(), stage.recordsOut(), stage.durationMs());
        }
    }

    private long elapsed(Instant start) {
        return Instant.now().toEpochMilli() - start.toEpochMilli();
    }
}
