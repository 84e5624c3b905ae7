package com.commitpulse.pipeline.analysis;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Exports analysis results as CSV files into an output directory.
 */
public class AnalysisReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisReportWriter.class);

    public static final String TOP_AUTHORS_FILE = "top_authors.csv";
    public static final String TOP_COMMITTERS_FILE = "top_committers.csv";
    public static final String LONGEST_STREAK_FILE = "longest_author_streak.csv";
    public static final String HEATMAP_FILE = "commit_heatmap.csv";

    private final Path outputDir;

    public AnalysisReportWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public Path writeTopAuthors(List<ContributorCount> rows) throws IOException {
        return writeContributors(TOP_AUTHORS_FILE, "author", rows);
    }

    public Path writeTopCommitters(List<ContributorCount> rows) throws IOException {
        return writeContributors(TOP_COMMITTERS_FILE, "committer", rows);
    }

    /**
     * Writes the streak row, or only the header when there is no streak.
     */
    public Path writeLongestStreak(Optional<Streak> streak) throws IOException {
        return write(LONGEST_STREAK_FILE,
                new String[]{"author", "streak_start", "streak_end", "streak_length"},
                printer -> {
                    if (streak.isPresent()) {
                        Streak s = streak.get();
                        printer.printRecord(s.label(), s.start(), s.end(), s.lengthDays());
                    }
                });
    }

    public Path writeHeatmap(Map<HeatmapSlot, Long> heatmap) throws IOException {
        return write(HEATMAP_FILE,
                new String[]{"day_of_week", "hour", "commit_count"},
                printer -> {
                    for (Map.Entry<HeatmapSlot, Long> cell : heatmap.entrySet()) {
                        printer.printRecord(cell.getKey().dayOfWeek(), cell.getKey().hour(), cell.getValue());
                    }
                });
    }

    private Path writeContributors(String fileName, String labelColumn, List<ContributorCount> rows)
            throws IOException {
        return write(fileName,
                new String[]{"rank", labelColumn, "commit_count"},
                printer -> {
                    for (ContributorCount row : rows) {
                        printer.printRecord(row.rank(), row.label(), row.commitCount());
                    }
                });
    }

    private Path write(String fileName, String[] header, RecordWriter body) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(fileName);

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(header)
                .setRecordSeparator("\n")
                .build();

        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(out, format)) {
            body.write(printer);
        }

        logger.info("Saved {}", target);
        return target;
    }

    @FunctionalInterface
    private interface RecordWriter {
        void write(CSVPrinter printer) throws IOException;
    }
}
