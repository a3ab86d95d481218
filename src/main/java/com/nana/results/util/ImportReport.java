package com.nana.results.util;

import com.nana.results.domain.Dataset;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * ImportReport - Outcome of Reading One Mark Sheet
 *
 * <p>Readers never throw for bad input. They return this report, which
 * carries the decoded {@link Dataset} (null when the file could not be
 * read at all) plus one {@link RowResult} per data row that was imported,
 * skipped or rejected.
 */
public final class ImportReport {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path sourceFile;
    private final LocalDateTime importedAt;
    private final Dataset dataset;
    private final int totalRows;
    private final int successCount;
    private final int failureCount;
    private final int skippedCount;
    private final List<RowResult> rowResults;

    private ImportReport(Builder builder) {
        this.sourceFile   = builder.sourceFile;
        this.importedAt   = builder.importedAt;
        this.dataset      = builder.dataset;
        this.totalRows    = builder.totalRows;
        this.successCount = builder.successCount;
        this.failureCount = builder.failureCount;
        this.skippedCount = builder.skippedCount;
        this.rowResults   = Collections.unmodifiableList(new ArrayList<>(builder.rowResults));
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public Path getSourceFile()            { return sourceFile; }

    public LocalDateTime getImportedAt()   { return importedAt; }

    /** @return the decoded sheet, or null if the file could not be read */
    public Dataset getDataset()            { return dataset; }

    public boolean hasDataset()            { return dataset != null; }

    /** @return data rows imported or rejected (skipped rows excluded) */
    public int getTotalRows()              { return totalRows; }

    public int getSuccessCount()           { return successCount; }

    public int getFailureCount()           { return failureCount; }

    public int getSkippedCount()           { return skippedCount; }

    public List<RowResult> getRowResults() { return rowResults; }

    /** @return rejected rows only */
    public List<RowResult> getFailedRows() {
        return rowResults.stream()
                .filter(RowResult::isFailure)
                .collect(Collectors.toList());
    }

    public boolean isFullSuccess() {
        return dataset != null && failureCount == 0;
    }

    /**
     * @return summary line (e.g., "Imported 47 of 50 rows. 3 failed.")
     */
    public String getSummary() {
        if (dataset == null) {
            return "The file could not be imported.";
        }
        if (totalRows == 0) {
            return "No data rows found in the file.";
        }
        if (failureCount == 0) {
            return String.format("Successfully imported all %d rows.", totalRows);
        }
        return String.format("Imported %d of %d rows. %d failed.", successCount, totalRows, failureCount);
    }

    /**
     * Plain-text report listing every rejected row.
     *
     * @return multi-line report
     */
    public String toReportText() {
        StringBuilder sb = new StringBuilder();
        String line60  = "=".repeat(60);
        String line60d = "-".repeat(60);

        sb.append(line60).append("\n");
        sb.append(" Result Analytics - Import Report\n");
        sb.append(line60).append("\n");
        sb.append(String.format(" %-14s: %s%n", "Source File",
                sourceFile != null ? sourceFile.getFileName() : "Unknown"));
        sb.append(String.format(" %-14s: %s%n", "Imported At", importedAt.format(DISPLAY_FORMAT)));
        sb.append(String.format(" %-14s: %d%n", "Total Rows", totalRows));
        sb.append(String.format(" %-14s: %d%n", "Succeeded", successCount));
        sb.append(String.format(" %-14s: %d%n", "Failed", failureCount));
        sb.append(String.format(" %-14s: %d%n", "Skipped", skippedCount));
        sb.append(line60d).append("\n");

        List<RowResult> failed = getFailedRows();
        if (failed.isEmpty()) {
            sb.append(" All rows imported successfully.\n");
        } else {
            sb.append(" FAILED ROWS:\n");
            sb.append(line60d).append("\n");
            for (RowResult rr : failed) {
                sb.append(String.format(" Row %-5d | %-20s | %s%n",
                        rr.getRowNumber(), rr.getOutcome().name(), rr.getErrorMessage()));
                if (rr.getRawLine() != null && !rr.getRawLine().isBlank()) {
                    String raw = rr.getRawLine();
                    if (raw.length() > 80) {
                        raw = raw.substring(0, 77) + "...";
                    }
                    sb.append(String.format("         | Raw: %s%n", raw));
                }
            }
        }
        sb.append(line60).append("\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ImportReport{total=" + totalRows
               + ", success=" + successCount
               + ", failed=" + failureCount
               + ", skipped=" + skippedCount + "}";
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: RowResult
    // -----------------------------------------------------------------------

    /** Outcome of one source row. Row numbers are 1-based file lines or sheet rows. */
    public static final class RowResult {

        public enum Outcome {
            SUCCESS,
            SKIPPED,
            PARSE_ERROR,
            WRONG_COLUMN_COUNT,
            UNEXPECTED_ERROR
        }

        private final int rowNumber;
        private final String rawLine;
        private final Outcome outcome;
        private final String errorMessage;

        public RowResult(int rowNumber, String rawLine, Outcome outcome, String errorMessage) {
            this.rowNumber    = rowNumber;
            this.rawLine      = rawLine;
            this.outcome      = outcome;
            this.errorMessage = errorMessage == null ? "" : errorMessage;
        }

        public int getRowNumber()       { return rowNumber; }

        public String getRawLine()      { return rawLine; }

        public Outcome getOutcome()     { return outcome; }

        public String getErrorMessage() { return errorMessage; }

        public boolean isSuccess()      { return outcome == Outcome.SUCCESS; }

        public boolean isFailure()      { return outcome != Outcome.SUCCESS && outcome != Outcome.SKIPPED; }

        @Override
        public String toString() {
            return "RowResult{row=" + rowNumber + ", outcome=" + outcome
                   + (errorMessage.isBlank() ? "" : ", error='" + errorMessage + "'") + "}";
        }
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: Builder
    // -----------------------------------------------------------------------

    /** Row-by-row accumulator used by the readers. */
    public static final class Builder {

        private final Path sourceFile;
        private final LocalDateTime importedAt;
        private Dataset dataset;
        private int totalRows;
        private int successCount;
        private int failureCount;
        private int skippedCount;
        private final List<RowResult> rowResults = new ArrayList<>();

        public Builder(Path sourceFile) {
            this.sourceFile = sourceFile;
            this.importedAt = LocalDateTime.now();
        }

        public Builder addSuccess(int rowNumber, String rawLine) {
            rowResults.add(new RowResult(rowNumber, rawLine, RowResult.Outcome.SUCCESS, ""));
            totalRows++;
            successCount++;
            return this;
        }

        public Builder addSkipped(int rowNumber, String rawLine, String reason) {
            rowResults.add(new RowResult(rowNumber, rawLine, RowResult.Outcome.SKIPPED, reason));
            skippedCount++;
            return this;
        }

        public Builder addFailure(int rowNumber, String rawLine,
                                  RowResult.Outcome outcome, String errorMessage) {
            rowResults.add(new RowResult(rowNumber, rawLine, outcome, errorMessage));
            totalRows++;
            failureCount++;
            return this;
        }

        public Builder dataset(Dataset dataset) {
            this.dataset = dataset;
            return this;
        }

        public ImportReport build() {
            return new ImportReport(this);
        }
    }
}
