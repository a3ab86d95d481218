package com.nana.results.util;

import com.nana.results.domain.StudentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * CsvExporter - Processed Records to CSV
 *
 * <p>Output format: UTF-8 with BOM (so spreadsheet tools detect the
 * encoding), CRLF line endings, RFC 4180 quoting, and a leading
 * {@code #} metadata comment that {@link MarkSheetCsvReader} skips.
 */
public class CsvExporter {

    private static final Logger log = LoggerFactory.getLogger(CsvExporter.class);

    private static final String CRLF = "\r\n";

    private static final byte[] UTF8_BOM = new byte[]{
            (byte) 0xEF, (byte) 0xBB, (byte) 0xBF
    };

    private static final DateTimeFormatter META_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // -----------------------------------------------------------------------
    // PUBLIC EXPORT METHODS
    // -----------------------------------------------------------------------

    public ExportResult exportAll(List<StudentRecord> records, Path outputPath) {
        return exportWithColumns(records, outputPath, Arrays.asList(CsvColumn.defaultColumns()));
    }

    public ExportResult exportRanking(List<StudentRecord> records, Path outputPath) {
        return exportWithColumns(records, outputPath, Arrays.asList(CsvColumn.rankingColumns()));
    }

    /**
     * Writes records with a chosen column list.
     *
     * @param records    records in output order
     * @param outputPath target file; parent directories are created
     * @param columns    columns in output order
     * @return success with row count and size, or failure with a message
     */
    public ExportResult exportWithColumns(List<StudentRecord> records,
                                          Path outputPath,
                                          List<CsvColumn> columns) {
        if (records == null) {
            return ExportResult.failure("Record list must not be null.");
        }
        if (outputPath == null) {
            return ExportResult.failure("Output path must not be null.");
        }
        if (columns == null || columns.isEmpty()) {
            return ExportResult.failure("Column list must not be null or empty.");
        }

        log.info("Starting CSV export: {} records, {} columns, to '{}'.",
                records.size(), columns.size(), outputPath);
        AppLogger.setOperationContext(AppLogger.OP_CSV_EXPORT);
        try {
            ensureParentDirectory(outputPath);
            writeCsvFile(records, outputPath, columns);

            long fileSizeBytes = Files.size(outputPath);
            log.info("CSV export complete: {} rows written, file size {} bytes.",
                    records.size(), fileSizeBytes);
            AppLogger.logEvent("CSV_EXPORT_COMPLETE",
                    "rows=" + records.size()
                    + ", columns=" + columns.size()
                    + ", file=" + outputPath.getFileName()
                    + ", size=" + fileSizeBytes + "B");
            return ExportResult.success(outputPath, records.size(), fileSizeBytes);
        } catch (IOException ex) {
            log.error("CSV export failed for path '{}'.", outputPath, ex);
            AppLogger.logErrorEvent("CSV_EXPORT_FAILED", "path=" + outputPath, ex);
            return ExportResult.failure("Export failed: " + ex.getMessage());
        } finally {
            AppLogger.clearOperationContext();
        }
    }

    // -----------------------------------------------------------------------
    // PRIVATE IMPLEMENTATION
    // -----------------------------------------------------------------------

    private void ensureParentDirectory(Path outputPath) throws IOException {
        Path parent = outputPath.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
            log.debug("Created export directory: {}", parent);
        }
    }

    private void writeCsvFile(List<StudentRecord> records,
                              Path outputPath,
                              List<CsvColumn> columns) throws IOException {
        // BOM first, then append the text
        Files.write(outputPath, UTF8_BOM,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING);

        try (BufferedWriter writer = Files.newBufferedWriter(
                outputPath, StandardCharsets.UTF_8, StandardOpenOption.APPEND)) {
            writer.write("# Result Analytics Export | Generated: "
                    + LocalDateTime.now().format(META_FORMAT)
                    + " | Rows: " + records.size()
                    + " | Columns: " + columns.size());
            writer.write(CRLF);

            StringBuilder header = new StringBuilder();
            for (int i = 0; i < columns.size(); i++) {
                if (i > 0) header.append(',');
                header.append(escapeCsvField(columns.get(i).getHeaderName()));
            }
            writer.write(header.toString());
            writer.write(CRLF);

            for (StudentRecord record : records) {
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < columns.size(); i++) {
                    if (i > 0) sb.append(',');
                    sb.append(escapeCsvField(columns.get(i).extract(record)));
                }
                writer.write(sb.toString());
                writer.write(CRLF);
            }
        }
    }

    /**
     * Quotes a field when it contains a comma, quote or line break;
     * embedded quotes are doubled.
     *
     * @param value raw value; null becomes an empty field
     * @return the escaped field
     */
    public static String escapeCsvField(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        boolean needsQuoting = value.contains(",")
                || value.contains("\"")
                || value.contains("\r")
                || value.contains("\n");
        if (!needsQuoting) {
            return value;
        }
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}
