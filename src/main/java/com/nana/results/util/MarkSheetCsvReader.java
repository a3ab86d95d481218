package com.nana.results.util;

import com.nana.results.domain.CellValues;
import com.nana.results.domain.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MarkSheetCsvReader - CSV Mark Sheet Import
 *
 * <p>Decodes a wide-format mark sheet saved as CSV into a {@link Dataset}.
 *
 * <p>PARSING:
 * A minimal RFC 4180 parser: quoted fields, {@code ""} escapes, commas
 * and line breaks inside quotes, UTF-8 BOM, CRLF or LF line endings.
 * Blank lines and lines starting with {@code #} are skipped.
 *
 * <p>HEADER:
 * The first remaining line is the header. If the line after it is a
 * sub-header (see {@link HeaderFlattener#isSubHeader(List)}) the two are
 * flattened into {@code "<CODE> <Role>"} names; otherwise the single
 * header is used as is.
 *
 * <p>All cell values stay text; numeric coercion happens downstream.
 * Problems never throw: they end up in the returned {@link ImportReport}.
 */
public class MarkSheetCsvReader {

    private static final Logger log = LoggerFactory.getLogger(MarkSheetCsvReader.class);

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Reads a CSV mark sheet.
     *
     * @param csvFilePath source file
     * @return import report carrying the dataset, named after the file
     */
    public ImportReport read(Path csvFilePath) {
        Objects.requireNonNull(csvFilePath, "csvFilePath");
        log.info("Starting CSV import: file='{}'.", csvFilePath);
        AppLogger.setOperationContext(AppLogger.OP_CSV_IMPORT);

        ImportReport.Builder report = new ImportReport.Builder(csvFilePath);
        try {
            validateFile(csvFilePath);
            List<String> lines = readLines(csvFilePath);
            log.debug("Read {} lines from file.", lines.size());
            decode(csvFilePath.getFileName().toString(), lines, report);
        } catch (IOException ex) {
            log.error("Failed to read import file '{}'.", csvFilePath, ex);
            AppLogger.logErrorEvent("CSV_IMPORT_IO_ERROR", "file=" + csvFilePath, ex);
            report.addFailure(0, "", ImportReport.RowResult.Outcome.UNEXPECTED_ERROR,
                    "Failed to read file: " + ex.getMessage());
        } finally {
            AppLogger.clearOperationContext();
        }

        ImportReport built = report.build();
        AppLogger.logEvent("CSV_IMPORT_COMPLETE", built.toString());
        log.info("Import complete: {}", built.getSummary());
        return built;
    }

    /**
     * Decodes CSV text that is already in memory.
     *
     * @param name    dataset name
     * @param content CSV text
     * @return import report carrying the dataset
     */
    public ImportReport read(String name, String content) {
        ImportReport.Builder report = new ImportReport.Builder(null);
        decode(name, splitLines(content), report);
        return report.build();
    }

    // -----------------------------------------------------------------------
    // DECODING
    // -----------------------------------------------------------------------

    private void decode(String name, List<String> lines, ImportReport.Builder report) {
        List<Record> records = assembleRecords(lines, report);
        if (records.isEmpty()) {
            AppLogger.logWarningEvent("CSV_IMPORT_EMPTY", "dataset=" + name);
            report.addFailure(0, "", ImportReport.RowResult.Outcome.PARSE_ERROR,
                    "No header row found.");
            return;
        }

        Record header = records.get(0);
        List<String> headerFields;
        try {
            headerFields = parseCsvRow(header.text);
        } catch (IllegalArgumentException ex) {
            report.addFailure(header.lineNumber, header.text,
                    ImportReport.RowResult.Outcome.PARSE_ERROR, "Header " + ex.getMessage());
            return;
        }

        int firstData = 1;
        List<String> columnsByPosition = HeaderFlattener.single(headerFields);
        if (records.size() > 1) {
            List<String> second = parseCsvRowSafe(records.get(1).text);
            if (HeaderFlattener.isSubHeader(second)) {
                columnsByPosition = HeaderFlattener.flatten(headerFields, second);
                firstData = 2;
                log.debug("Two-row header detected and flattened.");
            }
        }
        List<String> columns = new ArrayList<>();
        columnsByPosition.stream().filter(Objects::nonNull).forEach(columns::add);

        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = firstData; i < records.size(); i++) {
            Record record = records.get(i);
            List<String> fields;
            try {
                fields = parseCsvRow(record.text);
            } catch (IllegalArgumentException ex) {
                report.addFailure(record.lineNumber, record.text,
                        ImportReport.RowResult.Outcome.PARSE_ERROR, "CSV parse error: " + ex.getMessage());
                continue;
            }
            if (hasValuesBeyond(fields, columnsByPosition.size())) {
                report.addFailure(record.lineNumber, record.text,
                        ImportReport.RowResult.Outcome.WRONG_COLUMN_COUNT,
                        "Expected at most " + columnsByPosition.size()
                        + " columns, found " + fields.size() + ".");
                continue;
            }
            Map<String, Object> cells = new LinkedHashMap<>();
            for (int c = 0; c < columnsByPosition.size(); c++) {
                String column = columnsByPosition.get(c);
                if (column != null) {
                    cells.put(column, c < fields.size() ? fields.get(c) : null);
                }
            }
            if (cells.values().stream().allMatch(CellValues::isBlank)) {
                report.addSkipped(record.lineNumber, record.text, "Blank row");
                continue;
            }
            rows.add(cells);
            report.addSuccess(record.lineNumber, record.text);
        }

        Dataset dataset = Dataset.of(name, columns, rows);
        report.dataset(dataset);
        log.debug("Decoded {} with {} column(s).", dataset, columns.size());
    }

    private static boolean hasValuesBeyond(List<String> fields, int width) {
        for (int i = width; i < fields.size(); i++) {
            if (!fields.get(i).isBlank()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Joins physical lines into CSV records (a quoted field may span lines)
     * and drops blank and comment lines.
     */
    private List<Record> assembleRecords(List<String> lines, ImportReport.Builder report) {
        List<Record> records = new ArrayList<>();
        StringBuilder pending = null;
        int pendingStart = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int lineNumber = i + 1;
            if (pending != null) {
                pending.append('\n').append(line);
                if (quotesBalanced(pending)) {
                    records.add(new Record(pendingStart, pending.toString()));
                    pending = null;
                }
                continue;
            }
            if (line.isBlank()) {
                report.addSkipped(lineNumber, line, "Blank line");
                continue;
            }
            if (line.startsWith("#")) {
                report.addSkipped(lineNumber, line, "Comment line");
                continue;
            }
            if (quotesBalanced(line)) {
                records.add(new Record(lineNumber, line));
            } else {
                pending = new StringBuilder(line);
                pendingStart = lineNumber;
            }
        }
        if (pending != null) {
            // unterminated quote; parseCsvRow reports it
            records.add(new Record(pendingStart, pending.toString()));
        }
        return records;
    }

    private static boolean quotesBalanced(CharSequence text) {
        int quotes = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '"') {
                quotes++;
            }
        }
        return quotes % 2 == 0;
    }

    // -----------------------------------------------------------------------
    // FILE HANDLING
    // -----------------------------------------------------------------------

    private void validateFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("File does not exist: " + path.toAbsolutePath());
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("Path is not a regular file: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new IOException("File is not readable (check permissions): " + path);
        }
    }

    private List<String> readLines(Path path) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            boolean firstLine = true;
            while ((line = reader.readLine()) != null) {
                if (firstLine) {
                    line = stripBom(line);
                    firstLine = false;
                }
                lines.add(line);
            }
        }
        return lines;
    }

    private static List<String> splitLines(String content) {
        List<String> lines = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return lines;
        }
        String[] parts = stripBom(content).split("\r\n|\n|\r", -1);
        for (String part : parts) {
            lines.add(part);
        }
        // trailing newline yields one empty element
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    private static String stripBom(String text) {
        if (text.startsWith("\uFEFF")) {
            log.debug("UTF-8 BOM detected and stripped.");
            return text.substring(1);
        }
        return text;
    }

    // -----------------------------------------------------------------------
    // CSV PARSING
    // -----------------------------------------------------------------------

    /**
     * Parses one CSV record using RFC 4180 rules.
     *
     * @param line the record text (may contain line breaks inside quotes)
     * @return field values, quotes stripped and escapes resolved
     * @throws IllegalArgumentException if a quoted field is not closed
     */
    public List<String> parseCsvRow(String line) {
        List<String> fields = new ArrayList<>();
        if (line == null || line.isEmpty()) {
            return fields;
        }
        StringBuilder currentField = new StringBuilder();
        boolean inQuotes = false;
        int length = line.length();

        for (int i = 0; i < length; i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < length && line.charAt(i + 1) == '"') {
                        currentField.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    currentField.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == ',') {
                fields.add(currentField.toString());
                currentField.setLength(0);
            } else {
                currentField.append(c);
            }
        }
        fields.add(currentField.toString());

        if (inQuotes) {
            throw new IllegalArgumentException("Unclosed quoted field in line: " + truncate(line, 60));
        }
        return fields;
    }

    private List<String> parseCsvRowSafe(String line) {
        try {
            return parseCsvRow(line);
        } catch (IllegalArgumentException ex) {
            log.debug("Row could not be parsed as a sub-header: {}", ex.getMessage());
            return new ArrayList<>();
        }
    }

    private static String truncate(String s, int maxLength) {
        if (s == null) return "";
        if (s.length() <= maxLength) return s;
        return s.substring(0, maxLength - 3) + "...";
    }

    /** One logical CSV record and the file line it starts on. */
    private static final class Record {

        private final int lineNumber;
        private final String text;

        private Record(int lineNumber, String text) {
            this.lineNumber = lineNumber;
            this.text = text;
        }
    }
}
