package com.nana.results.util;

import com.nana.results.domain.CellValues;
import com.nana.results.domain.Dataset;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.CellRangeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ExcelMarkSheetReader - Workbook Mark Sheet Import (Apache POI)
 *
 * <p>Reads the first sheet of an {@code .xlsx} (or legacy {@code .xls})
 * workbook. The first row is the header; when the second row is a
 * sub-header the two are flattened by {@link HeaderFlattener}. Horizontally
 * merged header cells repeat their label across the merged width.
 *
 * <p>CELL DECODING:
 * numeric cells become {@link Double} (date-formatted ones become their
 * display text), string cells stay text, booleans become
 * {@code "TRUE"}/{@code "FALSE"}, formulas are read from their cached
 * result, and blank or error cells become null.
 */
public class ExcelMarkSheetReader {

    private static final Logger log = LoggerFactory.getLogger(ExcelMarkSheetReader.class);

    private final DataFormatter formatter = new DataFormatter();

    /**
     * Reads a workbook mark sheet.
     *
     * @param workbookPath source file
     * @return import report carrying the dataset, named after the file
     */
    public ImportReport read(Path workbookPath) {
        Objects.requireNonNull(workbookPath, "workbookPath");
        log.info("Starting workbook import: file='{}'.", workbookPath);
        AppLogger.setOperationContext(AppLogger.OP_XLSX_IMPORT);

        ImportReport.Builder report = new ImportReport.Builder(workbookPath);
        try (InputStream in = Files.newInputStream(workbookPath);
             Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                report.addFailure(0, "", ImportReport.RowResult.Outcome.PARSE_ERROR,
                        "Workbook has no sheets.");
            } else {
                decode(workbookPath.getFileName().toString(), workbook.getSheetAt(0), report);
            }
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to read workbook '{}'.", workbookPath, ex);
            AppLogger.logErrorEvent("XLSX_IMPORT_ERROR", "file=" + workbookPath, ex);
            report.addFailure(0, "", ImportReport.RowResult.Outcome.UNEXPECTED_ERROR,
                    "Failed to read workbook: " + ex.getMessage());
        } finally {
            AppLogger.clearOperationContext();
        }

        ImportReport built = report.build();
        AppLogger.logEvent("XLSX_IMPORT_COMPLETE", built.toString());
        log.info("Import complete: {}", built.getSummary());
        return built;
    }

    // -----------------------------------------------------------------------
    // DECODING
    // -----------------------------------------------------------------------

    private void decode(String name, Sheet sheet, ImportReport.Builder report) {
        int firstRow = sheet.getFirstRowNum();
        Row headerRow = sheet.getRow(firstRow);
        if (headerRow == null) {
            report.addFailure(0, "", ImportReport.RowResult.Outcome.PARSE_ERROR,
                    "Sheet '" + sheet.getSheetName() + "' is empty.");
            return;
        }

        int width = Math.max(headerRow.getLastCellNum(), 0);
        Row second = sheet.getRow(firstRow + 1);
        if (second != null) {
            width = Math.max(width, second.getLastCellNum());
        }

        List<String> groupCells = headerText(sheet, headerRow, width);
        List<String> columnsByPosition = HeaderFlattener.single(groupCells);
        int firstData = firstRow + 1;
        if (second != null) {
            List<String> subCells = headerText(sheet, second, width);
            if (HeaderFlattener.isSubHeader(subCells)) {
                columnsByPosition = HeaderFlattener.flatten(groupCells, subCells);
                firstData = firstRow + 2;
                log.debug("Two-row header detected and flattened.");
            }
        }
        List<String> columns = new ArrayList<>();
        columnsByPosition.stream().filter(Objects::nonNull).forEach(columns::add);

        List<Map<String, Object>> rows = new ArrayList<>();
        for (int r = firstData; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                report.addSkipped(r + 1, "", "Empty row");
                continue;
            }
            Map<String, Object> cells = new LinkedHashMap<>();
            for (int c = 0; c < columnsByPosition.size(); c++) {
                String column = columnsByPosition.get(c);
                if (column != null) {
                    cells.put(column, cellValue(row.getCell(c)));
                }
            }
            if (cells.values().stream().allMatch(CellValues::isBlank)) {
                report.addSkipped(r + 1, "", "Blank row");
                continue;
            }
            rows.add(cells);
            report.addSuccess(r + 1, "");
        }

        Dataset dataset = Dataset.of(name, columns, rows);
        report.dataset(dataset);
        log.debug("Decoded {} from sheet '{}'.", dataset, sheet.getSheetName());
    }

    /**
     * Header row as text, with horizontally merged cells repeating the
     * top-left label.
     */
    private List<String> headerText(Sheet sheet, Row row, int width) {
        List<String> values = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            values.add(formatter.formatCellValue(row.getCell(c)).trim());
        }
        if (width == 0) {
            return values;
        }
        for (CellRangeAddress region : sheet.getMergedRegions()) {
            if (region.getFirstRow() != row.getRowNum()) {
                continue;
            }
            if (region.getFirstColumn() >= width) {
                continue;
            }
            String label = values.get(region.getFirstColumn());
            for (int c = region.getFirstColumn() + 1; c <= region.getLastColumn() && c < width; c++) {
                values.set(c, label);
            }
        }
        return values;
    }

    /**
     * @param cell a POI cell, may be null
     * @return raw value for the row model
     */
    Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return formatter.formatCellValue(cell);
                }
                return cell.getNumericCellValue();
            case STRING:
                return cell.getStringCellValue();
            case BOOLEAN:
                return cell.getBooleanCellValue() ? "TRUE" : "FALSE";
            default:
                return null;
        }
    }
}
