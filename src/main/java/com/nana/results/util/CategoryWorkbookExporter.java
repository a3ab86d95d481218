package com.nana.results.util;

import com.nana.results.domain.Category;
import com.nana.results.domain.CellValues;
import com.nana.results.domain.StudentRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CategoryWorkbookExporter - Category-Wise XLSX Export
 *
 * <p>Writes one worksheet per {@link Category}, in declaration order,
 * each listing the students of that tier. Every sheet is created even when
 * empty. The Failed sheet carries an extra "Failed Subjects" column.
 */
public class CategoryWorkbookExporter {

    private static final Logger log = LoggerFactory.getLogger(CategoryWorkbookExporter.class);

    private static final List<CsvColumn> SHEET_COLUMNS = List.of(
            CsvColumn.STUDENT_ID,
            CsvColumn.NAME,
            CsvColumn.SECTION,
            CsvColumn.TOTAL_MARKS,
            CsvColumn.TOTAL_INTERNAL,
            CsvColumn.TOTAL_EXTERNAL,
            CsvColumn.PERCENTAGE,
            CsvColumn.SGPA,
            CsvColumn.CLASS_RANK);

    /** Columns written as numeric cells when their text parses. */
    private static final Set<CsvColumn> NUMERIC_COLUMNS = EnumSet.of(
            CsvColumn.TOTAL_MARKS,
            CsvColumn.TOTAL_INTERNAL,
            CsvColumn.TOTAL_EXTERNAL,
            CsvColumn.PERCENTAGE,
            CsvColumn.SGPA,
            CsvColumn.CLASS_RANK);

    private static final int MAX_COLUMN_CHARS = 60;

    /**
     * @param records    processed records, in the order rows should appear
     * @param outputPath target .xlsx file; parent directories are created
     * @return success with the number of student rows, or failure
     */
    public ExportResult export(List<StudentRecord> records, Path outputPath) {
        if (records == null) {
            return ExportResult.failure("Record list must not be null.");
        }
        if (outputPath == null) {
            return ExportResult.failure("Output path must not be null.");
        }

        log.info("Starting category workbook export: {} records to '{}'.", records.size(), outputPath);
        AppLogger.setOperationContext(AppLogger.OP_XLSX_EXPORT);
        try {
            Path parent = outputPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<Category, List<StudentRecord>> byCategory = groupByCategory(records);
            try (Workbook workbook = new XSSFWorkbook();
                 OutputStream out = Files.newOutputStream(outputPath)) {
                CellStyle headerStyle = headerStyle(workbook);
                for (Category category : Category.values()) {
                    writeSheet(workbook, headerStyle, category, byCategory.get(category));
                }
                workbook.write(out);
            }

            long size = Files.size(outputPath);
            AppLogger.logEvent("XLSX_EXPORT_COMPLETE",
                    "rows=" + records.size()
                    + ", sheets=" + Category.values().length
                    + ", file=" + outputPath.getFileName()
                    + ", size=" + size + "B");
            return ExportResult.success(outputPath, records.size(), size);
        } catch (IOException ex) {
            log.error("Category workbook export failed for path '{}'.", outputPath, ex);
            AppLogger.logErrorEvent("XLSX_EXPORT_FAILED", "path=" + outputPath, ex);
            return ExportResult.failure("Export failed: " + ex.getMessage());
        } finally {
            AppLogger.clearOperationContext();
        }
    }

    /**
     * @param category a category
     * @return the columns written on that category's sheet
     */
    public static List<CsvColumn> columnsFor(Category category) {
        List<CsvColumn> columns = new ArrayList<>(SHEET_COLUMNS);
        if (category == Category.FAILED) {
            columns.add(CsvColumn.FAILED_SUBJECTS);
        }
        return columns;
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    private static Map<Category, List<StudentRecord>> groupByCategory(List<StudentRecord> records) {
        Map<Category, List<StudentRecord>> grouped = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            grouped.put(category, new ArrayList<>());
        }
        for (StudentRecord record : records) {
            if (record.getCategory() != null) {
                grouped.get(record.getCategory()).add(record);
            }
        }
        return grouped;
    }

    private static void writeSheet(Workbook workbook, CellStyle headerStyle,
                                   Category category, List<StudentRecord> records) {
        Sheet sheet = workbook.createSheet(category.getSheetName());
        List<CsvColumn> columns = columnsFor(category);
        int[] widths = new int[columns.size()];

        Row header = sheet.createRow(0);
        for (int c = 0; c < columns.size(); c++) {
            String title = columns.get(c).getHeaderName();
            Cell cell = header.createCell(c);
            cell.setCellValue(title);
            cell.setCellStyle(headerStyle);
            widths[c] = title.length();
        }

        int rowNum = 1;
        for (StudentRecord record : records) {
            Row row = sheet.createRow(rowNum++);
            for (int c = 0; c < columns.size(); c++) {
                CsvColumn column = columns.get(c);
                String text = column.extract(record);
                Cell cell = row.createCell(c);
                Double number = NUMERIC_COLUMNS.contains(column) ? CellValues.toOptionalNumber(text) : null;
                if (number != null) {
                    cell.setCellValue(number);
                } else {
                    cell.setCellValue(text);
                }
                widths[c] = Math.max(widths[c], text.length());
            }
        }

        // Width from text length; autoSizeColumn needs AWT fonts on the host
        for (int c = 0; c < widths.length; c++) {
            int chars = Math.min(widths[c] + 2, MAX_COLUMN_CHARS);
            sheet.setColumnWidth(c, chars * 256);
        }
        log.debug("Sheet '{}' written with {} rows.", category.getSheetName(), records.size());
    }

    private static CellStyle headerStyle(Workbook workbook) {
        Font bold = workbook.createFont();
        bold.setBold(true);
        CellStyle style = workbook.createCellStyle();
        style.setFont(bold);
        return style;
    }
}
