package com.nana.results.util;

import com.nana.results.domain.Category;
import com.nana.results.domain.OverallResult;
import com.nana.results.domain.StudentRecord;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CategoryWorkbookExporterTest {

    @TempDir
    Path tempDir;

    private final CategoryWorkbookExporter exporter = new CategoryWorkbookExporter();

    private static StudentRecord record(String usn, Category category, double total, Integer rank) {
        return StudentRecord.builder()
                .studentId(usn)
                .name("Student " + usn)
                .section("A")
                .totalMarks(total)
                .percentage(total / 3)
                .overallResult(category == Category.FAILED ? OverallResult.F : OverallResult.P)
                .category(category)
                .failedSubjectNames(category == Category.FAILED ? List.of("CS302") : List.of())
                .classRank(rank)
                .build();
    }

    @Test
    @DisplayName("one sheet per category, in order, including empty ones")
    void sheetsPerCategory() throws IOException {
        Path file = tempDir.resolve("reports/categories.xlsx");
        List<StudentRecord> records = List.of(
                record("1XX22CS001", Category.FCD, 270, 1),
                record("1XX22CS002", Category.FCD, 240, 2),
                record("1XX22CS003", Category.FAILED, 90, 3));

        ExportResult result = exporter.export(records, file);

        assertTrue(result.isSuccess(), result.getSummary());
        assertEquals(3, result.getRowsWritten());
        try (InputStream in = Files.newInputStream(file);
             Workbook workbook = WorkbookFactory.create(in)) {
            assertEquals(Category.values().length, workbook.getNumberOfSheets());
            for (int i = 0; i < Category.values().length; i++) {
                assertEquals(Category.values()[i].getSheetName(), workbook.getSheetName(i));
            }

            Sheet fcd = workbook.getSheet("FCD");
            assertEquals(2, fcd.getLastRowNum());
            Row first = fcd.getRow(1);
            assertEquals("1XX22CS001", first.getCell(0).getStringCellValue());
            assertEquals(CellType.NUMERIC, first.getCell(3).getCellType());
            assertEquals(270.0, first.getCell(3).getNumericCellValue());
            assertEquals("", first.getCell(7).getStringCellValue());

            Sheet secondClass = workbook.getSheet("Second Class");
            assertEquals(0, secondClass.getLastRowNum());
            assertEquals("Student ID", secondClass.getRow(0).getCell(0).getStringCellValue());
        }
    }

    @Test
    @DisplayName("the Failed sheet lists failed subjects")
    void failedSheetHasSubjects() throws IOException {
        Path file = tempDir.resolve("categories.xlsx");

        exporter.export(List.of(record("1XX22CS003", Category.FAILED, 90, 1)), file);

        try (InputStream in = Files.newInputStream(file);
             Workbook workbook = WorkbookFactory.create(in)) {
            Row header = workbook.getSheet("Failed").getRow(0);
            int last = header.getLastCellNum() - 1;
            assertEquals("Failed Subjects", header.getCell(last).getStringCellValue());
            assertEquals("CS302", workbook.getSheet("Failed").getRow(1).getCell(last).getStringCellValue());
            assertEquals(last, workbook.getSheet("FCD").getRow(0).getLastCellNum());
        }
    }

    @Test
    @DisplayName("only the Failed tier gets the extra column")
    void columnsFor() {
        assertEquals(CsvColumn.FAILED_SUBJECTS,
                CategoryWorkbookExporter.columnsFor(Category.FAILED).get(9));
        assertFalse(CategoryWorkbookExporter.columnsFor(Category.ABSENT).contains(CsvColumn.FAILED_SUBJECTS));
    }

    @Test
    @DisplayName("bad arguments give a failure result")
    void invalidArguments() {
        assertFalse(exporter.export(null, tempDir.resolve("x.xlsx")).isSuccess());
        assertFalse(exporter.export(List.of(), null).isSuccess());
    }
}
