package com.nana.results.util;

import com.nana.results.domain.Dataset;
import com.nana.results.domain.RawRow;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExcelMarkSheetReaderTest {

    @TempDir
    Path tempDir;

    private final ExcelMarkSheetReader reader = new ExcelMarkSheetReader();

    @Test
    @DisplayName("merged subject headers are flattened into per-role columns")
    void mergedTwoRowHeader() throws IOException {
        Path file = tempDir.resolve("ece.xlsx");
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Results");
            Row group = sheet.createRow(0);
            group.createCell(0).setCellValue("USN");
            group.createCell(1).setCellValue("NAME");
            group.createCell(2).setCellValue("EC301");
            sheet.addMergedRegion(new CellRangeAddress(0, 0, 2, 5));

            Row sub = sheet.createRow(1);
            sub.createCell(2).setCellValue("Internal");
            sub.createCell(3).setCellValue("External");
            sub.createCell(4).setCellValue("Total");
            sub.createCell(5).setCellValue("Result");

            Row data = sheet.createRow(2);
            data.createCell(0).setCellValue(1001);
            data.createCell(1).setCellValue("Asha");
            data.createCell(2).setCellValue(42);
            data.createCell(3).setCellValue(48);
            data.createCell(4).setCellValue(90);
            data.createCell(5).setCellValue("P");
            write(workbook, file);
        }

        ImportReport report = reader.read(file);

        assertTrue(report.isFullSuccess());
        Dataset dataset = report.getDataset();
        assertEquals("ece.xlsx", dataset.getName());
        assertEquals(List.of("USN", "Name", "EC301 Internal", "EC301 External", "EC301 Total", "EC301 Result"),
                dataset.getColumns());
        RawRow row = dataset.getRows().get(0);
        assertEquals(90.0, row.get("EC301 Total"));
        assertEquals("1001", dataset.studentIdOf(row));
        assertEquals("Asha", dataset.studentNameOf(row));
    }

    @Test
    @DisplayName("gaps between rows are skipped and blank cells read as null")
    void singleHeaderWithGaps() throws IOException {
        Path file = tempDir.resolve("cse.xlsx");
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Sheet1");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("USN");
            header.createCell(1).setCellValue("CS301 Total");
            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue("1XX22CS001");
            first.createCell(1).setCellValue(75);
            Row third = sheet.createRow(3);
            third.createCell(0).setCellValue("1XX22CS002");
            write(workbook, file);
        }

        ImportReport report = reader.read(file);

        assertEquals(2, report.getSuccessCount());
        assertEquals(1, report.getSkippedCount());
        assertNull(report.getDataset().getRows().get(1).get("CS301 Total"));
    }

    @Test
    @DisplayName("rows whose cells are all blank are skipped, not counted as imported")
    void blankCellsRowSkipped() throws IOException {
        Path file = tempDir.resolve("blank.xlsx");
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Sheet1");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("USN");
            header.createCell(1).setCellValue("CS301 Total");
            Row blank = sheet.createRow(1);
            blank.createCell(0).setCellValue("  ");
            blank.createCell(1).setBlank();
            Row data = sheet.createRow(2);
            data.createCell(0).setCellValue("1XX22CS001");
            data.createCell(1).setCellValue(75);
            write(workbook, file);
        }

        ImportReport report = reader.read(file);

        assertEquals(1, report.getSuccessCount());
        assertEquals(1, report.getSkippedCount());
        assertEquals(report.getSuccessCount(), report.getDataset().getRowCount());
        assertTrue(report.isFullSuccess());
    }

    @Test
    @DisplayName("a file that is not a workbook is reported, not thrown")
    void notAWorkbook() throws IOException {
        Path file = tempDir.resolve("broken.xlsx");
        Files.writeString(file, "USN,Name\n");

        ImportReport report = reader.read(file);

        assertFalse(report.hasDataset());
        assertEquals(ImportReport.RowResult.Outcome.UNEXPECTED_ERROR,
                report.getFailedRows().get(0).getOutcome());
    }

    private static void write(Workbook workbook, Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            workbook.write(out);
        }
    }
}
