package com.nana.results.util;

import com.nana.results.domain.CreditConfig;
import com.nana.results.domain.SectionConfig;
import com.nana.results.domain.SectionRange;
import com.nana.results.service.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ConfigFileLoaderTest {

    @TempDir
    Path tempDir;

    private final ConfigFileLoader loader = new ConfigFileLoader();

    private Path file(String name, String content) throws IOException {
        Path path = tempDir.resolve(name);
        Files.writeString(path, content);
        return path;
    }

    @Nested
    @DisplayName("Section files")
    class SectionTests {

        @Test
        @DisplayName("range rules keep file order")
        void rangesInOrder() throws Exception {
            Path ranges = file("sections.properties",
                    "\uFEFF# CSE sections\nB=1XX22CS031,1XX22CS060\n\nA = 1XX22CS001 , 1XX22CS030\n");

            SectionConfig config = loader.loadSections(ranges, null);

            assertEquals(2, config.getRanges().size());
            SectionRange first = config.getRanges().get(0);
            assertEquals("B", first.getSectionName());
            assertEquals("1XX22CS031", first.getStartId());
            assertEquals("1XX22CS001", config.getRanges().get(1).getStartId());
            assertFalse(config.hasExplicitMapping());
        }

        @Test
        @DisplayName("mapping files may carry a header row")
        void mappingWithHeader() throws Exception {
            Path mapping = file("mapping.csv", "student_id,section\n1xx22cs001, A\n\"1XX22CS002\",B\n");

            SectionConfig config = loader.loadSections(null, mapping);

            assertEquals("A", config.explicitSectionFor("1XX22CS001"));
            assertEquals("B", config.explicitSectionFor("1XX22CS002"));
            assertEquals(2, config.getExplicitMapping().size());
        }

        @Test
        @DisplayName("the header row is recognised whatever the default locale")
        void mappingHeaderIgnoresLocale() throws Exception {
            Path mapping = file("mapping.csv", "ID,SECTION\n1XX22CS001,A\n");
            Locale original = Locale.getDefault();
            Locale.setDefault(new Locale("tr", "TR"));
            try {
                SectionConfig config = loader.loadSections(null, mapping);

                assertEquals(1, config.getExplicitMapping().size());
                assertEquals("A", config.explicitSectionFor("1XX22CS001"));
            } finally {
                Locale.setDefault(original);
            }
        }

        @Test
        @DisplayName("malformed lines are reported by line number")
        void malformedLines() throws IOException {
            Path ranges = file("sections.properties", "A=1XX22CS001,1XX22CS030\nB\nC=1XX22CS061\n");
            Path mapping = file("mapping.csv", "1XX22CS001\n");

            ValidationException ex = assertThrows(ValidationException.class,
                    () -> loader.loadSections(ranges, mapping));

            assertTrue(ex.hasError("sections.2"));
            assertTrue(ex.hasError("sections.3"));
            assertTrue(ex.hasError("mapping.1"));
            assertFalse(ex.hasError("sections.1"));
        }

        @Test
        @DisplayName("a missing file is an IOException")
        void missingFile() {
            IOException ex = assertThrows(IOException.class,
                    () -> loader.loadSections(tempDir.resolve("nope.properties"), null));
            assertTrue(ex.getMessage().startsWith("Configuration file not found"));
        }

        @Test
        @DisplayName("no files gives an empty configuration")
        void noFiles() throws Exception {
            SectionConfig config = loader.loadSections(null, null);

            assertFalse(config.hasRanges());
            assertFalse(config.hasExplicitMapping());
        }
    }

    @Nested
    @DisplayName("Credit files")
    class CreditTests {

        @Test
        @DisplayName("weights are read per subject code")
        void credits() throws Exception {
            Path credits = file("credits.properties", "! semester 5\nCS301=4\nCS302 = 3\nCS303=0\n");

            CreditConfig config = loader.loadCredits(credits);

            assertEquals(4, config.creditFor("CS301"));
            assertEquals(3, config.creditFor("CS302"));
            assertEquals(0, config.creditFor("CS303"));
            assertEquals(0, config.creditFor("CS399"));
        }

        @Test
        @DisplayName("non-integer weights are keyed by subject code")
        void nonIntegerWeight() throws IOException {
            Path credits = file("credits.properties", "CS301=3.5\nCS302\n");

            ValidationException ex = assertThrows(ValidationException.class, () -> loader.loadCredits(credits));

            assertEquals("Credit weight '3.5' is not a whole number.", ex.getError("credits.CS301"));
            assertTrue(ex.hasError("credits.2"));
            assertTrue(ex.getMessage().startsWith("Invalid configuration (2 problem(s)): "));
        }
    }
}
