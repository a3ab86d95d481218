package com.nana.results.util;

import com.nana.results.domain.CreditConfig;
import com.nana.results.domain.SectionConfig;
import com.nana.results.service.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * ConfigFileLoader - Section and Credit Configuration Files
 *
 * <p>Three plain-text formats are supported:
 * <ul>
 *   <li>section ranges, one {@code SECTION=START_ID,END_ID} per line;
 *       rules keep their file order, a section may appear more than once</li>
 *   <li>explicit mapping, CSV {@code student_id,section} with an optional
 *       header row</li>
 *   <li>credits, one {@code SUBJECT_CODE=WEIGHT} per line</li>
 * </ul>
 * Lines starting with {@code #} or {@code !} and blank lines are ignored.
 * Lines are read in order instead of through {@link java.util.Properties},
 * whose iteration order is undefined.
 */
public class ConfigFileLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigFileLoader.class);

    private final MarkSheetCsvReader csvParser = new MarkSheetCsvReader();

    // -----------------------------------------------------------------------
    // SECTIONS
    // -----------------------------------------------------------------------

    /**
     * Builds a section configuration from an optional ranges file and an
     * optional mapping file.
     *
     * @param rangesFile  ranges file, or null
     * @param mappingFile mapping CSV, or null
     * @return the combined configuration
     * @throws IOException         if a file cannot be read
     * @throws ValidationException if any line is malformed; keys are
     *                             {@code "sections.<line>"} and {@code "mapping.<line>"}
     */
    public SectionConfig loadSections(Path rangesFile, Path mappingFile)
            throws IOException, ValidationException {
        SectionConfig.Builder builder = SectionConfig.builder();
        Map<String, String> errors = new LinkedHashMap<>();

        if (rangesFile != null) {
            readRanges(rangesFile, builder, errors);
        }
        if (mappingFile != null) {
            builder.assignAll(readMapping(mappingFile, errors));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        SectionConfig config = builder.build();
        log.info("Loaded section configuration: {} range rule(s), {} explicit mapping(s).",
                config.getRanges().size(), config.getExplicitMapping().size());
        return config;
    }

    private void readRanges(Path file, SectionConfig.Builder builder,
                            Map<String, String> errors) throws IOException {
        List<String> lines = readLines(file);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (isIgnorable(line)) continue;

            int lineNo = i + 1;
            int eq = line.indexOf('=');
            if (eq <= 0) {
                errors.put("sections." + lineNo, "Expected SECTION=START_ID,END_ID but got '" + line + "'.");
                continue;
            }
            String section = line.substring(0, eq).trim();
            String[] bounds = line.substring(eq + 1).split(",");
            if (bounds.length != 2 || bounds[0].isBlank() || bounds[1].isBlank()) {
                errors.put("sections." + lineNo, "Section '" + section + "' needs exactly two ids: start,end.");
                continue;
            }
            builder.range(section, bounds[0].trim(), bounds[1].trim());
        }
    }

    private Map<String, String> readMapping(Path file, Map<String, String> errors) throws IOException {
        Map<String, String> mapping = new LinkedHashMap<>();
        List<String> lines = readLines(file);
        boolean firstRecord = true;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (isIgnorable(line)) continue;

            int lineNo = i + 1;
            List<String> fields;
            try {
                fields = csvParser.parseCsvRow(line);
            } catch (IllegalArgumentException ex) {
                errors.put("mapping." + lineNo, ex.getMessage());
                continue;
            }
            if (firstRecord) {
                firstRecord = false;
                if (isMappingHeader(fields)) continue;
            }
            if (fields.size() < 2 || fields.get(0).isBlank() || fields.get(1).isBlank()) {
                errors.put("mapping." + lineNo, "Expected student_id,section but got '" + line + "'.");
                continue;
            }
            mapping.put(fields.get(0).trim(), fields.get(1).trim());
        }
        return mapping;
    }

    private static boolean isMappingHeader(List<String> fields) {
        if (fields.isEmpty()) return false;
        String first = fields.get(0).trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        return first.equals("student_id") || first.equals("usn") || first.equals("id");
    }

    // -----------------------------------------------------------------------
    // CREDITS
    // -----------------------------------------------------------------------

    /**
     * Reads a credits file. Weights must be whole numbers; their range is
     * checked later by the SGPA engine.
     *
     * @param creditsFile credits file
     * @return the credit configuration
     * @throws IOException         if the file cannot be read
     * @throws ValidationException keyed {@code "credits.<CODE>"} for
     *                             non-integer weights, {@code "credits.<line>"}
     *                             for lines without {@code =}
     */
    public CreditConfig loadCredits(Path creditsFile) throws IOException, ValidationException {
        Map<String, Integer> credits = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();

        List<String> lines = readLines(creditsFile);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (isIgnorable(line)) continue;

            int eq = line.indexOf('=');
            if (eq <= 0) {
                errors.put("credits." + (i + 1), "Expected SUBJECT_CODE=WEIGHT but got '" + line + "'.");
                continue;
            }
            String code = line.substring(0, eq).trim();
            String weight = line.substring(eq + 1).trim();
            try {
                credits.put(code, Integer.parseInt(weight));
            } catch (NumberFormatException ex) {
                errors.put("credits." + code, "Credit weight '" + weight + "' is not a whole number.");
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        log.info("Loaded {} credit weight(s) from '{}'.", credits.size(), creditsFile.getFileName());
        return CreditConfig.of(credits);
    }

    // -----------------------------------------------------------------------
    // HELPERS
    // -----------------------------------------------------------------------

    private static List<String> readLines(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Configuration file not found: " + file);
        }
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        if (!lines.isEmpty() && lines.get(0).startsWith("\uFEFF")) {
            lines.set(0, lines.get(0).substring(1));
        }
        return lines;
    }

    private static boolean isIgnorable(String line) {
        return line.isEmpty() || line.startsWith("#") || line.startsWith("!");
    }
}
