package com.nana.results.cli;

import com.nana.results.domain.CreditConfig;
import com.nana.results.domain.SectionConfig;
import com.nana.results.domain.StudentRecord;
import com.nana.results.repository.InMemoryDatasetStore;
import com.nana.results.service.AnalysisRequest;
import com.nana.results.service.BranchComparator;
import com.nana.results.service.CacheKey;
import com.nana.results.service.EngineResult;
import com.nana.results.service.KpiSummary;
import com.nana.results.service.NormalizedSnapshot;
import com.nana.results.service.RankMetric;
import com.nana.results.service.ReportAggregator;
import com.nana.results.service.ReportBundle;
import com.nana.results.service.ResultCache;
import com.nana.results.service.ResultEngine;
import com.nana.results.service.ResultEngineImpl;
import com.nana.results.service.ResultFilter;
import com.nana.results.service.SectionBreakdown;
import com.nana.results.service.SubjectAnalyzer;
import com.nana.results.service.ValidationException;
import com.nana.results.util.AppConfig;
import com.nana.results.util.AppLogger;
import com.nana.results.util.CategoryWorkbookExporter;
import com.nana.results.util.ConfigFileLoader;
import com.nana.results.util.CsvExporter;
import com.nana.results.util.ExcelMarkSheetReader;
import com.nana.results.util.ExportResult;
import com.nana.results.util.GlobalExceptionHandler;
import com.nana.results.util.ImportReport;
import com.nana.results.util.MarkSheetCsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * ResultAnalyzerCli - Command-Line Entry Point
 *
 * <p>Wires the engine from {@link AppConfig}, imports one or more mark
 * sheets, prints the result analysis of each and, when several sheets are
 * given, a branch comparison. Exports are written for the first sheet.
 *
 * <p>Exit codes: 0 success, 1 import or analysis failure, 2 usage error.
 */
public class ResultAnalyzerCli {

    private static final Logger log = LoggerFactory.getLogger(ResultAnalyzerCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: ResultAnalyzerCli <marks.csv|marks.xlsx> [more sheets...] [options]",
            "  --sections <file>     section ranges, SECTION=START_ID,END_ID per line",
            "  --mapping <file>      explicit sections, CSV student_id,section",
            "  --credits <file>      subject credits, CODE=WEIGHT per line (enables SGPA)",
            "  --metric <name>       TOTAL_MARKS | TOTAL_INTERNAL | TOTAL_EXTERNAL | SGPA",
            "  --filter <name>       ALL | PASS | FAIL for the ranked listing",
            "  --search <text>       list students whose id or name contains the text",
            "  --export-csv <file>   write processed records as CSV",
            "  --export-xlsx <file>  write a category-wise workbook",
            "  --help                print this message");

    private final AppConfig config;
    private final PrintStream out;
    private final PrintStream err;
    private final ConfigFileLoader configLoader = new ConfigFileLoader();

    public ResultAnalyzerCli(AppConfig config, PrintStream out, PrintStream err) {
        if (config == null || out == null || err == null) {
            throw new IllegalArgumentException("Config and output streams must not be null.");
        }
        this.config = config;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        LocalDateTime start = LocalDateTime.now();
        GlobalExceptionHandler.install();
        AppLogger.logStartup();
        int code = new ResultAnalyzerCli(AppConfig.getInstance(), System.out, System.err).run(args);
        AppLogger.logShutdown(start);
        System.exit(code);
    }

    /**
     * Runs one command line.
     *
     * @param args command-line arguments
     * @return process exit code
     */
    public int run(String[] args) {
        Options options;
        try {
            options = Options.parse(args, config.getDefaultMetric());
        } catch (IllegalArgumentException ex) {
            err.println("Error: " + ex.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (options.help) {
            out.println(USAGE);
            return EXIT_OK;
        }

        AnalysisRequest request;
        try {
            request = buildRequest(options);
        } catch (IOException ex) {
            log.error("Could not read configuration file.", ex);
            err.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (ValidationException ex) {
            log.warn("Invalid configuration file: {}", ex.getMessage());
            ex.getFieldErrors().forEach((key, message) -> err.println("Error: " + key + ": " + message));
            return EXIT_FAILURE;
        }

        InMemoryDatasetStore store = new InMemoryDatasetStore();
        ResultCache<CacheKey, NormalizedSnapshot> cache = new ResultCache<>(config.getCacheCapacity());
        ResultEngine engine = new ResultEngineImpl(store, cache, new ReportAggregator(config.getReportTopSize()));

        List<String> datasetNames = new ArrayList<>();
        for (Path input : options.inputs) {
            ImportReport report = importSheet(input);
            out.println(report.getSummary());
            if (!report.hasDataset()) {
                report.getFailedRows().forEach(row -> err.println("  Row " + row.getRowNumber() + ": " + row.getErrorMessage()));
                err.println("Error: could not import '" + input + "'.");
                return EXIT_FAILURE;
            }
            store.put(report.getDataset());
            datasetNames.add(report.getDataset().getName());
        }

        EngineResult first = null;
        for (String name : datasetNames) {
            EngineResult result = engine.analyze(name, request);
            if (first == null) {
                first = result;
            }
            printResult(engine, result, options);
        }

        if (datasetNames.size() > 1) {
            printComparison(engine.compareBranches(datasetNames, request));
        }
        return export(first, options);
    }

    // -----------------------------------------------------------------------
    // WIRING
    // -----------------------------------------------------------------------

    private AnalysisRequest buildRequest(Options options) throws IOException, ValidationException {
        SectionConfig sections = SectionConfig.none();
        if (options.sectionsFile != null || options.mappingFile != null) {
            sections = configLoader.loadSections(options.sectionsFile, options.mappingFile);
        }
        CreditConfig credits = null;
        if (options.creditsFile != null) {
            credits = configLoader.loadCredits(options.creditsFile);
        }
        return AnalysisRequest.builder()
                .sections(sections)
                .credits(credits)
                .metric(options.metric)
                .build();
    }

    private static ImportReport importSheet(Path input) {
        String file = input.getFileName().toString().toLowerCase(Locale.ROOT);
        if (file.endsWith(".xlsx") || file.endsWith(".xls")) {
            return new ExcelMarkSheetReader().read(input);
        }
        return new MarkSheetCsvReader().read(input);
    }

    private int export(EngineResult result, Options options) {
        int code = EXIT_OK;
        if (options.exportCsv != null) {
            ExportResult csv = new CsvExporter().exportAll(result.getRecords(), resolveExport(options.exportCsv));
            code = reportExport(csv, code);
        }
        if (options.exportXlsx != null) {
            ExportResult xlsx = new CategoryWorkbookExporter().export(result.getRecords(), resolveExport(options.exportXlsx));
            code = reportExport(xlsx, code);
        }
        return code;
    }

    private int reportExport(ExportResult export, int code) {
        if (export.isSuccess()) {
            out.println(export.getSummary());
            return code;
        }
        err.println(export.getSummary());
        return EXIT_FAILURE;
    }

    /** Bare file names go to the configured export directory. */
    private Path resolveExport(Path target) {
        if (target.isAbsolute() || target.getParent() != null) {
            return target;
        }
        return config.getDefaultExportDir().resolve(target);
    }

    // -----------------------------------------------------------------------
    // PRINTING
    // -----------------------------------------------------------------------

    private void printResult(ResultEngine engine, EngineResult result, Options options) {
        ReportBundle reports = result.getReports();
        KpiSummary kpi = reports.getKpiSummary();

        out.println();
        out.println("=== " + result.getDatasetName() + " ===");
        out.println("Subjects: " + String.join(", ", result.getSchema().getCodes()));
        out.println("Ranked by: " + result.getMetric().getDisplayName());
        out.printf(Locale.ROOT, "Students: %d | Present: %d | Passed: %d | Failed: %d | Result: %.2f%%%n",
                kpi.getTotalStudents(), kpi.getPresentStudents(), kpi.getPassedStudents(),
                kpi.getFailedStudents(), kpi.getResultPercentage());

        out.println();
        out.printf("%-12s %5s %5s %5s %5s %6s %6s %6s%n",
                "Section", "FCD", "FC", "SC", "PC", "Failed", "Absent", "Total");
        for (SectionBreakdown row : reports.getSectionBreakdowns()) {
            out.printf("%-12s %5d %5d %5d %5d %6d %6d %6d%n",
                    row.getSection(), row.getFcd(), row.getFirstClass(), row.getSecondClass(),
                    row.getPassClass(), row.getFailed(), row.getAbsent(), row.getTotal());
        }

        printStudents("Top students", reports.getTopStudents(), result.getMetric());
        printStudents("Bottom students", reports.getBottomStudents(), result.getMetric());

        out.println();
        out.println("Section toppers:");
        for (Map.Entry<String, StudentRecord> entry : reports.getSectionToppers().entrySet()) {
            out.println("  " + entry.getKey() + ": " + describe(entry.getValue(), result.getMetric()));
        }

        SubjectAnalyzer.SubjectAnalysis subjects = engine.analyzeSubjects(result);
        if (!subjects.getSubjects().isEmpty()) {
            out.println();
            out.println("Hardest subject: " + subjects.getHardestSubject()
                    + " | Easiest subject: " + subjects.getEasiestSubject());
        }

        printStudents("Ranked listing (" + options.filter + ")",
                engine.rankedListing(result, options.filter), result.getMetric());

        if (options.search != null) {
            printStudents("Search '" + options.search + "'",
                    engine.searchStudents(result, options.search), result.getMetric());
        }

        for (String warning : result.getWarnings()) {
            err.println("Warning: " + warning);
        }
    }

    private void printStudents(String title, List<StudentRecord> students, RankMetric metric) {
        out.println();
        out.println(title + ":");
        if (students.isEmpty()) {
            out.println("  (none)");
            return;
        }
        for (StudentRecord student : students) {
            out.println("  " + describe(student, metric));
        }
    }

    private static String describe(StudentRecord record, RankMetric metric) {
        String rank = record.getClassRank() == null ? "-" : String.valueOf(record.getClassRank());
        return String.format(Locale.ROOT, "#%-4s %-14s %-24s %-10s %10.2f  %s",
                rank, record.getStudentId(), record.getName(), record.getSection(),
                metric.extract(record), record.getCategory().getLabel());
    }

    private void printComparison(BranchComparator.BranchComparison comparison) {
        out.println();
        out.println("=== Branch comparison ===");
        for (BranchComparator.BranchStats branch : comparison.getBranches()) {
            out.printf(Locale.ROOT, "  %-24s students=%d passed=%d pass%%=%.2f%n",
                    branch.getBranch(), branch.getStudents(), branch.getPassed(), branch.getPassPercentage());
        }
        out.printf(Locale.ROOT, "Best: %s | Weakest: %s | Students: %d | Overall pass%%: %.2f%n",
                comparison.getBestBranch(), comparison.getWeakBranch(),
                comparison.getTotalStudents(), comparison.getOverallPassPercentage());
    }

    // -----------------------------------------------------------------------
    // OPTIONS
    // -----------------------------------------------------------------------

    /** Parsed command line. */
    static final class Options {

        final List<Path> inputs = new ArrayList<>();
        Path sectionsFile;
        Path mappingFile;
        Path creditsFile;
        Path exportCsv;
        Path exportXlsx;
        String search;
        RankMetric metric;
        ResultFilter filter = ResultFilter.ALL;
        boolean help;

        /**
         * @param args          raw arguments
         * @param defaultMetric metric name used when {@code --metric} is absent
         * @return the options
         * @throws IllegalArgumentException for unknown flags, missing values or no input
         */
        static Options parse(String[] args, String defaultMetric) {
            Options options = new Options();
            String metricName = defaultMetric;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--help", "-h" -> options.help = true;
                    case "--sections" -> options.sectionsFile = Paths.get(valueAfter(args, ++i, arg));
                    case "--mapping" -> options.mappingFile = Paths.get(valueAfter(args, ++i, arg));
                    case "--credits" -> options.creditsFile = Paths.get(valueAfter(args, ++i, arg));
                    case "--metric" -> metricName = valueAfter(args, ++i, arg);
                    case "--filter" -> options.filter = parseFilter(valueAfter(args, ++i, arg));
                    case "--search" -> options.search = valueAfter(args, ++i, arg);
                    case "--export-csv" -> options.exportCsv = Paths.get(valueAfter(args, ++i, arg));
                    case "--export-xlsx" -> options.exportXlsx = Paths.get(valueAfter(args, ++i, arg));
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option '" + arg + "'.");
                        }
                        options.inputs.add(Paths.get(arg));
                    }
                }
            }
            if (options.help) {
                return options;
            }
            if (options.inputs.isEmpty()) {
                throw new IllegalArgumentException("No mark sheet given.");
            }
            options.metric = RankMetric.parse(metricName == null ? "TOTAL_MARKS" : metricName);
            return options;
        }

        private static String valueAfter(String[] args, int index, String flag) {
            if (index >= args.length || args[index].startsWith("--")) {
                throw new IllegalArgumentException("Option " + flag + " needs a value.");
            }
            return args[index];
        }

        private static ResultFilter parseFilter(String text) {
            try {
                return ResultFilter.parse(text);
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unknown filter '" + text + "'. Expected ALL, PASS or FAIL.", ex);
            }
        }
    }
}
