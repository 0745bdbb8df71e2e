package linkchecker;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

// Writes the three CSV reports into the output directory:
// links_multithread.csv and violations_links.csv are replaced on every run,
// run_summary.csv gets one row appended per run.
public class CsvReportWriter implements ReportSink {

    public static final String PAGES_FILE = "links_multithread.csv";
    public static final String VIOLATIONS_FILE = "violations_links.csv";
    public static final String SUMMARY_FILE = "run_summary.csv";

    private final Path outputDir;
    private final char delimiter;

    public CsvReportWriter(Path outputDir, char delimiter) {
        this.outputDir = outputDir;
        this.delimiter = delimiter;
    }

    public CsvReportWriter(CrawlerConfig.ReportConfig config) {
        this(config.outputDir(), config.csvDelimiter());
    }

    @Override
    public void write(Collection<PageResult> pages, Collection<ViolationRecord> violations, RunSummary summary) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            System.err.println("Could not create output dir: " + outputDir + " (" + e.getMessage() + ")");
            return;
        }

        List<List<String>> pageRows = new ArrayList<>();
        for (PageResult p : pages) pageRows.add(p.toRow());
        Path pagesCsv = outputDir.resolve(PAGES_FILE);
        if (replace(pagesCsv, PageResult.HEADER, pageRows)) {
            System.out.println("[report] " + pagesCsv);
        }

        List<List<String>> violationRows = new ArrayList<>();
        for (ViolationRecord v : violations) violationRows.add(v.toRow());
        Path violationsCsv = outputDir.resolve(VIOLATIONS_FILE);
        if (replace(violationsCsv, ViolationRecord.HEADER, violationRows)) {
            System.out.println("[violations] wrote " + violationRows.size() + " rows -> " + violationsCsv);
        }

        Path summaryCsv = outputDir.resolve(SUMMARY_FILE);
        if (appendSummary(summaryCsv, summary)) {
            System.out.println("[summary] appended -> " + summaryCsv);
        }
    }

    private boolean replace(Path out, List<String> header, List<List<String>> rows) {
        List<String> lines = new ArrayList<>(rows.size() + 1);
        lines.add(line(header));
        for (List<String> row : rows) lines.add(line(row));
        try {
            Files.write(out, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return true;
        } catch (IOException e) {
            System.err.println("Could not write " + out + ": " + e.getMessage());
            return false;
        }
    }

    private boolean appendSummary(Path out, RunSummary summary) {
        List<String> lines = new ArrayList<>(2);
        // header only for a new file so rows of earlier runs stay comparable
        if (!Files.exists(out)) lines.add(line(RunSummary.HEADER));
        lines.add(line(summary.toRow()));
        try {
            Files.write(out, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            return true;
        } catch (IOException e) {
            System.err.println("Could not append run summary " + out + ": " + e.getMessage());
            return false;
        }
    }

    private String line(List<String> fields) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) sb.append(delimiter);
            sb.append(csv(fields.get(i)));
        }
        return sb.toString();
    }

    // Quote CSV fields safely (minimal)
    static String csv(Object v) {
        String s = v == null ? "" : String.valueOf(v);
        s = s.replace("\"", "\"\"");
        return "\"" + s + "\"";
    }
}
