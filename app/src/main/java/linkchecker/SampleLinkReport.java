package linkchecker;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

// Mock-mode dry run: extract the in-scope links of one local sample page into links_sample.csv.
public class SampleLinkReport {

    public static final String SAMPLE_FILE = "links_sample.csv";

    private SampleLinkReport() { }

    public static Path write(CrawlerConfig config) throws IOException {
        CrawlerConfig.SeedConfig seeds = config.seeds();
        String pageUrl = seeds.samplePageUrl();

        long t0 = System.nanoTime();
        String html = Files.readString(seeds.samplePagePath());
        System.out.printf("[fetch] sanity metric: %.2f ms / request%n", (System.nanoTime() - t0) / 1_000_000.0);

        LinkExtractor extractor = new LinkExtractor(config.domainAllowlist(), config.countDuplicates());
        List<String> links = extractor.extract(pageUrl, html).links();
        System.out.println("[parse] internal=" + links.size());

        Path outDir = config.report().outputDir();
        Files.createDirectories(outDir);
        Path out = outDir.resolve(SAMPLE_FILE);

        char d = config.report().csvDelimiter();
        List<String> lines = new ArrayList<>();
        lines.add("page_url" + d + "link_url");
        for (String link : links) {
            lines.add(CsvReportWriter.csv(pageUrl) + d + CsvReportWriter.csv(link));
        }
        Files.write(out, lines, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        System.out.println("[report] wrote internal links -> " + out);
        return out;
    }
}
