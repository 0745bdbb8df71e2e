package linkchecker;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

// CLI entry point: load config, ingest the sitemap, then crawl (or run the mock dry run).
public class Main {

    public static void main(String[] args) {
        if (args.length > 1) {
            System.err.println("""
                    Usage: [config.yaml]
                    Example: config.yaml
                    """);
            System.exit(1);
        }
        Path configPath = Paths.get(args.length == 1 ? args[0] : "config.yaml");

        CrawlerConfig config;
        try {
            config = ConfigLoader.load(configPath);
        } catch (ConfigurationException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return; // unreachable, but required by compiler
        }

        try {
            int count = SitemapReader.ingest(config);
            System.out.println("[sitemap] wrote " + count + " URLs -> " + config.seeds().seedsCsv());

            if (config.seeds().mockMode()) {
                SampleLinkReport.write(config);
                return;
            }

            List<String> seeds = SitemapReader.readSeeds(config.seeds().seedsCsv());
            CrawlEngine engine = new CrawlEngine(config,
                    () -> new JsoupHttpFetcher(config),
                    new CsvReportWriter(config.report()));
            engine.crawlAll(seeds);
        } catch (IOException e) {
            System.err.println("Run failed: " + e.getMessage());
            System.exit(1);
        }
    }
}
