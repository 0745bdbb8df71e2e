package linkchecker;

import java.nio.file.Path;
import java.util.List;

// Validated settings for one crawl run. Built by ConfigLoader.
public record CrawlerConfig(
        int threads,
        double delaySeconds,
        int timeoutSeconds,
        String userAgent,
        List<String> domainAllowlist,
        boolean extractLinks,
        boolean countDuplicates,
        int maxUrls,                // 0 = unlimited
        SchedulerMode scheduler,
        CheckerConfig checker,
        CacheConfig cache,
        SeedConfig seeds,
        ReportConfig report
) {
    public CrawlerConfig {
        if (threads < 1) throw new ConfigurationException("threads must be >= 1, got " + threads);
        if (delaySeconds < 0) throw new ConfigurationException("delay must be >= 0, got " + delaySeconds);
        if (timeoutSeconds < 1) throw new ConfigurationException("timeout must be >= 1, got " + timeoutSeconds);
        if (maxUrls < 0) throw new ConfigurationException("max_urls must be >= 0, got " + maxUrls);
        if (userAgent == null || userAgent.isBlank()) throw new ConfigurationException("user_agent must not be empty");
        if (scheduler == null || checker == null || cache == null || seeds == null || report == null) {
            throw new ConfigurationException("incomplete configuration");
        }
        domainAllowlist = List.copyOf(domainAllowlist);
    }

    // checker.* options
    public record CheckerConfig(boolean treatRedirectAsOk, List<String> cascadeLoginPatterns, int maxLinksPerPage) {
        public CheckerConfig {
            if (maxLinksPerPage < 0) {
                throw new ConfigurationException("checker.max_links_per_page must be >= 0, got " + maxLinksPerPage);
            }
            cascadeLoginPatterns = List.copyOf(cascadeLoginPatterns);
        }
    }

    // cache.* options
    public record CacheConfig(CacheMode mode, int maxSize) {
        public CacheConfig {
            if (mode == CacheMode.LRU && maxSize <= 0) {
                throw new ConfigurationException("cache.max_size must be positive, got " + maxSize);
            }
        }
    }

    // Where seed URLs come from: a live sitemap, or local mock files.
    public record SeedConfig(
            boolean mockMode,
            String sitemapUrl,
            Path dataDir,
            Path mockSitemapPath,
            Path samplePagePath,
            String samplePageUrl
    ) {
        public SeedConfig {
            if (mockMode) {
                if (mockSitemapPath == null || samplePagePath == null || samplePageUrl == null) {
                    throw new ConfigurationException(
                            "mock_mode needs mock.sitemap_path, mock.sample_page_path and mock.sample_page_url");
                }
            } else if (sitemapUrl == null || sitemapUrl.isBlank()) {
                throw new ConfigurationException("sitemap_url is required unless mock_mode is true");
            }
        }

        public Path seedsCsv() {
            return dataDir.resolve("urls_initial.csv");
        }
    }

    // Report files and their CSV flavour.
    public record ReportConfig(Path outputDir, char csvDelimiter) { }
}
