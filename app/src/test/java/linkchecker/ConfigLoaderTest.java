package linkchecker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConfigLoaderTest {

    @Test
    void defaultsApplyForMissingKeys() {
        CrawlerConfig c = ConfigLoader.parse("sitemap_url: https://example.edu/sitemap.xml\n");

        assertEquals(12, c.threads());
        assertEquals(0.0, c.delaySeconds());
        assertEquals(10, c.timeoutSeconds());
        assertEquals("LinkChecker/0.2", c.userAgent());
        assertTrue(c.domainAllowlist().isEmpty());
        assertTrue(c.extractLinks());
        assertTrue(c.countDuplicates());
        assertEquals(0, c.maxUrls());
        assertEquals(SchedulerMode.FIFO, c.scheduler());
        assertTrue(c.checker().treatRedirectAsOk());
        assertEquals(300, c.checker().maxLinksPerPage());
        assertEquals(CacheMode.NONE, c.cache().mode());
        assertEquals(10000, c.cache().maxSize());
        assertEquals(Paths.get("output"), c.report().outputDir());
        assertEquals(',', c.report().csvDelimiter());
        assertEquals(Paths.get("data", "urls_initial.csv"), c.seeds().seedsCsv());
        assertFalse(c.seeds().mockMode());
    }

    @Test
    void fullFileIsRead(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, """
                mock_mode: true
                data_dir: work/data
                output_dir: work/out
                csv_delimiter: ";"
                threads: 4
                delay: 0.25
                timeout: "7"
                user_agent: Checker/9
                domain_allowlist:
                  - example.edu
                  - example.org
                extract_links: true
                count_duplicates: false
                max_urls: 50
                scheduler: priority
                checker:
                  treat_redirect_as_ok: false
                  cascade_login_patterns: ["/cas/login", "idp.example.edu"]
                  max_links_per_page: 25
                cache:
                  mode: lru
                  max_size: 500
                mock:
                  sitemap_path: mock/sitemap.xml
                  sample_page_path: mock/page.html
                  sample_page_url: https://example.edu/sample
                """);

        CrawlerConfig c = ConfigLoader.load(file);

        assertEquals(4, c.threads());
        assertEquals(0.25, c.delaySeconds());
        assertEquals(7, c.timeoutSeconds());
        assertEquals("Checker/9", c.userAgent());
        assertEquals(List.of("example.edu", "example.org"), c.domainAllowlist());
        assertFalse(c.countDuplicates());
        assertEquals(50, c.maxUrls());
        assertEquals(SchedulerMode.PRIORITY, c.scheduler());
        assertFalse(c.checker().treatRedirectAsOk());
        assertEquals(List.of("/cas/login", "idp.example.edu"), c.checker().cascadeLoginPatterns());
        assertEquals(25, c.checker().maxLinksPerPage());
        assertEquals(CacheMode.LRU, c.cache().mode());
        assertEquals(500, c.cache().maxSize());
        assertEquals(';', c.report().csvDelimiter());
        assertTrue(c.seeds().mockMode());
        assertEquals(Paths.get("mock/sitemap.xml"), c.seeds().mockSitemapPath());
        assertEquals("https://example.edu/sample", c.seeds().samplePageUrl());
        assertEquals(Paths.get("work/data/urls_initial.csv"), c.seeds().seedsCsv());
    }

    @Test
    void lruWithNonPositiveSizeFailsFast() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> TestConfigs.parse("""
                cache:
                  mode: lru
                  max_size: 0
                """));
        assertTrue(e.getMessage().contains("cache.max_size"));
    }

    @Test
    void nonPositiveSizeIsFineWithoutCache() {
        CrawlerConfig c = TestConfigs.parse("""
                cache:
                  mode: none
                  max_size: 0
                """);
        assertEquals(CacheMode.NONE, c.cache().mode());
    }

    @Test
    void malformedValuesAreRejected() {
        assertThrows(ConfigurationException.class, () -> TestConfigs.parse("threads: many\n"));
        assertThrows(ConfigurationException.class, () -> TestConfigs.parse("threads: 0\n"));
        assertThrows(ConfigurationException.class, () -> TestConfigs.parse("delay: -1\n"));
        assertThrows(ConfigurationException.class, () -> TestConfigs.parse("count_duplicates: maybe\n"));
        assertThrows(ConfigurationException.class, () -> TestConfigs.parse("scheduler: lifo\n"));
        assertThrows(ConfigurationException.class, () -> TestConfigs.parse("cache:\n  mode: redis\n"));
        assertThrows(ConfigurationException.class, () -> TestConfigs.parse("checker: [1, 2]\n"));
        assertThrows(ConfigurationException.class, () -> TestConfigs.parse("csv_delimiter: ';;'\n"));
        assertThrows(ConfigurationException.class, () -> TestConfigs.parse("max_urls: -3\n"));
        assertThrows(ConfigurationException.class, () -> TestConfigs.parse("threads: [\n"));
    }

    @Test
    void sourceOfSeedsIsRequired() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parse("threads: 2\n"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parse("mock_mode: true\n"));
    }

    @Test
    void missingFileIsAConfigurationError(@TempDir Path tempDir) {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load(tempDir.resolve("nope.yaml")));
    }

    @Test
    void exampleResourceLoads() throws Exception {
        Path example = Paths.get(getClass().getResource("/config-test.yaml").toURI());

        CrawlerConfig c = ConfigLoader.load(example);

        assertEquals(3, c.threads());
        assertEquals(CacheMode.LRU, c.cache().mode());
        assertEquals(List.of("/cas/login"), c.checker().cascadeLoginPatterns());
    }
}
