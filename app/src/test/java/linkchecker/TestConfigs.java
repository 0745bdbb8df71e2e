package linkchecker;

// Config builder for tests: a valid base document plus overrides in YAML.
final class TestConfigs {

    static final String BASE = """
            sitemap_url: https://example.edu/sitemap.xml
            domain_allowlist: [example.edu]
            user_agent: TestChecker/1.0
            """;

    private TestConfigs() { }

    static CrawlerConfig parse(String extraYaml) {
        return ConfigLoader.parse(BASE + extraYaml);
    }

    static CrawlerConfig defaults() {
        return parse("");
    }
}
