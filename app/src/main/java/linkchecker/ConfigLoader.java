package linkchecker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

// Reads config.yaml into a CrawlerConfig. Unknown keys are ignored;
// a value of the wrong type fails the whole load.
public class ConfigLoader {

    public static final int DEFAULT_THREADS = 12;
    public static final int DEFAULT_TIMEOUT_S = 10;
    public static final String DEFAULT_USER_AGENT = "LinkChecker/0.2";
    public static final int DEFAULT_MAX_LINKS_PER_PAGE = 300;
    public static final int DEFAULT_CACHE_SIZE = 10000;

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() { }

    public static CrawlerConfig load(Path file) {
        String text;
        try {
            text = Files.readString(file);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read config file " + file + ": " + e.getMessage(), e);
        }
        return parse(text);
    }

    public static CrawlerConfig parse(String yaml) {
        JsonNode root;
        try {
            root = YAML.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed YAML: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = MissingNode.getInstance();
        } else if (!root.isObject()) {
            throw new ConfigurationException("Config root must be a mapping");
        }

        JsonNode checker = section(root, "checker");
        JsonNode cache = section(root, "cache");
        JsonNode mock = section(root, "mock");

        CrawlerConfig.CheckerConfig checkerConfig = new CrawlerConfig.CheckerConfig(
                bool(checker, "treat_redirect_as_ok", true),
                strings(checker, "cascade_login_patterns"),
                integer(checker, "max_links_per_page", DEFAULT_MAX_LINKS_PER_PAGE));

        CrawlerConfig.CacheConfig cacheConfig = new CrawlerConfig.CacheConfig(
                CacheMode.fromLabel(text(cache, "mode", "none")),
                integer(cache, "max_size", DEFAULT_CACHE_SIZE));

        Path dataDir = Paths.get(text(root, "data_dir", "data"));
        CrawlerConfig.SeedConfig seedConfig = new CrawlerConfig.SeedConfig(
                bool(root, "mock_mode", false),
                text(root, "sitemap_url", null),
                dataDir,
                path(mock, "sitemap_path"),
                path(mock, "sample_page_path"),
                text(mock, "sample_page_url", null));

        String delimiter = text(root, "csv_delimiter", ",");
        if (delimiter.length() != 1) {
            throw new ConfigurationException("csv_delimiter must be a single character, got '" + delimiter + "'");
        }
        CrawlerConfig.ReportConfig reportConfig = new CrawlerConfig.ReportConfig(
                Paths.get(text(root, "output_dir", "output")),
                delimiter.charAt(0));

        return new CrawlerConfig(
                integer(root, "threads", DEFAULT_THREADS),
                decimal(root, "delay", 0.0),
                integer(root, "timeout", DEFAULT_TIMEOUT_S),
                text(root, "user_agent", DEFAULT_USER_AGENT),
                strings(root, "domain_allowlist"),
                bool(root, "extract_links", true),
                bool(root, "count_duplicates", true),
                integer(root, "max_urls", 0),
                SchedulerMode.fromLabel(text(root, "scheduler", "fifo")),
                checkerConfig,
                cacheConfig,
                seedConfig,
                reportConfig);
    }

    private static JsonNode section(JsonNode parent, String key) {
        JsonNode n = parent.path(key);
        if (n.isMissingNode() || n.isNull()) return MissingNode.getInstance();
        if (!n.isObject()) throw new ConfigurationException(key + " must be a mapping");
        return n;
    }

    private static boolean absent(JsonNode n) {
        return n.isMissingNode() || n.isNull();
    }

    private static int integer(JsonNode parent, String key, int def) {
        JsonNode n = parent.path(key);
        if (absent(n)) return def;
        if (n.isIntegralNumber() && n.canConvertToInt()) return n.intValue();
        if (n.isTextual()) {
            try {
                return Integer.parseInt(n.textValue().trim());
            } catch (NumberFormatException e) {
                // reported below
            }
        }
        throw new ConfigurationException("Invalid integer for " + key + ": " + n);
    }

    private static double decimal(JsonNode parent, String key, double def) {
        JsonNode n = parent.path(key);
        if (absent(n)) return def;
        if (n.isNumber()) return n.doubleValue();
        if (n.isTextual()) {
            try {
                return Double.parseDouble(n.textValue().trim());
            } catch (NumberFormatException e) {
                // reported below
            }
        }
        throw new ConfigurationException("Invalid number for " + key + ": " + n);
    }

    private static boolean bool(JsonNode parent, String key, boolean def) {
        JsonNode n = parent.path(key);
        if (absent(n)) return def;
        if (n.isBoolean()) return n.booleanValue();
        // same strictness as the CLI: only true/false
        if (n.isTextual()) {
            String s = n.textValue().trim().toLowerCase(Locale.ROOT);
            if (s.equals("true")) return true;
            if (s.equals("false")) return false;
        }
        throw new ConfigurationException("Invalid boolean for " + key + ": " + n + " (use true/false)");
    }

    private static String text(JsonNode parent, String key, String def) {
        JsonNode n = parent.path(key);
        if (absent(n)) return def;
        if (n.isValueNode()) return n.asText();
        throw new ConfigurationException(key + " must be a plain value");
    }

    private static Path path(JsonNode parent, String key) {
        String s = text(parent, key, null);
        return s == null ? null : Paths.get(s);
    }

    private static List<String> strings(JsonNode parent, String key) {
        JsonNode n = parent.path(key);
        List<String> out = new ArrayList<>();
        if (absent(n)) return out;
        if (!n.isArray()) throw new ConfigurationException(key + " must be a list");
        for (JsonNode item : n) {
            if (!item.isValueNode() || item.isNull()) {
                throw new ConfigurationException(key + " must only contain plain values");
            }
            String s = item.asText().trim();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }
}
