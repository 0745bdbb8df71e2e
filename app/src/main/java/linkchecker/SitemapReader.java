package linkchecker;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// Turns a sitemap into the seed list (data/urls_initial.csv) and reads it back.
public class SitemapReader {

    static final String SEEDS_HEADER = "url";
    private static final Duration SITEMAP_TIMEOUT = Duration.ofSeconds(20);

    private SitemapReader() { }

    // Read the sitemap named by the config, write the seed CSV, return the URL count.
    public static int ingest(CrawlerConfig config) throws IOException {
        CrawlerConfig.SeedConfig seeds = config.seeds();
        String xml = seeds.mockMode()
                ? Files.readString(seeds.mockSitemapPath())
                : download(seeds.sitemapUrl(), config.userAgent());
        List<String> urls = parseLocs(xml);
        writeSeeds(seeds.seedsCsv(), urls);
        return urls.size();
    }

    // All <loc> entries, normalized, de-duplicated in document order.
    public static List<String> parseLocs(String xml) {
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        Set<String> seen = new LinkedHashSet<>();
        for (Element loc : doc.select("loc")) {
            String u = normalize(loc.text());
            if (!u.isEmpty()) seen.add(u);
        }
        return new ArrayList<>(seen);
    }

    // https only, no fragment, no trailing slashes.
    static String normalize(String raw) {
        String u = raw.trim();
        if (u.startsWith("http://")) u = "https://" + u.substring("http://".length());
        int hash = u.indexOf('#');
        if (hash >= 0) u = u.substring(0, hash);
        int end = u.length();
        while (end > 0 && u.charAt(end - 1) == '/') end--;
        return u.substring(0, end);
    }

    public static void writeSeeds(Path csv, List<String> urls) throws IOException {
        if (csv.getParent() != null) Files.createDirectories(csv.getParent());
        List<String> lines = new ArrayList<>(urls.size() + 1);
        lines.add(SEEDS_HEADER);
        lines.addAll(urls);
        Files.write(csv, lines, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    // Seed URLs from the CSV, header and blank lines skipped.
    public static List<String> readSeeds(Path csv) throws IOException {
        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        List<String> urls = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            String u = lines.get(i).trim();
            if (!u.isEmpty()) urls.add(u);
        }
        return urls;
    }

    private static String download(String sitemapUrl, String userAgent) throws IOException {
        return Jsoup.connect(sitemapUrl)
                .userAgent(userAgent)
                .timeout((int) SITEMAP_TIMEOUT.toMillis())
                .ignoreContentType(true)
                .execute()
                .body();
    }
}
