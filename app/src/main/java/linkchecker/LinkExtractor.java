package linkchecker;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

// Pulls in-scope links out of a page's main content (<main>, #content or .content,
// else the whole document) after stripping site chrome. Keeps allow-listed
// http(s) links with a path, normalized, and allow-listed mailto: addresses.
public class LinkExtractor {

    static final List<String> CHROME_SELECTORS = List.of(
            "header", "nav", "footer", "aside", ".site-header", ".site-footer", ".global-nav");

    static final Set<String> SKIP_SCHEMES = Set.of("tel", "javascript", "data");

    private final List<String> allowDomains;
    private final boolean countDuplicates;

    public LinkExtractor(Collection<String> allowDomains, boolean countDuplicates) {
        List<String> lower = new ArrayList<>();
        for (String d : allowDomains) lower.add(d.toLowerCase(Locale.ROOT));
        this.allowDomains = List.copyOf(lower);
        this.countDuplicates = countDuplicates;
    }

    // links keeps every occurrence in page order; count follows count_duplicates.
    public record ExtractedLinks(List<String> links, int count) {

        // Cap the occurrence list; count is left as found.
        public List<String> capped(int maxLinks) {
            if (maxLinks > 0 && links.size() > maxLinks) {
                return links.subList(0, maxLinks);
            }
            return links;
        }
    }

    public ExtractedLinks extract(String pageUrl, String html) {
        Document doc = Jsoup.parse(html == null ? "" : html, pageUrl);

        for (String selector : CHROME_SELECTORS) {
            doc.select(selector).remove();
        }

        Element area = mainContent(doc);

        List<String> links = new ArrayList<>();
        Set<String> unique = new LinkedHashSet<>();

        for (Element a : area.select("a[href]")) {
            String kept = keep(pageUrl, a);
            if (kept == null) continue;
            links.add(kept);
            unique.add(kept);
        }

        int count = countDuplicates ? links.size() : unique.size();
        return new ExtractedLinks(List.copyOf(links), count);
    }

    private static Element mainContent(Document doc) {
        Element main = doc.selectFirst("main");
        if (main == null) main = doc.selectFirst("#content");
        if (main == null) main = doc.selectFirst(".content");
        return main != null ? main : doc;
    }

    // Normalized form of an in-scope link, or null to discard it.
    private String keep(String pageUrl, Element a) {
        // An empty href points back at the page itself.
        String abs = UrlUtil.resolveAgainst(pageUrl, a.attr("href").trim());
        if (abs == null) return null;

        URI uri;
        try {
            uri = new URI(abs);
        } catch (Exception e) {
            return null;
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);

        if (scheme.equals("mailto")) {
            return keepMailto(uri);
        }
        if (SKIP_SCHEMES.contains(scheme)) return null;
        if (!scheme.equals("http") && !scheme.equals("https")) return null;

        String host = uri.getHost() != null ? uri.getHost() : hostOfAuthority(uri.getRawAuthority());
        if (!UrlUtil.hostAllowed(host, allowDomains)) return null;

        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) return null;

        return UrlUtil.cacheKeyForm(abs);
    }

    private String keepMailto(URI uri) {
        String address = uri.getSchemeSpecificPart();
        if (address == null) return null;
        int q = address.indexOf('?');
        if (q >= 0) address = address.substring(0, q);
        address = address.trim().toLowerCase(Locale.ROOT);

        int at = address.lastIndexOf('@');
        if (at < 0) return null;
        String domain = address.substring(at + 1);
        if (!UrlUtil.hostAllowed(domain, allowDomains)) return null;
        return "mailto:" + address;
    }

    private static String hostOfAuthority(String authority) {
        if (authority == null) return null;
        String h = authority;
        int at = h.lastIndexOf('@');
        if (at >= 0) h = h.substring(at + 1);
        int colon = h.lastIndexOf(':');
        if (colon >= 0 && h.indexOf(']') < colon) h = h.substring(0, colon);
        return h;
    }
}
