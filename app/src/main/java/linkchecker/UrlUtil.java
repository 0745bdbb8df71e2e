package linkchecker;

import org.jsoup.internal.StringUtil;

import java.net.URI;
import java.util.Collection;
import java.util.Locale;

public class UrlUtil {

    private UrlUtil() { }

    // Form used to detect redirects: scheme/host lowercased, no trailing slash,
    // no fragment, query kept verbatim.
    public static String comparisonForm(String url) {
        Parts p = Parts.of(url);
        String query = p.query.isEmpty() ? "" : "?" + p.query;
        return p.scheme + "://" + p.authority + p.path + query;
    }

    // Form used as cache key: like comparisonForm but query dropped too,
    // so ?utm=... variants share one entry.
    public static String cacheKeyForm(String url) {
        Parts p = Parts.of(url);
        return p.scheme + "://" + p.authority + p.path;
    }

    // Only accept http/https links.
    public static boolean isHttpLike(String url) {
        if (url == null) return false;
        String u = url.toLowerCase(Locale.ROOT);
        return u.startsWith("http://") || u.startsWith("https://");
    }

    // Host suffix match against the allow-list, e.g. "www.example.edu" matches "example.edu".
    public static boolean hostAllowed(String host, Collection<String> allowDomains) {
        if (host == null || host.isEmpty()) return false;
        String h = host.toLowerCase(Locale.ROOT);
        for (String dom : allowDomains) {
            if (dom != null && !dom.isEmpty() && h.endsWith(dom.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    // Resolve a relative href or Location against a base URL (RFC 3986, so "?q" keeps the base path).
    // Null when neither can be made absolute.
    public static String resolveAgainst(String baseUrl, String href) {
        String resolved = StringUtil.resolve(baseUrl, href);
        return resolved.isEmpty() ? null : resolved;
    }

    // Cut a message to at most max characters.
    public static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }

    // Lenient split of a URL into its pieces. Never throws: anything
    // java.net.URI rejects is taken apart by hand.
    private static final class Parts {
        final String scheme;
        final String authority;
        final String path;
        final String query;

        private Parts(String scheme, String authority, String path, String query) {
            this.scheme = scheme.toLowerCase(Locale.ROOT);
            this.authority = authority.toLowerCase(Locale.ROOT);
            this.path = stripTrailingSlashes(path);
            this.query = query;
        }

        static Parts of(String url) {
            String raw = url == null ? "" : url.trim();
            try {
                URI uri = new URI(raw);
                return new Parts(
                        nullToEmpty(uri.getScheme()),
                        nullToEmpty(uri.getRawAuthority()),
                        nullToEmpty(uri.getRawPath()),
                        nullToEmpty(uri.getRawQuery()));
            } catch (Exception e) {
                return byHand(raw);
            }
        }

        private static Parts byHand(String raw) {
            String rest = raw;
            int hash = rest.indexOf('#');
            if (hash >= 0) rest = rest.substring(0, hash);

            String query = "";
            int q = rest.indexOf('?');
            if (q >= 0) {
                query = rest.substring(q + 1);
                rest = rest.substring(0, q);
            }

            String scheme = "";
            int sep = rest.indexOf("://");
            if (sep > 0) {
                scheme = rest.substring(0, sep);
                rest = rest.substring(sep + 3);
            } else {
                return new Parts("", "", rest, query);
            }

            int slash = rest.indexOf('/');
            String authority = slash >= 0 ? rest.substring(0, slash) : rest;
            String path = slash >= 0 ? rest.substring(slash) : "";
            return new Parts(scheme, authority, path, query);
        }

        private static String stripTrailingSlashes(String path) {
            String p = path.isEmpty() ? "/" : path;
            int end = p.length();
            while (end > 0 && p.charAt(end - 1) == '/') end--;
            return p.substring(0, end);
        }

        private static String nullToEmpty(String s) {
            return s == null ? "" : s;
        }
    }
}
