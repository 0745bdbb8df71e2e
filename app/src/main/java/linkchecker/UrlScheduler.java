package linkchecker;

import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

// Orders the seed list before crawling starts.
// SchedulerMode#FIFO keeps the input order. SchedulerMode#PRIORITY
// sorts by path depth (plus a penalty of 2 for a query string), then by URL
// length; remaining ties keep their input order. Never adds or drops URLs.
public class UrlScheduler {

    private static final int QUERY_PENALTY = 2;

    private UrlScheduler() { }

    public static List<String> orderUrls(List<String> urls, SchedulerMode mode) {
        List<String> ordered = new ArrayList<>(urls);
        if (mode == SchedulerMode.PRIORITY) {
            // List.sort is stable
            ordered.sort(Comparator.comparingInt(UrlScheduler::priorityScore)
                    .thenComparingInt(String::length));
        }
        return ordered;
    }

    // Smaller score = crawled earlier.
    static int priorityScore(String url) {
        String path;
        boolean hasQuery;
        try {
            URI uri = new URI(url.trim());
            path = uri.getRawPath();
            hasQuery = uri.getRawQuery() != null && !uri.getRawQuery().isEmpty();
        } catch (Exception e) {
            // rough fallback for hrefs URI cannot parse
            String s = url;
            int q = s.indexOf('?');
            hasQuery = q >= 0 && q < s.length() - 1;
            if (q >= 0) s = s.substring(0, q);
            int sep = s.indexOf("://");
            int slash = sep >= 0 ? s.indexOf('/', sep + 3) : s.indexOf('/');
            path = slash >= 0 ? s.substring(slash) : "";
        }
        int depth = 0;
        if (path != null) {
            for (int i = 0; i < path.length(); i++) {
                if (path.charAt(i) == '/') depth++;
            }
        }
        return depth + (hasQuery ? QUERY_PENALTY : 0);
    }
}
