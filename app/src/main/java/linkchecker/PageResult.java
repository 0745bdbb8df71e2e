package linkchecker;

import java.util.List;
import java.util.Locale;

// Result of crawling one page (a row of links_multithread.csv).
// internalLinksFound is null when links were not extracted (error, non-HTML, extraction off).
public record PageResult(
        String url,
        String status,
        double timeMs,
        String thread,
        String startUtc,
        String endUtc,
        String error,
        Integer internalLinksFound,
        String finalUrl,
        String contentType,
        String violationSummary,
        int violationsCount
) {
    public static final List<String> HEADER = List.of(
            "url", "status", "time_ms", "thread", "start_utc", "end_utc",
            "error", "internal_links_found", "final_url", "content_type",
            "violation_summary", "violations_count");

    public int linksFoundOrZero() {
        return internalLinksFound == null ? 0 : internalLinksFound;
    }

    public List<String> toRow() {
        return List.of(
                url,
                status,
                String.format(Locale.ROOT, "%.2f", timeMs),
                thread,
                startUtc,
                endUtc,
                error,
                internalLinksFound == null ? "" : String.valueOf(internalLinksFound),
                finalUrl,
                contentType,
                violationSummary,
                String.valueOf(violationsCount));
    }
}
