package linkchecker;

import java.util.List;
import java.util.Locale;

// Aggregates of one crawl invocation (a row appended to run_summary.csv).
// cpuPercentAvg and memoryRssMb are null when they could not be sampled.
public record RunSummary(
        String tsUtc,
        SchedulerMode scheduler,
        int threads,
        double delaySeconds,
        int urlsTotal,
        double durationSeconds,
        double urlsPerSecond,
        int brokenLinksTotal,
        int cascadeLoginsTotal,
        int pagesWithViolations,
        long totalLinksFound,
        CacheMode cacheMode,
        int cacheMaxSize,
        LruCache.CacheStats cacheStats,
        Double cpuPercentAvg,
        Double memoryRssMb
) {
    public static final List<String> HEADER = List.of(
            "ts_utc", "scheduler", "threads", "delay_s", "urls_total", "duration_s", "urls_per_s",
            "broken_links_total", "cascade_logins_total", "pages_with_violations", "total_links_found",
            "cache_mode", "cache_max_size", "cache_accesses", "cache_hits", "cache_misses",
            "cache_hit_ratio", "cpu_percent_avg", "memory_rss_mb");

    public List<String> toRow() {
        return List.of(
                tsUtc,
                scheduler.label(),
                String.valueOf(threads),
                String.valueOf(delaySeconds),
                String.valueOf(urlsTotal),
                fmt2(durationSeconds),
                fmt2(urlsPerSecond),
                String.valueOf(brokenLinksTotal),
                String.valueOf(cascadeLoginsTotal),
                String.valueOf(pagesWithViolations),
                String.valueOf(totalLinksFound),
                cacheMode.label(),
                String.valueOf(cacheMaxSize),
                String.valueOf(cacheStats.accesses()),
                String.valueOf(cacheStats.hits()),
                String.valueOf(cacheStats.misses()),
                String.format(Locale.ROOT, "%.4f", cacheStats.hitRatio()),
                cpuPercentAvg == null ? "" : fmt2(cpuPercentAvg),
                memoryRssMb == null ? "" : fmt2(memoryRssMb));
    }

    private static String fmt2(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }
}
