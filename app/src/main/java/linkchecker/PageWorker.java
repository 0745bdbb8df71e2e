package linkchecker;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

// One crawl thread's loop: take a URL from the frontier, skip it if another
// worker already had it, wait for the rate limiter, fetch, extract links,
// check them and record the page. Ends when the frontier is empty.
// Everything that can go wrong with a single page ends up in that page's
// row; the loop itself only stops on an empty frontier or an interrupt.
public class PageWorker implements Runnable {

    private final Frontier frontier;
    private final HttpFetcher fetcher;
    private final LinkChecker checker;
    private final LinkExtractor extractor;
    private final ViolationClassifier classifier;
    private final ResultCollector collector;
    private final RateLimiter rateLimiter;
    private final boolean extractLinks;
    private final int maxLinksPerPage;

    public PageWorker(Frontier frontier,
                      HttpFetcher fetcher,
                      LinkChecker checker,
                      LinkExtractor extractor,
                      ViolationClassifier classifier,
                      ResultCollector collector,
                      RateLimiter rateLimiter,
                      boolean extractLinks,
                      int maxLinksPerPage) {
        this.frontier = frontier;
        this.fetcher = fetcher;
        this.checker = checker;
        this.extractor = extractor;
        this.classifier = classifier;
        this.collector = collector;
        this.rateLimiter = rateLimiter;
        this.extractLinks = extractLinks;
        this.maxLinksPerPage = maxLinksPerPage;
    }

    // Page row plus the violations found on it.
    record PageOutcome(PageResult page, List<ViolationRecord> violations) { }

    @Override
    public void run() {
        while (true) {
            String url = frontier.poll();
            if (url == null) return;                // drained

            if (!frontier.markVisited(url)) continue;

            try {
                rateLimiter.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            PageOutcome outcome = processPage(url);
            collector.record(outcome.page(), outcome.violations());
        }
    }

    PageOutcome processPage(String url) {
        String thread = Thread.currentThread().getName();
        String startUtc = nowUtc();
        long t0 = System.nanoTime();

        try {
            FetchResult res = fetcher.get(url);
            double ms = elapsedMs(t0);

            if (!res.isOk()) {
                return new PageOutcome(errorRow(url, ms, thread, startUtc, res.error()), List.of());
            }

            String status = String.valueOf(reportStatus(url, res));
            Integer linksFound = null;
            List<ViolationRecord> violations = List.of();

            if (extractLinks && res.isSuccessful() && res.isHtml()) {
                LinkExtractor.ExtractedLinks extracted = extractor.extract(url, res.body());
                linksFound = extracted.count();
                // cap first, then check: violations may undercount on very link-heavy pages
                violations = classifier.classify(url, extracted.capped(maxLinksPerPage), checker);
            }

            PageResult page = new PageResult(url, status, ms, thread, startUtc, nowUtc(), "",
                    linksFound, res.finalUrl(), res.contentType(),
                    ViolationClassifier.summarize(violations), violations.size());
            return new PageOutcome(page, violations);

        } catch (RuntimeException e) {
            String error = e.getClass().getSimpleName() + ": "
                    + UrlUtil.truncate(String.valueOf(e.getMessage()), FetchResult.MAX_MESSAGE);
            return new PageOutcome(errorRow(url, elapsedMs(t0), thread, startUtc, error), List.of());
        }
    }

    // 301 whenever the fetch ended on a different effective URL, even if the final
    // answer was a 200; otherwise the raw status code.
    public static int reportStatus(String requestUrl, FetchResult res) {
        boolean moved = !UrlUtil.comparisonForm(requestUrl).equals(UrlUtil.comparisonForm(res.finalUrl()));
        return moved ? 301 : res.statusCode();
    }

    private static PageResult errorRow(String url, double ms, String thread, String startUtc, String error) {
        return new PageResult(url, "", ms, thread, startUtc, nowUtc(), error,
                null, "", "", ViolationClassifier.NO_VIOLATION, 0);
    }

    private static double elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000.0;
    }

    static String nowUtc() {
        return Instant.now().truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
