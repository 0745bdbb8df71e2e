package linkchecker;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

// Runs one finite crawl over a fixed URL list with a pool of PageWorkers
// sharing one Frontier, then hands the aggregated rows to the ReportSink.
public class CrawlEngine {

    private final CrawlerConfig config;
    private final Supplier<HttpFetcher> fetcherFactory;
    private final ReportSink reportSink;
    private final PrintStream out;

    public CrawlEngine(CrawlerConfig config, Supplier<HttpFetcher> fetcherFactory, ReportSink reportSink) {
        this(config, fetcherFactory, reportSink, System.out);
    }

    public CrawlEngine(CrawlerConfig config,
                       Supplier<HttpFetcher> fetcherFactory,
                       ReportSink reportSink,
                       PrintStream out) {
        this.config = config;
        this.fetcherFactory = fetcherFactory;
        this.reportSink = reportSink;
        this.out = out;
    }

    // Crawl every URL once and return pages per second.
    public double crawlAll(List<String> urls) {
        List<String> ordered = UrlScheduler.orderUrls(urls, config.scheduler());
        if (config.maxUrls() > 0 && ordered.size() > config.maxUrls()) {
            ordered = new ArrayList<>(ordered.subList(0, config.maxUrls()));
        }
        int total = ordered.size();

        Frontier frontier = new Frontier(ordered);
        ResultCollector collector = new ResultCollector(frontier.distinctCount(), out);
        LruCache<String, LinkCheckResult> cache = config.cache().mode() == CacheMode.LRU
                ? new LruCache<>(config.cache().maxSize())
                : null;

        LinkExtractor extractor = new LinkExtractor(config.domainAllowlist(), config.countDuplicates());
        ViolationClassifier classifier = new ViolationClassifier(config.checker().cascadeLoginPatterns());

        int threads = config.threads();
        ProcessSampler sampler = ProcessSampler.start();

        out.println("[crawl] mode=" + config.scheduler().label() + ", threads=" + threads
                + ", delay=" + config.delaySeconds() + "s, total=" + total);
        long t0 = System.nanoTime();

        ExecutorService pool = Executors.newFixedThreadPool(threads, workerThreads());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(newWorker(frontier, collector, cache, extractor, classifier)));
            }
            awaitAll(futures);
        } finally {
            shutdownGracefully(pool);
        }

        double duration = (System.nanoTime() - t0) / 1_000_000_000.0;
        Collection<PageResult> pages = collector.pages();
        Collection<ViolationRecord> violations = collector.violations();
        double throughput = duration > 0 ? pages.size() / duration : 0.0;

        out.println(String.format(Locale.ROOT, "[crawl] done: %d URLs in %.2fs -> %.2f URLs/s",
                pages.size(), duration, throughput));

        RunSummary summary = summarize(total, duration, throughput, pages, violations, cache, sampler);
        out.println("[crawl] broken_links=" + summary.brokenLinksTotal()
                + ", cascade_logins=" + summary.cascadeLoginsTotal()
                + ", pages_with_violations=" + summary.pagesWithViolations());

        reportSink.write(pages, violations, summary);
        return throughput;
    }

    // Each worker owns its HTTP client, link checker and rate limiter; the rest is shared.
    private PageWorker newWorker(Frontier frontier,
                                 ResultCollector collector,
                                 LruCache<String, LinkCheckResult> cache,
                                 LinkExtractor extractor,
                                 ViolationClassifier classifier) {
        HttpFetcher fetcher = fetcherFactory.get();
        LinkChecker checker = new HttpLinkChecker(fetcher, config.checker().treatRedirectAsOk(), cache);
        return new PageWorker(frontier, fetcher, checker, extractor, classifier, collector,
                new RateLimiter(config.delaySeconds()),
                config.extractLinks(), config.checker().maxLinksPerPage());
    }

    private RunSummary summarize(int total,
                                 double duration,
                                 double throughput,
                                 Collection<PageResult> pages,
                                 Collection<ViolationRecord> violations,
                                 LruCache<String, LinkCheckResult> cache,
                                 ProcessSampler sampler) {
        int broken = 0;
        int cascade = 0;
        Set<String> pagesWithViolations = new HashSet<>();
        for (ViolationRecord v : violations) {
            if (v.type() == ViolationType.BROKEN_LINK) broken++;
            else if (v.type() == ViolationType.CASCADE_LOGIN) cascade++;
            pagesWithViolations.add(v.pageUrl());
        }

        long linksFound = 0;
        for (PageResult p : pages) linksFound += p.linksFoundOrZero();

        return new RunSummary(
                PageWorker.nowUtc(),
                config.scheduler(),
                config.threads(),
                config.delaySeconds(),
                total,
                duration,
                throughput,
                broken,
                cascade,
                pagesWithViolations.size(),
                linksFound,
                config.cache().mode(),
                config.cache().maxSize(),
                cache == null ? LruCache.CacheStats.EMPTY : cache.stats(),
                sampler.cpuPercentSinceStart(),
                sampler.memoryRssMb());
    }

    // Block until every worker has seen an empty frontier.
    private void awaitAll(List<Future<?>> futures) {
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (ExecutionException e) {
                // workers record page failures themselves, so this is a bug in the worker loop
                System.err.println("Worker crashed: " + e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    // Stop workers with a small grace period.
    private void shutdownGracefully(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger n = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r, "crawl-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
