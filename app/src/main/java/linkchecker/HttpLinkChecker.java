package linkchecker;

// Checks a link with one GET through the worker's own HttpFetcher,
// optionally memoized in a run-wide LruCache keyed by
// UrlUtil#cacheKeyForm(String).
// Classification: status >= 400 is broken; 3xx is ok or broken depending on
// treat_redirect_as_ok; anything else is ok. A transport failure is a
// broken link with an empty status. Failures are not retried.
public class HttpLinkChecker implements LinkChecker {

    public static final String NOTE_OK = "ok";
    public static final String NOTE_STATUS_4XX = "status>=400";
    public static final String NOTE_REDIRECT_OK = "redirect ok";
    public static final String NOTE_REDIRECT_BROKEN = "redirect treated as broken";

    private final HttpFetcher fetcher;
    private final boolean treatRedirectAsOk;
    private final LruCache<String, LinkCheckResult> cache;   // null when caching is off

    public HttpLinkChecker(HttpFetcher fetcher, boolean treatRedirectAsOk, LruCache<String, LinkCheckResult> cache) {
        this.fetcher = fetcher;
        this.treatRedirectAsOk = treatRedirectAsOk;
        this.cache = cache;
    }

    @Override
    public LinkCheckResult check(String url) {
        String key = UrlUtil.cacheKeyForm(url);
        if (cache != null) {
            LinkCheckResult cached = cache.get(key);
            if (cached != null) return cached;
        }

        LinkCheckResult result = classify(fetcher.get(url));

        // populate on miss; a concurrent miss on the same key just overwrites with an equal verdict
        if (cache != null) {
            cache.set(key, result);
        }
        return result;
    }

    LinkCheckResult classify(FetchResult res) {
        if (!res.isOk()) {
            return new LinkCheckResult(Verdict.BROKEN_LINK, "", "", res.error());
        }
        int code = res.statusCode();
        String status = String.valueOf(code);

        if (code >= 400) {
            return new LinkCheckResult(Verdict.BROKEN_LINK, status, res.finalUrl(), NOTE_STATUS_4XX);
        }
        if (code >= 300) {
            return treatRedirectAsOk
                    ? new LinkCheckResult(Verdict.OK, status, res.finalUrl(), NOTE_REDIRECT_OK)
                    : new LinkCheckResult(Verdict.BROKEN_LINK, status, res.finalUrl(), NOTE_REDIRECT_BROKEN);
        }
        String note = res.redirects() > 0 ? "redirect chain len=" + res.redirects() : NOTE_OK;
        return new LinkCheckResult(Verdict.OK, status, res.finalUrl(), note);
    }
}
