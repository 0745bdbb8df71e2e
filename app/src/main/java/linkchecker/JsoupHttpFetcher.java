package linkchecker;

import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;

// HttpFetcher backed by one jsoup session. Each worker builds its own
// instance so keep-alive connections are never contended across threads.
// Redirects are followed here rather than by jsoup so the chain length is known.
public class JsoupHttpFetcher implements HttpFetcher {

    public static final int MAX_REDIRECTS = 20;

    private final Connection session;

    public JsoupHttpFetcher(String userAgent, Duration timeout) {
        this.session = Jsoup.newSession()
                .userAgent(userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .timeout((int) timeout.toMillis())
                .followRedirects(false)
                .ignoreHttpErrors(true)     // 4xx/5xx are answers, not failures
                .ignoreContentType(true);
    }

    public JsoupHttpFetcher(CrawlerConfig config) {
        this(config.userAgent(), Duration.ofSeconds(config.timeoutSeconds()));
    }

    @Override
    public FetchResult get(String url) {
        String current = url;
        int redirects = 0;
        try {
            while (true) {
                Connection.Response res = session.newRequest()
                        .url(current)
                        .method(Connection.Method.GET)
                        .execute();

                int code = res.statusCode();
                String location = res.header("Location");
                String body = res.body();

                if (code >= 300 && code < 400 && location != null && !location.isBlank()) {
                    if (redirects >= MAX_REDIRECTS) {
                        return FetchResult.failed(FetchStatus.FAILED, "TooManyRedirects",
                                "Exceeded " + MAX_REDIRECTS + " redirects.");
                    }
                    String next = UrlUtil.resolveAgainst(res.url().toExternalForm(), location.trim());
                    if (next == null) {
                        return FetchResult.failed(FetchStatus.FAILED, "InvalidURL",
                                "Bad redirect location: " + location);
                    }
                    current = next;
                    redirects++;
                    continue;
                }

                return FetchResult.ok(code, res.url().toExternalForm(), res.contentType(), body, redirects);
            }
        } catch (IOException e) {
            // timeouts, DNS, refused connections, TLS problems
            return FetchResult.failed(e);
        } catch (UncheckedIOException e) {
            // body read failed half way
            return FetchResult.failed(e.getCause());
        } catch (IllegalArgumentException e) {
            // jsoup rejects malformed or non-http URLs this way
            return FetchResult.failed(FetchStatus.FAILED, "InvalidURL", e.getMessage());
        }
    }
}
