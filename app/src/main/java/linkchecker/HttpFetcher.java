package linkchecker;

// One worker's HTTP client. Implementations are not shared between threads and
// never throw for transport problems; they report them as a failed FetchResult.
public interface HttpFetcher {

    FetchResult get(String url);
}
