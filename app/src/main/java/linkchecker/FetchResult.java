package linkchecker;

import java.net.SocketTimeoutException;
import java.util.Locale;

// Tagged result of one GET with redirects followed. On FetchStatus#OK
// the response fields are filled and error is empty; otherwise only
// error ("Kind: message") is meaningful.
public record FetchResult(
        FetchStatus status,
        int statusCode,
        String finalUrl,
        String contentType,
        String body,
        int redirects,
        String error
) {
    // Longest diagnostic message kept after the exception kind.
    public static final int MAX_MESSAGE = 120;

    public static FetchResult ok(int statusCode, String finalUrl, String contentType, String body, int redirects) {
        return new FetchResult(FetchStatus.OK, statusCode, finalUrl,
                contentType == null ? "" : contentType,
                body == null ? "" : body,
                redirects, "");
    }

    public static FetchResult failed(FetchStatus status, String kind, String message) {
        return new FetchResult(status, 0, "", "", "", 0,
                kind + ": " + UrlUtil.truncate(message == null ? "" : message, MAX_MESSAGE));
    }

    public static FetchResult failed(Throwable t) {
        FetchStatus s = t instanceof SocketTimeoutException ? FetchStatus.TIMEOUT : FetchStatus.FAILED;
        return failed(s, t.getClass().getSimpleName(), t.getMessage());
    }

    public boolean isOk() {
        return status == FetchStatus.OK;
    }

    // "ok" in the requests sense: any status below 400
    public boolean isSuccessful() {
        return isOk() && statusCode < 400;
    }

    public boolean isHtml() {
        return contentType.toLowerCase(Locale.ROOT).contains("text/html");
    }
}
