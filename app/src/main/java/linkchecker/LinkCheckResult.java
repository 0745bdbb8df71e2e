package linkchecker;

// Immutable outcome of one link check; this is what the cache stores.
// status and finalUrl are empty when no response was received.
public record LinkCheckResult(Verdict verdict, String status, String finalUrl, String note) {

    public boolean isBroken() {
        return verdict == Verdict.BROKEN_LINK;
    }
}
