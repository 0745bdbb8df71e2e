package linkchecker;

// Outcome class of one HTTP exchange.
public enum FetchStatus {
    OK,
    TIMEOUT,
    FAILED
}
