package linkchecker;

// Per-worker politeness delay: at least delay between two requests of
// the same worker. Not thread-safe; each worker owns one.
public class RateLimiter {

    private final long delayNanos;
    private long lastRequestNanos;
    private boolean first = true;

    public RateLimiter(double delaySeconds) {
        this.delayNanos = (long) (Math.max(0.0, delaySeconds) * 1_000_000_000L);
    }

    // Sleep until the delay since this worker's previous request has passed.
    // The very first request waits the full delay too.
    public void acquire() throws InterruptedException {
        if (delayNanos <= 0) return;

        long wait;
        if (first) {
            wait = delayNanos;
            first = false;
        } else {
            wait = delayNanos - (System.nanoTime() - lastRequestNanos);
        }
        if (wait > 0) {
            Thread.sleep(wait / 1_000_000L, (int) (wait % 1_000_000L));
        }
        lastRequestNanos = System.nanoTime();
    }
}
