package linkchecker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertTrue;

public class RateLimiterTest {

    @Test
    void zeroDelayNeverWaits() throws Exception {
        RateLimiter limiter = new RateLimiter(0.0);
        long t0 = System.nanoTime();
        for (int i = 0; i < 1000; i++) limiter.acquire();
        assertTrue(System.nanoTime() - t0 < 500_000_000L);
    }

    @Test
    void consecutiveRequestsAreSpacedByDelay() throws Exception {
        RateLimiter limiter = new RateLimiter(0.05);
        long t0 = System.nanoTime();
        limiter.acquire();   // first call waits the full delay too
        limiter.acquire();
        limiter.acquire();
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;

        assertTrue(elapsedMs >= 145, "elapsed " + elapsedMs + "ms");
    }

    @Test
    void timeSpentElsewhereCountsTowardsTheDelay() throws Exception {
        RateLimiter limiter = new RateLimiter(0.05);
        limiter.acquire();
        Thread.sleep(80);

        long t0 = System.nanoTime();
        limiter.acquire();
        long waitedMs = (System.nanoTime() - t0) / 1_000_000L;

        assertTrue(waitedMs < 40, "waited " + waitedMs + "ms");
    }
}
