package linkchecker;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

// Run-wide sink shared by all workers. Rows are kept in memory in completion
// order and handed to the report writer once the pool is done.
public class ResultCollector {

    static final int PROGRESS_EVERY = 100;

    private final Queue<PageResult> pages = new ConcurrentLinkedQueue<>();
    private final Queue<ViolationRecord> violations = new ConcurrentLinkedQueue<>();
    private final AtomicInteger processed = new AtomicInteger(0);

    private final int total;
    private final PrintStream out;

    public ResultCollector(int total, PrintStream out) {
        this.total = total;
        this.out = out;
    }

    // Store one finished page and its violations; returns the processed count.
    public int record(PageResult page, List<ViolationRecord> pageViolations) {
        if (!pageViolations.isEmpty()) violations.addAll(pageViolations);
        pages.add(page);

        int n = processed.incrementAndGet();
        if (n % PROGRESS_EVERY == 0 || n == total) {
            out.println("[crawl] processed " + n + "/" + total + " pages...");
        }
        return n;
    }

    public Collection<PageResult> pages() {
        return new ArrayList<>(pages);
    }

    public Collection<ViolationRecord> violations() {
        return new ArrayList<>(violations);
    }
}
