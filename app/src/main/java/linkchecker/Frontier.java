package linkchecker;

import java.util.Collection;
import java.util.HashSet;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;

// Work queue of page URLs shared by all workers, plus the set of URLs already
// dispatched. Seeded once up front; workers only ever take from it.
public class Frontier {

    private final Queue<String> queue = new ConcurrentLinkedQueue<>();

    // Grows monotonically for the lifetime of the run
    private final Set<String> visited = new HashSet<>();
    private final Object visitedLock = new Object();

    private final int seeded;
    private final int distinct;

    public Frontier(Collection<String> orderedUrls) {
        for (String u : orderedUrls) {
            if (u != null) queue.add(u);
        }
        this.seeded = queue.size();
        this.distinct = new HashSet<>(queue).size();
    }

    // Non-blocking take; null means the frontier is drained.
    public String poll() {
        return queue.poll();
    }

    // Atomic check-and-insert. True only for the first caller with this URL.
    public boolean markVisited(String url) {
        synchronized (visitedLock) {
            return visited.add(url);
        }
    }

    public int visitedCount() {
        synchronized (visitedLock) {
            return visited.size();
        }
    }

    public int seededCount() {
        return seeded;
    }

    // Pages that will actually be fetched once duplicates are skipped.
    public int distinctCount() {
        return distinct;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
