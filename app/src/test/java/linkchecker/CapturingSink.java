package linkchecker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

// ReportSink that keeps what the engine hands over.
class CapturingSink implements ReportSink {

    List<PageResult> pages = new ArrayList<>();
    List<ViolationRecord> violations = new ArrayList<>();
    RunSummary summary;

    @Override
    public void write(Collection<PageResult> pages, Collection<ViolationRecord> violations, RunSummary summary) {
        this.pages = new ArrayList<>(pages);
        this.violations = new ArrayList<>(violations);
        this.summary = summary;
    }

    PageResult page(String url) {
        for (PageResult p : pages) {
            if (p.url().equals(url)) return p;
        }
        throw new AssertionError("no row for " + url);
    }
}
