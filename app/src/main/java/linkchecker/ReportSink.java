package linkchecker;

import java.util.Collection;

// Where a finished crawl's rows go.
public interface ReportSink {

    void write(Collection<PageResult> pages, Collection<ViolationRecord> violations, RunSummary summary);
}
