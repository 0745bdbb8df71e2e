package linkchecker;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

public class ViolationClassifierTest {

    private static final String PAGE = "https://example.edu/a";

    @Test
    void cascadeLoginIsFlaggedWithoutCheckingTheLink() {
        ViolationClassifier classifier = new ViolationClassifier(List.of("/CAS/login"));
        LinkChecker mustNotBeCalled = url -> fail("network check for " + url);

        List<ViolationRecord> found = classifier.classify(PAGE,
                List.of("https://example.edu/cas/LOGIN?service=x"), mustNotBeCalled);

        assertEquals(1, found.size());
        ViolationRecord v = found.get(0);
        assertEquals(ViolationType.CASCADE_LOGIN, v.type());
        assertEquals(PAGE, v.pageUrl());
        assertEquals("", v.status());
        assertEquals("cascade login link", v.note());
    }

    @Test
    void onlyBrokenLinksBecomeViolations() {
        ViolationClassifier classifier = new ViolationClassifier(List.of());
        FakeFetcher fetcher = new FakeFetcher()
                .status("https://example.edu/ok", 200)
                .status("https://example.edu/missing", 404)
                .status("https://example.edu/moved", 302);
        HttpLinkChecker checker = new HttpLinkChecker(fetcher, true, null);

        List<ViolationRecord> found = classifier.classify(PAGE, List.of(
                "https://example.edu/ok", "https://example.edu/missing", "https://example.edu/moved"), checker);

        assertEquals(1, found.size());
        assertEquals("https://example.edu/missing", found.get(0).linkUrl());
        assertEquals(ViolationType.BROKEN_LINK, found.get(0).type());
        assertEquals("404", found.get(0).status());
        assertEquals("status>=400", found.get(0).note());
    }

    @Test
    void nonHttpLinksAreSkipped() {
        List<String> checked = new ArrayList<>();
        LinkChecker recording = url -> {
            checked.add(url);
            return new LinkCheckResult(Verdict.OK, "200", url, "ok");
        };

        List<ViolationRecord> found = new ViolationClassifier(List.of("login")).classify(PAGE,
                List.of("mailto:login@example.edu", "https://example.edu/b"), recording);

        assertTrue(found.isEmpty());
        assertEquals(List.of("https://example.edu/b"), checked);
    }

    @Test
    void summaryIsSortedDistinctKinds() {
        ViolationRecord broken = new ViolationRecord(PAGE, "l1", ViolationType.BROKEN_LINK, "404", "l1", "status>=400");
        ViolationRecord cascade = new ViolationRecord(PAGE, "l2", ViolationType.CASCADE_LOGIN, "", "", "cascade login link");

        assertEquals("none", ViolationClassifier.summarize(List.of()));
        assertEquals("broken_link", ViolationClassifier.summarize(List.of(broken, broken)));
        assertEquals("broken_link+cascade_login", ViolationClassifier.summarize(List.of(cascade, broken)));
    }
}
