package linkchecker;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

// Turns a page's extracted links into violation records.
// A link containing one of the cascade-login patterns (case-insensitive) is
// flagged without touching the network; every other http(s) link goes through
// the LinkChecker and is recorded when broken.
public class ViolationClassifier {

    public static final String NO_VIOLATION = "none";
    static final String CASCADE_NOTE = "cascade login link";

    private final List<String> cascadePatterns;

    public ViolationClassifier(List<String> cascadeLoginPatterns) {
        List<String> lower = new ArrayList<>();
        for (String p : cascadeLoginPatterns) {
            if (p != null && !p.isEmpty()) lower.add(p.toLowerCase(Locale.ROOT));
        }
        this.cascadePatterns = List.copyOf(lower);
    }

    public boolean isCascadeLogin(String url) {
        String u = url.toLowerCase(Locale.ROOT);
        for (String pattern : cascadePatterns) {
            if (u.contains(pattern)) return true;
        }
        return false;
    }

    public List<ViolationRecord> classify(String pageUrl, List<String> links, LinkChecker checker) {
        List<ViolationRecord> found = new ArrayList<>();
        for (String link : links) {
            // mailto: and friends are counted but never checked
            if (!UrlUtil.isHttpLike(link)) continue;

            if (isCascadeLogin(link)) {
                found.add(new ViolationRecord(pageUrl, link, ViolationType.CASCADE_LOGIN, "", "", CASCADE_NOTE));
                continue;
            }

            LinkCheckResult r = checker.check(link);
            if (r.isBroken()) {
                found.add(new ViolationRecord(pageUrl, link, ViolationType.BROKEN_LINK,
                        r.status(), r.finalUrl(), r.note()));
            }
        }
        return found;
    }

    // Sorted, '+'-joined distinct kinds, or "none".
    public static String summarize(List<ViolationRecord> violations) {
        if (violations.isEmpty()) return NO_VIOLATION;
        Set<String> kinds = new TreeSet<>();
        for (ViolationRecord v : violations) kinds.add(v.type().label());
        return String.join("+", kinds);
    }
}
