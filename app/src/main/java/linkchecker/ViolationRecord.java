package linkchecker;

import java.util.List;

// One offending link on one page (a row of violations_links.csv).
public record ViolationRecord(
        String pageUrl,
        String linkUrl,
        ViolationType type,
        String status,
        String finalUrl,
        String note
) {
    public static final List<String> HEADER =
            List.of("page_url", "link_url", "violation_type", "status", "final_url", "note");

    public List<String> toRow() {
        return List.of(pageUrl, linkUrl, type.label(), status, finalUrl, note);
    }
}
