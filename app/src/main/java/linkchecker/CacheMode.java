package linkchecker;

import java.util.Locale;

// Whether link-check outcomes are memoized for the run.
public enum CacheMode {
    NONE("none"),
    LRU("lru");

    private final String label;

    CacheMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static CacheMode fromLabel(String raw) {
        String s = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (CacheMode m : values()) {
            if (m.label.equals(s)) return m;
        }
        throw new ConfigurationException("Unknown cache.mode: " + raw + " (use none/lru)");
    }
}
