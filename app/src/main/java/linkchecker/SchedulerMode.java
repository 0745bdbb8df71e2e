package linkchecker;

import java.util.Locale;

// Order in which seed URLs are handed to the frontier.
public enum SchedulerMode {
    FIFO("fifo"),
    PRIORITY("priority");

    private final String label;

    SchedulerMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SchedulerMode fromLabel(String raw) {
        String s = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (SchedulerMode m : values()) {
            if (m.label.equals(s)) return m;
        }
        throw new ConfigurationException("Unknown scheduler: " + raw + " (use fifo/priority)");
    }
}
