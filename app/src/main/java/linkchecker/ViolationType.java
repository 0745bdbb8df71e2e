package linkchecker;

// Kinds of page-to-link violations, by report label.
public enum ViolationType {
    BROKEN_LINK("broken_link"),
    CASCADE_LOGIN("cascade_login");

    private final String label;

    ViolationType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
