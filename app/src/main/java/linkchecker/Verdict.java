package linkchecker;

// Binary outcome of checking one link.
public enum Verdict {
    OK("ok"),
    BROKEN_LINK("broken_link");

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
