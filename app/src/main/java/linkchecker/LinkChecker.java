package linkchecker;

// Validates one link target. Never throws for network problems.
@FunctionalInterface
public interface LinkChecker {

    LinkCheckResult check(String url);
}
