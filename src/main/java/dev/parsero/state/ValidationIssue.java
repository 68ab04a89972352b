package dev.parsero.state;

/**
 * One schema violation: the dotted path of the offending field and what was wrong with it.
 */
public record ValidationIssue(String path, String message) {

    @Override
    public String toString() {
        return path.isEmpty() ? message : path + ": " + message;
    }
}
