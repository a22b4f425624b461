package com.vyperformatter.plugins.vyper.safety;

/**
 * Outcome of a {@link SafetyOracle} comparison. A mismatch names the first construct
 * that differs and the line it starts on in the original.
 */
public final class ComparisonResult {
    private static final ComparisonResult EQUIVALENT = new ComparisonResult(true, null, 0);

    private final boolean equivalent;
    private final String message;
    private final int line;

    private ComparisonResult(boolean equivalent, String message, int line) {
        this.equivalent = equivalent;
        this.message = message;
        this.line = line;
    }

    public static ComparisonResult equivalent() {
        return EQUIVALENT;
    }

    public static ComparisonResult mismatch(String message, int line) {
        return new ComparisonResult(false, message, line);
    }

    public boolean isEquivalent() { return equivalent; }
    public String getMessage() { return message; }
    public int getLine() { return line; }

    @Override
    public String toString() {
        return equivalent ? "equivalent" : "mismatch at line " + line + ": " + message;
    }
}
