package com.vyperformatter.plugins.vyper.safety;

/**
 * Decides whether formatted source means exactly the same as the original.
 */
public interface SafetyOracle {

    ComparisonResult compare(String original, String formatted);

    default boolean compareSemantics(String original, String formatted) {
        return compare(original, formatted).isEquivalent();
    }
}
