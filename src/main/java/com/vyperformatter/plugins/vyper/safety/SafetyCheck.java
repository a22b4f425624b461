package com.vyperformatter.plugins.vyper.safety;

import java.util.logging.Logger;

import com.vyperformatter.util.LoggerUtil;

/**
 * Runs a {@link SafetyOracle} over a formatting result and turns a mismatch into an
 * {@link UnsafeFormattingException}.
 */
public class SafetyCheck {
    private static final Logger logger = LoggerUtil.getLogger(SafetyCheck.class);

    private final SafetyOracle oracle;

    public SafetyCheck(SafetyOracle oracle) {
        this.oracle = oracle;
    }

    public void verify(String original, String formatted) throws UnsafeFormattingException {
        ComparisonResult result;
        try {
            result = oracle.compare(original, formatted);
        } catch (RuntimeException e) {
            throw new UnsafeFormattingException("Safety check could not complete: " + e.getMessage(), 0, e);
        }

        if (!result.isEquivalent()) {
            logger.fine("Safety check failed: " + result);
            throw new UnsafeFormattingException(
                    "Formatted code is not equivalent to the source: " + result.getMessage(), result.getLine());
        }
    }
}
