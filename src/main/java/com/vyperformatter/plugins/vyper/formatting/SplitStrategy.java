package com.vyperformatter.plugins.vyper.formatting;

import java.util.List;

/**
 * Ways of breaking a logical line that does not fit, tried in the order returned by
 * {@link #candidatesFor(Line)}.
 */
public enum SplitStrategy {
    /** Split at the first bracket pair. Declarations only. */
    LEFT_HAND,
    /** Split at the last bracket pair, omitting trailers that fit. */
    RIGHT_HAND,
    /** One line per delimiter of the governing priority. */
    DELIMITER,
    /** Break around standalone comments inside brackets. */
    STANDALONE_COMMENT;

    static List<SplitStrategy> candidatesFor(Line line) {
        if (line.isDef()) {
            return List.of(LEFT_HAND);
        }
        if (line.isInsideBrackets()) {
            return List.of(DELIMITER, STANDALONE_COMMENT, RIGHT_HAND);
        }
        return List.of(RIGHT_HAND);
    }
}
