package com.vyperformatter.plugins.vyper.formatting;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Decides how many blank lines go before and after each logical line, before the
 * line is split.
 * <p>
 * Declarations are separated by two blank lines at module level and one when nested.
 * Flow control and version pragmas are followed by a blank line. Otherwise the blank
 * lines the author wrote are kept.
 */
public class EmptyLineTracker {
    private Line previousLine;
    private int previousAfter;
    private final Deque<Integer> previousDefs = new ArrayDeque<>();

    /**
     * Returns {@code {before, after}} for {@code current}. The blank lines already
     * promised after the previous line are deducted from {@code before}.
     */
    public int[] maybeEmptyLines(Line current) {
        int[] result = _maybeEmptyLines(current);
        int before = previousLine == null ? 0 : result[0] - previousAfter;
        previousAfter = result[1];
        previousLine = current;
        return new int[]{Math.max(before, 0), result[1]};
    }

    private int[] _maybeEmptyLines(Line current) {
        int before = current.getBlankLinesBefore();
        int depth = current.getDepth();
        while (!previousDefs.isEmpty() && previousDefs.peek() >= depth) {
            previousDefs.pop();
            before = (depth > 0 ? 1 : 2) - previousAfter;
        }

        if (current.isDecorator() || current.isDef()) {
            return _forDeclaration(current, before);
        }
        if (current.isFlowControl()) {
            return new int[]{before, 1};
        }
        if (current.isPragma()) {
            return new int[]{0, 1};
        }
        if (previousLine != null && previousLine.isImport() && !current.isImport()
                && depth == previousLine.getDepth()) {
            return new int[]{Math.max(before, 1), 0};
        }
        return new int[]{before, 0};
    }

    private int[] _forDeclaration(Line current, int before) {
        if (!current.isDecorator()) {
            previousDefs.push(current.getDepth());
        }
        if (previousLine == null) {
            return new int[]{0, 0};
        }
        if (previousLine.isDecorator()) {
            return new int[]{0, 0};
        }
        if (previousLine.getDepth() < current.getDepth() && previousLine.isDef()) {
            return new int[]{0, 0};
        }
        if (previousLine.isComment() && !previousLine.isPragma()
                && previousLine.getDepth() == current.getDepth() && before == 0) {
            return new int[]{0, 0};
        }
        return new int[]{current.getDepth() > 0 ? 1 : 2, 0};
    }
}
