package com.vyperformatter.plugins.vyper.formatting;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.vyperformatter.plugins.vyper.parsing.Leaf;
import com.vyperformatter.plugins.vyper.parsing.LeafType;

/**
 * Tracks bracket nesting and depth-zero delimiters of one logical line as its leaves
 * are appended.
 * <p>
 * The target list of a {@code for} loop counts as one level deeper so that its
 * commas never become delimiters.
 */
public class BracketTracker {
    private final boolean lenient;
    private final Deque<Leaf> openBrackets = new ArrayDeque<>();
    private final Deque<Integer> forLoopDepths = new ArrayDeque<>();
    private final Map<Leaf, Integer> depths = new IdentityHashMap<>();
    private final Map<Leaf, Leaf> openingBrackets = new IdentityHashMap<>();
    private final Map<Leaf, DelimiterPriority> delimiters = new IdentityHashMap<>();
    private final List<Leaf> invisible = new ArrayList<>();
    private int depth;
    private Leaf previous;

    /**
     * @param lenient tolerate closing brackets opened on another line, as happens for
     *                the tail of a bracket split
     */
    public BracketTracker(boolean lenient) {
        this.lenient = lenient;
    }

    /**
     * Records a leaf's depth, bracket pairing and delimiter priority.
     *
     * @throws BracketMatchException when a closing bracket does not match
     */
    public void mark(Leaf leaf, boolean inImport) {
        if (leaf.getType() == LeafType.COMMENT) {
            return;
        }

        boolean loopTarget = false;
        if (!forLoopDepths.isEmpty() && forLoopDepths.peek() == depth && leaf.isKeyword("in")) {
            depth--;
            forLoopDepths.pop();
            loopTarget = true;
        }

        if (leaf.isClosingBracket()) {
            if (openBrackets.isEmpty()) {
                if (!lenient) {
                    throw new BracketMatchException("Unmatched closing bracket '" + leaf.getValue()
                            + "' at line " + leaf.getLine() + ", column " + leaf.getColumn());
                }
            } else {
                Leaf opening = openBrackets.peek();
                if (opening.getType().closingCounterpart() != leaf.getType()) {
                    throw new BracketMatchException("Closing bracket " + leaf.getType()
                            + " does not match " + opening.getType() + " opened at line " + opening.getLine());
                }
                openBrackets.pop();
                depth--;
                openingBrackets.put(leaf, opening);
            }
            if (leaf.isInvisible()) {
                invisible.add(leaf);
            }
        }

        depths.put(leaf, depth);
        if (depth == 0 && !loopTarget) {
            DelimiterPriority before = DelimiterPriority.splitBefore(leaf, previous, inImport);
            if (before != null && previous != null) {
                delimiters.merge(previous, before, (a, b) -> a.compareTo(b) <= 0 ? a : b);
            }
            DelimiterPriority after = DelimiterPriority.splitAfter(leaf);
            if (after != null) {
                delimiters.put(leaf, after);
            }
        }

        if (leaf.isOpeningBracket()) {
            openBrackets.push(leaf);
            depth++;
            if (leaf.isInvisible()) {
                invisible.add(leaf);
            }
        }
        previous = leaf;

        if (leaf.isKeyword("for")) {
            depth++;
            forLoopDepths.push(depth);
        }
    }

    public int getDepth() {
        return depth;
    }

    public boolean anyOpenBrackets() {
        return !openBrackets.isEmpty();
    }

    public int depthOf(Leaf leaf) {
        return depths.getOrDefault(leaf, 0);
    }

    /**
     * Opening bracket paired with a closing bracket on this line, or null.
     */
    public Leaf openingBracketOf(Leaf closing) {
        return openingBrackets.get(closing);
    }

    public DelimiterPriority priorityOf(Leaf leaf) {
        return delimiters.get(leaf);
    }

    public boolean hasDelimiters() {
        return !delimiters.isEmpty();
    }

    /**
     * The governing (lowest-ordinal) priority among depth-zero delimiters, ignoring the
     * delimiter recorded on {@code exclude}. Returns null when there is none.
     */
    public DelimiterPriority governingPriority(Leaf exclude) {
        DelimiterPriority governing = null;
        for (Map.Entry<Leaf, DelimiterPriority> entry : delimiters.entrySet()) {
            if (entry.getKey() == exclude) {
                continue;
            }
            if (governing == null || entry.getValue().compareTo(governing) < 0) {
                governing = entry.getValue();
            }
        }
        return governing;
    }

    public DelimiterPriority governingPriority() {
        return governingPriority(null);
    }

    public int delimiterCount(DelimiterPriority priority) {
        int count = 0;
        for (DelimiterPriority value : delimiters.values()) {
            if (value == priority) {
                count++;
            }
        }
        return count;
    }

    public List<Leaf> getInvisible() {
        return Collections.unmodifiableList(invisible);
    }
}
