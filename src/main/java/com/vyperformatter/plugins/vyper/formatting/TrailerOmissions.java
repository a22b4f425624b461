package com.vyperformatter.plugins.vyper.formatting;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import com.vyperformatter.plugins.vyper.parsing.Leaf;
import com.vyperformatter.plugins.vyper.parsing.LeafType;

/**
 * Enumerates growing sets of closing brackets that a right-hand split may skip, so
 * that trailers which fit on the line stay glued and the split moves to an earlier
 * bracket pair.
 * <p>
 * Sets are cumulative. The first one is empty unless the line carries a magic
 * trailing comma. Leaves are inspected lazily: a split attempted between two steps
 * may have made optional parentheses visible, which changes what comes next.
 */
final class TrailerOmissions implements Iterator<Set<Leaf>> {
    private final Line line;
    private final List<Leaf> leaves;
    private final int lineLength;
    private final Set<Leaf> omit = _identitySet();
    private final Set<Leaf> innerBrackets = _identitySet();

    private boolean emitInitial;
    private int index;
    private int length;
    private Leaf openingBracket;
    private Leaf closingBracket;
    private Leaf resumeLeaf;
    private int resumeIndex;
    private boolean done;
    private Set<Leaf> next;

    TrailerOmissions(Line line, int lineLength) {
        this.line = line;
        this.leaves = line.getLeaves();
        this.lineLength = lineLength;
        this.emitInitial = !line.hasMagicTrailingComma();
        this.index = leaves.size() - 1;
        this.length = 4 * line.getDepth();
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = _advance();
        }
        return next != null;
    }

    @Override
    public Set<Leaf> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Set<Leaf> result = next;
        next = null;
        return result;
    }

    private Set<Leaf> _advance() {
        if (emitInitial) {
            emitInitial = false;
            return _snapshot();
        }
        if (resumeLeaf != null) {
            Leaf leaf = resumeLeaf;
            resumeLeaf = null;
            _afterClosingBracket(leaf, resumeIndex);
        }

        while (!done && index >= 0) {
            int current = index--;
            Leaf leaf = leaves.get(current);
            if (leaf.getValue().indexOf('\n') >= 0) {
                // Multiline strings end the measurable part of the line
                done = true;
                break;
            }
            int leafLength = _lengthOf(leaf);
            length += leafLength;
            if (length > lineLength) {
                done = true;
                break;
            }
            boolean hasInlineComment = leafLength > Strings.width(leaf.getValue()) + Strings.width(leaf.getPrefix());
            if (leaf.getType() == LeafType.STANDALONE_COMMENT || hasInlineComment) {
                done = true;
                break;
            }

            Leaf previous = current > 0 ? leaves.get(current - 1) : null;
            if (openingBracket != null) {
                if (leaf == openingBracket) {
                    openingBracket = null;
                } else if (leaf.isClosingBracket()) {
                    if (_hasExplodingComma(leaf, previous)) {
                        done = true;
                        break;
                    }
                    innerBrackets.add(leaf);
                }
            } else if (leaf.isClosingBracket()) {
                if (previous != null && previous.isOpeningBracket()) {
                    // Empty brackets only go along with another pair
                    innerBrackets.add(leaf);
                    continue;
                }
                if (closingBracket != null) {
                    omit.add(closingBracket);
                    omit.addAll(innerBrackets);
                    innerBrackets.clear();
                    resumeLeaf = leaf;
                    resumeIndex = current;
                    return _snapshot();
                }
                _afterClosingBracket(leaf, current);
            }
        }
        return null;
    }

    private void _afterClosingBracket(Leaf leaf, int current) {
        Leaf previous = current > 0 ? leaves.get(current - 1) : null;
        if (_hasExplodingComma(leaf, previous)) {
            done = true;
            return;
        }
        if (!leaf.getValue().isEmpty()) {
            openingBracket = line.getBracketTracker().openingBracketOf(leaf);
            closingBracket = leaf;
        }
    }

    /**
     * Bracket pairs ending in a magic trailing comma must explode, so they are never
     * omitted.
     */
    private boolean _hasExplodingComma(Leaf closing, Leaf previous) {
        if (previous == null || previous.getType() != LeafType.COMMA) {
            return false;
        }
        Leaf opening = line.getBracketTracker().openingBracketOf(closing);
        return opening != null && !line.isOneSequenceBetween(opening, closing);
    }

    private int _lengthOf(Leaf leaf) {
        int result = Strings.width(leaf.getPrefix()) + Strings.width(leaf.getValue());
        for (Leaf comment : line.commentsAfter(leaf)) {
            result += Strings.width(comment.getValue());
        }
        return result;
    }

    private Set<Leaf> _snapshot() {
        Set<Leaf> copy = _identitySet();
        copy.addAll(omit);
        return copy;
    }

    private static Set<Leaf> _identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
