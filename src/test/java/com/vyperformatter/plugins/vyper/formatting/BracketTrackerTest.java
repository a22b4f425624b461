package com.vyperformatter.plugins.vyper.formatting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.vyperformatter.plugins.vyper.parsing.Leaf;
import com.vyperformatter.plugins.vyper.parsing.LeafType;
import com.vyperformatter.plugins.vyper.parsing.ParseException;
import com.vyperformatter.plugins.vyper.parsing.Tokenizer;

class BracketTrackerTest {

    @Test
    void onlyDepthZeroOperatorsAreDelimiters() throws ParseException {
        List<Leaf> leaves = _leaves("foo(a, b) + c");
        BracketTracker tracker = _track(leaves, false);

        assertEquals(DelimiterPriority.ARITHMETIC, tracker.governingPriority());
        assertEquals(DelimiterPriority.ARITHMETIC, tracker.priorityOf(leaves.get(5)));
        assertEquals(0, tracker.delimiterCount(DelimiterPriority.COMMA));
        assertEquals(1, tracker.depthOf(leaves.get(2)));
        assertEquals(0, tracker.getDepth());
    }

    @Test
    void commaGovernsOverLogic() throws ParseException {
        List<Leaf> leaves = _leaves("a, b and c");
        BracketTracker tracker = _track(leaves, false);

        assertEquals(DelimiterPriority.COMMA, tracker.governingPriority());
        assertEquals(DelimiterPriority.LOGIC, tracker.priorityOf(leaves.get(2)));
        assertEquals(DelimiterPriority.LOGIC, tracker.governingPriority(leaves.get(1)));
    }

    @Test
    void forLoopTargetIsNotSplit() throws ParseException {
        List<Leaf> leaves = _leaves("for a, b in pairs");
        BracketTracker tracker = _track(leaves, false);

        assertFalse(tracker.hasDelimiters());
        assertEquals(1, tracker.depthOf(leaves.get(2)));
        assertEquals(0, tracker.depthOf(leaves.get(5)));
    }

    @Test
    void unaryOperatorIsNotADelimiter() throws ParseException {
        BracketTracker tracker = _track(_leaves("-a + b"), false);

        assertEquals(1, tracker.delimiterCount(DelimiterPriority.ARITHMETIC));
    }

    @Test
    void pairsClosingWithOpeningBrackets() throws ParseException {
        List<Leaf> leaves = _leaves("x[i](y)");
        BracketTracker tracker = _track(leaves, false);

        assertEquals(leaves.get(1), tracker.openingBracketOf(leaves.get(3)));
        assertEquals(leaves.get(4), tracker.openingBracketOf(leaves.get(6)));
        assertNull(tracker.openingBracketOf(leaves.get(0)));
    }

    @Test
    void strictTrackerRejectsUnmatchedClosingBracket() {
        BracketTracker tracker = new BracketTracker(false);
        Leaf closing = new Leaf(LeafType.RPAR, ")", "", 1, 1);

        assertThrows(BracketMatchException.class, () -> tracker.mark(closing, false));
    }

    @Test
    void lenientTrackerAcceptsUnmatchedClosingBracket() {
        BracketTracker tracker = new BracketTracker(true);
        tracker.mark(new Leaf(LeafType.NAME, "x", "", 1, 1), false);
        tracker.mark(new Leaf(LeafType.RPAR, ")", "", 1, 2), false);

        assertEquals(0, tracker.getDepth());
        assertFalse(tracker.anyOpenBrackets());
    }

    @Test
    void invisibleParenthesesAreRecorded() {
        BracketTracker tracker = new BracketTracker(false);
        tracker.mark(Leaf.invisibleParen(LeafType.LPAR, 1, 1), false);
        assertTrue(tracker.anyOpenBrackets());
        tracker.mark(new Leaf(LeafType.NAME, "x", "", 1, 1), false);
        tracker.mark(Leaf.invisibleParen(LeafType.RPAR, 1, 2), false);

        assertEquals(2, tracker.getInvisible().size());
    }

    private static List<Leaf> _leaves(String code) throws ParseException {
        return Tokenizer.tokenize(code).stream()
                .filter(leaf -> !leaf.getType().isLayout())
                .collect(Collectors.toList());
    }

    private static BracketTracker _track(List<Leaf> leaves, boolean lenient) {
        BracketTracker tracker = new BracketTracker(lenient);
        for (Leaf leaf : leaves) {
            tracker.mark(leaf, false);
        }
        return tracker;
    }
}
