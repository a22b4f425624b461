package com.vyperformatter.plugins.vyper.formatting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.vyperformatter.plugins.vyper.parsing.Leaf;
import com.vyperformatter.plugins.vyper.parsing.LeafType;
import com.vyperformatter.util.LoggerUtil;

/**
 * Breaks a logical line into physical lines that fit the configured width.
 * <p>
 * A line that fits and has no magic trailing comma is kept as is. Otherwise the
 * strategies of {@link SplitStrategy#candidatesFor(Line)} are tried in order and every
 * line they produce is split again. A line no strategy can break is returned whole,
 * even when it overflows.
 * <p>
 * Splitting mutates the leaves it works on: optional parentheses that end up
 * delimiting a split become visible, and the first leaf of every produced line loses
 * its prefix.
 */
public class LineSplitter {
    private static final Logger logger = LoggerUtil.getLogger(LineSplitter.class);

    private final int lineLength;

    public LineSplitter(int lineLength) {
        this.lineLength = lineLength;
    }

    public int getLineLength() {
        return lineLength;
    }

    public List<Line> split(Line line) {
        return _transform(line, false);
    }

    private List<Line> _transform(Line line, boolean forceOptionalParens) {
        if (line.isComment()) {
            return List.of(line);
        }

        String lineStr = line.toString();
        if (!line.shouldSplitRhs() && !line.hasMagicTrailingComma() && line.isShortEnough(lineLength)) {
            return List.of(line);
        }

        for (SplitStrategy strategy : SplitStrategy.candidatesFor(line)) {
            try {
                return _run(line, strategy, lineStr, forceOptionalParens);
            } catch (CannotSplitException e) {
                logger.finest(() -> strategy + " split rejected for line " + _sourceLine(line)
                        + ": " + e.getMessage());
            }
        }
        return List.of(line);
    }

    private List<Line> _run(Line line, SplitStrategy strategy, String lineStr, boolean forceOptionalParens)
            throws CannotSplitException {
        List<Line> result = new ArrayList<>();
        for (Line transformed : _apply(strategy, line, forceOptionalParens)) {
            if (transformed.toString().equals(lineStr)) {
                throw new CannotSplitException("Line transformer returned an unchanged result");
            }
            result.addAll(_transform(transformed, forceOptionalParens));
        }

        List<Leaf> invisible = line.getBracketTracker().getInvisible();
        if (strategy != SplitStrategy.RIGHT_HAND
                || invisible.isEmpty()
                || invisible.stream().anyMatch(bracket -> !bracket.getValue().isEmpty())
                || result.isEmpty()
                || result.get(0).isShortEnough(lineLength)) {
            return result;
        }

        // Second opinion: split at the optional parentheses instead of omitting them
        Line copy = line.cloneEmpty();
        for (Leaf leaf : line.getLeaves()) {
            copy.append(leaf.copy(), false);
            for (Leaf comment : line.commentsAfter(leaf)) {
                copy.append(comment, true);
            }
        }
        List<Line> secondOpinion = _run(copy, strategy, lineStr, true);
        if (secondOpinion.stream().allMatch(candidate -> candidate.isShortEnough(lineLength))) {
            return secondOpinion;
        }
        return result;
    }

    private List<Line> _apply(SplitStrategy strategy, Line line, boolean forceOptionalParens)
            throws CannotSplitException {
        return switch (strategy) {
            case LEFT_HAND -> leftHandSplit(line);
            case RIGHT_HAND -> _rightHandSplitOmittingTrailers(line, forceOptionalParens);
            case DELIMITER -> delimiterSplit(line);
            case STANDALONE_COMMENT -> standaloneCommentSplit(line);
        };
    }

    /**
     * Tries right-hand splits with more and more trailers glued to the line, and keeps
     * the first whose opening line fits. Falls back to a split at the last bracket.
     */
    private List<Line> _rightHandSplitOmittingTrailers(Line line, boolean forceOptionalParens)
            throws CannotSplitException {
        TrailerOmissions omissions = new TrailerOmissions(line, lineLength);
        while (omissions.hasNext()) {
            List<Line> lines = rightHandSplit(line, omissions.next(), forceOptionalParens);
            if (lines.get(0).isShortEnough(lineLength)) {
                return lines;
            }
        }
        return rightHandSplit(line, _identitySet(), forceOptionalParens);
    }

    /**
     * Splits at the last bracket pair whose closing bracket is not in {@code omit}.
     * Optional parentheses are skipped in favour of an earlier pair when the body
     * reads fine without them, unless {@code forceOptionalParens} is set.
     */
    List<Line> rightHandSplit(Line line, Set<Leaf> omit, boolean forceOptionalParens)
            throws CannotSplitException {
        List<Leaf> tailLeaves = new ArrayList<>();
        List<Leaf> bodyLeaves = new ArrayList<>();
        List<Leaf> headLeaves = new ArrayList<>();
        List<Leaf> current = tailLeaves;
        Leaf opening = null;
        Leaf closing = null;

        List<Leaf> leaves = line.getLeaves();
        for (int i = leaves.size() - 1; i >= 0; i--) {
            Leaf leaf = leaves.get(i);
            if (current == bodyLeaves && leaf == opening) {
                current = bodyLeaves.isEmpty() ? tailLeaves : headLeaves;
            }
            current.add(leaf);
            if (current == tailLeaves && leaf.isClosingBracket() && !omit.contains(leaf)) {
                opening = line.getBracketTracker().openingBracketOf(leaf);
                closing = leaf;
                current = bodyLeaves;
            }
        }
        if (opening == null || closing == null || headLeaves.isEmpty()) {
            throw new CannotSplitException("No brackets found");
        }

        Collections.reverse(tailLeaves);
        Collections.reverse(bodyLeaves);
        Collections.reverse(headLeaves);
        Line head = _buildLine(headLeaves, line, opening, false);
        Line body = _buildLine(bodyLeaves, line, opening, true);
        Line tail = _buildLine(tailLeaves, line, opening, false);
        _succeededOrRaise(head, body, tail);

        if (!forceOptionalParens
                && opening.getType() == LeafType.LPAR && opening.isInvisible()
                && closing.getType() == LeafType.RPAR && closing.isInvisible()
                && !line.isImport()
                && !body.containsStandaloneComments(0)
                && _canOmitInvisibleParens(body)) {
            Set<Leaf> widerOmit = _identitySet();
            widerOmit.addAll(omit);
            widerOmit.add(closing);
            try {
                return rightHandSplit(line, widerOmit, false);
            } catch (CannotSplitException e) {
                if (!body.isShortEnough(lineLength)) {
                    throw new CannotSplitException(
                            "Splitting failed, body is still too long and can't be split.", e);
                }
            }
        }

        opening.ensureVisible();
        closing.ensureVisible();
        return _nonEmpty(head, body, tail);
    }

    /**
     * Splits at the first bracket pair, making it visible. Used for declarations,
     * where the parameter list is the natural place to break.
     */
    List<Line> leftHandSplit(Line line) throws CannotSplitException {
        List<Leaf> tailLeaves = new ArrayList<>();
        List<Leaf> bodyLeaves = new ArrayList<>();
        List<Leaf> headLeaves = new ArrayList<>();
        List<Leaf> current = headLeaves;
        Leaf matching = null;

        for (Leaf leaf : line.getLeaves()) {
            if (current == bodyLeaves && matching != null && leaf.isClosingBracket()
                    && line.getBracketTracker().openingBracketOf(leaf) == matching) {
                leaf.ensureVisible();
                matching.ensureVisible();
                current = bodyLeaves.isEmpty() ? headLeaves : tailLeaves;
            }
            current.add(leaf);
            if (current == headLeaves && leaf.isOpeningBracket()) {
                matching = leaf;
                current = bodyLeaves;
            }
        }
        if (matching == null) {
            throw new CannotSplitException("No brackets found");
        }

        Line head = _buildLine(headLeaves, line, matching, false);
        Line body = _buildLine(bodyLeaves, line, matching, true);
        Line tail = _buildLine(tailLeaves, line, matching, false);
        _succeededOrRaise(head, body, tail);
        return _nonEmpty(head, body, tail);
    }

    /**
     * Puts every segment between delimiters of the governing priority on its own
     * line. A comma split gets a trailing comma after its last segment.
     */
    List<Line> delimiterSplit(Line line) throws CannotSplitException {
        List<Leaf> leaves = line.getLeaves();
        if (leaves.isEmpty()) {
            throw new CannotSplitException("Line empty");
        }
        Leaf last = leaves.get(leaves.size() - 1);
        BracketTracker tracker = line.getBracketTracker();
        DelimiterPriority priority = tracker.governingPriority(last);
        if (priority == null) {
            throw new CannotSplitException("No delimiters found");
        }
        if (priority == DelimiterPriority.DOT && tracker.delimiterCount(priority) == 1) {
            throw new CannotSplitException("Splitting a single attribute from its owner looks wrong");
        }

        List<Line> result = new ArrayList<>();
        Line current = line.derive(line.getDepth(), line.isInsideBrackets());
        for (Leaf leaf : leaves) {
            current = _appendSafely(result, current, line, leaf);
            for (Leaf comment : line.commentsAfter(leaf)) {
                current = _appendSafely(result, current, line, comment);
            }
            if (tracker.priorityOf(leaf) == priority) {
                result.add(current);
                current = line.derive(line.getDepth(), line.isInsideBrackets());
            }
        }
        if (!current.isEmpty()) {
            List<Leaf> currentLeaves = current.getLeaves();
            Leaf tailLeaf = currentLeaves.get(currentLeaves.size() - 1);
            if (priority == DelimiterPriority.COMMA
                    && tailLeaf.getType() != LeafType.COMMA
                    && tailLeaf.getType() != LeafType.STANDALONE_COMMENT) {
                current.append(new Leaf(LeafType.COMMA, ",", "", tailLeaf.getLine(), tailLeaf.getColumn()), false);
            }
            result.add(current);
        }
        _resetFirstPrefixes(result);
        return result;
    }

    /**
     * Starts a new line wherever a standalone comment would otherwise share a line
     * with code at depth zero.
     */
    List<Line> standaloneCommentSplit(Line line) throws CannotSplitException {
        if (!line.containsStandaloneComments(0)) {
            throw new CannotSplitException("Line does not have any standalone comments");
        }

        List<Line> result = new ArrayList<>();
        Line current = line.derive(line.getDepth(), line.isInsideBrackets());
        for (Leaf leaf : line.getLeaves()) {
            current = _appendSafely(result, current, line, leaf);
            for (Leaf comment : line.commentsAfter(leaf)) {
                current = _appendSafely(result, current, line, comment);
            }
        }
        if (!current.isEmpty()) {
            result.add(current);
        }
        _resetFirstPrefixes(result);
        return result;
    }

    private static Line _appendSafely(List<Line> result, Line current, Line original, Leaf leaf) {
        if (current.appendSafe(leaf, true)) {
            return current;
        }
        result.add(current);
        Line next = original.derive(original.getDepth(), original.isInsideBrackets());
        next.append(leaf, false);
        return next;
    }

    private static void _resetFirstPrefixes(List<Line> lines) {
        for (Line line : lines) {
            line.getLeaves().get(0).setPrefix("");
        }
    }

    /**
     * Builds the head, body or tail of a bracket split. The body goes one level
     * deeper; imports and single-parameter signatures get a trailing comma there.
     */
    private Line _buildLine(List<Leaf> leaves, Line original, Leaf opening, boolean isBody) {
        Line result = isBody ? original.derive(original.getDepth() + 1, true) : original.deriveFragment();
        if (isBody && !leaves.isEmpty()) {
            boolean noCommas = original.isDef()
                    && opening.getValue().equals("(")
                    && leaves.stream().noneMatch(leaf -> leaf.getType() == LeafType.COMMA)
                    && !_isInReturnAnnotation(original, opening);
            if (original.isImport() || noCommas) {
                for (int i = leaves.size() - 1; i >= 0; i--) {
                    Leaf leaf = leaves.get(i);
                    if (leaf.getType() == LeafType.STANDALONE_COMMENT) {
                        continue;
                    }
                    if (leaf.getType() != LeafType.COMMA) {
                        leaves.add(i + 1, new Leaf(LeafType.COMMA, ",", "", leaf.getLine(), leaf.getColumn()));
                    }
                    break;
                }
            }
        }

        for (Leaf leaf : leaves) {
            result.append(leaf, true);
            for (Leaf comment : original.commentsAfter(leaf)) {
                result.append(comment, true);
            }
        }
        if (isBody && _shouldSplitBody(result, original, opening)) {
            result.setShouldSplitRhs(true);
        }
        return result;
    }

    private static boolean _isInReturnAnnotation(Line line, Leaf opening) {
        for (Leaf leaf : line.getLeaves()) {
            if (leaf == opening) {
                return false;
            }
            if (leaf.getType() == LeafType.ARROW) {
                return true;
            }
        }
        return false;
    }

    /**
     * A body delimited by commas explodes one element per line right away when it
     * ends with a trailing comma or is a parenthesized tuple.
     */
    private static boolean _shouldSplitBody(Line body, Line original, Leaf opening) {
        List<Leaf> leaves = body.getLeaves();
        if (leaves.isEmpty()) {
            return false;
        }
        Leaf last = leaves.get(leaves.size() - 1);
        boolean trailingComma = last.getType() == LeafType.COMMA;
        DelimiterPriority priority = body.getBracketTracker().governingPriority(trailingComma ? last : null);
        return priority == DelimiterPriority.COMMA
                && (trailingComma || original.isParenthesizedAtom(opening));
    }

    private static void _succeededOrRaise(Line head, Line body, Line tail) throws CannotSplitException {
        int tailLength = tail.toString().strip().length();
        if (body.isEmpty()) {
            if (tailLength == 0) {
                throw new CannotSplitException("Splitting brackets produced the same line");
            }
            if (tailLength < 3) {
                throw new CannotSplitException("Splitting brackets on an empty body to save "
                        + tailLength + " characters is not worth it");
            }
        }
    }

    /**
     * Whether the body of optional parentheses can stand without them and still be
     * split well at one of its own brackets.
     */
    private boolean _canOmitInvisibleParens(Line line) {
        BracketTracker tracker = line.getBracketTracker();
        if (!tracker.hasDelimiters()) {
            return true;
        }

        DelimiterPriority priority = tracker.governingPriority();
        if (tracker.delimiterCount(priority) > 1) {
            return false;
        }
        if (priority == DelimiterPriority.DOT) {
            return true;
        }

        List<Leaf> leaves = line.getLeaves();
        if (leaves.size() < 2) {
            return false;
        }
        Leaf first = leaves.get(0);
        Leaf second = leaves.get(1);
        if (first.isOpeningBracket() && !second.isClosingBracket() && _canOmitOpeningParen(line, first)) {
            return true;
        }

        Leaf penultimate = leaves.get(leaves.size() - 2);
        Leaf last = leaves.get(leaves.size() - 1);
        if (last.getType() == LeafType.RPAR || last.getType() == LeafType.RBRACE) {
            if (penultimate.isOpeningBracket()) {
                return false;
            }
            return _canOmitClosingParen(line, last);
        }
        return false;
    }

    private boolean _canOmitOpeningParen(Line line, Leaf first) {
        boolean remainder = false;
        int length = 4 * line.getDepth();
        for (Leaf leaf : line.getLeaves()) {
            if (leaf.isClosingBracket() && line.getBracketTracker().openingBracketOf(leaf) == first) {
                remainder = true;
            }
            if (remainder) {
                length += _lengthOf(line, leaf);
                if (length > lineLength) {
                    return false;
                }
                if (leaf.isOpeningBracket()) {
                    remainder = false;
                }
            }
        }
        return true;
    }

    private boolean _canOmitClosingParen(Line line, Leaf last) {
        Leaf opening = line.getBracketTracker().openingBracketOf(last);
        int length = 4 * line.getDepth();
        boolean seenOtherBrackets = false;
        for (Leaf leaf : line.getLeaves()) {
            length += _lengthOf(line, leaf);
            if (leaf == opening) {
                if (seenOtherBrackets || length <= lineLength) {
                    return true;
                }
            } else if (leaf.isOpeningBracket()) {
                seenOtherBrackets = true;
            }
        }
        return false;
    }

    private static int _lengthOf(Line line, Leaf leaf) {
        int length = Strings.width(leaf.getPrefix()) + Strings.width(leaf.getValue());
        for (Leaf comment : line.commentsAfter(leaf)) {
            length += Strings.width(comment.getValue());
        }
        return length;
    }

    private static List<Line> _nonEmpty(Line... lines) {
        List<Line> result = new ArrayList<>();
        for (Line line : lines) {
            if (!line.isEmpty()) {
                result.add(line);
            }
        }
        return result;
    }

    private static Set<Leaf> _identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private static int _sourceLine(Line line) {
        return line.isEmpty() ? 0 : line.getLeaves().get(0).getLine();
    }
}
