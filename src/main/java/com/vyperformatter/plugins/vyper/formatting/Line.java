package com.vyperformatter.plugins.vyper.formatting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.vyperformatter.plugins.vyper.parsing.Keywords;
import com.vyperformatter.plugins.vyper.parsing.Leaf;
import com.vyperformatter.plugins.vyper.parsing.LeafType;

/**
 * A logical line: the leaves of one statement (or statement fragment after a split)
 * at a given indentation depth, plus the trailing comments attached to them.
 */
public class Line {
    private static final String INDENT = "    ";

    private final int depth;
    private final boolean insideBrackets;
    private final boolean interfaceMember;
    private final List<Leaf> leaves = new ArrayList<>();
    private final Map<Integer, List<Leaf>> comments = new TreeMap<>();
    private final BracketTracker bracketTracker;
    private boolean shouldSplitRhs;
    private Leaf magicTrailingComma;
    private int blankLinesBefore;

    public Line(int depth, boolean insideBrackets, boolean interfaceMember) {
        this(depth, insideBrackets, interfaceMember, false);
    }

    private Line(int depth, boolean insideBrackets, boolean interfaceMember, boolean lenientBrackets) {
        this.depth = depth;
        this.insideBrackets = insideBrackets;
        this.interfaceMember = interfaceMember;
        this.bracketTracker = new BracketTracker(lenientBrackets);
    }

    /**
     * Creates an empty line sharing this line's context.
     */
    Line derive(int newDepth, boolean newInsideBrackets) {
        return new Line(newDepth, newInsideBrackets, interfaceMember, false);
    }

    /**
     * Creates an empty line for the head or tail of a bracket split, whose brackets may
     * be paired across lines.
     */
    Line deriveFragment() {
        return new Line(depth, false, interfaceMember, true);
    }

    /**
     * Empty copy carrying over the split flags.
     */
    Line cloneEmpty() {
        Line line = new Line(depth, insideBrackets, interfaceMember, false);
        line.shouldSplitRhs = shouldSplitRhs;
        line.magicTrailingComma = magicTrailingComma;
        return line;
    }

    /**
     * Adds a leaf. Unless {@code preformatted}, whitespace before it is recomputed and
     * a closing bracket may flag a magic trailing comma. Trailing comments are
     * diverted to the comment table.
     */
    public void append(Leaf leaf, boolean preformatted) {
        boolean hasValue = leaf.getType().isOpeningBracket() || leaf.getType().isClosingBracket()
                || !leaf.getValue().isBlank();
        if (!hasValue) {
            return;
        }

        if (leaf.getType() == LeafType.COMMENT && leaves.isEmpty()) {
            leaf = leaf.copyAs(LeafType.STANDALONE_COMMENT);
        }
        if (!leaves.isEmpty() && !preformatted) {
            leaf.setPrefix(Whitespace.prefixFor(leaf, this));
        }

        bracketTracker.mark(leaf, isImport());
        if ((insideBrackets || !preformatted) && hasMagicTrailingComma(leaf)) {
            magicTrailingComma = leaf;
        }

        if (!_appendComment(leaf)) {
            leaves.add(leaf);
        }
    }

    /**
     * Appends unless doing so would put code after a standalone comment at depth zero.
     *
     * @return false when the leaf must start a new line instead
     */
    boolean appendSafe(Leaf leaf, boolean preformatted) {
        if (bracketTracker.getDepth() == 0) {
            if (isComment()) {
                return false;
            }
            if (!leaves.isEmpty() && leaf.getType() == LeafType.STANDALONE_COMMENT) {
                return false;
            }
        }
        append(leaf, preformatted);
        return true;
    }

    private boolean _appendComment(Leaf comment) {
        if (comment.getType() == LeafType.STANDALONE_COMMENT && bracketTracker.anyOpenBrackets()) {
            comment.setPrefix("");
            return false;
        }
        if (comment.getType() != LeafType.COMMENT) {
            return false;
        }

        int target = leaves.size() - 1;
        Leaf last = leaves.get(target);
        if (last.getType() == LeafType.RPAR && last.isInvisible()) {
            Leaf opening = bracketTracker.openingBracketOf(last);
            if (opening != null && _indexOf(opening) >= leaves.size() - 3) {
                // Comments after invisible parentheses around one leaf belong to that leaf
                target = leaves.size() - 2;
            }
        }
        comments.computeIfAbsent(target, k -> new ArrayList<>()).add(comment);
        return true;
    }

    /**
     * Whether {@code closing} ends a bracket pair whose last element is followed by a
     * comma the author wrote to keep the collection exploded.
     */
    boolean hasMagicTrailingComma(Leaf closing) {
        if (!closing.isClosingBracket() || leaves.isEmpty()
                || leaves.get(leaves.size() - 1).getType() != LeafType.COMMA) {
            return false;
        }
        if (closing.getType() == LeafType.RSQB || closing.getType() == LeafType.RBRACE) {
            return true;
        }
        if (isImport()) {
            return true;
        }
        Leaf opening = bracketTracker.openingBracketOf(closing);
        return opening != null && !isOneSequenceBetween(opening, closing);
    }

    /**
     * True when the parentheses hold a single element, as in a one-element tuple.
     * Call and signature parentheses never qualify once they contain a comma.
     */
    boolean isOneSequenceBetween(Leaf opening, Leaf closing) {
        if (opening.getType() != LeafType.LPAR || closing.getType() != LeafType.RPAR) {
            return false;
        }
        int start = _indexOf(opening);
        int end = _indexOf(closing);
        if (start < 0) {
            return false;
        }
        if (end < 0) {
            end = leaves.size();
        }
        int innerDepth = bracketTracker.depthOf(opening) + 1;
        boolean trailer = isTrailerBracket(opening);
        int commas = 0;
        for (int i = start + 1; i < end; i++) {
            Leaf leaf = leaves.get(i);
            if (leaf.getType() == LeafType.COMMA && bracketTracker.depthOf(leaf) == innerDepth) {
                commas++;
                if (trailer) {
                    commas++;
                    break;
                }
            }
        }
        return commas < 2;
    }

    /**
     * Whether an opening bracket on this line starts a call, subscript or signature
     * rather than a literal or a parenthesized expression.
     */
    boolean isTrailerBracket(Leaf opening) {
        if (opening.isOptionalParen()) {
            return false;
        }
        int index = _indexOf(opening);
        if (index <= 0) {
            return false;
        }
        Leaf previous = leaves.get(index - 1);
        return switch (previous.getType()) {
            case NAME, STRING, RPAR, RSQB, RBRACE -> !previous.isInvisible();
            default -> false;
        };
    }

    /**
     * Whether an opening parenthesis on this line groups an expression or tuple of its
     * own, as opposed to call or signature parentheses.
     */
    boolean isParenthesizedAtom(Leaf opening) {
        return opening.getType() == LeafType.LPAR && !opening.isOptionalParen()
                && !isTrailerBracket(opening);
    }

    private int _indexOf(Leaf leaf) {
        for (int i = 0; i < leaves.size(); i++) {
            if (leaves.get(i) == leaf) {
                return i;
            }
        }
        return -1;
    }

    public List<Leaf> commentsAfter(Leaf leaf) {
        int index = _indexOf(leaf);
        if (index < 0) {
            return Collections.emptyList();
        }
        return comments.getOrDefault(index, Collections.emptyList());
    }

    public List<Leaf> getAllComments() {
        List<Leaf> result = new ArrayList<>();
        comments.values().forEach(result::addAll);
        return result;
    }

    public List<Leaf> getLeaves() {
        return Collections.unmodifiableList(leaves);
    }

    public boolean isEmpty() {
        return leaves.isEmpty();
    }

    public int getDepth() { return depth; }
    public boolean isInsideBrackets() { return insideBrackets; }
    public boolean isInterfaceMember() { return interfaceMember; }
    public BracketTracker getBracketTracker() { return bracketTracker; }
    public boolean shouldSplitRhs() { return shouldSplitRhs; }
    public boolean hasMagicTrailingComma() { return magicTrailingComma != null; }
    public int getBlankLinesBefore() { return blankLinesBefore; }

    void setShouldSplitRhs(boolean shouldSplitRhs) {
        this.shouldSplitRhs = shouldSplitRhs;
    }

    void setBlankLinesBefore(int blankLinesBefore) {
        this.blankLinesBefore = blankLinesBefore;
    }

    private Leaf _first() {
        return leaves.isEmpty() ? null : leaves.get(0);
    }

    public boolean isComment() {
        return leaves.size() == 1 && (leaves.get(0).getType() == LeafType.STANDALONE_COMMENT
                || leaves.get(0).getType() == LeafType.DOCSTRING);
    }

    public boolean isPragma() {
        return isComment() && Comments.isPragma(leaves.get(0).getValue());
    }

    public boolean isDecorator() {
        return _first() != null && _first().getType() == LeafType.AT;
    }

    public boolean isImport() {
        Leaf first = _first();
        return first != null && (first.isKeyword("import") || first.isKeyword("from"));
    }

    /**
     * Declarations get blank-line separation and split on their first bracket.
     * Function signatures inside an interface are plain members.
     */
    public boolean isDef() {
        Leaf first = _first();
        return first != null && first.getType() == LeafType.KEYWORD
                && Keywords.DECLARATIONS.contains(first.getValue()) && !interfaceMember;
    }

    public boolean isFlowControl() {
        Leaf first = _first();
        return first != null && first.getType() == LeafType.KEYWORD
                && Keywords.FLOW_CONTROL.contains(first.getValue());
    }

    public boolean containsStandaloneComments() {
        return containsStandaloneComments(Integer.MAX_VALUE);
    }

    public boolean containsStandaloneComments(int depthLimit) {
        for (Leaf leaf : leaves) {
            if (leaf.getType() == LeafType.STANDALONE_COMMENT && bracketTracker.depthOf(leaf) <= depthLimit) {
                return true;
            }
        }
        return false;
    }

    /**
     * Fits in {@code lineLength} columns on one physical line.
     */
    public boolean isShortEnough(int lineLength) {
        String rendered = toString();
        return Strings.width(rendered) <= lineLength && rendered.indexOf('\n') < 0
                && !containsStandaloneComments();
    }

    /**
     * Renders the line without its newline: indentation, leaves, then trailing comments.
     */
    @Override
    public String toString() {
        if (leaves.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(INDENT.repeat(depth));
        sb.append(leaves.get(0).getValue());
        for (int i = 1; i < leaves.size(); i++) {
            sb.append(leaves.get(i).getPrefix()).append(leaves.get(i).getValue());
        }
        for (List<Leaf> attached : comments.values()) {
            for (Leaf comment : attached) {
                sb.append(Whitespace.DOUBLESPACE).append(comment.getValue());
            }
        }
        return sb.toString();
    }
}
