package com.vyperformatter.plugins.vyper.formatting;

import java.util.List;

import com.vyperformatter.plugins.vyper.parsing.Leaf;
import com.vyperformatter.plugins.vyper.parsing.LeafType;

/**
 * Computes the whitespace that goes before a leaf, given the leaves already on its line.
 */
final class Whitespace {
    static final String NO = "";
    static final String SPACE = " ";
    static final String DOUBLESPACE = "  ";

    private Whitespace() {
    }

    static String prefixFor(Leaf leaf, Line line) {
        LeafType type = leaf.getType();
        if (type == LeafType.COMMENT) {
            return DOUBLESPACE;
        }
        switch (type) {
            case RPAR, RSQB, RBRACE, COMMA, COLON, STANDALONE_COMMENT, DOCSTRING:
                return NO;
            default:
                break;
        }

        List<Leaf> leaves = line.getLeaves();
        Leaf previous = leaves.isEmpty() ? null : leaves.get(leaves.size() - 1);
        Leaf beforePrevious = leaves.size() < 2 ? null : leaves.get(leaves.size() - 2);
        if (previous == null || previous.isOpeningBracket() || previous.getType() == LeafType.AT) {
            return NO;
        }

        if (previous.getType() == LeafType.DOT) {
            return leaf.isKeyword("import") ? SPACE : NO;
        }
        if (type == LeafType.DOT) {
            return previous.isKeyword("from") ? SPACE : NO;
        }

        if (leaf.isOperator("**") || previous.isOperator("**")) {
            return NO;
        }

        if (type == LeafType.LPAR || type == LeafType.LSQB) {
            boolean trailer = switch (previous.getType()) {
                case NAME, STRING, RPAR, RSQB, RBRACE -> !previous.isInvisible();
                default -> false;
            };
            return trailer ? NO : SPACE;
        }

        if (isUnaryOperator(previous, beforePrevious)) {
            return NO;
        }

        boolean keywordContext = line.getBracketTracker().getDepth() > 0 || line.isInsideBrackets();
        if (type == LeafType.EQUAL) {
            if (keywordContext) {
                return _isAnnotatedParameter(leaves) ? SPACE : NO;
            }
            return SPACE;
        }
        if (previous.getType() == LeafType.EQUAL && keywordContext && previous.getPrefix().isEmpty()) {
            return NO;
        }

        return SPACE;
    }

    /**
     * A sign or inversion operator that applies to the operand after it.
     */
    static boolean isUnaryOperator(Leaf leaf, Leaf previous) {
        if (leaf.getType() != LeafType.OPERATOR) {
            return false;
        }
        return switch (leaf.getValue()) {
            case "-", "+" -> previous == null || !previous.endsOperand();
            case "~" -> true;
            default -> false;
        };
    }

    /**
     * Whether the innermost bracket segment being appended to holds an annotation,
     * in which case a default value reads {@code name: type = value}.
     */
    private static boolean _isAnnotatedParameter(List<Leaf> leaves) {
        int nesting = 0;
        for (int i = leaves.size() - 1; i >= 0; i--) {
            Leaf leaf = leaves.get(i);
            if (leaf.isClosingBracket()) {
                nesting++;
            } else if (leaf.isOpeningBracket()) {
                if (nesting == 0) {
                    return false;
                }
                nesting--;
            } else if (nesting == 0) {
                if (leaf.getType() == LeafType.COMMA) {
                    return false;
                }
                if (leaf.getType() == LeafType.COLON) {
                    return true;
                }
            }
        }
        return false;
    }
}
