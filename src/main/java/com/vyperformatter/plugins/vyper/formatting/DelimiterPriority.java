package com.vyperformatter.plugins.vyper.formatting;

import com.vyperformatter.plugins.vyper.parsing.Leaf;
import com.vyperformatter.plugins.vyper.parsing.LeafType;

/**
 * Split points of a line, in the order they are tried: the constant with the lowest
 * ordinal present at depth zero governs a delimiter split.
 */
public enum DelimiterPriority {
    COMMA,
    TERNARY,
    LOGIC,
    STRING,
    COMPARATOR,
    BITWISE_OR,
    BITWISE_XOR,
    BITWISE_AND,
    SHIFT,
    ARITHMETIC,
    TERM,
    POWER,
    DOT;

    /**
     * Priority of splitting right after {@code leaf}, or null.
     */
    static DelimiterPriority splitAfter(Leaf leaf) {
        return leaf.getType() == LeafType.COMMA ? COMMA : null;
    }

    /**
     * Priority of splitting right before {@code leaf}, or null.
     *
     * @param previous the leaf before it on the line, may be null
     * @param inImport whether the line is an import statement
     */
    static DelimiterPriority splitBefore(Leaf leaf, Leaf previous, boolean inImport) {
        switch (leaf.getType()) {
            case DOT:
                if (!inImport && previous != null && previous.isClosingBracket() && !previous.isInvisible()) {
                    return DOT;
                }
                return null;
            case STRING:
                return previous != null && previous.getType() == LeafType.STRING ? STRING : null;
            case KEYWORD:
                return switch (leaf.getValue()) {
                    case "and", "or" -> LOGIC;
                    case "if", "else" -> previous != null ? TERNARY : null;
                    case "in" -> previous != null && !previous.isKeyword("not") ? COMPARATOR : null;
                    case "not" -> previous != null && previous.endsOperand() ? COMPARATOR : null;
                    default -> null;
                };
            case OPERATOR:
                if (previous == null || !previous.endsOperand()) {
                    // unary
                    return null;
                }
                return switch (leaf.getValue()) {
                    case "<", ">", "==", "!=", "<=", ">=" -> COMPARATOR;
                    case "|" -> BITWISE_OR;
                    case "^" -> BITWISE_XOR;
                    case "&" -> BITWISE_AND;
                    case "<<", ">>" -> SHIFT;
                    case "+", "-" -> ARITHMETIC;
                    case "*", "/", "//", "%" -> TERM;
                    case "**" -> POWER;
                    default -> null;
                };
            default:
                return null;
        }
    }
}
