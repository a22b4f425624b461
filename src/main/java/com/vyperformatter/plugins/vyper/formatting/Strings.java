package com.vyperformatter.plugins.vyper.formatting;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * String literal normalization: quote preference, docstring indentation and display width.
 */
public final class Strings {
    private static final String PREFIX_CHARS = "bBrRxXuUfF";

    private Strings() {
    }

    /**
     * Display width of a piece of rendered text, counted in code points.
     */
    public static int width(String text) {
        return text.codePointCount(0, text.length());
    }

    public static String stringPrefix(String literal) {
        int i = 0;
        while (i < literal.length() && PREFIX_CHARS.indexOf(literal.charAt(i)) >= 0) {
            i++;
        }
        return literal.substring(0, i);
    }

    /**
     * Prefers double quotes unless that would need more escapes than the original.
     * Triple-double-quoted literals are left alone, {@code '''} becomes {@code """}.
     */
    public static String normalizeQuotes(String literal) {
        String prefix = stringPrefix(literal);
        String value = literal.substring(prefix.length());
        if (value.startsWith("\"\"\"")) {
            return literal;
        }

        String origQuote;
        String newQuote;
        if (value.startsWith("'''")) {
            origQuote = "'''";
            newQuote = "\"\"\"";
        } else if (value.startsWith("\"")) {
            origQuote = "\"";
            newQuote = "'";
        } else {
            origQuote = "'";
            newQuote = "\"";
        }

        String body = value.substring(origQuote.length(), value.length() - origQuote.length());
        String original = literal;
        String newBody;
        if (prefix.toLowerCase(Locale.ROOT).contains("r")) {
            if (_count(body, newQuote) != _count(body, "\\" + newQuote)) {
                // An unescaped new quote in a raw string cannot be converted
                return literal;
            }
            newBody = body;
        } else {
            Pattern escapedNew = _escapedQuote(newQuote);
            Pattern escapedOrig = _escapedQuote(origQuote);
            Pattern unescapedNew = Pattern.compile("(([^\\\\]|^)(\\\\\\\\)*)" + Pattern.quote(newQuote));

            newBody = _subTwice(escapedNew, "$1$2" + Matcher.quoteReplacement(newQuote), body);
            if (!body.equals(newBody)) {
                body = newBody;
                original = prefix + origQuote + body + origQuote;
            }
            newBody = _subTwice(escapedOrig, "$1$2" + Matcher.quoteReplacement(origQuote), newBody);
            newBody = _subTwice(unescapedNew, "$1" + Matcher.quoteReplacement("\\" + newQuote), newBody);
        }

        if (newQuote.equals("\"\"\"") && newBody.endsWith("\"")) {
            newBody = newBody.substring(0, newBody.length() - 1) + "\\\"";
        }

        int origEscapes = _count(body, "\\");
        int newEscapes = _count(newBody, "\\");
        if (newEscapes > origEscapes) {
            return original;
        }
        if (newEscapes == origEscapes && origQuote.equals("\"")) {
            return original;
        }
        return prefix + newQuote + newBody + newQuote;
    }

    /**
     * Normalizes a docstring literal found at the given block depth.
     */
    public static String formatDocstring(String literal, int depth, int lineLength) {
        String normalized = normalizeQuotes(literal);
        if (depth == 0) {
            return normalized;
        }

        String prefix = stringPrefix(normalized);
        String value = normalized.substring(prefix.length());
        char quoteChar = value.charAt(0);
        int quoteLength = value.startsWith(String.valueOf(quoteChar).repeat(3)) && value.length() >= 6 ? 3 : 1;
        String docstring = value.substring(quoteLength, value.length() - quoteLength);
        boolean startedEmpty = docstring.isEmpty();
        if (docstring.matches("(?s).*\\\\\\s*\n.*")) {
            // Line continuations inside the literal are kept verbatim
            return normalized;
        }

        String indent = "    ".repeat(depth);
        if (quoteLength == 3 && docstring.indexOf('\n') >= 0) {
            docstring = fixDocstring(docstring, indent);
        } else {
            docstring = docstring.strip();
        }

        if (!docstring.isEmpty()) {
            if (docstring.charAt(0) == quoteChar) {
                docstring = " " + docstring;
            }
            if (docstring.charAt(docstring.length() - 1) == quoteChar) {
                docstring = docstring + " ";
            }
            if (docstring.endsWith("\\")) {
                int backslashes = docstring.length() - docstring.replaceAll("\\\\+$", "").length();
                if (backslashes % 2 == 1) {
                    docstring = docstring + " ";
                }
            }
        } else if (!startedEmpty) {
            // A blank docstring keeps one space between its quotes
            docstring = " ";
        }

        String quote = String.valueOf(quoteChar).repeat(quoteLength);
        if (quoteLength == 3) {
            String[] lines = docstring.split("\n", -1);
            int lastLineLength = docstring.isEmpty() ? indent.length() : width(lines[lines.length - 1]);
            if (lines.length == 1) {
                lastLineLength += indent.length() + prefix.length() + quoteLength;
            }
            if (lines.length > 1 && lastLineLength + quoteLength > lineLength) {
                return prefix + quote + docstring + "\n" + indent + quote;
            }
        }
        return prefix + quote + docstring + quote;
    }

    /**
     * Re-indents the continuation lines of a docstring body to {@code indent}, keeping
     * their relative indentation and dropping trailing whitespace.
     */
    static String fixDocstring(String docstring, String indent) {
        if (docstring.isEmpty()) {
            return docstring;
        }
        List<String> lines = new ArrayList<>();
        for (String line : docstring.split("\n", -1)) {
            lines.add(_expandLeadingTabs(line));
        }

        int common = Integer.MAX_VALUE;
        for (String line : lines.subList(1, lines.size())) {
            String stripped = line.stripLeading();
            if (!stripped.isEmpty()) {
                common = Math.min(common, line.length() - stripped.length());
            }
        }

        List<String> trimmed = new ArrayList<>();
        trimmed.add(lines.get(0).strip());
        int lastIndex = lines.size() - 2;
        for (int i = 0; i < lines.size() - 1; i++) {
            String line = lines.get(i + 1);
            String content = common == Integer.MAX_VALUE || line.length() <= common
                    ? line.strip()
                    : line.substring(common).stripTrailing();
            if (!content.isEmpty() || i == lastIndex) {
                trimmed.add(indent + content);
            } else {
                trimmed.add("");
            }
        }
        return String.join("\n", trimmed);
    }

    private static String _expandLeadingTabs(String line) {
        int i = 0;
        StringBuilder sb = new StringBuilder();
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            if (line.charAt(i) == '\t') {
                sb.append(" ".repeat(8 - sb.length() % 8));
            } else {
                sb.append(' ');
            }
            i++;
        }
        return sb.append(line.substring(i)).toString();
    }

    private static Pattern _escapedQuote(String quote) {
        return Pattern.compile("([^\\\\]|^)\\\\((?:\\\\\\\\)*)" + Pattern.quote(quote));
    }

    private static String _subTwice(Pattern pattern, String replacement, String text) {
        String once = pattern.matcher(text).replaceAll(replacement);
        return pattern.matcher(once).replaceAll(replacement);
    }

    private static int _count(String text, String needle) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }
}
