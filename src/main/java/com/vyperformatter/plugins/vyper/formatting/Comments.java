package com.vyperformatter.plugins.vyper.formatting;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.vyperformatter.plugins.vyper.parsing.Leaf;
import com.vyperformatter.plugins.vyper.parsing.LeafType;

/**
 * Extracts comments from leaf prefixes.
 */
public final class Comments {
    private static final Pattern MISSING_SPACE = Pattern.compile("^#(\\w)");
    private static final Pattern PRAGMA = Pattern.compile(
            "^#\\s*(@version|pragma\\s+version)\\b.*");

    private Comments() {
    }

    /**
     * A comment found in a prefix, not yet attached to a line.
     */
    public static final class ProtoComment {
        private final LeafType type;
        private final String value;
        private final int newlines;

        ProtoComment(LeafType type, String value, int newlines) {
            this.type = type;
            this.value = value;
            this.newlines = newlines;
        }

        public LeafType getType() { return type; }
        public String getValue() { return value; }

        /**
         * Blank lines between the previous comment or code and this comment.
         */
        public int getNewlines() { return newlines; }

        public Leaf toLeaf(Leaf owner) {
            return new Leaf(type, value, "", owner.getLine(), owner.getColumn());
        }
    }

    /**
     * Lists the comments of a prefix in order. A comment on the first line of the
     * prefix shares its line with preceding code and is trailing; any other comment
     * stands alone. Comments before the end of the file always stand alone.
     */
    public static List<ProtoComment> fromPrefix(String prefix, boolean endOfFile) {
        List<ProtoComment> result = new ArrayList<>();
        if (prefix.indexOf('#') < 0) {
            return result;
        }

        String[] lines = prefix.split("\n", -1);
        int blankLines = 0;
        for (int index = 0; index < lines.length; index++) {
            String line = lines[index].strip();
            if (line.isEmpty()) {
                blankLines++;
            }
            if (!line.startsWith("#")) {
                continue;
            }
            LeafType type = index == 0 && !endOfFile ? LeafType.COMMENT : LeafType.STANDALONE_COMMENT;
            result.add(new ProtoComment(type, normalize(line), blankLines));
            blankLines = 0;
        }
        return result;
    }

    /**
     * Counts the newlines between the last comment of a prefix (or its start) and the
     * leaf that owns it.
     */
    public static int newlinesAfterComments(String prefix) {
        int lastHash = prefix.lastIndexOf('#');
        String tail = lastHash < 0 ? prefix : prefix.substring(lastHash);
        int count = (int) tail.chars().filter(c -> c == '\n').count();
        return lastHash < 0 ? count : Math.max(count - 1, 0);
    }

    /**
     * Strips trailing whitespace and puts a space between the hash and a word.
     */
    public static String normalize(String comment) {
        String content = comment.stripTrailing();
        return MISSING_SPACE.matcher(content).replaceFirst("# $1");
    }

    public static boolean isPragma(String comment) {
        return PRAGMA.matcher(comment).matches();
    }
}
