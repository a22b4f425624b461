package com.vyperformatter.plugins.vyper.parsing;

import java.util.Set;

/**
 * Reserved words the formatter treats specially.
 */
public final class Keywords {

    public static final Set<String> HARD_KEYWORDS = Set.of(
            "and", "as", "assert", "break", "continue", "def", "elif", "else",
            "extcall", "for", "from", "if", "import", "in", "log", "not", "or",
            "pass", "raise", "return", "staticcall");

    /**
     * Declaration words that are only keywords when a name follows them,
     * so that e.g. {@code flag: bool} stays a plain variable.
     */
    public static final Set<String> SOFT_KEYWORDS = Set.of(
            "event", "struct", "interface", "enum", "flag");

    public static final Set<String> DECLARATIONS = Set.of(
            "def", "event", "struct", "interface", "enum", "flag");

    public static final Set<String> FLOW_CONTROL = Set.of("return", "break", "continue");

    private Keywords() {
    }

    public static boolean isHardKeyword(String word) {
        return HARD_KEYWORDS.contains(word);
    }

    public static boolean isSoftKeyword(String word) {
        return SOFT_KEYWORDS.contains(word);
    }
}
