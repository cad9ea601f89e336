package com.ifdefgraph.core.tree;

import java.util.Map;

/**
 * Preprocessor directive kinds. Only the conditional ones affect presence conditions;
 * everything else ({@code #define}, {@code #include}, {@code #pragma}, ...) is {@link #OTHER}.
 */
public enum DirectiveKind {
    IF,
    IFDEF,
    IFNDEF,
    ELIF,
    ELSE,
    ENDIF,
    OTHER;

    private static final Map<String, DirectiveKind> BY_TAG = Map.of(
        "cpp:if",     IF,
        "cpp:ifdef",  IFDEF,
        "cpp:ifndef", IFNDEF,
        "cpp:elif",   ELIF,
        "cpp:else",   ELSE,
        "cpp:endif",  ENDIF
    );

    public static DirectiveKind forTag(String tag) {
        return BY_TAG.getOrDefault(tag, OTHER);
    }

    /** Source spelling, e.g. {@code #ifdef}. */
    public String spelling() {
        return this == OTHER ? "#?" : "#" + name().toLowerCase();
    }
}
