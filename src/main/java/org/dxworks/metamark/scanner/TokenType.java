package org.dxworks.metamark.scanner;

import java.util.regex.Pattern;

/**
 * Lexical rules of MetaMark, in declaration order.
 * <p>
 * At each cursor position every eligible rule is tried. The highest priority wins regardless
 * of match length, the longest match wins among equal priorities, and any remaining tie goes
 * to the rule declared first.
 */
public enum TokenType {
    CODE_FENCE("```([A-Za-z0-9_+#.-]*)[ \\t]*(?:\\r\\n|\\r|\\n|\\z)", 3, Anchor.LEADING_BLANKS),
    FRONTMATTER_DELIMITER("---[ \\t]*(?:\\r\\n|\\r|\\n|\\z)", 2, Anchor.LINE_START),
    COMPONENT_START("\\[\\[component:[^\\]\\r\\n]+\\]\\]", 2, Anchor.NONE),
    COMPONENT_END("\\[\\[/component\\]\\]", 2, Anchor.NONE),
    ANNOTATION("@\\[[^\\]\\r\\n]+\\]", 2, Anchor.NONE),
    COMMENT("%% [^\\r\\n]*", 2, Anchor.LEADING_BLANKS),
    BOLD("\\*\\*[^*\\r\\n]+\\*\\*", 2, Anchor.NONE),
    ITALIC("\\*[^*\\r\\n]+\\*", 2, Anchor.NONE),
    INLINE_CODE("`[^`\\r\\n]+`", 2, Anchor.NONE),
    LINK("\\[[^\\]\\r\\n]+\\]\\([^)\\r\\n]+\\)", 2, Anchor.NONE),
    INLINE_MATH("\\$[^$\\r\\n]+\\$", 2, Anchor.NONE),
    BLOCK_MATH("\\$\\$[^$\\r\\n]+\\$\\$", 2, Anchor.NONE),
    UNORDERED_LIST_MARKER("[ \\t]*- ", 2, Anchor.LINE_START),
    ORDERED_LIST_MARKER("[ \\t]*\\d+\\. ", 2, Anchor.LINE_START),
    HEADING("#{1,6} ", 2, Anchor.LEADING_BLANKS),
    WHITESPACE("[ \\t]+", 2, Anchor.NONE),
    NEWLINE("(?:\\r\\n|\\r|\\n)+", 2, Anchor.NONE),
    TEXT("[^\\s][^\\s*`\\[$@]*", 1, Anchor.NONE);

    private final Pattern pattern;
    private final int priority;
    private final Anchor anchor;

    TokenType(String regex, int priority, Anchor anchor) {
        this.pattern = Pattern.compile(regex);
        this.priority = priority;
        this.anchor = anchor;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public int getPriority() {
        return priority;
    }

    public Anchor getAnchor() {
        return anchor;
    }

    public boolean isListMarker() {
        return this == UNORDERED_LIST_MARKER || this == ORDERED_LIST_MARKER;
    }

    /** Tokens that the inline parser turns into inline nodes or annotations. */
    public boolean isInline() {
        switch (this) {
            case TEXT:
            case WHITESPACE:
            case BOLD:
            case ITALIC:
            case INLINE_CODE:
            case LINK:
            case INLINE_MATH:
            case BLOCK_MATH:
            case ANNOTATION:
                return true;
            default:
                return false;
        }
    }
}
