package org.dxworks.metamark.scanner;

/**
 * Where on a line a lexical rule is allowed to start.
 */
public enum Anchor {
    /** Anywhere. */
    NONE,
    /** Only at column 1; the rule's own pattern swallows any indentation. */
    LINE_START,
    /** Only when every character before it on the same line is a space or tab. */
    LEADING_BLANKS
}
