package ai.docsite.plaintext.render;

/**
 * Kind of list whose items are currently being rendered.
 */
public enum ListType {
    NONE,
    UNORDERED,
    ORDERED,
    DESCRIPTION,
    /** A description list without terms, used for indentation. */
    QUOTATION
}
