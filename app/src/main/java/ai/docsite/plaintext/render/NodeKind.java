package ai.docsite.plaintext.render;

/**
 * Closed set of element classifications, each mapped to one handler of {@link DocumentVisitor}.
 */
public enum NodeKind {
    HIDDEN,
    LANGUAGE_SWITCH,
    DIRECTION_SWITCH,

    MATH,
    FOOTNOTE_LIST,
    IMAGE,

    FOOTNOTE_REFERENCE,
    REFERENCED_BY,

    BODY,
    ANCHOR,
    PARAGRAPH,
    HEADING,
    SUBSCRIPT,
    SUPERSCRIPT,
    CENTER,
    LINE_BREAK,
    LIST,
    LIST_ITEM,
    DESCRIPTION_LIST,
    TERM,
    DEFINITION,
    QUOTATION,
    TABLE,
    FIGURE,
    BLOCK,

    CHILDREN
}
