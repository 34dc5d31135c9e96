package ai.docsite.plaintext.render;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;

/**
 * Maps an element to the {@link NodeKind} that renders it.
 *
 * <p>Rules apply in priority order and the first match wins: hidden content, a language switch,
 * a direction switch, then the {@code typeof}, {@code rel} and tag handler tables. Anything
 * unmatched is rendered through its children.
 */
public class ElementClassifier {

    static final String MATH_TYPE = "mw:Extension/math";

    private static final Map<String, NodeKind> TYPEOF_HANDLERS = Map.of(
            MATH_TYPE, NodeKind.MATH,
            "mw:Extension/references", NodeKind.FOOTNOTE_LIST,
            "mw:Image", NodeKind.IMAGE,
            "mw:Image/Thumb", NodeKind.IMAGE);

    private static final Map<String, NodeKind> REL_HANDLERS = Map.of(
            "dc:references", NodeKind.FOOTNOTE_REFERENCE,
            "mw:referencedBy", NodeKind.REFERENCED_BY);

    private static final Map<String, NodeKind> TAG_HANDLERS = Map.ofEntries(
            Map.entry("body", NodeKind.BODY),
            Map.entry("a", NodeKind.ANCHOR),
            Map.entry("p", NodeKind.PARAGRAPH),
            Map.entry("h1", NodeKind.HEADING),
            Map.entry("h2", NodeKind.HEADING),
            Map.entry("h3", NodeKind.HEADING),
            Map.entry("h4", NodeKind.HEADING),
            Map.entry("h5", NodeKind.HEADING),
            Map.entry("h6", NodeKind.HEADING),
            Map.entry("sub", NodeKind.SUBSCRIPT),
            Map.entry("sup", NodeKind.SUPERSCRIPT),
            Map.entry("center", NodeKind.CENTER),
            Map.entry("br", NodeKind.LINE_BREAK),
            Map.entry("ul", NodeKind.LIST),
            Map.entry("ol", NodeKind.LIST),
            Map.entry("li", NodeKind.LIST_ITEM),
            Map.entry("dl", NodeKind.DESCRIPTION_LIST),
            Map.entry("dt", NodeKind.TERM),
            Map.entry("dd", NodeKind.DEFINITION),
            Map.entry("blockquote", NodeKind.QUOTATION),
            Map.entry("table", NodeKind.TABLE),
            Map.entry("figure", NodeKind.FIGURE),
            Map.entry("div", NodeKind.BLOCK));

    // class names follow enwiki conventions
    private static final Set<String> NON_PRINTING_CLASSES = Set.of(
            "noprint", "infobox", "navbox", "rellink", "dablink", "toplink", "metadata");
    private static final Pattern DISPLAY_NONE = Pattern.compile(
            "(^|;)\\s*display\\s*:\\s*none\\s*(;|$)", Pattern.CASE_INSENSITIVE);

    public NodeKind classify(Element element, String currentLanguage, Direction currentDirection) {
        if (isHidden(element)) {
            return NodeKind.HIDDEN;
        }
        String language = element.attr("lang");
        if (!language.isEmpty() && !language.equals(currentLanguage)) {
            return NodeKind.LANGUAGE_SWITCH;
        }
        Optional<Direction> direction = Direction.fromAttribute(element.attr("dir"));
        if (direction.isPresent() && direction.get() != currentDirection) {
            return NodeKind.DIRECTION_SWITCH;
        }
        if (element.hasAttr("typeof")) {
            NodeKind kind = TYPEOF_HANDLERS.get(element.attr("typeof"));
            if (kind != null) {
                return kind;
            }
        }
        if (element.hasAttr("rel")) {
            NodeKind kind = REL_HANDLERS.get(element.attr("rel"));
            if (kind != null) {
                return kind;
            }
        }
        return TAG_HANDLERS.getOrDefault(element.normalName(), NodeKind.CHILDREN);
    }

    /**
     * Non-printing content: explicit markers, inline {@code display:none}, or boilerplate boxes.
     * Grouped-image templates are never hidden.
     */
    public static boolean isHidden(Element element) {
        boolean hidden = DISPLAY_NONE.matcher(element.attr("style")).find()
                || element.classNames().stream().anyMatch(NON_PRINTING_CLASSES::contains);
        return hidden && !MediaWikiData.isGroupedImages(element);
    }

    static boolean isMath(Element element) {
        return element != null && MATH_TYPE.equals(element.attr("typeof"));
    }
}
