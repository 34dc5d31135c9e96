package ai.docsite.plaintext.render;

import ai.docsite.plaintext.format.InlineCollector;
import ai.docsite.plaintext.format.TextSink;
import ai.docsite.plaintext.math.MathExpression;
import ai.docsite.plaintext.math.MathInterpreter;
import ai.docsite.plaintext.text.ScriptAlphabet;
import ai.docsite.plaintext.text.TextNormalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a Parsoid article document and renders it as plain text through a {@link TextSink}.
 *
 * <p>Each element is classified by {@link ElementClassifier} and handed to the matching handler;
 * unknown markup is flattened to its text content. Language, direction and list state are saved
 * before entering a subtree that changes them and restored on the way out, so they never leak to
 * siblings. Inline constructs (headings, sub/superscripts, description terms) are rendered by
 * temporarily swapping in an {@link InlineCollector}.
 */
public class DocumentVisitor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentVisitor.class);
    private static final Pattern FOOTNOTE_MARKER = Pattern.compile("^\\[\\d+\\]$");

    private final Document document;
    private final VisitorOptions options;
    private final MathInterpreter mathInterpreter;
    private final ElementClassifier classifier = new ElementClassifier();
    private final Set<String> groupedImageTemplates = new HashSet<>();
    private final Set<String> usedLanguages = new LinkedHashSet<>();

    private TextSink sink;
    private String currentLanguage;
    private Direction currentDirection;
    private ListInfo listInfo = ListInfo.root();
    private String pageTitle = "";

    public DocumentVisitor(Document document, TextSink sink, VisitorOptions options, MathInterpreter mathInterpreter) {
        this.document = Objects.requireNonNull(document, "document");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.options = Objects.requireNonNull(options, "options");
        this.mathInterpreter = Objects.requireNonNull(mathInterpreter, "mathInterpreter");
        this.currentLanguage = options.language();
        this.currentDirection = options.direction();
    }

    public void visit(Node node) {
        if (node instanceof Element element) {
            dispatch(element, classifier.classify(element, currentLanguage, currentDirection));
        } else if (node instanceof TextNode textNode) {
            String text = TextNormalizer.normalize(textNode.getWholeText());
            if (!text.isEmpty()) {
                sink.write(text);
            }
        }
    }

    public void visitChildren(Element element) {
        for (Node child : new ArrayList<>(element.childNodes())) {
            visit(child);
        }
    }

    /**
     * Languages entered while rendering, in first-seen order.
     */
    public Set<String> usedLanguages() {
        return Collections.unmodifiableSet(usedLanguages);
    }

    /**
     * Title of the page resolved while visiting the document body.
     */
    public String pageTitle() {
        return pageTitle;
    }

    String currentLanguage() {
        return currentLanguage;
    }

    Direction currentDirection() {
        return currentDirection;
    }

    private void dispatch(Element element, NodeKind kind) {
        switch (kind) {
            case HIDDEN, REFERENCED_BY -> {
            }
            case LANGUAGE_SWITCH -> visitLanguageSwitch(element);
            case DIRECTION_SWITCH -> visitDirectionSwitch(element);
            case MATH -> visitMath(element, false);
            case FOOTNOTE_LIST -> visitFootnoteList(element);
            case IMAGE, FIGURE -> visitFigure(element, null);
            case FOOTNOTE_REFERENCE -> visitFootnoteReference(element);
            case BODY -> visitBody(element);
            case PARAGRAPH -> visitParagraph(element);
            case HEADING -> visitHeading(element, Integer.parseInt(element.normalName().substring(1)));
            case SUBSCRIPT -> visitScript(element, ScriptAlphabet.SUBSCRIPT);
            case SUPERSCRIPT -> visitSuperscript(element);
            case LINE_BREAK -> sink.lineBreak();
            case CENTER -> visitBlock(element);
            case LIST -> visitList(element);
            case LIST_ITEM -> visitListItem(element);
            case DESCRIPTION_LIST -> visitDescriptionList(element);
            case TERM -> visitTerm(element);
            case DEFINITION -> visitDefinition(element);
            case QUOTATION -> visitQuotation(element);
            case TABLE -> visitTable(element);
            case BLOCK -> {
                if (MediaWikiData.isGroupedImages(element)) {
                    visitGroupedImages(element);
                } else {
                    visitBlock(element);
                }
            }
            case ANCHOR, CHILDREN -> visitChildren(element);
        }
    }

    private void visitLanguageSwitch(Element element) {
        String language = element.attr("lang");
        usedLanguages.add(language);
        String savedLanguage = currentLanguage;
        Direction savedDirection = currentDirection;
        currentLanguage = language;
        currentDirection = LanguageDirectionality.lookup(language);
        try {
            visit(element);
        } finally {
            currentLanguage = savedLanguage;
            currentDirection = savedDirection;
        }
    }

    private void visitDirectionSwitch(Element element) {
        Direction savedDirection = currentDirection;
        Direction direction = Direction.fromAttribute(element.attr("dir")).orElse(currentDirection);
        LOGGER.warn("Using non-standard dir for language {}: {} -> {}",
                currentLanguage, currentDirection.attributeValue(), direction.attributeValue());
        currentDirection = direction;
        try {
            visit(element);
        } finally {
            currentDirection = savedDirection;
        }
    }

    private void visitBody(Element body) {
        String title = document.title();
        Element link = document.selectFirst("link[rel=dc:isVersionOf]");
        if (link != null && link.hasAttr("href")) {
            title = link.attr("href").replaceFirst("^.*/", "");
        }
        pageTitle = title.replace('_', ' ');
        LOGGER.debug("Rendering page '{}'", pageTitle);
        visitChildren(body);
    }

    private void visitParagraph(Element element) {
        sink.paragraphBreak();
        visitChildren(element);
        sink.paragraphBreak();
    }

    private void visitBlock(Element element) {
        sink.lineBreak();
        visitChildren(element);
        sink.lineBreak();
    }

    // H1s are at the same level as the page title and are dropped in single-item collections
    private void visitHeading(Element element, int level) {
        int effectiveLevel = options.hasChapters() ? level : level - 1;
        if (options.singleItem() && effectiveLevel == 0) {
            return;
        }
        sink.writeHeading(effectiveLevel, collect(element));
    }

    private void visitSuperscript(Element element) {
        if (options.noRefs() && element.hasClass("Template-Fact")) {
            // "citation needed"
            return;
        }
        visitScript(element, ScriptAlphabet.SUPERSCRIPT);
    }

    private void visitScript(Element element, ScriptAlphabet alphabet) {
        String contents = collect(element);
        sink.write(alphabet.transliterate(contents).orElseGet(() -> TextNormalizer.normalize(contents)));
    }

    private void visitFootnoteReference(Element element) {
        if (options.noRefs()) {
            return;
        }
        String contents = collect(element);
        if (FOOTNOTE_MARKER.matcher(contents).matches()) {
            Element marker = document.createElement("sup");
            marker.text(contents.substring(1, contents.length() - 1) + " ");
            visitSuperscript(marker);
        } else {
            visitSuperscript(element);
        }
    }

    private void visitFootnoteList(Element element) {
        if (options.noRefs()) {
            return;
        }
        int number = 0;
        for (Element footnote : element.children()) {
            number++;
            sink.indent(TextNormalizer.normalize("[" + number + "]"));
            visitChildren(footnote);
            sink.dedent();
        }
    }

    private void visitList(Element element) {
        if (element.children().isEmpty()) {
            return;
        }
        ListInfo saved = listInfo;
        listInfo = saved.nested("ol".equals(element.normalName()) ? ListType.ORDERED : ListType.UNORDERED);
        try {
            visitChildren(element);
        } finally {
            listInfo = saved;
        }
    }

    private void visitListItem(Element element) {
        sink.indent(listInfo.nextItemLabel());
        visitChildren(element);
        sink.dedent();
    }

    private void visitDescriptionList(Element element) {
        if (element.children().isEmpty()) {
            return;
        }
        boolean sawTerm = false;
        boolean allMath = true;
        for (Element row = element.children().first(); row != null && !sawTerm; row = row.nextElementSibling()) {
            sawTerm = "dt".equals(row.normalName());
            Element math = row.children().first();
            if (math == null || math.nextElementSibling() != null || !ElementClassifier.isMath(math)) {
                allMath = false;
            }
        }
        if (allMath && !sawTerm) {
            // indented display equations
            for (Element row : element.children()) {
                visitMath(row.children().first(), true);
            }
            return;
        }

        ListInfo saved = listInfo;
        listInfo = saved.nested(sawTerm ? ListType.DESCRIPTION : ListType.QUOTATION);
        try {
            visitChildren(element);
            if (listInfo.sawTerm()) {
                sink.dedent();
            }
        } finally {
            listInfo = saved;
        }
    }

    private void visitTerm(Element element) {
        if (!inDescriptionList(element)) {
            sink.indent(collect(element));
            sink.dedent();
            return;
        }
        if (listInfo.sawTerm()) {
            sink.dedent();
            listInfo.sawTerm(false);
        }
        String term = collect(element);
        sink.indent(term);
        listInfo.sawTerm(true);
    }

    private void visitDefinition(Element element) {
        if (!inDescriptionList(element)) {
            sink.indent();
            visitChildren(element);
            sink.dedent();
            return;
        }
        if (!listInfo.sawTerm()) {
            sink.indent();
            listInfo.sawTerm(true);
        }
        visitChildren(element);
    }

    /** Only direct children of the list being rendered share its term scope. */
    private boolean inDescriptionList(Element element) {
        ListType type = listInfo.type();
        Element parent = element.parent();
        return (type == ListType.DESCRIPTION || type == ListType.QUOTATION)
                && parent != null && "dl".equals(parent.normalName());
    }

    private void visitQuotation(Element element) {
        sink.indent();
        visitChildren(element);
        sink.dedent();
    }

    private void visitTable(Element element) {
        if (groupedImageTemplates.contains(element.attr("about"))) {
            return;
        }
        if (MediaWikiData.isGroupedImages(element)) {
            visitGroupedImages(element);
        }
        // other tables are not rendered
    }

    /**
     * Double/triple image templates: pairs each image cell with the caption cell in the row below.
     */
    private void visitGroupedImages(Element element) {
        String about = element.attr("about");
        if (about.isEmpty()) {
            LOGGER.debug("Grouped image template without about id; skipping");
            return;
        }
        groupedImageTemplates.add(about);
        Element scope = element.parent() != null ? element.parent() : element;
        List<Element> images = new ArrayList<>();
        List<Element> captions = new ArrayList<>();
        for (Element table : scope.getElementsByAttributeValue("about", about)) {
            if ("table".equals(table.normalName())) {
                images.addAll(table.select("tr > td > [typeof=mw:Image]"));
                captions.addAll(table.select("tr + tr > td > [class=thumbcaption]"));
            }
        }
        for (int i = 0; i < images.size(); i++) {
            visitFigure(images.get(i), i < captions.size() ? captions.get(i) : null);
        }
    }

    /**
     * Images and figures are not rendered; this hook only receives them in document order.
     */
    protected void visitFigure(Element figure, Element caption) {
    }

    private void visitMath(Element element, boolean display) {
        Optional<String> source = MediaWikiData.mathSource(element);
        if (source.isEmpty()) {
            LOGGER.debug("Math element without readable source; rendering fallback content");
            visitChildren(element);
            if (display) {
                sink.lineBreak();
            }
            return;
        }
        MathExpression expression = MathExpression.parse(source.get(), display);
        sink.write(mathInterpreter.interpret(expression));
        if (expression.display()) {
            sink.lineBreak();
        }
    }

    /**
     * Renders the children of {@code element} into a single line of text.
     */
    private String collect(Element element) {
        TextSink saved = sink;
        InlineCollector collector = new InlineCollector();
        sink = collector;
        try {
            visitChildren(element);
        } finally {
            sink = saved;
        }
        return collector.text();
    }
}
