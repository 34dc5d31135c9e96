package ai.docsite.plaintext.convert;

import ai.docsite.plaintext.bundle.ArticleSource;
import ai.docsite.plaintext.bundle.Metabook;
import ai.docsite.plaintext.bundle.MetabookItem;
import ai.docsite.plaintext.format.LineFormatter;
import ai.docsite.plaintext.math.MathInterpreter;
import ai.docsite.plaintext.render.DocumentVisitor;
import ai.docsite.plaintext.render.LanguageDirectionality;
import ai.docsite.plaintext.render.VisitorOptions;
import ai.docsite.plaintext.text.TextNormalizer;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Renders every chapter and article of a collection, in order, as one plain-text document.
 */
public class CollectionRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(CollectionRenderer.class);
    static final String MDC_ARTICLE = "article";

    private final RenderOptions options;
    private final StatusReporter status;

    public CollectionRenderer(RenderOptions options, StatusReporter status) {
        this.options = Objects.requireNonNull(options, "options");
        this.status = Objects.requireNonNull(status, "status");
    }

    /**
     * Writes the collection to {@code out}, flushing after every article.
     *
     * @return languages used anywhere in the collection, in first-seen order
     * @throws ConversionException when an article is missing or the output cannot be written
     */
    public Set<String> render(Metabook metabook, ArticleSource source, Writer out) {
        String language = options.language()
                .orElseGet(() -> metabook.lang() == null || metabook.lang().isBlank() ? "en" : metabook.lang());
        Session session = new Session(metabook, source, new LineFormatter(out, options.layout()), language);
        try {
            session.formatter.writeTitle(TextNormalizer.collapse(metabook.effectiveTitle()),
                    metabook.subtitle() == null ? null : TextNormalizer.collapse(metabook.subtitle()));
            if (metabook.summary() != null && !metabook.summary().isBlank()) {
                session.formatter.writeSummary(TextNormalizer.collapse(metabook.summary()));
            }
            status.createStage(metabook.countItems(), "Formatting");
            session.renderItems(metabook.items());
            session.formatter.flush();
        } catch (UncheckedIOException ex) {
            throw new ConversionException(FailureKind.OUTPUT, "Failed to write output: " + ex.getCause().getMessage(), ex);
        }
        return session.usedLanguages;
    }

    private final class Session {
        private final ArticleSource source;
        private final LineFormatter formatter;
        private final String language;
        private final MathInterpreter mathInterpreter = new MathInterpreter();
        private final Set<String> usedLanguages = new LinkedHashSet<>();
        private final boolean hasChapters;
        private final boolean singleItem;

        private Session(Metabook metabook, ArticleSource source, LineFormatter formatter, String language) {
            this.source = source;
            this.formatter = formatter;
            this.language = language;
            this.hasChapters = metabook.hasChapters();
            this.singleItem = metabook.isSingleItem();
            usedLanguages.add(language);
        }

        private void renderItems(List<MetabookItem> items) {
            for (MetabookItem item : items) {
                if (item.isChapter()) {
                    status.report("Formatting chapter", item.title());
                    formatter.writeHeading(0, TextNormalizer.normalize(item.title()));
                    renderItems(item.items());
                } else if (item.isArticle()) {
                    renderArticle(item);
                } else {
                    LOGGER.warn("Skipping collection item '{}' of unknown type {}", item.title(), item.type());
                }
            }
        }

        private void renderArticle(MetabookItem item) {
            MDC.put(MDC_ARTICLE, item.title());
            try {
                status.report("Formatting article", item.title());
                Document document = Jsoup.parse(source.document(item.wikiIndex(), item.revision()));
                String articleLanguage = source.siteLanguage(item.wikiIndex()).orElse(language);
                VisitorOptions visitorOptions = new VisitorOptions(options.noRefs(), singleItem, hasChapters,
                        language, LanguageDirectionality.lookup(language));
                DocumentVisitor visitor = new DocumentVisitor(document, formatter, visitorOptions, mathInterpreter);

                Element heading = document.createElement("h1");
                heading.appendElement("span").attr("lang", articleLanguage).text(item.title());
                visitor.visit(heading);

                Element body = document.body();
                if (body.attr("lang").isEmpty()) {
                    body.attr("lang", articleLanguage);
                }
                visitor.visit(body);
                usedLanguages.addAll(visitor.usedLanguages());

                formatter.paragraphBreak();
                formatter.flush();
            } finally {
                MDC.remove(MDC_ARTICLE);
            }
        }
    }
}
