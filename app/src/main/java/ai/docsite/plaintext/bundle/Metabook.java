package ai.docsite.plaintext.bundle;

import ai.docsite.plaintext.convert.ConversionException;
import ai.docsite.plaintext.convert.FailureKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Collection manifest ({@code metabook.json}) describing the chapters and articles of a bundle.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Metabook(
        String title,
        String subtitle,
        String summary,
        String lang,
        List<MetabookItem> items,
        List<Wiki> wikis
) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public Metabook {
        items = items == null ? List.of() : List.copyOf(items);
        wikis = wikis == null ? List.of() : List.copyOf(wikis);
    }

    public static Metabook read(Path path) {
        try {
            return MAPPER.readValue(path.toFile(), Metabook.class);
        } catch (IOException ex) {
            throw new ConversionException(FailureKind.INPUT, "Failed to read collection metadata: " + path, ex);
        }
    }

    public boolean hasChapters() {
        return items.stream().anyMatch(MetabookItem::isChapter);
    }

    public boolean isSingleItem() {
        return !hasChapters() && items.size() <= 1;
    }

    /**
     * Title to print at the top of the output; a single-article collection without a title of
     * its own borrows the article's.
     */
    public String effectiveTitle() {
        if ((title == null || title.isBlank()) && items.size() == 1) {
            return items.get(0).title();
        }
        return title == null ? "" : title;
    }

    /**
     * Number of nodes in the collection tree, the collection itself included.
     */
    public int countItems() {
        return 1 + items.stream().mapToInt(MetabookItem::countItems).sum();
    }
}
