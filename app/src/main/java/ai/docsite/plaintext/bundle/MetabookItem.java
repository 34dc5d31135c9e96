package ai.docsite.plaintext.bundle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * A chapter (title plus nested items) or an article (title, revision and owning wiki index).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetabookItem(String type, String title, String revision, Integer wiki, List<MetabookItem> items) {

    public static final String CHAPTER = "chapter";
    public static final String ARTICLE = "article";

    public MetabookItem {
        title = title == null ? "" : title;
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static MetabookItem article(String title, String revision, int wiki) {
        return new MetabookItem(ARTICLE, title, revision, wiki, List.of());
    }

    public static MetabookItem chapter(String title, List<MetabookItem> items) {
        return new MetabookItem(CHAPTER, title, null, null, items);
    }

    public boolean isChapter() {
        return CHAPTER.equals(type);
    }

    public boolean isArticle() {
        return ARTICLE.equals(type);
    }

    public int wikiIndex() {
        return wiki == null ? 0 : wiki;
    }

    int countItems() {
        return 1 + items.stream().mapToInt(MetabookItem::countItems).sum();
    }
}
