package ai.docsite.plaintext.bundle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.docsite.plaintext.convert.ConversionException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class BundleArticleSourceTest {

    private final MapRecordStore documents = new MapRecordStore();
    private final MapRecordStore siteInfo = new MapRecordStore();
    private final Metabook metabook = new Metabook("T", null, null, "en", List.of(),
            List.of(new Wiki("https://en.wikipedia.org/w"), new Wiki("https://fr.wikipedia.org/w")));
    private final BundleArticleSource source = new BundleArticleSource(metabook, documents, siteInfo);

    @Test
    void prefixesRevisionsOfSecondaryWikis() {
        documents.records.put("42", "<p>en</p>");
        documents.records.put("1|42", "<p>fr</p>");

        assertThat(source.document(0, "42")).isEqualTo("<p>en</p>");
        assertThat(source.document(1, "42")).isEqualTo("<p>fr</p>");
    }

    @Test
    void readsSiteLanguage() {
        siteInfo.records.put("https://fr.wikipedia.org/w", "{\"general\":{\"lang\":\"fr\",\"sitename\":\"Wikipédia\"}}");
        siteInfo.records.put("https://en.wikipedia.org/w", "{\"general\":{}}");

        assertThat(source.siteLanguage(1)).contains("fr");
        assertThat(source.siteLanguage(0)).isEmpty();
    }

    @Test
    void missingRecordsAreInputFailures() {
        assertThatThrownBy(() -> source.document(0, "404"))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("404");
        assertThatThrownBy(() -> source.siteLanguage(0)).isInstanceOf(ConversionException.class);
        assertThatThrownBy(() -> source.siteLanguage(5)).isInstanceOf(ConversionException.class);
    }

    @Test
    void malformedSiteRecordIsAnInputFailure() {
        siteInfo.records.put("https://en.wikipedia.org/w", "{oops");

        assertThatThrownBy(() -> source.siteLanguage(0)).isInstanceOf(ConversionException.class);
    }

    private static final class MapRecordStore implements RecordStore {
        private final Map<String, String> records = new HashMap<>();

        @Override
        public Optional<String> get(String key) {
            return Optional.ofNullable(records.get(key));
        }

        @Override
        public void close() {
        }
    }
}
