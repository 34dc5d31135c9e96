package ai.docsite.plaintext.bundle;

import ai.docsite.plaintext.convert.ConversionException;
import ai.docsite.plaintext.convert.FailureKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ArticleSource} backed by the bundle's {@code parsoid.db} and {@code siteinfo.db} stores.
 */
public class BundleArticleSource implements ArticleSource {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Metabook metabook;
    private final RecordStore documents;
    private final RecordStore siteInfo;

    public BundleArticleSource(Metabook metabook, RecordStore documents, RecordStore siteInfo) {
        this.metabook = Objects.requireNonNull(metabook, "metabook");
        this.documents = Objects.requireNonNull(documents, "documents");
        this.siteInfo = Objects.requireNonNull(siteInfo, "siteInfo");
    }

    @Override
    public String document(int wiki, String revision) {
        String key = documentKey(wiki, revision);
        return documents.get(key)
                .orElseThrow(() -> new ConversionException(FailureKind.INPUT, "Missing document for revision " + key));
    }

    @Override
    public Optional<String> siteLanguage(int wiki) {
        if (wiki < 0 || wiki >= metabook.wikis().size()) {
            throw new ConversionException(FailureKind.INPUT, "Collection metadata has no wiki #" + wiki);
        }
        String baseUrl = metabook.wikis().get(wiki).baseUrl();
        String raw = siteInfo.get(baseUrl)
                .orElseThrow(() -> new ConversionException(FailureKind.INPUT, "Missing site information for " + baseUrl));
        try {
            JsonNode language = MAPPER.readTree(raw).path("general").path("lang");
            return language.isTextual() && !language.asText().isBlank()
                    ? Optional.of(language.asText())
                    : Optional.empty();
        } catch (JsonProcessingException ex) {
            throw new ConversionException(FailureKind.INPUT, "Malformed site information for " + baseUrl, ex);
        }
    }

    // the first wiki's revisions are stored without a prefix
    static String documentKey(int wiki, String revision) {
        return wiki > 0 ? wiki + "|" + revision : revision;
    }
}
