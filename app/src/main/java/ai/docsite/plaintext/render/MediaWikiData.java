package ai.docsite.plaintext.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import java.util.Set;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the JSON payload Parsoid stores in {@code data-mw} attributes.
 *
 * <p>Malformed payloads are never fatal: they are logged and treated as absent, so the element is
 * rendered as if it carried no special metadata.
 */
final class MediaWikiData {

    private static final Logger LOGGER = LoggerFactory.getLogger(MediaWikiData.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String TRANSCLUSION = "mw:Transclusion";
    static final Set<String> GROUPED_IMAGE_TEMPLATES = Set.of(
            "./Template:Double_image",
            "./Template:Triple_image");

    private MediaWikiData() {
    }

    static Optional<JsonNode> read(Element element) {
        String raw = element.attr("data-mw");
        if (raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readTree(raw));
        } catch (JsonProcessingException ex) {
            LOGGER.debug("Ignoring malformed data-mw on <{}>: {}", element.normalName(), ex.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Whether the element starts a double/triple image template (a table of images with captions).
     */
    static boolean isGroupedImages(Element element) {
        if (!TRANSCLUSION.equals(element.attr("typeof"))) {
            return false;
        }
        return read(element)
                .map(data -> data.path("parts").path(0).path("template").path("target").path("href").asText(""))
                .filter(GROUPED_IMAGE_TEMPLATES::contains)
                .isPresent();
    }

    static Optional<String> mathSource(Element element) {
        return read(element)
                .map(data -> data.path("body").path("extsrc"))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText);
    }
}
