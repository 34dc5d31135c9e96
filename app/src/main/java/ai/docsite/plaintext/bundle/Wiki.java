package ai.docsite.plaintext.bundle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Source wiki of bundled articles; its base URL keys the site record store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Wiki(@JsonProperty("baseurl") String baseUrl) {
}
