package ai.docsite.plaintext.bundle;

import java.util.Optional;

/**
 * Supplies article bodies and site metadata for the items of a collection.
 */
public interface ArticleSource {

    /**
     * HTML body of the given revision. Fails when the record is missing.
     */
    String document(int wiki, String revision);

    /**
     * Default content language of the given wiki, if the site record declares one.
     */
    Optional<String> siteLanguage(int wiki);
}
