package ai.docsite.plaintext.bundle;

import java.util.Optional;

/**
 * Read-only key/value record store shipped inside a bundle.
 */
public interface RecordStore extends AutoCloseable {

    Optional<String> get(String key);

    @Override
    void close();
}
