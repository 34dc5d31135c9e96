package ai.docsite.plaintext.format;

import java.util.Objects;

/**
 * Indentation scope: the indent column and the wrap function derived from it.
 */
record FormatterState(int indent, Wrapper wrapper) {

    FormatterState {
        Objects.requireNonNull(wrapper, "wrapper");
    }
}
