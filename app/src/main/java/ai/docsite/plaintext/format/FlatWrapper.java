package ai.docsite.plaintext.format;

import ai.docsite.plaintext.text.TextNormalizer;

/**
 * No-wrap layout: compresses whitespace and prefixes the indent, never breaking the line.
 */
final class FlatWrapper implements Wrapper {

    private final String prefix;

    FlatWrapper(int indent) {
        this.prefix = " ".repeat(Math.max(0, indent));
    }

    @Override
    public String wrap(String text) {
        return prefix + TextNormalizer.collapseWhitespace(text).trim();
    }
}
