package ai.docsite.plaintext.render;

import java.util.Locale;
import java.util.Optional;

/**
 * Text flow direction.
 */
public enum Direction {
    LTR,
    RTL;

    /**
     * Parses a {@code dir} attribute value. {@code auto} and unrecognized values yield empty.
     */
    public static Optional<Direction> fromAttribute(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "ltr" -> Optional.of(LTR);
            case "rtl" -> Optional.of(RTL);
            default -> Optional.empty();
        };
    }

    public String attributeValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
