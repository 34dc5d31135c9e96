package ai.docsite.plaintext.render;

import java.util.Locale;
import java.util.Set;

/**
 * Default text direction for wiki language codes.
 */
public final class LanguageDirectionality {

    private static final Set<String> RIGHT_TO_LEFT = Set.of(
            "ar", "arc", "arq", "ary", "arz", "azb", "bcc", "bgn", "bqi", "ckb",
            "dv", "fa", "glk", "he", "khw", "ks", "lki", "lrc", "luz", "mzn",
            "nqo", "pnb", "ps", "sd", "sdh", "skr", "syc", "syr", "ug", "ur",
            "yi", "ydd");

    private LanguageDirectionality() {
    }

    public static Direction lookup(String language) {
        if (language == null || language.isBlank()) {
            return Direction.LTR;
        }
        String tag = language.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if (RIGHT_TO_LEFT.contains(tag)) {
            return Direction.RTL;
        }
        int separator = tag.indexOf('-');
        if (separator > 0 && RIGHT_TO_LEFT.contains(tag.substring(0, separator))) {
            return Direction.RTL;
        }
        return Direction.LTR;
    }
}
