package ai.docsite.plaintext.text;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Unicode subscript and superscript transliteration tables.
 *
 * <p>Only a restricted alphabet has Unicode sub/superscript forms. A run is transliterated
 * only when every character is eligible; callers keep the plain text otherwise.
 */
public enum ScriptAlphabet {
    SUBSCRIPT(subscriptTable()),
    SUPERSCRIPT(superscriptTable());

    private final Map<Character, Character> table;

    ScriptAlphabet(Map<Character, Character> table) {
        this.table = Collections.unmodifiableMap(table);
    }

    public boolean isEligible(char ch) {
        return table.containsKey(ch);
    }

    /**
     * Whether {@code text} is non-empty and consists solely of eligible characters.
     */
    public boolean accepts(CharSequence text) {
        if (text == null || text.length() == 0) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!isEligible(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public Optional<String> transliterate(CharSequence text) {
        if (!accepts(text)) {
            return Optional.empty();
        }
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            builder.append(table.get(text.charAt(i)).charValue());
        }
        return Optional.of(builder.toString());
    }

    private static Map<Character, Character> subscriptTable() {
        Map<Character, Character> map = new LinkedHashMap<>();
        for (char digit = '0'; digit <= '9'; digit++) {
            map.put(digit, (char) ('₀' + (digit - '0')));
        }
        map.put('+', '₊');
        map.put('-', '₋');
        map.put('=', '₌');
        map.put('(', '₍');
        map.put(')', '₎');
        map.put('a', 'ₐ');
        map.put('e', 'ₑ');
        map.put('o', 'ₒ');
        map.put('x', 'ₓ');
        map.put('h', 'ₕ');
        map.put('k', 'ₖ');
        map.put('l', 'ₗ');
        map.put('m', 'ₘ');
        map.put('n', 'ₙ');
        map.put('p', 'ₚ');
        map.put('s', 'ₛ');
        map.put('t', 'ₜ');
        map.put(' ', ' ');
        map.put('\u00A0', '\u00A0');
        return map;
    }

    private static Map<Character, Character> superscriptTable() {
        Map<Character, Character> map = new LinkedHashMap<>();
        map.put('0', '⁰');
        map.put('1', '¹');
        map.put('2', '²');
        map.put('3', '³');
        for (char digit = '4'; digit <= '9'; digit++) {
            map.put(digit, (char) ('⁴' + (digit - '4')));
        }
        map.put('i', 'ⁱ');
        map.put('+', '⁺');
        map.put('-', '⁻');
        map.put('=', '⁼');
        map.put('(', '⁽');
        map.put(')', '⁾');
        map.put('n', 'ⁿ');
        map.put(' ', ' ');
        map.put('\u00A0', '\u00A0');
        return map;
    }
}
