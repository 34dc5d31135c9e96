package ai.docsite.plaintext.math;

import ai.docsite.plaintext.text.ScriptAlphabet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts the LaTeX-like macro notation of math elements into Unicode text.
 *
 * <p>Macros are consumed left to right. Brace or bracket arguments are matched by depth counting
 * over {@code {}[]}, chained arguments ({@code \sqrt[3]{x}}) are collected together, and each
 * argument is interpreted recursively before its macro is applied. Unknown macros are passed
 * through verbatim and reported once per name for the lifetime of the instance.
 */
public class MathInterpreter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MathInterpreter.class);

    private static final Pattern MACRO = Pattern.compile("\\\\([A-Za-z]+|.|)(?:([{\\[])|\\s+)?");
    private static final Pattern CHAINED_ARGUMENT = Pattern.compile("\\s*([{\\[])");
    private static final Map<String, MacroHandler> MACROS = buildMacroTable();

    private final Set<String> unknownMacros = new LinkedHashSet<>();
    private final Set<String> unterminatedMacros = new HashSet<>();

    public String interpret(MathExpression expression) {
        return interpret(expression.body());
    }

    public String interpret(String source) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        StringBuilder result = new StringBuilder(source.length());
        String rest = source;
        while (true) {
            Matcher matcher = MACRO.matcher(rest);
            if (!matcher.find()) {
                break;
            }
            String name = matcher.group(1);
            result.append(applyScripts(rest.substring(0, matcher.start())));
            rest = rest.substring(matcher.end());
            List<MacroArgument> arguments = List.of();
            if (matcher.group(2) != null) {
                ArgumentScan scan = scanArguments(name, rest, matcher.group(2).charAt(0) == '[');
                arguments = scan.arguments();
                rest = scan.remainder();
            }
            result.append(apply(name, arguments));
        }
        return result.append(applyScripts(rest)).toString();
    }

    /**
     * Names of unrecognized macros reported so far, in first-seen order.
     */
    public Set<String> unknownMacros() {
        return Collections.unmodifiableSet(unknownMacros);
    }

    private ArgumentScan scanArguments(String name, String text, boolean bracketed) {
        List<MacroArgument> arguments = new ArrayList<>();
        boolean optional = bracketed;
        int start = 0;
        int position = 0;
        int depth = 1;
        while (true) {
            int next = nextDelimiter(text, position);
            if (next < 0) {
                if (unterminatedMacros.add(name)) {
                    LOGGER.warn("Unterminated argument for math macro \\{}: {}", name, text.substring(start));
                }
                arguments.add(new MacroArgument(interpret(text.substring(start)), optional));
                return new ArgumentScan(arguments, "");
            }
            char delimiter = text.charAt(next);
            if (delimiter == '{' || delimiter == '[') {
                depth++;
            } else if (--depth == 0) {
                arguments.add(new MacroArgument(interpret(text.substring(start, next)), optional));
                Matcher chained = CHAINED_ARGUMENT.matcher(text).region(next + 1, text.length());
                if (!chained.lookingAt()) {
                    return new ArgumentScan(arguments, text.substring(next + 1));
                }
                optional = chained.group(1).charAt(0) == '[';
                start = chained.end();
                position = start;
                depth = 1;
                continue;
            }
            position = next + 1;
        }
    }

    private static int nextDelimiter(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            switch (text.charAt(i)) {
                case '{', '}', '[', ']' -> {
                    return i;
                }
                default -> {
                }
            }
        }
        return -1;
    }

    private String apply(String name, List<MacroArgument> arguments) {
        MacroHandler handler = MACROS.get(name);
        if (handler != null) {
            return handler.apply(arguments);
        }
        if (unknownMacros.add(name)) {
            LOGGER.warn("Unknown math macro: \\{}", name);
        }
        return "\\" + name + arguments.stream()
                .map(argument -> "{" + argument.text() + "}")
                .collect(Collectors.joining()) + " ";
    }

    /**
     * Transliterates {@code _run}/{@code ^run} and {@code _{run}}/{@code ^{run}} when the run is
     * entirely sub/superscript-safe; anything else stays literal.
     */
    static String applyScripts(String text) {
        if (text.indexOf('_') < 0 && text.indexOf('^') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if ((ch == '_' || ch == '^') && i + 1 < text.length()) {
                ScriptAlphabet alphabet = ch == '_' ? ScriptAlphabet.SUBSCRIPT : ScriptAlphabet.SUPERSCRIPT;
                int consumed = transliterateRun(text, i + 1, alphabet, out);
                if (consumed > 0) {
                    i += 1 + consumed;
                    continue;
                }
            }
            out.append(ch);
            i++;
        }
        return out.toString();
    }

    private static int transliterateRun(String text, int from, ScriptAlphabet alphabet, StringBuilder out) {
        if (text.charAt(from) == '{') {
            int close = text.indexOf('}', from + 1);
            if (close < 0) {
                return 0;
            }
            Optional<String> converted = alphabet.transliterate(text.substring(from + 1, close));
            converted.ifPresent(out::append);
            return converted.isPresent() ? close + 1 - from : 0;
        }
        int end = from;
        while (end < text.length() && !Character.isWhitespace(text.charAt(end)) && alphabet.isEligible(text.charAt(end))) {
            end++;
        }
        if (end == from) {
            return 0;
        }
        out.append(alphabet.transliterate(text.substring(from, end)).orElseThrow());
        return end - from;
    }

    private static String squareRoot(List<MacroArgument> arguments) {
        if (arguments.isEmpty()) {
            return "√";
        }
        if (arguments.size() >= 2 && arguments.get(0).optional()) {
            String index = arguments.get(0).text();
            String radicand = arguments.get(1).text();
            return ScriptAlphabet.SUPERSCRIPT.transliterate(index)
                    .map(superscript -> superscript + "√(" + radicand + ")")
                    .orElse("√[" + index + "](" + radicand + ")");
        }
        return "√(" + arguments.get(0).text() + ")";
    }

    private static String firstArgument(List<MacroArgument> arguments) {
        return arguments.isEmpty() ? "" : arguments.get(0).text();
    }

    private static Map<String, MacroHandler> buildMacroTable() {
        Map<String, MacroHandler> table = new HashMap<>();
        symbols(table, "cdot", "·", "cdots", "⋯", "dots", "…", "ldots", "…");

        for (String style : List.of("", "mathbf", "rm", "scriptstyle", "text")) {
            table.put(style, MathInterpreter::firstArgument);
        }
        table.put("sqrt", MathInterpreter::squareRoot);

        symbols(table,
                "alpha", "α", "beta", "β", "gamma", "γ", "delta", "δ",
                "epsilon", "ϵ", "varepsilon", "ε", "zeta", "ζ", "eta", "η",
                "theta", "θ", "vartheta", "ϑ", "iota", "ι", "kappa", "κ",
                "lambda", "λ", "mu", "μ", "nu", "ν", "xi", "ξ",
                "pi", "π", "varpi", "ϖ", "rho", "ρ", "varrho", "ϱ",
                "sigma", "σ", "varsigma", "ς", "tau", "τ", "upsilon", "υ",
                "phi", "ϕ", "varphi", "φ", "chi", "χ", "psi", "ψ", "omega", "ω");
        symbols(table,
                "Gamma", "Γ", "Delta", "Δ", "Theta", "Θ", "Lambda", "Λ",
                "Xi", "Ξ", "Pi", "Π", "Sigma", "Σ", "Upsilon", "Υ",
                "Phi", "Φ", "Psi", "Ψ", "Omega", "Ω");
        symbols(table,
                "approx", "≈", "bigcap", "∩", "bigcup", "∪", "cap", "∩", "cup", "∪",
                "equiv", "≡", "exists", "∃", "forall", "∀", "int", "∫", "sum", "Σ",
                "vee", "∨", "wedge", "∧");
        symbols(table,
                "leftarrow", "←", "gets", "←", "Leftarrow", "⇐",
                "rightarrow", "→", "to", "→", "Rightarrow", "⇒",
                "leftrightarrow", "↔", "Leftrightarrow", "⇔", "mapsto", "↦",
                "hookleftarrow", "↩", "hookrightarrow", "↪",
                "leftharpoonup", "↼", "leftharpoondown", "↽",
                "rightharpoonup", "⇀", "rightharpoondown", "⇁", "rightleftharpoons", "⇌",
                "uparrow", "↑", "Uparrow", "⇑", "downarrow", "↓", "Downarrow", "⇓",
                "updownarrow", "↕", "Updownarrow", "⇕");
        // spacing; \! is a negative space
        symbols(table, " ", " ", "quad", " ", ";", " ", ":", " ", ",", " ", "!", "");
        symbols(table, "$", "$", "&", "&", "{", "{", "}", "}", "\\", "\n");
        return Map.copyOf(table);
    }

    private static void symbols(Map<String, MacroHandler> table, String... pairs) {
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            String symbol = pairs[i + 1];
            table.put(pairs[i], arguments -> symbol);
        }
    }

    private record ArgumentScan(List<MacroArgument> arguments, String remainder) {
    }
}
