package com.mathide.core.parser;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * ExpressionRepair - fixes math-notation commands that the model emitted with a single
 * backslash inside JSON string literals.
 *
 * Models write {@code "\sin(x)"} where JSON needs {@code "\\sin(x)"}. Only commands from
 * {@link #COMMANDS} are touched, only inside string literals, and only when they are not
 * already doubly escaped. Structural JSON outside strings is copied unchanged.
 *
 * Per literal the rewrite is two-pass:
 *   1. mask every already-correct {@code \\cmd} behind a private-use placeholder
 *   2. rewrite single-escaped {@code \cmd} to {@code \\cmd}
 *   3. restore the placeholders
 *
 * The transformation is idempotent: repair(repair(x)) equals repair(x).
 */
public final class ExpressionRepair {

    /** Known command names. A command matches only when not followed by another letter. */
    public static final Set<String> COMMANDS = Set.of(
            // trigonometric and hyperbolic
            "sin", "cos", "tan", "cot", "sec", "csc",
            "arcsin", "arccos", "arctan", "arccot", "arcsec", "arccsc",
            "sinh", "cosh", "tanh", "coth", "sech", "csch",
            // logarithms, limits, extrema
            "log", "ln", "lg", "exp", "lim", "inf", "infty", "sup", "max", "min", "det", "gcd", "deg",
            // roots and fractions
            "sqrt", "cbrt", "frac", "dfrac", "tfrac", "over", "binom", "choose",
            // operators and relations
            "pm", "mp", "times", "div", "cdot", "ast", "leq", "geq", "neq", "le", "ge", "ne",
            "approx", "equiv", "propto", "sim", "cong",
            // sets and quantifiers
            "in", "notin", "subset", "subseteq", "supset", "cup", "cap", "emptyset",
            "forall", "exists", "setminus",
            // greek letters
            "alpha", "beta", "gamma", "delta", "epsilon", "varepsilon", "theta", "lambda",
            "mu", "pi", "rho", "sigma", "tau", "phi", "varphi", "omega",
            "Delta", "Sigma", "Omega"
    );

    // Longest names first so alternation prefers "sinh" over "sin".
    private static final String ALTERNATION = COMMANDS.stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .collect(Collectors.joining("|"));

    private static final Pattern DOUBLE_ESCAPED =
            Pattern.compile("\\\\\\\\(" + ALTERNATION + ")(?![a-zA-Z])");

    private static final Pattern SINGLE_ESCAPED =
            Pattern.compile("(?<!\\\\)\\\\(" + ALTERNATION + ")(?![a-zA-Z])");

    private static final char MARKER_OPEN  = '\uE000';
    private static final char MARKER_CLOSE = '\uE001';

    private ExpressionRepair() {}

    /**
     * Re-escape known commands inside every JSON string literal of {@code json}.
     *
     * @param json text presumed to contain JSON; null is returned as-is
     * @return repaired text with the same structure
     */
    public static String repair(String json) {
        if (json == null || json.indexOf('\\') < 0) {
            return json;
        }

        StringBuilder out = new StringBuilder(json.length() + 16);
        boolean inString    = false;
        int     stringStart = -1;

        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);

            if (c == '"' && !isEscaped(json, i)) {
                if (!inString) {
                    inString    = true;
                    stringStart = i;
                } else {
                    inString = false;
                    out.append('"')
                       .append(repairLiteral(json.substring(stringStart + 1, i)))
                       .append('"');
                }
            } else if (!inString) {
                out.append(c);
            }
        }

        // Unterminated literal: keep the tail verbatim rather than dropping it.
        if (inString) {
            out.append(json, stringStart, json.length());
        }

        return out.toString();
    }

    /** Rewrite one string literal's inner content. */
    static String repairLiteral(String content) {
        if (content.indexOf('\\') < 0) {
            return content;
        }

        // Pass 1: mask already-correct occurrences.
        Map<String, String> masked  = new LinkedHashMap<>();
        Matcher             doubled = DOUBLE_ESCAPED.matcher(content);
        StringBuilder       buffer  = new StringBuilder();
        while (doubled.find()) {
            String marker = MARKER_OPEN + Integer.toString(masked.size()) + MARKER_CLOSE;
            masked.put(marker, doubled.group());
            doubled.appendReplacement(buffer, Matcher.quoteReplacement(marker));
        }
        doubled.appendTail(buffer);

        // Pass 2: double the single escapes that remain.
        String rewritten = SINGLE_ESCAPED.matcher(buffer.toString())
                .replaceAll(m -> Matcher.quoteReplacement("\\\\" + m.group(1)));

        // Restore.
        for (Map.Entry<String, String> e : masked.entrySet()) {
            rewritten = rewritten.replace(e.getKey(), e.getValue());
        }
        return rewritten;
    }

    /** A quote is escaped when preceded by an odd run of backslashes. */
    private static boolean isEscaped(String text, int index) {
        int backslashes = 0;
        for (int j = index - 1; j >= 0 && text.charAt(j) == '\\'; j--) {
            backslashes++;
        }
        return (backslashes & 1) == 1;
    }
}
