package io.hapconf.core.transform;

import io.hapconf.core.model.Value;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Splits interpolated text into literal and {@code ${expr}} segments.
 *
 * <p>
 * Literal segments keep their escapes ({@code \$} and {@code \\}) until {@link #decode} is
 * called, so that text can be re-assembled and interpolated again by a later pass.
 */
final class Interpolation {

    /** One piece of interpolated text. For an expression, {@code text} excludes the braces. */
    record Segment(boolean expression, String text) {}

    private Interpolation() {}

    static boolean hasExpressions(String template) {
        for (Segment s : parse(template)) {
            if (s.expression()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parses {@code template}. An unterminated {@code ${} is kept as literal text.
     */
    static List<Segment> parse(String template) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        int n = template.length();
        while (i < n) {
            char c = template.charAt(i);
            if (c == '\\' && i + 1 < n && (template.charAt(i + 1) == '$' || template.charAt(i + 1) == '\\')) {
                literal.append(c).append(template.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == '$' && i + 1 < n && template.charAt(i + 1) == '{') {
                int end = closingBrace(template, i + 2);
                if (end < 0) {
                    literal.append(template, i, n);
                    break;
                }
                if (literal.length() > 0) {
                    segments.add(new Segment(false, literal.toString()));
                    literal.setLength(0);
                }
                segments.add(new Segment(true, template.substring(i + 2, end).trim()));
                i = end + 1;
                continue;
            }
            literal.append(c);
            i++;
        }
        if (literal.length() > 0) {
            segments.add(new Segment(false, literal.toString()));
        }
        return segments;
    }

    /** Re-assembles segments into template text. */
    static String render(List<Segment> segments) {
        StringBuilder sb = new StringBuilder();
        for (Segment s : segments) {
            if (s.expression()) {
                sb.append("${").append(s.text()).append('}');
            } else {
                sb.append(s.text());
            }
        }
        return sb.toString();
    }

    /**
     * Substitutes expressions in {@code template}. {@code fn} returns the value of an expression, or
     * empty to leave it in place. When nothing is left to interpolate the result is concrete: a
     * template made of a single expression keeps the expression's type, anything else becomes a
     * string.
     */
    static Value apply(String template, Function<String, Optional<Value>> fn) {
        List<Segment> segments = parse(template);
        if (segments.size() == 1 && segments.get(0).expression()) {
            Optional<Value> whole = fn.apply(segments.get(0).text());
            if (whole.isPresent()) {
                return whole.get();
            }
            return new Value.Interpolated(template);
        }
        List<Segment> out = new ArrayList<>(segments.size());
        boolean pending = false;
        for (Segment s : segments) {
            if (!s.expression()) {
                out.add(s);
                continue;
            }
            Optional<Value> v = fn.apply(s.text());
            if (v.isPresent()) {
                out.add(new Segment(false, escape(v.get().asText())));
            } else {
                out.add(s);
                pending = true;
            }
        }
        String text = render(out);
        return pending ? new Value.Interpolated(text) : Value.str(decode(text));
    }

    /** Rewrites the text of every expression, leaving literal text untouched. */
    static String rewriteExpressions(String template, UnaryOperator<String> fn) {
        List<Segment> out = new ArrayList<>();
        for (Segment s : parse(template)) {
            out.add(s.expression() ? new Segment(true, fn.apply(s.text())) : s);
        }
        return render(out);
    }

    /** Like {@link #apply} for names: a fully substituted name is returned decoded. */
    static String applyToName(String name, Function<String, Optional<Value>> fn) {
        if (!name.contains("${")) {
            return name;
        }
        Value v = apply(name, fn);
        return v.asText();
    }

    /** Escapes literal text so that it survives a later {@link #parse}. */
    static String escape(String text) {
        return text.replace("\\", "\\\\").replace("$", "\\$");
    }

    /** Decodes the escapes of fully resolved text. */
    static String decode(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                if (next == '$' || next == '\\') {
                    sb.append(next);
                    i++;
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static int closingBrace(String s, int from) {
        int depth = 1;
        char quote = 0;
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
