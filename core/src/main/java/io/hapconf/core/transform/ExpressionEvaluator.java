package io.hapconf.core.transform;

import io.hapconf.core.model.Value;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates the expression inside {@code ${...}}: variable names, integer and duration literals,
 * quoted strings, parentheses and the operators {@code + - * / %}.
 *
 * <p>
 * Numeric strings (as produced by environment lookups) take part in arithmetic as integers or
 * durations. Adding a non-numeric string concatenates. Durations of different units are
 * converted to the finer unit before adding or subtracting.
 *
 * <p>
 * Stateless and thread-safe.
 */
final class ExpressionEvaluator {

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DURATION = Pattern.compile("(-?\\d+)(us|ms|s|m|h|d)");

    /** Raised for malformed expressions and arithmetic errors. */
    static final class ExpressionException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        ExpressionException(String message) {
            super(message);
        }

        ExpressionException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private enum Kind {
        NUMBER,
        DURATION,
        STRING,
        IDENT,
        OP,
        LPAREN,
        RPAREN
    }

    private record Tok(Kind kind, String text, int start, int end) {}

    private ExpressionEvaluator() {}

    /** Variable names the expression refers to, in order of first appearance. */
    static Set<String> identifiers(String expression) {
        Set<String> names = new LinkedHashSet<>();
        for (Tok t : tokenize(expression)) {
            if (t.kind() == Kind.IDENT) {
                names.add(t.text());
            }
        }
        return names;
    }

    /**
     * Replaces every occurrence of {@code variable} with a literal for {@code value}. Other text is
     * kept byte for byte.
     */
    static String substitute(String expression, String variable, Value value) {
        StringBuilder sb = new StringBuilder();
        int last = 0;
        for (Tok t : tokenize(expression)) {
            if (t.kind() == Kind.IDENT && t.text().equals(variable)) {
                sb.append(expression, last, t.start()).append(literal(value));
                last = t.end();
            }
        }
        sb.append(expression.substring(last));
        return sb.toString();
    }

    /**
     * Evaluates {@code expression}, looking variables up with {@code lookup}.
     *
     * @throws ExpressionException on syntax errors, unknown variables, type errors or division by
     *     zero
     */
    static Value evaluate(String expression, Function<String, Value> lookup) {
        List<Tok> tokens = tokenize(expression);
        if (tokens.isEmpty()) {
            throw new ExpressionException("empty expression");
        }
        Parser p = new Parser(tokens, lookup);
        Value result;
        try {
            result = p.sum();
        } catch (ArithmeticException e) {
            throw new ExpressionException("integer overflow in '" + expression + "'", e);
        }
        if (p.pos < tokens.size()) {
            throw new ExpressionException("unexpected '" + tokens.get(p.pos).text() + "' in '" + expression + "'");
        }
        return result;
    }

    // --- Tokenizer ---

    private static List<Tok> tokenize(String s) {
        List<Tok> tokens = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < s.length() && Character.isDigit(s.charAt(i))) {
                    i++;
                }
                int unitStart = i;
                while (i < s.length() && Character.isLetter(s.charAt(i))) {
                    i++;
                }
                String unit = s.substring(unitStart, i);
                if (unit.isEmpty()) {
                    tokens.add(new Tok(Kind.NUMBER, s.substring(start, i), start, i));
                } else if (Value.Duration.UNITS.contains(unit)) {
                    tokens.add(new Tok(Kind.DURATION, s.substring(start, i), start, i));
                } else {
                    throw new ExpressionException("invalid number '" + s.substring(start, i) + "'");
                }
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Tok(Kind.IDENT, s.substring(start, i), start, i));
            } else if (c == '"' || c == '\'') {
                int start = i;
                int close = s.indexOf(c, i + 1);
                if (close < 0) {
                    throw new ExpressionException("unterminated string in '" + s + "'");
                }
                tokens.add(new Tok(Kind.STRING, s.substring(i + 1, close), start, close + 1));
                i = close + 1;
            } else if ("+-*/%".indexOf(c) >= 0) {
                tokens.add(new Tok(Kind.OP, String.valueOf(c), i, i + 1));
                i++;
            } else if (c == '(') {
                tokens.add(new Tok(Kind.LPAREN, "(", i, i + 1));
                i++;
            } else if (c == ')') {
                tokens.add(new Tok(Kind.RPAREN, ")", i, i + 1));
                i++;
            } else {
                throw new ExpressionException("unexpected character '" + c + "' in '" + s + "'");
            }
        }
        return tokens;
    }

    private static String literal(Value value) {
        Value v = coerce(value);
        if (v instanceof Value.Num n) {
            return n.value() < 0 ? "(" + n.value() + ")" : Long.toString(n.value());
        }
        if (v instanceof Value.Duration d) {
            return d.amount() < 0 ? "(0" + d.unit() + " - " + (-d.amount()) + d.unit() + ")" : d.asText();
        }
        String text = value.asText();
        char quote = text.indexOf('"') >= 0 ? '\'' : '"';
        return quote + text + quote;
    }

    /** Numeric-looking strings become numbers or durations; other values are returned as is. */
    private static Value coerce(Value value) {
        if (value instanceof Value.Str || value instanceof Value.Ident) {
            String text = value.asText().trim();
            if (INTEGER.matcher(text).matches()) {
                try {
                    return Value.num(Long.parseLong(text));
                } catch (NumberFormatException e) {
                    throw new ExpressionException("integer out of range: " + text);
                }
            }
            Matcher m = DURATION.matcher(text);
            if (m.matches()) {
                return new Value.Duration(Long.parseLong(m.group(1)), m.group(2));
            }
        }
        return value;
    }

    // --- Recursive descent ---

    private static final class Parser {
        private final List<Tok> tokens;
        private final Function<String, Value> lookup;
        private int pos;

        Parser(List<Tok> tokens, Function<String, Value> lookup) {
            this.tokens = tokens;
            this.lookup = lookup;
        }

        Value sum() {
            Value left = product();
            while (isOp("+") || isOp("-")) {
                String op = tokens.get(pos++).text();
                Value right = product();
                left = op.equals("+") ? add(left, right) : subtract(left, right);
            }
            return left;
        }

        Value product() {
            Value left = unary();
            while (isOp("*") || isOp("/") || isOp("%")) {
                String op = tokens.get(pos++).text();
                Value right = unary();
                left = multiplicative(op, left, right);
            }
            return left;
        }

        Value unary() {
            if (isOp("-")) {
                pos++;
                Value operand = coerce(unary());
                if (operand instanceof Value.Num n) {
                    return Value.num(Math.negateExact(n.value()));
                }
                if (operand instanceof Value.Duration d) {
                    return new Value.Duration(-d.amount(), d.unit());
                }
                throw new ExpressionException("cannot negate '" + operand.asText() + "'");
            }
            return primary();
        }

        Value primary() {
            if (pos >= tokens.size()) {
                throw new ExpressionException("unexpected end of expression");
            }
            Tok t = tokens.get(pos++);
            switch (t.kind()) {
                case NUMBER:
                    try {
                        return Value.num(Long.parseLong(t.text()));
                    } catch (NumberFormatException e) {
                        throw new ExpressionException("integer out of range: " + t.text());
                    }
                case DURATION: {
                    Matcher m = DURATION.matcher(t.text());
                    if (!m.matches()) {
                        throw new ExpressionException("invalid duration '" + t.text() + "'");
                    }
                    return new Value.Duration(Long.parseLong(m.group(1)), m.group(2));
                }
                case STRING:
                    return Value.str(t.text());
                case IDENT: {
                    Value v = lookup.apply(t.text());
                    if (v == null) {
                        throw new ExpressionException("undefined variable '" + t.text() + "'");
                    }
                    return v;
                }
                case LPAREN: {
                    Value inner = sum();
                    if (pos >= tokens.size() || tokens.get(pos).kind() != Kind.RPAREN) {
                        throw new ExpressionException("missing ')'");
                    }
                    pos++;
                    return inner;
                }
                default:
                    throw new ExpressionException("unexpected '" + t.text() + "'");
            }
        }

        private boolean isOp(String op) {
            return pos < tokens.size() && tokens.get(pos).kind() == Kind.OP && tokens.get(pos).text().equals(op);
        }
    }

    // --- Arithmetic ---

    private static Value add(Value left, Value right) {
        Value l = coerce(left);
        Value r = coerce(right);
        if (l instanceof Value.Num a && r instanceof Value.Num b) {
            return Value.num(Math.addExact(a.value(), b.value()));
        }
        if (l instanceof Value.Duration a && r instanceof Value.Duration b) {
            String unit = finer(a.unit(), b.unit());
            return Value.Duration.ofMicros(Math.addExact(a.toMicros(), b.toMicros()), unit);
        }
        if (isText(l) || isText(r)) {
            return Value.str(left.asText() + right.asText());
        }
        throw new ExpressionException("cannot add '" + left.asText() + "' and '" + right.asText() + "'");
    }

    private static Value subtract(Value left, Value right) {
        Value l = coerce(left);
        Value r = coerce(right);
        if (l instanceof Value.Num a && r instanceof Value.Num b) {
            return Value.num(Math.subtractExact(a.value(), b.value()));
        }
        if (l instanceof Value.Duration a && r instanceof Value.Duration b) {
            String unit = finer(a.unit(), b.unit());
            return Value.Duration.ofMicros(Math.subtractExact(a.toMicros(), b.toMicros()), unit);
        }
        throw new ExpressionException("cannot subtract '" + right.asText() + "' from '" + left.asText() + "'");
    }

    private static Value multiplicative(String op, Value left, Value right) {
        Value l = coerce(left);
        Value r = coerce(right);
        if (l instanceof Value.Num a && r instanceof Value.Num b) {
            switch (op) {
                case "*":
                    return Value.num(Math.multiplyExact(a.value(), b.value()));
                case "/":
                    return Value.num(a.value() / nonZero(b.value()));
                default:
                    return Value.num(a.value() % nonZero(b.value()));
            }
        }
        if (l instanceof Value.Duration d && r instanceof Value.Num n) {
            switch (op) {
                case "*":
                    return new Value.Duration(Math.multiplyExact(d.amount(), n.value()), d.unit());
                case "/":
                    return new Value.Duration(d.amount() / nonZero(n.value()), d.unit());
                default:
                    throw new ExpressionException("cannot take the remainder of a duration");
            }
        }
        if (l instanceof Value.Num n && r instanceof Value.Duration d && op.equals("*")) {
            return new Value.Duration(Math.multiplyExact(n.value(), d.amount()), d.unit());
        }
        throw new ExpressionException(
                "cannot apply '" + op + "' to '" + left.asText() + "' and '" + right.asText() + "'");
    }

    private static long nonZero(long divisor) {
        if (divisor == 0) {
            throw new ExpressionException("division by zero");
        }
        return divisor;
    }

    private static boolean isText(Value v) {
        return v instanceof Value.Str || v instanceof Value.Ident;
    }

    private static String finer(String a, String b) {
        return Value.Duration.microsPerUnit(a) <= Value.Duration.microsPerUnit(b) ? a : b;
    }
}
