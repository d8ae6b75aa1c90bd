package io.hapconf.core.syntax;

import io.hapconf.core.error.ParseException;
import io.hapconf.core.model.SourceLocation;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits DSL source into {@link Token}s.
 *
 * <p>
 * Tokenization is context sensitive in three places, each resolved by a fixed rule:
 * <ul>
 * <li>After the word {@code bind} and a blank, the next run of non-blank characters is one
 * address word ({@code *:80}, {@code :::443}), so the colon does not end it.
 * <li>After {@code inline NAME}, a brace-delimited body is one {@link TokenType#CODE} token.
 * <li>A run of digits is a number when followed by {@code ..}, a word when followed by
 * {@code .digit} (addresses, versions) or by letters other than a duration unit, and a duration
 * when followed by a unit alone.
 * </ul>
 *
 * <p>
 * Comments ({@code //}, {@code #} and {@code /* ... *&#47;}) are skipped.
 */
public final class Lexer {

    private static final String[] UNITS = {"us", "ms", "s", "m", "h", "d"};

    private final String src;
    private final String sourceName;
    private final List<Token> tokens = new ArrayList<>();

    private int pos;
    private int line = 1;
    private int col = 1;
    private boolean rawAddressNext;

    private Lexer(String src, String sourceName) {
        this.src = src;
        this.sourceName = sourceName;
    }

    /**
     * Tokenizes {@code source}. The returned list always ends with an {@link TokenType#EOF} token.
     *
     * @throws ParseException on an unterminated string, comment or block, or a stray character
     */
    public static List<Token> tokenize(String source, String sourceName) {
        Lexer lexer = new Lexer(source, sourceName);
        lexer.run();
        return lexer.tokens;
    }

    private void run() {
        while (true) {
            skipBlanksAndComments();
            if (pos >= src.length()) {
                tokens.add(new Token(TokenType.EOF, "", here(), line, false));
                return;
            }
            char c = src.charAt(pos);
            if (rawAddressNext) {
                rawAddressNext = false;
                if (c != '"' && c != '\'' && c != '{' && c != '\n') {
                    readRawAddress();
                    continue;
                }
            }
            if (c == '{' && followsInlineHeader()) {
                readCode();
                continue;
            }
            switch (c) {
                case '{':
                    single(TokenType.LBRACE);
                    break;
                case '}':
                    single(TokenType.RBRACE);
                    break;
                case '[':
                    single(TokenType.LBRACKET);
                    break;
                case ']':
                    single(TokenType.RBRACKET);
                    break;
                case '(':
                    single(TokenType.LPAREN);
                    break;
                case ')':
                    single(TokenType.RPAREN);
                    break;
                case ':':
                    single(TokenType.COLON);
                    break;
                case ',':
                    single(TokenType.COMMA);
                    break;
                case '=':
                    single(TokenType.EQUALS);
                    break;
                case '@':
                    single(TokenType.AT);
                    break;
                case '"':
                    readDoubleQuoted();
                    break;
                case '\'':
                    readSingleQuoted();
                    break;
                default:
                    readOther(c);
            }
        }
    }

    private void readOther(char c) {
        if (c == '.' && peek(1) == '.') {
            SourceLocation start = here();
            advance();
            advance();
            tokens.add(new Token(TokenType.RANGE, "..", start, line, false));
            return;
        }
        if (isDigit(c) || (c == '-' && isDigit(peek(1)))) {
            readNumberOrWord();
            return;
        }
        if (isWordStart(c)) {
            readWord(pos, here());
            return;
        }
        throw new ParseException(
                String.format("Unexpected character '%s' at %d:%d", c, line, col), String.valueOf(c), here());
    }

    // --- Numbers and words ---

    private void readNumberOrWord() {
        SourceLocation start = here();
        int begin = pos;
        if (src.charAt(pos) == '-') {
            advance();
        }
        while (pos < src.length() && isDigit(src.charAt(pos))) {
            advance();
        }
        char next = peek(0);
        if (next == '.' && peek(1) == '.') {
            tokens.add(new Token(TokenType.NUMBER, src.substring(begin, pos), start, line, false));
            return;
        }
        if (next == '.' && isDigit(peek(1))) {
            readWord(begin, start);
            return;
        }
        for (String unit : UNITS) {
            if (src.startsWith(unit, pos) && !isWordChar(peek(unit.length()))) {
                String number = src.substring(begin, pos);
                for (int i = 0; i < unit.length(); i++) {
                    advance();
                }
                tokens.add(new Token(TokenType.DURATION, number + unit, start, line, false));
                return;
            }
        }
        if (isWordChar(next)) {
            readWord(begin, start);
            return;
        }
        tokens.add(new Token(TokenType.NUMBER, src.substring(begin, pos), start, line, false));
    }

    /** Reads a word starting at {@code begin}; characters before {@code pos} are already consumed. */
    private void readWord(int begin, SourceLocation start) {
        boolean interpolated = false;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '$' && peek(1) == '{') {
                interpolated = true;
                consumeBalanced('{', '}');
            } else if (c == '%' && peek(1) == '[') {
                advance();
                consumeBalanced('[', ']');
            } else if (c == '(') {
                if (pos - begin == 3 && src.startsWith("env", begin)) {
                    break;
                }
                consumeBalanced('(', ')');
            } else if (c == '.' && peek(1) == '.') {
                break;
            } else if (isWordChar(c)) {
                advance();
            } else {
                break;
            }
        }
        String text = src.substring(begin, pos);
        tokens.add(new Token(TokenType.WORD, text, start, line, interpolated));
        if (text.equals("bind") && (peek(0) == ' ' || peek(0) == '\t')) {
            rawAddressNext = true;
        }
    }

    private void readRawAddress() {
        SourceLocation start = here();
        int begin = pos;
        boolean interpolated = false;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '$' && peek(1) == '{') {
                interpolated = true;
                consumeBalanced('{', '}');
            } else if (Character.isWhitespace(c) || c == '{' || c == '}') {
                break;
            } else {
                advance();
            }
        }
        tokens.add(new Token(TokenType.WORD, src.substring(begin, pos), start, line, interpolated));
    }

    private void consumeBalanced(char open, char close) {
        SourceLocation start = here();
        int depth = 0;
        // the opening character is at pos, or at pos + 1 after a '$'
        if (src.charAt(pos) != open) {
            advance();
        }
        do {
            if (pos >= src.length() || src.charAt(pos) == '\n') {
                throw new ParseException(
                        String.format("Unterminated '%s' starting at %d:%d", open, start.line(), start.column()),
                        String.valueOf(open),
                        start);
            }
            char c = src.charAt(pos);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
            }
            advance();
        } while (depth > 0);
    }

    // --- Strings ---

    private void readDoubleQuoted() {
        SourceLocation start = here();
        advance();
        StringBuilder decoded = new StringBuilder();
        StringBuilder raw = new StringBuilder();
        boolean interpolated = false;
        while (true) {
            if (pos >= src.length()) {
                throw new ParseException(
                        String.format("Unterminated string starting at %d:%d", start.line(), start.column()),
                        "\"",
                        start);
            }
            char c = src.charAt(pos);
            if (c == '"') {
                advance();
                break;
            }
            if (c == '\\') {
                char e = peek(1);
                advance();
                advance();
                switch (e) {
                    case 'n':
                        decoded.append('\n');
                        raw.append('\n');
                        break;
                    case 't':
                        decoded.append('\t');
                        raw.append('\t');
                        break;
                    case 'r':
                        decoded.append('\r');
                        raw.append('\r');
                        break;
                    case '"':
                        decoded.append('"');
                        raw.append('"');
                        break;
                    case '\\':
                        decoded.append('\\');
                        raw.append("\\\\");
                        break;
                    case '$':
                        decoded.append('$');
                        raw.append("\\$");
                        break;
                    default:
                        // unknown escapes are kept verbatim, as regexes in ACLs rely on them
                        decoded.append('\\').append(e);
                        raw.append('\\').append('\\').append(e);
                }
                continue;
            }
            if (c == '$' && peek(1) == '{') {
                interpolated = true;
            }
            decoded.append(c);
            raw.append(c);
            advance();
        }
        String text = interpolated ? raw.toString() : decoded.toString();
        tokens.add(new Token(TokenType.STRING, text, start, line, interpolated));
    }

    private void readSingleQuoted() {
        SourceLocation start = here();
        advance();
        StringBuilder text = new StringBuilder();
        while (true) {
            if (pos >= src.length()) {
                throw new ParseException(
                        String.format("Unterminated string starting at %d:%d", start.line(), start.column()),
                        "'",
                        start);
            }
            char c = src.charAt(pos);
            if (c == '\'') {
                advance();
                break;
            }
            if (c == '\\' && peek(1) == '\'') {
                advance();
                c = '\'';
            }
            text.append(c);
            advance();
        }
        tokens.add(new Token(TokenType.STRING, text.toString(), start, line, false));
    }

    // --- Inline code ---

    private boolean followsInlineHeader() {
        int n = tokens.size();
        return n >= 2
                && tokens.get(n - 2).isWord("inline")
                && (tokens.get(n - 1).is(TokenType.WORD) || tokens.get(n - 1).is(TokenType.STRING));
    }

    private void readCode() {
        SourceLocation start = here();
        advance();
        int begin = pos;
        int depth = 1;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '"' || c == '\'') {
                skipLuaString(c);
                continue;
            }
            if (c == '-' && peek(1) == '-') {
                while (pos < src.length() && src.charAt(pos) != '\n') {
                    advance();
                }
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    String body = src.substring(begin, pos);
                    advance();
                    tokens.add(new Token(TokenType.CODE, body, start, line, false));
                    return;
                }
            }
            advance();
        }
        throw new ParseException(
                String.format("Unterminated inline code block starting at %d:%d", start.line(), start.column()),
                "{",
                start);
    }

    private void skipLuaString(char quote) {
        advance();
        while (pos < src.length() && src.charAt(pos) != quote) {
            if (src.charAt(pos) == '\\') {
                advance();
            }
            advance();
        }
        advance();
    }

    // --- Whitespace and comments ---

    private void skipBlanksAndComments() {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (Character.isWhitespace(c)) {
                if (c == '\n') {
                    rawAddressNext = false;
                }
                advance();
            } else if (c == '#' || (c == '/' && peek(1) == '/')) {
                while (pos < src.length() && src.charAt(pos) != '\n') {
                    advance();
                }
            } else if (c == '/' && peek(1) == '*') {
                SourceLocation start = here();
                advance();
                advance();
                while (!(peek(0) == '*' && peek(1) == '/')) {
                    if (pos >= src.length()) {
                        throw new ParseException(
                                String.format(
                                        "Unterminated comment starting at %d:%d", start.line(), start.column()),
                                "/*",
                                start);
                    }
                    advance();
                }
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    // --- Character helpers ---

    private void single(TokenType type) {
        SourceLocation start = here();
        String text = String.valueOf(src.charAt(pos));
        advance();
        tokens.add(new Token(type, text, start, line, false));
    }

    private void advance() {
        if (pos >= src.length()) {
            return;
        }
        if (src.charAt(pos) == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        pos++;
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < src.length() ? src.charAt(i) : '\0';
    }

    private SourceLocation here() {
        return new SourceLocation(sourceName, line, col);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c)
                || c == '_'
                || c == '.'
                || c == '/'
                || c == '*'
                || c == '%'
                || c == '!'
                || c == '~'
                || c == '^'
                || c == '|'
                || c == '$'
                || c == '-';
    }

    private static boolean isWordChar(char c) {
        return isWordStart(c) || isDigit(c) || c == '?' || c == '&' || c == '+';
    }
}
