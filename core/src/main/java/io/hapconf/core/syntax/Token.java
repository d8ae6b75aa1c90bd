package io.hapconf.core.syntax;

import io.hapconf.core.model.SourceLocation;
import java.util.Objects;

/**
 * A lexical token.
 *
 * @param type         token kind
 * @param text         token text; for strings the decoded content without quotes
 * @param location     position of the first character
 * @param endLine      line of the last character, for same-line checks
 * @param interpolated {@code true} if the text holds an unescaped {@code ${...}}
 */
public record Token(TokenType type, String text, SourceLocation location, int endLine, boolean interpolated) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    /** Returns {@code true} for a word token with exactly this text. */
    public boolean isWord(String word) {
        return type == TokenType.WORD && text.equals(word);
    }

    public int line() {
        return location.line();
    }

    /** Text as it appears in messages. */
    public String display() {
        if (type == TokenType.EOF) {
            return "<EOF>";
        }
        if (type == TokenType.STRING) {
            return "\"" + text + "\"";
        }
        return text;
    }
}
