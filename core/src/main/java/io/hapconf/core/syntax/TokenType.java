package io.hapconf.core.syntax;

/** Lexical token kinds of the DSL. */
public enum TokenType {
    LBRACE("'{'"),
    RBRACE("'}'"),
    LBRACKET("'['"),
    RBRACKET("']'"),
    LPAREN("'('"),
    RPAREN("')'"),
    COLON("':'"),
    COMMA("','"),
    EQUALS("'='"),
    AT("'@'"),
    RANGE("'..'"),
    STRING("string"),
    NUMBER("number"),
    DURATION("duration"),
    WORD("word"),
    /** Raw body of an inline script, braces excluded. */
    CODE("code block"),
    EOF("end of input");

    private final String description;

    TokenType(String description) {
        this.description = description;
    }

    /** Human-readable name for error messages. */
    public String description() {
        return description;
    }
}
