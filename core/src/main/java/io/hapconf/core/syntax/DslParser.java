package io.hapconf.core.syntax;

import io.hapconf.core.error.ParseException;
import io.hapconf.core.model.SourceLocation;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser from DSL tokens to a {@link SyntaxNode} tree.
 *
 * <p>
 * Inside a block body, where several constructs may start with the same word, alternatives are
 * tried in a fixed order:
 * <ol>
 * <li>{@code @name} template spread
 * <li>{@code key: value...} property (a word directly followed by a colon)
 * <li>{@code for VAR in ...} loop
 * <li>reserved block keywords ({@code bind}, {@code acl}, {@code servers}, {@code server},
 * {@code server-template}, {@code health-check}, {@code stick-table}, {@code http-request},
 * {@code http-response}, {@code route}, {@code use_backend}, {@code lua})
 * <li>{@code name { ... }} nested property block, when the brace is on the same line
 * <li>bare directive consuming the rest of the line
 * </ol>
 *
 * <p>
 * Property values continue to the end of the line or up to the next {@code key:} pair, so
 * several properties may share a line. The first syntax error aborts parsing; there is no
 * recovery.
 */
public final class DslParser {

    private static final Set<String> SECTION_WORDS = Set.of("global", "defaults", "frontend", "backend", "listen");

    private final List<Token> tokens;
    private int pos;

    private DslParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a complete {@code config NAME { ... }} document.
     *
     * @param source     DSL source text
     * @param sourceName name used in locations, typically the file name
     * @return the root {@code config} node
     * @throws ParseException on the first syntax error
     */
    public static SyntaxNode parse(String source, String sourceName) {
        DslParser parser = new DslParser(Lexer.tokenize(source, sourceName));
        return parser.document();
    }

    // --- Document level ---

    private SyntaxNode document() {
        Token head = peek();
        if (head.is(TokenType.EOF)) {
            throw error("Empty source: expected 'config NAME { ... }'", head);
        }
        expectWord("config");
        Token name = expectName("config name");
        expect(TokenType.LBRACE);
        List<SyntaxNode> items = new ArrayList<>();
        while (!peek().is(TokenType.RBRACE)) {
            if (peek().is(TokenType.EOF)) {
                throw error("Unexpected end of input: missing '}' to close config '" + name.text() + "'", peek());
            }
            items.add(configItem());
        }
        expect(TokenType.RBRACE);
        if (!peek().is(TokenType.EOF)) {
            throw error("Unexpected '" + peek().display() + "' after the end of config", peek());
        }
        return new SyntaxNode("config", name, items, head.location());
    }

    private SyntaxNode configItem() {
        Token t = peek();
        if (t.is(TokenType.WORD) && peekAt(1).is(TokenType.COLON)) {
            return property();
        }
        if (!t.is(TokenType.WORD)) {
            throw error("Unexpected " + t.type().description() + " '" + t.display() + "' in config body", t);
        }
        switch (t.text()) {
            case "let":
                return let();
            case "template":
                return namedBlock("template");
            case "global":
            case "defaults":
                advance();
                return new SyntaxNode(t.text(), t, block(), t.location());
            case "frontend":
            case "backend":
            case "listen":
                return namedBlock(t.text());
            case "lua":
                return lua();
            case "for":
                return loop(true);
            default:
                throw error(
                        "Unexpected '" + t.text()
                                + "' in config body; expected let, template, global, defaults, frontend, backend,"
                                + " listen, lua or for",
                        t);
        }
    }

    private SyntaxNode let() {
        Token let = advance();
        Token name = expect(TokenType.WORD);
        expect(TokenType.EQUALS);
        SyntaxNode value = value();
        return new SyntaxNode("let", name, List.of(value), let.location());
    }

    private SyntaxNode namedBlock(String rule) {
        Token keyword = advance();
        Token name = expectName(rule + " name");
        return new SyntaxNode(rule, name, block(), keyword.location());
    }

    // --- Block bodies ---

    /** Parses {@code { item* }} and returns the items. */
    private List<SyntaxNode> block() {
        Token open = expect(TokenType.LBRACE);
        List<SyntaxNode> items = new ArrayList<>();
        while (!peek().is(TokenType.RBRACE)) {
            if (peek().is(TokenType.EOF)) {
                throw error(
                        String.format(
                                "Unexpected end of input: block opened at %d:%d is not closed",
                                open.line(),
                                open.location().column()),
                        peek());
            }
            items.add(bodyItem());
        }
        expect(TokenType.RBRACE);
        return items;
    }

    private SyntaxNode bodyItem() {
        Token t = peek();
        if (t.is(TokenType.AT)) {
            return spread();
        }
        if (t.is(TokenType.WORD) && peekAt(1).is(TokenType.COLON)) {
            return property();
        }
        if (!t.is(TokenType.WORD)) {
            throw error("Unexpected " + t.type().description() + " '" + t.display() + "'", t);
        }
        if (t.text().equals("for") && peekAt(2).isWord("in")) {
            return loop(false);
        }
        switch (t.text()) {
            case "bind":
                return bind();
            case "acl":
                return acl();
            case "servers":
                advance();
                return new SyntaxNode("servers", t, block(), t.location());
            case "server":
                return server();
            case "server-template":
            case "server_template":
                return serverTemplate();
            case "health-check":
            case "health_check":
                advance();
                return new SyntaxNode("health_check", t, block(), t.location());
            case "stick-table":
            case "stick_table":
                advance();
                return new SyntaxNode("stick_table", t, inlineOrBlock(t), t.location());
            case "http-request":
            case "http_request":
                return httpRules("http_request");
            case "http-response":
            case "http_response":
                return httpRules("http_response");
            case "route":
                return route();
            case "use_backend":
            case "use-backend":
                return useBackend();
            case "lua":
                return lua();
            default:
                break;
        }
        if (SECTION_WORDS.contains(t.text()) || t.text().equals("template") || t.text().equals("let")) {
            throw error("'" + t.text() + "' is only allowed at the top level of a config", t);
        }
        if (peekAt(1).is(TokenType.LBRACE) && peekAt(1).line() == t.line()) {
            advance();
            return new SyntaxNode("block", t, block(), t.location());
        }
        return directive();
    }

    private SyntaxNode spread() {
        Token at = advance();
        Token name = expect(TokenType.WORD);
        if (name.location().column() != at.location().column() + 1 || name.line() != at.line()) {
            throw error("Template spread must be written '@name' without spaces", name);
        }
        return new SyntaxNode("spread", name, List.of(), at.location());
    }

    private SyntaxNode property() {
        Token key = advance();
        expect(TokenType.COLON);
        List<SyntaxNode> values = new ArrayList<>();
        values.add(value());
        while (continuesLine() && !startsProperty() && !peek().is(TokenType.AT) && !peek().is(TokenType.RBRACE)) {
            values.add(value());
        }
        return new SyntaxNode("property", key, values, key.location());
    }

    private SyntaxNode loop(boolean topLevel) {
        Token keyword = advance();
        Token variable = expect(TokenType.WORD);
        expectWord("in");
        SyntaxNode iteration = value();
        if (!iteration.is("range") && !iteration.is("list")) {
            throw error("Loop must iterate over a range 'a..b' or a list '[...]'", keyword);
        }
        Token open = expect(TokenType.LBRACE);
        List<SyntaxNode> children = new ArrayList<>();
        children.add(iteration);
        while (!peek().is(TokenType.RBRACE)) {
            if (peek().is(TokenType.EOF)) {
                throw error(
                        String.format(
                                "Unexpected end of input: loop body opened at %d:%d is not closed",
                                open.line(),
                                open.location().column()),
                        peek());
            }
            children.add(topLevel ? configItem() : bodyItem());
        }
        expect(TokenType.RBRACE);
        return new SyntaxNode("for", variable, children, keyword.location());
    }

    // --- Reserved constructs ---

    private SyntaxNode bind() {
        Token keyword = advance();
        Token address = peek();
        if (!address.is(TokenType.WORD) && !address.is(TokenType.STRING)) {
            throw error("Expected a bind address after 'bind'", address);
        }
        advance();
        List<SyntaxNode> children = new ArrayList<>();
        String rule = address.is(TokenType.STRING) ? (address.interpolated() ? "istring" : "string") : "ident";
        children.add(SyntaxNode.leaf(rule, address));
        while (continuesLine() && !peek().is(TokenType.RBRACE)) {
            if (peek().is(TokenType.LBRACE)) {
                children.addAll(block());
                break;
            }
            if (startsProperty()) {
                children.add(property());
            } else {
                Token flag = expect(TokenType.WORD);
                if (continuesLine() && (peek().is(TokenType.STRING) || peek().is(TokenType.NUMBER))) {
                    children.add(new SyntaxNode("property", flag, List.of(value()), flag.location()));
                } else {
                    children.add(SyntaxNode.leaf("flag", flag));
                }
            }
        }
        return new SyntaxNode("bind", keyword, children, keyword.location());
    }

    private SyntaxNode acl() {
        Token keyword = advance();
        Token name = expect(TokenType.WORD);
        List<SyntaxNode> parts = new ArrayList<>();
        if (peek().is(TokenType.LBRACE)) {
            Token open = advance();
            while (!peek().is(TokenType.RBRACE)) {
                if (peek().is(TokenType.EOF)) {
                    throw error(
                            String.format("Unexpected end of input: acl block opened at %d:%d is not closed",
                                    open.line(), open.location().column()),
                            peek());
                }
                parts.add(value());
            }
            expect(TokenType.RBRACE);
        } else {
            while (continuesLine() && !peek().is(TokenType.RBRACE)) {
                parts.add(value());
            }
        }
        if (parts.isEmpty()) {
            throw error("ACL '" + name.text() + "' needs a criterion", name);
        }
        return new SyntaxNode("acl", name, parts, keyword.location());
    }

    private SyntaxNode server() {
        Token keyword = advance();
        Token name = expectName("server name");
        return new SyntaxNode("server", name, inlineOrBlock(name), keyword.location());
    }

    private SyntaxNode serverTemplate() {
        Token keyword = advance();
        Token prefix = expectName("server-template prefix");
        List<SyntaxNode> children = new ArrayList<>();
        children.add(value());
        children.addAll(inlineOrBlock(prefix));
        return new SyntaxNode("server_template", prefix, children, keyword.location());
    }

    /** A {@code { ... }} block, or properties and spreads on the remainder of the current line. */
    private List<SyntaxNode> inlineOrBlock(Token owner) {
        if (peek().is(TokenType.LBRACE)) {
            return block();
        }
        List<SyntaxNode> items = new ArrayList<>();
        while (continuesLine() && !peek().is(TokenType.RBRACE)) {
            if (peek().is(TokenType.AT)) {
                items.add(spread());
            } else if (startsProperty()) {
                items.add(property());
            } else {
                throw error("Expected '{' or 'key: value' after '" + owner.text() + "'", peek());
            }
        }
        return items;
    }

    private SyntaxNode httpRules(String rule) {
        Token keyword = advance();
        List<SyntaxNode> rules = new ArrayList<>();
        if (peek().is(TokenType.LBRACE)) {
            advance();
            while (!peek().is(TokenType.RBRACE)) {
                if (peek().is(TokenType.EOF)) {
                    throw error("Unexpected end of input in '" + keyword.text() + "' block", peek());
                }
                rules.add(httpRule());
            }
            expect(TokenType.RBRACE);
        } else {
            if (!continuesLine()) {
                throw error("Expected a rule or '{' after '" + keyword.text() + "'", peek());
            }
            rules.add(httpRule());
        }
        return new SyntaxNode(rule, keyword, rules, keyword.location());
    }

    private SyntaxNode httpRule() {
        Token action = expect(TokenType.WORD);
        List<SyntaxNode> parts = new ArrayList<>();
        while (continuesLine() && !peek().is(TokenType.RBRACE)) {
            Token t = peek();
            if (t.isWord("if") || t.isWord("unless")) {
                parts.add(condition());
                break;
            }
            if (startsProperty()) {
                Token key = advance();
                advance();
                parts.add(new SyntaxNode("param", key, List.of(value()), key.location()));
            } else {
                parts.add(value());
            }
        }
        return new SyntaxNode("rule", action, parts, action.location());
    }

    private SyntaxNode route() {
        Token keyword = advance();
        Token open = expect(TokenType.LBRACE);
        List<SyntaxNode> entries = new ArrayList<>();
        while (!peek().is(TokenType.RBRACE)) {
            Token t = peek();
            if (t.is(TokenType.EOF)) {
                throw error(
                        String.format("Unexpected end of input: route block opened at %d:%d is not closed",
                                open.line(), open.location().column()),
                        t);
            }
            if (t.isWord("to")) {
                advance();
                Token backend = expectName("backend name");
                List<SyntaxNode> children = new ArrayList<>();
                if (continuesLine() && (peek().isWord("if") || peek().isWord("unless"))) {
                    children.add(condition());
                }
                entries.add(new SyntaxNode("to", backend, children, t.location()));
            } else if (t.isWord("default") && peekAt(1).is(TokenType.COLON)) {
                entries.add(property());
            } else {
                throw error("Expected 'to BACKEND [if|unless COND]' or 'default: BACKEND' in route", t);
            }
        }
        expect(TokenType.RBRACE);
        return new SyntaxNode("route", keyword, entries, keyword.location());
    }

    private SyntaxNode useBackend() {
        Token keyword = advance();
        Token backend = expectName("backend name");
        List<SyntaxNode> children = new ArrayList<>();
        if (continuesLine() && (peek().isWord("if") || peek().isWord("unless"))) {
            children.add(condition());
        }
        return new SyntaxNode("use_backend", backend, children, keyword.location());
    }

    /** {@code if|unless term...} up to the end of the line or an unbalanced closing brace. */
    private SyntaxNode condition() {
        Token keyword = advance();
        List<SyntaxNode> terms = new ArrayList<>();
        int depth = 0;
        while (continuesLine()) {
            Token t = peek();
            if (t.is(TokenType.RBRACE)) {
                if (depth == 0) {
                    break;
                }
                depth--;
            } else if (t.is(TokenType.LBRACE)) {
                depth++;
            }
            advance();
            terms.add(SyntaxNode.leaf("term", t));
        }
        if (terms.isEmpty()) {
            throw error("Condition '" + keyword.text() + "' needs at least one term", keyword);
        }
        return new SyntaxNode("condition", keyword, terms, keyword.location());
    }

    private SyntaxNode lua() {
        Token keyword = advance();
        Token open = expect(TokenType.LBRACE);
        List<SyntaxNode> scripts = new ArrayList<>();
        while (!peek().is(TokenType.RBRACE)) {
            Token t = peek();
            if (t.is(TokenType.EOF)) {
                throw error(
                        String.format("Unexpected end of input: lua block opened at %d:%d is not closed",
                                open.line(), open.location().column()),
                        t);
            }
            if (t.isWord("inline")) {
                advance();
                Token name = expectName("script name");
                Token code = expect(TokenType.CODE);
                scripts.add(new SyntaxNode("inline", name, List.of(SyntaxNode.leaf("code", code)), t.location()));
            } else if (t.isWord("load")) {
                advance();
                Token path = expect(TokenType.STRING);
                scripts.add(new SyntaxNode("load", path, List.of(), t.location()));
            } else {
                throw error("Expected 'inline NAME { ... }' or 'load \"path\"' in lua block", t);
            }
        }
        expect(TokenType.RBRACE);
        return new SyntaxNode("lua", keyword, scripts, keyword.location());
    }

    private SyntaxNode directive() {
        Token name = advance();
        List<SyntaxNode> args = new ArrayList<>();
        while (continuesLine() && !peek().is(TokenType.RBRACE)) {
            args.add(value());
        }
        return new SyntaxNode("directive", name, args, name.location());
    }

    // --- Values ---

    private SyntaxNode value() {
        Token t = peek();
        switch (t.type()) {
            case STRING:
                advance();
                return SyntaxNode.leaf(t.interpolated() ? "istring" : "string", t);
            case NUMBER:
                advance();
                return maybeRange(SyntaxNode.leaf("number", t));
            case DURATION:
                advance();
                return SyntaxNode.leaf("duration", t);
            case LBRACKET:
                return listOrRange();
            case LBRACE:
                return object();
            case WORD:
                advance();
                if (t.text().equals("true") || t.text().equals("false")) {
                    return SyntaxNode.leaf("bool", t);
                }
                if (t.text().equals("env") && peek().is(TokenType.LPAREN)) {
                    return envCall(t);
                }
                return maybeRange(SyntaxNode.leaf("ident", t));
            default:
                throw error("Expected a value but found " + t.type().description() + " '" + t.display() + "'", t);
        }
    }

    private SyntaxNode maybeRange(SyntaxNode from) {
        if (!peek().is(TokenType.RANGE)) {
            return from;
        }
        advance();
        Token to = peek();
        if (!to.is(TokenType.NUMBER) && !to.is(TokenType.WORD)) {
            throw error("Expected a range upper bound after '..'", to);
        }
        advance();
        SyntaxNode upper = SyntaxNode.leaf(to.is(TokenType.NUMBER) ? "number" : "ident", to);
        return new SyntaxNode("range", null, List.of(from, upper), from.location());
    }

    private SyntaxNode listOrRange() {
        Token open = advance();
        List<SyntaxNode> items = new ArrayList<>();
        while (!peek().is(TokenType.RBRACKET)) {
            if (peek().is(TokenType.EOF)) {
                throw error(
                        String.format("Unexpected end of input: list opened at %d:%d is not closed",
                                open.line(), open.location().column()),
                        peek());
            }
            items.add(value());
            if (peek().is(TokenType.COMMA)) {
                advance();
            } else if (!peek().is(TokenType.RBRACKET) && peek().line() == previous().endLine()) {
                throw error("Expected ',' or ']' in list but found '" + peek().display() + "'", peek());
            }
        }
        expect(TokenType.RBRACKET);
        if (items.size() == 1 && items.get(0).is("range")) {
            return items.get(0);
        }
        return new SyntaxNode("list", open, items, open.location());
    }

    private SyntaxNode object() {
        Token open = advance();
        List<SyntaxNode> entries = new ArrayList<>();
        while (!peek().is(TokenType.RBRACE)) {
            Token key = peek();
            if (key.is(TokenType.EOF)) {
                throw error(
                        String.format("Unexpected end of input: object opened at %d:%d is not closed",
                                open.line(), open.location().column()),
                        key);
            }
            if (!key.is(TokenType.WORD) && !key.is(TokenType.NUMBER) && !key.is(TokenType.STRING)) {
                throw error("Expected an object key but found '" + key.display() + "'", key);
            }
            advance();
            expect(TokenType.COLON);
            List<SyntaxNode> values = new ArrayList<>();
            values.add(value());
            while (continuesLine() && !startsProperty() && !peek().is(TokenType.COMMA)
                    && !peek().is(TokenType.RBRACE)) {
                values.add(value());
            }
            entries.add(new SyntaxNode("entry", key, values, key.location()));
            if (peek().is(TokenType.COMMA)) {
                advance();
            }
        }
        expect(TokenType.RBRACE);
        return new SyntaxNode("object", open, entries, open.location());
    }

    private SyntaxNode envCall(Token env) {
        expect(TokenType.LPAREN);
        List<SyntaxNode> args = new ArrayList<>();
        while (!peek().is(TokenType.RPAREN)) {
            args.add(value());
            if (peek().is(TokenType.COMMA)) {
                advance();
            } else if (!peek().is(TokenType.RPAREN)) {
                throw error("Expected ',' or ')' in env(...) but found '" + peek().display() + "'", peek());
            }
        }
        expect(TokenType.RPAREN);
        return new SyntaxNode("env", env, args, env.location());
    }

    // --- Token helpers ---

    /** {@code true} if the next token starts on the line where the previous one ended. */
    private boolean continuesLine() {
        Token next = peek();
        return !next.is(TokenType.EOF) && pos > 0 && next.line() == previous().endLine();
    }

    private boolean startsProperty() {
        return peek().is(TokenType.WORD) && peekAt(1).is(TokenType.COLON);
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        int i = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token previous() {
        return tokens.get(pos - 1);
    }

    private Token advance() {
        Token t = tokens.get(pos);
        if (!t.is(TokenType.EOF)) {
            pos++;
        }
        return t;
    }

    private Token expect(TokenType type) {
        Token t = peek();
        if (!t.is(type)) {
            throw error(
                    String.format("Expected %s but found %s '%s'", type.description(), t.type().description(),
                            t.display()),
                    t);
        }
        return advance();
    }

    private void expectWord(String word) {
        Token t = peek();
        if (!t.isWord(word)) {
            throw error(String.format("Expected '%s' but found '%s'", word, t.display()), t);
        }
        advance();
    }

    /** A name: a word or a quoted string. */
    private Token expectName(String what) {
        Token t = peek();
        if (!t.is(TokenType.WORD) && !t.is(TokenType.STRING)) {
            throw error(String.format("Expected %s but found '%s'", what, t.display()), t);
        }
        return advance();
    }

    private ParseException error(String message, Token at) {
        SourceLocation loc = at.location();
        return new ParseException(
                String.format("%s (line %d, column %d)", message, loc.line(), loc.column()), at.display(), loc);
    }
}
