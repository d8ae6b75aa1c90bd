package io.hapconf.core.syntax;

import io.hapconf.core.model.SourceLocation;
import java.util.List;
import java.util.Objects;

/**
 * Concrete syntax tree node: a rule name, an optional head token (the name or keyword that
 * introduced the construct) and ordered children. Consumed only by the IR builder.
 *
 * @param rule     grammar rule, e.g. {@code backend}, {@code property}, {@code string}
 * @param token    head token, or {@code null} for purely structural nodes
 * @param children ordered child nodes
 * @param location position of the construct
 */
public record SyntaxNode(String rule, Token token, List<SyntaxNode> children, SourceLocation location) {

    public SyntaxNode {
        Objects.requireNonNull(rule, "rule must not be null");
        children = List.copyOf(children);
        Objects.requireNonNull(location, "location must not be null");
    }

    public static SyntaxNode leaf(String rule, Token token) {
        return new SyntaxNode(rule, token, List.of(), token.location());
    }

    /** Text of the head token; throws if there is none. */
    public String text() {
        if (token == null) {
            throw new IllegalStateException("Node '" + rule + "' has no head token");
        }
        return token.text();
    }

    public SyntaxNode child(int index) {
        return children.get(index);
    }

    public boolean is(String name) {
        return rule.equals(name);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(rule);
        if (token != null) {
            sb.append(' ').append(token.display());
        }
        for (SyntaxNode child : children) {
            sb.append(' ').append(child);
        }
        return sb.append(')').toString();
    }
}
