package io.hapconf.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An {@code if}/{@code unless} condition on a routing or HTTP rule. Terms are kept as written:
 * ACL names (optionally negated with {@code !}), the {@code or}/{@code ||} operators and the
 * tokens of anonymous ACLs in braces.
 */
public record Condition(String keyword, List<String> terms) {

    public Condition {
        if (!"if".equals(keyword) && !"unless".equals(keyword)) {
            throw new IllegalArgumentException("Condition keyword must be 'if' or 'unless', got: " + keyword);
        }
        terms = List.copyOf(terms);
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("Condition must have at least one term");
        }
    }

    /**
     * Names of the ACLs this condition refers to, without negation. Operators and anonymous ACL
     * contents are skipped.
     */
    public List<String> aclNames() {
        List<String> names = new java.util.ArrayList<>();
        int depth = 0;
        for (String term : terms) {
            if (term.equals("{") || term.equals("!{")) {
                depth++;
                continue;
            }
            if (term.equals("}")) {
                depth = Math.max(0, depth - 1);
                continue;
            }
            if (depth > 0 || term.equals("or") || term.equals("||") || term.equals("!")) {
                continue;
            }
            String name = term.startsWith("!") ? term.substring(1) : term;
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    /** Renders as the target expects, e.g. {@code if is_api !is_admin}. */
    public String render() {
        StringBuilder sb = new StringBuilder(keyword);
        String previous = "";
        for (String term : terms) {
            if (previous.equals("!") && term.equals("{")) {
                sb.append(term);
            } else {
                sb.append(' ').append(term);
            }
            previous = term;
        }
        return sb.toString();
    }

    public Condition withTerms(List<String> newTerms) {
        return new Condition(keyword, Objects.requireNonNull(newTerms));
    }
}
