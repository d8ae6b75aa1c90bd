package io.hapconf.core.transform;

import io.hapconf.core.error.ResolutionException;
import io.hapconf.core.error.TranslateException;
import io.hapconf.core.model.Backend;
import io.hapconf.core.model.Config;
import io.hapconf.core.model.ForLoop;
import io.hapconf.core.model.Frontend;
import io.hapconf.core.model.IrNode;
import io.hapconf.core.model.Iteration;
import io.hapconf.core.model.Listen;
import io.hapconf.core.model.SectionEntry;
import io.hapconf.core.model.Server;
import io.hapconf.core.model.ServerEntry;
import io.hapconf.core.model.ServerTemplate;
import io.hapconf.core.model.SourceLocation;
import io.hapconf.core.model.Value;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands {@code for} loops into sibling nodes, both among the top-level sections and inside
 * server lists.
 *
 * <p>
 * For every iteration the loop variable is substituted textually into each {@code ${...}}
 * expression of the body; expressions left without free variables are evaluated on the spot, so
 * {@code "web${i}"} becomes {@code "web1"} and {@code ${8000 + i}} becomes {@code 8001}.
 * Expressions that still name other variables stay interpolated for the variable resolver. Outer
 * loops are expanded before inner ones, so an inner range may use an outer variable.
 */
public final class LoopUnroller {

    private static final Logger LOG = LoggerFactory.getLogger(LoopUnroller.class);

    /**
     * Returns a copy of {@code config} with every loop expanded.
     *
     * @throws ResolutionException for non-integer or reversed range bounds, non-literal list items
     *     and duplicate generated names
     */
    public Config unroll(Config config) {
        return config.withSections(unrollSections(config.sections()));
    }

    private List<SectionEntry> unrollSections(List<SectionEntry> entries) {
        List<SectionEntry> out = new ArrayList<>();
        for (SectionEntry entry : entries) {
            if (entry instanceof ForLoop loop) {
                List<SectionEntry> generated = new ArrayList<>();
                for (Value item : iterationValues(loop)) {
                    Substitution sub = new Substitution(loop.variable(), item);
                    List<SectionEntry> copies = new ArrayList<>();
                    for (IrNode node : loop.body()) {
                        copies.add(sub.section((SectionEntry) node));
                    }
                    generated.addAll(unrollSections(copies));
                }
                requireUniqueNames(loop, generated);
                LOG.debug("Unrolled section loop: variable={}, sections={}", loop.variable(), generated.size());
                out.addAll(generated);
            } else if (entry instanceof Backend b) {
                out.add(b.withServers(unrollServers(b.servers())));
            } else if (entry instanceof Listen l) {
                out.add(l.withServers(unrollServers(l.servers())));
            } else {
                out.add(entry);
            }
        }
        return out;
    }

    private List<ServerEntry> unrollServers(List<ServerEntry> entries) {
        List<ServerEntry> out = new ArrayList<>();
        for (ServerEntry entry : entries) {
            if (entry instanceof ForLoop loop) {
                List<ServerEntry> generated = new ArrayList<>();
                for (Value item : iterationValues(loop)) {
                    Substitution sub = new Substitution(loop.variable(), item);
                    List<ServerEntry> copies = new ArrayList<>();
                    for (IrNode node : loop.body()) {
                        copies.add(sub.server((ServerEntry) node));
                    }
                    generated.addAll(unrollServers(copies));
                }
                requireUniqueNames(loop, generated);
                LOG.debug("Unrolled server loop: variable={}, servers={}", loop.variable(), generated.size());
                out.addAll(generated);
            } else {
                out.add(entry);
            }
        }
        return out;
    }

    private static List<Value> iterationValues(ForLoop loop) {
        if (loop.iteration() instanceof Iteration.Items items) {
            for (Value item : items.items()) {
                if (!item.isResolved()) {
                    throw new ResolutionException(
                            String.format(
                                    "Loop '%s' iterates over '%s'; list items must be literals",
                                    loop.variable(),
                                    item.asText()),
                            TranslateException.Phase.UNROLL,
                            loop.location());
                }
            }
            return items.items();
        }
        Iteration.Range range = (Iteration.Range) loop.iteration();
        long from = bound(loop, range.from());
        long to = bound(loop, range.to());
        if (to != Long.MAX_VALUE && from > to + 1) {
            throw new ResolutionException(
                    String.format("Loop '%s' has reversed range bounds %d..%d", loop.variable(), from, to),
                    TranslateException.Phase.UNROLL,
                    loop.location());
        }
        List<Value> values = new ArrayList<>();
        for (long i = from; from <= to; i++) {
            values.add(Value.num(i));
            if (i == to) {
                break;
            }
        }
        return values;
    }

    private static long bound(ForLoop loop, Value value) {
        OptionalLong n = value instanceof Value.Duration ? OptionalLong.empty() : value.asLong();
        if (n.isEmpty() || !value.isResolved()) {
            throw new ResolutionException(
                    String.format(
                            "Loop '%s' range bound '%s' is not an integer; bounds may only use literals and"
                                    + " enclosing loop variables",
                            loop.variable(),
                            value.asText()),
                    TranslateException.Phase.UNROLL,
                    loop.location());
        }
        return n.getAsLong();
    }

    private static void requireUniqueNames(ForLoop loop, List<? extends IrNode> generated) {
        Map<String, IrNode> seen = new HashMap<>();
        for (IrNode node : generated) {
            String name = generatedName(node);
            if (name == null) {
                continue;
            }
            String key = node.getClass().getSimpleName() + ":" + name;
            if (seen.putIfAbsent(key, node) != null) {
                throw new ResolutionException(
                        String.format(
                                "Loop '%s' generates the name '%s' more than once; include the loop variable in"
                                        + " the name",
                                loop.variable(),
                                name),
                        TranslateException.Phase.UNROLL,
                        List.of(name),
                        loop.location());
            }
        }
    }

    private static String generatedName(IrNode node) {
        if (node instanceof Frontend f) {
            return f.name();
        }
        if (node instanceof Backend b) {
            return b.name();
        }
        if (node instanceof Listen l) {
            return l.name();
        }
        if (node instanceof Server s) {
            return s.name();
        }
        if (node instanceof ServerTemplate t) {
            return t.prefix();
        }
        return null;
    }

    /** Substitutes one loop variable throughout a copied subtree. */
    private static final class Substitution extends IrRewriter {
        private final String variable;
        private final Value item;

        Substitution(String variable, Value item) {
            this.variable = variable;
            this.item = item;
        }

        @Override
        protected Value value(Value value, SourceLocation location) {
            return value.mapLeaves(leaf -> leaf instanceof Value.Interpolated i ? substitute(i, location) : leaf);
        }

        @Override
        protected String name(String name, SourceLocation location) {
            if (!name.contains("${")) {
                return name;
            }
            String rewritten = Interpolation.rewriteExpressions(name, e -> replace(e, location));
            return Interpolation.applyToName(rewritten, e -> fold(e, location));
        }

        private Value substitute(Value.Interpolated value, SourceLocation location) {
            String rewritten = Interpolation.rewriteExpressions(value.template(), e -> replace(e, location));
            return Interpolation.apply(rewritten, e -> fold(e, location));
        }

        private String replace(String expression, SourceLocation location) {
            try {
                return ExpressionEvaluator.substitute(expression, variable, item);
            } catch (ExpressionEvaluator.ExpressionException e) {
                throw invalid(expression, e, location);
            }
        }

        private Optional<Value> fold(String expression, SourceLocation location) {
            try {
                if (!ExpressionEvaluator.identifiers(expression).isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(ExpressionEvaluator.evaluate(expression, name -> null));
            } catch (ExpressionEvaluator.ExpressionException e) {
                throw invalid(expression, e, location);
            }
        }

        private ResolutionException invalid(
                String expression, ExpressionEvaluator.ExpressionException e, SourceLocation location) {
            return new ResolutionException(
                    String.format("Cannot evaluate '${%s}' in loop '%s': %s", expression, variable, e.getMessage()),
                    e,
                    TranslateException.Phase.UNROLL,
                    location);
        }
    }
}
