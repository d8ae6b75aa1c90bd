package io.hapconf.core.transform;

import io.hapconf.core.error.ResolutionException;
import io.hapconf.core.error.TranslateException;
import io.hapconf.core.model.Config;
import io.hapconf.core.model.SourceLocation;
import io.hapconf.core.model.Value;
import io.hapconf.core.model.VariableBinding;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces every {@code ${expr}} interpolation and {@code env(...)} lookup in the tree with a
 * concrete value.
 *
 * <p>
 * The {@code let} bindings are resolved first, by repeated passes over the binding table: a
 * pass substitutes every expression whose variables are already concrete, and passes repeat until
 * all bindings are concrete. A pass that changes nothing, or running out of passes, means the
 * remaining bindings refer to each other in a cycle. The tree is then rewritten in one pass
 * against the finished table.
 *
 * <p>
 * Templates and inline Lua bodies are left as they are.
 */
public final class VariableResolver {

    private static final Logger LOG = LoggerFactory.getLogger(VariableResolver.class);

    private final Function<String, String> envLookup;
    private final int maxPasses;

    /**
     * @param envLookup returns the value of an environment variable, or {@code null} if unset
     * @param maxPasses upper bound on resolution passes over the binding table
     */
    public VariableResolver(Function<String, String> envLookup, int maxPasses) {
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
        if (maxPasses <= 0) {
            throw new IllegalArgumentException("maxPasses must be positive, got: " + maxPasses);
        }
        this.maxPasses = maxPasses;
    }

    /**
     * Returns a copy of {@code config} without unresolved values.
     *
     * @throws ResolutionException for undefined variables, unset environment variables without a
     *     default, circular bindings and failing arithmetic
     */
    public Config resolve(Config config) {
        Map<String, VariableBinding> bindings = new LinkedHashMap<>();
        for (VariableBinding b : config.variables()) {
            bindings.put(b.name(), b);
        }
        Map<String, Value> table = resolveBindings(bindings);

        Rewriter rewriter = new Rewriter(table);
        Config rewritten = rewriter.rewrite(config);
        List<VariableBinding> resolved = new ArrayList<>(config.variables().size());
        for (VariableBinding b : config.variables()) {
            resolved.add(new VariableBinding(b.name(), table.get(b.name()), b.location()));
        }
        return new Config(
                rewritten.name(),
                rewritten.properties(),
                rewritten.global(),
                rewritten.defaults(),
                rewritten.sections(),
                rewritten.templates(),
                resolved,
                rewritten.luaScripts(),
                rewritten.location());
    }

    private Map<String, Value> resolveBindings(Map<String, VariableBinding> bindings) {
        Map<String, Value> table = new LinkedHashMap<>();
        for (VariableBinding b : bindings.values()) {
            table.put(b.name(), b.value().mapLeaves(v -> env(v, b.location())));
        }
        int passes = 0;
        while (true) {
            List<String> pending = pending(table);
            if (pending.isEmpty()) {
                break;
            }
            if (passes == maxPasses) {
                throw circular(pending, bindings, "did not converge after " + maxPasses + " passes");
            }
            passes++;
            boolean changed = false;
            for (String name : pending) {
                SourceLocation location = bindings.get(name).location();
                Value current = table.get(name);
                Value next = current.mapLeaves(v -> substituteAvailable(v, table, location));
                if (!next.equals(current)) {
                    table.put(name, next);
                    changed = true;
                }
            }
            if (!changed) {
                throw circular(pending, bindings, "no progress in pass " + passes);
            }
        }
        LOG.debug("Variables resolved: bindings={}, passes={}", table.size(), passes);
        return table;
    }

    /** Substitutes the expressions whose variables are all concrete; the rest are kept. */
    private static Value substituteAvailable(Value value, Map<String, Value> table, SourceLocation location) {
        if (!(value instanceof Value.Interpolated interpolated)) {
            return value;
        }
        return Interpolation.apply(interpolated.template(), expression -> {
            for (String name : identifiers(expression, location)) {
                Value bound = table.get(name);
                if (bound == null) {
                    throw undefined(name, location);
                }
                if (!bound.isResolved()) {
                    return Optional.empty();
                }
            }
            return Optional.of(evaluate(expression, table, location));
        });
    }

    private static List<String> pending(Map<String, Value> table) {
        List<String> pending = new ArrayList<>();
        table.forEach((name, value) -> {
            if (!value.isResolved()) pending.add(name);
        });
        return pending;
    }

    private Value env(Value value, SourceLocation location) {
        if (!(value instanceof Value.EnvRef ref)) {
            return value;
        }
        String actual = envLookup.apply(ref.variable());
        if (actual != null) {
            return Value.str(actual);
        }
        if (ref.defaultValue() != null) {
            return ref.defaultValue();
        }
        throw new ResolutionException(
                String.format(
                        "Environment variable '%s' is not set and has no default at %s", ref.variable(), location),
                TranslateException.Phase.RESOLVE,
                List.of(ref.variable()),
                location);
    }

    private static List<String> identifiers(String expression, SourceLocation location) {
        try {
            return new ArrayList<>(ExpressionEvaluator.identifiers(expression));
        } catch (ExpressionEvaluator.ExpressionException e) {
            throw invalidExpression(expression, e, location);
        }
    }

    private static Value evaluate(String expression, Map<String, Value> table, SourceLocation location) {
        try {
            return ExpressionEvaluator.evaluate(expression, table::get);
        } catch (ExpressionEvaluator.ExpressionException e) {
            throw invalidExpression(expression, e, location);
        }
    }

    private static ResolutionException invalidExpression(
            String expression, ExpressionEvaluator.ExpressionException e, SourceLocation location) {
        return new ResolutionException(
                String.format("Cannot evaluate '${%s}': %s", expression, e.getMessage()),
                e,
                TranslateException.Phase.RESOLVE,
                location);
    }

    private static ResolutionException undefined(String name, SourceLocation location) {
        return new ResolutionException(
                String.format("Undefined variable '%s' referenced at %s", name, location),
                TranslateException.Phase.RESOLVE,
                List.of(name),
                location);
    }

    private static ResolutionException circular(
            List<String> pending, Map<String, VariableBinding> bindings, String detail) {
        SourceLocation location = bindings.get(pending.get(0)).location();
        return new ResolutionException(
                String.format(
                        "Circular variable reference among [%s]: %s", String.join(", ", pending), detail),
                TranslateException.Phase.RESOLVE,
                pending,
                location);
    }

    /** Rewrites the tree against a fully resolved binding table. */
    private final class Rewriter extends IrRewriter {
        private final Map<String, Value> table;

        Rewriter(Map<String, Value> table) {
            this.table = table;
        }

        @Override
        protected Value value(Value value, SourceLocation location) {
            return value.mapLeaves(leaf -> {
                Value v = env(leaf, location);
                return v instanceof Value.Interpolated ? substituteAvailable(v, table, location) : v;
            });
        }

        @Override
        protected String name(String name, SourceLocation location) {
            return Interpolation.applyToName(name, expression -> {
                for (String id : identifiers(expression, location)) {
                    if (!table.containsKey(id)) {
                        throw undefined(id, location);
                    }
                }
                return Optional.of(evaluate(expression, table, location));
            });
        }
    }
}
