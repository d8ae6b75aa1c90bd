package io.hapconf.core.transform;

import io.hapconf.core.catalog.PropertyCatalog;
import io.hapconf.core.model.Backend;
import io.hapconf.core.model.Config;
import io.hapconf.core.model.Defaults;
import io.hapconf.core.model.Frontend;
import io.hapconf.core.model.GlobalSettings;
import io.hapconf.core.model.HealthCheck;
import io.hapconf.core.model.Listen;
import io.hapconf.core.model.Properties;
import io.hapconf.core.model.SectionEntry;
import io.hapconf.core.model.Server;
import io.hapconf.core.model.ServerEntry;
import io.hapconf.core.model.ServerTemplate;
import io.hapconf.core.model.Spreadable;
import io.hapconf.core.model.Template;
import io.hapconf.core.model.Value;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges {@code @template} spreads into the nodes that declare them.
 *
 * <p>
 * Precedence: properties written on the node itself always win; among several spreads the one
 * declared last wins. Merged keys are split into modeled properties and extras for the receiving
 * node's kind.
 *
 * <p>
 * Expansion is single-level. A template's own spreads are never followed, and spreads naming an
 * unknown template stay on the node; the semantic validator reports both.
 */
public final class TemplateExpander {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateExpander.class);

    private final PropertyCatalog catalog;

    public TemplateExpander(PropertyCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /** Returns a copy of {@code config} with every resolvable spread merged. */
    public Config expand(Config config) {
        Map<String, Template> templates = new HashMap<>();
        for (Template t : config.templates()) {
            templates.putIfAbsent(t.name(), t);
        }
        Expansion expansion = new Expansion(templates);
        Config expanded = new Config(
                config.name(),
                config.properties(),
                config.global() == null ? null : expansion.global(config.global()),
                config.defaults() == null ? null : expansion.defaults(config.defaults()),
                expansion.sections(config.sections()),
                config.templates(),
                config.variables(),
                config.luaScripts(),
                config.location());
        LOG.debug("Templates expanded: templates={}, spreads={}", templates.size(), expansion.spreadCount);
        return expanded;
    }

    private final class Expansion {
        private final Map<String, Template> templates;
        private int spreadCount;

        Expansion(Map<String, Template> templates) {
            this.templates = templates;
        }

        GlobalSettings global(GlobalSettings g) {
            return merge(g);
        }

        Defaults defaults(Defaults d) {
            Defaults merged = merge(d);
            return merged.withHealthCheck(healthCheck(merged.healthCheck()));
        }

        List<SectionEntry> sections(List<SectionEntry> entries) {
            List<SectionEntry> out = new ArrayList<>(entries.size());
            for (SectionEntry entry : entries) {
                if (entry instanceof Frontend f) {
                    out.add(merge(f));
                } else if (entry instanceof Backend b) {
                    Backend merged = merge(b);
                    out.add(merged.withHealthCheck(healthCheck(merged.healthCheck()))
                            .withServers(servers(merged.servers())));
                } else if (entry instanceof Listen l) {
                    Listen merged = merge(l);
                    out.add(merged.withHealthCheck(healthCheck(merged.healthCheck()))
                            .withServers(servers(merged.servers())));
                } else {
                    out.add(entry);
                }
            }
            return out;
        }

        private List<ServerEntry> servers(List<ServerEntry> entries) {
            List<ServerEntry> out = new ArrayList<>(entries.size());
            for (ServerEntry entry : entries) {
                if (entry instanceof Server s) {
                    out.add(merge(s));
                } else if (entry instanceof ServerTemplate t) {
                    out.add(merge(t));
                } else {
                    out.add(entry);
                }
            }
            return out;
        }

        private HealthCheck healthCheck(HealthCheck hc) {
            return hc == null ? null : merge(hc);
        }

        /**
         * Merges the node's spreads. Unknown template names are kept in the returned node's
         * spreads.
         */
        private <T extends Spreadable<T>> T merge(T node) {
            if (node.spreads().isEmpty()) {
                return node;
            }
            Map<String, Value> fromTemplates = new LinkedHashMap<>();
            List<String> unresolved = new ArrayList<>();
            for (String name : node.spreads()) {
                Template template = templates.get(name);
                if (template == null) {
                    unresolved.add(name);
                    continue;
                }
                for (Map.Entry<String, Value> e : template.properties()) {
                    fromTemplates.remove(e.getKey());
                    fromTemplates.put(e.getKey(), e.getValue());
                }
                spreadCount++;
            }
            Map<String, Value> local = new LinkedHashMap<>(node.properties().asMap());
            local.putAll(node.extras().asMap());
            Properties all = Properties.of(local).withDefaults(Properties.of(fromTemplates));

            Map<String, Value> modeled = new LinkedHashMap<>();
            Map<String, Value> extras = new LinkedHashMap<>();
            for (Map.Entry<String, Value> e : all) {
                if (catalog.isModeled(node.kind(), e.getKey())) {
                    modeled.put(e.getKey(), e.getValue());
                } else {
                    extras.put(e.getKey(), e.getValue());
                }
            }
            return node.withProperties(Properties.of(modeled), Properties.of(extras), unresolved);
        }
    }
}
