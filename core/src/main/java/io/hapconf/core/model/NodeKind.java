package io.hapconf.core.model;

/** Kinds of property-carrying IR nodes. Selects the property catalog used for a node. */
public enum NodeKind {
    GLOBAL("global"),
    DEFAULTS("defaults"),
    FRONTEND("frontend"),
    BACKEND("backend"),
    LISTEN("listen"),
    BIND("bind"),
    SERVER("server"),
    SERVER_TEMPLATE("server-template"),
    HEALTH_CHECK("health-check"),
    STICK_TABLE("stick-table");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    /** DSL keyword for this kind, used in messages. */
    public String label() {
        return label;
    }
}
