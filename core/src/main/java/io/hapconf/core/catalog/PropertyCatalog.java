package io.hapconf.core.catalog;

import io.hapconf.core.model.NodeKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The modeled properties of each {@link NodeKind}, in rendering order.
 *
 * <p>
 * Keys not listed here are kept in a node's extras map and rendered generically, so the catalog
 * only needs the keywords that carry a value domain or a non-default rendering.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class PropertyCatalog {

    public static final ValueDomain MODE = ValueDomain.oneOf("http", "tcp", "log");

    public static final ValueDomain BALANCE = new ValueDomain.OneOf(
            Set.of("roundrobin", "static-rr", "leastconn", "first", "source", "uri", "url_param", "random",
                    "rdp-cookie", "hash"),
            List.of(
                    Pattern.compile("hdr\\([^)]+\\)"),
                    Pattern.compile("rdp-cookie\\([^)]*\\)"),
                    Pattern.compile("random\\(\\d+\\)"),
                    Pattern.compile("url_param\\s+\\S.*"),
                    Pattern.compile("uri\\s+\\S.*"),
                    Pattern.compile("hash\\s+\\S.*")));

    public static final ValueDomain VERIFY = ValueDomain.oneOf("none", "required", "optional");

    public static final ValueDomain HTTP_METHOD =
            ValueDomain.oneOf("GET", "HEAD", "POST", "PUT", "DELETE", "OPTIONS", "PATCH", "TRACE", "CONNECT");

    public static final ValueDomain STICK_TYPE = ValueDomain.oneOf("ip", "ipv6", "integer", "string", "binary");

    private static final PropertyCatalog INSTANCE = new PropertyCatalog();

    private final Map<NodeKind, Map<String, PropertySpec>> specs = new EnumMap<>(NodeKind.class);

    private PropertyCatalog() {
        register(NodeKind.GLOBAL, globalSpecs());
        register(NodeKind.DEFAULTS, defaultsSpecs());
        register(NodeKind.FRONTEND, frontendSpecs());
        register(NodeKind.BACKEND, backendSpecs());
        register(NodeKind.LISTEN, listenSpecs());
        register(NodeKind.BIND, bindSpecs());
        register(NodeKind.SERVER, serverSpecs());
        register(NodeKind.SERVER_TEMPLATE, serverSpecs());
        register(NodeKind.HEALTH_CHECK, healthCheckSpecs());
        register(NodeKind.STICK_TABLE, stickTableSpecs());
    }

    public static PropertyCatalog standard() {
        return INSTANCE;
    }

    /** Looks up the spec for {@code key} on a node of {@code kind}. */
    public Optional<PropertySpec> find(NodeKind kind, String key) {
        return Optional.ofNullable(specs.get(kind).get(key));
    }

    public boolean isModeled(NodeKind kind, String key) {
        return specs.get(kind).containsKey(key);
    }

    /** All specs of {@code kind} in rendering order. */
    public List<PropertySpec> specsFor(NodeKind kind) {
        return List.copyOf(specs.get(kind).values());
    }

    private void register(NodeKind kind, List<PropertySpec> list) {
        Map<String, PropertySpec> byKey = new LinkedHashMap<>();
        for (PropertySpec spec : list) {
            byKey.put(spec.key(), spec);
        }
        specs.put(kind, Collections.unmodifiableMap(byKey));
    }

    // --- Per-kind tables ---

    private static List<PropertySpec> globalSpecs() {
        List<PropertySpec> l = new ArrayList<>();
        l.add(flag("daemon"));
        l.add(flag("master_worker"));
        l.add(scalar("maxconn", ValueDomain.POSITIVE));
        l.add(scalar("nbthread", ValueDomain.POSITIVE));
        l.add(scalar("user", ValueDomain.ANY));
        l.add(scalar("group", ValueDomain.ANY));
        l.add(scalar("chroot", ValueDomain.ANY));
        l.add(scalar("pidfile", ValueDomain.ANY));
        l.add(spec("log", Rendering.REPEATED, ValueDomain.ANY));
        l.add(scalar("ssl_default_bind_ciphers", ValueDomain.ANY));
        l.add(spec("ssl_default_bind_options", Rendering.SPACE_JOINED, ValueDomain.ANY));
        l.add(scalar("ssl_default_server_ciphers", ValueDomain.ANY));
        l.add(spec("ssl_default_server_options", Rendering.SPACE_JOINED, ValueDomain.ANY));
        l.add(spec("stats_socket", "stats socket", Rendering.REPEATED, ValueDomain.ANY));
        l.add(scalar("stats_timeout", "stats timeout", ValueDomain.POSITIVE_DURATION));
        return l;
    }

    private static List<PropertySpec> defaultsSpecs() {
        List<PropertySpec> l = new ArrayList<>();
        l.add(scalar("mode", MODE));
        l.add(scalar("log", ValueDomain.ANY));
        l.add(scalar("maxconn", ValueDomain.POSITIVE));
        l.add(scalar("balance", BALANCE));
        l.add(scalar("retries", ValueDomain.NON_NEGATIVE));
        l.addAll(timeouts("connect", "client", "server", "check", "queue", "tunnel", "http_request",
                "http_keep_alive", "client_fin", "server_fin"));
        l.add(spec("option", Rendering.REPEATED, ValueDomain.ANY));
        l.add(spec("errorfile", Rendering.KEYED_LINES, ValueDomain.ANY));
        l.add(trailing("default_backend"));
        return l;
    }

    private static List<PropertySpec> frontendSpecs() {
        List<PropertySpec> l = new ArrayList<>();
        l.add(scalar("mode", MODE));
        l.add(scalar("description", ValueDomain.ANY));
        l.add(scalar("log", ValueDomain.ANY));
        l.add(scalar("maxconn", ValueDomain.POSITIVE));
        l.addAll(timeouts("client", "http_request", "http_keep_alive", "client_fin", "tunnel"));
        l.add(scalar("monitor_uri", ValueDomain.ANY));
        l.add(spec("option", Rendering.REPEATED, ValueDomain.ANY));
        l.add(spec("errorfile", Rendering.KEYED_LINES, ValueDomain.ANY));
        l.add(trailing("default_backend"));
        return l;
    }

    private static List<PropertySpec> backendSpecs() {
        List<PropertySpec> l = new ArrayList<>();
        l.add(scalar("mode", MODE));
        l.add(scalar("description", ValueDomain.ANY));
        l.add(scalar("log", ValueDomain.ANY));
        l.add(scalar("balance", BALANCE));
        l.add(scalar("hash_type", ValueDomain.ANY));
        l.add(scalar("retries", ValueDomain.NON_NEGATIVE));
        l.add(scalar("fullconn", ValueDomain.POSITIVE));
        l.addAll(timeouts("connect", "server", "check", "queue", "tunnel", "server_fin"));
        l.add(spec("option", Rendering.REPEATED, ValueDomain.ANY));
        l.add(scalar("cookie", ValueDomain.ANY));
        l.add(spec("errorfile", Rendering.KEYED_LINES, ValueDomain.ANY));
        return l;
    }

    private static List<PropertySpec> listenSpecs() {
        Map<String, PropertySpec> merged = new LinkedHashMap<>();
        for (PropertySpec s : frontendSpecs()) {
            merged.put(s.key(), s);
        }
        for (PropertySpec s : backendSpecs()) {
            merged.putIfAbsent(s.key(), s);
        }
        List<PropertySpec> l = new ArrayList<>();
        // trailing entries go last so the rendering order stays readable
        merged.values().stream().filter(s -> !s.trailing()).forEach(l::add);
        merged.values().stream().filter(PropertySpec::trailing).forEach(l::add);
        return l;
    }

    private static List<PropertySpec> bindSpecs() {
        List<PropertySpec> l = new ArrayList<>();
        l.add(flag("ssl"));
        l.add(scalar("crt", ValueDomain.ANY));
        l.add(scalar("ca_file", ValueDomain.ANY));
        l.add(scalar("verify", VERIFY));
        l.add(spec("alpn", Rendering.COMMA_JOINED, ValueDomain.ANY));
        l.add(scalar("ciphers", ValueDomain.ANY));
        l.add(scalar("ssl_min_ver", ValueDomain.oneOf("SSLv3", "TLSv1.0", "TLSv1.1", "TLSv1.2", "TLSv1.3")));
        l.add(flag("strict_sni"));
        l.add(flag("accept_proxy"));
        l.add(flag("transparent"));
        l.add(flag("v4v6"));
        l.add(flag("v6only"));
        l.add(scalar("maxconn", ValueDomain.POSITIVE));
        return l;
    }

    private static List<PropertySpec> serverSpecs() {
        List<PropertySpec> l = new ArrayList<>();
        // address and port form the head of the server line; listed for domain checks only
        l.add(scalar("address", ValueDomain.ANY));
        l.add(scalar("port", ValueDomain.PORT));
        l.add(flag("check"));
        l.add(scalar("inter", ValueDomain.POSITIVE_DURATION));
        l.add(scalar("fastinter", ValueDomain.POSITIVE_DURATION));
        l.add(scalar("downinter", ValueDomain.POSITIVE_DURATION));
        l.add(scalar("rise", ValueDomain.POSITIVE));
        l.add(scalar("fall", ValueDomain.POSITIVE));
        l.add(scalar("weight", ValueDomain.range(0, 256)));
        l.add(scalar("maxconn", ValueDomain.POSITIVE));
        l.add(scalar("maxqueue", ValueDomain.NON_NEGATIVE));
        l.add(flag("ssl"));
        l.add(scalar("verify", VERIFY));
        l.add(scalar("ca_file", ValueDomain.ANY));
        l.add(scalar("crt", ValueDomain.ANY));
        l.add(scalar("sni", ValueDomain.ANY));
        l.add(spec("alpn", Rendering.COMMA_JOINED, ValueDomain.ANY));
        l.add(scalar("cookie", ValueDomain.ANY));
        l.add(scalar("slowstart", ValueDomain.POSITIVE_DURATION));
        l.add(scalar("resolvers", ValueDomain.ANY));
        l.add(scalar("init_addr", ValueDomain.ANY));
        l.add(flag("backup"));
        l.add(flag("disabled"));
        l.add(flag("send_proxy"));
        l.add(flag("send_proxy_v2"));
        return l;
    }

    private static List<PropertySpec> healthCheckSpecs() {
        List<PropertySpec> l = new ArrayList<>();
        l.add(scalar("method", HTTP_METHOD));
        l.add(scalar("uri", ValueDomain.ANY));
        l.add(scalar("version", ValueDomain.ANY));
        l.add(spec("headers", Rendering.KEYED_LINES, ValueDomain.ANY));
        l.add(scalar("expect_status", ValueDomain.HTTP_STATUS));
        l.add(scalar("expect_string", ValueDomain.ANY));
        l.add(scalar("expect_rstatus", ValueDomain.ANY));
        l.add(scalar("expect_rstring", ValueDomain.ANY));
        return l;
    }

    private static List<PropertySpec> stickTableSpecs() {
        List<PropertySpec> l = new ArrayList<>();
        l.add(scalar("type", STICK_TYPE));
        l.add(scalar("len", ValueDomain.POSITIVE));
        l.add(scalar("size", ValueDomain.ANY));
        l.add(scalar("expire", ValueDomain.POSITIVE_DURATION));
        l.add(flag("nopurge"));
        l.add(scalar("peers", ValueDomain.ANY));
        l.add(spec("store", Rendering.COMMA_JOINED, ValueDomain.ANY));
        return l;
    }

    // --- Helpers ---

    private static List<PropertySpec> timeouts(String... names) {
        List<PropertySpec> l = new ArrayList<>();
        for (String name : names) {
            l.add(scalar("timeout_" + name, ValueDomain.POSITIVE_DURATION));
        }
        return l;
    }

    private static PropertySpec flag(String key) {
        return new PropertySpec(key, Keywords.toKeyword(key), Rendering.FLAG, ValueDomain.FLAG, false);
    }

    private static PropertySpec scalar(String key, ValueDomain domain) {
        return new PropertySpec(key, Keywords.toKeyword(key), Rendering.SCALAR, domain, false);
    }

    private static PropertySpec scalar(String key, String keyword, ValueDomain domain) {
        return new PropertySpec(key, keyword, Rendering.SCALAR, domain, false);
    }

    private static PropertySpec spec(String key, Rendering rendering, ValueDomain domain) {
        return new PropertySpec(key, Keywords.toKeyword(key), rendering, domain, false);
    }

    private static PropertySpec spec(String key, String keyword, Rendering rendering, ValueDomain domain) {
        return new PropertySpec(key, keyword, rendering, domain, false);
    }

    private static PropertySpec trailing(String key) {
        return new PropertySpec(key, Keywords.toKeyword(key), Rendering.SCALAR, ValueDomain.ANY, true);
    }
}
