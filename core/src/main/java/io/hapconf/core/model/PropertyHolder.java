package io.hapconf.core.model;

/**
 * A node with a modeled property map plus a generic map for keys the catalog does not know.
 * Unknown keys are kept rather than rejected and are rendered verbatim by the generator.
 */
public interface PropertyHolder extends IrNode {

    NodeKind kind();

    /** Catalog-known properties. */
    Properties properties();

    /** Unmodeled properties, passed through in declaration order. */
    Properties extras();
}
