package io.hapconf.core.model;

/** Common supertype of every IR node. All implementations are immutable records. */
public interface IrNode {

    /** Where the node was declared in the DSL source. */
    SourceLocation location();
}
