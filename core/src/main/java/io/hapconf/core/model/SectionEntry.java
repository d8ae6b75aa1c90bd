package io.hapconf.core.model;

/**
 * Member of the top-level proxy section list: a {@link Frontend}, {@link Backend}, {@link Listen},
 * or a {@link ForLoop} producing them. Loops are gone after unrolling.
 */
public interface SectionEntry extends IrNode {}
