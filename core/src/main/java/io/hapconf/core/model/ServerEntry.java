package io.hapconf.core.model;

/**
 * Member of a backend or listen server list: a {@link Server}, {@link ServerTemplate}, or a
 * {@link ForLoop} producing them. Loops are gone after unrolling.
 */
public interface ServerEntry extends IrNode {}
