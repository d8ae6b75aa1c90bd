package io.hapconf.core.model;

import java.util.List;

/**
 * A property holder that may carry pending {@code @template} spreads.
 *
 * @param <T> the concrete node type
 */
public interface Spreadable<T extends Spreadable<T>> extends PropertyHolder {

    /** Template names still to be merged, in declaration order. Empty after expansion. */
    List<String> spreads();

    /** Returns a copy with the given property maps and remaining spreads. */
    T withProperties(Properties properties, Properties extras, List<String> spreads);
}
