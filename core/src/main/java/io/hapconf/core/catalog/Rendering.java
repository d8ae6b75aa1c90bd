package io.hapconf.core.catalog;

/** How a property value is written out by the code generator. */
public enum Rendering {
    /** Boolean: the bare keyword when true, nothing when false. */
    FLAG,
    /** {@code keyword value}. */
    SCALAR,
    /** One {@code keyword item} line (or token pair) per list item. */
    REPEATED,
    /** {@code keyword a b c}. */
    SPACE_JOINED,
    /** {@code keyword a,b,c}. */
    COMMA_JOINED,
    /** One {@code keyword key value} line per object entry, e.g. {@code errorfile 503 /x.http}. */
    KEYED_LINES
}
