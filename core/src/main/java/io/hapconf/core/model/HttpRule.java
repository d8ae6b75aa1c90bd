package io.hapconf.core.model;

import java.util.List;

/** Common shape of {@code http-request} and {@code http-response} rules. */
public interface HttpRule extends IrNode {

    /** Action as written in the DSL, e.g. {@code set_header} or {@code lua.auth}. */
    String action();

    /** Positional arguments in declaration order. */
    List<Value> args();

    /** Named parameters ({@code status: 403}) in declaration order. */
    Properties params();

    /** The rule condition, or {@code null}. */
    Condition condition();

    /** Target directive keyword: {@code http-request} or {@code http-response}. */
    String directive();
}
