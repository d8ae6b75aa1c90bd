package io.hapconf.core.error;

import io.hapconf.core.model.SourceLocation;

/**
 * Thrown when a pipeline invariant is broken, for example an unresolved interpolation or a
 * pending template spread reaching the code generator. Indicates a bug in an earlier pass rather
 * than a problem in the user's source.
 */
public final class InternalTranslationException extends TranslateException {

    private static final long serialVersionUID = 1L;

    public InternalTranslationException(String message, SourceLocation location) {
        super(message, Phase.GENERATE, location);
    }
}
