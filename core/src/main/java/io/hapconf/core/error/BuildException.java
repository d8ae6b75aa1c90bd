package io.hapconf.core.error;

import io.hapconf.core.model.SourceLocation;

/** Thrown when a syntactically valid tree has an impossible shape (e.g. a server outside a backend). */
public final class BuildException extends TranslateException {

    private static final long serialVersionUID = 1L;

    public BuildException(String message, SourceLocation location) {
        super(message, Phase.BUILD, location);
    }
}
