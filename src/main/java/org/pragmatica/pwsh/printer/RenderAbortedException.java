package org.pragmatica.pwsh.printer;

import org.pragmatica.pwsh.error.RenderError;

/**
 * Unwinds the traversal when a node cannot be rendered. Never leaves this package:
 * the entry points turn it into a {@link RenderResult.Failure}.
 */
final class RenderAbortedException extends RuntimeException {
    private final transient RenderError error;

    RenderAbortedException(RenderError error) {
        super(error.message(), null, false, false);
        this.error = error;
    }

    RenderError error() {
        return error;
    }
}
