package org.pragmatica.pwsh.error;

import org.pragmatica.pwsh.ast.TokenKind;

/**
 * Reasons a syntax tree cannot be rendered. Both are contract violations by the tree's
 * producer rather than runtime conditions, so they are never retried.
 */
public sealed interface RenderError {

    String message();

    /**
     * The tree contains a construct the renderer has no canonical layout for.
     */
    record UnsupportedConstruct(String construct) implements RenderError {
        @Override
        public String message() {
            return "Unsupported construct: " + construct;
        }
    }

    /**
     * The tree refers to a token that has no canonical spelling.
     */
    record UnsupportedToken(TokenKind token) implements RenderError {
        @Override
        public String message() {
            return "Unsupported token: " + token;
        }
    }
}
