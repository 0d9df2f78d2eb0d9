package org.pragmatica.pwsh.ast;

/**
 * Targets of a top-level {@code using} directive.
 */
public enum UsingKind {
    NAMESPACE(TokenKind.NAMESPACE),
    ASSEMBLY(TokenKind.ASSEMBLY),
    MODULE(TokenKind.MODULE);

    private final TokenKind keyword;

    UsingKind(TokenKind keyword) {
        this.keyword = keyword;
    }

    public TokenKind keyword() {
        return keyword;
    }
}
