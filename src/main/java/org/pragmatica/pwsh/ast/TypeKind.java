package org.pragmatica.pwsh.ast;

/**
 * Flavours of user-defined types.
 */
public enum TypeKind {
    CLASS(TokenKind.CLASS),
    INTERFACE(TokenKind.INTERFACE),
    ENUM(TokenKind.ENUM);

    private final TokenKind keyword;

    TypeKind(TokenKind keyword) {
        this.keyword = keyword;
    }

    public TokenKind keyword() {
        return keyword;
    }
}
