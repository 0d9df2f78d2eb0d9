package org.pragmatica.pwsh.ast;

/**
 * Execution phases of a script block.
 */
public enum BlockKind {
    DYNAMICPARAM(TokenKind.DYNAMICPARAM),
    BEGIN(TokenKind.BEGIN),
    PROCESS(TokenKind.PROCESS),
    END(TokenKind.END);

    private final TokenKind keyword;

    BlockKind(TokenKind keyword) {
        this.keyword = keyword;
    }

    public TokenKind keyword() {
        return keyword;
    }
}
