package org.pragmatica.pwsh.ast;

/**
 * How a string literal was quoted in source.
 */
public enum StringConstantType {
    BARE_WORD,
    SINGLE_QUOTED,
    DOUBLE_QUOTED,
    SINGLE_QUOTED_HERE_STRING,
    DOUBLE_QUOTED_HERE_STRING
}
