package org.pragmatica.pwsh.ast;

/**
 * Operator, punctuation and keyword tokens that syntax nodes refer to.
 *
 * <p>Token kinds that carry source text of their own (variables, numbers, literals,
 * comments) are listed too, so that trees produced by a tokenizer can name them,
 * but they have no canonical spelling.
 */
public enum TokenKind {
    // Tokens without a fixed spelling
    UNKNOWN,
    VARIABLE,
    SPLATTED_VARIABLE,
    PARAMETER,
    NUMBER,
    LABEL,
    IDENTIFIER,
    GENERIC,
    LINE_CONTINUATION,
    COMMENT,
    END_OF_INPUT,
    STRING_LITERAL,
    STRING_EXPANDABLE,
    HERE_STRING_LITERAL,
    HERE_STRING_EXPANDABLE,
    REDIRECTION,
    REDIRECT_IN,

    // Punctuation
    NEW_LINE,
    LPAREN,
    RPAREN,
    LCURLY,
    RCURLY,
    LBRACKET,
    RBRACKET,
    AT_PAREN,
    AT_CURLY,
    DOLLAR_PAREN,
    SEMI,
    AND_AND,
    OR_OR,
    AMPERSAND,
    PIPE,
    COMMA,
    MINUS_MINUS,
    PLUS_PLUS,
    DOT_DOT,
    COLON_COLON,
    DOT,
    EXCLAIM,
    MULTIPLY,
    DIVIDE,
    REM,
    PLUS,
    MINUS,
    EQUALS,
    PLUS_EQUALS,
    MINUS_EQUALS,
    MULTIPLY_EQUALS,
    DIVIDE_EQUALS,
    REMAINDER_EQUALS,
    QUESTION_MARK,
    QUESTION_QUESTION,
    QUESTION_QUESTION_EQUALS,
    QUESTION_DOT,
    QUESTION_LBRACKET,
    COLON,
    POSTFIX_PLUS_PLUS,
    POSTFIX_MINUS_MINUS,

    // Operators
    FORMAT,
    NOT,
    BNOT,
    AND,
    OR,
    XOR,
    BAND,
    BOR,
    BXOR,
    JOIN,
    IEQ,
    INE,
    IGE,
    IGT,
    ILT,
    ILE,
    ILIKE,
    INOTLIKE,
    IMATCH,
    INOTMATCH,
    IREPLACE,
    ICONTAINS,
    INOTCONTAINS,
    IIN,
    INOTIN,
    ISPLIT,
    CEQ,
    CNE,
    CGE,
    CGT,
    CLT,
    CLE,
    CLIKE,
    CNOTLIKE,
    CMATCH,
    CNOTMATCH,
    CREPLACE,
    CCONTAINS,
    CNOTCONTAINS,
    CIN,
    CNOTIN,
    CSPLIT,
    IS,
    IS_NOT,
    AS,
    SHL,
    SHR,

    // Keywords
    BEGIN,
    BREAK,
    CATCH,
    CLASS,
    CLEAN,
    CONTINUE,
    DATA,
    DEFINE,
    DO,
    DYNAMICPARAM,
    ELSE,
    ELSE_IF,
    END,
    EXIT,
    FILTER,
    FINALLY,
    FOR,
    FOREACH,
    FROM,
    FUNCTION,
    IF,
    IN,
    PARAM,
    PROCESS,
    RETURN,
    SWITCH,
    THROW,
    TRAP,
    TRY,
    UNTIL,
    USING,
    VAR,
    WHILE,
    WORKFLOW,
    PARALLEL,
    SEQUENCE,
    INLINE_SCRIPT,
    CONFIGURATION,
    PUBLIC,
    PRIVATE,
    STATIC,
    INTERFACE,
    ENUM,
    NAMESPACE,
    MODULE,
    TYPE,
    ASSEMBLY,
    COMMAND,
    HIDDEN,
    BASE,
    DEFAULT
}
