package org.pragmatica.pwsh.printer;

import org.pragmatica.pwsh.ast.RedirectionStream;
import org.pragmatica.pwsh.ast.TokenKind;
import org.pragmatica.pwsh.error.RenderError;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical spelling of operator, punctuation and keyword tokens, and the digit codes of
 * redirection streams.
 */
public final class Lexemes {
    private static final Map<TokenKind, String> TOKENS = buildTokenTable();
    private static final Map<RedirectionStream, Character> STREAMS = buildStreamTable();

    private Lexemes() {}

    /**
     * Canonical spelling of a token, or {@link RenderError.UnsupportedToken} for tokens
     * that carry their own text ({@code VARIABLE}, {@code NUMBER}, ...).
     */
    public static RenderResult lexemeFor(TokenKind token) {
        return lookup(token).map(RenderResult::success)
                            .orElseGet(() -> RenderResult.failure(new RenderError.UnsupportedToken(token)));
    }

    public static Optional<String> lookup(TokenKind token) {
        return Optional.ofNullable(TOKENS.get(token));
    }

    public static char streamIndicator(RedirectionStream stream) {
        return STREAMS.get(stream);
    }

    public static Map<TokenKind, String> tokens() {
        return Collections.unmodifiableMap(TOKENS);
    }

    private static Map<TokenKind, String> buildTokenTable() {
        var table = new EnumMap<TokenKind, String>(TokenKind.class);

        // Punctuation
        table.put(TokenKind.NEW_LINE, "\n");
        table.put(TokenKind.LPAREN, "(");
        table.put(TokenKind.RPAREN, ")");
        table.put(TokenKind.LCURLY, "{");
        table.put(TokenKind.RCURLY, "}");
        table.put(TokenKind.LBRACKET, "[");
        table.put(TokenKind.RBRACKET, "]");
        table.put(TokenKind.AT_PAREN, "@(");
        table.put(TokenKind.AT_CURLY, "@{");
        table.put(TokenKind.DOLLAR_PAREN, "$(");
        table.put(TokenKind.SEMI, ";");
        table.put(TokenKind.AND_AND, "&&");
        table.put(TokenKind.OR_OR, "||");
        table.put(TokenKind.AMPERSAND, "&");
        table.put(TokenKind.PIPE, "|");
        table.put(TokenKind.COMMA, ",");
        table.put(TokenKind.MINUS_MINUS, "--");
        table.put(TokenKind.PLUS_PLUS, "++");
        table.put(TokenKind.DOT_DOT, "..");
        table.put(TokenKind.COLON_COLON, "::");
        table.put(TokenKind.DOT, ".");
        table.put(TokenKind.EXCLAIM, "!");
        table.put(TokenKind.MULTIPLY, "*");
        table.put(TokenKind.DIVIDE, "/");
        table.put(TokenKind.REM, "%");
        table.put(TokenKind.PLUS, "+");
        table.put(TokenKind.MINUS, "-");
        table.put(TokenKind.EQUALS, "=");
        table.put(TokenKind.PLUS_EQUALS, "+=");
        table.put(TokenKind.MINUS_EQUALS, "-=");
        table.put(TokenKind.MULTIPLY_EQUALS, "*=");
        table.put(TokenKind.DIVIDE_EQUALS, "/=");
        table.put(TokenKind.REMAINDER_EQUALS, "%=");
        table.put(TokenKind.QUESTION_MARK, "?");
        table.put(TokenKind.QUESTION_QUESTION, "??");
        table.put(TokenKind.QUESTION_QUESTION_EQUALS, "??=");
        table.put(TokenKind.QUESTION_DOT, "?.");
        table.put(TokenKind.QUESTION_LBRACKET, "?[");
        table.put(TokenKind.COLON, ":");
        table.put(TokenKind.POSTFIX_PLUS_PLUS, "++");
        table.put(TokenKind.POSTFIX_MINUS_MINUS, "--");

        // Operators
        table.put(TokenKind.FORMAT, "-f");
        table.put(TokenKind.NOT, "-not");
        table.put(TokenKind.BNOT, "-bnot");
        table.put(TokenKind.AND, "-and");
        table.put(TokenKind.OR, "-or");
        table.put(TokenKind.XOR, "-xor");
        table.put(TokenKind.BAND, "-band");
        table.put(TokenKind.BOR, "-bor");
        table.put(TokenKind.BXOR, "-bxor");
        table.put(TokenKind.JOIN, "-join");
        table.put(TokenKind.IEQ, "-eq");
        table.put(TokenKind.INE, "-ne");
        table.put(TokenKind.IGE, "-ge");
        table.put(TokenKind.IGT, "-gt");
        table.put(TokenKind.ILT, "-lt");
        table.put(TokenKind.ILE, "-le");
        table.put(TokenKind.ILIKE, "-like");
        table.put(TokenKind.INOTLIKE, "-notlike");
        table.put(TokenKind.IMATCH, "-match");
        table.put(TokenKind.INOTMATCH, "-notmatch");
        table.put(TokenKind.IREPLACE, "-replace");
        table.put(TokenKind.ICONTAINS, "-contains");
        table.put(TokenKind.INOTCONTAINS, "-notcontains");
        table.put(TokenKind.IIN, "-in");
        table.put(TokenKind.INOTIN, "-notin");
        table.put(TokenKind.ISPLIT, "-split");
        table.put(TokenKind.CEQ, "-ceq");
        table.put(TokenKind.CNE, "-cne");
        table.put(TokenKind.CGE, "-cge");
        table.put(TokenKind.CGT, "-cgt");
        table.put(TokenKind.CLT, "-clt");
        table.put(TokenKind.CLE, "-cle");
        table.put(TokenKind.CLIKE, "-clike");
        table.put(TokenKind.CNOTLIKE, "-cnotlike");
        table.put(TokenKind.CMATCH, "-cmatch");
        table.put(TokenKind.CNOTMATCH, "-cnotmatch");
        table.put(TokenKind.CREPLACE, "-creplace");
        table.put(TokenKind.CCONTAINS, "-ccontains");
        table.put(TokenKind.CNOTCONTAINS, "-cnotcontains");
        table.put(TokenKind.CIN, "-cin");
        table.put(TokenKind.CNOTIN, "-cnotin");
        table.put(TokenKind.CSPLIT, "-csplit");
        table.put(TokenKind.IS, "-is");
        table.put(TokenKind.IS_NOT, "-isnot");
        table.put(TokenKind.AS, "-as");
        table.put(TokenKind.SHL, "-shl");
        table.put(TokenKind.SHR, "-shr");

        // Keywords
        table.put(TokenKind.BEGIN, "begin");
        table.put(TokenKind.BREAK, "break");
        table.put(TokenKind.CATCH, "catch");
        table.put(TokenKind.CLASS, "class");
        table.put(TokenKind.CLEAN, "clean");
        table.put(TokenKind.CONTINUE, "continue");
        table.put(TokenKind.DATA, "data");
        table.put(TokenKind.DEFINE, "define");
        table.put(TokenKind.DO, "do");
        table.put(TokenKind.DYNAMICPARAM, "dynamicparam");
        table.put(TokenKind.ELSE, "else");
        table.put(TokenKind.ELSE_IF, "elseif");
        table.put(TokenKind.END, "end");
        table.put(TokenKind.EXIT, "exit");
        table.put(TokenKind.FILTER, "filter");
        table.put(TokenKind.FINALLY, "finally");
        table.put(TokenKind.FOR, "for");
        table.put(TokenKind.FOREACH, "foreach");
        table.put(TokenKind.FROM, "from");
        table.put(TokenKind.FUNCTION, "function");
        table.put(TokenKind.IF, "if");
        table.put(TokenKind.IN, "in");
        table.put(TokenKind.PARAM, "param");
        table.put(TokenKind.PROCESS, "process");
        table.put(TokenKind.RETURN, "return");
        table.put(TokenKind.SWITCH, "switch");
        table.put(TokenKind.THROW, "throw");
        table.put(TokenKind.TRAP, "trap");
        table.put(TokenKind.TRY, "try");
        table.put(TokenKind.UNTIL, "until");
        table.put(TokenKind.USING, "using");
        table.put(TokenKind.VAR, "var");
        table.put(TokenKind.WHILE, "while");
        table.put(TokenKind.WORKFLOW, "workflow");
        table.put(TokenKind.PARALLEL, "parallel");
        table.put(TokenKind.SEQUENCE, "sequence");
        table.put(TokenKind.INLINE_SCRIPT, "inlinescript");
        table.put(TokenKind.CONFIGURATION, "configuration");
        table.put(TokenKind.PUBLIC, "public");
        table.put(TokenKind.PRIVATE, "private");
        table.put(TokenKind.STATIC, "static");
        table.put(TokenKind.INTERFACE, "interface");
        table.put(TokenKind.ENUM, "enum");
        table.put(TokenKind.NAMESPACE, "namespace");
        table.put(TokenKind.MODULE, "module");
        table.put(TokenKind.TYPE, "type");
        table.put(TokenKind.ASSEMBLY, "assembly");
        table.put(TokenKind.COMMAND, "command");
        table.put(TokenKind.HIDDEN, "hidden");
        table.put(TokenKind.BASE, "base");
        table.put(TokenKind.DEFAULT, "default");

        return table;
    }

    private static Map<RedirectionStream, Character> buildStreamTable() {
        var table = new EnumMap<RedirectionStream, Character>(RedirectionStream.class);
        table.put(RedirectionStream.ALL, '*');
        table.put(RedirectionStream.OUTPUT, '1');
        table.put(RedirectionStream.ERROR, '2');
        table.put(RedirectionStream.WARNING, '3');
        table.put(RedirectionStream.VERBOSE, '4');
        table.put(RedirectionStream.DEBUG, '5');
        table.put(RedirectionStream.INFORMATION, '6');
        return table;
    }
}
