package org.pragmatica.pwsh.printer;

import org.pragmatica.pwsh.ast.Expression;
import org.pragmatica.pwsh.ast.ScriptBlock;
import org.pragmatica.pwsh.ast.Statement;

/**
 * Printer interface - renders syntax trees as PowerShell source.
 */
public interface Printer {

    /**
     * Render a single statement.
     */
    RenderResult renderStatement(Statement statement);

    /**
     * Render a single expression.
     */
    RenderResult renderExpression(Expression expression);

    /**
     * Render a {@code using} directive, terminated by a line break.
     */
    RenderResult renderUsingDirective(Statement.UsingStatement directive);

    /**
     * Render a top-level script: its {@code using} directives, then its body without braces.
     */
    RenderResult renderScript(ScriptBlock script);
}
