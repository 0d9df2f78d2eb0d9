package org.pragmatica.pwsh.ast;

import java.util.List;

/**
 * Braced sequence of statements, with the traps that guard them.
 */
public record StatementBlock(List<Statement.TrapStatement> traps, List<Statement> statements) implements Node {
    public StatementBlock {
        traps = List.copyOf(traps);
        statements = List.copyOf(statements);
    }

    public static StatementBlock of(Statement... statements) {
        return new StatementBlock(List.of(), List.of(statements));
    }

    public static StatementBlock empty() {
        return new StatementBlock(List.of(), List.of());
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visitStatementBlock(this);
    }
}
