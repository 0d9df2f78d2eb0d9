package org.pragmatica.pwsh.ast;

import java.util.Objects;

/**
 * Condition and body of an {@code if} or {@code elseif} branch.
 */
public record IfClause(Statement.PipelineBase condition, StatementBlock body) implements Node {
    public IfClause {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visitIfClause(this);
    }
}
