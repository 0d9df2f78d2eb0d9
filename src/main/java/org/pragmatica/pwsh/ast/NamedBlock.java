package org.pragmatica.pwsh.ast;

import java.util.List;
import java.util.Objects;

/**
 * One execution phase of a script block. An unnamed block is the implicit {@code end}
 * block of a script block that declares no phases.
 */
public record NamedBlock(BlockKind kind, List<Statement.TrapStatement> traps, List<Statement> statements, boolean unnamed)
    implements Node {
    public NamedBlock {
        Objects.requireNonNull(kind, "kind");
        traps = List.copyOf(traps);
        statements = List.copyOf(statements);
    }

    public static NamedBlock of(BlockKind kind, Statement... statements) {
        return new NamedBlock(kind, List.of(), List.of(statements), false);
    }

    public static NamedBlock unnamed(Statement... statements) {
        return new NamedBlock(BlockKind.END, List.of(), List.of(statements), true);
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visitNamedBlock(this);
    }
}
