package org.pragmatica.pwsh.ast;

import java.util.Objects;

/**
 * {@code key = value} pair of a hashtable literal. The value is a full statement.
 */
public record HashtableEntry(Expression key, Statement value) implements Node {
    public HashtableEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public static HashtableEntry of(String key, Expression value) {
        return new HashtableEntry(Expression.bareWord(key), Statement.pipeline(value));
    }

    public static HashtableEntry of(Expression key, Expression value) {
        return new HashtableEntry(key, Statement.pipeline(value));
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visitHashtableEntry(this);
    }
}
