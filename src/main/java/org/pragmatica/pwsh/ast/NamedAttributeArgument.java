package org.pragmatica.pwsh.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * Named attribute argument: {@code Name = value}, or just {@code Name} when the value is omitted.
 */
public record NamedAttributeArgument(String name, Optional<Expression> argument) implements Node {
    public NamedAttributeArgument {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(argument, "argument");
    }

    public static NamedAttributeArgument of(String name) {
        return new NamedAttributeArgument(name, Optional.empty());
    }

    public static NamedAttributeArgument of(String name, Expression argument) {
        return new NamedAttributeArgument(name, Optional.of(argument));
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visitNamedAttributeArgument(this);
    }
}
