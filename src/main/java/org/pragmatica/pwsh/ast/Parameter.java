package org.pragmatica.pwsh.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parameter declaration: attributes and type constraints, the variable, an optional default.
 */
public record Parameter(Expression.VariableExpression name,
                        List<AttributeBase> attributes,
                        Optional<Expression> defaultValue) implements Node {
    public Parameter {
        Objects.requireNonNull(name, "name");
        attributes = List.copyOf(attributes);
        Objects.requireNonNull(defaultValue, "defaultValue");
    }

    public static Parameter of(String name, AttributeBase... attributes) {
        return new Parameter(Expression.variable(name), List.of(attributes), Optional.empty());
    }

    public Parameter withDefault(Expression value) {
        return new Parameter(name, attributes, Optional.of(value));
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visitParameter(this);
    }
}
