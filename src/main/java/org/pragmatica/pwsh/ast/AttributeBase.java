package org.pragmatica.pwsh.ast;

import java.util.List;
import java.util.Objects;

/**
 * Bracketed annotations: attributes with arguments and plain type constraints.
 */
public sealed interface AttributeBase extends Node {

    TypeName typeName();

    static TypeConstraint typeConstraint(String typeName) {
        return new TypeConstraint(TypeName.simple(typeName));
    }

    static Attribute attribute(String typeName) {
        return new Attribute(TypeName.simple(typeName), List.of(), List.of());
    }

    static Attribute attribute(String typeName, Expression... positionalArguments) {
        return new Attribute(TypeName.simple(typeName), List.of(positionalArguments), List.of());
    }

    static Attribute attribute(String typeName, NamedAttributeArgument... namedArguments) {
        return new Attribute(TypeName.simple(typeName), List.of(), List.of(namedArguments));
    }

    /**
     * {@code [Name(positional, Named = value)]}
     */
    record Attribute(TypeName typeName,
                     List<Expression> positionalArguments,
                     List<NamedAttributeArgument> namedArguments) implements AttributeBase {
        public Attribute {
            Objects.requireNonNull(typeName, "typeName");
            positionalArguments = List.copyOf(positionalArguments);
            namedArguments = List.copyOf(namedArguments);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitAttribute(this);
        }
    }

    /**
     * {@code [TypeName]}
     */
    record TypeConstraint(TypeName typeName) implements AttributeBase {
        public TypeConstraint {
            Objects.requireNonNull(typeName, "typeName");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitTypeConstraint(this);
        }
    }
}
