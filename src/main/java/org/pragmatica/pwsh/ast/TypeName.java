package org.pragmatica.pwsh.ast;

import java.util.List;
import java.util.Objects;

/**
 * Type names as written inside brackets.
 */
public sealed interface TypeName extends Node {

    static SimpleTypeName simple(String fullName) {
        return new SimpleTypeName(fullName);
    }

    static ArrayTypeName array(TypeName elementType, int rank) {
        return new ArrayTypeName(elementType, rank);
    }

    static GenericTypeName generic(String name, TypeName... arguments) {
        return new GenericTypeName(simple(name), List.of(arguments));
    }

    /**
     * Dotted name: {@code System.Collections.Hashtable}
     */
    record SimpleTypeName(String fullName) implements TypeName {
        public SimpleTypeName {
            Objects.requireNonNull(fullName, "fullName");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitSimpleTypeName(this);
        }
    }

    /**
     * {@code int[]} for rank 1, {@code int[,]} for rank 2 and so on.
     */
    record ArrayTypeName(TypeName elementType, int rank) implements TypeName {
        public ArrayTypeName {
            Objects.requireNonNull(elementType, "elementType");
            if (rank < 1) {
                throw new IllegalArgumentException("Array rank must be positive: " + rank);
            }
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitArrayTypeName(this);
        }
    }

    /**
     * {@code List[string]}, {@code Dictionary[string, int]}
     */
    record GenericTypeName(SimpleTypeName typeDefinition, List<TypeName> arguments) implements TypeName {
        public GenericTypeName {
            Objects.requireNonNull(typeDefinition, "typeDefinition");
            arguments = List.copyOf(arguments);
            if (arguments.isEmpty()) {
                throw new IllegalArgumentException("Generic type requires at least one argument");
            }
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitGenericTypeName(this);
        }
    }
}
