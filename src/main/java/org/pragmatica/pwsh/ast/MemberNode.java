package org.pragmatica.pwsh.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Members of a type definition.
 */
public sealed interface MemberNode extends Node {

    String name();

    static PropertyMember property(String name) {
        return new PropertyMember(name, Optional.empty(), Optional.empty(), false, false);
    }

    static PropertyMember property(String typeName, String name) {
        return new PropertyMember(name, Optional.of(AttributeBase.typeConstraint(typeName)), Optional.empty(), false, false);
    }

    static FunctionMember method(String returnType, String name, List<Parameter> parameters, ScriptBlock body) {
        return new FunctionMember(name,
                                  Optional.of(AttributeBase.typeConstraint(returnType)),
                                  parameters,
                                  body,
                                  false,
                                  false,
                                  false);
    }

    static FunctionMember constructor(String name, List<Parameter> parameters, ScriptBlock body) {
        return new FunctionMember(name, Optional.empty(), parameters, body, false, false, true);
    }

    /**
     * Property: {@code static hidden [type]$Name = value}. In an enum, the enumerator {@code Name = value}.
     */
    record PropertyMember(String name,
                          Optional<AttributeBase.TypeConstraint> propertyType,
                          Optional<Expression> initialValue,
                          boolean isStatic,
                          boolean isHidden) implements MemberNode {
        public PropertyMember {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(propertyType, "propertyType");
            Objects.requireNonNull(initialValue, "initialValue");
        }

        public PropertyMember withInitialValue(Expression value) {
            return new PropertyMember(name, propertyType, Optional.of(value), isStatic, isHidden);
        }

        public PropertyMember asStatic() {
            return new PropertyMember(name, propertyType, initialValue, true, isHidden);
        }

        public PropertyMember asHidden() {
            return new PropertyMember(name, propertyType, initialValue, isStatic, true);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitPropertyMember(this);
        }
    }

    /**
     * Method or constructor. Constructors carry no modifiers and no return type.
     */
    record FunctionMember(String name,
                          Optional<AttributeBase.TypeConstraint> returnType,
                          List<Parameter> parameters,
                          ScriptBlock body,
                          boolean isStatic,
                          boolean isHidden,
                          boolean isConstructor) implements MemberNode {
        public FunctionMember {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(returnType, "returnType");
            parameters = List.copyOf(parameters);
            Objects.requireNonNull(body, "body");
        }

        public FunctionMember asStatic() {
            return new FunctionMember(name, returnType, parameters, body, true, isHidden, isConstructor);
        }

        public FunctionMember asHidden() {
            return new FunctionMember(name, returnType, parameters, body, isStatic, true, isConstructor);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitFunctionMember(this);
        }
    }
}
