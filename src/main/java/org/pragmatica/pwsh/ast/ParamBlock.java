package org.pragmatica.pwsh.ast;

import java.util.List;

/**
 * {@code param(...)} declaration, with the attributes written above it.
 */
public record ParamBlock(List<AttributeBase.Attribute> attributes, List<Parameter> parameters) implements Node {
    public ParamBlock {
        attributes = List.copyOf(attributes);
        parameters = List.copyOf(parameters);
    }

    public static ParamBlock of(Parameter... parameters) {
        return new ParamBlock(List.of(), List.of(parameters));
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visitParamBlock(this);
    }
}
