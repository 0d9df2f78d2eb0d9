package org.pragmatica.pwsh.ast;

/**
 * A syntax tree node. Nodes are immutable; a tree is built by its producer and only
 * read by consumers such as the renderer.
 */
public sealed interface Node permits CommandElement,
                                     Statement,
                                     MemberNode,
                                     Redirection,
                                     AttributeBase,
                                     TypeName,
                                     ScriptBlock,
                                     NamedBlock,
                                     ParamBlock,
                                     Parameter,
                                     StatementBlock,
                                     HashtableEntry,
                                     IfClause,
                                     NamedAttributeArgument {

    /**
     * Dispatch to the visitor method for this node's concrete kind.
     */
    void accept(NodeVisitor visitor);
}
