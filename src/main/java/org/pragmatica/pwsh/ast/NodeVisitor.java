package org.pragmatica.pwsh.ast;

/**
 * One method per concrete node kind. Adding a node kind adds a method here, so every
 * visitor has to decide what to do with it before it compiles again.
 */
public interface NodeVisitor {

    // Expressions
    void visitConstantExpression(Expression.ConstantExpression node);

    void visitStringConstantExpression(Expression.StringConstantExpression node);

    void visitExpandableStringExpression(Expression.ExpandableStringExpression node);

    void visitArrayLiteral(Expression.ArrayLiteral node);

    void visitArrayExpression(Expression.ArrayExpression node);

    void visitHashtableExpression(Expression.HashtableExpression node);

    void visitVariableExpression(Expression.VariableExpression node);

    void visitMemberExpression(Expression.MemberExpression node);

    void visitInvokeMemberExpression(Expression.InvokeMemberExpression node);

    void visitBaseCtorInvokeMemberExpression(Expression.BaseCtorInvokeMemberExpression node);

    void visitIndexExpression(Expression.IndexExpression node);

    void visitUnaryExpression(Expression.UnaryExpression node);

    void visitBinaryExpression(Expression.BinaryExpression node);

    void visitTernaryExpression(Expression.TernaryExpression node);

    void visitParenExpression(Expression.ParenExpression node);

    void visitSubExpression(Expression.SubExpression node);

    void visitTypeExpression(Expression.TypeExpression node);

    void visitConvertExpression(Expression.ConvertExpression node);

    void visitAttributedExpression(Expression.AttributedExpression node);

    void visitUsingExpression(Expression.UsingExpression node);

    void visitScriptBlockExpression(Expression.ScriptBlockExpression node);

    void visitErrorExpression(Expression.ErrorExpression node);

    // Command elements
    void visitCommandParameter(CommandElement.CommandParameter node);

    // Statements
    void visitPipeline(Statement.Pipeline node);

    void visitPipelineChain(Statement.PipelineChain node);

    void visitAssignmentStatement(Statement.AssignmentStatement node);

    void visitCommand(Statement.Command node);

    void visitCommandExpression(Statement.CommandExpression node);

    void visitIfStatement(Statement.IfStatement node);

    void visitWhileStatement(Statement.WhileStatement node);

    void visitDoWhileStatement(Statement.DoWhileStatement node);

    void visitDoUntilStatement(Statement.DoUntilStatement node);

    void visitForStatement(Statement.ForStatement node);

    void visitForEachStatement(Statement.ForEachStatement node);

    void visitBreakStatement(Statement.BreakStatement node);

    void visitContinueStatement(Statement.ContinueStatement node);

    void visitReturnStatement(Statement.ReturnStatement node);

    void visitExitStatement(Statement.ExitStatement node);

    void visitThrowStatement(Statement.ThrowStatement node);

    void visitTrapStatement(Statement.TrapStatement node);

    void visitFunctionDefinition(Statement.FunctionDefinition node);

    void visitTypeDefinition(Statement.TypeDefinition node);

    void visitSwitchStatement(Statement.SwitchStatement node);

    void visitTryStatement(Statement.TryStatement node);

    void visitBlockStatement(Statement.BlockStatement node);

    void visitDataStatement(Statement.DataStatement node);

    void visitConfigurationDefinition(Statement.ConfigurationDefinition node);

    void visitDynamicKeywordStatement(Statement.DynamicKeywordStatement node);

    void visitErrorStatement(Statement.ErrorStatement node);

    void visitUsingStatement(Statement.UsingStatement node);

    // Type members
    void visitPropertyMember(MemberNode.PropertyMember node);

    void visitFunctionMember(MemberNode.FunctionMember node);

    // Redirections
    void visitFileRedirection(Redirection.FileRedirection node);

    void visitMergingRedirection(Redirection.MergingRedirection node);

    // Attributes and type names
    void visitAttribute(AttributeBase.Attribute node);

    void visitTypeConstraint(AttributeBase.TypeConstraint node);

    void visitNamedAttributeArgument(NamedAttributeArgument node);

    void visitSimpleTypeName(TypeName.SimpleTypeName node);

    void visitArrayTypeName(TypeName.ArrayTypeName node);

    void visitGenericTypeName(TypeName.GenericTypeName node);

    // Structure
    void visitScriptBlock(ScriptBlock node);

    void visitNamedBlock(NamedBlock node);

    void visitParamBlock(ParamBlock node);

    void visitParameter(Parameter node);

    void visitStatementBlock(StatementBlock node);

    void visitHashtableEntry(HashtableEntry node);

    void visitIfClause(IfClause node);
}
