package org.pragmatica.pwsh.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Statement nodes - the units a statement block is made of.
 */
public sealed interface Statement extends Node {

    // === Factories ===

    static Pipeline pipeline(CommandBase... elements) {
        return new Pipeline(List.of(elements), false);
    }

    static Pipeline pipeline(Expression expression) {
        return pipeline(commandExpression(expression));
    }

    static Pipeline background(CommandBase... elements) {
        return new Pipeline(List.of(elements), true);
    }

    static PipelineChain chain(PipelineBase left, TokenKind operator, Pipeline right) {
        return new PipelineChain(left, operator, right, false);
    }

    static AssignmentStatement assign(Expression left, TokenKind operator, Statement right) {
        return new AssignmentStatement(left, operator, right);
    }

    static AssignmentStatement assign(Expression left, Expression right) {
        return assign(left, TokenKind.EQUALS, pipeline(right));
    }

    static Command command(CommandElement... elements) {
        return new Command(Optional.empty(), List.of(elements), List.of());
    }

    static Command command(String name, CommandElement... arguments) {
        var elements = new ArrayList<CommandElement>();
        elements.add(Expression.bareWord(name));
        elements.addAll(List.of(arguments));
        return new Command(Optional.empty(), elements, List.of());
    }

    static Command invoke(TokenKind invocationOperator, CommandElement... elements) {
        return new Command(Optional.of(invocationOperator), List.of(elements), List.of());
    }

    static CommandExpression commandExpression(Expression expression) {
        return new CommandExpression(expression, List.of());
    }

    static IfStatement ifStatement(PipelineBase condition, StatementBlock body) {
        return new IfStatement(List.of(new IfClause(condition, body)), Optional.empty());
    }

    static WhileStatement whileLoop(PipelineBase condition, StatementBlock body) {
        return new WhileStatement(condition, body);
    }

    static ForEachStatement forEach(Expression.VariableExpression variable, PipelineBase iterable, StatementBlock body) {
        return new ForEachStatement(variable, iterable, body);
    }

    static ReturnStatement returnStatement(PipelineBase pipeline) {
        return new ReturnStatement(Optional.of(pipeline));
    }

    static ThrowStatement throwStatement(PipelineBase pipeline) {
        return new ThrowStatement(Optional.of(pipeline));
    }

    static FunctionDefinition function(String name, ScriptBlock body) {
        return new FunctionDefinition(name, false, body);
    }

    static FunctionDefinition filter(String name, ScriptBlock body) {
        return new FunctionDefinition(name, true, body);
    }

    static UsingStatement using(UsingKind kind, String name) {
        return new UsingStatement(kind, Expression.bareWord(name), Optional.empty());
    }

    // === Pipelines ===

    /**
     * Statements that can stand where a pipeline is expected: conditions, parenthesized
     * expressions, the operands of {@code return} and friends.
     */
    sealed interface PipelineBase extends Statement {}

    /**
     * Commands or expressions joined by {@code |}, optionally sent to the background with {@code &}.
     */
    record Pipeline(List<CommandBase> elements, boolean background) implements PipelineBase {
        public Pipeline {
            elements = List.copyOf(elements);
            if (elements.isEmpty()) {
                throw new IllegalArgumentException("Pipeline requires at least one element");
            }
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitPipeline(this);
        }
    }

    /**
     * Pipelines joined by {@code &&} or {@code ||}.
     */
    record PipelineChain(PipelineBase left, TokenKind operator, Pipeline right, boolean background) implements PipelineBase {
        public PipelineChain {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitPipelineChain(this);
        }
    }

    record AssignmentStatement(Expression left, TokenKind operator, Statement right) implements PipelineBase {
        public AssignmentStatement {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitAssignmentStatement(this);
        }
    }

    // === Commands ===

    /**
     * Elements of a pipeline.
     */
    sealed interface CommandBase extends Statement {
        List<Redirection> redirections();
    }

    /**
     * Command invocation, with an optional invocation operator ({@code &} or {@code .}).
     */
    record Command(Optional<TokenKind> invocationOperator,
                   List<CommandElement> elements,
                   List<Redirection> redirections) implements CommandBase {
        public Command {
            Objects.requireNonNull(invocationOperator, "invocationOperator");
            elements = List.copyOf(elements);
            redirections = List.copyOf(redirections);
        }

        public Command withRedirections(Redirection... redirections) {
            return new Command(invocationOperator, elements, List.of(redirections));
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitCommand(this);
        }
    }

    /**
     * Expression used as a pipeline element.
     */
    record CommandExpression(Expression expression, List<Redirection> redirections) implements CommandBase {
        public CommandExpression {
            Objects.requireNonNull(expression, "expression");
            redirections = List.copyOf(redirections);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitCommandExpression(this);
        }
    }

    // === Flow control ===

    /**
     * {@code if}, any number of {@code elseif} clauses and an optional {@code else}.
     */
    record IfStatement(List<IfClause> clauses, Optional<StatementBlock> elseClause) implements Statement {
        public IfStatement {
            clauses = List.copyOf(clauses);
            Objects.requireNonNull(elseClause, "elseClause");
            if (clauses.isEmpty()) {
                throw new IllegalArgumentException("If statement requires at least one clause");
            }
        }

        public IfStatement withElseIf(PipelineBase condition, StatementBlock body) {
            var extended = new java.util.ArrayList<>(clauses);
            extended.add(new IfClause(condition, body));
            return new IfStatement(extended, elseClause);
        }

        public IfStatement withElse(StatementBlock body) {
            return new IfStatement(clauses, Optional.of(body));
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitIfStatement(this);
        }
    }

    record WhileStatement(PipelineBase condition, StatementBlock body) implements Statement {
        public WhileStatement {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitWhileStatement(this);
        }
    }

    record DoWhileStatement(PipelineBase condition, StatementBlock body) implements Statement {
        public DoWhileStatement {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitDoWhileStatement(this);
        }
    }

    record DoUntilStatement(PipelineBase condition, StatementBlock body) implements Statement {
        public DoUntilStatement {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitDoUntilStatement(this);
        }
    }

    /**
     * {@code for (initializer; condition; iterator)} - each of the three parts may be omitted.
     */
    record ForStatement(Optional<PipelineBase> initializer,
                        Optional<PipelineBase> condition,
                        Optional<PipelineBase> iterator,
                        StatementBlock body) implements Statement {
        public ForStatement {
            Objects.requireNonNull(initializer, "initializer");
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(iterator, "iterator");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitForStatement(this);
        }
    }

    record ForEachStatement(Expression.VariableExpression variable, PipelineBase iterable, StatementBlock body)
        implements Statement {
        public ForEachStatement {
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(iterable, "iterable");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitForEachStatement(this);
        }
    }

    record BreakStatement(Optional<Expression> label) implements Statement {
        public BreakStatement {
            Objects.requireNonNull(label, "label");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBreakStatement(this);
        }
    }

    record ContinueStatement(Optional<Expression> label) implements Statement {
        public ContinueStatement {
            Objects.requireNonNull(label, "label");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitContinueStatement(this);
        }
    }

    record ReturnStatement(Optional<PipelineBase> pipeline) implements Statement {
        public ReturnStatement {
            Objects.requireNonNull(pipeline, "pipeline");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitReturnStatement(this);
        }
    }

    record ExitStatement(Optional<PipelineBase> pipeline) implements Statement {
        public ExitStatement {
            Objects.requireNonNull(pipeline, "pipeline");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitExitStatement(this);
        }
    }

    record ThrowStatement(Optional<PipelineBase> pipeline) implements Statement {
        public ThrowStatement {
            Objects.requireNonNull(pipeline, "pipeline");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitThrowStatement(this);
        }
    }

    /**
     * Block-scoped error handler: {@code trap [Type] { ... }}
     */
    record TrapStatement(Optional<AttributeBase.TypeConstraint> trapType, StatementBlock body) implements Statement {
        public TrapStatement {
            Objects.requireNonNull(trapType, "trapType");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitTrapStatement(this);
        }
    }

    // === Definitions ===

    record FunctionDefinition(String name, boolean isFilter, ScriptBlock body) implements Statement {
        public FunctionDefinition {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitFunctionDefinition(this);
        }
    }

    /**
     * Class, interface or enum definition.
     */
    record TypeDefinition(String name, TypeKind kind, List<TypeName> baseTypes, List<MemberNode> members)
        implements Statement {
        public TypeDefinition {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(kind, "kind");
            baseTypes = List.copyOf(baseTypes);
            members = List.copyOf(members);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitTypeDefinition(this);
        }
    }

    // === Constructs the renderer does not format ===

    record SwitchStatement(PipelineBase condition, List<Clause> clauses, Optional<StatementBlock> defaultClause)
        implements Statement {
        public SwitchStatement {
            Objects.requireNonNull(condition, "condition");
            clauses = List.copyOf(clauses);
            Objects.requireNonNull(defaultClause, "defaultClause");
        }

        public record Clause(Expression pattern, StatementBlock body) {}

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitSwitchStatement(this);
        }
    }

    record TryStatement(StatementBlock body, List<CatchClause> catchClauses, Optional<StatementBlock> finallyBlock)
        implements Statement {
        public TryStatement {
            Objects.requireNonNull(body, "body");
            catchClauses = List.copyOf(catchClauses);
            Objects.requireNonNull(finallyBlock, "finallyBlock");
        }

        public record CatchClause(List<AttributeBase.TypeConstraint> catchTypes, StatementBlock body) {}

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitTryStatement(this);
        }
    }

    /**
     * Workflow block: {@code sequence { ... }} or {@code parallel { ... }}.
     */
    record BlockStatement(TokenKind kind, StatementBlock body) implements Statement {
        public BlockStatement {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBlockStatement(this);
        }
    }

    record DataStatement(Optional<String> variable, List<Expression> commandsAllowed, StatementBlock body)
        implements Statement {
        public DataStatement {
            Objects.requireNonNull(variable, "variable");
            commandsAllowed = List.copyOf(commandsAllowed);
            Objects.requireNonNull(body, "body");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitDataStatement(this);
        }
    }

    record ConfigurationDefinition(Expression name, Expression.ScriptBlockExpression body) implements Statement {
        public ConfigurationDefinition {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitConfigurationDefinition(this);
        }
    }

    record DynamicKeywordStatement(List<CommandElement> elements) implements Statement {
        public DynamicKeywordStatement {
            elements = List.copyOf(elements);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitDynamicKeywordStatement(this);
        }
    }

    /**
     * Placeholder a tolerant parser leaves where a statement could not be parsed.
     */
    record ErrorStatement(String text) implements Statement {
        public ErrorStatement {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitErrorStatement(this);
        }
    }

    /**
     * Top-level {@code using namespace|assembly|module} directive. The name is a bare word,
     * or a hashtable module specification for {@code using module}.
     */
    record UsingStatement(UsingKind kind, Expression name, Optional<Expression.StringConstantExpression> alias)
        implements Statement {
        public UsingStatement {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(alias, "alias");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitUsingStatement(this);
        }
    }
}
