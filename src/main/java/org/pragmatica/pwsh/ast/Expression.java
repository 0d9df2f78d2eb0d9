package org.pragmatica.pwsh.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Expression nodes - anything that produces a value.
 */
public sealed interface Expression extends CommandElement {

    // === Factories ===

    static ConstantExpression constant(Object value) {
        return new ConstantExpression(Optional.of(value));
    }

    static ConstantExpression nullConstant() {
        return new ConstantExpression(Optional.empty());
    }

    static StringConstantExpression bareWord(String value) {
        return new StringConstantExpression(value, StringConstantType.BARE_WORD);
    }

    static StringConstantExpression singleQuoted(String value) {
        return new StringConstantExpression(value, StringConstantType.SINGLE_QUOTED);
    }

    static StringConstantExpression doubleQuoted(String value) {
        return new StringConstantExpression(value, StringConstantType.DOUBLE_QUOTED);
    }

    static ExpandableStringExpression expandable(String value) {
        return new ExpandableStringExpression(value, StringConstantType.DOUBLE_QUOTED);
    }

    static VariableExpression variable(String name) {
        return new VariableExpression(name, false);
    }

    static VariableExpression splatted(String name) {
        return new VariableExpression(name, true);
    }

    static ArrayLiteral arrayLiteral(Expression... elements) {
        return new ArrayLiteral(List.of(elements));
    }

    static ArrayExpression arrayExpression(Statement... statements) {
        return new ArrayExpression(StatementBlock.of(statements));
    }

    static HashtableExpression hashtable(HashtableEntry... entries) {
        return new HashtableExpression(List.of(entries));
    }

    static MemberExpression member(Expression target, String member) {
        return new MemberExpression(target, bareWord(member), false);
    }

    static MemberExpression staticMember(Expression target, String member) {
        return new MemberExpression(target, bareWord(member), true);
    }

    static InvokeMemberExpression invoke(Expression target, String member, Expression... arguments) {
        return new InvokeMemberExpression(target, bareWord(member), List.of(arguments), false);
    }

    static InvokeMemberExpression invokeStatic(Expression target, String member, Expression... arguments) {
        return new InvokeMemberExpression(target, bareWord(member), List.of(arguments), true);
    }

    static IndexExpression index(Expression target, Expression index) {
        return new IndexExpression(target, index);
    }

    static UnaryExpression unary(TokenKind operator, Expression child) {
        return new UnaryExpression(operator, child);
    }

    static BinaryExpression binary(Expression left, TokenKind operator, Expression right) {
        return new BinaryExpression(left, operator, right);
    }

    static TernaryExpression ternary(Expression condition, Expression ifTrue, Expression ifFalse) {
        return new TernaryExpression(condition, ifTrue, ifFalse);
    }

    static ParenExpression paren(Statement.PipelineBase pipeline) {
        return new ParenExpression(pipeline);
    }

    static ParenExpression paren(Expression expression) {
        return new ParenExpression(Statement.pipeline(expression));
    }

    static SubExpression subExpression(Statement... statements) {
        return new SubExpression(StatementBlock.of(statements));
    }

    static TypeExpression type(String typeName) {
        return new TypeExpression(TypeName.simple(typeName));
    }

    static ConvertExpression convert(String typeName, Expression child) {
        return new ConvertExpression(AttributeBase.typeConstraint(typeName), child);
    }

    static UsingExpression using(String variableName) {
        return new UsingExpression(variable(variableName));
    }

    static ScriptBlockExpression scriptBlock(Statement... statements) {
        return new ScriptBlockExpression(ScriptBlock.of(statements));
    }

    static ScriptBlockExpression scriptBlock(ScriptBlock scriptBlock) {
        return new ScriptBlockExpression(scriptBlock);
    }

    // === Literals ===

    /**
     * Numeric, boolean or null constant. An empty value is {@code $null}.
     */
    record ConstantExpression(Optional<Object> value) implements Expression {
        public ConstantExpression {
            Objects.requireNonNull(value, "value");
            value.ifPresent(constant -> {
                if (!(constant instanceof Number) && !(constant instanceof Boolean)) {
                    throw new IllegalArgumentException("Constant must be a number or a boolean: "
                                                       + constant.getClass().getName());
                }
            });
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitConstantExpression(this);
        }
    }

    /**
     * String literal whose text is taken as-is.
     */
    record StringConstantExpression(String value, StringConstantType stringConstantType) implements Expression {
        public StringConstantExpression {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(stringConstantType, "stringConstantType");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitStringConstantExpression(this);
        }
    }

    /**
     * Interpolated string. The value is the raw source text between the quotes.
     */
    record ExpandableStringExpression(String value, StringConstantType stringConstantType) implements Expression {
        public ExpandableStringExpression {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(stringConstantType, "stringConstantType");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitExpandableStringExpression(this);
        }
    }

    /**
     * Comma list: {@code 1, 2, 3}
     */
    record ArrayLiteral(List<Expression> elements) implements Expression {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitArrayLiteral(this);
        }
    }

    /**
     * Array sub-expression: {@code @( ... )}
     */
    record ArrayExpression(StatementBlock subExpression) implements Expression {
        public ArrayExpression {
            Objects.requireNonNull(subExpression, "subExpression");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitArrayExpression(this);
        }
    }

    /**
     * Hashtable literal: {@code @{ key = value }}
     */
    record HashtableExpression(List<HashtableEntry> entries) implements Expression {
        public HashtableExpression {
            entries = List.copyOf(entries);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitHashtableExpression(this);
        }
    }

    // === References ===

    /**
     * Variable reference: {@code $name}, or {@code @name} when splatted.
     */
    record VariableExpression(String name, boolean splatted) implements Expression {
        public VariableExpression {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitVariableExpression(this);
        }
    }

    /**
     * Property access: {@code target.Member} or {@code target::Member}.
     * The member is usually a bare word but may be any expression ({@code $x.$name}).
     */
    record MemberExpression(Expression target, Expression member, boolean isStatic) implements Expression {
        public MemberExpression {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(member, "member");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitMemberExpression(this);
        }
    }

    /**
     * Method call: {@code target.Member(arguments)} or {@code target::Member(arguments)}.
     */
    record InvokeMemberExpression(Expression target,
                                  Expression member,
                                  List<Expression> arguments,
                                  boolean isStatic) implements Expression {
        public InvokeMemberExpression {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(member, "member");
            arguments = List.copyOf(arguments);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitInvokeMemberExpression(this);
        }
    }

    /**
     * Base class constructor call in a class constructor: {@code : base(arguments)}
     */
    record BaseCtorInvokeMemberExpression(List<Expression> arguments) implements Expression {
        public BaseCtorInvokeMemberExpression {
            arguments = List.copyOf(arguments);
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBaseCtorInvokeMemberExpression(this);
        }
    }

    /**
     * Indexing: {@code target[index]}
     */
    record IndexExpression(Expression target, Expression index) implements Expression {
        public IndexExpression {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(index, "index");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitIndexExpression(this);
        }
    }

    // === Operators ===

    record UnaryExpression(TokenKind operator, Expression child) implements Expression {
        public UnaryExpression {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(child, "child");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitUnaryExpression(this);
        }
    }

    record BinaryExpression(Expression left, TokenKind operator, Expression right) implements Expression {
        public BinaryExpression {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitBinaryExpression(this);
        }
    }

    /**
     * Conditional operator: {@code condition ? ifTrue : ifFalse}
     */
    record TernaryExpression(Expression condition, Expression ifTrue, Expression ifFalse) implements Expression {
        public TernaryExpression {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(ifTrue, "ifTrue");
            Objects.requireNonNull(ifFalse, "ifFalse");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitTernaryExpression(this);
        }
    }

    // === Grouping ===

    /**
     * Parenthesized pipeline: {@code (pipeline)}
     */
    record ParenExpression(Statement.PipelineBase pipeline) implements Expression {
        public ParenExpression {
            Objects.requireNonNull(pipeline, "pipeline");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitParenExpression(this);
        }
    }

    /**
     * Command substitution: {@code $( statements )}
     */
    record SubExpression(StatementBlock subExpression) implements Expression {
        public SubExpression {
            Objects.requireNonNull(subExpression, "subExpression");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitSubExpression(this);
        }
    }

    // === Types ===

    /**
     * Type literal: {@code [System.String]}
     */
    record TypeExpression(TypeName typeName) implements Expression {
        public TypeExpression {
            Objects.requireNonNull(typeName, "typeName");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitTypeExpression(this);
        }
    }

    /**
     * Cast: {@code [int]$value}
     */
    record ConvertExpression(AttributeBase.TypeConstraint type, Expression child) implements Expression {
        public ConvertExpression {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(child, "child");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitConvertExpression(this);
        }
    }

    /**
     * Expression preceded by an attribute: {@code [ValidateNotNull()]$value}
     */
    record AttributedExpression(AttributeBase.Attribute attribute, Expression child) implements Expression {
        public AttributedExpression {
            Objects.requireNonNull(attribute, "attribute");
            Objects.requireNonNull(child, "child");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitAttributedExpression(this);
        }
    }

    // === Script blocks and scopes ===

    /**
     * Closure capture of a caller's variable: {@code $using:name}
     */
    record UsingExpression(VariableExpression variable) implements Expression {
        public UsingExpression {
            Objects.requireNonNull(variable, "variable");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitUsingExpression(this);
        }
    }

    record ScriptBlockExpression(ScriptBlock scriptBlock) implements Expression {
        public ScriptBlockExpression {
            Objects.requireNonNull(scriptBlock, "scriptBlock");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitScriptBlockExpression(this);
        }
    }

    /**
     * Placeholder a tolerant parser leaves where an expression could not be parsed.
     */
    record ErrorExpression(String text) implements Expression {
        public ErrorExpression {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitErrorExpression(this);
        }
    }
}
