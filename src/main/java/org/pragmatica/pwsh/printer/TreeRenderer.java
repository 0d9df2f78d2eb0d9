package org.pragmatica.pwsh.printer;

import org.pragmatica.pwsh.ast.AttributeBase;
import org.pragmatica.pwsh.ast.CommandElement;
import org.pragmatica.pwsh.ast.Expression;
import org.pragmatica.pwsh.ast.HashtableEntry;
import org.pragmatica.pwsh.ast.IfClause;
import org.pragmatica.pwsh.ast.MemberNode;
import org.pragmatica.pwsh.ast.NamedAttributeArgument;
import org.pragmatica.pwsh.ast.NamedBlock;
import org.pragmatica.pwsh.ast.Node;
import org.pragmatica.pwsh.ast.NodeVisitor;
import org.pragmatica.pwsh.ast.ParamBlock;
import org.pragmatica.pwsh.ast.Parameter;
import org.pragmatica.pwsh.ast.Redirection;
import org.pragmatica.pwsh.ast.RedirectionStream;
import org.pragmatica.pwsh.ast.ScriptBlock;
import org.pragmatica.pwsh.ast.Statement;
import org.pragmatica.pwsh.ast.StatementBlock;
import org.pragmatica.pwsh.ast.TokenKind;
import org.pragmatica.pwsh.ast.TypeKind;
import org.pragmatica.pwsh.ast.TypeName;
import org.pragmatica.pwsh.error.RenderError;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Renders syntax trees as canonically formatted PowerShell source.
 *
 * <p>An instance owns one {@link RenderContext} and is not thread-safe. Every public render
 * call starts from an empty buffer, so an instance may be reused sequentially.
 */
public final class TreeRenderer implements NodeVisitor {
    private static final Pattern SIMPLE_VARIABLE_NAME = Pattern.compile("[\\p{L}\\p{N}_?:]+|\\$|\\^");

    private final RenderContext ctx;

    private TreeRenderer(RendererConfig config) {
        this.ctx = RenderContext.create(config);
    }

    public static TreeRenderer create(RendererConfig config) {
        return new TreeRenderer(config);
    }

    public static TreeRenderer create() {
        return create(RendererConfig.DEFAULT);
    }

    // === Entry points ===

    public RenderResult renderStatement(Statement statement) {
        return renderWith(() -> render(statement));
    }

    public RenderResult renderExpression(Expression expression) {
        return renderWith(() -> render(expression));
    }

    public RenderResult renderUsingDirective(Statement.UsingStatement directive) {
        return renderWith(() -> writeUsingDirective(directive));
    }

    /**
     * Render a whole script: its {@code using} directives, then the body of the script block
     * without surrounding braces.
     */
    public RenderResult renderScript(ScriptBlock script) {
        return renderWith(() -> {
            ctx.intersperse(script.usingStatements(), () -> {}, this::writeUsingDirective);
            if (!script.usingStatements().isEmpty() && hasBody(script)) {
                ctx.newline();
            }
            writeScriptBody(script);
        });
    }

    public void reset() {
        ctx.reset();
    }

    private RenderResult renderWith(Runnable action) {
        ctx.reset();
        try {
            action.run();
            return RenderResult.success(ctx.text());
        } catch (RenderAbortedException e) {
            ctx.reset();
            return RenderResult.failure(e.error());
        }
    }

    private void render(Node node) {
        ctx.enter();
        try {
            node.accept(this);
        } finally {
            ctx.exit();
        }
    }

    // === Expressions ===

    @Override
    public void visitConstantExpression(Expression.ConstantExpression node) {
        var value = node.value();
        if (value.isEmpty()) {
            ctx.write("$null");
        } else if (value.get() instanceof Boolean bool) {
            ctx.write(bool ? "$true" : "$false");
        } else {
            ctx.write(numberLiteral((Number) value.get()));
        }
    }

    @Override
    public void visitStringConstantExpression(Expression.StringConstantExpression node) {
        var value = node.value();
        switch (node.stringConstantType()) {
            case BARE_WORD -> ctx.write(value);
            case SINGLE_QUOTED -> ctx.write('\'')
                                     .write(StringEscapes.singleQuoted(value))
                                     .write('\'');
            case DOUBLE_QUOTED -> ctx.write('"')
                                     .write(StringEscapes.doubleQuoted(value))
                                     .write('"');
            case SINGLE_QUOTED_HERE_STRING -> writeHereString('\'', value);
            case DOUBLE_QUOTED_HERE_STRING -> writeHereString('"', StringEscapes.doubleQuotedHereString(value));
        }
    }

    @Override
    public void visitExpandableStringExpression(Expression.ExpandableStringExpression node) {
        switch (node.stringConstantType()) {
            case BARE_WORD -> ctx.write(node.value());
            case DOUBLE_QUOTED -> ctx.write('"')
                                     .write(node.value())
                                     .write('"');
            case DOUBLE_QUOTED_HERE_STRING -> writeHereString('"', node.value());
            default -> unsupported("single-quoted expandable string");
        }
    }

    @Override
    public void visitArrayLiteral(Expression.ArrayLiteral node) {
        ctx.intersperse(node.elements(), ", ", this::render);
    }

    @Override
    public void visitArrayExpression(Expression.ArrayExpression node) {
        token(TokenKind.AT_PAREN);
        writeStatements(node.subExpression());
        token(TokenKind.RPAREN);
    }

    @Override
    public void visitHashtableExpression(Expression.HashtableExpression node) {
        token(TokenKind.AT_CURLY);
        if (node.entries().isEmpty()) {
            token(TokenKind.RCURLY);
            return;
        }
        ctx.indent();
        ctx.intersperse(node.entries(), ctx::newline, this::render);
        ctx.dedent();
        token(TokenKind.RCURLY);
    }

    @Override
    public void visitVariableExpression(Expression.VariableExpression node) {
        ctx.write(node.splatted() ? '@' : '$');
        writeVariableName(node.name());
    }

    @Override
    public void visitMemberExpression(Expression.MemberExpression node) {
        render(node.target());
        token(node.isStatic() ? TokenKind.COLON_COLON : TokenKind.DOT);
        render(node.member());
    }

    @Override
    public void visitInvokeMemberExpression(Expression.InvokeMemberExpression node) {
        render(node.target());
        token(node.isStatic() ? TokenKind.COLON_COLON : TokenKind.DOT);
        render(node.member());
        token(TokenKind.LPAREN);
        ctx.intersperse(node.arguments(), ", ", this::render);
        token(TokenKind.RPAREN);
    }

    @Override
    public void visitBaseCtorInvokeMemberExpression(Expression.BaseCtorInvokeMemberExpression node) {
        unsupported("base constructor invocation");
    }

    @Override
    public void visitIndexExpression(Expression.IndexExpression node) {
        render(node.target());
        token(TokenKind.LBRACKET);
        render(node.index());
        token(TokenKind.RBRACKET);
    }

    @Override
    public void visitUnaryExpression(Expression.UnaryExpression node) {
        switch (node.operator()) {
            case PLUS_PLUS, MINUS_MINUS -> {
                token(node.operator());
                render(node.child());
            }
            case POSTFIX_PLUS_PLUS, POSTFIX_MINUS_MINUS -> {
                render(node.child());
                token(node.operator());
            }
            default -> {
                token(node.operator());
                ctx.write(' ');
                render(node.child());
            }
        }
    }

    @Override
    public void visitBinaryExpression(Expression.BinaryExpression node) {
        render(node.left());
        writeSpaced(node.operator());
        render(node.right());
    }

    @Override
    public void visitTernaryExpression(Expression.TernaryExpression node) {
        render(node.condition());
        writeSpaced(TokenKind.QUESTION_MARK);
        render(node.ifTrue());
        writeSpaced(TokenKind.COLON);
        render(node.ifFalse());
    }

    @Override
    public void visitParenExpression(Expression.ParenExpression node) {
        token(TokenKind.LPAREN);
        render(node.pipeline());
        token(TokenKind.RPAREN);
    }

    @Override
    public void visitSubExpression(Expression.SubExpression node) {
        token(TokenKind.DOLLAR_PAREN);
        writeStatements(node.subExpression());
        token(TokenKind.RPAREN);
    }

    @Override
    public void visitTypeExpression(Expression.TypeExpression node) {
        token(TokenKind.LBRACKET);
        render(node.typeName());
        token(TokenKind.RBRACKET);
    }

    @Override
    public void visitConvertExpression(Expression.ConvertExpression node) {
        render(node.type());
        render(node.child());
    }

    @Override
    public void visitAttributedExpression(Expression.AttributedExpression node) {
        render(node.attribute());
        render(node.child());
    }

    @Override
    public void visitUsingExpression(Expression.UsingExpression node) {
        var variable = node.variable();
        ctx.write(variable.splatted() ? '@' : '$');
        writeVariableName("using:" + variable.name());
    }

    @Override
    public void visitScriptBlockExpression(Expression.ScriptBlockExpression node) {
        render(node.scriptBlock());
    }

    @Override
    public void visitErrorExpression(Expression.ErrorExpression node) {
        unsupported("error expression");
    }

    // === Commands ===

    @Override
    public void visitCommandParameter(CommandElement.CommandParameter node) {
        ctx.write('-')
           .write(node.name());
        node.argument()
            .ifPresent(argument -> {
                token(TokenKind.COLON);
                render(argument);
            });
    }

    @Override
    public void visitPipeline(Statement.Pipeline node) {
        ctx.intersperse(node.elements(), " | ", this::render);
        if (node.background()) {
            ctx.write(" &");
        }
    }

    @Override
    public void visitPipelineChain(Statement.PipelineChain node) {
        render(node.left());
        writeSpaced(node.operator());
        render(node.right());
        if (node.background()) {
            ctx.write(" &");
        }
    }

    @Override
    public void visitAssignmentStatement(Statement.AssignmentStatement node) {
        render(node.left());
        writeSpaced(node.operator());
        render(node.right());
    }

    @Override
    public void visitCommand(Statement.Command node) {
        node.invocationOperator()
            .ifPresent(operator -> {
                token(operator);
                ctx.write(' ');
            });
        ctx.intersperse(node.elements(), " ", this::render);
        writeRedirections(node.redirections());
    }

    @Override
    public void visitCommandExpression(Statement.CommandExpression node) {
        render(node.expression());
        writeRedirections(node.redirections());
    }

    @Override
    public void visitFileRedirection(Redirection.FileRedirection node) {
        if (node.fromStream() != RedirectionStream.OUTPUT) {
            ctx.write(Lexemes.streamIndicator(node.fromStream()));
        }
        ctx.write(node.append() ? ">>" : ">");
        render(node.location());
    }

    @Override
    public void visitMergingRedirection(Redirection.MergingRedirection node) {
        ctx.write(Lexemes.streamIndicator(node.fromStream()))
           .write(">&")
           .write(Lexemes.streamIndicator(node.toStream()));
    }

    // === Flow control ===

    @Override
    public void visitIfStatement(Statement.IfStatement node) {
        var clauses = node.clauses();
        token(TokenKind.IF);
        render(clauses.get(0));
        for (int i = 1; i < clauses.size(); i++) {
            ctx.newline();
            token(TokenKind.ELSE_IF);
            render(clauses.get(i));
        }
        node.elseClause()
            .ifPresent(body -> {
                ctx.newline();
                token(TokenKind.ELSE);
                render(body);
            });
        ctx.endStatement();
    }

    @Override
    public void visitIfClause(IfClause node) {
        writeCondition(node.condition());
        render(node.body());
    }

    @Override
    public void visitWhileStatement(Statement.WhileStatement node) {
        token(TokenKind.WHILE);
        writeCondition(node.condition());
        render(node.body());
        ctx.endStatement();
    }

    @Override
    public void visitDoWhileStatement(Statement.DoWhileStatement node) {
        writeDoLoop(node.body(), TokenKind.WHILE, node.condition());
    }

    @Override
    public void visitDoUntilStatement(Statement.DoUntilStatement node) {
        writeDoLoop(node.body(), TokenKind.UNTIL, node.condition());
    }

    @Override
    public void visitForStatement(Statement.ForStatement node) {
        token(TokenKind.FOR);
        ctx.write(" (");
        node.initializer()
            .ifPresent(this::render);
        token(TokenKind.SEMI);
        node.condition()
            .ifPresent(condition -> {
                ctx.write(' ');
                render(condition);
            });
        token(TokenKind.SEMI);
        node.iterator()
            .ifPresent(iterator -> {
                ctx.write(' ');
                render(iterator);
            });
        token(TokenKind.RPAREN);
        render(node.body());
        ctx.endStatement();
    }

    @Override
    public void visitForEachStatement(Statement.ForEachStatement node) {
        token(TokenKind.FOREACH);
        ctx.write(" (");
        render(node.variable());
        writeSpaced(TokenKind.IN);
        render(node.iterable());
        token(TokenKind.RPAREN);
        render(node.body());
        ctx.endStatement();
    }

    @Override
    public void visitBreakStatement(Statement.BreakStatement node) {
        writeControlFlow(TokenKind.BREAK, node.label());
    }

    @Override
    public void visitContinueStatement(Statement.ContinueStatement node) {
        writeControlFlow(TokenKind.CONTINUE, node.label());
    }

    @Override
    public void visitReturnStatement(Statement.ReturnStatement node) {
        writeControlFlow(TokenKind.RETURN, node.pipeline());
    }

    @Override
    public void visitExitStatement(Statement.ExitStatement node) {
        writeControlFlow(TokenKind.EXIT, node.pipeline());
    }

    @Override
    public void visitThrowStatement(Statement.ThrowStatement node) {
        writeControlFlow(TokenKind.THROW, node.pipeline());
    }

    @Override
    public void visitTrapStatement(Statement.TrapStatement node) {
        token(TokenKind.TRAP);
        node.trapType()
            .ifPresent(type -> {
                ctx.write(' ');
                render(type);
            });
        render(node.body());
        ctx.endStatement();
    }

    // === Definitions ===

    @Override
    public void visitFunctionDefinition(Statement.FunctionDefinition node) {
        token(node.isFilter() ? TokenKind.FILTER : TokenKind.FUNCTION);
        ctx.write(' ')
           .write(node.name());
        ctx.newline();
        render(node.body());
        ctx.endStatement();
    }

    @Override
    public void visitTypeDefinition(Statement.TypeDefinition node) {
        token(node.kind().keyword());
        ctx.write(' ')
           .write(node.name());
        if (!node.baseTypes().isEmpty()) {
            ctx.write(" : ");
            ctx.intersperse(node.baseTypes(), ", ", this::render);
        }

        if (node.members().isEmpty()) {
            ctx.newline();
            token(TokenKind.LCURLY);
            ctx.newline();
            token(TokenKind.RCURLY);
            ctx.endStatement();
            return;
        }

        ctx.beginBlock();
        if (node.kind() == TypeKind.ENUM) {
            ctx.intersperse(node.members(), () -> {
                token(TokenKind.COMMA);
                ctx.newline();
            }, this::writeEnumMember);
        } else if (node.kind() == TypeKind.CLASS) {
            ctx.intersperse(node.members(), () -> ctx.newline(2), this::render);
        } else {
            ctx.intersperse(node.members(), ctx::newline, this::render);
        }
        ctx.endBlock();
        ctx.endStatement();
    }

    @Override
    public void visitPropertyMember(MemberNode.PropertyMember node) {
        writeModifiers(node.isStatic(), node.isHidden());
        node.propertyType()
            .ifPresent(this::render);
        ctx.write('$')
           .write(node.name());
        node.initialValue()
            .ifPresent(this::writeInitializer);
    }

    @Override
    public void visitFunctionMember(MemberNode.FunctionMember node) {
        if (!node.isConstructor()) {
            writeModifiers(node.isStatic(), node.isHidden());
            node.returnType()
                .ifPresent(this::render);
        }
        ctx.write(node.name());
        token(TokenKind.LPAREN);
        ctx.intersperse(node.parameters(), ", ", this::writeInlineParameter);
        token(TokenKind.RPAREN);
        ctx.newline();
        render(node.body());
    }

    // === Attributes and types ===

    @Override
    public void visitAttribute(AttributeBase.Attribute node) {
        token(TokenKind.LBRACKET);
        render(node.typeName());
        token(TokenKind.LPAREN);
        ctx.intersperse(node.positionalArguments(), ", ", this::render);
        if (!node.positionalArguments().isEmpty() && !node.namedArguments().isEmpty()) {
            ctx.write(", ");
        }
        ctx.intersperse(node.namedArguments(), ", ", this::render);
        token(TokenKind.RPAREN);
        token(TokenKind.RBRACKET);
    }

    @Override
    public void visitTypeConstraint(AttributeBase.TypeConstraint node) {
        token(TokenKind.LBRACKET);
        render(node.typeName());
        token(TokenKind.RBRACKET);
    }

    @Override
    public void visitNamedAttributeArgument(NamedAttributeArgument node) {
        ctx.write(node.name());
        node.argument()
            .ifPresent(this::writeInitializer);
    }

    @Override
    public void visitSimpleTypeName(TypeName.SimpleTypeName node) {
        ctx.write(node.fullName());
    }

    @Override
    public void visitArrayTypeName(TypeName.ArrayTypeName node) {
        render(node.elementType());
        token(TokenKind.LBRACKET);
        ctx.write(",".repeat(node.rank() - 1));
        token(TokenKind.RBRACKET);
    }

    @Override
    public void visitGenericTypeName(TypeName.GenericTypeName node) {
        render(node.typeDefinition());
        token(TokenKind.LBRACKET);
        ctx.intersperse(node.arguments(), ", ", this::render);
        token(TokenKind.RBRACKET);
    }

    // === Blocks ===

    @Override
    public void visitScriptBlock(ScriptBlock node) {
        if (!node.usingStatements().isEmpty()) {
            unsupported("using statement inside a script block");
        }
        token(TokenKind.LCURLY);
        ctx.indent();
        writeScriptBody(node);
        ctx.dedent();
        token(TokenKind.RCURLY);
    }

    @Override
    public void visitNamedBlock(NamedBlock node) {
        token(node.kind().keyword());
        ctx.beginBlock();
        writeStatements(node.traps(), node.statements());
        ctx.endBlock();
    }

    @Override
    public void visitParamBlock(ParamBlock node) {
        for (var attribute : node.attributes()) {
            render(attribute);
            ctx.newline();
        }
        token(TokenKind.PARAM);
        token(TokenKind.LPAREN);
        if (node.parameters().isEmpty()) {
            token(TokenKind.RPAREN);
            return;
        }
        ctx.indent();
        ctx.intersperse(node.parameters(), () -> {
            token(TokenKind.COMMA);
            ctx.newline(2);
        }, this::render);
        ctx.dedent();
        token(TokenKind.RPAREN);
    }

    @Override
    public void visitParameter(Parameter node) {
        for (var attribute : node.attributes()) {
            render(attribute);
            ctx.newline();
        }
        render(node.name());
        node.defaultValue()
            .ifPresent(this::writeInitializer);
    }

    @Override
    public void visitStatementBlock(StatementBlock node) {
        ctx.beginBlock();
        writeStatements(node);
        ctx.endBlock();
    }

    @Override
    public void visitHashtableEntry(HashtableEntry node) {
        render(node.key());
        writeSpaced(TokenKind.EQUALS);
        render(node.value());
    }

    // === Constructs without a canonical layout ===

    @Override
    public void visitSwitchStatement(Statement.SwitchStatement node) {
        unsupported("switch statement");
    }

    @Override
    public void visitTryStatement(Statement.TryStatement node) {
        unsupported("try statement");
    }

    @Override
    public void visitBlockStatement(Statement.BlockStatement node) {
        unsupported("block statement");
    }

    @Override
    public void visitDataStatement(Statement.DataStatement node) {
        unsupported("data statement");
    }

    @Override
    public void visitConfigurationDefinition(Statement.ConfigurationDefinition node) {
        unsupported("configuration definition");
    }

    @Override
    public void visitDynamicKeywordStatement(Statement.DynamicKeywordStatement node) {
        unsupported("dynamic keyword statement");
    }

    @Override
    public void visitErrorStatement(Statement.ErrorStatement node) {
        unsupported("error statement");
    }

    @Override
    public void visitUsingStatement(Statement.UsingStatement node) {
        unsupported("using statement");
    }

    // === Helpers ===

    private void writeUsingDirective(Statement.UsingStatement directive) {
        token(TokenKind.USING);
        ctx.write(' ');
        token(directive.kind().keyword());
        ctx.write(' ');
        directive.alias()
                 .ifPresent(alias -> {
                     render(alias);
                     writeSpaced(TokenKind.EQUALS);
                 });
        var name = directive.name();
        if (name instanceof Expression.StringConstantExpression) {
            render(name);
        } else if (name instanceof Expression.HashtableExpression specification) {
            writeInlineHashtable(specification);
        } else {
            unsupported("using directive target");
        }
        ctx.endStatement();
    }

    /**
     * Single-line hashtable, as module specifications of {@code using module} are written.
     */
    private void writeInlineHashtable(Expression.HashtableExpression hashtable) {
        if (hashtable.entries().isEmpty()) {
            ctx.write("@{}");
            return;
        }
        ctx.write("@{ ");
        ctx.intersperse(hashtable.entries(), "; ", this::render);
        ctx.write(" }");
    }

    private void writeScriptBody(ScriptBlock script) {
        var sections = new ArrayList<Runnable>();
        script.paramBlock()
              .ifPresent(block -> sections.add(() -> render(block)));
        script.dynamicParamBlock()
              .ifPresent(block -> sections.add(() -> render(block)));
        script.beginBlock()
              .ifPresent(block -> sections.add(() -> render(block)));
        script.processBlock()
              .ifPresent(block -> sections.add(() -> render(block)));

        var explicitBlocks = script.dynamicParamBlock().isPresent()
                             || script.beginBlock().isPresent()
                             || script.processBlock().isPresent();
        script.endBlock()
              .ifPresent(block -> {
                  if (explicitBlocks) {
                      sections.add(() -> render(block));
                  } else if (!block.statements().isEmpty() || !block.traps().isEmpty()) {
                      sections.add(() -> writeStatements(block.traps(), block.statements()));
                  }
              });

        ctx.intersperse(sections, () -> ctx.newline(2), Runnable::run);
    }

    private static boolean hasBody(ScriptBlock script) {
        return script.paramBlock().isPresent()
               || script.dynamicParamBlock().isPresent()
               || script.beginBlock().isPresent()
               || script.processBlock().isPresent()
               || script.endBlock()
                        .map(block -> !block.statements().isEmpty() || !block.traps().isEmpty())
                        .orElse(false);
    }

    private void writeStatements(StatementBlock block) {
        writeStatements(block.traps(), block.statements());
    }

    /**
     * Traps first, then statements, one per line.
     */
    private void writeStatements(List<Statement.TrapStatement> traps, List<Statement> statements) {
        var all = new ArrayList<Statement>(traps.size() + statements.size());
        all.addAll(traps);
        all.addAll(statements);
        ctx.intersperse(all, ctx::newline, this::render);
    }

    private void writeCondition(Statement.PipelineBase condition) {
        ctx.write(" (");
        render(condition);
        token(TokenKind.RPAREN);
    }

    private void writeDoLoop(StatementBlock body, TokenKind keyword, Statement.PipelineBase condition) {
        token(TokenKind.DO);
        render(body);
        ctx.write(' ');
        token(keyword);
        writeCondition(condition);
        ctx.endStatement();
    }

    private void writeControlFlow(TokenKind keyword, Optional<? extends Node> child) {
        token(keyword);
        child.ifPresent(node -> {
            ctx.write(' ');
            render(node);
        });
    }

    private void writeRedirections(List<Redirection> redirections) {
        if (redirections.isEmpty()) {
            return;
        }
        ctx.write(' ');
        ctx.intersperse(redirections, " ", this::render);
    }

    private void writeEnumMember(MemberNode member) {
        if (member instanceof MemberNode.PropertyMember enumerator) {
            ctx.write(enumerator.name());
            enumerator.initialValue()
                      .ifPresent(this::writeInitializer);
        } else {
            unsupported("method in enum " + member.name());
        }
    }

    private void writeInlineParameter(Parameter parameter) {
        for (var attribute : parameter.attributes()) {
            render(attribute);
        }
        render(parameter.name());
        parameter.defaultValue()
                 .ifPresent(this::writeInitializer);
    }

    private void writeModifiers(boolean isStatic, boolean isHidden) {
        if (isStatic) {
            token(TokenKind.STATIC);
            ctx.write(' ');
        }
        if (isHidden) {
            token(TokenKind.HIDDEN);
            ctx.write(' ');
        }
    }

    private void writeInitializer(Expression value) {
        writeSpaced(TokenKind.EQUALS);
        render(value);
    }

    private void writeHereString(char quote, String value) {
        ctx.write('@')
           .write(quote);
        ctx.writeVerbatim("\n" + value + "\n" + quote + "@");
    }

    /**
     * Literal that reads back as the same numeric type: {@code L} marks a long,
     * {@code d} a decimal and {@code n} a big integer.
     */
    private static String numberLiteral(Number number) {
        if (number instanceof Long) {
            return number + "L";
        }
        if (number instanceof BigDecimal decimal) {
            return decimal.toPlainString() + "d";
        }
        if (number instanceof BigInteger) {
            return number + "n";
        }
        return number.toString();
    }

    private void writeVariableName(String name) {
        if (SIMPLE_VARIABLE_NAME.matcher(name).matches()) {
            ctx.write(name);
            return;
        }
        ctx.write('{')
           .write(name.replace("`", "``")
                      .replace("}", "`}"))
           .write('}');
    }

    private void writeSpaced(TokenKind operator) {
        ctx.write(' ');
        token(operator);
        ctx.write(' ');
    }

    private void token(TokenKind kind) {
        ctx.write(lexeme(kind));
    }

    private static String lexeme(TokenKind kind) {
        return Lexemes.lookup(kind)
                      .orElseThrow(() -> new RenderAbortedException(new RenderError.UnsupportedToken(kind)));
    }

    private static void unsupported(String construct) {
        throw new RenderAbortedException(new RenderError.UnsupportedConstruct(construct));
    }
}
