package org.pragmatica.pwsh.printer;

import org.junit.jupiter.api.Test;
import org.pragmatica.pwsh.ast.AttributeBase;
import org.pragmatica.pwsh.ast.BlockKind;
import org.pragmatica.pwsh.ast.Expression;
import org.pragmatica.pwsh.ast.HashtableEntry;
import org.pragmatica.pwsh.ast.MemberNode;
import org.pragmatica.pwsh.ast.NamedAttributeArgument;
import org.pragmatica.pwsh.ast.NamedBlock;
import org.pragmatica.pwsh.ast.ParamBlock;
import org.pragmatica.pwsh.ast.Parameter;
import org.pragmatica.pwsh.ast.Redirection;
import org.pragmatica.pwsh.ast.RedirectionStream;
import org.pragmatica.pwsh.ast.ScriptBlock;
import org.pragmatica.pwsh.ast.Statement;
import org.pragmatica.pwsh.ast.StatementBlock;
import org.pragmatica.pwsh.ast.StringConstantType;
import org.pragmatica.pwsh.ast.TokenKind;
import org.pragmatica.pwsh.ast.TypeKind;
import org.pragmatica.pwsh.ast.TypeName;
import org.pragmatica.pwsh.ast.UsingKind;
import org.pragmatica.pwsh.error.RenderError;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.pwsh.ast.AttributeBase.attribute;
import static org.pragmatica.pwsh.ast.AttributeBase.typeConstraint;
import static org.pragmatica.pwsh.ast.CommandElement.parameter;
import static org.pragmatica.pwsh.ast.Expression.arrayExpression;
import static org.pragmatica.pwsh.ast.Expression.arrayLiteral;
import static org.pragmatica.pwsh.ast.Expression.bareWord;
import static org.pragmatica.pwsh.ast.Expression.binary;
import static org.pragmatica.pwsh.ast.Expression.constant;
import static org.pragmatica.pwsh.ast.Expression.doubleQuoted;
import static org.pragmatica.pwsh.ast.Expression.expandable;
import static org.pragmatica.pwsh.ast.Expression.hashtable;
import static org.pragmatica.pwsh.ast.Expression.index;
import static org.pragmatica.pwsh.ast.Expression.member;
import static org.pragmatica.pwsh.ast.Expression.singleQuoted;
import static org.pragmatica.pwsh.ast.Expression.unary;
import static org.pragmatica.pwsh.ast.Expression.variable;
import static org.pragmatica.pwsh.ast.Statement.command;
import static org.pragmatica.pwsh.ast.Statement.pipeline;

class TreeRendererTest {
    private final TreeRenderer renderer = TreeRenderer.create();

    private String render(Statement statement) {
        var result = renderer.renderStatement(statement);
        assertThat(result.isSuccess()).as("render failed: %s", result.error()).isTrue();
        return result.unwrap();
    }

    private String render(Expression expression) {
        var result = renderer.renderExpression(expression);
        assertThat(result.isSuccess()).as("render failed: %s", result.error()).isTrue();
        return result.unwrap();
    }

    // === Unary and binary operators ===

    @Test
    void unaryMinus_onVariable_separatedBySpace() {
        assertThat(render(unary(TokenKind.MINUS, variable("x")))).isEqualTo("- $x");
    }

    @Test
    void negativeNumber_rendersAsConstant() {
        assertThat(render(constant(-1))).isEqualTo("-1");
    }

    @Test
    void incrementDecrement_prefixAndPostfix_noSpace() {
        assertThat(render(unary(TokenKind.POSTFIX_PLUS_PLUS, variable("x")))).isEqualTo("$x++");
        assertThat(render(unary(TokenKind.MINUS_MINUS, variable("i")))).isEqualTo("--$i");
        assertThat(render(unary(TokenKind.MINUS, unary(TokenKind.MINUS_MINUS, variable("i"))))).isEqualTo("- --$i");
    }

    @Test
    void notOperator_spelledOut() {
        assertThat(render(unary(TokenKind.NOT, constant(true)))).isEqualTo("-not $true");
    }

    @Test
    void formatOperator_betweenStrings() {
        assertThat(render(binary(singleQuoted("{0}"), TokenKind.FORMAT, singleQuoted("Hi"))))
            .isEqualTo("'{0}' -f 'Hi'");
    }

    @Test
    void binaryOr_andMembership_useCorrectSpelling() {
        assertThat(render(binary(variable("a"), TokenKind.BOR, variable("b")))).isEqualTo("$a -bor $b");
        assertThat(render(binary(variable("a"), TokenKind.IIN, variable("b")))).isEqualTo("$a -in $b");
    }

    @Test
    void ternary_rendersWithSpacedMarkers() {
        assertThat(render(Expression.ternary(constant(true), singleQuoted("true"), singleQuoted("false"))))
            .isEqualTo("$true ? 'true' : 'false'");
    }

    @Test
    void subExpression_insideBinary() {
        var expression = binary(constant(3), TokenKind.PLUS, Expression.subExpression(pipeline(command("Get-Random"))));

        assertThat(render(expression)).isEqualTo("3 + $(Get-Random)");
    }

    // === Constants and strings ===

    @Test
    void constants_booleansAndNull_useVariables() {
        assertThat(render(constant(true))).isEqualTo("$true");
        assertThat(render(constant(false))).isEqualTo("$false");
        assertThat(render(Expression.nullConstant())).isEqualTo("$null");
        assertThat(render(constant(2.5))).isEqualTo("2.5");
    }

    @Test
    void numericConstants_keepTheirType() {
        assertThat(render(constant(5L))).isEqualTo("5L");
        assertThat(render(constant(new BigDecimal("1.5")))).isEqualTo("1.5d");
        assertThat(render(constant(new BigInteger("123456789012345678901234567890"))))
            .isEqualTo("123456789012345678901234567890n");
        assertThat(render(constant(42))).isEqualTo("42");
    }

    @Test
    void singleQuotedString_doublesEmbeddedQuote() {
        assertThat(render(singleQuoted("banana's cake"))).isEqualTo("'banana''s cake'");
    }

    @Test
    void doubleQuotedString_escapesControlCharacters() {
        assertThat(render(doubleQuoted("I\nlike\nducks"))).isEqualTo("\"I`nlike`nducks\"");
    }

    @Test
    void doubleQuotedString_escapesSpecialCharacters() {
        assertThat(render(doubleQuoted("a$b`c\"d\te"))).isEqualTo("\"a`$b``c`\"d`te\"");
    }

    @Test
    void expandableString_writtenAsIs() {
        assertThat(render(expandable("Hi $Name"))).isEqualTo("\"Hi $Name\"");
    }

    @Test
    void hereString_bodyIsNotIndented() {
        var hereString = new Expression.StringConstantExpression("line one\nline two",
                                                                StringConstantType.SINGLE_QUOTED_HERE_STRING);
        var function = Statement.function("Show", ScriptBlock.of(pipeline(hereString)));

        assertThat(render(function)).isEqualTo("""
            function Show
            {
                @'
            line one
            line two
            '@
            }
            """);
    }

    @Test
    void doubleQuotedHereString_escapesBacktickAndDollar() {
        var hereString = new Expression.StringConstantExpression("cost: $5 `tick\nsecond line",
                                                                StringConstantType.DOUBLE_QUOTED_HERE_STRING);

        assertThat(render(hereString)).isEqualTo("@\"\ncost: `$5 ``tick\nsecond line\n\"@");
    }

    @Test
    void doubleQuotedHereString_quoteOpeningLine_escaped() {
        var hereString = new Expression.StringConstantExpression("a\n\"@ b",
                                                                StringConstantType.DOUBLE_QUOTED_HERE_STRING);

        assertThat(render(hereString)).isEqualTo("@\"\na\n`\"@ b\n\"@");
    }

    @Test
    void expandableHereString_usesDoubleQuoteDelimiters() {
        var hereString = new Expression.ExpandableStringExpression("Hello $Name",
                                                                  StringConstantType.DOUBLE_QUOTED_HERE_STRING);

        assertThat(render(hereString)).isEqualTo("@\"\nHello $Name\n\"@");
    }

    // === Variables ===

    @Test
    void variable_simpleNames_unbraced() {
        assertThat(render(variable("x"))).isEqualTo("$x");
        assertThat(render(variable("env:PATH"))).isEqualTo("$env:PATH");
        assertThat(render(variable("_"))).isEqualTo("$_");
        assertThat(render(variable("?"))).isEqualTo("$?");
    }

    @Test
    void variable_nameWithSpecialCharacters_braced() {
        assertThat(render(variable("my var"))).isEqualTo("${my var}");
        assertThat(render(variable("a}b"))).isEqualTo("${a`}b}");
    }

    @Test
    void splattedVariable_usesAtSign() {
        assertThat(render(pipeline(command("Get-Item", Expression.splatted("params"))))).isEqualTo("Get-Item @params");
    }

    @Test
    void usingVariable_hasScopePrefix() {
        assertThat(render(Expression.using("limit"))).isEqualTo("$using:limit");
    }

    @Test
    void usingVariable_splatted_usesAtSign() {
        var splatted = new Expression.UsingExpression(Expression.splatted("params"));

        assertThat(render(pipeline(command("Invoke-Thing", splatted)))).isEqualTo("Invoke-Thing @using:params");
    }

    @Test
    void usingVariable_nameWithSpecialCharacters_braced() {
        assertThat(render(Expression.using("my var"))).isEqualTo("${using:my var}");
        assertThat(render(Expression.using("a}b"))).isEqualTo("${using:a`}b}");
    }

    // === Members, indexes, types ===

    @Test
    void staticInvocation_withoutArguments() {
        assertThat(render(Expression.invokeStatic(Expression.type("type"), "GetThings"))).isEqualTo("[type]::GetThings()");
    }

    @Test
    void memberAccess_withVariableMember() {
        var access = new Expression.MemberExpression(variable("x"), variable("property"), false);

        assertThat(render(access)).isEqualTo("$x.$property");
    }

    @Test
    void staticInvocation_withVariableMemberAndArguments() {
        var call = new Expression.InvokeMemberExpression(Expression.type("type"),
                                                         variable("method"),
                                                         List.of(constant(1), constant(2), singleQuoted("x")),
                                                         true);

        assertThat(render(call)).isEqualTo("[type]::$method(1, 2, 'x')");
    }

    @Test
    void indexExpression_onMember() {
        var expression = index(member(variable("x"), "Item"), binary(variable("i"), TokenKind.PLUS, constant(1)));

        assertThat(render(expression)).isEqualTo("$x.Item[$i + 1]");
    }

    @Test
    void arrayExpression_withArrayLiteral() {
        var expression = arrayExpression(pipeline(arrayLiteral(constant(1), singleQuoted("Hi"), constant(3))));

        assertThat(render(expression)).isEqualTo("@(1, 'Hi', 3)");
    }

    @Test
    void typeNames_genericAndArray() {
        var generic = new Expression.TypeExpression(TypeName.generic("System.Collections.Generic.Dictionary",
                                                                     TypeName.simple("string"),
                                                                     TypeName.simple("int")));
        var array = new Expression.TypeExpression(TypeName.array(TypeName.simple("int"), 2));

        assertThat(render(generic)).isEqualTo("[System.Collections.Generic.Dictionary[string, int]]");
        assertThat(render(array)).isEqualTo("[int[,]]");
    }

    @Test
    void attributedExpression_withPositionalAndNamedArguments() {
        var attr = new AttributeBase.Attribute(TypeName.simple("ThirdAttribute"),
                                               List.of(constant(1), constant(2)),
                                               List.of(NamedAttributeArgument.of("Fun")));

        assertThat(render(new Expression.AttributedExpression(attr, variable("x"))))
            .isEqualTo("[ThirdAttribute(1, 2, Fun)]$x");
    }

    // === Commands and pipelines ===

    @Test
    void command_withSwitchAndParameterArgument() {
        var statement = pipeline(command("Get-ChildItem", parameter("Recurse"), parameter("Path"), bareWord("./here")));

        assertThat(render(statement)).isEqualTo("Get-ChildItem -Recurse -Path ./here");
    }

    @Test
    void commandParameter_withColonArgument() {
        var statement = pipeline(command("Get-Item", parameter("Force", constant(false))));

        assertThat(render(statement)).isEqualTo("Get-Item -Force:$false");
    }

    @Test
    void pipeline_joinedWithBars() {
        var statement = pipeline(command("Get-ChildItem"),
                                 command("?", bareWord("Name"), parameter("like"), singleQuoted("banana")),
                                 command("%", bareWord("FullPath")));

        assertThat(render(statement)).isEqualTo("Get-ChildItem | ? Name -like 'banana' | % FullPath");
    }

    @Test
    void backgroundPipeline_endsWithAmpersand() {
        var statement = Statement.background(command("Invoke-Expression", singleQuoted("runCommand")));

        assertThat(render(statement)).isEqualTo("Invoke-Expression 'runCommand' &");
    }

    @Test
    void pipelineChain_joinedWithOperator() {
        var statement = Statement.chain(pipeline(constant(1)), TokenKind.AND_AND, pipeline(constant(2)));

        assertThat(render(statement)).isEqualTo("1 && 2");
    }

    @Test
    void fileRedirections_outputStreamHasNoIndicator() {
        var statement = pipeline(command("gci").withRedirections(Redirection.toFile(RedirectionStream.OUTPUT, bareWord("test.txt")),
                                                                 Redirection.toFile(RedirectionStream.ERROR, bareWord("errs.txt"))));

        assertThat(render(statement)).isEqualTo("gci >test.txt 2>errs.txt");
    }

    @Test
    void appendAndMergeRedirections() {
        var statement = pipeline(command("gci").withRedirections(Redirection.appendToFile(RedirectionStream.ALL, bareWord("log.txt")),
                                                                 Redirection.merge(RedirectionStream.ERROR, RedirectionStream.OUTPUT)));

        assertThat(render(statement)).isEqualTo("gci *>>log.txt 2>&1");
    }

    @Test
    void invocationOperator_withScriptBlock() {
        var body = pipeline(binary(index(variable("args"), constant(0)), TokenKind.PLUS, constant(2)));
        var statement = pipeline(Statement.invoke(TokenKind.AMPERSAND, Expression.scriptBlock(body)));

        assertThat(render(statement)).isEqualTo("& {\n    $args[0] + 2\n}");
    }

    @Test
    void assignment_compoundOperator() {
        var statement = Statement.assign(variable("total"), TokenKind.PLUS_EQUALS, pipeline(variable("x")));

        assertThat(render(statement)).isEqualTo("$total += $x");
    }

    // === Flow control ===

    @Test
    void controlFlow_keywordsWithOperands() {
        assertThat(render(new Statement.ExitStatement(Optional.of(pipeline(constant(1)))))).isEqualTo("exit 1");
        assertThat(render(Statement.returnStatement(pipeline(Expression.paren(binary(variable("result"), TokenKind.PLUS, constant(3)))))))
            .isEqualTo("return ($result + 3)");
        assertThat(render(Statement.throwStatement(pipeline(Expression.convert("System.Exception", singleQuoted("Bad"))))))
            .isEqualTo("throw [System.Exception]'Bad'");
        assertThat(render(new Statement.BreakStatement(Optional.of(bareWord("outer"))))).isEqualTo("break outer");
        assertThat(render(new Statement.ContinueStatement(Optional.empty()))).isEqualTo("continue");
        assertThat(render(new Statement.ReturnStatement(Optional.empty()))).isEqualTo("return");
    }

    @Test
    void whileLoop_bracesOnOwnLines() {
        var loop = Statement.whileLoop(pipeline(binary(variable("i"), TokenKind.ILT, constant(10))),
                                       StatementBlock.of(pipeline(unary(TokenKind.POSTFIX_PLUS_PLUS, variable("i")))));

        assertThat(render(loop)).isEqualTo("""
            while ($i -lt 10)
            {
                $i++
            }
            """);
    }

    @Test
    void doWhileLoop_conditionAfterClosingBrace() {
        var loop = new Statement.DoWhileStatement(pipeline(binary(variable("x"), TokenKind.ILT, constant(10))),
                                                  StatementBlock.of(pipeline(unary(TokenKind.POSTFIX_PLUS_PLUS, variable("x")))));

        assertThat(render(loop)).isEqualTo("""
            do
            {
                $x++
            } while ($x -lt 10)
            """);
    }

    @Test
    void doUntilLoop_usesUntilKeyword() {
        var loop = new Statement.DoUntilStatement(pipeline(variable("done")), StatementBlock.empty());

        assertThat(render(loop)).isEqualTo("do\n{\n} until ($done)\n");
    }

    @Test
    void forEachLoop_usesInKeyword() {
        var loop = Statement.forEach(variable("n"),
                                     pipeline(arrayLiteral(constant(1), constant(2), constant(3))),
                                     StatementBlock.of(pipeline(variable("n"))));

        assertThat(render(loop)).isEqualTo("""
            foreach ($n in 1, 2, 3)
            {
                $n
            }
            """);
    }

    @Test
    void forLoop_allParts() {
        var loop = new Statement.ForStatement(Optional.of(Statement.assign(variable("i"), constant(0))),
                                              Optional.of(pipeline(binary(variable("i"), TokenKind.ILT, member(variable("args"), "Count")))),
                                              Optional.of(pipeline(unary(TokenKind.POSTFIX_PLUS_PLUS, variable("i")))),
                                              StatementBlock.of(pipeline(index(variable("args"), variable("i")))));

        assertThat(render(loop)).isEqualTo("""
            for ($i = 0; $i -lt $args.Count; $i++)
            {
                $args[$i]
            }
            """);
    }

    @Test
    void forLoop_omittedParts() {
        var loop = new Statement.ForStatement(Optional.empty(), Optional.empty(), Optional.empty(), StatementBlock.empty());

        assertThat(render(loop)).isEqualTo("for (;;)\n{\n}\n");
    }

    @Test
    void ifStatement_elseIfAndElseOnOwnLines() {
        var statement = Statement.ifStatement(pipeline(variable("x")), StatementBlock.of(pipeline(constant(1))))
                                 .withElseIf(pipeline(variable("y")), StatementBlock.of(pipeline(constant(2))))
                                 .withElse(StatementBlock.of(pipeline(constant(3))));

        assertThat(render(statement)).isEqualTo("""
            if ($x)
            {
                1
            }
            elseif ($y)
            {
                2
            }
            else
            {
                3
            }
            """);
    }

    @Test
    void trap_withTypeAndBody() {
        var trap = new Statement.TrapStatement(Optional.of(typeConstraint("System.Exception")),
                                               StatementBlock.of(pipeline(command("Write-Host", singleQuoted("oops")))));

        assertThat(render(trap)).isEqualTo("""
            trap [System.Exception]
            {
                Write-Host 'oops'
            }
            """);
    }

    // === Hashtables ===

    @Test
    void hashtable_empty() {
        assertThat(render(hashtable())).isEqualTo("@{}");
    }

    @Test
    void hashtable_entriesOnOwnLines() {
        var table = hashtable(HashtableEntry.of("One", singleQuoted("One")),
                              HashtableEntry.of("Two", variable("x")),
                              HashtableEntry.of(variable("banana"), constant(7)));

        assertThat(render(table)).isEqualTo("@{\n    One = 'One'\n    Two = $x\n    $banana = 7\n}");
    }

    @Test
    void hashtable_nestedIndentation() {
        var table = hashtable(HashtableEntry.of("One", constant(1)),
                              HashtableEntry.of("Sub", hashtable(HashtableEntry.of("SubOne", constant(2)),
                                                                 HashtableEntry.of("SubTwo", Expression.scriptBlock(pipeline(variable("x")))))));

        assertThat(render(table)).isEqualTo("""
            @{
                One = 1
                Sub = @{
                    SubOne = 2
                    SubTwo = {
                        $x
                    }
                }
            }""");
    }

    // === Functions and script blocks ===

    @Test
    void function_simpleBody() {
        var function = Statement.function("Test-Function",
                                          ScriptBlock.of(pipeline(command("Write-Host", singleQuoted("Hello!")))));

        assertThat(render(function)).isEqualTo("""
            function Test-Function
            {
                Write-Host 'Hello!'
            }
            """);
    }

    @Test
    void filter_usesFilterKeyword() {
        var filter = Statement.filter("Get-Even", ScriptBlock.of(pipeline(variable("_"))));

        assertThat(render(filter)).startsWith("filter Get-Even\n{");
    }

    @Test
    void advancedFunction_paramBlockWithAttributes() {
        var params = new ParamBlock(List.of(attribute("CmdletBinding")),
                                    List.of(Parameter.of("Greeting", attribute("Parameter"), typeConstraint("string"))));
        var function = Statement.function("Test-Greeting",
                                          ScriptBlock.of(params, pipeline(command("Write-Host", variable("Greeting")))));

        assertThat(render(function)).isEqualTo("""
            function Test-Greeting
            {
                [CmdletBinding()]
                param(
                    [Parameter()]
                    [string]
                    $Greeting
                )

                Write-Host $Greeting
            }
            """);
    }

    @Test
    void paramBlock_parametersSeparatedByBlankLine() {
        var params = ParamBlock.of(Parameter.of("Name",
                                                attribute("Parameter", NamedAttributeArgument.of("Mandatory", constant(true)))),
                                   Parameter.of("Count", typeConstraint("int")).withDefault(constant(1)));

        assertThat(render(Expression.scriptBlock(ScriptBlock.of(params)))).isEqualTo("""
            {
                param(
                    [Parameter(Mandatory = $true)]
                    $Name,

                    [int]
                    $Count = 1
                )
            }""");
    }

    @Test
    void paramBlock_emptyRendersParentheses() {
        assertThat(render(Expression.scriptBlock(ScriptBlock.of(ParamBlock.of())))).isEqualTo("{\n    param()\n}");
    }

    @Test
    void scriptBlock_emptyRendersBraces() {
        assertThat(render(Expression.scriptBlock())).isEqualTo("{\n}");
    }

    @Test
    void scriptBlock_namedBlocksSeparatedByBlankLine() {
        var script = ScriptBlock.of()
                                .withBeginBlock(NamedBlock.of(BlockKind.BEGIN, pipeline(constant(1))))
                                .withProcessBlock(NamedBlock.of(BlockKind.PROCESS, pipeline(variable("_"))))
                                .withEndBlock(NamedBlock.of(BlockKind.END));

        assertThat(render(Expression.scriptBlock(script))).isEqualTo("""
            {
                begin
                {
                    1
                }

                process
                {
                    $_
                }

                end
                {
                }
            }""");
    }

    @Test
    void scriptBlock_dynamicParamForcesExplicitEndBlock() {
        var script = ScriptBlock.of(pipeline(variable("x")))
                                .withDynamicParamBlock(NamedBlock.of(BlockKind.DYNAMICPARAM, pipeline(variable("d"))));

        assertThat(render(Expression.scriptBlock(script))).isEqualTo("""
            {
                dynamicparam
                {
                    $d
                }

                end
                {
                    $x
                }
            }""");
    }

    @Test
    void statementSequence_blankLineAfterCompoundStatement() {
        var script = ScriptBlock.of(Statement.ifStatement(pipeline(variable("a")), StatementBlock.of(pipeline(constant(1)))),
                                    pipeline(constant(2)),
                                    pipeline(constant(3)));

        assertThat(render(Expression.scriptBlock(script))).isEqualTo("""
            {
                if ($a)
                {
                    1
                }

                2
                3
            }""");
    }

    @Test
    void statementSequence_noBlankLineBeforeClosingBrace() {
        var function = Statement.function("Test",
                                          ScriptBlock.of(Statement.ifStatement(pipeline(variable("a")),
                                                                               StatementBlock.of(pipeline(constant(1))))));

        assertThat(render(function)).isEqualTo("""
            function Test
            {
                if ($a)
                {
                    1
                }
            }
            """);
    }

    @Test
    void statementBlock_trapsPrecedeStatements() {
        var trap = new Statement.TrapStatement(Optional.empty(), StatementBlock.of(pipeline(command("continue"))));
        var block = new StatementBlock(List.of(trap), List.of(pipeline(variable("x"))));
        var loop = Statement.whileLoop(pipeline(constant(true)), block);

        assertThat(render(loop)).isEqualTo("""
            while ($true)
            {
                trap
                {
                    continue
                }

                $x
            }
            """);
    }

    // === Type definitions ===

    @Test
    void emptyClass_bracesOnOwnLines() {
        var type = new Statement.TypeDefinition("Duck", TypeKind.CLASS, List.of(), List.of());

        assertThat(render(type)).isEqualTo("class Duck\n{\n}\n");
    }

    @Test
    void class_withProperty() {
        var type = new Statement.TypeDefinition("Duck", TypeKind.CLASS, List.of(), List.of(MemberNode.property("string", "Name")));

        assertThat(render(type)).isEqualTo("""
            class Duck
            {
                [string]$Name
            }
            """);
    }

    @Test
    void class_withPropertyAndMethod() {
        var method = MemberNode.method("string",
                                       "GetGreeting",
                                       List.of(Parameter.of("Name", typeConstraint("string"))),
                                       ScriptBlock.of(Statement.returnStatement(pipeline(expandable("Hi $Name")))));
        var type = new Statement.TypeDefinition("Duck",
                                                TypeKind.CLASS,
                                                List.of(TypeName.simple("Bird")),
                                                List.of(MemberNode.property("string", "Name"), method));

        assertThat(render(type)).isEqualTo("""
            class Duck : Bird
            {
                [string]$Name

                [string]GetGreeting([string]$Name)
                {
                    return "Hi $Name"
                }
            }
            """);
    }

    @Test
    void class_modifiersAndConstructor() {
        var property = MemberNode.property("int", "Count").withInitialValue(constant(0)).asStatic().asHidden();
        var ctor = MemberNode.constructor("Duck",
                                          List.of(Parameter.of("Name", typeConstraint("string")), Parameter.of("Age")),
                                          ScriptBlock.of());
        var type = new Statement.TypeDefinition("Duck", TypeKind.CLASS, List.of(), List.of(property, ctor));

        assertThat(render(type)).isEqualTo("""
            class Duck
            {
                static hidden [int]$Count = 0

                Duck([string]$Name, $Age)
                {
                }
            }
            """);
    }

    @Test
    void interface_membersOnConsecutiveLines() {
        var type = new Statement.TypeDefinition("IDuck",
                                                TypeKind.INTERFACE,
                                                List.of(),
                                                List.of(MemberNode.property("string", "Name"), MemberNode.property("int", "Age")));

        assertThat(render(type)).isEqualTo("""
            interface IDuck
            {
                [string]$Name
                [int]$Age
            }
            """);
    }

    @Test
    void enum_membersSeparatedByComma() {
        var type = new Statement.TypeDefinition("Color",
                                                TypeKind.ENUM,
                                                List.of(),
                                                List.of(MemberNode.property("Red"),
                                                        MemberNode.property("Green").withInitialValue(constant(5))));

        assertThat(render(type)).isEqualTo("""
            enum Color
            {
                Red,
                Green = 5
            }
            """);
    }

    @Test
    void enum_withMethodMember_isUnsupported() {
        var type = new Statement.TypeDefinition("Color",
                                                TypeKind.ENUM,
                                                List.of(),
                                                List.of(MemberNode.method("void", "Paint", List.of(), ScriptBlock.of())));

        var result = renderer.renderStatement(type);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).containsInstanceOf(RenderError.UnsupportedConstruct.class);
    }

    // === Using directives and scripts ===

    @Test
    void usingNamespace_terminatedByNewline() {
        var result = renderer.renderUsingDirective(Statement.using(UsingKind.NAMESPACE, "System.Collections.Generic"));

        assertThat(result.unwrap()).isEqualTo("using namespace System.Collections.Generic\n");
    }

    @Test
    void usingModule_withModuleSpecification_inlineHashtable() {
        var specification = hashtable(HashtableEntry.of("ModuleName", singleQuoted("PrettyPrintingTestModule")),
                                      HashtableEntry.of("ModuleVersion", singleQuoted("1.18")));
        var directive = new Statement.UsingStatement(UsingKind.MODULE, specification, Optional.empty());

        assertThat(renderer.renderUsingDirective(directive).unwrap())
            .isEqualTo("using module @{ ModuleName = 'PrettyPrintingTestModule'; ModuleVersion = '1.18' }\n");
    }

    @Test
    void usingNamespace_withAlias() {
        var directive = new Statement.UsingStatement(UsingKind.NAMESPACE,
                                                     bareWord("System.Collections.Generic"),
                                                     Optional.of(bareWord("Gen")));

        assertThat(renderer.renderUsingDirective(directive).unwrap())
            .isEqualTo("using namespace Gen = System.Collections.Generic\n");
    }

    @Test
    void usingDirective_withUnsupportedTarget_fails() {
        var directive = new Statement.UsingStatement(UsingKind.ASSEMBLY, variable("path"), Optional.empty());

        var result = renderer.renderUsingDirective(directive);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).containsInstanceOf(RenderError.UnsupportedConstruct.class);
    }

    @Test
    void script_fullLayout() {
        var script = ScriptBlock.of(ParamBlock.of(Parameter.of("Path", typeConstraint("string"))))
                                .withBeginBlock(NamedBlock.of(BlockKind.BEGIN, Statement.assign(variable("count"), constant(0))))
                                .withEndBlock(NamedBlock.of(BlockKind.END,
                                                            Statement.ifStatement(pipeline(binary(variable("count"), TokenKind.IGT, constant(1))),
                                                                                  StatementBlock.of(pipeline(command("Write-Host", singleQuoted("Many"))))),
                                                            pipeline(variable("count"))));

        assertThat(renderer.renderScript(script).unwrap()).isEqualTo("""
            param(
                [string]
                $Path
            )

            begin
            {
                $count = 0
            }

            end
            {
                if ($count -gt 1)
                {
                    Write-Host 'Many'
                }

                $count
            }""");
    }

    @Test
    void script_usingDirectivesPrecedeBody() {
        var script = ScriptBlock.of(pipeline(command("Get-Thing")))
                                .withUsing(Statement.using(UsingKind.NAMESPACE, "System.IO"),
                                           Statement.using(UsingKind.MODULE, "Things"));

        assertThat(renderer.renderScript(script).unwrap()).isEqualTo("""
            using namespace System.IO
            using module Things

            Get-Thing""");
    }

    @Test
    void script_empty_rendersNothing() {
        assertThat(renderer.renderScript(ScriptBlock.of()).unwrap()).isEmpty();
    }

    // === Unsupported input ===

    @Test
    void unsupportedStatements_failWithConstructName() {
        assertUnsupported(new Statement.TryStatement(StatementBlock.empty(), List.of(), Optional.empty()), "try statement");
        assertUnsupported(new Statement.SwitchStatement(pipeline(variable("x")), List.of(), Optional.empty()), "switch statement");
        assertUnsupported(new Statement.ErrorStatement("oops"), "error statement");
        assertUnsupported(Statement.using(UsingKind.NAMESPACE, "System"), "using statement");
    }

    @Test
    void unsupportedConstruct_nestedDeepInside_failsWholeRender() {
        var function = Statement.function("Broken",
                                          ScriptBlock.of(pipeline(constant(1)),
                                                         new Statement.DataStatement(Optional.empty(), List.of(), StatementBlock.empty())));

        var result = renderer.renderStatement(function);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).contains(new RenderError.UnsupportedConstruct("data statement"));
    }

    @Test
    void unsupportedExpressions_fail() {
        assertThat(renderer.renderExpression(new Expression.ErrorExpression("?")).error())
            .contains(new RenderError.UnsupportedConstruct("error expression"));
        assertThat(renderer.renderExpression(new Expression.BaseCtorInvokeMemberExpression(List.of())).error())
            .contains(new RenderError.UnsupportedConstruct("base constructor invocation"));
    }

    @Test
    void tokenWithoutSpelling_failsWithUnsupportedToken() {
        var result = renderer.renderExpression(binary(variable("a"), TokenKind.VARIABLE, variable("b")));

        assertThat(result.error()).contains(new RenderError.UnsupportedToken(TokenKind.VARIABLE));
    }

    @Test
    void renderer_reusableAfterFailure() {
        renderer.renderStatement(new Statement.ErrorStatement("oops"));

        assertThat(render(variable("x"))).isEqualTo("$x");
    }

    @Test
    void depthLimit_exceeded_failsInsteadOfOverflowing() {
        var shallow = TreeRenderer.create(new RendererConfig(4));
        var expression = unary(TokenKind.MINUS, unary(TokenKind.MINUS, unary(TokenKind.MINUS, unary(TokenKind.MINUS, variable("x")))));

        var result = shallow.renderExpression(expression);

        assertThat(result.error()).contains(new RenderError.UnsupportedConstruct("nesting deeper than 4 levels"));
        assertThat(shallow.renderExpression(unary(TokenKind.MINUS, variable("x"))).unwrap()).isEqualTo("- $x");
    }

    @Test
    void depthLimit_deeplyNestedTreeWithDefaultConfig_fails() {
        Expression expression = variable("x");
        for (int i = 0; i < 10_000; i++) {
            expression = Expression.paren(expression);
        }

        var result = renderer.renderExpression(expression);

        assertThat(result.isFailure()).isTrue();
    }

    @Test
    void depthLimit_atCeiling_deepTreeFailsWithoutStackOverflow() {
        var deepest = TreeRenderer.create(new RendererConfig(RendererConfig.MAX_DEPTH));
        Expression expression = variable("x");
        for (int i = 0; i < 200_000; i++) {
            expression = Expression.paren(expression);
        }

        var result = deepest.renderExpression(expression);

        assertThat(result.error())
            .contains(new RenderError.UnsupportedConstruct("nesting deeper than " + RendererConfig.MAX_DEPTH + " levels"));
    }

    private void assertUnsupported(Statement statement, String construct) {
        assertThat(renderer.renderStatement(statement).error())
            .contains(new RenderError.UnsupportedConstruct(construct));
    }
}
