package org.pragmatica.pwsh.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Script block: optional {@code param} block and up to four named blocks.
 * A whole script file is a script block too; its {@code using} directives are kept here.
 */
public record ScriptBlock(List<Statement.UsingStatement> usingStatements,
                          Optional<ParamBlock> paramBlock,
                          Optional<NamedBlock> dynamicParamBlock,
                          Optional<NamedBlock> beginBlock,
                          Optional<NamedBlock> processBlock,
                          Optional<NamedBlock> endBlock) implements Node {
    public ScriptBlock {
        usingStatements = List.copyOf(usingStatements);
        Objects.requireNonNull(paramBlock, "paramBlock");
        Objects.requireNonNull(dynamicParamBlock, "dynamicParamBlock");
        Objects.requireNonNull(beginBlock, "beginBlock");
        Objects.requireNonNull(processBlock, "processBlock");
        Objects.requireNonNull(endBlock, "endBlock");
    }

    /**
     * Script block whose statements form the implicit end block.
     */
    public static ScriptBlock of(Statement... statements) {
        return new ScriptBlock(List.of(),
                               Optional.empty(),
                               Optional.empty(),
                               Optional.empty(),
                               Optional.empty(),
                               Optional.of(NamedBlock.unnamed(statements)));
    }

    public static ScriptBlock of(ParamBlock paramBlock, Statement... statements) {
        return of(statements).withParamBlock(paramBlock);
    }

    public ScriptBlock withUsing(Statement.UsingStatement... directives) {
        return new ScriptBlock(List.of(directives), paramBlock, dynamicParamBlock, beginBlock, processBlock, endBlock);
    }

    public ScriptBlock withParamBlock(ParamBlock block) {
        return new ScriptBlock(usingStatements, Optional.of(block), dynamicParamBlock, beginBlock, processBlock, endBlock);
    }

    public ScriptBlock withDynamicParamBlock(NamedBlock block) {
        return new ScriptBlock(usingStatements, paramBlock, Optional.of(block), beginBlock, processBlock, endBlock);
    }

    public ScriptBlock withBeginBlock(NamedBlock block) {
        return new ScriptBlock(usingStatements, paramBlock, dynamicParamBlock, Optional.of(block), processBlock, endBlock);
    }

    public ScriptBlock withProcessBlock(NamedBlock block) {
        return new ScriptBlock(usingStatements, paramBlock, dynamicParamBlock, beginBlock, Optional.of(block), endBlock);
    }

    public ScriptBlock withEndBlock(NamedBlock block) {
        return new ScriptBlock(usingStatements, paramBlock, dynamicParamBlock, beginBlock, processBlock, Optional.of(block));
    }

    @Override
    public void accept(NodeVisitor visitor) {
        visitor.visitScriptBlock(this);
    }
}
