package org.pragmatica.pwsh;

import org.pragmatica.pwsh.ast.Expression;
import org.pragmatica.pwsh.ast.ScriptBlock;
import org.pragmatica.pwsh.ast.Statement;
import org.pragmatica.pwsh.printer.Printer;
import org.pragmatica.pwsh.printer.RenderResult;
import org.pragmatica.pwsh.printer.RendererConfig;
import org.pragmatica.pwsh.printer.TreeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Entry point for rendering PowerShell syntax trees.
 *
 * <p>Example usage:
 * <pre>{@code
 * var statement = Statement.pipeline(Statement.command("Get-ChildItem", CommandElement.parameter("Recurse")));
 *
 * var text = PrettyPrinter.renderStatement(statement).unwrap();
 * }</pre>
 */
public final class PrettyPrinter {
    private static final Logger log = LoggerFactory.getLogger(PrettyPrinter.class);
    private static final Printer DEFAULT = new ConfiguredPrinter(RendererConfig.DEFAULT);

    private PrettyPrinter() {}

    public static RenderResult renderStatement(Statement statement) {
        return DEFAULT.renderStatement(statement);
    }

    public static RenderResult renderExpression(Expression expression) {
        return DEFAULT.renderExpression(expression);
    }

    public static RenderResult renderUsingDirective(Statement.UsingStatement directive) {
        return DEFAULT.renderUsingDirective(directive);
    }

    public static RenderResult renderScript(ScriptBlock script) {
        return DEFAULT.renderScript(script);
    }

    /**
     * Create a builder for a printer with custom configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a {@link Printer}.
     */
    public static final class Builder {
        private int maxDepth = RendererConfig.DEFAULT.maxDepth();

        private Builder() {}

        /**
         * Deepest node nesting rendered before giving up.
         */
        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the configured depth is not positive
         */
        public Printer build() {
            return new ConfiguredPrinter(new RendererConfig(maxDepth));
        }
    }

    private record ConfiguredPrinter(RendererConfig config) implements Printer {

        @Override
        public RenderResult renderStatement(Statement statement) {
            return render("statement", renderer -> renderer.renderStatement(statement));
        }

        @Override
        public RenderResult renderExpression(Expression expression) {
            return render("expression", renderer -> renderer.renderExpression(expression));
        }

        @Override
        public RenderResult renderUsingDirective(Statement.UsingStatement directive) {
            return render("using directive", renderer -> renderer.renderUsingDirective(directive));
        }

        @Override
        public RenderResult renderScript(ScriptBlock script) {
            return render("script", renderer -> renderer.renderScript(script));
        }

        private RenderResult render(String what, Function<TreeRenderer, RenderResult> action) {
            var result = action.apply(TreeRenderer.create(config));
            if (result.isFailure()) {
                result.error()
                      .ifPresent(error -> log.debug("Failed to render {}: {}", what, error.message()));
            } else if (log.isTraceEnabled()) {
                log.trace("Rendered {} ({} chars)", what, result.unwrap().length());
            }
            return result;
        }
    }
}
