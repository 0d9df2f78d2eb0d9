package org.pragmatica.pwsh.printer;

import org.pragmatica.pwsh.error.RenderError;

import java.util.List;
import java.util.function.Consumer;

/**
 * Mutable output state of one render call: the text buffer, the indentation level and the
 * nesting depth of the traversal.
 *
 * <p>Indentation is written lazily, in front of the first text of a line, so blank lines
 * never carry trailing spaces.
 */
public final class RenderContext {
    private static final String INDENT = "    ";
    private static final char NEWLINE = '\n';

    private final StringBuilder buffer;
    private final int maxDepth;

    private int indent;
    private int depth;
    private boolean atLineStart;

    private RenderContext(RendererConfig config) {
        this.buffer = new StringBuilder();
        this.maxDepth = config.maxDepth();
        this.indent = 0;
        this.depth = 0;
        this.atLineStart = false;
    }

    public static RenderContext create(RendererConfig config) {
        return new RenderContext(config);
    }

    // === Text ===

    public RenderContext write(String text) {
        if (text.isEmpty()) {
            return this;
        }
        writeIndentIfPending();
        buffer.append(text);
        return this;
    }

    public RenderContext write(char c) {
        writeIndentIfPending();
        buffer.append(c);
        return this;
    }

    /**
     * Append text exactly as given. Used for here-string bodies, whose lines must not be
     * indented and whose terminator has to start a line.
     */
    public RenderContext writeVerbatim(String text) {
        atLineStart = false;
        buffer.append(text);
        return this;
    }

    public String text() {
        return buffer.toString();
    }

    public void reset() {
        buffer.setLength(0);
        indent = 0;
        depth = 0;
        atLineStart = false;
    }

    // === Layout ===

    public int indentLevel() {
        return indent;
    }

    /**
     * Line break; the next line starts at the current indentation.
     */
    public void newline() {
        buffer.append(NEWLINE);
        atLineStart = true;
    }

    /**
     * {@code count - 1} blank lines, then a line break.
     */
    public void newline(int count) {
        for (int i = 0; i < count; i++) {
            buffer.append(NEWLINE);
        }
        atLineStart = true;
    }

    public void indent() {
        indent++;
        newline();
    }

    /**
     * Step one level out and start a fresh line. Blank lines left by the enclosed content
     * are dropped, so a closing delimiter always follows its last line directly.
     */
    public void dedent() {
        if (indent > 0) {
            indent--;
        }
        if (atLineStart) {
            trimTrailingBlankLines();
        } else {
            newline();
        }
    }

    public void beginBlock() {
        newline();
        write('{');
        indent();
    }

    public void endBlock() {
        dedent();
        write('}');
    }

    /**
     * Terminates a statement that ends with a block of its own.
     */
    public void endStatement() {
        buffer.append(NEWLINE);
        atLineStart = true;
    }

    public <T> void intersperse(List<T> items, String separator, Consumer<T> writer) {
        intersperse(items, () -> write(separator), writer);
    }

    public <T> void intersperse(List<T> items, Runnable separator, Consumer<T> writer) {
        if (items == null || items.isEmpty()) {
            return;
        }
        writer.accept(items.get(0));
        for (int i = 1; i < items.size(); i++) {
            separator.run();
            writer.accept(items.get(i));
        }
    }

    // === Depth guard ===

    /**
     * Record descent into a child node.
     *
     * @throws RenderAbortedException when the configured nesting limit is exceeded
     */
    void enter() {
        if (++depth > maxDepth) {
            throw new RenderAbortedException(
                new RenderError.UnsupportedConstruct("nesting deeper than " + maxDepth + " levels"));
        }
    }

    void exit() {
        depth--;
    }

    private void writeIndentIfPending() {
        if (atLineStart) {
            buffer.append(INDENT.repeat(indent));
            atLineStart = false;
        }
    }

    private void trimTrailingBlankLines() {
        int end = buffer.length();
        while (end >= 2 && buffer.charAt(end - 1) == NEWLINE && buffer.charAt(end - 2) == NEWLINE) {
            end--;
        }
        buffer.setLength(end);
    }
}
