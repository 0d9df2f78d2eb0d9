package org.pragmatica.pwsh.printer;

/**
 * Renderer configuration options.
 *
 * @param maxDepth deepest node nesting the renderer descends into before giving up,
 *                 between 1 and {@link #MAX_DEPTH}
 */
public record RendererConfig(int maxDepth) {
    /**
     * Ceiling for {@code maxDepth}. Deeper traversal risks exhausting the thread stack.
     */
    public static final int MAX_DEPTH = 1024;
    public static final RendererConfig DEFAULT = new RendererConfig(512);

    public RendererConfig {
        if (maxDepth < 1 || maxDepth > MAX_DEPTH) {
            throw new IllegalArgumentException("maxDepth must be between 1 and " + MAX_DEPTH + ": " + maxDepth);
        }
    }
}
