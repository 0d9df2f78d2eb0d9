package org.pragmatica.pwsh.ast;

import java.util.Objects;

/**
 * Stream redirections attached to a command.
 */
public sealed interface Redirection extends Node {

    RedirectionStream fromStream();

    static FileRedirection toFile(RedirectionStream from, Expression location) {
        return new FileRedirection(from, location, false);
    }

    static FileRedirection appendToFile(RedirectionStream from, Expression location) {
        return new FileRedirection(from, location, true);
    }

    static MergingRedirection merge(RedirectionStream from, RedirectionStream to) {
        return new MergingRedirection(from, to);
    }

    /**
     * {@code 2>file}, or {@code 2>>file} when appending.
     */
    record FileRedirection(RedirectionStream fromStream, Expression location, boolean append) implements Redirection {
        public FileRedirection {
            Objects.requireNonNull(fromStream, "fromStream");
            Objects.requireNonNull(location, "location");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitFileRedirection(this);
        }
    }

    /**
     * {@code 2>&1}
     */
    record MergingRedirection(RedirectionStream fromStream, RedirectionStream toStream) implements Redirection {
        public MergingRedirection {
            Objects.requireNonNull(fromStream, "fromStream");
            Objects.requireNonNull(toStream, "toStream");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitMergingRedirection(this);
        }
    }
}
