package org.pragmatica.pwsh.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * One element of a command invocation: the command name, an argument or a parameter.
 */
public sealed interface CommandElement extends Node permits Expression, CommandElement.CommandParameter {

    static CommandParameter parameter(String name) {
        return new CommandParameter(name, Optional.empty());
    }

    static CommandParameter parameter(String name, Expression argument) {
        return new CommandParameter(name, Optional.of(argument));
    }

    /**
     * Command parameter: {@code -Name} or {@code -Name:argument}.
     */
    record CommandParameter(String name, Optional<Expression> argument) implements CommandElement {
        public CommandParameter {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(argument, "argument");
        }

        @Override
        public void accept(NodeVisitor visitor) {
            visitor.visitCommandParameter(this);
        }
    }
}
