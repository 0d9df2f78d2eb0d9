package org.pragmatica.pwsh.printer;

import org.pragmatica.pwsh.error.RenderError;

import java.util.Optional;
import java.util.function.Function;

/**
 * Result of rendering - either the rendered text or the reason rendering stopped.
 */
public sealed interface RenderResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The rendered text.
     *
     * @throws IllegalStateException if rendering failed
     */
    String unwrap();

    Optional<RenderError> error();

    <R> R fold(Function<RenderError, R> onFailure, Function<String, R> onSuccess);

    default RenderResult map(Function<String, String> mapper) {
        return fold(RenderResult::failure, text -> success(mapper.apply(text)));
    }

    static RenderResult success(String text) {
        return new Success(text);
    }

    static RenderResult failure(RenderError error) {
        return new Failure(error);
    }

    record Success(String text) implements RenderResult {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String unwrap() {
            return text;
        }

        @Override
        public Optional<RenderError> error() {
            return Optional.empty();
        }

        @Override
        public <R> R fold(Function<RenderError, R> onFailure, Function<String, R> onSuccess) {
            return onSuccess.apply(text);
        }
    }

    record Failure(RenderError cause) implements RenderResult {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public String unwrap() {
            throw new IllegalStateException(cause.message());
        }

        @Override
        public Optional<RenderError> error() {
            return Optional.of(cause);
        }

        @Override
        public <R> R fold(Function<RenderError, R> onFailure, Function<String, R> onSuccess) {
            return onFailure.apply(cause);
        }
    }
}
