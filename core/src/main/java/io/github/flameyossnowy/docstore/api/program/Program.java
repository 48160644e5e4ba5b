package io.github.flameyossnowy.docstore.api.program;

import io.github.flameyossnowy.docstore.api.batch.BatchEntry;
import io.github.flameyossnowy.docstore.api.batch.BatchOutcome;
import io.github.flameyossnowy.docstore.api.model.DocumentValue;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.api.model.RawContent;
import io.github.flameyossnowy.docstore.api.model.Version;
import io.github.flameyossnowy.docstore.api.operation.Operation;
import io.github.flameyossnowy.docstore.api.operation.operations.BatchCreateOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.CreateOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.GetCounterOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.GetOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.IncrementCounterOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.RemoveOperation;
import io.github.flameyossnowy.docstore.api.operation.operations.UpdateOperation;
import io.github.flameyossnowy.docstore.api.result.TransactionResult;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A description of one or more document operations, not yet executed.
 * <p>
 * Programs are immutable values. Building, composing, storing or reusing a
 * program never touches a backend; only a {@link ProgramInterpreter} runs one.
 * Composition forms a chain of continuations:
 * <pre>{@code
 * Program<DocumentValue> bump = Program.get(key)
 *         .andThen(doc -> Program.update(key, next(doc.content()), doc.version()));
 * }</pre>
 * Stages run in the order they are declared. A failed stage skips every later
 * {@code andThen}/{@code map} stage up to the nearest {@code orElse}/{@code mapError}.
 *
 * @param <T> the result type
 */
public abstract class Program<T> {
    Program() {
    }

    @Contract(value = "_ -> new", pure = true)
    public static <T> @NotNull Program<T> pure(T value) {
        return new Pure<>(value);
    }

    @Contract(value = "_ -> new", pure = true)
    public static <T> @NotNull Program<T> fail(@NotNull Throwable error) {
        return new Failed<>(Objects.requireNonNull(error, "error"));
    }

    /**
     * Lifts a result that is already known into a program.
     *
     * @param result the known result
     * @return a program yielding that result
     */
    public static <T> @NotNull Program<T> fromResult(@NotNull TransactionResult<T> result) {
        return result.fold(error -> Program.<T>fail(error), value -> Program.<T>pure(value));
    }

    @Contract(value = "_ -> new", pure = true)
    public static <T> @NotNull Program<T> lift(@NotNull Operation<T> operation) {
        return new Suspend<>(Objects.requireNonNull(operation, "operation"));
    }

    public static @NotNull Program<DocumentValue> get(@NotNull Key key) {
        return lift(new GetOperation(key));
    }

    public static @NotNull Program<DocumentValue> create(@NotNull Key key, @NotNull RawContent content) {
        return lift(new CreateOperation(key, content));
    }

    public static @NotNull Program<DocumentValue> update(@NotNull Key key, @NotNull RawContent content, @NotNull Version version) {
        return lift(new UpdateOperation(key, content, version));
    }

    public static @NotNull Program<Boolean> remove(@NotNull Key key) {
        return lift(new RemoveOperation(key));
    }

    public static @NotNull Program<Long> getCounter(@NotNull Key key) {
        return lift(new GetCounterOperation(key));
    }

    public static @NotNull Program<Long> incrementCounter(@NotNull Key key, long delta) {
        return lift(new IncrementCounterOperation(key, delta));
    }

    public static @NotNull Program<BatchOutcome> batchCreate(@NotNull Iterable<TransactionResult<BatchEntry>> items,
                                                             @NotNull Predicate<Throwable> continuation) {
        return lift(new BatchCreateOperation(items, continuation));
    }

    /**
     * Sequences a stage whose program depends on this program's result.
     *
     * @param continuation builds the next program from the result
     * @return the composed program
     */
    @Contract(value = "_ -> new", pure = true)
    public <R> @NotNull Program<R> andThen(@NotNull Function<? super T, ? extends Program<R>> continuation) {
        return new Bind<>(this, Objects.requireNonNull(continuation, "continuation"));
    }

    /**
     * Transforms the result without running another operation.
     *
     * @param function the pure transformation
     * @return the composed program
     */
    public <R> @NotNull Program<R> map(@NotNull Function<? super T, ? extends R> function) {
        Objects.requireNonNull(function, "function");
        return andThen(value -> Program.<R>pure(function.apply(value)));
    }

    /**
     * Runs {@code next} after this program succeeds, discarding this program's result.
     *
     * @param next the following program
     * @return the composed program
     */
    public <R> @NotNull Program<R> then(@NotNull Program<R> next) {
        Objects.requireNonNull(next, "next");
        return this.<R>andThen(ignored -> next);
    }

    /**
     * Replaces the error of a failed run. Successful runs are untouched.
     *
     * @param function maps the error
     * @return the composed program
     */
    public @NotNull Program<T> mapError(@NotNull Function<? super Throwable, ? extends Throwable> function) {
        Objects.requireNonNull(function, "function");
        return new Recover<>(this, error -> Program.<T>fail(function.apply(error)));
    }

    /**
     * Continues with a fallback program when this program fails.
     *
     * @param fallback builds the fallback from the error
     * @return the composed program
     */
    @Contract(value = "_ -> new", pure = true)
    public @NotNull Program<T> orElse(@NotNull Function<? super Throwable, ? extends Program<T>> fallback) {
        return new Recover<>(this, Objects.requireNonNull(fallback, "fallback"));
    }

    static final class Pure<T> extends Program<T> {
        final T value;

        Pure(T value) {
            this.value = value;
        }

        @Override
        public String toString() {
            return "Pure[" + value + "]";
        }
    }

    static final class Failed<T> extends Program<T> {
        final Throwable error;

        Failed(Throwable error) {
            this.error = error;
        }

        @Override
        public String toString() {
            return "Failed[" + error + "]";
        }
    }

    static final class Suspend<T> extends Program<T> {
        final Operation<T> operation;

        Suspend(Operation<T> operation) {
            this.operation = operation;
        }

        @Override
        public String toString() {
            return "Suspend[" + operation + "]";
        }
    }

    static final class Bind<A, T> extends Program<T> {
        final Program<A> source;
        final Function<? super A, ? extends Program<T>> continuation;

        Bind(Program<A> source, Function<? super A, ? extends Program<T>> continuation) {
            this.source = source;
            this.continuation = continuation;
        }

        @Override
        public String toString() {
            return "Bind[" + source + "]";
        }
    }

    static final class Recover<T> extends Program<T> {
        final Program<T> source;
        final Function<? super Throwable, ? extends Program<T>> fallback;

        Recover(Program<T> source, Function<? super Throwable, ? extends Program<T>> fallback) {
            this.source = source;
            this.fallback = fallback;
        }

        @Override
        public String toString() {
            return "Recover[" + source + "]";
        }
    }
}
