package io.github.flameyossnowy.docstore.api.batch;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Summary of a batch run: the indices that were created and the ordered list of failures.
 * <p>
 * Outcomes of consecutive batch steps fold into one with {@link #combine(BatchOutcome)}.
 * Combining is associative; succeeded indices merge as a set and failures are appended
 * in order, skipping indices that already failed.
 *
 * @param succeeded indices of created items
 * @param failures failed items in the order they were recorded
 */
public record BatchOutcome(@NotNull SortedSet<Integer> succeeded, @NotNull List<BatchFailure> failures) {
    private static final BatchOutcome EMPTY = new BatchOutcome(new TreeSet<>(), List.of());

    public BatchOutcome {
        succeeded = Collections.unmodifiableSortedSet(new TreeSet<>(succeeded));
        failures = List.copyOf(failures);
    }

    @Contract(pure = true)
    public static @NotNull BatchOutcome empty() {
        return EMPTY;
    }

    public static @NotNull BatchOutcome succeeded(int index) {
        return new BatchOutcome(new TreeSet<>(List.of(index)), List.of());
    }

    public static @NotNull BatchOutcome failed(int index, @NotNull Throwable cause) {
        return new BatchOutcome(new TreeSet<>(), List.of(new BatchFailure(index, cause)));
    }

    public static @NotNull BatchOutcome of(@NotNull Collection<Integer> succeeded, @NotNull List<BatchFailure> failures) {
        return new BatchOutcome(new TreeSet<>(succeeded), dedupe(failures));
    }

    /**
     * Merges two outcomes.
     *
     * @param other the outcome recorded after this one
     * @return the merged outcome
     */
    public @NotNull BatchOutcome combine(@NotNull BatchOutcome other) {
        if (other.isEmpty()) return this;
        if (this.isEmpty()) return other;

        SortedSet<Integer> mergedSuccesses = new TreeSet<>(succeeded);
        mergedSuccesses.addAll(other.succeeded);

        List<BatchFailure> mergedFailures = new ArrayList<>(failures.size() + other.failures.size());
        mergedFailures.addAll(failures);
        mergedFailures.addAll(other.failures);
        return new BatchOutcome(mergedSuccesses, dedupe(mergedFailures));
    }

    private static List<BatchFailure> dedupe(List<BatchFailure> failures) {
        Set<Integer> seen = new HashSet<>();
        List<BatchFailure> result = new ArrayList<>(failures.size());
        for (BatchFailure failure : failures) {
            if (seen.add(failure.index())) result.add(failure);
        }
        return result;
    }

    public boolean isEmpty() {
        return succeeded.isEmpty() && failures.isEmpty();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * @return true if no item failed
     */
    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public @NotNull SortedSet<Integer> failedIndices() {
        SortedSet<Integer> indices = new TreeSet<>();
        for (BatchFailure failure : failures) indices.add(failure.index());
        return Collections.unmodifiableSortedSet(indices);
    }

    public @NotNull Optional<BatchFailure> lastFailure() {
        return failures.isEmpty() ? Optional.empty() : Optional.of(failures.get(failures.size() - 1));
    }

    /**
     * @return number of items that were processed, successfully or not
     */
    public int processed() {
        return succeeded.size() + failures.size();
    }
}
