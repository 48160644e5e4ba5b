package io.github.flameyossnowy.docstore.mongodb;

import org.jetbrains.annotations.NotNull;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Bridges a driver {@link Publisher} to a {@link CompletableFuture} holding its first element.
 * <p>
 * The future is settled exactly once: with the first element, with the error, or, when the
 * publisher completes without emitting anything, with the error from {@code onEmpty}.
 * Signals arriving after that are ignored.
 *
 * @param <T> the element type
 */
public final class SingleResultSubscriber<T> implements Subscriber<T> {
    private final CompletableFuture<T> future = new CompletableFuture<>();
    private final Supplier<? extends Throwable> onEmpty;
    private final AtomicBoolean settled = new AtomicBoolean();
    private volatile Subscription subscription;

    public SingleResultSubscriber(@NotNull Supplier<? extends Throwable> onEmpty) {
        this.onEmpty = Objects.requireNonNull(onEmpty, "onEmpty");
    }

    /**
     * Subscribes to {@code publisher} and returns the future of its first element.
     *
     * @param publisher the driver publisher
     * @param onEmpty produces the error used when nothing is emitted
     * @return the future
     */
    public static <T> @NotNull CompletableFuture<T> first(@NotNull Publisher<T> publisher,
                                                          @NotNull Supplier<? extends Throwable> onEmpty) {
        SingleResultSubscriber<T> subscriber = new SingleResultSubscriber<>(onEmpty);
        try {
            publisher.subscribe(subscriber);
        } catch (RuntimeException e) {
            subscriber.onError(e);
        }
        return subscriber.future;
    }

    public @NotNull CompletableFuture<T> getFuture() {
        return future;
    }

    @Override
    public void onSubscribe(Subscription subscription) {
        if (this.subscription != null || settled.get()) {
            subscription.cancel();
            return;
        }
        this.subscription = subscription;
        subscription.request(1);
    }

    @Override
    public void onNext(T item) {
        if (!settled.compareAndSet(false, true)) return;
        Subscription current = subscription;
        if (current != null) current.cancel();
        future.complete(item);
    }

    @Override
    public void onError(Throwable throwable) {
        if (settled.compareAndSet(false, true)) future.completeExceptionally(throwable);
    }

    @Override
    public void onComplete() {
        if (settled.compareAndSet(false, true)) future.completeExceptionally(onEmpty.get());
    }
}
