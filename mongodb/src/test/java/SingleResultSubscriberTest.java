import io.github.flameyossnowy.docstore.api.exceptions.DocumentException;
import io.github.flameyossnowy.docstore.api.exceptions.ErrorKind;
import io.github.flameyossnowy.docstore.api.model.Key;
import io.github.flameyossnowy.docstore.mongodb.SingleResultSubscriber;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.reactivestreams.Subscription;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SingleResultSubscriberTest {
    static final Key KEY = Key.of("k");

    @Mock
    Subscription subscription;

    @Mock
    Subscription second;

    @Test
    void completesWithFirstElement() {
        CompletableFuture<String> future = SingleResultSubscriber.first(Publishers.just("value"), () -> DocumentException.notFound(KEY));

        assertEquals("value", future.join());
    }

    @Test
    void emptyCompletionUsesSuppliedError() {
        CompletableFuture<String> future = SingleResultSubscriber.first(Publishers.empty(), () -> DocumentException.notFound(KEY));

        CompletionException thrown = assertThrows(CompletionException.class, future::join);
        assertEquals(ErrorKind.NOT_FOUND, DocumentException.kindOf(thrown.getCause()));
    }

    @Test
    void errorCompletesExceptionally() {
        IllegalStateException failure = new IllegalStateException("socket closed");

        CompletableFuture<String> future = SingleResultSubscriber.first(Publishers.error(failure), () -> DocumentException.notFound(KEY));

        assertSame(failure, assertThrows(CompletionException.class, future::join).getCause());
    }

    @Test
    void requestsOneAndCancelsAfterValue() {
        SingleResultSubscriber<String> subscriber = new SingleResultSubscriber<>(() -> DocumentException.notFound(KEY));

        subscriber.onSubscribe(subscription);
        subscriber.onNext("first");

        verify(subscription).request(1);
        verify(subscription).cancel();
        assertEquals("first", subscriber.getFuture().join());
    }

    @Test
    void lateSignalsAreIgnored() {
        SingleResultSubscriber<String> subscriber = new SingleResultSubscriber<>(() -> DocumentException.notFound(KEY));

        subscriber.onSubscribe(subscription);
        subscriber.onNext("first");
        subscriber.onNext("second");
        subscriber.onError(new IllegalStateException("late"));
        subscriber.onComplete();

        assertEquals("first", subscriber.getFuture().join());
    }

    @Test
    void secondSubscriptionIsCancelled() {
        SingleResultSubscriber<String> subscriber = new SingleResultSubscriber<>(() -> DocumentException.notFound(KEY));

        subscriber.onSubscribe(subscription);
        subscriber.onSubscribe(second);

        verify(second).cancel();
        verify(second, never()).request(anyLong());
    }

    @Test
    void throwingPublisherFailsFuture() {
        CompletableFuture<String> future = SingleResultSubscriber.first(subscriber -> {
            throw new IllegalArgumentException("bad filter");
        }, () -> DocumentException.notFound(KEY));

        assertInstanceOf(IllegalArgumentException.class, assertThrows(CompletionException.class, future::join).getCause());
    }
}
