package com.mathide.llm;

import com.mathide.exception.CompletionException;
import com.mathide.exception.CompletionException.FailureKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RetryingLLMClientTest {

    /** Transport answering from a queue; each entry is a reply or a failure. */
    private static class QueueTransport implements CompletionTransport {
        final Deque<Object> outcomes = new ArrayDeque<>();
        int calls;

        QueueTransport then(Object outcome) {
            outcomes.addLast(outcome);
            return this;
        }

        @Override
        public CompletionResponse send(CompletionRequest request) {
            calls++;
            Object next = outcomes.removeFirst();
            if (next instanceof CompletionException e) throw e;
            return new CompletionResponse((String) next, null, "test-model", null);
        }
    }

    private final List<Long> sleeps = new ArrayList<>();

    private RetryingLLMClient client(QueueTransport transport, int maxAttempts) {
        return new RetryingLLMClient(transport, maxAttempts, 100, sleeps::add, new Random(42));
    }

    private static CompletionRequest request() {
        return CompletionRequest.of(ModelRole.GENERATOR, "system", "user");
    }

    @Test
    void testTransientFailureIsRetried() {
        QueueTransport transport = new QueueTransport()
                .then(new CompletionException(FailureKind.RATE_LIMITED, "429"))
                .then(new CompletionException(FailureKind.CONNECTION, "timeout"))
                .then("[]");

        CompletionResponse response = client(transport, 3).complete(request());

        assertEquals("[]", response.getContent());
        assertEquals("stop", response.getFinishReason());
        assertEquals(3, transport.calls);
        assertEquals(2, sleeps.size());
        assertTrue(sleeps.get(0) >= 100 && sleeps.get(0) <= 200);
        assertTrue(sleeps.get(1) >= 200 && sleeps.get(1) <= 300);
    }

    @Test
    void testNonTransientFailureIsNotRetried() {
        QueueTransport transport = new QueueTransport()
                .then(new CompletionException(FailureKind.OTHER, "401"));

        CompletionException e = assertThrows(CompletionException.class,
                () -> client(transport, 3).complete(request()));

        assertEquals(FailureKind.OTHER, e.getKind());
        assertEquals(1, transport.calls);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testRetriesStopAtMaxAttempts() {
        QueueTransport transport = new QueueTransport();
        for (int i = 0; i < 5; i++) {
            transport.then(new CompletionException(FailureKind.CONNECTION, "down"));
        }

        CompletionException e = assertThrows(CompletionException.class,
                () -> client(transport, 3).complete(request()));

        assertEquals(FailureKind.CONNECTION, e.getKind());
        assertEquals(3, transport.calls);
        assertEquals(2, sleeps.size());
    }

    @Test
    void testBlankContentIsInvalidResponse() {
        QueueTransport transport = new QueueTransport().then("   ").then("never reached");

        CompletionException e = assertThrows(CompletionException.class,
                () -> client(transport, 3).complete(request()));

        assertEquals(FailureKind.INVALID_RESPONSE, e.getKind());
        assertEquals(1, transport.calls);
    }

    @Test
    void testBackoffGrowsExponentiallyWithBoundedJitter() {
        RetryingLLMClient retrying = client(new QueueTransport(), 5);

        for (int attempt = 1; attempt <= 4; attempt++) {
            long base = 100L << (attempt - 1);
            long backoff = retrying.computeBackoff(attempt);
            assertTrue(backoff >= base && backoff <= base + 100,
                    "attempt " + attempt + " backoff " + backoff);
        }
    }

    @Test
    void testZeroBaseMeansNoPause() {
        RetryingLLMClient retrying = new RetryingLLMClient(
                new QueueTransport(), 3, 0, sleeps::add, new Random(1));

        assertEquals(0, retrying.computeBackoff(1));
        assertEquals(0, retrying.computeBackoff(3));
    }

    @Test
    void testInterruptedBackoffSurfacesAsCompletionFailure() {
        QueueTransport transport = new QueueTransport()
                .then(new CompletionException(FailureKind.RATE_LIMITED, "429"))
                .then("never reached");
        RetryingLLMClient retrying = new RetryingLLMClient(transport, 3, 10,
                millis -> { throw new InterruptedException(); }, new Random(3));

        CompletionException e = assertThrows(CompletionException.class, () -> retrying.complete(request()));

        assertEquals(FailureKind.RATE_LIMITED, e.getKind());
        assertTrue(Thread.interrupted());
    }

    @Test
    void testRejectsNonPositiveAttempts() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryingLLMClient(new QueueTransport(), 0, 10, sleeps::add, new Random()));
    }
}
