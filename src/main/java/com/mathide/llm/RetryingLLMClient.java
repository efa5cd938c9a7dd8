package com.mathide.llm;

import com.mathide.exception.CompletionException;
import com.mathide.exception.CompletionException.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * RetryingLLMClient - bounded-retry {@link LLMClient} over a single-attempt transport.
 *
 * RETRY POLICY:
 * - RATE_LIMITED, CONNECTION: retried, exponential backoff plus jitter
 * - INVALID_RESPONSE, OTHER:  propagated immediately
 * - at most maxAttempts attempts in total, including the first
 *
 * An empty completion is treated as INVALID_RESPONSE even if the transport let it through.
 */
@Component
public class RetryingLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(RetryingLLMClient.class);

    private static final long MAX_JITTER_MS = 250;

    /** Pause between attempts. Replaced in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final CompletionTransport transport;
    private final int                 maxAttempts;
    private final long                baseBackoffMs;
    private final Sleeper             sleeper;
    private final Random              jitterRandom;

    @Autowired
    public RetryingLLMClient(
            CompletionTransport transport,
            @Value("${mathide.llm.max-attempts:3}") int maxAttempts,
            @Value("${mathide.llm.base-backoff-ms:1000}") long baseBackoffMs
    ) {
        this(transport, maxAttempts, baseBackoffMs, Thread::sleep, new Random());
    }

    public RetryingLLMClient(
            CompletionTransport transport,
            int                 maxAttempts,
            long                baseBackoffMs,
            Sleeper             sleeper,
            Random              jitterRandom
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.transport     = transport;
        this.maxAttempts   = maxAttempts;
        this.baseBackoffMs = Math.max(0, baseBackoffMs);
        this.sleeper       = sleeper;
        this.jitterRandom  = jitterRandom;
    }

    // =========================================================================
    // LLMClient contract
    // =========================================================================

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        int attempt = 0;

        while (true) {
            attempt++;
            try {
                log.debug("[LLM] role={} attempt {}/{}", request.getRole(), attempt, maxAttempts);

                CompletionResponse response = transport.send(request);
                if (response == null || response.getContent() == null || response.getContent().isBlank()) {
                    throw new CompletionException(FailureKind.INVALID_RESPONSE, "Empty completion");
                }

                log.info("[LLM] role={} model={} finish={} tokens: {} | retries={}",
                        request.getRole(), response.getModel(), response.getFinishReason(),
                        response.getUsage(), attempt - 1);
                return response;

            } catch (CompletionException ex) {

                if (!ex.isTransient() || attempt >= maxAttempts) {
                    log.error("[LLM] Final failure | role={} kind={} attempts={}: {}",
                            request.getRole(), ex.getKind(), attempt, ex.getMessage());
                    throw ex;
                }

                long backoff = computeBackoff(attempt);
                log.warn("[LLM] {} on attempt {}. Retrying after {} ms. Cause: {}",
                        ex.getKind(), attempt, backoff, ex.getMessage());

                pause(backoff, ex);
            }
        }
    }

    // =========================================================================
    // Backoff
    // =========================================================================

    /** base * 2^(attempt-1) plus up to min(250 ms, base) of jitter. */
    long computeBackoff(int attempt) {
        long exponential = baseBackoffMs * (1L << (attempt - 1));
        long maxJitter   = Math.min(MAX_JITTER_MS, baseBackoffMs);
        long jitter      = maxJitter > 0 ? jitterRandom.nextLong(maxJitter + 1) : 0;
        return exponential + jitter;
    }

    private void pause(long millis, CompletionException pending) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CompletionException(pending.getKind(), "Interrupted while backing off", ie);
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
