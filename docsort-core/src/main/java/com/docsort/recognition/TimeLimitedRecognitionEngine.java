package com.docsort.recognition;

import com.docsort.model.ImageVariant;

import java.io.Closeable;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds each recognition call by a timeout. A call that runs over is
 * cancelled and reported as a {@link RecognitionException}, the same as an
 * engine failure.
 *
 * <p>Calls run on a fixed number of worker threads. A native Tesseract call
 * ignores interruption, so a timed-out call keeps its worker until it returns;
 * the time a call spends queued behind such a worker counts toward its own
 * timeout.</p>
 */
public class TimeLimitedRecognitionEngine implements RecognitionEngine, Closeable {

    public static final int DEFAULT_MAX_THREADS = Runtime.getRuntime().availableProcessors();

    private final RecognitionEngine delegate;
    private final Duration timeout;
    private final RecognitionThreadFactory threadFactory = new RecognitionThreadFactory();
    private final ExecutorService executor;

    public TimeLimitedRecognitionEngine(RecognitionEngine delegate, Duration timeout) {
        this(delegate, timeout, DEFAULT_MAX_THREADS);
    }

    public TimeLimitedRecognitionEngine(RecognitionEngine delegate, Duration timeout, int maxThreads) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (maxThreads <= 0) {
            throw new IllegalArgumentException("maxThreads must be positive: " + maxThreads);
        }
        this.executor = Executors.newFixedThreadPool(maxThreads, threadFactory);
    }

    @Override
    public String recognize(ImageVariant variant) throws RecognitionException {
        Future<String> future = executor.submit(() -> delegate.recognize(variant));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RecognitionException("Recognition timed out after %d ms on %s".formatted(
                    timeout.toMillis(), variant.describe()), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RecognitionException re) throw re;
            throw new RecognitionException("Recognition failed on " + variant.describe(), cause);
        } catch (CancellationException e) {
            throw new RecognitionException("Recognition cancelled on " + variant.describe(), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RecognitionException("Interrupted while waiting for recognition", e);
        }
    }

    /** Worker threads created so far. */
    int threadsStarted() {
        return threadFactory.counter.get();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static final class RecognitionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "recognition-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
