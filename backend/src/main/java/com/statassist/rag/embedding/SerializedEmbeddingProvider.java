package com.statassist.rag.embedding;

import com.statassist.rag.exception.EmbeddingException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Funnels every call to a delegate through a single worker thread, for models that are
 * not safe to invoke concurrently. Callers block only on their own request; vector-store
 * work on other threads is unaffected.
 */
@Slf4j
public class SerializedEmbeddingProvider implements EmbeddingProvider, AutoCloseable {

    private final EmbeddingProvider delegate;
    private final ExecutorService worker;

    public SerializedEmbeddingProvider(EmbeddingProvider delegate) {
        this.delegate = delegate;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "embedding-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public float[] embed(String text) {
        Future<float[]> future = worker.submit(() -> delegate.embed(text));
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while waiting for embedding", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new EmbeddingException("Failed to generate embedding: " + cause.getMessage(), cause);
        }
    }

    public EmbeddingProvider getDelegate() {
        return delegate;
    }

    @Override
    public String describe() {
        return delegate.describe() + " (serialized)";
    }

    @Override
    public void close() {
        log.info("Shutting down embedding worker");
        worker.shutdownNow();
    }
}
