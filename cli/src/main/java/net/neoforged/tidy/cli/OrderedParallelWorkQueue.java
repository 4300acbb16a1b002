package net.neoforged.tidy.cli;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs work in parallel, but hands the results to the consumer in the order the work was submitted.
 * <p>
 * Not thread-safe: work must be submitted from a single thread, which is also the thread the consumer is called on.
 */
class OrderedParallelWorkQueue<T> implements AutoCloseable {
    private final Deque<Future<T>> pending;
    private final Consumer<T> consumer;
    private final int maxQueueDepth;

    public OrderedParallelWorkQueue(Consumer<T> consumer, int maxQueueDepth) {
        this.consumer = consumer;
        this.maxQueueDepth = maxQueueDepth;
        if (maxQueueDepth < 0) {
            throw new IllegalArgumentException("Max queue depth must not be negative");
        }
        this.pending = new ArrayDeque<>(maxQueueDepth);
    }

    public void submit(Supplier<T> producer) {
        if (maxQueueDepth <= 0) {
            // Forced into synchronous mode
            consumer.accept(producer.get());
            return;
        }
        try {
            drainTo(maxQueueDepth - 1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        pending.add(CompletableFuture.supplyAsync(producer));
    }

    private void drainTo(int drainTo) throws InterruptedException {
        while (pending.size() > drainTo) {
            T result;
            try {
                result = pending.removeFirst().get();
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException re) {
                    throw re;
                }
                throw new RuntimeException(e.getCause());
            }
            consumer.accept(result);
        }
    }

    @Override
    public void close() {
        try {
            drainTo(0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
