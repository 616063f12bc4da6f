package com.staticpress.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Ordered parallel map over a worker pool.
 *
 * <p>Every element is submitted as its own task; results are gathered by index, so the
 * returned list lines up with the input list whatever order the tasks complete in.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<RssItem> items = ParallelMapper.map(executor, newestPosts, this::toItem);
 * }</pre>
 */
public final class ParallelMapper {

    private ParallelMapper() {
        // Utility class
    }

    /**
     * Applies {@code function} to every element in parallel and returns the results in input order.
     *
     * <p>If any application throws, the first failure in input order is rethrown after all tasks
     * have been awaited. Unchecked exceptions propagate unchanged.
     *
     * @param executor worker pool
     * @param items input elements
     * @param function transformation, must be safe to call concurrently
     * @param <T> input type
     * @param <R> result type
     * @return results, {@code result.get(i) == function.apply(items.get(i))}
     */
    public static <T, R> List<R> map(ExecutorService executor, List<T> items, Function<? super T, ? extends R> function) {
        List<Future<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            Callable<R> task = () -> function.apply(item);
            futures.add(executor.submit(task));
        }

        List<R> results = new ArrayList<>(items.size());
        RuntimeException firstFailure = null;
        for (Future<R> future : futures) {
            try {
                results.add(future.get());
            } catch (ExecutionException e) {
                if (firstFailure == null) {
                    firstFailure = unwrap(e);
                }
                results.add(null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while waiting for parallel tasks", e);
            }
        }

        if (firstFailure != null) {
            throw firstFailure;
        }
        return results;
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException(cause);
    }
}
