package org.mitoseeker.utils;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.mitoseeker.exceptions.MitoSeekerException;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Argument checks and small iteration helpers shared across MitoSeeker.
 * The checks throw {@link IllegalArgumentException}, except {@link #validate}, which guards internal state.
 */
public final class Utils {

    private Utils() {}

    /**
     * @return {@code object}, if it is not {@code null}.
     * @throws IllegalArgumentException if {@code object} is {@code null}.
     */
    public static <T> T nonNull(final T object) {
        return nonNull(object, "Null object is not allowed here.");
    }

    /**
     * @param message exception message used when {@code object} is {@code null}.
     * @return {@code object}, if it is not {@code null}.
     * @throws IllegalArgumentException if {@code object} is {@code null}.
     */
    public static <T> T nonNull(final T object, final String message) {
        if ( object == null ) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    public static <T> T nonNull(final T object, final Supplier<String> message) {
        if ( object == null ) {
            throw new IllegalArgumentException(message.get());
        }
        return object;
    }

    /**
     * @return {@code collection}, if it is neither {@code null} nor empty.
     * @throws IllegalArgumentException otherwise, with {@code message} in the exception message.
     */
    public static <I, T extends Collection<I>> T nonEmpty(final T collection, final String message) {
        nonNull(collection, "Collection is null: " + message);
        validateArg(!collection.isEmpty(), () -> "Collection is empty: " + message);
        return collection;
    }

    /**
     * @return {@code string}, if it is neither {@code null} nor empty.
     * @throws IllegalArgumentException otherwise, with {@code message} in the exception message.
     */
    public static String nonEmpty(final String string, final String message) {
        nonNull(string, "String is null: " + message);
        validateArg(!string.isEmpty(), () -> "String is empty: " + message);
        return string;
    }

    /**
     * @throws IllegalArgumentException if {@code collection} is {@code null} or holds a {@code null} element.
     */
    public static void containsNoNull(final Collection<?> collection, final String message) {
        nonNull(collection, message);
        // Collection.contains(null) may itself throw for some Set implementations
        for ( final Object element : collection ) {
            if ( element == null ) {
                throw new IllegalArgumentException(message);
            }
        }
    }

    public static void validateArg(final boolean condition, final String message) {
        if ( !condition ) {
            throw new IllegalArgumentException(message);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> message) {
        if ( !condition ) {
            throw new IllegalArgumentException(message.get());
        }
    }

    /**
     * Checks a condition that holds unless MitoSeeker itself is broken.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void validate(final boolean condition, final Supplier<String> message) {
        if ( !condition ) {
            throw new IllegalStateException(message.get());
        }
    }

    /**
     * Maps {@code function} over {@code fromIterator} on {@code numThreads} worker threads, yielding results in input
     * order.  At most {@code numThreads} inputs are in flight at once.
     * <p>
     * With one thread this is Guava's {@link Iterators#transform}.  Otherwise the pool is shut down when the output is
     * exhausted or a task fails; a task's {@link RuntimeException} is rethrown as is.  Workers are daemon threads,
     * so abandoning the output iterator early does not keep the JVM alive.
     * </p>
     */
    public static <F, T> Iterator<T> transformParallel(final Iterator<F> fromIterator, final Function<F, T> function, final int numThreads) {
        nonNull(fromIterator, "fromIterator");
        nonNull(function, "function");
        validateArg(numThreads >= 1, "numThreads must be at least 1");

        if ( numThreads == 1 ) {
            return Iterators.transform(fromIterator, function::apply);
        }

        final ExecutorService pool = Executors.newFixedThreadPool(numThreads,
                new ThreadFactoryBuilder().setNameFormat("mitoseeker-worker-%d").setDaemon(true).build());
        final Deque<Future<T>> inFlight = new ArrayDeque<>(numThreads);

        return new AbstractIterator<T>() {
            @Override
            protected T computeNext() {
                while ( inFlight.size() < numThreads && fromIterator.hasNext() ) {
                    final F input = fromIterator.next();
                    inFlight.addLast(pool.submit(() -> function.apply(input)));
                }
                if ( inFlight.isEmpty() ) {
                    pool.shutdown();
                    return endOfData();
                }
                return await(inFlight.removeFirst());
            }

            private T await(final Future<T> future) {
                try {
                    return future.get();
                }
                catch ( final InterruptedException e ) {
                    pool.shutdownNow();
                    Thread.currentThread().interrupt();
                    throw new MitoSeekerException("Interrupted while waiting for a parallel task", e);
                }
                catch ( final ExecutionException e ) {
                    pool.shutdownNow();
                    if ( e.getCause() instanceof RuntimeException ) {
                        throw (RuntimeException) e.getCause();
                    }
                    throw new MitoSeekerException("Parallel task failed", e.getCause());
                }
            }
        };
    }
}
