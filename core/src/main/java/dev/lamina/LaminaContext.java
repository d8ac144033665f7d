/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import dev.lamina.internal.compression.CodecFactory;

/**
 * Context object that manages shared resources for reading and writing row groups.
 * <p>
 * Holds the thread pool on which the column chunks of a row group are encoded and decoded
 * in parallel, and the codec factory. The context is owned, and closed, by whoever created it;
 * readers and writers borrow it.
 * </p>
 */
public final class LaminaContext implements AutoCloseable {

    private static final String THREADS_PROPERTY = "lamina.threads";

    private static final System.Logger LOG = System.getLogger(LaminaContext.class.getName());

    private final ExecutorService executor;
    private final CodecFactory codecFactory;

    private LaminaContext(ExecutorService executor) {
        this.executor = executor;
        this.codecFactory = new CodecFactory();
    }

    /**
     * Create a new context with a thread pool sized to available processors, unless
     * the {@code lamina.threads} system property says otherwise.
     */
    public static LaminaContext create() {
        return create(defaultThreadCount());
    }

    /**
     * Create a new context with a thread pool of the specified size.
     */
    public static LaminaContext create(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "lamina-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory);
        LOG.log(System.Logger.Level.DEBUG, "Created context with {0} threads", threads);
        return new LaminaContext(executor);
    }

    private static int defaultThreadCount() {
        String configured = System.getProperty(THREADS_PROPERTY);
        if (configured != null) {
            try {
                return Integer.parseInt(configured.trim());
            }
            catch (NumberFormatException e) {
                LOG.log(System.Logger.Level.WARNING, "Ignoring invalid value of {0}: {1}", THREADS_PROPERTY, configured);
            }
        }
        return Runtime.getRuntime().availableProcessors();
    }

    /**
     * Get the executor service for parallel operations.
     */
    public ExecutorService executor() {
        return executor;
    }

    /**
     * Get the codec factory.
     */
    public CodecFactory codecFactory() {
        return codecFactory;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
