package dev.aparikh.semanticmail.sync;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pool that hands the submitting thread's MDC to the task, so worker log lines carry
 * the same {@code userId} and {@code runId}.
 */
public class MdcTaskExecutor implements Executor, AutoCloseable {

    private final ExecutorService delegate;

    private MdcTaskExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    /** Bounded pool for CPU-side work such as classification and chunking. */
    public static MdcTaskExecutor fixed(String namePrefix, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1");
        }
        return new MdcTaskExecutor(Executors.newFixedThreadPool(threads, threadFactory(namePrefix)));
    }

    /** Unbounded pool for blocking I/O calls that are awaited with a timeout. */
    public static MdcTaskExecutor cached(String namePrefix) {
        return new MdcTaskExecutor(Executors.newCachedThreadPool(threadFactory(namePrefix)));
    }

    @Override
    public void execute(Runnable command) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        delegate.execute(() -> {
            restore(parentMdc);
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    public <T> Future<T> submit(Callable<T> task) {
        return delegate.submit(wrap(task));
    }

    @Override
    public void close() {
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(10, TimeUnit.SECONDS)) {
                delegate.shutdownNow();
            }
        } catch (InterruptedException e) {
            delegate.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static <T> Callable<T> wrap(Callable<T> task) {
        // Capture MDC context from the submitting thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            restore(parentMdc);
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }

    private static void restore(Map<String, String> parentMdc) {
        if (parentMdc != null) {
            MDC.setContextMap(parentMdc);
        }
    }

    private static ThreadFactory threadFactory(String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, namePrefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
