package com.aiBench.translationBench.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Propagates SLF4J MDC (notably {@code correlationId}) to worker threads.
 * <p>
 * MDC is thread-local; without propagation, logs written by provider calls and metric
 * evaluations running on pool threads lose the request's correlation ID.
 * <p>
 * Wrap the executor once: {@code ExecutorService withMdc = MdcPropagation.wrapExecutor(pool);}
 * and every task submitted through it carries the submitting thread's MDC.
 */
public final class MdcPropagation {

    public static final String CORRELATION_ID = "correlationId";

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that sets it for the duration
     * of the task and clears it in {@code finally}.
     *
     * @param task the task to run in the child thread
     * @return a runnable that propagates MDC then runs the task
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Returns an executor that wraps every submitted task with MDC propagation from the submitting thread.
     *
     * @param delegate the underlying executor
     * @return an executor that propagates MDC for each task
     */
    public static ExecutorService wrapExecutor(ExecutorService delegate) {
        return new MdcPropagatingExecutor(delegate);
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }

    private static final class MdcPropagatingExecutor extends AbstractExecutorService {
        private final ExecutorService delegate;

        MdcPropagatingExecutor(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrapRunnable(command));
        }

        @Override
        public void shutdown() {
            delegate.shutdown();
        }

        @Override
        public List<Runnable> shutdownNow() {
            return delegate.shutdownNow();
        }

        @Override
        public boolean isShutdown() {
            return delegate.isShutdown();
        }

        @Override
        public boolean isTerminated() {
            return delegate.isTerminated();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
