package com.di.docsync.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Propagates SLF4J MDC ({@code jobId}, {@code table}) to table-worker and download threads so
 * that every line a sync run produces can be correlated.
 * <p>
 * Usage: {@code executor.submit(MdcPropagation.wrapRunnable(() -> syncTable(t)));}
 */
public final class MdcPropagation {

    public static final String JOB_ID = "jobId";
    public static final String TABLE = "table";

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that sets it for the duration of the task.
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
     * Callable flavour of {@link #wrapRunnable(Runnable)}.
     */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.call();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Supplier flavour of {@link #wrapRunnable(Runnable)}, for {@code CompletableFuture.supplyAsync}.
     */
    public static <T> Supplier<T> wrapSupplier(Supplier<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.get();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Runs the task with one extra MDC key set, restoring the previous value afterwards.
     */
    public static void runWith(String key, String value, Runnable task) {
        String previous = MDC.get(key);
        MDC.put(key, value);
        try {
            task.run();
        } finally {
            if (previous != null) {
                MDC.put(key, previous);
            } else {
                MDC.remove(key);
            }
        }
    }

    /**
     * Copy of the current thread's MDC; never null.
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
}
