package com.di.docsync.sync;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-scoped cancellation signal. Open cursors and the download pool register a hook; cancelling runs
 * every hook once. A hook registered after cancellation runs immediately.
 */
@Slf4j
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> hooks = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            hooks.forEach(CancellationToken::runHook);
        }
    }

    /**
     * @return handle that unregisters the hook
     */
    public Runnable register(Runnable hook) {
        hooks.add(hook);
        if (cancelled.get()) {
            runHook(hook);
        }
        return () -> hooks.remove(hook);
    }

    private static void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("[SYNC] Cancellation hook failed: {}", e.getMessage());
        }
    }
}
