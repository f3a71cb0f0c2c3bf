package io.eventrelay.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Threads owned by an {@link EventRelayServer}: a send executor for fan-out and keepalive writes, and one
 * scheduler thread that only triggers keepalive ticks. All platform threads are daemons.
 */
final class RelayThreads {
    private static final Logger log = LoggerFactory.getLogger(RelayThreads.class);

    // Executors.newVirtualThreadPerTaskExecutor(), present from JDK 21 on
    private static final MethodHandle VIRTUAL_EXECUTOR = lookupVirtualExecutor();

    private RelayThreads() {
    }

    static ExecutorService newExecutor(String namePrefix) {
        if (VIRTUAL_EXECUTOR != null) {
            try {
                return (ExecutorService) VIRTUAL_EXECUTOR.invoke();
            } catch (Throwable t) {
                log.warn("Virtual thread executor unavailable, using platform threads: {}", t.toString());
            }
        }
        return Executors.newCachedThreadPool(daemonFactory(namePrefix));
    }

    static ScheduledExecutorService newScheduler(String namePrefix) {
        return Executors.newSingleThreadScheduledExecutor(daemonFactory(namePrefix));
    }

    private static ThreadFactory daemonFactory(String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static MethodHandle lookupVirtualExecutor() {
        try {
            return MethodHandles.publicLookup().findStatic(Executors.class, "newVirtualThreadPerTaskExecutor",
                    MethodType.methodType(ExecutorService.class));
        } catch (NoSuchMethodException | IllegalAccessException e) {
            log.debug("Runtime has no virtual threads, relay sends use a cached daemon pool");
            return null;
        }
    }
}
