package io.rulegate.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for transport work: virtual threads where the runtime has them, daemon platform
 * threads otherwise.
 */
public final class VirtualThreads {
    private static final Logger log = LoggerFactory.getLogger(VirtualThreads.class);

    private VirtualThreads() {
    }

    public static ExecutorService newExecutor(String namePrefix) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        try {
            Method method = Executors.class.getMethod("newVirtualThreadPerTaskExecutor");
            return (ExecutorService) method.invoke(null);
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.debug("Virtual threads unavailable, using a cached pool for {}", namePrefix);
            return Executors.newCachedThreadPool(new NamedThreadFactory(namePrefix));
        }
    }

    /**
     * Single daemon thread for periodic tasks.
     */
    public static ScheduledExecutorService newScheduler(String name) {
        Objects.requireNonNull(name, "name");
        return Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory(name));
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
