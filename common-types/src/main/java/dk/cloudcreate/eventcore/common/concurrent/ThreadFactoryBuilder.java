package dk.cloudcreate.eventcore.common.concurrent;

import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builder for a {@link ThreadFactory} that names its threads using a format such as <code>"OutboxRelay-%d"</code>
 * where <code>%d</code> is replaced by a running thread number
 */
public final class ThreadFactoryBuilder {
    private String                          nameFormat;
    private boolean                         daemon;
    private Thread.UncaughtExceptionHandler uncaughtExceptionHandler;

    public static ThreadFactoryBuilder builder() {
        return new ThreadFactoryBuilder();
    }

    public ThreadFactoryBuilder nameFormat(String nameFormat) {
        this.nameFormat = Objects.requireNonNull(nameFormat, "No nameFormat provided");
        return this;
    }

    public ThreadFactoryBuilder daemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }

    public ThreadFactoryBuilder uncaughtExceptionHandler(Thread.UncaughtExceptionHandler uncaughtExceptionHandler) {
        this.uncaughtExceptionHandler = uncaughtExceptionHandler;
        return this;
    }

    public ThreadFactory build() {
        Objects.requireNonNull(nameFormat, "No nameFormat provided");
        var format                  = nameFormat;
        var isDaemon                = daemon;
        var exceptionHandler        = uncaughtExceptionHandler;
        var threadNumber            = new AtomicLong();
        var backingThreadFactory    = Executors.defaultThreadFactory();
        return runnable -> {
            var thread = backingThreadFactory.newThread(runnable);
            thread.setName(String.format(format, threadNumber.incrementAndGet()));
            thread.setDaemon(isDaemon);
            if (exceptionHandler != null) {
                thread.setUncaughtExceptionHandler(exceptionHandler);
            }
            return thread;
        };
    }
}
