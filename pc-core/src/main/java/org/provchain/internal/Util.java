package org.provchain.internal;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Util {

    private static final Logger LOGGER = LoggerFactory.getLogger(Util.class);

    private Util() {
    }

    public static ListeningExecutorService newExecutor(final int numThreads,
            final String nameFormat, final boolean daemon) {
        Preconditions.checkArgument(numThreads > 0, "Invalid thread count %s", numThreads);
        final ThreadFactory factory = new ThreadFactoryBuilder().setDaemon(daemon)
                .setNameFormat(nameFormat)
                .setUncaughtExceptionHandler(new UncaughtExceptionHandler() {

                    @Override
                    public void uncaughtException(final Thread thread, final Throwable ex) {
                        LOGGER.error("Uncaught exception in thread " + thread.getName(), ex);
                    }

                }).build();
        return decorate(Executors.newFixedThreadPool(numThreads, factory));
    }

    public static ListeningExecutorService decorate(final ExecutorService executor) {
        Preconditions.checkNotNull(executor);
        if (executor instanceof ListeningExecutorService) {
            return (ListeningExecutorService) executor;
        }
        return MoreExecutors.listeningDecorator(executor);
    }

}
