package com.mlld.sdk.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Reads the worker's stderr and keeps the most recent text as diagnostic context
 * for disconnect reasons. Never delivers anything to pending requests itself.
 */
final class StderrCollector implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(StderrCollector.class);

    static final int MAX_BUFFERED_CHARS = 64 * 1024;

    private final BufferedReader reader;
    @Nullable
    private final Consumer<String> listener;
    private final StringBuilder buffer = new StringBuilder();
    private final CountDownLatch finished = new CountDownLatch(1);

    StderrCollector(BufferedReader reader, @Nullable Consumer<String> listener) {
        this.reader = reader;
        this.listener = listener;
    }

    @Override
    public void run() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                append(line);
                if (listener != null) {
                    try {
                        listener.accept(line);
                    } catch (RuntimeException e) {
                        logger.warn("stderr listener failed", e);
                    }
                } else {
                    logger.debug("mlld stderr: {}", line);
                }
            }
        } catch (IOException e) {
            logger.debug("mlld stderr stream closed", e);
        } finally {
            finished.countDown();
        }
    }

    synchronized void append(String line) {
        if (buffer.length() > 0) {
            buffer.append('\n');
        }
        buffer.append(line);
        if (buffer.length() > MAX_BUFFERED_CHARS) {
            buffer.delete(0, buffer.length() - MAX_BUFFERED_CHARS);
        }
    }

    synchronized String text() {
        return buffer.toString();
    }

    /**
     * Wait for the stream to reach its end.
     *
     * @return {@code true} if the reader finished within the timeout
     */
    boolean awaitFinished(long timeout, TimeUnit unit) {
        try {
            return finished.await(timeout, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
