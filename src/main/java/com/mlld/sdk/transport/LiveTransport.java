package com.mlld.sdk.transport;

import com.mlld.sdk.exceptions.TransportException;
import com.mlld.sdk.protocol.LiveProtocol;
import com.mlld.sdk.types.options.ClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Worker session backed by a {@code mlld live --stdio} subprocess.
 * Owns the process, its stdin writer, the pending registry and the two reader threads.
 */
public class LiveTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(LiveTransport.class);

    static final List<String> LIVE_ARGS = List.of("live", "--stdio");

    private static final long EXIT_WAIT_SECONDS = 5;
    private static final long READER_JOIN_SECONDS = 2;
    private static final long STDIN_LOCK_MILLIS = 100;

    private final Process process;
    private final BufferedWriter stdinWriter;
    private final PendingRegistry registry;
    private final ExecutorService readers;
    private final Future<?> stdoutTask;
    private final Future<?> stderrTask;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private LiveTransport(Process process, ClientOptions options, LiveProtocol protocol) {
        this.process = process;
        this.registry = new PendingRegistry();
        this.stdinWriter = new BufferedWriter(
                new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8)
        );

        BufferedReader stdoutReader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)
        );
        BufferedReader stderrReader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8)
        );

        StderrCollector stderrCollector = new StderrCollector(stderrReader, options.getStderr());
        this.readers = Executors.newFixedThreadPool(2, readerThreads(process.pid()));
        this.stderrTask = readers.submit(stderrCollector);
        this.stdoutTask = readers.submit(new ResponseReader(stdoutReader, registry, protocol, stderrCollector));
    }

    /**
     * Start the worker and its reader threads.
     *
     * @throws TransportException if the process cannot be started
     */
    public static LiveTransport spawn(ClientOptions options, LiveProtocol protocol) {
        List<String> command = buildCommand(options);
        ProcessBuilder pb = new ProcessBuilder(command);

        if (options.getWorkingDir() != null) {
            pb.directory(options.getWorkingDir().toFile());
        }
        if (options.getEnv() != null) {
            pb.environment().putAll(options.getEnv());
        }

        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        pb.redirectOutput(ProcessBuilder.Redirect.PIPE);
        pb.redirectError(ProcessBuilder.Redirect.PIPE);

        logger.debug("Starting mlld live transport: {}", String.join(" ", command));
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new TransportException("Failed to start mlld live transport: " + e.getMessage(), e);
        }

        LiveTransport transport = new LiveTransport(process, options, protocol);
        logger.debug("mlld live transport started (pid {})", process.pid());
        return transport;
    }

    /**
     * Factory spawning a new session with the given options on every call.
     */
    public static TransportFactory factory(ClientOptions options, LiveProtocol protocol) {
        return () -> spawn(options, protocol);
    }

    static List<String> buildCommand(ClientOptions options) {
        List<String> cmd = new ArrayList<>();
        cmd.add(options.getCommand());
        if (options.getCommandArgs() != null) {
            cmd.addAll(options.getCommandArgs());
        }
        cmd.addAll(LIVE_ARGS);
        return cmd;
    }

    @Override
    public ResponseChannel register(long requestId) {
        return registry.register(requestId);
    }

    @Override
    public void send(String line) {
        if (closed.get()) {
            throw new TransportException("live transport is closed");
        }
        writeLock.lock();
        try {
            stdinWriter.write(line);
            stdinWriter.write('\n');
            stdinWriter.flush();
        } catch (IOException e) {
            throw new TransportException("Failed to write to mlld stdin: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void remove(long requestId) {
        registry.remove(requestId);
    }

    @Override
    public boolean isRunning() {
        return !closed.get() && process.isAlive() && !registry.isClosed();
    }

    public long pid() {
        return process.pid();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        closeStdin();

        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(EXIT_WAIT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("mlld worker (pid {}) did not exit within {}s", process.pid(), EXIT_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        join(stdoutTask, "stdout");
        join(stderrTask, "stderr");
        readers.shutdownNow();

        int dropped = registry.disconnectAll();
        if (dropped > 0) {
            logger.debug("Disconnected {} request(s) still registered at close", dropped);
        }
        logger.debug("mlld live transport stopped (pid {})", process.pid());
    }

    private void closeStdin() {
        boolean locked = false;
        try {
            locked = writeLock.tryLock(STDIN_LOCK_MILLIS, TimeUnit.MILLISECONDS);
            if (locked) {
                stdinWriter.flush();
                stdinWriter.close();
            }
        } catch (IOException e) {
            logger.warn("Error closing mlld stdin", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (locked) {
                writeLock.unlock();
            }
        }
    }

    private void join(Future<?> task, String stream) {
        try {
            task.get(READER_JOIN_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            logger.warn("mlld {} reader did not stop within {}s", stream, READER_JOIN_SECONDS);
        } catch (ExecutionException e) {
            logger.warn("mlld {} reader failed", stream, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory readerThreads(long pid) {
        AtomicInteger count = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "mlld-live-" + pid + "-reader-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
