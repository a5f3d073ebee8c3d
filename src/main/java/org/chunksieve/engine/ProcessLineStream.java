package org.chunksieve.engine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LineStream} over a live engine process.
 * <p>
 * A daemon reader thread drains the process output into a queue of
 * {@link EngineEvent}s and appends {@link EngineEvent.Exited} once the output is closed
 * and the process has terminated. The consumer never touches the process streams.
 */
final class ProcessLineStream implements LineStream {

    private static final Logger log = LoggerFactory.getLogger(ProcessLineStream.class);

    private final Process process;
    private final Path programFile;
    private final Duration timeout;
    private final Duration gracePeriod;
    private final long deadlineNanos;
    private final BlockingQueue<EngineEvent> events = new LinkedBlockingQueue<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private boolean exhausted;

    ProcessLineStream(Process process, Path programFile, Duration timeout, Duration gracePeriod) {
        this.process = process;
        this.programFile = programFile;
        this.timeout = timeout;
        this.gracePeriod = gracePeriod;
        this.deadlineNanos = System.nanoTime() + timeout.toNanos();

        Thread reader = new Thread(this::pump, "engine-reader-" + process.pid());
        reader.setDaemon(true);
        reader.start();
    }

    private void pump() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                events.add(new EngineEvent.Line(line));
            }
        } catch (IOException e) {
            // Stream closed underneath us by a kill; the exit event still follows
            log.debug("Engine pid={} output closed: {}", process.pid(), e.getMessage());
        }

        try {
            events.add(new EngineEvent.Exited(process.waitFor()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Reader of engine pid={} interrupted before exit", process.pid());
        }
    }

    @Override
    public EngineEvent next() throws TimedOutException, InterruptedException {
        if (exhausted) {
            throw new IllegalStateException("Engine stream already reached its exit event");
        }
        long remaining = deadlineNanos - System.nanoTime();
        EngineEvent event = remaining > 0
                ? events.poll(remaining, TimeUnit.NANOSECONDS)
                : events.poll();
        if (event == null) {
            log.warn("Engine pid={} exceeded {} ms, destroying it", process.pid(), timeout.toMillis());
            process.destroyForcibly();
            throw new TimedOutException(timeout);
        }
        if (event instanceof EngineEvent.Exited) {
            exhausted = true;
        }
        return event;
    }

    @Override
    public void cancel() {
        if (!cancelled.compareAndSet(false, true) || !process.isAlive()) {
            return;
        }
        process.destroy();
        process.onExit()
                .orTimeout(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((p, error) -> {
                    if (error != null) {
                        log.warn("Engine pid={} ignored termination for {} ms, killing it",
                                process.pid(), gracePeriod.toMillis());
                        process.destroyForcibly();
                    }
                });
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (process.isAlive()) {
            process.destroyForcibly();
        }
        ProcessExecutorAdapter.deleteProgramFile(programFile);
    }
}
