package org.chunksieve.scheduler;

import java.math.BigInteger;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;

import org.chunksieve.engine.EngineEvent;
import org.chunksieve.engine.EngineException;
import org.chunksieve.engine.ExecutionFailedException;
import org.chunksieve.engine.ExecutorAdapter;
import org.chunksieve.engine.LineStream;
import org.chunksieve.engine.TimedOutException;
import org.chunksieve.isa.Program;
import org.chunksieve.program.ProgramBuilder;
import org.chunksieve.program.SearchBlock;
import org.chunksieve.result.Candidate;
import org.chunksieve.result.FactorPair;
import org.chunksieve.result.ParseEmptyException;
import org.chunksieve.result.ResultParser;
import org.chunksieve.result.Verifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Searches one {@link SearchBlock}: builds its program, runs it on the engine, parses the
 * output as it streams in and verifies every candidate.
 * <p>
 * Failures never escape {@link #call()}; they are converted into a {@link WorkerOutcome}
 * so a broken engine run cannot abort its siblings. The first verified factor is handed
 * to the {@link FactorListener} immediately, without waiting for the engine to exit.
 * <p>
 * {@link #cancel()} may be called from any thread. It kills the engine run in progress
 * (or prevents it from starting) and does not wait for the task to finish.
 */
public class WorkerTask implements Callable<WorkerOutcome> {

    private static final Logger log = LoggerFactory.getLogger(WorkerTask.class);

    /**
     * Receives verified factors as soon as a worker finds them.
     */
    @FunctionalInterface
    public interface FactorListener {

        /**
         * @param source the reporting worker
         * @param pair   the verified factorization
         * @return {@code true} if the report was accepted as the search result
         */
        boolean onVerified(WorkerTask source, FactorPair pair);
    }

    private final int workerId;
    private final SearchBlock block;
    private final BigInteger modulus;
    private final SearchSettings settings;
    private final ProgramBuilder builder;
    private final ExecutorAdapter adapter;
    private final FactorListener listener;

    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.IDLE);
    private volatile boolean cancelled;
    private volatile LineStream stream;
    private volatile WorkerOutcome outcome;

    public WorkerTask(int workerId, SearchBlock block, BigInteger modulus, SearchSettings settings,
                      ProgramBuilder builder, ExecutorAdapter adapter, FactorListener listener) {
        this.workerId = workerId;
        this.block = block;
        this.modulus = modulus;
        this.settings = settings;
        this.builder = builder;
        this.adapter = adapter;
        this.listener = listener;
    }

    public int getWorkerId() {
        return workerId;
    }

    public SearchBlock getBlock() {
        return block;
    }

    public WorkerState getState() {
        return state.get();
    }

    /**
     * @return the terminal outcome, or empty while the task has not finished
     */
    public Optional<WorkerOutcome> getOutcome() {
        return Optional.ofNullable(outcome);
    }

    /**
     * Marks the task as handed to the pool.
     *
     * @throws IllegalStateException if the task was already dispatched
     */
    public void markDispatched() {
        if (!state.compareAndSet(WorkerState.IDLE, WorkerState.DISPATCHED)) {
            throw new IllegalStateException(String.format(
                    "Cannot dispatch worker %d as it is in state %s", workerId, state.get()));
        }
    }

    /**
     * Stops the task. A queued task will not launch its engine; a running one has its
     * engine terminated.
     */
    public void cancel() {
        cancelled = true;
        LineStream current = stream;
        if (current != null) {
            current.cancel();
        }
    }

    @Override
    public WorkerOutcome call() {
        if (!state.compareAndSet(WorkerState.DISPATCHED, WorkerState.RUNNING)) {
            throw new IllegalStateException(String.format(
                    "Cannot run worker %d as it is in state %s", workerId, state.get()));
        }
        if (cancelled) {
            return finish(WorkerOutcome.failed(workerId, block, "cancelled before start"));
        }

        try {
            Program program = builder.build(modulus, settings.chunkDepth(), block, settings.iterations());
            if (cancelled) {
                return finish(WorkerOutcome.failed(workerId, block, "cancelled before start"));
            }
            log.debug("Worker {} starting engine for {} ({} instructions)", workerId, block, program.size());
            return finish(execute(program));
        } catch (TimedOutException e) {
            log.warn("Worker {} timed out on {}: {}", workerId, block, e.getMessage());
            return finish(WorkerOutcome.timedOut(workerId, block, e.getMessage()));
        } catch (EngineException e) {
            log.warn("Worker {} failed on {}: {}", workerId, block, e.getMessage());
            return finish(WorkerOutcome.failed(workerId, block, e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Worker {} interrupted on {}", workerId, block);
            return finish(WorkerOutcome.failed(workerId, block, "interrupted"));
        } catch (RuntimeException e) {
            log.warn("Worker {} could not search {}: {}", workerId, block, e.getMessage());
            log.debug("Worker {} failure details", workerId, e);
            return finish(WorkerOutcome.failed(workerId, block, e.getMessage()));
        }
    }

    private WorkerOutcome execute(Program program) throws EngineException, InterruptedException {
        try (LineStream run = adapter.run(program, settings.workerTimeout())) {
            stream = run;
            if (cancelled) {
                // cancel() raced with the launch and missed the stream
                run.cancel();
            }

            ResultParser parser = new ResultParser(block, settings.chunkStates());
            while (true) {
                EngineEvent event = run.next();
                if (event instanceof EngineEvent.Line line) {
                    log.debug("[worker-{}] {}", workerId, line.text());
                    Optional<FactorPair> verified = verifyLine(parser, line.text());
                    if (verified.isPresent()) {
                        return report(verified.get());
                    }
                } else if (event instanceof EngineEvent.Exited exited) {
                    return onExit(exited.exitCode(), parser);
                }
            }
        } finally {
            stream = null;
        }
    }

    private Optional<FactorPair> verifyLine(ResultParser parser, String line) {
        for (Candidate candidate : parser.accept(line)) {
            Optional<FactorPair> pair = Verifier.verify(modulus, candidate.value());
            if (pair.isPresent()) {
                return pair;
            }
            log.trace("Worker {} rejected candidate {}", workerId, candidate.value());
        }
        return Optional.empty();
    }

    private WorkerOutcome report(FactorPair pair) {
        if (listener.onVerified(this, pair)) {
            log.info("Worker {} found {} in {}", workerId, pair, block);
        } else {
            log.debug("Worker {} found {} after the search was decided, discarding", workerId, pair);
        }
        return WorkerOutcome.succeeded(workerId, block, pair);
    }

    private WorkerOutcome onExit(int exitCode, ResultParser parser) throws EngineException {
        if (cancelled) {
            return WorkerOutcome.failed(workerId, block, "cancelled");
        }
        if (parser.recognizedLines() == 0) {
            if (exitCode != 0) {
                throw new ExecutionFailedException(exitCode);
            }
            throw new ParseEmptyException(parser.linesRead());
        }
        String reason = exitCode == 0
                ? "no verified factor among " + parser.recognizedLines() + " reports"
                : "engine exited with code " + exitCode + " after " + parser.recognizedLines()
                        + " reports without a verified factor";
        log.debug("Worker {} exhausted {}: {}", workerId, block, reason);
        return WorkerOutcome.failed(workerId, block, reason);
    }

    private WorkerOutcome finish(WorkerOutcome result) {
        outcome = result;
        state.set(result.state());
        return result;
    }
}
