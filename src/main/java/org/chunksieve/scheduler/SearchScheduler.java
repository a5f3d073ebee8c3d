package org.chunksieve.scheduler;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.chunksieve.engine.ExecutorAdapter;
import org.chunksieve.engine.ProcessExecutorAdapter;
import org.chunksieve.program.ProgramBuilder;
import org.chunksieve.program.SearchBlock;
import org.chunksieve.result.FactorPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a divisor search across a bounded pool of workers.
 * <p>
 * <b>Protocol:</b>
 * <ol>
 *   <li>The search interval is partitioned into disjoint blocks ({@link Partitioner}).</li>
 *   <li>Each block becomes a {@link WorkerTask}; at most {@code workers} run at a time.</li>
 *   <li>A worker that verifies a factor offers it to a single-assignment {@link ResultSlot}.
 *       The first offer wins and fires the pool-wide cancellation exactly once: every other
 *       worker's engine is terminated and queued workers never launch theirs.</li>
 *   <li>Later offers are discarded. Failed or timed-out workers never cancel anybody.</li>
 * </ol>
 * Workers never address the same chunk because blocks are disjoint, so the engines need
 * no coordination beyond the result slot.
 * <p>
 * A scheduler instance holds no per-search state and may run several searches in sequence.
 */
public class SearchScheduler {

    private static final Logger log = LoggerFactory.getLogger(SearchScheduler.class);

    private static final long POOL_DRAIN_MILLIS = 1000;

    private final SearchSettings settings;
    private final ProgramBuilder builder;
    private final ExecutorAdapter adapter;

    public SearchScheduler(SearchSettings settings, ProgramBuilder builder, ExecutorAdapter adapter) {
        this.settings = settings;
        this.builder = builder;
        this.adapter = adapter;
    }

    /**
     * Creates a scheduler that launches the configured engine as a local process.
     */
    public static SearchScheduler create(SearchSettings settings) {
        return new SearchScheduler(
                settings,
                new ProgramBuilder(settings.limits(), settings.registers(), settings.importWeights()),
                new ProcessExecutorAdapter(settings.engineCommand(), settings.workDirectory(),
                        settings.cancelGracePeriod()));
    }

    public SearchSettings getSettings() {
        return settings;
    }

    /**
     * Partitions the search interval of {@code modulus} for this scheduler's settings.
     */
    public List<SearchBlock> partition(BigInteger modulus) {
        return Partitioner.partition(modulus, settings.chunkDepth(), settings.workers(), settings.limits());
    }

    /**
     * Searches for a non-trivial factor of {@code modulus}.
     *
     * @param modulus the integer to factor (at least 2)
     * @return the verified factorization, or a "not found" result when every worker finished without one
     * @throws InterruptedException if the calling thread is interrupted; all engines are terminated first
     */
    public SearchResult search(BigInteger modulus) throws InterruptedException {
        List<SearchBlock> blocks = partition(modulus);
        ResultSlot slot = new ResultSlot();
        AtomicBoolean cancellationFired = new AtomicBoolean(false);
        List<WorkerTask> tasks = new ArrayList<>(blocks.size());

        WorkerTask.FactorListener listener = (source, pair) -> {
            if (!slot.offer(pair)) {
                return false;
            }
            if (cancellationFired.compareAndSet(false, true)) {
                cancelSiblings(tasks, source);
            }
            return true;
        };
        for (int i = 0; i < blocks.size(); i++) {
            tasks.add(new WorkerTask(i, blocks.get(i), modulus, settings, builder, adapter, listener));
        }

        int poolSize = Math.min(settings.workers(), tasks.size());
        log.info("Searching {} ({} bits): {} blocks of up to {} chunks x {} states, {} workers, {} iterations",
                modulus, modulus.bitLength(), blocks.size(), blocks.get(0).activeChunks(),
                settings.chunkStates(), poolSize, settings.iterations());

        ExecutorService pool = Executors.newFixedThreadPool(poolSize, workerThreadFactory());
        boolean timedOut = false;
        try {
            tasks.forEach(WorkerTask::markDispatched);
            List<Future<WorkerOutcome>> futures = settings.searchTimeout() == null
                    ? pool.invokeAll(tasks)
                    : pool.invokeAll(tasks, settings.searchTimeout().toMillis(), TimeUnit.MILLISECONDS);
            for (Future<WorkerOutcome> future : futures) {
                if (future.isCancelled()) {
                    timedOut = true;
                }
            }
        } finally {
            // Reached with unfinished tasks only after a search timeout or an interrupt
            for (WorkerTask task : tasks) {
                if (task.getOutcome().isEmpty()) {
                    task.cancel();
                }
            }
            pool.shutdownNow();
            if (!pool.awaitTermination(POOL_DRAIN_MILLIS, TimeUnit.MILLISECONDS)) {
                log.warn("Worker pool did not drain within {} ms", POOL_DRAIN_MILLIS);
            }
        }

        if (timedOut) {
            log.warn("Search of {} exceeded its timeout of {} ms", modulus, settings.searchTimeout().toMillis());
        }
        String missingReason = timedOut ? "search timed out" : "not run";
        List<WorkerOutcome> outcomes = new ArrayList<>(tasks.size());
        for (WorkerTask task : tasks) {
            outcomes.add(task.getOutcome()
                    .orElseGet(() -> WorkerOutcome.failed(task.getWorkerId(), task.getBlock(), missingReason)));
        }

        Optional<FactorPair> winner = slot.get();
        if (winner.isPresent()) {
            log.info("Factor found: {} = {}", modulus, winner.get());
            return SearchResult.found(modulus, winner.get(), outcomes);
        }
        SearchResult result = SearchResult.notFound(modulus, outcomes, timedOut);
        log.info("No factor of {} found: {} blocks failed, {} timed out", modulus,
                result.count(WorkerState.FAILED), result.count(WorkerState.TIMED_OUT));
        return result;
    }

    private static void cancelSiblings(List<WorkerTask> tasks, WorkerTask winner) {
        int cancelled = 0;
        for (WorkerTask task : tasks) {
            if (task != winner && !task.getState().isTerminal()) {
                task.cancel();
                cancelled++;
            }
        }
        log.debug("Worker {} won, cancelled {} sibling workers", winner.getWorkerId(), cancelled);
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "search-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
