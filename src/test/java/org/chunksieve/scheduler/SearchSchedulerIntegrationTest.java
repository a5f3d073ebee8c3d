package org.chunksieve.scheduler;

import java.math.BigInteger;
import java.nio.file.Path;
import java.util.List;

import org.chunksieve.result.FactorPair;
import org.chunksieve.testing.EngineCommands;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end searches against the simulated engine running as child processes.
 */
@Tag("integration")
class SearchSchedulerIntegrationTest {

    @TempDir
    Path workDir;

    @Test
    void search_findsFactorOfSmallSemiprime() throws Exception {
        SearchResult result = SearchScheduler.create(settings(EngineCommands.simulated(), 2, 2, 1))
                .search(BigInteger.valueOf(21));

        assertThat(result.isFound()).isTrue();
        assertThat(result.factor()).isIn(
                new FactorPair(BigInteger.valueOf(3), BigInteger.valueOf(7)),
                new FactorPair(BigInteger.valueOf(7), BigInteger.valueOf(3)));
    }

    @Test
    void search_findsFactorInLaterBlock() throws Exception {
        // 12 chunks over 3 workers; 101 lives in the last block
        SearchResult result = SearchScheduler.create(settings(EngineCommands.simulated(), 2, 2, 3))
                .search(BigInteger.valueOf(10403));

        assertThat(result.isFound()).isTrue();
        assertThat(result.factor()).isEqualTo(new FactorPair(BigInteger.valueOf(101), BigInteger.valueOf(103)));
        assertThat(result.outcomes()).hasSize(3);
    }

    @Test
    void search_prime_isNotFound() throws Exception {
        SearchResult result = SearchScheduler.create(settings(EngineCommands.simulated(), 2, 3, 2))
                .search(BigInteger.valueOf(10007));

        assertThat(result.isFound()).isFalse();
        assertThat(result.timedOut()).isFalse();
        assertThat(result.outcomes()).allSatisfy(o -> assertThat(o.state()).isEqualTo(WorkerState.FAILED));
    }

    @Test
    void search_insufficientIterations_isNotFound() throws Exception {
        SearchResult result = SearchScheduler.create(settings(EngineCommands.simulated(), 2, 1, 3))
                .search(BigInteger.valueOf(10403));

        assertThat(result.isFound()).isFalse();
        assertThat(result.outcomes()).extracting(WorkerOutcome::reason)
                .allSatisfy(reason -> assertThat(reason).contains("no verified factor"));
    }

    @Test
    void search_wideLimbModulus_withSingleIteration_isNotFound() throws Exception {
        // 49 bits: the STORE_HI half of the limb is non-zero and the search spans 313 chunks of depth 10
        SearchResult result = SearchScheduler.create(settings(EngineCommands.simulated(), 10, 1, 2))
                .search(new BigInteger("341550071728321"));

        assertThat(result.isFound()).isFalse();
        assertThat(result.timedOut()).isFalse();
        assertThat(result.outcomes()).hasSize(2).extracting(WorkerOutcome::reason)
                .allSatisfy(reason -> assertThat(reason).contains("no verified factor"));
    }

    @Test
    void search_wideLimbModulus_withTwoIterations_findsFactor() throws Exception {
        SearchResult result = SearchScheduler.create(settings(EngineCommands.simulated(), 10, 2, 2))
                .search(new BigInteger("341550071728321"));

        assertThat(result.isFound()).isTrue();
        assertThat(result.factor()).isEqualTo(
                new FactorPair(BigInteger.valueOf(10670053), BigInteger.valueOf(32010157)));
        assertThat(result.factor()).hasToString("10670053 x 32010157");
    }

    @Test
    void search_crashingEngine_isNotFoundWithReasons() throws Exception {
        SearchResult result = SearchScheduler.create(settings(EngineCommands.crashing(), 2, 2, 2))
                .search(BigInteger.valueOf(10403));

        assertThat(result.isFound()).isFalse();
        assertThat(result.outcomes()).extracting(WorkerOutcome::reason)
                .allSatisfy(reason -> assertThat(reason).contains("code 3"));
    }

    @Test
    void search_missingEngine_isNotFound() throws Exception {
        List<String> command = List.of(workDir.resolve("missing-engine").toString());
        SearchResult result = SearchScheduler.create(settings(command, 2, 2, 1)).search(BigInteger.valueOf(21));

        assertThat(result.isFound()).isFalse();
        assertThat(result.outcomes()).singleElement()
                .satisfies(o -> assertThat(o.reason()).contains("could not be started"));
    }

    private SearchSettings settings(List<String> command, int depth, int iterations, int workers) {
        return TestSettings.of(depth, iterations, workers).withEngineCommand(command);
    }
}
