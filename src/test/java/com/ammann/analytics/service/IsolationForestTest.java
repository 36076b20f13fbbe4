/* (C)2026 */
package com.ammann.analytics.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import com.ammann.analytics.exception.AnalysisTimeoutException;
import com.ammann.analytics.exception.AnalyticsException;
import com.ammann.analytics.exception.ValidationException;
import com.ammann.analytics.support.TestDataFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class IsolationForestTest {

    private static final Executor DIRECT = Runnable::run;
    private static final Duration DEADLINE = Duration.ofSeconds(10);

    @Test
    void extremeValueHasTheHighestScore() {
        double[] values = TestDataFactory.noisyConstant(100, 50.0, 5.0, 3L);
        values[37] = 5_000.0;

        IsolationForest forest = IsolationForest.fit(values, 50, 64, 1L, DIRECT, DEADLINE);
        double[] scores = forest.scores(values);

        int top = 0;
        for (int i = 1; i < scores.length; i++) {
            if (scores[i] > scores[top]) {
                top = i;
            }
        }
        assertThat(top).isEqualTo(37);
        assertThat(forest.getTreeCount()).isEqualTo(50);
        assertThat(forest.getSampleSize()).isEqualTo(64);
    }

    @Test
    void sameSeedGivesSameScoresOnAnyExecutor() throws Exception {
        double[] values = TestDataFactory.noisyConstant(60, 10.0, 2.0, 8L);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            double[] direct = IsolationForest.fit(values, 30, 32, 99L, DIRECT, DEADLINE).scores(values);
            double[] pooled = IsolationForest.fit(values, 30, 32, 99L, pool, DEADLINE).scores(values);

            assertThat(pooled).containsExactly(direct);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void sampleSizeIsCappedAtSeriesLength() {
        double[] values = {1, 2, 3, 4, 5, 6};

        IsolationForest forest = IsolationForest.fit(values, 5, 256, 1L, DIRECT, DEADLINE);

        assertThat(forest.getSampleSize()).isEqualTo(6);
        for (double score : forest.scores(values)) {
            assertThat(score).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        }
    }

    @Test
    void fitThatMissesItsDeadlineTimesOut() {
        Executor neverRuns = command -> { };
        double[] values = TestDataFactory.noisyConstant(20, 10.0, 1.0, 1L);

        assertThatThrownBy(() -> IsolationForest.fit(values, 10, 16, 1L, neverRuns, Duration.ofMillis(50)))
                .isInstanceOf(AnalysisTimeoutException.class)
                .hasMessageContaining("within 50 ms");
    }

    @Test
    void fitSubmitsABoundedNumberOfTasks() {
        AtomicInteger submitted = new AtomicInteger();
        Executor counting = command -> {
            submitted.incrementAndGet();
            command.run();
        };
        double[] values = TestDataFactory.noisyConstant(50, 10.0, 1.0, 2L);

        IsolationForest forest = IsolationForest.fit(values, 100, 32, 1L, counting, DEADLINE);

        assertThat(forest.getTreeCount()).isEqualTo(100);
        assertThat(submitted).hasValue(IsolationForest.MAX_TASKS_PER_FIT);

        submitted.set(0);
        assertThat(IsolationForest.fit(values, 3, 32, 1L, counting, DEADLINE).getTreeCount()).isEqualTo(3);
        assertThat(submitted).hasValue(3);
    }

    @Test
    void rejectedSubmissionFailsTheFit() {
        List<Runnable> parked = new ArrayList<>();
        Executor singleSlot = command -> {
            if (!parked.isEmpty()) {
                throw new RejectedExecutionException("queue full");
            }
            parked.add(command);
        };
        double[] values = TestDataFactory.noisyConstant(20, 10.0, 1.0, 1L);

        assertThatThrownBy(() -> IsolationForest.fit(values, 20, 16, 1L, singleSlot, DEADLINE))
                .isInstanceOf(AnalyticsException.class)
                .hasMessageContaining("saturated")
                .hasCauseInstanceOf(RejectedExecutionException.class);
        assertThat(parked).hasSize(1);
    }

    @Test
    void abandonedTreeStopsGrowing() {
        double[] values = TestDataFactory.noisyConstant(64, 0.0, 100.0, 4L);

        assertThatThrownBy(() -> IsolationForest.Tree.grow(values, 64, 6, new Random(5L), () -> true))
                .isInstanceOf(CancellationException.class);
    }

    @Test
    void fewerThanTwoValuesAreRejected() {
        assertThatThrownBy(() -> IsolationForest.fit(new double[] {1.0}, 10, 16, 1L, DIRECT, DEADLINE))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void treesRespectDepthLimit() {
        double[] values = TestDataFactory.noisyConstant(64, 0.0, 100.0, 4L);

        IsolationForest.Tree tree = IsolationForest.Tree.grow(values, 64, 6, new Random(5L));

        assertThat(tree.nodeCount()).isLessThanOrEqualTo((1 << 7) - 1);
        for (double v : values) {
            assertThat(tree.pathLength(v)).isGreaterThanOrEqualTo(1.0);
        }
    }

    @Test
    void averagePathLengthMatchesKnownValues() {
        assertThat(IsolationForest.averagePathLength(1)).isZero();
        assertThat(IsolationForest.averagePathLength(2)).isCloseTo(0.1544, offset(1e-3));
        assertThat(IsolationForest.averagePathLength(256)).isGreaterThan(9.0).isLessThan(11.0);
    }
}
