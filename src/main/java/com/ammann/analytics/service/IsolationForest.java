/* (C)2026 */
package com.ammann.analytics.service;

import com.ammann.analytics.exception.AnalysisTimeoutException;
import com.ammann.analytics.exception.AnalyticsException;
import com.ammann.analytics.exception.ValidationException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import org.jboss.logging.Logger;

/**
 * Isolation forest over a one-dimensional series.
 *
 * <p>Each tree is grown on a random subsample (drawn without replacement) by
 * splitting at a uniformly random value between the minimum and maximum of the
 * current partition, up to depth {@code ceil(log2(sampleSize))}. Points that
 * are isolated after few splits are anomalous: the score
 * {@code 2^(-E[h(x)] / c(sampleSize))} approaches 1 for outliers and stays near
 * or below 0.5 for ordinary points.
 *
 * <p>Trees are stored as flat node arrays and built concurrently on the
 * supplied executor, in at most {@link #MAX_TASKS_PER_FIT} tasks per fit.
 * Per-tree seeds are drawn from one master seed before any task is submitted,
 * so a fixed seed gives identical scores regardless of scheduling.
 */
public final class IsolationForest {

    private static final Logger LOG = Logger.getLogger(IsolationForest.class);

    private static final double EULER_MASCHERONI = 0.5772156649;

    /** Upper bound on executor tasks one fit submits; trees are split evenly between them. */
    static final int MAX_TASKS_PER_FIT = 4;

    private final List<Tree> trees;
    private final int sampleSize;
    private final double normalizer;

    private IsolationForest(List<Tree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
        this.normalizer = averagePathLength(sampleSize);
    }

    /**
     * Grows a forest over {@code data}.
     *
     * @param data       training values, at least two
     * @param numTrees   number of trees
     * @param sampleSize subsample size per tree; capped at {@code data.length}
     * @param seed       master seed
     * @param executor   executor the trees are built on
     * @param timeout    deadline for building the whole forest
     * @return the fitted forest
     * @throws AnalysisTimeoutException if the trees are not built within {@code timeout}
     * @throws AnalyticsException       if the executor rejects the work or a tree fails to build
     */
    public static IsolationForest fit(
            double[] data,
            int numTrees,
            int sampleSize,
            long seed,
            Executor executor,
            Duration timeout) {
        if (data.length < 2) {
            throw ValidationException.insufficientData("isolation forest training values", 2, data.length);
        }
        if (numTrees < 1) {
            throw ValidationException.invalidParameter("numTrees", numTrees, "a value >= 1");
        }
        int effectiveSample = Math.max(2, Math.min(sampleSize, data.length));
        int maxDepth = (int) Math.ceil(Math.log(effectiveSample) / Math.log(2));

        Random master = new Random(seed);
        long[] treeSeeds = new long[numTrees];
        for (int t = 0; t < numTrees; t++) {
            treeSeeds[t] = master.nextLong();
        }

        int taskCount = Math.min(MAX_TASKS_PER_FIT, numTrees);
        AtomicBoolean abandoned = new AtomicBoolean();
        List<CompletableFuture<List<Tree>>> futures = new ArrayList<>(taskCount);
        try {
            for (int task = 0; task < taskCount; task++) {
                int from = task * numTrees / taskCount;
                int to = (task + 1) * numTrees / taskCount;
                futures.add(
                        CompletableFuture.supplyAsync(
                                () -> growRange(data, effectiveSample, maxDepth, treeSeeds, from, to, abandoned),
                                executor));
            }
        } catch (RejectedExecutionException e) {
            abandon(futures, abandoned);
            LOG.warnf("Isolation forest executor rejected %d-tree fit: %s", numTrees, e.getMessage());
            throw new AnalyticsException("Isolation forest executor is saturated", e);
        }

        long start = System.nanoTime();
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            all.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(futures, abandoned);
            LOG.warnf("Isolation forest of %d trees exceeded deadline of %d ms", numTrees, timeout.toMillis());
            throw new AnalysisTimeoutException("Isolation forest fit", timeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(futures, abandoned);
            throw new AnalyticsException("Interrupted while building isolation forest", e);
        } catch (ExecutionException e) {
            abandon(futures, abandoned);
            throw new AnalyticsException("Failed to build isolation tree", e.getCause());
        }

        List<Tree> trees = new ArrayList<>(numTrees);
        for (CompletableFuture<List<Tree>> future : futures) {
            trees.addAll(future.join());
        }

        LOG.debugf(
                "Built isolation forest: %d trees, sample size %d, max depth %d in %d ms",
                numTrees, effectiveSample, maxDepth, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return new IsolationForest(trees, effectiveSample);
    }

    private static List<Tree> growRange(
            double[] data,
            int sampleSize,
            int maxDepth,
            long[] treeSeeds,
            int from,
            int to,
            AtomicBoolean abandoned) {
        BooleanSupplier stop = () -> abandoned.get() || Thread.currentThread().isInterrupted();
        List<Tree> grown = new ArrayList<>(to - from);
        for (int t = from; t < to; t++) {
            grown.add(Tree.grow(data, sampleSize, maxDepth, new Random(treeSeeds[t]), stop));
        }
        return grown;
    }

    private static void abandon(List<? extends CompletableFuture<?>> futures, AtomicBoolean abandoned) {
        abandoned.set(true);
        futures.forEach(f -> f.cancel(true));
    }

    /**
     * Anomaly score of {@code value} in (0, 1].
     */
    public double score(double value) {
        if (normalizer <= 0.0) {
            return 0.5;
        }
        double total = 0.0;
        for (Tree tree : trees) {
            total += tree.pathLength(value);
        }
        double average = total / trees.size();
        return Math.pow(2.0, -average / normalizer);
    }

    /**
     * Scores every value.
     */
    public double[] scores(double[] values) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = score(values[i]);
        }
        return result;
    }

    public int getTreeCount() {
        return trees.size();
    }

    public int getSampleSize() {
        return sampleSize;
    }

    /**
     * Expected path length of an unsuccessful binary search among {@code n} points:
     * {@code c(n) = 2(ln(n - 1) + gamma) - 2(n - 1)/n}, 0 for {@code n <= 1}.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_MASCHERONI) - 2.0 * (n - 1.0) / n;
    }

    /**
     * One isolation tree as parallel arrays. Node 0 is the root; a node with
     * {@code left[i] < 0} is a leaf holding {@code size[i]} training points.
     */
    static final class Tree {
        private final double[] split;
        private final int[] left;
        private final int[] right;
        private final int[] size;
        private final int[] depth;
        private int nodeCount;

        private Tree(int capacity) {
            split = new double[capacity];
            left = new int[capacity];
            right = new int[capacity];
            size = new int[capacity];
            depth = new int[capacity];
        }

        static Tree grow(double[] data, int sampleSize, int maxDepth, Random random) {
            return grow(data, sampleSize, maxDepth, random, () -> false);
        }

        /**
         * Grows one tree, giving up with a {@link CancellationException} once
         * {@code stop} reports true.
         */
        static Tree grow(double[] data, int sampleSize, int maxDepth, Random random, BooleanSupplier stop) {
            double[] sample = sample(data, sampleSize, random);
            Tree tree = new Tree((1 << (maxDepth + 1)) - 1);

            // each pending entry: node, lo, hi (range of sample owned by the node)
            int[] stack = new int[3 * tree.split.length];
            int top = 0;
            int root = tree.newNode(0);
            stack[top++] = root;
            stack[top++] = 0;
            stack[top++] = sample.length;

            while (top > 0) {
                if (stop.getAsBoolean()) {
                    throw new CancellationException("Isolation tree construction abandoned");
                }
                int hi = stack[--top];
                int lo = stack[--top];
                int node = stack[--top];
                int count = hi - lo;
                tree.size[node] = count;

                if (tree.depth[node] >= maxDepth || count <= 1) {
                    continue;
                }
                double min = Double.POSITIVE_INFINITY;
                double max = Double.NEGATIVE_INFINITY;
                for (int i = lo; i < hi; i++) {
                    min = Math.min(min, sample[i]);
                    max = Math.max(max, sample[i]);
                }
                if (min == max) {
                    continue;
                }

                double splitValue = min + random.nextDouble() * (max - min);
                int mid = partition(sample, lo, hi, splitValue);

                int leftChild = tree.newNode(tree.depth[node] + 1);
                int rightChild = tree.newNode(tree.depth[node] + 1);
                tree.split[node] = splitValue;
                tree.left[node] = leftChild;
                tree.right[node] = rightChild;

                stack[top++] = leftChild;
                stack[top++] = lo;
                stack[top++] = mid;
                stack[top++] = rightChild;
                stack[top++] = mid;
                stack[top++] = hi;
            }
            return tree;
        }

        double pathLength(double value) {
            int node = 0;
            while (left[node] >= 0) {
                node = value < split[node] ? left[node] : right[node];
            }
            return depth[node] + averagePathLength(size[node]);
        }

        int nodeCount() {
            return nodeCount;
        }

        private int newNode(int nodeDepth) {
            int id = nodeCount++;
            left[id] = -1;
            right[id] = -1;
            depth[id] = nodeDepth;
            return id;
        }

        private static double[] sample(double[] data, int sampleSize, Random random) {
            if (sampleSize >= data.length) {
                return data.clone();
            }
            // partial Fisher-Yates over the index range
            int[] indices = new int[data.length];
            for (int i = 0; i < indices.length; i++) {
                indices[i] = i;
            }
            double[] sample = new double[sampleSize];
            for (int i = 0; i < sampleSize; i++) {
                int j = i + random.nextInt(indices.length - i);
                int swap = indices[i];
                indices[i] = indices[j];
                indices[j] = swap;
                sample[i] = data[indices[i]];
            }
            return sample;
        }

        /** Moves values below {@code pivot} to the front of {@code [lo, hi)}; returns the boundary. */
        private static int partition(double[] values, int lo, int hi, double pivot) {
            int boundary = lo;
            for (int i = lo; i < hi; i++) {
                if (values[i] < pivot) {
                    double swap = values[i];
                    values[i] = values[boundary];
                    values[boundary] = swap;
                    boundary++;
                }
            }
            return boundary;
        }
    }
}
