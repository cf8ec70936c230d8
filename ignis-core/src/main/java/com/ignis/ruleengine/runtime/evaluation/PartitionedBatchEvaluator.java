package com.ignis.ruleengine.runtime.evaluation;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.ignis.ruleengine.api.IRuleEvaluator;
import com.ignis.ruleengine.api.model.EvaluationResult;
import com.ignis.ruleengine.api.model.Record;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Evaluates a list of records on several worker threads.
 *
 * <p>The list is cut into contiguous partitions; each worker evaluates one
 * partition with the shared, immutable evaluator. Results are reassembled in
 * partition order, so the output lines up with the input position by position.
 */
public final class PartitionedBatchEvaluator implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(PartitionedBatchEvaluator.class.getName());

    /** Below this many records per worker, partitioning costs more than it saves. */
    static final int MIN_PARTITION_SIZE = 256;

    private final IRuleEvaluator evaluator;
    private final ExecutorService executor;
    private final int parallelism;
    private final boolean ownsExecutor;

    public PartitionedBatchEvaluator(IRuleEvaluator evaluator, int parallelism) {
        this(evaluator, Executors.newFixedThreadPool(parallelism, new ThreadFactoryBuilder()
                .setNameFormat("ignis-batch-%d")
                .setDaemon(true)
                .build()), parallelism, true);
    }

    public PartitionedBatchEvaluator(IRuleEvaluator evaluator, ExecutorService executor, int parallelism) {
        this(evaluator, executor, parallelism, false);
    }

    private PartitionedBatchEvaluator(IRuleEvaluator evaluator, ExecutorService executor, int parallelism,
                                      boolean ownsExecutor) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("Parallelism must be positive: " + parallelism);
        }
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator cannot be null");
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
        this.parallelism = parallelism;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Evaluates every record and returns the results in input order.
     *
     * @throws IllegalStateException if interrupted while waiting for workers
     */
    public List<EvaluationResult> evaluateAll(List<? extends Record> records) {
        int size = records.size();
        int partitions = Math.max(1, Math.min(parallelism, size / MIN_PARTITION_SIZE));
        if (partitions == 1) {
            return evaluator.evaluateBatch(records).collect(Collectors.toList());
        }

        int chunk = (size + partitions - 1) / partitions;
        List<Future<List<EvaluationResult>>> futures = new ArrayList<>(partitions);
        for (int start = 0; start < size; start += chunk) {
            List<? extends Record> slice = records.subList(start, Math.min(size, start + chunk));
            futures.add(executor.submit(() -> evaluator.evaluateBatch(slice).collect(Collectors.toList())));
        }
        logger.fine(() -> String.format("Evaluating %d records in %d partitions", size, futures.size()));

        List<EvaluationResult> results = new ArrayList<>(size);
        try {
            for (Future<List<EvaluationResult>> future : futures) {
                results.addAll(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Interrupted while evaluating batch", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Batch evaluation failed", cause);
        }
        return results;
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
