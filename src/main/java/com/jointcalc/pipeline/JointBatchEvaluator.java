package com.jointcalc.pipeline;

import com.jointcalc.io.CalculationConfig;
import com.jointcalc.model.BoltGeometry;
import com.jointcalc.model.JointResult;
import com.jointcalc.model.JointSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.log4j.Log4j2;

/**
 * Evaluates many independent joints on a fixed thread pool.
 *
 * <p>
 * Each task builds its own graph, so workers share nothing. Results come back
 * in input order.
 */
@Log4j2
public final class JointBatchEvaluator implements AutoCloseable {
    private final CalculationConfig config;
    private final ExecutorService executor;

    public JointBatchEvaluator(CalculationConfig config) {
        this.config = config;
        int threads = config.effectiveBatchThreads();
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "joint-batch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.debug("Batch evaluator started with {} thread(s)", threads);
    }

    /**
     * @return one result per spec, in the order of {@code specs}.
     * @throws InterruptedException if interrupted while waiting.
     */
    public List<JointResult> evaluateAll(List<JointSpec> specs) throws InterruptedException {
        List<Future<JointResult>> futures = new ArrayList<>(specs.size());
        for (JointSpec spec : specs)
            futures.add(executor.submit(() -> JointPipeline.evaluateJoint(spec, config)));

        List<JointResult> results = new ArrayList<>(specs.size());
        for (Future<JointResult> f : futures) {
            try {
                results.add(f.get());
            } catch (ExecutionException e) {
                throw new IllegalStateException("Joint evaluation task failed", e.getCause());
            }
        }
        return results;
    }

    /**
     * Design sweep over bolt sizes: {@code base} with each bolt in turn, the
     * rest of the joint unchanged.
     */
    public List<JointResult> sweep(JointSpec base, List<BoltGeometry> bolts) throws InterruptedException {
        List<JointSpec> specs = new ArrayList<>(bolts.size());
        for (BoltGeometry bolt : bolts)
            specs.add(base.toBuilder().bolt(bolt).build());
        log.info("Sweeping {} bolt size(s)", specs.size());
        return evaluateAll(specs);
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
