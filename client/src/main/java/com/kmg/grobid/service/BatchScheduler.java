package com.kmg.grobid.service;

import com.kmg.grobid.model.Batch;
import com.kmg.grobid.model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Groups incoming paths into batches of at most {@code batchSize} and drains each batch on its
 * own pool of {@code workerCount} threads. A batch is finished, and its pool shut down, before
 * the next batch is read from the input. At most {@code batchSize} paths are buffered and at most
 * {@code workerCount} units run at once; the price is that a slow file holds up the next batch.
 */
@Service
public class BatchScheduler {
    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);
    private static final long TERMINATION_WAIT_SECONDS = 30;

    /**
     * Receives scheduling events. All callbacks run on the scheduling thread.
     */
    public interface BatchListener {
        default void batchStarted(Batch batch) {
        }

        void outcome(Outcome outcome);

        default void batchCompleted(Batch batch) {
        }
    }

    /**
     * @return number of batches drained
     */
    public int run(Iterator<Path> paths, int batchSize, int workerCount,
                   Function<Path, Outcome> unit, BatchListener listener) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive: " + workerCount);
        }

        int batches = 0;
        List<Path> buffer = new ArrayList<>(Math.min(batchSize, 1024));
        while (paths.hasNext()) {
            buffer.add(paths.next());
            if (buffer.size() == batchSize) {
                drain(new Batch(batches++, buffer), workerCount, unit, listener);
                buffer.clear();
            }
        }
        if (!buffer.isEmpty()) {
            drain(new Batch(batches++, buffer), workerCount, unit, listener);
        }
        return batches;
    }

    void drain(Batch batch, int workerCount, Function<Path, Outcome> unit, BatchListener listener) {
        log.info("PDF files to process: {} (batch {})", batch.size(), batch.index() + 1);
        listener.batchStarted(batch);

        int threads = Math.min(workerCount, batch.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("grobid-worker-"));
        CompletionService<Outcome> completionService = new ExecutorCompletionService<>(executor);
        Map<Future<Outcome>, Path> submitted = new HashMap<>();

        try {
            for (Path file : batch.files()) {
                submitted.put(completionService.submit(() -> unit.apply(file)), file);
            }

            for (int done = 0; done < submitted.size(); done++) {
                Future<Outcome> future = completionService.take();
                listener.outcome(resolve(future, submitted.get(future)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while draining batch " + (batch.index() + 1), e);
        } finally {
            shutdown(executor);
        }

        listener.batchCompleted(batch);
    }

    private Outcome resolve(Future<Outcome> future, Path file) throws InterruptedException {
        try {
            Outcome outcome = future.get();
            if (outcome == null) {
                return Outcome.failed(file, null, "no outcome produced", 0, 0);
            }
            return outcome;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Unexpected failure while processing {}: {}", file, cause.getMessage(), cause);
            return Outcome.failed(file, null, "unexpected error: " + cause.getMessage(), 0, 0);
        }
    }

    private void shutdown(ExecutorService executor) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(TERMINATION_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate within {} seconds", TERMINATION_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
