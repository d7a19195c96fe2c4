package com.kmg.grobid.service;

import com.kmg.grobid.dto.RunRequest;
import com.kmg.grobid.model.Outcome;
import com.kmg.grobid.model.ProcessingRequest;
import com.kmg.grobid.model.RetryDecision;
import com.kmg.grobid.model.ServiceResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.nio.file.Path;

/**
 * Processes one document: skip check, submission with 503 retries, then the write.
 * Runs on a worker thread; a retry sleep only holds that worker.
 */
@Service
public class DocumentProcessor {
    private static final Logger log = LoggerFactory.getLogger(DocumentProcessor.class);

    private final GrobidService grobidService;
    private final RetryPolicy retryPolicy;
    private final ResultWriter resultWriter;

    public DocumentProcessor(GrobidService grobidService, RetryPolicy retryPolicy, ResultWriter resultWriter) {
        this.grobidService = grobidService;
        this.retryPolicy = retryPolicy;
        this.resultWriter = resultWriter;
    }

    public Outcome process(Path file, RunRequest run) {
        Path destination = resultWriter.destinationFor(file, run.inputDirectory(), run.outputDirectory());
        if (!run.force() && resultWriter.isProcessed(destination)) {
            log.info("{} already exists, skipping... (use --force to reprocess pdf input files)", destination);
            return Outcome.skipped(file, destination, "output already exists");
        }

        log.info("Processing -> {}", file);
        ProcessingRequest request = new ProcessingRequest(file, run.operation(), run.options());
        int attempt = 0;
        while (true) {
            attempt++;
            ServiceResponse response;
            try {
                response = grobidService.submit(run.settings().apiBase(), request);
            } catch (RestClientException e) {
                log.warn("Processing failed for {}, transport error: {}", file, e.getMessage());
                return Outcome.failed(file, destination, "transport error: " + e.getMessage(), 0, attempt);
            }

            RetryDecision decision = retryPolicy.classify(response, attempt, run.settings());
            switch (decision.action()) {
                case ACCEPT -> {
                    return resultWriter.write(file, destination, decision.body(), attempt);
                }
                case FAIL -> {
                    log.warn("Processing failed for {}, {}", file, decision.reason());
                    return Outcome.failed(file, destination, decision.reason(), decision.statusCode(), attempt);
                }
                case RETRY -> {
                    log.info("Server busy for {}, retrying in {} ms (attempt {})",
                            file, decision.delay().toMillis(), attempt);
                    if (!pause(decision)) {
                        return Outcome.failed(file, destination, "interrupted while waiting to retry", 503, attempt);
                    }
                }
            }
        }
    }

    private boolean pause(RetryDecision decision) {
        try {
            Thread.sleep(decision.delay().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
