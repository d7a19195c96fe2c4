package com.kmg.grobid.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.grobid.config.ClientSettings;
import com.kmg.grobid.dto.RunReport;
import com.kmg.grobid.dto.RunRequest;
import com.kmg.grobid.model.Outcome;
import com.kmg.grobid.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

@Service
public class GrobidClientService {
    private static final Logger log = LoggerFactory.getLogger(GrobidClientService.class);

    private final FileDiscoveryService discoveryService;
    private final BatchScheduler batchScheduler;
    private final DocumentProcessor documentProcessor;
    private final ObjectMapper objectMapper;

    public GrobidClientService(
            FileDiscoveryService discoveryService,
            BatchScheduler batchScheduler,
            DocumentProcessor documentProcessor,
            ObjectMapper objectMapper
    ) {
        this.discoveryService = discoveryService;
        this.batchScheduler = batchScheduler;
        this.documentProcessor = documentProcessor;
        this.objectMapper = objectMapper;
    }

    /**
     * Processes every document under the input directory. Per-file failures are counted,
     * never thrown; unreadable subfolders are skipped. An invalid or unreadable input directory
     * aborts the run.
     */
    public RunSummary process(RunRequest request) {
        Path root = discoveryService.validateRoot(request.inputDirectory());
        RunRequest run = new RunRequest(request.operation(), root, request.outputDirectory(), request.options(),
                request.force(), request.settings(), request.reportPath());
        ClientSettings settings = run.settings();

        OffsetDateTime startedAt = OffsetDateTime.now(ZoneOffset.UTC);
        long start = System.nanoTime();
        Tally tally = new Tally(run.reportPath() != null);

        int batches;
        try (Stream<Path> documents = discoveryService.discover(root)) {
            batches = batchScheduler.run(
                    documents.iterator(),
                    settings.batchSize(),
                    settings.workerCount(),
                    file -> documentProcessor.process(file, run),
                    tally
            );
        }

        RunSummary summary = new RunSummary(batches, tally.written, tally.skipped, tally.failed, tally.retried,
                Duration.ofNanos(System.nanoTime() - start));
        log.info("{} documents in {} batches: {} written, {} skipped, {} failed, {} needed retries",
                summary.total(), summary.batches(), summary.written(), summary.skipped(), summary.failed(),
                summary.retried());

        if (run.reportPath() != null) {
            writeReport(run, summary, startedAt, tally.failures);
        }
        return summary;
    }

    private void writeReport(RunRequest run, RunSummary summary, OffsetDateTime startedAt,
                             List<RunReport.FailedFile> failures) {
        RunReport report = new RunReport(
                run.operation().endpoint(),
                run.inputDirectory().toString(),
                run.outputDirectory() == null ? null : run.outputDirectory().toString(),
                startedAt.toString(),
                OffsetDateTime.now(ZoneOffset.UTC).toString(),
                summary.elapsed().toMillis() / 1000.0,
                summary.batches(),
                summary.written(),
                summary.skipped(),
                summary.failed(),
                summary.retried(),
                failures
        );
        try {
            Path reportPath = run.reportPath().toAbsolutePath();
            if (reportPath.getParent() != null) {
                Files.createDirectories(reportPath.getParent());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
            log.info("Report written to {}", reportPath);
        } catch (IOException e) {
            log.warn("Failed to write report {}: {}", run.reportPath(), e.getMessage());
        }
    }

    private static class Tally implements BatchScheduler.BatchListener {
        private final boolean keepFailures;
        private final List<RunReport.FailedFile> failures = new ArrayList<>();
        private int written;
        private int skipped;
        private int failed;
        private int retried;

        Tally(boolean keepFailures) {
            this.keepFailures = keepFailures;
        }

        @Override
        public void outcome(Outcome outcome) {
            if (outcome.retried()) {
                retried++;
            }
            switch (outcome.status()) {
                case WRITTEN -> written++;
                case SKIPPED -> skipped++;
                case FAILED -> {
                    failed++;
                    if (keepFailures) {
                        failures.add(new RunReport.FailedFile(outcome.source().toString(), outcome.reason(),
                                outcome.statusCode(), outcome.attempts()));
                    }
                }
            }
        }
    }
}
