package com.kmg.grobid.cli;

import com.kmg.grobid.config.ClientSettings;
import com.kmg.grobid.config.ConfigFileLoader;
import com.kmg.grobid.dto.RunRequest;
import com.kmg.grobid.model.RunSummary;
import com.kmg.grobid.service.GrobidClientService;
import com.kmg.grobid.service.GrobidService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point of a command line run: arguments, configuration, liveness check, processing.
 * Disabled with {@code grobid.cli.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "grobid.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GrobidClientRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(GrobidClientRunner.class);

    private final ConfigFileLoader configFileLoader;
    private final GrobidService grobidService;
    private final GrobidClientService grobidClientService;

    public GrobidClientRunner(
            ConfigFileLoader configFileLoader,
            GrobidService grobidService,
            GrobidClientService grobidClientService
    ) {
        this.configFileLoader = configFileLoader;
        this.grobidService = grobidService;
        this.grobidClientService = grobidClientService;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (args.containsOption("help")) {
            log.info("{}{}", System.lineSeparator(), CommandLineOptions.USAGE);
            return;
        }

        CommandLineOptions options = CommandLineOptions.parse(args);
        ClientSettings settings = configFileLoader.load(options.config(), options.configExplicit());
        if (options.workers() != null) {
            settings = settings.withWorkerCount(options.workers());
        }

        prepareOutputDirectory(options.output());
        grobidService.requireAlive(settings.apiBase());

        RunRequest request = new RunRequest(
                options.operation(),
                options.input(),
                options.output(),
                options.optionSet(settings.coordinates()),
                options.force(),
                settings,
                options.report()
        );
        log.info("Running {} on {} with {} workers, batches of {}",
                request.operation().endpoint(), options.input(), settings.workerCount(), settings.batchSize());

        RunSummary summary = grobidClientService.process(request);
        log.info("Runtime: {} seconds", String.format("%.3f", summary.elapsed().toMillis() / 1000.0));
    }

    private void prepareOutputDirectory(Path output) throws IOException {
        if (output == null || Files.isDirectory(output)) {
            return;
        }
        log.info("Output directory does not exist but will be created: {}", output);
        Files.createDirectories(output);
    }
}
