package com.kmg.grobid.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.grobid.config.ConfigFileLoader;
import com.kmg.grobid.config.GrobidProperties;
import com.kmg.grobid.dto.RunRequest;
import com.kmg.grobid.model.RunSummary;
import com.kmg.grobid.model.ServiceOperation;
import com.kmg.grobid.service.GrobidClientService;
import com.kmg.grobid.service.GrobidService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class GrobidClientRunnerTest {

    @TempDir
    Path tempDir;

    private GrobidService grobidService;
    private GrobidClientService clientService;
    private GrobidClientRunner runner;
    private Path config;

    @BeforeEach
    void setUp() throws IOException {
        grobidService = mock(GrobidService.class);
        clientService = mock(GrobidClientService.class);
        runner = new GrobidClientRunner(new ConfigFileLoader(new ObjectMapper(), new GrobidProperties()),
                grobidService, clientService);
        config = Files.writeString(tempDir.resolve("config.json"), """
                { "grobid_server": "grobid.test", "grobid_port": 8070, "batch_size": 5,
                  "number_of_processes": 2, "sleep_time": 1, "coordinates": ["ref"] }
                """);
        when(clientService.process(any())).thenReturn(new RunSummary(1, 1, 0, 0, 0, Duration.ofMillis(10)));
    }

    private void run(String... args) throws Exception {
        runner.run(new DefaultApplicationArguments(args));
    }

    @Test
    void run_buildsRequestFromArgumentsAndConfig() throws Exception {
        Path output = tempDir.resolve("out/nested");

        run("processHeaderDocument", "--input=" + tempDir, "--output=" + output, "--config=" + config,
                "--n=7", "--teiCoordinates", "--consolidate_header");

        verify(grobidService).requireAlive("http://grobid.test:8070");
        ArgumentCaptor<RunRequest> captor = ArgumentCaptor.forClass(RunRequest.class);
        verify(clientService).process(captor.capture());
        RunRequest request = captor.getValue();
        assertEquals(ServiceOperation.HEADER, request.operation());
        assertEquals(7, request.settings().workerCount());
        assertEquals(5, request.settings().batchSize());
        assertTrue(request.options().includeCoordinates());
        assertTrue(request.options().consolidateHeader());
        assertEquals(List.of("ref"), request.options().coordinates());
        assertFalse(request.force());
        assertTrue(Files.isDirectory(output));
    }

    @Test
    void run_abortsBeforeProcessingWhenServerIsDown() {
        doThrow(new GrobidService.GrobidUnavailableException("GROBID server is down"))
                .when(grobidService).requireAlive(anyString());

        assertThrows(GrobidService.GrobidUnavailableException.class,
                () -> run("processFulltextDocument", "--input=" + tempDir, "--config=" + config));
        verifyNoInteractions(clientService);
    }

    @Test
    void run_missingExplicitConfigIsFatal() {
        assertThrows(ConfigFileLoader.ConfigLoadException.class,
                () -> run("processFulltextDocument", "--input=" + tempDir, "--config=" + tempDir.resolve("none.json")));
        verifyNoInteractions(grobidService, clientService);
    }

    @Test
    void run_helpDoesNothing() throws Exception {
        run("--help");

        verifyNoInteractions(grobidService, clientService);
    }
}
