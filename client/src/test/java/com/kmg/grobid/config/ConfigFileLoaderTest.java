package com.kmg.grobid.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigFileLoaderTest {

    @TempDir
    Path tempDir;

    private final GrobidProperties properties = new GrobidProperties();
    private final ConfigFileLoader loader = new ConfigFileLoader(new ObjectMapper(), properties);

    private Path config(String json) throws IOException {
        return Files.writeString(tempDir.resolve("config.json"), json);
    }

    @Test
    void load_readsAllRecognizedKeys() throws IOException {
        Path file = config("""
                {
                    "grobid_server": "grobid.example.org",
                    "grobid_port": "8080",
                    "batch_size": 50,
                    "sleep_time": 2.5,
                    "number_of_processes": 4,
                    "coordinates": [ "persName", "figure", "ref" ],
                    "unrelated": true
                }
                """);

        ClientSettings settings = loader.load(file, true);

        assertEquals("http://grobid.example.org:8080", settings.apiBase());
        assertEquals(50, settings.batchSize());
        assertEquals(4, settings.workerCount());
        assertEquals(Duration.ofMillis(2500), settings.sleepTime());
        assertEquals(List.of("persName", "figure", "ref"), settings.coordinates());
    }

    @Test
    void load_nullPortIsOmittedFromApiBase() throws IOException {
        Path file = config("""
                { "grobid_server": "https://cloud.science-miner.com/grobid", "grobid_port": null }
                """);

        assertEquals("https://cloud.science-miner.com/grobid", loader.load(file, true).apiBase());
    }

    @Test
    void load_missingKeysFallBackToProperties() throws IOException {
        properties.setBatchSize(7);
        Path file = config("{ \"coordinates\": \"biblStruct\" }");

        ClientSettings settings = loader.load(file, true);

        assertEquals("http://localhost:8070", settings.apiBase());
        assertEquals(7, settings.batchSize());
        assertEquals(10, settings.workerCount());
        assertEquals(Duration.ofSeconds(5), settings.sleepTime());
        assertEquals(List.of("biblStruct"), settings.coordinates());
    }

    @Test
    void load_commaSeparatedCoordinatesAreSplitIntoElements() throws IOException {
        Path file = config("{ \"coordinates\": \"persName, figure,,ref\" }");

        assertEquals(List.of("persName", "figure", "ref"), loader.load(file, true).coordinates());
    }

    @Test
    void load_optionalMissingFileUsesDefaults() {
        ClientSettings settings = loader.load(tempDir.resolve("config.json"), false);

        assertEquals(ClientSettings.from(properties), settings);
    }

    @Test
    void load_requiredMissingFileFails() {
        assertThrows(ConfigFileLoader.ConfigLoadException.class,
                () -> loader.load(tempDir.resolve("nope.json"), true));
    }

    @Test
    void load_malformedJsonFails() throws IOException {
        Path file = config("{ \"batch_size\": ");

        assertThrows(ConfigFileLoader.ConfigLoadException.class, () -> loader.load(file, true));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "{ \"batch_size\": 0 }",
            "{ \"number_of_processes\": -2 }",
            "{ \"sleep_time\": -1 }",
            "{ \"grobid_port\": \"http\" }",
            "{ \"grobid_server\": \"\" }",
            "[ 1, 2 ]",
    })
    void load_invalidValuesAreRejected(String json) throws IOException {
        Path file = config(json);

        assertThrows(ConfigFileLoader.ConfigLoadException.class, () -> loader.load(file, true));
    }

    @ParameterizedTest
    @CsvSource({
            "localhost,           8070, http://localhost:8070",
            "http://host/,        ,     http://host",
            "https://secure.org,  443,  https://secure.org:443",
    })
    void apiBase_buildsBaseUrl(String server, Integer port, String expected) {
        assertEquals(expected, ClientSettings.apiBase(server, port));
    }
}
