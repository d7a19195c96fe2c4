package com.kmg.grobid.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a {@code config.json} file and layers it over the {@link GrobidProperties} defaults.
 *
 * <p>Recognized keys are {@code grobid_server}, {@code grobid_port}, {@code batch_size},
 * {@code number_of_processes}, {@code sleep_time} (seconds) and {@code coordinates}
 * (an array of element names, or a comma separated string). Other keys are ignored.</p>
 */
@Component
public class ConfigFileLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigFileLoader.class);

    private final ObjectMapper objectMapper;
    private final GrobidProperties properties;

    public ConfigFileLoader(ObjectMapper objectMapper, GrobidProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * @param required when true a missing file is an error, otherwise the defaults are used
     */
    public ClientSettings load(Path configPath, boolean required) {
        ClientSettings defaults = ClientSettings.from(properties);
        if (configPath == null || !Files.isRegularFile(configPath)) {
            if (required) {
                throw new ConfigLoadException("Configuration file not found: " + configPath);
            }
            log.info("No configuration file at {}, using application defaults", configPath);
            return defaults;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(configPath.toFile());
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read configuration " + configPath + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigLoadException("Configuration " + configPath + " must be a JSON object");
        }

        String server = root.hasNonNull("grobid_server") ? root.get("grobid_server").asText() : properties.getServer();
        Integer port = root.has("grobid_port") ? readPort(root.get("grobid_port")) : properties.getPort();
        int batchSize = readPositiveInt(root, "batch_size", defaults.batchSize());
        int workers = readPositiveInt(root, "number_of_processes", defaults.workerCount());
        Duration sleepTime = readSeconds(root, "sleep_time", defaults.sleepTime());
        List<String> coordinates = root.has("coordinates") ? readCoordinates(root.get("coordinates")) : defaults.coordinates();

        if (server == null || server.isBlank()) {
            throw new ConfigLoadException("grobid_server must not be blank");
        }

        log.info("Configuration loaded: {}", configPath);
        return new ClientSettings(
                ClientSettings.apiBase(server, port),
                batchSize,
                workers,
                sleepTime,
                coordinates,
                defaults.maxAttempts(),
                defaults.backoffMultiplier(),
                defaults.maxSleepTime()
        );
    }

    private Integer readPort(JsonNode node) {
        if (node.isNull()) {
            return null;
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            int port = Integer.parseInt(text);
            if (port <= 0 || port > 65535) {
                throw new ConfigLoadException("grobid_port out of range: " + text);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("grobid_port is not a number: " + text, e);
        }
    }

    private int readPositiveInt(JsonNode root, String field, int fallback) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.canConvertToInt() && !node.isTextual()) {
            throw new ConfigLoadException(field + " must be an integer");
        }
        int value;
        try {
            value = node.isTextual() ? Integer.parseInt(node.asText().trim()) : node.asInt();
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(field + " is not a number: " + node.asText(), e);
        }
        if (value <= 0) {
            throw new ConfigLoadException(field + " must be positive: " + value);
        }
        return value;
    }

    private Duration readSeconds(JsonNode root, String field, Duration fallback) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        double seconds;
        try {
            seconds = node.isNumber() ? node.asDouble() : Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new ConfigLoadException(field + " is not a number: " + node.asText(), e);
        }
        if (seconds < 0) {
            throw new ConfigLoadException(field + " must not be negative: " + seconds);
        }
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    /**
     * An array gives one element name per entry; a plain string may list several names separated by commas.
     */
    private List<String> readCoordinates(JsonNode node) {
        List<String> names = new ArrayList<>();
        if (node == null || node.isNull()) {
            return names;
        }
        if (node.isArray()) {
            node.forEach(element -> names.add(element.asText().trim()));
        } else {
            names.addAll(Arrays.asList(node.asText().split(",")));
        }
        names.replaceAll(String::trim);
        names.removeIf(String::isEmpty);
        return names;
    }

    public static class ConfigLoadException extends RuntimeException {
        public ConfigLoadException(String message) {
            super(message);
        }

        public ConfigLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
